package com.phillippitts.commandrouter.service.classifier;

import com.phillippitts.commandrouter.exception.ClassificationException;

/**
 * Client for the Tier 2 fallback language model.
 *
 * <p>Implementations perform exactly one remote call per invocation and never retry.
 * Callers impose their own deadline; implementations should still set a transport timeout.
 */
public interface IntentModelClient {

    /**
     * Sends one chat completion request.
     *
     * @param systemPrompt instructions describing the closed intent schema
     * @param userText     the utterance to classify
     * @return the model's free-text answer (expected to contain one JSON object)
     * @throws ClassificationException if the call fails or returns a non-2xx status
     */
    String complete(String systemPrompt, String userText);

    /**
     * Lightweight reachability check used by the health monitor.
     *
     * @return true if the backend answered
     */
    boolean probe();

    /**
     * @return false when the client can never succeed (no API key configured)
     */
    boolean isConfigured();
}
