package com.phillippitts.commandrouter.service.classifier;

import com.phillippitts.commandrouter.domain.Classification;
import com.phillippitts.commandrouter.domain.Utterance;

import java.util.Optional;

/**
 * Maps an utterance to one intent of the closed taxonomy.
 *
 * <p>Two tiers: deterministic patterns first, then a bounded call to a fallback language model
 * when no pattern is confident enough and the backend is healthy.
 *
 * <p>Classification never fails: when both tiers come up empty the result is
 * {@link Classification#degraded()} (conversation, confidence 0).
 */
public interface IntentClassifier {

    /**
     * Classifies an utterance using both tiers.
     *
     * @param utterance non-null utterance
     * @return classification; never null, never throws for bad model output or timeouts
     */
    Classification classify(Utterance utterance);

    /**
     * Tier 1 only. Used to classify pipeline segments without a network call.
     *
     * @param text utterance or segment
     * @return a confident pattern classification, or empty
     */
    Optional<Classification> classifyDeterministic(String text);
}
