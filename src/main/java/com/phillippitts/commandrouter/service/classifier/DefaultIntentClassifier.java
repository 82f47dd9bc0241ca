package com.phillippitts.commandrouter.service.classifier;

import com.phillippitts.commandrouter.config.properties.ClassifierProperties;
import com.phillippitts.commandrouter.domain.Classification;
import com.phillippitts.commandrouter.domain.Utterance;
import com.phillippitts.commandrouter.exception.ClassificationException;
import com.phillippitts.commandrouter.service.health.FallbackAvailability;
import com.phillippitts.commandrouter.service.metrics.CommandMetrics;
import com.phillippitts.commandrouter.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Two-tier {@link IntentClassifier}.
 *
 * <p>Tier 2 runs only when all of these hold:
 * <ul>
 *   <li>no Tier 1 pattern matched at or above {@code router.classifier.min-pattern-confidence}</li>
 *   <li>the fallback is enabled</li>
 *   <li>the health monitor reports the backend available</li>
 * </ul>
 * The model call runs on the classifier pool and is abandoned after
 * {@code router.classifier.fallback-timeout-ms}. When Tier 2 is skipped, rejected by a saturated
 * pool, times out, fails or returns invalid output, the result is {@link Classification#degraded()}.
 */
@Service
public class DefaultIntentClassifier implements IntentClassifier {

    private static final Logger LOG = LogManager.getLogger(DefaultIntentClassifier.class);

    private final PatternIntentMatcher matcher;
    private final IntentModelClient modelClient;
    private final FallbackAvailability availability;
    private final ClassifierProperties properties;
    private final Executor classifierExecutor;
    private final CommandMetrics metrics;
    private final String systemPrompt;

    public DefaultIntentClassifier(PatternIntentMatcher matcher,
                                   IntentModelClient modelClient,
                                   FallbackAvailability availability,
                                   ClassifierProperties properties,
                                   @Qualifier("classifierExecutor") Executor classifierExecutor,
                                   CommandMetrics metrics) {
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.modelClient = Objects.requireNonNull(modelClient, "modelClient");
        this.availability = Objects.requireNonNull(availability, "availability");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.classifierExecutor = Objects.requireNonNull(classifierExecutor, "classifierExecutor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.systemPrompt = IntentPrompts.systemPrompt();
    }

    @Override
    public Classification classify(Utterance utterance) {
        Objects.requireNonNull(utterance, "utterance");
        String text = utterance.text();
        Optional<Classification> tier1 = matcher.match(text);

        if (tier1.isPresent() && isConfident(tier1.get())) {
            LOG.debug("Pattern match: intent={}, confidence={}", tier1.get().intent(), tier1.get().confidence());
            return tier1.get();
        }

        if (!properties.isFallbackEnabled() || !availability.isAvailable()) {
            metrics.recordFallback("skipped");
            LOG.debug("Fallback classifier skipped (enabled={}, available={})",
                    properties.isFallbackEnabled(), availability.isAvailable());
            return Classification.degraded();
        }
        return classifyWithModel(text).orElseGet(Classification::degraded);
    }

    @Override
    public Optional<Classification> classifyDeterministic(String text) {
        return matcher.match(text).filter(this::isConfident);
    }

    private boolean isConfident(Classification c) {
        return c.confidence() >= properties.getMinPatternConfidence();
    }

    private Optional<Classification> classifyWithModel(String text) {
        long timeoutMs = properties.getFallbackTimeoutMs();
        CompletableFuture<String> future;
        try {
            future = CompletableFuture.supplyAsync(() -> modelClient.complete(systemPrompt, text), classifierExecutor);
        } catch (RejectedExecutionException e) {
            metrics.recordFallback("rejected");
            LOG.warn("Classifier pool saturated, fallback classifier not attempted");
            return Optional.empty();
        }
        try {
            String raw = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            Classification parsed = IntentResponseParser.parse(raw);
            metrics.recordFallback("model");
            LOG.info("Fallback classification: intent={}, confidence={}, text='{}'",
                    parsed.intent(), parsed.confidence(), LogSanitizer.preview(text));
            return Optional.of(parsed);
        } catch (TimeoutException e) {
            // Best effort; the HTTP client's own timeout ends the call
            future.cancel(true);
            metrics.recordFallback("timeout");
            LOG.warn("Fallback classifier timed out after {} ms", timeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            metrics.recordFallback("error");
            LOG.warn("Interrupted while waiting for fallback classifier");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            metrics.recordFallback("error");
            LOG.warn("Fallback classifier call failed: {}", cause.getMessage());
        } catch (ClassificationException e) {
            metrics.recordFallback("unparseable");
            LOG.warn("Fallback classifier output rejected: {}", e.getMessage());
        }
        return Optional.empty();
    }
}
