package com.phillippitts.commandrouter.service.classifier;

import com.phillippitts.commandrouter.config.properties.ClassifierProperties;
import com.phillippitts.commandrouter.domain.Classification;
import com.phillippitts.commandrouter.domain.IntentCategory;
import com.phillippitts.commandrouter.domain.Utterance;
import com.phillippitts.commandrouter.exception.ClassificationException;
import com.phillippitts.commandrouter.service.metrics.CommandMetrics;
import com.phillippitts.commandrouter.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultIntentClassifierTest {

    private SimpleMeterRegistry registry;
    private CommandMetrics metrics;
    private IntentModelClient model;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new CommandMetrics(registry);
        model = mock(IntentModelClient.class);
        pool = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private DefaultIntentClassifier classifier(boolean available, long timeoutMs) {
        return new DefaultIntentClassifier(new PatternIntentMatcher(), model, () -> available,
                new ClassifierProperties(true, timeoutMs, 0.6), pool, metrics);
    }

    private double fallbackCount(String outcome) {
        var counter = registry.find("commandrouter.classifier.fallback").tag("outcome", outcome).counter();
        return counter == null ? 0.0 : counter.count();
    }

    @Test
    void confidentPatternNeverCallsTheModel() {
        Classification c = classifier(true, 1000).classify(Utterance.typed("call mom"));

        assertThat(c.intent()).isEqualTo(IntentCategory.PHONE_CALL);
        verify(model, never()).complete(anyString(), anyString());
    }

    @Test
    void unmatchedUtteranceUsesTheModel() {
        when(model.complete(anyString(), anyString()))
                .thenReturn("{\"intent\": \"web_search\", \"confidence\": 0.7, \"slots\": {\"query\": \"cricket score\"}}");

        Classification c = classifier(true, 1000).classify(Utterance.typed("cricket score kya hai"));

        assertThat(c.intent()).isEqualTo(IntentCategory.WEB_SEARCH);
        assertThat(c.source()).isEqualTo(Classification.Source.MODEL);
        assertThat(fallbackCount("model")).isEqualTo(1.0);
    }

    @Test
    void modelTimeoutDegradesToConversation() {
        when(model.complete(anyString(), anyString())).thenAnswer(inv -> {
            Thread.sleep(2000);
            return "{\"intent\": \"email\"}";
        });

        Classification c = classifier(true, 50).classify(Utterance.typed("asdf qwerty zxcv"));

        assertThat(c.intent()).isEqualTo(IntentCategory.CONVERSATION);
        assertThat(c.confidence()).isZero();
        assertThat(c.source()).isEqualTo(Classification.Source.DEGRADED);
        assertThat(fallbackCount("timeout")).isEqualTo(1.0);
    }

    @Test
    void unparseableModelOutputDegrades() {
        when(model.complete(anyString(), anyString())).thenReturn("{\"intent\": \"teleport\"}");

        Classification c = classifier(true, 1000).classify(Utterance.typed("asdf qwerty zxcv"));

        assertThat(c.source()).isEqualTo(Classification.Source.DEGRADED);
        assertThat(fallbackCount("unparseable")).isEqualTo(1.0);
    }

    @Test
    void modelErrorDegradesToConversation() {
        when(model.complete(anyString(), anyString())).thenThrow(new ClassificationException("HTTP 500"));

        Classification c = classifier(true, 1000).classify(Utterance.typed("what is the capital of peru"));

        assertThat(c).isEqualTo(Classification.degraded());
        assertThat(fallbackCount("error")).isEqualTo(1.0);
    }

    @Test
    void questionDegradesWhenTheModelTimesOut() {
        when(model.complete(anyString(), anyString())).thenAnswer(inv -> {
            Thread.sleep(2000);
            return "{\"intent\": \"web_search\"}";
        });

        Classification c = classifier(true, 50).classify(Utterance.typed("what is the weather like"));

        assertThat(c.intent()).isEqualTo(IntentCategory.CONVERSATION);
        assertThat(c.confidence()).isZero();
        assertThat(c.source()).isEqualTo(Classification.Source.DEGRADED);
    }

    @Test
    void saturatedPoolDegradesWithinTheTimeout() {
        Executor rejecting = task -> {
            throw new RejectedExecutionException("pool full");
        };
        DefaultIntentClassifier classifier = new DefaultIntentClassifier(new PatternIntentMatcher(), model,
                () -> true, new ClassifierProperties(true, 50, 0.6), rejecting, metrics);

        Classification c = classifier.classify(Utterance.typed("how do magnets work"));

        assertThat(c).isEqualTo(Classification.degraded());
        assertThat(fallbackCount("rejected")).isEqualTo(1.0);
        verify(model, never()).complete(anyString(), anyString());
    }

    @Test
    void unavailableBackendIsNeverCalled() {
        Classification c = classifier(false, 1000).classify(Utterance.typed("what is the capital of peru"));

        assertThat(c).isEqualTo(Classification.degraded());
        verify(model, never()).complete(anyString(), anyString());
        assertThat(fallbackCount("skipped")).isEqualTo(1.0);
    }

    @Test
    void disabledFallbackIsNeverCalled() {
        DefaultIntentClassifier disabled = new DefaultIntentClassifier(new PatternIntentMatcher(), model, () -> true,
                new ClassifierProperties(false, 1000, 0.6), new SyncExecutor(), metrics);

        disabled.classify(Utterance.typed("asdf qwerty zxcv"));

        verify(model, never()).complete(anyString(), anyString());
    }

    @Test
    void deterministicClassificationNeverCallsTheModel() {
        DefaultIntentClassifier classifier = classifier(true, 1000);

        assertThat(classifier.classifyDeterministic("find my resume")).isPresent();
        assertThat(classifier.classifyDeterministic("what is the capital of peru")).isEmpty();
        verify(model, never()).complete(anyString(), anyString());
    }
}
