package com.phillippitts.commandrouter.service.workflow;

import com.phillippitts.commandrouter.config.properties.ClassifierProperties;
import com.phillippitts.commandrouter.config.properties.ResolverProperties;
import com.phillippitts.commandrouter.service.classifier.DefaultIntentClassifier;
import com.phillippitts.commandrouter.service.classifier.IntentClassifier;
import com.phillippitts.commandrouter.service.classifier.IntentModelClient;
import com.phillippitts.commandrouter.service.classifier.PatternIntentMatcher;
import com.phillippitts.commandrouter.service.metrics.CommandMetrics;
import com.phillippitts.commandrouter.service.resolver.DirectoryRegistry;
import com.phillippitts.commandrouter.service.resolver.EntityResolver;
import com.phillippitts.commandrouter.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import static org.mockito.Mockito.mock;

/**
 * Shared wiring for workflow tests: pattern-only classifier and a small directory.
 */
final class WorkflowTestSupport {

    static final String DIRECTORY = """
            {
              "contacts": {
                "jay": {"label": "Jay", "value": "+919321781905"},
                "mom": {"label": "Mom", "value": "+919876543212"},
                "shivam": {"label": "Shivam Patel", "value": "+919876543219"}
              },
              "emails": {
                "vijay": {"label": "Vijay Sharma", "value": "vijaysharma@gmail.com"}
              },
              "applications": {
                "chrome": {"label": "Chrome", "value": "chrome"}
              }
            }
            """;

    private WorkflowTestSupport() {
    }

    /** Pattern tier only: the fallback backend reports unavailable. */
    static IntentClassifier patternOnlyClassifier(CommandMetrics metrics) {
        return new DefaultIntentClassifier(new PatternIntentMatcher(), mock(IntentModelClient.class), () -> false,
                new ClassifierProperties(true, 1000, 0.6), new SyncExecutor(), metrics);
    }

    static CommandMetrics metrics() {
        return new CommandMetrics(new SimpleMeterRegistry());
    }

    static DirectoryRegistry directories() {
        return DirectoryRegistry.fromJson(DIRECTORY);
    }

    static SlotResolver slotResolver() {
        return new SlotResolver(new EntityResolver(ResolverProperties.defaults()), directories());
    }
}
