package com.phillippitts.commandrouter.service.executor;

import com.phillippitts.commandrouter.domain.IntentCategory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable intent to executor mapping, built once at startup from every
 * {@link ActionExecutor} bean.
 */
@Component
public class ExecutorRegistry {

    private static final Logger LOG = LogManager.getLogger(ExecutorRegistry.class);

    private final Map<IntentCategory, ActionExecutor> byIntent;

    /**
     * @throws IllegalStateException if two executors claim the same intent
     */
    public ExecutorRegistry(List<ActionExecutor> executors) {
        Map<IntentCategory, ActionExecutor> map = new EnumMap<>(IntentCategory.class);
        for (ActionExecutor executor : executors) {
            ActionExecutor previous = map.putIfAbsent(executor.intent(), executor);
            if (previous != null) {
                throw new IllegalStateException("Duplicate executors for " + executor.intent()
                        + ": " + previous.name() + ", " + executor.name());
            }
        }
        this.byIntent = Map.copyOf(map);
        LOG.info("Registered executors: {}", byIntent.keySet());
    }

    public Optional<ActionExecutor> find(IntentCategory intent) {
        return Optional.ofNullable(byIntent.get(intent));
    }

    public Collection<ActionExecutor> all() {
        return byIntent.values();
    }
}
