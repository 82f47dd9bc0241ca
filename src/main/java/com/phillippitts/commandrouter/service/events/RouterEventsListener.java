package com.phillippitts.commandrouter.service.events;

import com.phillippitts.commandrouter.service.health.FallbackBackendHealthMonitor;
import com.phillippitts.commandrouter.service.health.FallbackBackendStateChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing logging for router events. Privacy-safe and throttled to avoid log spam.
 */
@Component
class RouterEventsListener {
    private static final Logger LOG = LogManager.getLogger(RouterEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onFallbackBackendStateChanged(FallbackBackendStateChangedEvent e) {
        if (e.current() == FallbackBackendHealthMonitor.BackendState.DOWN) {
            if (shouldLog("fallback-down")) {
                LOG.warn("Fallback classifier backend unreachable; ambiguous commands use patterns only. "
                        + "Check router.classifier.base-url and network access.");
            }
        } else {
            LOG.info("Fallback classifier backend is {}", e.current());
        }
    }

    @EventListener
    void onCommandCompleted(CommandCompletedEvent e) {
        if (!e.success() && shouldLog("command-failed-" + e.intent())) {
            LOG.warn("Command failed: intent={}, steps={}, durationMs={}",
                    e.intent().wireName(), e.steps(), e.durationMs());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
