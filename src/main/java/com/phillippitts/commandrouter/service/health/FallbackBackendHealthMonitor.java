package com.phillippitts.commandrouter.service.health;

import com.phillippitts.commandrouter.service.classifier.IntentModelClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodically probes the fallback model backend and caches the answer.
 *
 * <p>The classifier consults {@link #isAvailable()} on every request instead of discovering an
 * outage through a timeout. The flag is refreshed every {@code router.fallback.health.interval-ms}
 * milliseconds, starting at application startup.
 *
 * <p>State model:
 * <ul>
 *   <li>UP: last probe succeeded (also the initial state when an API key is configured)</li>
 *   <li>DOWN: last probe failed</li>
 *   <li>DISABLED: no API key configured; never probed, never available</li>
 * </ul>
 * Transitions publish {@link FallbackBackendStateChangedEvent}.
 */
@Component
public class FallbackBackendHealthMonitor implements FallbackAvailability {

    private static final Logger LOG = LogManager.getLogger(FallbackBackendHealthMonitor.class);

    public enum BackendState { UP, DOWN, DISABLED }

    private final IntentModelClient client;
    private final ApplicationEventPublisher publisher;
    private final AtomicReference<BackendState> state;
    private volatile Instant lastProbe;

    public FallbackBackendHealthMonitor(IntentModelClient client, ApplicationEventPublisher publisher) {
        this.client = Objects.requireNonNull(client, "client");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.state = new AtomicReference<>(client.isConfigured() ? BackendState.UP : BackendState.DISABLED);
        if (!client.isConfigured()) {
            LOG.info("Fallback classifier disabled: no API key configured");
        }
    }

    @Scheduled(initialDelay = 0, fixedDelayString = "${router.fallback.health.interval-ms:30000}")
    public void refresh() {
        if (!client.isConfigured()) {
            return;
        }
        boolean reachable;
        try {
            reachable = client.probe();
        } catch (RuntimeException e) {
            LOG.warn("Fallback backend probe threw: {}", e.toString());
            reachable = false;
        }
        lastProbe = Instant.now();
        BackendState next = reachable ? BackendState.UP : BackendState.DOWN;
        BackendState previous = state.getAndSet(next);
        if (previous != next) {
            LOG.info("Fallback backend state changed: {} -> {}", previous, next);
            publisher.publishEvent(new FallbackBackendStateChangedEvent(previous, next, lastProbe));
        }
    }

    @Override
    public boolean isAvailable() {
        return state.get() == BackendState.UP;
    }

    public BackendState getState() {
        return state.get();
    }

    /** @return time of the last probe, or null if none has run */
    public Instant getLastProbe() {
        return lastProbe;
    }
}
