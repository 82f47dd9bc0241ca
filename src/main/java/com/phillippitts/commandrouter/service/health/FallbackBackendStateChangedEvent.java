package com.phillippitts.commandrouter.service.health;

import java.time.Instant;

/**
 * Published when the fallback backend's probed state changes.
 */
public record FallbackBackendStateChangedEvent(
        FallbackBackendHealthMonitor.BackendState previous,
        FallbackBackendHealthMonitor.BackendState current,
        Instant at
) {
    public FallbackBackendStateChangedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
