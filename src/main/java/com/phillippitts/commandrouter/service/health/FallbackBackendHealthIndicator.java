package com.phillippitts.commandrouter.service.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Health indicator for the fallback classifier backend.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: backend reachable, ambiguous commands can use the fallback model</li>
 *   <li>DOWN: backend unreachable; classification degrades to patterns only</li>
 *   <li>DISABLED: no API key configured</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health as {@code fallbackBackend}.
 */
@Component("fallbackBackend")
public class FallbackBackendHealthIndicator implements HealthIndicator {

    static final String DISABLED = "DISABLED";

    private final FallbackBackendHealthMonitor monitor;

    public FallbackBackendHealthIndicator(FallbackBackendHealthMonitor monitor) {
        this.monitor = monitor;
    }

    @Override
    public Health health() {
        Instant lastProbe = monitor.getLastProbe();
        String probed = lastProbe == null ? "never" : lastProbe.toString();

        return switch (monitor.getState()) {
            case UP -> Health.up()
                    .withDetail("status", "Fallback classifier available")
                    .withDetail("lastProbe", probed)
                    .build();
            case DOWN -> Health.down()
                    .withDetail("status", "Fallback classifier unreachable; using patterns only")
                    .withDetail("lastProbe", probed)
                    .build();
            case DISABLED -> Health.status(DISABLED)
                    .withDetail("status", "No API key configured")
                    .build();
        };
    }
}
