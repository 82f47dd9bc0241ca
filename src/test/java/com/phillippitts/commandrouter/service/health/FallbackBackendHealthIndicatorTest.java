package com.phillippitts.commandrouter.service.health;

import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FallbackBackendHealthIndicatorTest {

    @Test
    void shouldReportUpWhenBackendReachable() {
        FallbackBackendHealthMonitor monitor = mock(FallbackBackendHealthMonitor.class);
        when(monitor.getState()).thenReturn(FallbackBackendHealthMonitor.BackendState.UP);
        when(monitor.getLastProbe()).thenReturn(Instant.parse("2024-05-01T10:00:00Z"));

        Health health = new FallbackBackendHealthIndicator(monitor).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("lastProbe", "2024-05-01T10:00:00Z");
    }

    @Test
    void shouldReportDownWhenBackendUnreachable() {
        FallbackBackendHealthMonitor monitor = mock(FallbackBackendHealthMonitor.class);
        when(monitor.getState()).thenReturn(FallbackBackendHealthMonitor.BackendState.DOWN);

        Health health = new FallbackBackendHealthIndicator(monitor).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("lastProbe", "never");
    }

    @Test
    void shouldReportDisabledWithoutApiKey() {
        FallbackBackendHealthMonitor monitor = mock(FallbackBackendHealthMonitor.class);
        when(monitor.getState()).thenReturn(FallbackBackendHealthMonitor.BackendState.DISABLED);

        Health health = new FallbackBackendHealthIndicator(monitor).health();

        assertThat(health.getStatus()).isEqualTo(new Status("DISABLED"));
        assertThat(health.getDetails()).containsEntry("status", "No API key configured");
    }
}
