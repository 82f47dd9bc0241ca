package com.phillippitts.commandrouter.service.health;

import com.phillippitts.commandrouter.service.classifier.IntentModelClient;
import com.phillippitts.commandrouter.testutil.EventCapturingPublisher;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FallbackBackendHealthMonitorTest {

    @Test
    void startsDisabledWithoutApiKeyAndNeverProbes() {
        IntentModelClient client = mock(IntentModelClient.class);
        when(client.isConfigured()).thenReturn(false);
        FallbackBackendHealthMonitor monitor = new FallbackBackendHealthMonitor(client, new EventCapturingPublisher());

        monitor.refresh();

        assertThat(monitor.getState()).isEqualTo(FallbackBackendHealthMonitor.BackendState.DISABLED);
        assertThat(monitor.isAvailable()).isFalse();
        verify(client, never()).probe();
    }

    @Test
    void failedProbeMarksDownAndPublishesTransition() {
        IntentModelClient client = mock(IntentModelClient.class);
        when(client.isConfigured()).thenReturn(true);
        when(client.probe()).thenReturn(false);
        EventCapturingPublisher publisher = new EventCapturingPublisher();
        FallbackBackendHealthMonitor monitor = new FallbackBackendHealthMonitor(client, publisher);
        assertThat(monitor.isAvailable()).isTrue();

        monitor.refresh();

        assertThat(monitor.isAvailable()).isFalse();
        assertThat(monitor.getLastProbe()).isNotNull();
        FallbackBackendStateChangedEvent event = publisher.find(FallbackBackendStateChangedEvent.class);
        assertThat(event).isNotNull();
        assertThat(event.previous()).isEqualTo(FallbackBackendHealthMonitor.BackendState.UP);
        assertThat(event.current()).isEqualTo(FallbackBackendHealthMonitor.BackendState.DOWN);
    }

    @Test
    void probeExceptionCountsAsDownAndRecoveryIsPublished() {
        IntentModelClient client = mock(IntentModelClient.class);
        when(client.isConfigured()).thenReturn(true);
        when(client.probe()).thenThrow(new IllegalStateException("boom")).thenReturn(true);
        EventCapturingPublisher publisher = new EventCapturingPublisher();
        FallbackBackendHealthMonitor monitor = new FallbackBackendHealthMonitor(client, publisher);

        monitor.refresh();
        assertThat(monitor.getState()).isEqualTo(FallbackBackendHealthMonitor.BackendState.DOWN);

        monitor.refresh();
        assertThat(monitor.getState()).isEqualTo(FallbackBackendHealthMonitor.BackendState.UP);
        assertThat(publisher.events()).hasSize(2);
    }

    @Test
    void unchangedStateIsNotRepublished() {
        IntentModelClient client = mock(IntentModelClient.class);
        when(client.isConfigured()).thenReturn(true);
        when(client.probe()).thenReturn(true);
        EventCapturingPublisher publisher = new EventCapturingPublisher();
        FallbackBackendHealthMonitor monitor = new FallbackBackendHealthMonitor(client, publisher);

        monitor.refresh();
        monitor.refresh();

        assertThat(publisher.events()).isEmpty();
    }
}
