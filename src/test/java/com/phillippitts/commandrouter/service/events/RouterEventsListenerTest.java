package com.phillippitts.commandrouter.service.events;

import com.phillippitts.commandrouter.domain.IntentCategory;
import com.phillippitts.commandrouter.service.health.FallbackBackendHealthMonitor.BackendState;
import com.phillippitts.commandrouter.service.health.FallbackBackendStateChangedEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class RouterEventsListenerTest {

    @Test
    void throttlesRepeatLogs() {
        RouterEventsListener l = new RouterEventsListener();
        assertThat(l.shouldLog("fallback-down")).isTrue();
        assertThat(l.shouldLog("fallback-down")).isFalse();
        assertThat(l.shouldLog("command-failed-EMAIL")).isTrue();
    }

    @Test
    void handlersDoNotThrow() {
        RouterEventsListener l = new RouterEventsListener();

        assertThatCode(() -> {
            l.onFallbackBackendStateChanged(new FallbackBackendStateChangedEvent(BackendState.UP, BackendState.DOWN, null));
            l.onFallbackBackendStateChanged(new FallbackBackendStateChangedEvent(BackendState.DOWN, BackendState.UP, null));
            l.onCommandCompleted(new CommandCompletedEvent("c1", IntentCategory.EMAIL, false, 1, 12, Instant.now()));
            l.onCommandCompleted(new CommandCompletedEvent("c2", IntentCategory.EMAIL, true, 2, 30, null));
        }).doesNotThrowAnyException();
    }
}
