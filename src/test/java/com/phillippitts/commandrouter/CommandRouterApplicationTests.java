package com.phillippitts.commandrouter;

import com.phillippitts.commandrouter.service.channel.CommandWebSocketHandler;
import com.phillippitts.commandrouter.service.channel.HeartbeatScheduler;
import com.phillippitts.commandrouter.service.executor.ExecutorRegistry;
import com.phillippitts.commandrouter.service.health.FallbackBackendHealthMonitor;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
    properties = {
        "router.classifier.api-key=", // no fallback model in tests
        "router.channel.heartbeat-interval-ms=600000"
    }
)
class CommandRouterApplicationTests {

    @Autowired
    private ExecutorRegistry executors;

    @Autowired
    private FallbackBackendHealthMonitor fallbackHealth;

    @Autowired
    private CommandWebSocketHandler handler;

    @Autowired
    private HeartbeatScheduler heartbeat;

    @Test
    void contextLoads() {
        assertThat(handler).isNotNull();
        assertThat(heartbeat).isNotNull();
        assertThat(executors.all()).hasSize(9);
        assertThat(fallbackHealth.getState()).isEqualTo(FallbackBackendHealthMonitor.BackendState.DISABLED);
    }
}
