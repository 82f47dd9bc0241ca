package com.phillippitts.commandrouter.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for workflow coordination and the stateless call path.
 */
@Validated
@ConfigurationProperties(prefix = "router.workflow")
public class WorkflowProperties {

    @Min(100)
    private final long executorTimeoutMs;

    /**
     * Overall budget for one synchronous {@code POST /api/commands} call.
     */
    @Min(100)
    private final long statelessTimeoutMs;

    @ConstructorBinding
    public WorkflowProperties(Long executorTimeoutMs, Long statelessTimeoutMs) {
        this.executorTimeoutMs = executorTimeoutMs == null ? 10_000L : executorTimeoutMs;
        this.statelessTimeoutMs = statelessTimeoutMs == null ? 30_000L : statelessTimeoutMs;
    }

    public long getExecutorTimeoutMs() {
        return executorTimeoutMs;
    }

    public long getStatelessTimeoutMs() {
        return statelessTimeoutMs;
    }
}
