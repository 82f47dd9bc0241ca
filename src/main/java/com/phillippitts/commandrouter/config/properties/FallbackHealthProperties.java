package com.phillippitts.commandrouter.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Probe settings for the fallback model backend.
 */
@Validated
@ConfigurationProperties(prefix = "router.fallback.health")
public class FallbackHealthProperties {

    @Min(1000)
    private final long intervalMs;

    @Min(100)
    private final long probeTimeoutMs;

    @ConstructorBinding
    public FallbackHealthProperties(Long intervalMs, Long probeTimeoutMs) {
        this.intervalMs = intervalMs == null ? 30_000L : intervalMs;
        this.probeTimeoutMs = probeTimeoutMs == null ? 3_000L : probeTimeoutMs;
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    public long getProbeTimeoutMs() {
        return probeTimeoutMs;
    }
}
