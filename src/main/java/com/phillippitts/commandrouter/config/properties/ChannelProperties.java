package com.phillippitts.commandrouter.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the realtime WebSocket channel.
 */
@Validated
@ConfigurationProperties(prefix = "router.channel")
public class ChannelProperties {

    @Min(1000)
    private final long heartbeatIntervalMs;

    /**
     * Sessions without a ping or pong for this long are closed by the sweep.
     */
    @Min(1000)
    private final long staleAfterMs;

    private final boolean acknowledgeCommands;

    @Min(100)
    private final int sendTimeLimitMs;

    @Min(1024)
    private final int bufferSizeLimit;

    @NotBlank
    private final String allowedOriginPattern;

    @ConstructorBinding
    public ChannelProperties(Long heartbeatIntervalMs,
                             Long staleAfterMs,
                             Boolean acknowledgeCommands,
                             Integer sendTimeLimitMs,
                             Integer bufferSizeLimit,
                             String allowedOriginPattern) {
        this.heartbeatIntervalMs = heartbeatIntervalMs == null ? 30_000L : heartbeatIntervalMs;
        this.staleAfterMs = staleAfterMs == null ? 90_000L : staleAfterMs;
        this.acknowledgeCommands = acknowledgeCommands == null || acknowledgeCommands;
        this.sendTimeLimitMs = sendTimeLimitMs == null ? 10_000 : sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit == null ? 512 * 1024 : bufferSizeLimit;
        this.allowedOriginPattern = allowedOriginPattern == null ? "*" : allowedOriginPattern;
    }

    public static ChannelProperties defaults() {
        return new ChannelProperties(null, null, null, null, null, null);
    }

    public long getHeartbeatIntervalMs() {
        return heartbeatIntervalMs;
    }

    public long getStaleAfterMs() {
        return staleAfterMs;
    }

    public boolean isAcknowledgeCommands() {
        return acknowledgeCommands;
    }

    public int getSendTimeLimitMs() {
        return sendTimeLimitMs;
    }

    public int getBufferSizeLimit() {
        return bufferSizeLimit;
    }

    public String getAllowedOriginPattern() {
        return allowedOriginPattern;
    }
}
