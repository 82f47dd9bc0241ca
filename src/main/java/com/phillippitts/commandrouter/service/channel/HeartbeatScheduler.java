package com.phillippitts.commandrouter.service.channel;

import com.phillippitts.commandrouter.config.properties.ChannelProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Periodic liveness check: closes connections whose heartbeat is stale and pings the rest.
 */
@Component
public class HeartbeatScheduler {

    private static final Logger LOG = LogManager.getLogger(HeartbeatScheduler.class);

    private final SessionRegistry registry;
    private final ResultDispatcher dispatcher;
    private final Duration staleAfter;
    private final Clock clock;

    @Autowired
    public HeartbeatScheduler(SessionRegistry registry, ResultDispatcher dispatcher, ChannelProperties properties) {
        this(registry, dispatcher, properties, Clock.systemUTC());
    }

    HeartbeatScheduler(SessionRegistry registry, ResultDispatcher dispatcher,
                       ChannelProperties properties, Clock clock) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.staleAfter = Duration.ofMillis(properties.getStaleAfterMs());
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${router.channel.heartbeat-interval-ms:30000}",
            initialDelayString = "${router.channel.heartbeat-interval-ms:30000}")
    public void tick() {
        Instant now = clock.instant();
        List<ClientSession> stale = registry.sweepStale(now, staleAfter);
        for (ClientSession session : stale) {
            close(session);
        }
        String ping = ChannelMessageCodec.encodePing(now);
        for (ClientSession session : registry.all()) {
            dispatcher.send(session, ping);
        }
    }

    private void close(ClientSession session) {
        try {
            session.socket().close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException e) {
            LOG.warn("Failed to close stale connection {}: {}", session.connectionId(), e.getMessage());
        }
    }
}
