package com.phillippitts.commandrouter.service.channel;

import com.phillippitts.commandrouter.domain.CommandOutcome;
import com.phillippitts.commandrouter.exception.ChannelException;
import com.phillippitts.commandrouter.service.metrics.CommandMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;

import java.io.IOException;
import java.util.Optional;

/**
 * Writes outbound frames to live connections.
 *
 * <p>A result whose connection is gone (closed, swept or never registered) is logged and
 * dropped. Delivery never throws back into the lane.
 */
@Component
public class ResultDispatcher {

    private static final Logger LOG = LogManager.getLogger(ResultDispatcher.class);

    private final SessionRegistry registry;
    private final CommandMetrics metrics;

    public ResultDispatcher(SessionRegistry registry, CommandMetrics metrics) {
        this.registry = registry;
        this.metrics = metrics;
    }

    /**
     * Sends the {@code command_result} frame for an outcome.
     *
     * @return true if the frame was written
     */
    public boolean deliver(String connectionId, CommandOutcome outcome) {
        Optional<ClientSession> session = registry.find(connectionId);
        if (session.isEmpty() || !session.get().isOpen()) {
            LOG.info("Connection gone, discarding result: correlation={}, success={}",
                    outcome.correlationId(), outcome.success());
            metrics.incrementDiscardedResult();
            return false;
        }
        boolean sent = send(session.get(), ChannelMessageCodec.encodeResult(outcome));
        if (!sent) {
            metrics.incrementDiscardedResult();
        }
        return sent;
    }

    /**
     * Writes one text frame. Send failures are logged, not thrown.
     *
     * @return true if the frame was written
     */
    boolean send(ClientSession session, String payload) {
        if (!session.isOpen()) {
            return false;
        }
        try {
            session.socket().sendMessage(new TextMessage(payload));
            return true;
        } catch (IOException | IllegalStateException e) {
            ChannelException failure = new ChannelException("Failed to send frame", session.connectionId(), e);
            LOG.warn(failure.getMessage(), failure);
            return false;
        }
    }
}
