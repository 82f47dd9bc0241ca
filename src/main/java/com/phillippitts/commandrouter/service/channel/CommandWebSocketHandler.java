package com.phillippitts.commandrouter.service.channel;

import com.phillippitts.commandrouter.config.logging.LogContext;
import com.phillippitts.commandrouter.config.properties.ChannelProperties;
import com.phillippitts.commandrouter.domain.CommandOutcome;
import com.phillippitts.commandrouter.domain.IntentCategory;
import com.phillippitts.commandrouter.domain.Utterance;
import com.phillippitts.commandrouter.domain.WorkflowRequest;
import com.phillippitts.commandrouter.service.command.CommandService;
import com.phillippitts.commandrouter.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Realtime command channel.
 *
 * <p>Each connection gets a {@link SerialLane} on the shared command pool: commands from one
 * connection are processed and answered in arrival order, while different connections proceed
 * independently. The I/O thread only decodes, acknowledges and enqueues.
 *
 * <p>Every command frame yields exactly one {@code command_result} carrying its correlation id,
 * unless the connection closes first, in which case the result is discarded.
 */
@Component
public class CommandWebSocketHandler extends TextWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(CommandWebSocketHandler.class);

    static final String ACK_MESSAGE = "Processing your command...";
    static final String EMPTY_COMMAND_MESSAGE = "Please say or type a command.";
    static final String BUSY_MESSAGE = "I'm busy right now. Please try again in a moment.";

    private final CommandService commandService;
    private final SessionRegistry registry;
    private final ResultDispatcher dispatcher;
    private final ChannelProperties properties;
    private final Executor commandExecutor;
    private final Clock clock;

    @Autowired
    public CommandWebSocketHandler(CommandService commandService,
                                   SessionRegistry registry,
                                   ResultDispatcher dispatcher,
                                   ChannelProperties properties,
                                   @Qualifier("commandExecutor") Executor commandExecutor) {
        this(commandService, registry, dispatcher, properties, commandExecutor, Clock.systemUTC());
    }

    CommandWebSocketHandler(CommandService commandService,
                            SessionRegistry registry,
                            ResultDispatcher dispatcher,
                            ChannelProperties properties,
                            Executor commandExecutor,
                            Clock clock) {
        this.commandService = commandService;
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.properties = properties;
        this.commandExecutor = commandExecutor;
        this.clock = clock;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession socket = new ConcurrentWebSocketSessionDecorator(
                session, properties.getSendTimeLimitMs(), properties.getBufferSizeLimit());
        registry.register(new ClientSession(session.getId(), socket, clock.instant(), commandExecutor));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String connectionId = session.getId();
        ThreadContext.put(LogContext.CONNECTION_ID, connectionId);
        try {
            ClientSession client = registry.find(connectionId).orElse(null);
            if (client == null) {
                LOG.warn("Message on unregistered connection ignored");
                return;
            }
            InboundMessage inbound;
            try {
                inbound = ChannelMessageCodec.decode(message.getPayload());
            } catch (IllegalArgumentException e) {
                LOG.warn("Rejected frame: {}", e.getMessage());
                dispatcher.send(client, ChannelMessageCodec.encodeError(e.getMessage()));
                return;
            }
            switch (inbound.type()) {
                case PING -> {
                    client.heartbeat(clock.instant());
                    dispatcher.send(client, ChannelMessageCodec.encodePong(clock.instant()));
                }
                case PONG -> client.heartbeat(clock.instant());
                case COMMAND -> onCommand(client, inbound);
                default -> throw new IllegalStateException("Unhandled message type: " + inbound.type());
            }
        } finally {
            ThreadContext.remove(LogContext.CONNECTION_ID);
        }
    }

    private void onCommand(ClientSession client, InboundMessage inbound) {
        String correlationId = inbound.correlationId() != null
                ? inbound.correlationId()
                : WorkflowRequest.newCorrelationId();
        String text = inbound.command() == null ? "" : inbound.command().trim();
        if (text.isEmpty()) {
            dispatcher.deliver(client.connectionId(),
                    CommandOutcome.failure(correlationId, IntentCategory.CONVERSATION, EMPTY_COMMAND_MESSAGE));
            return;
        }
        LOG.info("Command received: correlation={}, text='{}'", correlationId, LogSanitizer.preview(text));
        if (properties.isAcknowledgeCommands()) {
            dispatcher.send(client, ChannelMessageCodec.encodeAck(correlationId, ACK_MESSAGE));
        }
        WorkflowRequest request = WorkflowRequest.of(correlationId, Utterance.typed(text));
        String connectionId = client.connectionId();
        try {
            client.lane().submit(() -> {
                CommandOutcome outcome = commandService.process(request);
                dispatcher.deliver(connectionId, outcome);
            });
        } catch (RejectedExecutionException e) {
            LOG.warn("Command pool saturated, rejecting command: correlation={}", correlationId);
            dispatcher.deliver(connectionId,
                    CommandOutcome.failure(correlationId, IntentCategory.CONVERSATION, BUSY_MESSAGE));
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ThreadContext.put(LogContext.CONNECTION_ID, session.getId());
        try {
            registry.remove(session.getId()).ifPresent(closed ->
                    LOG.info("Connection closed: status={}, pending={}", status.getCode(), closed.lane().pending()));
        } finally {
            ThreadContext.remove(LogContext.CONNECTION_ID);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        LOG.warn("Transport error on connection {}: {}", session.getId(), exception.getMessage());
    }
}
