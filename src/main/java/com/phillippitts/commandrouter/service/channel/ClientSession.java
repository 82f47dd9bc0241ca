package com.phillippitts.commandrouter.service.channel;

import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * One live realtime connection: its socket, heartbeat bookkeeping and serial command lane.
 */
public final class ClientSession {

    private final String connectionId;
    private final WebSocketSession socket;
    private final Instant connectedAt;
    private final SerialLane lane;
    private volatile Instant lastHeartbeat;

    ClientSession(String connectionId, WebSocketSession socket, Instant connectedAt, Executor commandExecutor) {
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
        this.socket = Objects.requireNonNull(socket, "socket");
        this.connectedAt = Objects.requireNonNull(connectedAt, "connectedAt");
        this.lastHeartbeat = connectedAt;
        this.lane = new SerialLane(commandExecutor);
    }

    public String connectionId() {
        return connectionId;
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    public Instant lastHeartbeat() {
        return lastHeartbeat;
    }

    void heartbeat(Instant at) {
        this.lastHeartbeat = at;
    }

    WebSocketSession socket() {
        return socket;
    }

    SerialLane lane() {
        return lane;
    }

    boolean isOpen() {
        return socket.isOpen();
    }
}
