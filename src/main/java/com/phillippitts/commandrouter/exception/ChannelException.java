package com.phillippitts.commandrouter.exception;

/**
 * Thrown when a message cannot be written to a realtime connection.
 */
public class ChannelException extends CommandRouterException {

    private final String connectionId;

    public ChannelException(String message, String connectionId) {
        super(message + " (connection: " + connectionId + ")");
        this.connectionId = connectionId;
    }

    public ChannelException(String message, String connectionId, Throwable cause) {
        super(message + " (connection: " + connectionId + ")", cause);
        this.connectionId = connectionId;
    }

    public String getConnectionId() {
        return connectionId;
    }
}
