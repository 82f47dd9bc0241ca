package com.phillippitts.commandrouter.config.logging;

/**
 * ThreadContext keys shared by the HTTP filter, the WebSocket handler and the log pattern.
 */
public final class LogContext {

    public static final String CORRELATION_ID = "correlationId";
    public static final String CONNECTION_ID = "connectionId";
    public static final String REQUEST_ID = "requestId";

    private LogContext() {
    }
}
