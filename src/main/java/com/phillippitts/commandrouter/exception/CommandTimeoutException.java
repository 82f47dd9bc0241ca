package com.phillippitts.commandrouter.exception;

/**
 * Thrown when a stateless command does not complete within its overall time budget.
 */
public class CommandTimeoutException extends CommandRouterException {

    private final String correlationId;
    private final long timeoutMs;

    public CommandTimeoutException(String correlationId, long timeoutMs) {
        super("Command timed out after " + timeoutMs + " ms (correlation: " + correlationId + ")");
        this.correlationId = correlationId;
        this.timeoutMs = timeoutMs;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
