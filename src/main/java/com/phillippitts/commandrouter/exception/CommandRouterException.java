package com.phillippitts.commandrouter.exception;

/**
 * Base exception for all command router errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class CommandRouterException extends RuntimeException {

    public CommandRouterException(String message) {
        super(message);
    }

    public CommandRouterException(String message, Throwable cause) {
        super(message, cause);
    }

    public CommandRouterException(Throwable cause) {
        super(cause);
    }
}
