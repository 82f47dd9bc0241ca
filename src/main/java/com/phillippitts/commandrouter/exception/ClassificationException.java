package com.phillippitts.commandrouter.exception;

/**
 * Thrown when the fallback model's answer cannot be turned into a valid classification
 * (unparseable text, unknown intent, out-of-range confidence, slot outside the schema),
 * or when the model call itself fails.
 */
public class ClassificationException extends CommandRouterException {

    public ClassificationException(String message) {
        super(message);
    }

    public ClassificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
