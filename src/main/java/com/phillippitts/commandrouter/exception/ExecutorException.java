package com.phillippitts.commandrouter.exception;

/**
 * Thrown when an action executor fails or exceeds its time budget.
 */
public class ExecutorException extends CommandRouterException {

    private final String executorName;

    public ExecutorException(String message, String executorName) {
        super(message + " (executor: " + executorName + ")");
        this.executorName = executorName;
    }

    public ExecutorException(String message, String executorName, Throwable cause) {
        super(message + " (executor: " + executorName + ")", cause);
        this.executorName = executorName;
    }

    public String getExecutorName() {
        return executorName;
    }
}
