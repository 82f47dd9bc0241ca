package com.phillippitts.commandrouter.exception;

import com.phillippitts.commandrouter.domain.ExecutionResult;

/**
 * Signals that a pipeline stopped before its consumer ran. Carries the failure that ends the
 * workflow so it can be reported as the whole result.
 */
public class WorkflowAbortException extends CommandRouterException {

    private final int failedStep;
    private final transient ExecutionResult failure;

    public WorkflowAbortException(String message, int failedStep, ExecutionResult failure) {
        super(message + " (step: " + failedStep + ")");
        this.failedStep = failedStep;
        this.failure = failure;
    }

    public int getFailedStep() {
        return failedStep;
    }

    public ExecutionResult getFailure() {
        return failure;
    }
}
