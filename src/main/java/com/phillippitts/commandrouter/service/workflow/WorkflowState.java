package com.phillippitts.commandrouter.service.workflow;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one workflow request.
 *
 * <pre>
 * RECEIVED → CLASSIFYING → SINGLE_DISPATCH → COMPLETED | FAILED
 *                        → PRODUCING_STEP → CONSUMING_STEP → COMPLETED | FAILED
 * </pre>
 * Any non-terminal state may also move straight to FAILED.
 */
public enum WorkflowState {
    RECEIVED,
    CLASSIFYING,
    SINGLE_DISPATCH,
    PRODUCING_STEP,
    CONSUMING_STEP,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    Set<WorkflowState> successors() {
        return switch (this) {
            case RECEIVED -> EnumSet.of(CLASSIFYING, FAILED);
            case CLASSIFYING -> EnumSet.of(SINGLE_DISPATCH, PRODUCING_STEP, FAILED);
            case SINGLE_DISPATCH -> EnumSet.of(COMPLETED, FAILED);
            case PRODUCING_STEP -> EnumSet.of(CONSUMING_STEP, FAILED);
            case CONSUMING_STEP -> EnumSet.of(COMPLETED, FAILED);
            case COMPLETED, FAILED -> EnumSet.noneOf(WorkflowState.class);
        };
    }
}
