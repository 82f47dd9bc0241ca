package com.phillippitts.commandrouter.service.workflow;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe state machine for one workflow request.
 *
 * <p>Transitions are validated against {@link WorkflowState}; an illegal transition throws
 * {@link IllegalStateException}. Terminal states accept no further transitions.
 */
public final class WorkflowTrace {

    private final Lock lock = new ReentrantLock();
    private final String correlationId;
    private final List<WorkflowState> history = new ArrayList<>();
    private WorkflowState state = WorkflowState.RECEIVED;

    public WorkflowTrace(String correlationId) {
        this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
        history.add(state);
    }

    /**
     * @throws IllegalStateException if {@code next} is not a legal successor of the current state
     */
    public void transition(WorkflowState next) {
        Objects.requireNonNull(next, "next");
        lock.lock();
        try {
            if (!state.successors().contains(next)) {
                throw new IllegalStateException("Illegal workflow transition " + state + " -> " + next
                        + " (correlation: " + correlationId + ")");
            }
            state = next;
            history.add(next);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves to FAILED unless already terminal.
     */
    public void failIfActive() {
        lock.lock();
        try {
            if (!state.isTerminal()) {
                state = WorkflowState.FAILED;
                history.add(state);
            }
        } finally {
            lock.unlock();
        }
    }

    public WorkflowState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public List<WorkflowState> history() {
        lock.lock();
        try {
            return List.copyOf(history);
        } finally {
            lock.unlock();
        }
    }

    public String correlationId() {
        return correlationId;
    }
}
