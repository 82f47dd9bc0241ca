package com.phillippitts.commandrouter.service.workflow;

import com.phillippitts.commandrouter.domain.ExecutionResult;
import com.phillippitts.commandrouter.domain.WorkflowRequest;

import java.util.List;

/**
 * Turns a workflow request into executor calls.
 *
 * <p>Either one step (single dispatch) or a producer/consumer pipeline runs. The returned list
 * holds the result of every step that ran, in order; it is never empty and the call never throws
 * for classification, resolution or executor failures.
 */
public interface WorkflowCoordinator {

    /**
     * @param request the request; steps empty means classify the utterance first
     * @return step results, at least one
     */
    List<ExecutionResult> run(WorkflowRequest request);
}
