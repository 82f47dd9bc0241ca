package com.phillippitts.commandrouter.service.command;

import com.phillippitts.commandrouter.domain.CommandOutcome;
import com.phillippitts.commandrouter.domain.WorkflowRequest;

/**
 * Entry point shared by the realtime channel and the stateless HTTP API.
 *
 * <p>Produces exactly one {@link CommandOutcome} per request, success or failure.
 */
public interface CommandService {

    /**
     * Processes a request on the calling thread.
     *
     * @return aggregated outcome carrying the request's correlation id; never throws
     */
    CommandOutcome process(WorkflowRequest request);

    /**
     * Processes a request on the command pool and waits at most the stateless budget.
     *
     * @throws com.phillippitts.commandrouter.exception.CommandTimeoutException if the budget is exceeded
     */
    CommandOutcome processWithTimeout(WorkflowRequest request);
}
