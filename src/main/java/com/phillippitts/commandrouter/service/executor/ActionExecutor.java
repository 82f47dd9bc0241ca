package com.phillippitts.commandrouter.service.executor;

import com.phillippitts.commandrouter.domain.IntentCategory;

import java.util.Map;

/**
 * Task-specific handler for one intent category.
 *
 * <p>Implementations receive resolved slot values (canonical contact values, application ids,
 * piped attachments) and produce a side-effect reference such as a deep link. They know nothing
 * about other executors; chaining is done by the workflow coordinator.
 *
 * <p><b>Contract:</b>
 * <ul>
 *   <li>Must be thread-safe; one instance serves all requests.</li>
 *   <li>Must not retry external calls.</li>
 *   <li>Should report expected failures (missing slot, nothing found) as a failed
 *       {@link ActionOutcome}; thrown exceptions are treated as unexpected and reported with a
 *       generic message.</li>
 * </ul>
 */
public interface ActionExecutor {

    /** Stable executor name reported as {@code agent_used}. */
    String name();

    /** The single intent this executor handles. */
    IntentCategory intent();

    /** One-line description for the intent catalogue. */
    default String description() {
        return name();
    }

    /**
     * Performs the action.
     *
     * @param parameters slot values keyed by slot name; never null
     * @return outcome; never null
     */
    ActionOutcome execute(Map<String, String> parameters);
}
