package com.phillippitts.commandrouter.testutil;

import com.phillippitts.commandrouter.domain.IntentCategory;
import com.phillippitts.commandrouter.service.executor.ActionExecutor;
import com.phillippitts.commandrouter.service.executor.ActionOutcome;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Test double for ActionExecutor that records every call and answers with a canned outcome.
 *
 * <p><b>Public fields:</b> {@code calls} holds the parameters of each invocation in order.
 */
public class RecordingExecutor implements ActionExecutor {
    private final String name;
    private final IntentCategory intent;
    private final Function<Map<String, String>, ActionOutcome> behaviour;
    public final List<Map<String, String>> calls = new CopyOnWriteArrayList<>();

    public RecordingExecutor(String name, IntentCategory intent,
                             Function<Map<String, String>, ActionOutcome> behaviour) {
        this.name = name;
        this.intent = intent;
        this.behaviour = behaviour;
    }

    public static RecordingExecutor succeeding(String name, IntentCategory intent, String message,
                                               Map<String, Object> payload) {
        return new RecordingExecutor(name, intent, params -> ActionOutcome.success(message, payload));
    }

    public static RecordingExecutor failing(String name, IntentCategory intent, String message) {
        return new RecordingExecutor(name, intent, params -> ActionOutcome.failure(message));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public IntentCategory intent() {
        return intent;
    }

    @Override
    public ActionOutcome execute(Map<String, String> parameters) {
        calls.add(Map.copyOf(parameters));
        return behaviour.apply(parameters);
    }

    public boolean wasCalled() {
        return !calls.isEmpty();
    }
}
