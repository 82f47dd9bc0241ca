package com.phillippitts.commandrouter.service.executor.builtin;

import com.phillippitts.commandrouter.domain.IntentCategory;
import com.phillippitts.commandrouter.service.executor.ActionExecutor;
import com.phillippitts.commandrouter.service.executor.ActionOutcome;
import com.phillippitts.commandrouter.service.executor.SlotNames;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Canned replies for greetings, help and thanks; everything else gets a capability hint.
 */
@Component
public class ConversationExecutor implements ActionExecutor {

    static final String HELP = "I can send WhatsApp messages, make calls, draft emails, schedule events, "
            + "prepare UPI payments, find files, open apps and search the web.";

    @Override
    public String name() {
        return "conversation";
    }

    @Override
    public IntentCategory intent() {
        return IntentCategory.CONVERSATION;
    }

    @Override
    public String description() {
        return "Answers greetings and questions about what I can do";
    }

    @Override
    public ActionOutcome execute(Map<String, String> parameters) {
        String topic = parameters.getOrDefault(SlotNames.TOPIC, "").toLowerCase(Locale.ROOT);
        String reply;
        if (topic.startsWith("hi") || topic.startsWith("hello") || topic.startsWith("hey") || topic.startsWith("good")) {
            reply = "Hello! What can I do for you?";
        } else if (topic.startsWith("help") || topic.startsWith("what can")) {
            reply = HELP;
        } else if (topic.startsWith("thank") || topic.equals("thx")) {
            reply = "You're welcome!";
        } else {
            reply = "I'm not sure how to help with that yet. " + HELP;
        }
        return ActionOutcome.success(reply, Map.of("reply", reply));
    }
}
