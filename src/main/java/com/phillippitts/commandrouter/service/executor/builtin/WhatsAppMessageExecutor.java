package com.phillippitts.commandrouter.service.executor.builtin;

import com.phillippitts.commandrouter.domain.IntentCategory;
import com.phillippitts.commandrouter.service.executor.ActionExecutor;
import com.phillippitts.commandrouter.service.executor.ActionOutcome;
import com.phillippitts.commandrouter.service.executor.SlotNames;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds a {@code https://wa.me/<digits>?text=...} deep link for a resolved contact.
 */
@Component
public class WhatsAppMessageExecutor implements ActionExecutor {

    static final String NAME = "whatsapp";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public IntentCategory intent() {
        return IntentCategory.MESSAGING;
    }

    @Override
    public String description() {
        return "Prepares a WhatsApp message to a contact";
    }

    @Override
    public ActionOutcome execute(Map<String, String> parameters) {
        String name = Links.orDefault(parameters.get(SlotNames.RECIPIENT_NAME), parameters.get(SlotNames.RECIPIENT));
        String digits = Links.digitsOnly(parameters.get(SlotNames.RECIPIENT));
        if (digits.isEmpty()) {
            return ActionOutcome.failure("I couldn't find a phone number for " + Links.orDefault(name, "that contact") + ".");
        }
        String text = Links.withAttachment(parameters.get(SlotNames.BODY), parameters.get(SlotNames.ATTACHMENT));
        String url = "https://wa.me/" + digits + (text.isEmpty() ? "" : "?text=" + Links.encode(text));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("url", url);
        payload.put("recipient", name);
        payload.put("message", text);
        payload.put(SlotNames.ATTACHMENT, parameters.get(SlotNames.ATTACHMENT));
        return ActionOutcome.success("WhatsApp message ready for " + name + ".", payload);
    }
}
