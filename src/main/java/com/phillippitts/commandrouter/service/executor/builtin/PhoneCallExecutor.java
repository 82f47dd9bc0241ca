package com.phillippitts.commandrouter.service.executor.builtin;

import com.phillippitts.commandrouter.domain.IntentCategory;
import com.phillippitts.commandrouter.service.executor.ActionExecutor;
import com.phillippitts.commandrouter.service.executor.ActionOutcome;
import com.phillippitts.commandrouter.service.executor.SlotNames;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Builds a {@code tel:} dial link for a resolved contact.
 */
@Component
public class PhoneCallExecutor implements ActionExecutor {

    @Override
    public String name() {
        return "phone";
    }

    @Override
    public IntentCategory intent() {
        return IntentCategory.PHONE_CALL;
    }

    @Override
    public String description() {
        return "Dials a contact";
    }

    @Override
    public ActionOutcome execute(Map<String, String> parameters) {
        String raw = parameters.get(SlotNames.RECIPIENT);
        String name = Links.orDefault(parameters.get(SlotNames.RECIPIENT_NAME), raw);
        String digits = Links.digitsOnly(raw);
        if (digits.isEmpty()) {
            return ActionOutcome.failure("I couldn't find a phone number for " + Links.orDefault(name, "that contact") + ".");
        }
        String number = raw.trim().startsWith("+") ? "+" + digits : digits;
        return ActionOutcome.success("Calling " + name + ".",
                Map.of("url", "tel:" + number, "recipient", name));
    }
}
