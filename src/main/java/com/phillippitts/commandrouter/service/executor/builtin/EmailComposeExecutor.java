package com.phillippitts.commandrouter.service.executor.builtin;

import com.phillippitts.commandrouter.domain.IntentCategory;
import com.phillippitts.commandrouter.service.executor.ActionExecutor;
import com.phillippitts.commandrouter.service.executor.ActionOutcome;
import com.phillippitts.commandrouter.service.executor.SlotNames;
import com.phillippitts.commandrouter.util.EmailAddresses;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Prepares an email draft as a Gmail compose link, with a {@code mailto:} alternative.
 *
 * <p>Links cannot carry attachments, so a piped file is referenced in the body.
 */
@Component
public class EmailComposeExecutor implements ActionExecutor {

    private static final String GMAIL_COMPOSE = "https://mail.google.com/mail/?view=cm&fs=1";

    @Override
    public String name() {
        return "email";
    }

    @Override
    public IntentCategory intent() {
        return IntentCategory.EMAIL;
    }

    @Override
    public String description() {
        return "Drafts an email";
    }

    @Override
    public ActionOutcome execute(Map<String, String> parameters) {
        String address = EmailAddresses.normalize(parameters.get(SlotNames.RECIPIENT));
        if (!EmailAddresses.isAddress(address)) {
            String who = Links.orDefault(parameters.get(SlotNames.RECIPIENT_NAME), parameters.get(SlotNames.RECIPIENT));
            return ActionOutcome.failure("I need an email address for " + Links.orDefault(who, "the recipient") + ".");
        }
        String name = Links.orDefault(parameters.get(SlotNames.RECIPIENT_NAME), address);
        String subject = Links.orDefault(parameters.get(SlotNames.SUBJECT), "");
        String body = Links.withAttachment(parameters.get(SlotNames.BODY), parameters.get(SlotNames.ATTACHMENT));

        StringBuilder gmail = new StringBuilder(GMAIL_COMPOSE).append("&to=").append(Links.encode(address));
        StringBuilder mailto = new StringBuilder("mailto:").append(address);
        String separator = "?";
        if (!subject.isEmpty()) {
            gmail.append("&su=").append(Links.encode(subject));
            mailto.append(separator).append("subject=").append(Links.encode(subject));
            separator = "&";
        }
        if (!body.isEmpty()) {
            gmail.append("&body=").append(Links.encode(body));
            mailto.append(separator).append("body=").append(Links.encode(body));
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("url", gmail.toString());
        payload.put("mailto", mailto.toString());
        payload.put("to", address);
        payload.put("subject", subject);
        payload.put(SlotNames.ATTACHMENT, parameters.get(SlotNames.ATTACHMENT));
        return ActionOutcome.success("Email draft ready for " + name + ".", payload);
    }
}
