package com.phillippitts.commandrouter.service.workflow;

import com.phillippitts.commandrouter.domain.ParsedCommand;
import com.phillippitts.commandrouter.exception.EntityNotFoundException;
import com.phillippitts.commandrouter.service.executor.SlotNames;
import com.phillippitts.commandrouter.service.resolver.CandidateDirectory;
import com.phillippitts.commandrouter.service.resolver.CanonicalEntry;
import com.phillippitts.commandrouter.service.resolver.DirectoryRegistry;
import com.phillippitts.commandrouter.service.resolver.EntityResolver;
import com.phillippitts.commandrouter.service.resolver.Resolution;
import com.phillippitts.commandrouter.util.EmailAddresses;
import org.springframework.stereotype.Component;

/**
 * Replaces spoken entity names in a command's slots with canonical directory values.
 *
 * <ul>
 *   <li>{@code recipient} against contacts for messaging, calls and payments
 *       (literal phone numbers and UPI ids pass through)</li>
 *   <li>{@code recipient} against emails for email, unless it already is an address</li>
 *   <li>{@code app} against applications for app launch</li>
 * </ul>
 * The name as spoken is kept in {@code recipient_name} / {@code app_name}; the canonical label
 * goes to {@code recipient_label} / {@code app_label}.
 */
@Component
public class SlotResolver {

    private final EntityResolver resolver;
    private final DirectoryRegistry directories;

    public SlotResolver(EntityResolver resolver, DirectoryRegistry directories) {
        this.resolver = resolver;
        this.directories = directories;
    }

    /**
     * @throws EntityNotFoundException if a name slot has no match in its directory
     */
    public ParsedCommand resolve(ParsedCommand command) {
        return switch (command.intent()) {
            case MESSAGING, PHONE_CALL -> isPhoneNumber(command.slot(SlotNames.RECIPIENT))
                    ? command
                    : resolveRecipient(command, directories.contacts());
            case PAYMENT -> {
                String recipient = command.slot(SlotNames.RECIPIENT);
                yield recipient != null && (recipient.contains("@") || isPhoneNumber(recipient))
                        ? command
                        : resolveRecipient(command, directories.contacts());
            }
            case EMAIL -> resolveEmail(command);
            case APP_LAUNCH -> resolveSlot(command, SlotNames.APP, SlotNames.APP_NAME, SlotNames.APP_LABEL,
                    directories.applications());
            default -> command;
        };
    }

    private ParsedCommand resolveEmail(ParsedCommand command) {
        String recipient = command.slot(SlotNames.RECIPIENT);
        if (recipient == null) {
            return command;
        }
        String normalized = EmailAddresses.normalize(recipient);
        if (EmailAddresses.isAddress(normalized)) {
            return command.withSlot(SlotNames.RECIPIENT, normalized);
        }
        return resolveRecipient(command, directories.emails());
    }

    private ParsedCommand resolveRecipient(ParsedCommand command, CandidateDirectory directory) {
        return resolveSlot(command, SlotNames.RECIPIENT, SlotNames.RECIPIENT_NAME, SlotNames.RECIPIENT_LABEL, directory);
    }

    private ParsedCommand resolveSlot(ParsedCommand command, String slot, String nameSlot, String labelSlot,
                                      CandidateDirectory directory) {
        String spoken = command.slot(slot);
        if (spoken == null || spoken.isBlank()) {
            // The executor reports the missing slot
            return command;
        }
        Resolution resolution = resolver.resolve(spoken, directory);
        CanonicalEntry entry = resolution.match()
                .orElseThrow(() -> new EntityNotFoundException(spoken, directory.name()));
        return command.withSlot(slot, entry.value())
                .withSlot(nameSlot, spoken.trim())
                .withSlot(labelSlot, entry.label());
    }

    static boolean isPhoneNumber(String value) {
        return value != null && value.matches("\\+?[\\d\\s\\-()]{7,}");
    }
}
