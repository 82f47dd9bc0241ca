package com.phillippitts.commandrouter.service.workflow;

import com.phillippitts.commandrouter.domain.IntentCategory;
import com.phillippitts.commandrouter.domain.ParsedCommand;
import com.phillippitts.commandrouter.exception.EntityNotFoundException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlotResolverTest {

    private final SlotResolver resolver = WorkflowTestSupport.slotResolver();

    private static ParsedCommand command(IntentCategory intent, String slot, String value) {
        return new ParsedCommand(intent, 0.9, Map.of(slot, value), "");
    }

    @Test
    void contextWordIsStrippedFromSpokenContact() {
        ParsedCommand resolved = resolver.resolve(command(IntentCategory.PHONE_CALL, "recipient", "Shivam clg"));

        assertThat(resolved.slot("recipient")).isEqualTo("+919876543219");
        assertThat(resolved.slot("recipient_name")).isEqualTo("Shivam clg");
        assertThat(resolved.slot("recipient_label")).isEqualTo("Shivam Patel");
    }

    @Test
    void literalPhoneNumberPassesThrough() {
        ParsedCommand cmd = command(IntentCategory.MESSAGING, "recipient", "+91 98765 43210");

        assertThat(resolver.resolve(cmd)).isSameAs(cmd);
    }

    @Test
    void upiIdPassesThroughForPayments() {
        ParsedCommand cmd = command(IntentCategory.PAYMENT, "recipient", "jay@okaxis");

        assertThat(resolver.resolve(cmd)).isSameAs(cmd);
    }

    @Test
    void emailRecipientResolvesAgainstEmailDirectory() {
        ParsedCommand resolved = resolver.resolve(command(IntentCategory.EMAIL, "recipient", "Vijay"));

        assertThat(resolved.slot("recipient")).isEqualTo("vijaysharma@gmail.com");
        assertThat(resolved.slot("recipient_name")).isEqualTo("Vijay");
        assertThat(resolved.slot("recipient_label")).isEqualTo("Vijay Sharma");
    }

    @Test
    void appNameResolvesAgainstApplications() {
        ParsedCommand resolved = resolver.resolve(command(IntentCategory.APP_LAUNCH, "app", "Chrome"));

        assertThat(resolved.slot("app")).isEqualTo("chrome");
        assertThat(resolved.slot("app_name")).isEqualTo("Chrome");
        assertThat(resolved.slot("app_label")).isEqualTo("Chrome");
    }

    @Test
    void unknownNameThrowsWithDirectory() {
        assertThatThrownBy(() -> resolver.resolve(command(IntentCategory.MESSAGING, "recipient", "Zed")))
                .isInstanceOf(EntityNotFoundException.class)
                .satisfies(e -> assertThat(((EntityNotFoundException) e).getDirectory()).isEqualTo("contacts"));
    }

    @Test
    void intentsWithoutNamesAreUntouched() {
        ParsedCommand cmd = command(IntentCategory.WEB_SEARCH, "query", "Jay");

        assertThat(resolver.resolve(cmd)).isSameAs(cmd);
    }

    @Test
    void phoneNumberDetection() {
        assertThat(SlotResolver.isPhoneNumber("+919321781905")).isTrue();
        assertThat(SlotResolver.isPhoneNumber("(022) 555-1234")).isTrue();
        assertThat(SlotResolver.isPhoneNumber("mom")).isFalse();
        assertThat(SlotResolver.isPhoneNumber(null)).isFalse();
    }
}
