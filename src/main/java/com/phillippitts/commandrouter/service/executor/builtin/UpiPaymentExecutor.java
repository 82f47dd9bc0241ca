package com.phillippitts.commandrouter.service.executor.builtin;

import com.phillippitts.commandrouter.config.properties.ExecutorProperties;
import com.phillippitts.commandrouter.domain.IntentCategory;
import com.phillippitts.commandrouter.service.executor.ActionExecutor;
import com.phillippitts.commandrouter.service.executor.ActionOutcome;
import com.phillippitts.commandrouter.service.executor.SlotNames;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Builds a {@code upi://pay} intent link. Nothing is paid until the user confirms in the app.
 *
 * <p>A recipient that is already a UPI id ({@code name@bank}) is used as-is; a phone number gets
 * the handle of the chosen app.
 */
@Component
public class UpiPaymentExecutor implements ActionExecutor {

    private static final Map<String, String> HANDLES = Map.of(
            "paytm", "@paytm",
            "phonepe", "@ybl",
            "phone pe", "@ybl",
            "gpay", "@okaxis",
            "google pay", "@okaxis",
            "bhim", "@upi",
            "upi", "@upi");

    private final String defaultApp;

    public UpiPaymentExecutor(ExecutorProperties properties) {
        this.defaultApp = properties.getDefaultPaymentApp().toLowerCase(Locale.ROOT);
    }

    @Override
    public String name() {
        return "upi";
    }

    @Override
    public IntentCategory intent() {
        return IntentCategory.PAYMENT;
    }

    @Override
    public String description() {
        return "Prepares a UPI payment";
    }

    @Override
    public ActionOutcome execute(Map<String, String> parameters) {
        String recipient = parameters.get(SlotNames.RECIPIENT);
        String name = Links.orDefault(parameters.get(SlotNames.RECIPIENT_NAME), recipient);
        BigDecimal amount = parseAmount(parameters.get(SlotNames.AMOUNT));
        if (amount == null) {
            return ActionOutcome.failure("I need a valid amount to pay.");
        }
        if (recipient == null || recipient.isBlank()) {
            return ActionOutcome.failure("Who should I pay?");
        }
        String app = Links.orDefault(parameters.get(SlotNames.APP), defaultApp).toLowerCase(Locale.ROOT);
        String payee;
        if (recipient.contains("@")) {
            payee = recipient.trim();
        } else {
            String digits = Links.digitsOnly(recipient);
            if (digits.isEmpty()) {
                return ActionOutcome.failure("I couldn't find a UPI id or number for " + name + ".");
            }
            // Drop the country code; UPI handles use the 10-digit mobile number
            String mobile = digits.length() > 10 ? digits.substring(digits.length() - 10) : digits;
            payee = mobile + HANDLES.getOrDefault(app, "@upi");
        }

        String url = "upi://pay?pa=" + Links.encode(payee)
                + "&pn=" + Links.encode(name)
                + "&am=" + amount.toPlainString()
                + "&cu=INR";

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("url", url);
        payload.put("payee", payee);
        payload.put("amount", amount.toPlainString());
        payload.put("app", app);
        return ActionOutcome.success("Payment of ₹" + amount.toPlainString() + " to " + name
                + " ready. Confirm it in " + app + ".", payload);
    }

    private static BigDecimal parseAmount(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            BigDecimal value = new BigDecimal(raw.replace(",", "").trim());
            return value.signum() > 0 ? value.stripTrailingZeros() : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
