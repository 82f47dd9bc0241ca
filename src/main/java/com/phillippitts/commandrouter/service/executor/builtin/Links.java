package com.phillippitts.commandrouter.service.executor.builtin;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * URL helpers shared by the link-building executors.
 */
final class Links {

    private Links() {
    }

    /** Percent-encodes a query value, using %20 for spaces. */
    static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    static String digitsOnly(String value) {
        return value == null ? "" : value.replaceAll("\\D", "");
    }

    static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    /** Appends a produced file reference to a message body. */
    static String withAttachment(String body, String attachment) {
        if (attachment == null || attachment.isBlank()) {
            return body == null ? "" : body;
        }
        String prefix = body == null || body.isBlank() ? "" : body + "\n\n";
        return prefix + "File: " + attachment;
    }
}
