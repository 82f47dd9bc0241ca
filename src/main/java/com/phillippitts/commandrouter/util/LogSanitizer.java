package com.phillippitts.commandrouter.util;

/** Utility for privacy-safe logging of utterance previews and identifiers. */
public final class LogSanitizer {

    /** Default preview length for utterances in log lines. */
    public static final int PREVIEW_LENGTH = 40;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    public static String preview(String utterance) {
        return truncate(utterance, PREVIEW_LENGTH);
    }

    /**
     * Masks all but the last two digits of a phone number or payment handle.
     */
    public static String maskDigits(String s) {
        if (s == null) {
            return "";
        }
        int digits = 0;
        for (int i = 0; i < s.length(); i++) {
            if (Character.isDigit(s.charAt(i))) {
                digits++;
            }
        }
        StringBuilder out = new StringBuilder(s.length());
        int seen = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isDigit(c)) {
                seen++;
                out.append(seen > digits - 2 ? c : '*');
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }
}
