package com.phillippitts.commandrouter.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes dictated email addresses ("jay at the rate gmail dot com").
 */
public final class EmailAddresses {

    private static final Pattern ADDRESS = Pattern.compile("^[\\w.+\\-]+@[\\w\\-]+(?:\\.[\\w\\-]+)+$");

    private EmailAddresses() {
    }

    /**
     * Rewrites spoken separators and removes inner spaces if the result looks like an address.
     * Anything else is returned trimmed and otherwise unchanged.
     */
    public static String normalize(String spoken) {
        if (spoken == null) {
            return "";
        }
        String s = spoken.trim();
        String rewritten = s.toLowerCase(Locale.ROOT)
                .replaceAll("\\s*\\bat the rate(?: of)?\\b\\s*", "@")
                .replaceAll("\\s*\\bdot\\b\\s*", ".")
                .replaceAll("\\s*@\\s*", "@");
        String compact = rewritten.replace(" ", "");
        return isAddress(compact) ? compact : s;
    }

    public static boolean isAddress(String s) {
        return s != null && ADDRESS.matcher(s).matches();
    }
}
