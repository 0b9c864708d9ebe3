package decentralabs.settlement.util;

import java.util.regex.Pattern;

/**
 * Makes user controlled values safe for log statements: strips line breaks, caps length and
 * masks wallet addresses.
 */
public final class LogSanitizer {

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\r\\n\\t]+");
    private static final int MAX_LOGGED_LENGTH = 256;

    private LogSanitizer() {
    }

    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = CONTROL_CHARS.matcher(value).replaceAll("_");
        if (cleaned.length() > MAX_LOGGED_LENGTH) {
            return cleaned.substring(0, MAX_LOGGED_LENGTH) + "...(" + cleaned.length() + " chars)";
        }
        return cleaned;
    }

    /**
     * Keeps a short prefix and suffix of an identifier, e.g. {@code 0x8335...2913}.
     */
    public static String maskIdentifier(String identifier) {
        String sanitized = sanitize(identifier);
        if (sanitized.isEmpty()) {
            return "";
        }
        if (sanitized.length() == 1) {
            return "*";
        }
        if (sanitized.length() <= 4) {
            return sanitized.charAt(0) + "***";
        }
        int prefixLength = Math.min(6, sanitized.length() / 2);
        int suffixLength = Math.min(4, Math.max(1, sanitized.length() - prefixLength));
        return sanitized.substring(0, prefixLength) + "..." + sanitized.substring(sanitized.length() - suffixLength);
    }
}
