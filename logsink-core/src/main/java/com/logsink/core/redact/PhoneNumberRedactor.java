package com.logsink.core.redact;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces telephone-number-shaped substrings with {@value #SENTINEL}.
 *
 * <p>Supported shapes: {@code (555) 123-4567}, {@code 555-123-4567} and {@code 555-0199}. All
 * three are alternatives of a single pattern scanned left to right, longest shape first, so a
 * ten-digit number is consumed whole instead of leaving {@code 555-} in front of a redacted
 * tail. The sentinel contains no digits, which makes the function idempotent.
 */
public final class PhoneNumberRedactor {

    public static final String SENTINEL = "[REDACTED]";

    private static final Pattern PHONE = Pattern.compile(
            "\\(\\d{3}\\)\\s*\\d{3}-\\d{4}" // (555) 123-4567
                    + "|\\d{3}-\\d{3}-\\d{4}" // 555-123-4567
                    + "|\\d{3}-\\d{4}"); // 555-0199

    private static final String REPLACEMENT = Matcher.quoteReplacement(SENTINEL);

    public String redact(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return PHONE.matcher(text).replaceAll(REPLACEMENT);
    }
}
