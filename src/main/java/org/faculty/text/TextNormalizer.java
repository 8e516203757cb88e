package org.faculty.text;

import java.util.regex.Pattern;

/**
 * Deterministic cleanup applied to every text before it is embedded.
 * <p>
 * Rules, in order:
 * - null is treated as the empty string
 * - every run of whitespace (including CR / LF) becomes one space
 * - ';' becomes ','
 * - leading and trailing whitespace is removed
 * <p>
 * Normalizing an already-normalized text returns it unchanged.
 */
public final class TextNormalizer {

    private static final Pattern WHITESPACE_RUN =
            Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String collapsed = WHITESPACE_RUN.matcher(text).replaceAll(" ");
        return collapsed.replace(';', ',').strip();
    }
}
