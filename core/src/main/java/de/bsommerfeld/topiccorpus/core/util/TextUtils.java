package de.bsommerfeld.topiccorpus.core.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Small string helpers shared across modules.
 */
public final class TextUtils {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private TextUtils() {
    }

    /**
     * Replaces line breaks with spaces, collapses whitespace runs and trims.
     * {@code null} becomes the empty string.
     */
    public static String cleanText(String text) {
        if (text == null) {
            return "";
        }
        String flat = text.replace('\r', ' ').replace('\n', ' ');
        return WHITESPACE_RUN.matcher(flat).replaceAll(" ").trim();
    }

    /**
     * Trims every entry and drops blanks and case-insensitive duplicates.
     * The first spelling of each entry wins.
     */
    public static List<String> dedupeIgnoreCase(Collection<String> values) {
        List<String> out = new ArrayList<>();
        if (values == null) {
            return out;
        }
        Set<String> seen = new HashSet<>();
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (seen.add(trimmed.toLowerCase(Locale.ROOT))) {
                out.add(trimmed);
            }
        }
        return out;
    }

    /** {@code true} if every character is 7-bit ASCII. */
    public static boolean isAscii(String text) {
        return text.chars().allMatch(c -> c < 128);
    }
}
