package de.bsommerfeld.topiccorpus.core.text;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into words the way a POSIX shell does: whitespace separates
 * words, single and double quotes group a phrase into one word, and a
 * backslash escapes the next character (inside double quotes only {@code "}
 * and {@code \}).
 */
public final class ShellSplitter {

    private ShellSplitter() {
    }

    /**
     * @throws IllegalArgumentException if a quote is left open or the text
     *                                  ends with a dangling backslash
     */
    public static List<String> split(String text) {
        List<String> words = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inWord = false;
        char quote = 0;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);

            if (quote == '\'') {
                if (c == '\'') {
                    quote = 0;
                } else {
                    current.append(c);
                }
                continue;
            }

            if (quote == '"') {
                if (c == '"') {
                    quote = 0;
                } else if (c == '\\' && i + 1 < text.length()
                        && (text.charAt(i + 1) == '"' || text.charAt(i + 1) == '\\')) {
                    current.append(text.charAt(++i));
                } else {
                    current.append(c);
                }
                continue;
            }

            if (Character.isWhitespace(c)) {
                if (inWord) {
                    words.add(current.toString());
                    current.setLength(0);
                    inWord = false;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
                inWord = true;
            } else if (c == '\\') {
                if (i + 1 >= text.length()) {
                    throw new IllegalArgumentException("No escaped character");
                }
                current.append(text.charAt(++i));
                inWord = true;
            } else {
                current.append(c);
                inWord = true;
            }
        }

        if (quote != 0) {
            throw new IllegalArgumentException("No closing quotation");
        }
        if (inWord) {
            words.add(current.toString());
        }
        return words;
    }
}
