package com.purchasingpower.schemaembed.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Normalizes and tokenizes rendered schema text.
 *
 * Steps, in order: lowercase, split on whitespace, split parentheses, commas
 * and semicolons off as standalone tokens, drop empty tokens, and optionally
 * remove stop words.
 *
 * Example: {@code "id INT, name varchar(50)"} becomes
 * {@code [id, int, ",", name, varchar, "(", 50, ")"]}.
 *
 * @since 1.0.0
 */
public class SchemaTokenizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final String PUNCTUATION = "(),;";

    /**
     * Fixed English stop words. Keeps SQL words the generators weight
     * (on, set, null, key, references...) out of the list.
     */
    public static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "and", "or", "of", "to", "in", "is", "it",
            "for", "with", "as", "at", "by", "be", "this", "that");

    private final boolean removeStopWords;

    public SchemaTokenizer() {
        this(false);
    }

    public SchemaTokenizer(boolean removeStopWords) {
        this.removeStopWords = removeStopWords;
    }

    public List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }

        List<String> tokens = new ArrayList<>();
        for (String chunk : WHITESPACE.split(text.toLowerCase(Locale.ROOT))) {
            splitPunctuation(chunk, tokens);
        }

        if (removeStopWords) {
            tokens.removeIf(STOP_WORDS::contains);
        }
        return tokens;
    }

    public boolean isRemoveStopWords() {
        return removeStopWords;
    }

    private void splitPunctuation(String chunk, List<String> out) {
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < chunk.length(); i++) {
            char c = chunk.charAt(i);
            if (PUNCTUATION.indexOf(c) >= 0) {
                flush(current, out);
                out.add(String.valueOf(c));
            } else {
                current.append(c);
            }
        }
        flush(current, out);
    }

    private void flush(StringBuilder current, List<String> out) {
        if (current.length() > 0) {
            out.add(current.toString());
            current.setLength(0);
        }
    }
}
