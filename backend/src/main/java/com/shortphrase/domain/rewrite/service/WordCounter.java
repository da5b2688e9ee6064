package com.shortphrase.domain.rewrite.service;

import java.util.regex.Pattern;

/**
 * Counts whitespace-delimited tokens. Punctuation attached to a word does not
 * make a separate word; a standalone punctuation token does count.
 */
public final class WordCounter {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private WordCounter() {
    }

    public static int count(String text) {
        if (text == null) {
            return 0;
        }
        String stripped = text.strip();
        if (stripped.isEmpty()) {
            return 0;
        }
        return WHITESPACE.split(stripped).length;
    }

    public static String[] words(String text) {
        if (text == null || text.isBlank()) {
            return new String[0];
        }
        return WHITESPACE.split(text.strip());
    }
}
