package com.shortphrase.infrastructure.ai.preprocessing;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Cleans OCR-extracted sentences before routing and rewriting:
 * - Unicode NFC normalization
 * - Invisible/control character removal
 * - De-hyphenation of words split across lines ("philo- sophe" → "philosophe")
 * - Quote and apostrophe normalization (’ “ ” « » → ' ")
 * - Spaced elision repair ("l ' été" → "l'été")
 * - Whitespace normalization (line breaks and runs collapse to one space, trim)
 */
@Component
public class TextNormalizer {

    // Zero-width and invisible Unicode characters
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    // Control characters except common whitespace (\n, \r, \t)
    private static final Pattern CONTROL_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]"
    );

    // Hyphen (or non-breaking hyphen) followed by a line break or spaces between two word characters
    private static final Pattern BROKEN_HYPHENATION = Pattern.compile(
            "(\\w)[-\\u2011]\\s+(\\w)", Pattern.UNICODE_CHARACTER_CLASS
    );

    // Single-letter French elisions with a detached apostrophe: "d ' accord"
    private static final Pattern SPACED_ELISION = Pattern.compile(
            "\\b([dljmtscnqDLJMTSCNQ])\\s*'\\s+(?=\\w)", Pattern.UNICODE_CHARACTER_CLASS
    );

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    /**
     * Normalize one sentence.
     *
     * @param text raw sentence
     * @return cleaned single-line sentence
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        // 1. Unicode NFC normalization
        String result = Normalizer.normalize(text, Normalizer.Form.NFC);

        // 2. Remove invisible characters
        result = INVISIBLE_CHARS.matcher(result).replaceAll("");

        // 3. Remove control characters (except \n, \r, \t)
        result = CONTROL_CHARS.matcher(result).replaceAll("");

        // 4. Non-breaking spaces are plain spaces
        result = result.replace('\u00A0', ' ').replace('\u202F', ' ');

        // 5. Rejoin words hyphenated across a line break
        result = BROKEN_HYPHENATION.matcher(result).replaceAll("$1$2");

        // 6. Normalize quotes and apostrophes
        result = result
                .replace('’', '\'')
                .replace('‘', '\'')
                .replace('“', '"')
                .replace('”', '"')
                .replace('«', '"')
                .replace('»', '"');

        // 7. Reattach detached elisions
        result = SPACED_ELISION.matcher(result).replaceAll("$1'");

        // 8. Collapse line breaks and space runs, trim
        result = WHITESPACE_RUN.matcher(result).replaceAll(" ").strip();

        return result;
    }
}
