package com.shortphrase.infrastructure.ai.chunking;

import com.shortphrase.domain.rewrite.service.WordCounter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a sentence into consecutive word windows of at most {@code limit} words.
 * Words are never altered, dropped or reordered: joining the chunks with single
 * spaces gives back the whitespace-normalized input.
 *
 * <p>With clause breaks preferred, a chunk is closed after clause punctuation
 * ({@code , ; : . ! ?}) whenever the whole clause fits; clauses longer than the
 * limit are cut into fixed windows.</p>
 */
@Slf4j
public class DeterministicChunker {

    // Word ending a clause, allowing closing quotes or brackets after the mark
    private static final Pattern CLAUSE_END = Pattern.compile(".*[,;:.!?…][\"')\\]]*$");

    private final boolean preferClauseBreaks;

    public DeterministicChunker(boolean preferClauseBreaks) {
        this.preferClauseBreaks = preferClauseBreaks;
    }

    public List<String> chunk(String text, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        String[] words = WordCounter.words(text);
        if (words.length == 0) {
            return List.of();
        }
        if (words.length <= limit) {
            return List.of(String.join(" ", words));
        }

        List<String> chunks = preferClauseBreaks
                ? chunkAtClauseBreaks(words, limit)
                : fixedWindows(Arrays.asList(words), limit, new ArrayList<>());
        log.debug("Chunked {} words into {} pieces (limit {})", words.length, chunks.size(), limit);
        return chunks;
    }

    private List<String> chunkAtClauseBreaks(String[] words, int limit) {
        List<String> chunks = new ArrayList<>();
        List<String> current = new ArrayList<>();

        for (List<String> clause : splitClauses(words)) {
            if (clause.size() > limit) {
                flush(current, chunks);
                fixedWindows(clause, limit, chunks);
            } else if (current.size() + clause.size() <= limit) {
                current.addAll(clause);
            } else {
                flush(current, chunks);
                current.addAll(clause);
            }
        }
        flush(current, chunks);
        return chunks;
    }

    private List<List<String>> splitClauses(String[] words) {
        List<List<String>> clauses = new ArrayList<>();
        List<String> clause = new ArrayList<>();
        for (String word : words) {
            clause.add(word);
            if (CLAUSE_END.matcher(word).matches()) {
                clauses.add(clause);
                clause = new ArrayList<>();
            }
        }
        if (!clause.isEmpty()) {
            clauses.add(clause);
        }
        return clauses;
    }

    private static List<String> fixedWindows(List<String> words, int limit, List<String> into) {
        for (int i = 0; i < words.size(); i += limit) {
            into.add(String.join(" ", words.subList(i, Math.min(i + limit, words.size()))));
        }
        return into;
    }

    private static void flush(List<String> current, List<String> chunks) {
        if (!current.isEmpty()) {
            chunks.add(String.join(" ", current));
            current.clear();
        }
    }
}
