package com.shortphrase.infrastructure.ai.cache;

import com.shortphrase.domain.rewrite.model.Provenance;
import com.shortphrase.domain.rewrite.model.RewriteCandidate;
import com.shortphrase.domain.rewrite.service.WordCounter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Process-wide LRU cache of validated oracle rewrites.
 * Keys are sentences with case folded and whitespace collapsed; each entry remembers
 * the word limit it was produced for and is served only to requests with the same
 * or a looser limit.
 */
@Slf4j
public class RewriteCache {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private final int capacity;
    private final LinkedHashMap<String, CacheEntry> entries;

    private long hits;
    private long misses;
    private long evictions;

    private record CacheEntry(RewriteCandidate candidate, int wordLimit) {}

    public RewriteCache(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CacheEntry> eldest) {
                if (size() > RewriteCache.this.capacity) {
                    evictions++;
                    log.debug("Evicting cached rewrite (limit {}), capacity {}", eldest.getValue().wordLimit(),
                            RewriteCache.this.capacity);
                    return true;
                }
                return false;
            }
        };
    }

    /**
     * Normalization applied to cache keys: case folding and whitespace collapsing only.
     */
    public static String normalizeKey(String sentence) {
        return WHITESPACE_RUN.matcher(sentence.strip()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    public synchronized Optional<RewriteCandidate> lookup(String sentence, int wordLimit) {
        CacheEntry entry = entries.get(normalizeKey(sentence));
        if (entry == null || entry.wordLimit() > wordLimit) {
            misses++;
            return Optional.empty();
        }
        hits++;
        return Optional.of(entry.candidate());
    }

    /**
     * Store a validated oracle rewrite, replacing any previous entry for the same sentence.
     *
     * @throws IllegalArgumentException if the candidate is not an oracle rewrite or breaks the limit
     */
    public synchronized void store(String sentence, int wordLimit, RewriteCandidate candidate) {
        if (candidate == null || candidate.provenance() != Provenance.ORACLE) {
            throw new IllegalArgumentException("Only oracle rewrites can be cached");
        }
        if (candidate.isEmpty()) {
            throw new IllegalArgumentException("Cannot cache an empty rewrite");
        }
        for (String fragment : candidate.fragments()) {
            if (WordCounter.count(fragment) > wordLimit) {
                throw new IllegalArgumentException(
                        "Fragment exceeds limit " + wordLimit + ": '" + fragment + "'");
            }
        }
        entries.put(normalizeKey(sentence), new CacheEntry(candidate, wordLimit));
    }

    public synchronized void clear() {
        entries.clear();
        hits = 0;
        misses = 0;
        evictions = 0;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized CacheStats stats() {
        return new CacheStats(entries.size(), capacity, hits, misses, evictions);
    }
}
