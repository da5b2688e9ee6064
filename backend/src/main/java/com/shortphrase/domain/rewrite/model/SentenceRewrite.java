package com.shortphrase.domain.rewrite.model;

import java.util.List;

/**
 * Final per-sentence record handed to downstream export.
 *
 * @param index            position in the input list
 * @param originalSentence the sentence as supplied
 * @param outputFragments  compliant output sentences
 * @param provenance       where the fragments came from
 * @param wordCount        word count of the (cleaned) original
 * @param accepted         false when the sentence was resolved by fallback
 * @param status           terminal task status
 * @param flaggedForReview true when the output needs a quality review
 * @param note             why a non-default path was taken (nullable)
 */
public record SentenceRewrite(
        int index,
        String originalSentence,
        List<String> outputFragments,
        Provenance provenance,
        int wordCount,
        boolean accepted,
        TaskStatus status,
        boolean flaggedForReview,
        String note
) {
    public SentenceRewrite {
        outputFragments = List.copyOf(outputFragments);
    }

    public String methodLabel() {
        return switch (status) {
            case ROUTED_DIRECT -> "Direct";
            case CACHED -> "Oracle-Rewritten (cached)";
            case VALIDATED -> "Oracle-Rewritten";
            case ROUTED_MECHANICAL -> "Mechanical-Chunked";
            case FALLBACK -> "Mechanical-Chunked (fallback)";
            default -> status.name();
        };
    }
}
