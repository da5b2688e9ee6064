package com.shortphrase.domain.rewrite.model;

import java.util.List;

/**
 * One oracle call.
 *
 * @param sentences          sentences to rewrite, in order
 * @param wordLimit          maximum words per output fragment
 * @param complexity         batch complexity class, used for prompt framing
 * @param previousRejection  reason the previous answer was rejected; only set on strict re-requests
 */
public record OracleRequest(
        List<String> sentences,
        int wordLimit,
        BatchComplexityClass complexity,
        RejectionReason previousRejection
) {
    public OracleRequest {
        sentences = List.copyOf(sentences);
    }

    public static OracleRequest batch(List<String> sentences, int wordLimit, BatchComplexityClass complexity) {
        return new OracleRequest(sentences, wordLimit, complexity, null);
    }

    public static OracleRequest strict(String sentence, int wordLimit, BatchComplexityClass complexity,
                                       RejectionReason previousRejection) {
        return new OracleRequest(List.of(sentence), wordLimit, complexity, previousRejection);
    }

    public boolean isStrict() {
        return previousRejection != null;
    }
}
