package com.shortphrase.domain.rewrite.model;

import java.util.List;

/**
 * Input of one document run.
 *
 * @param sentences ordered, already boundary-split sentences
 * @param wordLimit maximum words per output fragment (must be positive)
 * @param mode      oracle rewriting or mechanical chunking only
 */
public record RewriteCommand(
        List<String> sentences,
        int wordLimit,
        ProcessingMode mode
) {
    public static RewriteCommand of(List<String> sentences, int wordLimit) {
        return new RewriteCommand(sentences, wordLimit, ProcessingMode.ORACLE_REWRITE);
    }
}
