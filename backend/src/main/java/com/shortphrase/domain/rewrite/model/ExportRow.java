package com.shortphrase.domain.rewrite.model;

/**
 * One output fragment flattened for tabular export.
 */
public record ExportRow(
        int row,
        String sentence,
        String original,
        String method,
        int wordCount
) {}
