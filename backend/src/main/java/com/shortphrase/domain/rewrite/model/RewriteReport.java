package com.shortphrase.domain.rewrite.model;

import com.shortphrase.domain.rewrite.service.WordCounter;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a document run.
 *
 * @param results   one record per completed input sentence, in input order
 * @param metrics   final counters
 * @param warnings  run-level warnings (e.g. oracle credentials rejected), each reported once
 * @param cancelled true if the run stopped early; results then cover completed sentences only
 */
public record RewriteReport(
        List<SentenceRewrite> results,
        RunMetricsSnapshot metrics,
        List<String> warnings,
        boolean cancelled
) {
    public RewriteReport {
        results = List.copyOf(results);
        warnings = List.copyOf(warnings);
    }

    public int totalFragments() {
        return results.stream().mapToInt(r -> r.outputFragments().size()).sum();
    }

    public List<String> allFragments() {
        return results.stream().flatMap(r -> r.outputFragments().stream()).toList();
    }

    /**
     * Flatten results into one row per output fragment, numbered from 1.
     * The original sentence and method are left blank for direct pass-through rows.
     */
    public List<ExportRow> toExportRows() {
        List<ExportRow> rows = new ArrayList<>();
        int row = 1;
        for (SentenceRewrite result : results) {
            boolean direct = result.status() == TaskStatus.ROUTED_DIRECT;
            for (String fragment : result.outputFragments()) {
                rows.add(new ExportRow(
                        row++,
                        fragment,
                        direct ? "" : result.originalSentence(),
                        direct ? "" : result.methodLabel(),
                        WordCounter.count(fragment)));
            }
        }
        return rows;
    }
}
