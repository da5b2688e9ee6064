package com.shortphrase.domain.rewrite.model;

/**
 * Intermediate state published while a run is in progress.
 *
 * @param completed    sentences with a final result so far
 * @param total        sentences in the run
 * @param lastSentence most recently completed sentence (nullable before any completes)
 * @param metrics      running totals
 * @param finished     true on the last event of the run
 */
public record RewriteProgressEvent(
        int completed,
        int total,
        String lastSentence,
        RunMetricsSnapshot metrics,
        boolean finished
) {
    public double percent() {
        return total > 0 ? (double) completed / total * 100 : 100;
    }
}
