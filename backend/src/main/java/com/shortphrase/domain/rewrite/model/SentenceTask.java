package com.shortphrase.domain.rewrite.model;

import lombok.Getter;

/**
 * One unit of work in a document run.
 * Owned by the orchestrator; batch workers only read the immutable fields.
 */
@Getter
public class SentenceTask {

    private final int index;
    private final String originalSentence;
    private final String text;
    private final int wordCount;

    private TaskStatus status = TaskStatus.PENDING;
    private RewriteCandidate candidate;
    private boolean flaggedForReview;
    private String note;

    /**
     * @param index            position in the input list
     * @param originalSentence sentence exactly as supplied
     * @param text             cleaned text used for routing and rewriting
     * @param wordCount        word count of {@code text}
     */
    public SentenceTask(int index, String originalSentence, String text, int wordCount) {
        this.index = index;
        this.originalSentence = originalSentence;
        this.text = text;
        this.wordCount = wordCount;
    }

    public void markStatus(TaskStatus status) {
        if (isResolved()) {
            throw new IllegalStateException("Task " + index + " is already resolved as " + this.status);
        }
        this.status = status;
    }

    public void resolve(TaskStatus status, RewriteCandidate candidate, String note) {
        markStatus(status);
        this.candidate = candidate;
        this.note = note;
    }

    /**
     * Resolve through the mechanical fallback; the result is flagged for quality review.
     */
    public void resolveForReview(RewriteCandidate candidate, String note) {
        resolve(TaskStatus.FALLBACK, candidate, note);
        this.flaggedForReview = true;
    }

    public boolean isResolved() {
        return candidate != null;
    }

    public SentenceRewrite toRewrite() {
        if (!isResolved()) {
            throw new IllegalStateException("Task " + index + " has no result yet (status " + status + ")");
        }
        return new SentenceRewrite(
                index,
                originalSentence,
                candidate.fragments(),
                candidate.provenance(),
                wordCount,
                !flaggedForReview,
                status,
                flaggedForReview,
                note
        );
    }
}
