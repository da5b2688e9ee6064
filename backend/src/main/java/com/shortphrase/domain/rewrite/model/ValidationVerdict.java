package com.shortphrase.domain.rewrite.model;

/**
 * Outcome of validating a candidate against its original sentence.
 *
 * @param accepted true if every check passed
 * @param reason   first failing check, null when accepted
 * @param detail   human-readable description of the failure (nullable)
 */
public record ValidationVerdict(
        boolean accepted,
        RejectionReason reason,
        String detail
) {
    private static final ValidationVerdict ACCEPTED = new ValidationVerdict(true, null, null);

    public static ValidationVerdict accept() {
        return ACCEPTED;
    }

    public static ValidationVerdict reject(RejectionReason reason, String detail) {
        return new ValidationVerdict(false, reason, detail);
    }

    public String describe() {
        return accepted ? "accepted" : reason + ": " + detail;
    }
}
