package com.shortphrase.domain.rewrite.model;

/**
 * Outcome of a provider credential check.
 */
public record AccessCheckResult(String provider, Status status, String message) {

    public enum Status {
        VALID,
        INVALID_KEY,
        QUOTA_EXCEEDED,
        ERROR
    }

    public boolean isValid() {
        return status == Status.VALID;
    }
}
