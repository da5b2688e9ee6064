package com.shortphrase.domain.rewrite.model;

/**
 * Token usage reported by a provider for one call.
 */
public record OracleUsage(long inputTokens, long outputTokens) {

    public static final OracleUsage NONE = new OracleUsage(0, 0);

    public long totalTokens() {
        return inputTokens + outputTokens;
    }
}
