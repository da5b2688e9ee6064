package com.shortphrase.infrastructure.ai;

import com.shortphrase.domain.rewrite.model.OracleUsage;

import java.time.Duration;

/**
 * Accounting for exactly one oracle attempt, retries included.
 */
public record OracleCallRecord(
        String provider,
        long inputTokens,
        long outputTokens,
        boolean success,
        Duration latency
) {
    public static OracleCallRecord success(String provider, OracleUsage usage, Duration latency) {
        return new OracleCallRecord(provider, usage.inputTokens(), usage.outputTokens(), true, latency);
    }

    public static OracleCallRecord failure(String provider, Duration latency) {
        return new OracleCallRecord(provider, 0, 0, false, latency);
    }
}
