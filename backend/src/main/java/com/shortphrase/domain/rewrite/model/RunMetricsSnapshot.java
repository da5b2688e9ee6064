package com.shortphrase.domain.rewrite.model;

import java.time.Duration;
import java.util.Map;

/**
 * Point-in-time copy of a run's counters, safe to hand to other threads.
 */
public record RunMetricsSnapshot(
        long sentencesSeen,
        long directPassThroughs,
        long oracleSuccesses,
        long mechanicalRouted,
        long mechanicalFallbacks,
        long cacheHits,
        long cacheMisses,
        long oracleCalls,
        long successfulOracleCalls,
        long failedOracleCalls,
        long validationRetries,
        Map<RejectionReason, Long> rejections,
        long inputTokens,
        long outputTokens,
        double estimatedCostUsd,
        long fatalErrorWarnings,
        long batches,
        long batchedSentences,
        Map<RunPhase, Duration> phaseDurations,
        Duration elapsed
) {
    public RunMetricsSnapshot {
        rejections = Map.copyOf(rejections);
        phaseDurations = Map.copyOf(phaseDurations);
    }

    public double cacheHitRate() {
        long lookups = cacheHits + cacheMisses;
        return lookups > 0 ? (double) cacheHits / lookups * 100 : 0;
    }

    public double averageBatchSize() {
        return batches > 0 ? (double) batchedSentences / batches : 0;
    }

    public long totalTokens() {
        return inputTokens + outputTokens;
    }

    public double sentencesPerSecond() {
        double seconds = elapsed.toMillis() / 1000.0;
        return seconds > 0 ? sentencesSeen / seconds : 0;
    }
}
