package com.shortphrase.infrastructure.ai.pipeline;

import com.shortphrase.domain.rewrite.model.RejectionReason;
import com.shortphrase.domain.rewrite.model.RunMetricsSnapshot;
import com.shortphrase.domain.rewrite.model.RunPhase;
import com.shortphrase.infrastructure.ai.OracleCallRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Counters of one document run. Written by the thread driving the run;
 * {@link #snapshot()} may be called from any thread.
 */
@Slf4j
public class RunMetrics {

    private final AtomicLong sentencesSeen = new AtomicLong();
    private final AtomicLong directPassThroughs = new AtomicLong();
    private final AtomicLong oracleSuccesses = new AtomicLong();
    private final AtomicLong mechanicalRouted = new AtomicLong();
    private final AtomicLong mechanicalFallbacks = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final AtomicLong oracleCalls = new AtomicLong();
    private final AtomicLong successfulOracleCalls = new AtomicLong();
    private final AtomicLong failedOracleCalls = new AtomicLong();
    private final AtomicLong validationRetries = new AtomicLong();
    private final AtomicLong inputTokens = new AtomicLong();
    private final AtomicLong outputTokens = new AtomicLong();
    private final DoubleAdder estimatedCostUsd = new DoubleAdder();
    private final AtomicLong fatalErrorWarnings = new AtomicLong();
    private final AtomicLong batches = new AtomicLong();
    private final AtomicLong batchedSentences = new AtomicLong();
    private final Map<RejectionReason, AtomicLong> rejections = new EnumMap<>(RejectionReason.class);
    private final Map<RunPhase, AtomicLong> phaseNanos = new EnumMap<>(RunPhase.class);

    private volatile long startNanos = System.nanoTime();
    private volatile long endNanos = -1;

    public RunMetrics() {
        for (RejectionReason reason : RejectionReason.values()) {
            rejections.put(reason, new AtomicLong());
        }
        for (RunPhase phase : RunPhase.values()) {
            phaseNanos.put(phase, new AtomicLong());
        }
    }

    public void start() {
        startNanos = System.nanoTime();
        endNanos = -1;
    }

    public void finish() {
        endNanos = System.nanoTime();
    }

    public void recordSentence() {
        sentencesSeen.incrementAndGet();
    }

    public void recordDirect() {
        directPassThroughs.incrementAndGet();
    }

    public void recordOracleSuccess() {
        oracleSuccesses.incrementAndGet();
    }

    public void recordMechanicalRouted() {
        mechanicalRouted.incrementAndGet();
    }

    public void recordMechanicalFallback() {
        mechanicalFallbacks.incrementAndGet();
    }

    public void recordCacheHit() {
        cacheHits.incrementAndGet();
    }

    public void recordCacheMiss() {
        cacheMisses.incrementAndGet();
    }

    public void recordValidationRetry() {
        validationRetries.incrementAndGet();
    }

    public void recordRejection(RejectionReason reason) {
        rejections.get(reason).incrementAndGet();
    }

    public void recordFatalWarning() {
        fatalErrorWarnings.incrementAndGet();
    }

    public void recordBatch(int size) {
        batches.incrementAndGet();
        batchedSentences.addAndGet(size);
    }

    /**
     * Fold one oracle attempt into the totals.
     */
    public void recordCall(OracleCallRecord call, double costUsd) {
        oracleCalls.incrementAndGet();
        if (call.success()) {
            successfulOracleCalls.incrementAndGet();
        } else {
            failedOracleCalls.incrementAndGet();
        }
        inputTokens.addAndGet(call.inputTokens());
        outputTokens.addAndGet(call.outputTokens());
        estimatedCostUsd.add(costUsd);
    }

    public void addPhaseTime(RunPhase phase, long nanos) {
        phaseNanos.get(phase).addAndGet(nanos);
    }

    public RunMetricsSnapshot snapshot() {
        Map<RejectionReason, Long> rejectionCounts = new EnumMap<>(RejectionReason.class);
        rejections.forEach((reason, count) -> rejectionCounts.put(reason, count.get()));
        Map<RunPhase, Duration> phaseDurations = new EnumMap<>(RunPhase.class);
        phaseNanos.forEach((phase, nanos) -> phaseDurations.put(phase, Duration.ofNanos(nanos.get())));

        long end = endNanos >= 0 ? endNanos : System.nanoTime();
        return new RunMetricsSnapshot(
                sentencesSeen.get(),
                directPassThroughs.get(),
                oracleSuccesses.get(),
                mechanicalRouted.get(),
                mechanicalFallbacks.get(),
                cacheHits.get(),
                cacheMisses.get(),
                oracleCalls.get(),
                successfulOracleCalls.get(),
                failedOracleCalls.get(),
                validationRetries.get(),
                rejectionCounts,
                inputTokens.get(),
                outputTokens.get(),
                estimatedCostUsd.sum(),
                fatalErrorWarnings.get(),
                batches.get(),
                batchedSentences.get(),
                phaseDurations,
                Duration.ofNanos(end - startNanos)
        );
    }

    public void logSummary() {
        RunMetricsSnapshot s = snapshot();
        log.info("Run summary - speed: {} sentences in {} ms ({}/s), {} batches (avg size {})",
                s.sentencesSeen(), s.elapsed().toMillis(), String.format("%.1f", s.sentencesPerSecond()),
                s.batches(), String.format("%.1f", s.averageBatchSize()));
        log.info("Run summary - efficiency: direct={}, cacheHits={}, cacheMisses={}, cacheHitRate={}%, oracleCalls={} (failed {})",
                s.directPassThroughs(), s.cacheHits(), s.cacheMisses(), String.format("%.1f", s.cacheHitRate()),
                s.oracleCalls(), s.failedOracleCalls());
        log.info("Run summary - quality: oracleRewritten={}, mechanicalRouted={}, fallbacks={}, validationRetries={}, rejections={}",
                s.oracleSuccesses(), s.mechanicalRouted(), s.mechanicalFallbacks(), s.validationRetries(), s.rejections());
        log.info("Run summary - cost: inputTokens={}, outputTokens={}, estimatedCost=${}",
                s.inputTokens(), s.outputTokens(), String.format("%.4f", s.estimatedCostUsd()));
    }
}
