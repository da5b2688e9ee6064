package com.shortphrase.infrastructure.ai;

import com.shortphrase.domain.rewrite.exception.FatalOracleException;
import com.shortphrase.domain.rewrite.exception.OracleException;
import com.shortphrase.domain.rewrite.exception.TransientOracleException;
import com.shortphrase.domain.rewrite.model.BatchComplexityClass;
import com.shortphrase.domain.rewrite.model.OracleItem;
import com.shortphrase.domain.rewrite.model.OracleRequest;
import com.shortphrase.domain.rewrite.model.OracleResponse;
import com.shortphrase.domain.rewrite.model.RejectionReason;
import com.shortphrase.domain.rewrite.model.SentenceTask;
import com.shortphrase.domain.rewrite.service.RewritingOracle;
import com.shortphrase.infrastructure.ai.batching.SentenceBatch;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Drives a {@link RewritingOracle} through the retry policy. Never throws for oracle
 * failures: the outcome says whether the batch completed, failed fatally or ran out
 * of attempts, and carries one call record per attempt. Safe to call from several
 * worker threads at once.
 */
@Slf4j
public class OracleClient {

    private final RewritingOracle oracle;
    private final RetryPolicy retryPolicy;
    private final BackoffSleeper sleeper;

    public OracleClient(RewritingOracle oracle, RetryPolicy retryPolicy, BackoffSleeper sleeper) {
        this.oracle = oracle;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    public String providerName() {
        return oracle.name();
    }

    public OracleBatchOutcome submit(SentenceBatch batch, int limit) {
        return execute(OracleRequest.batch(batch.sentences(), limit, batch.complexity()),
                "batch #" + batch.sequence());
    }

    /**
     * Single-sentence re-request citing why the previous answer was rejected.
     */
    public OracleBatchOutcome submitStrict(SentenceTask task, BatchComplexityClass complexity,
                                           int limit, RejectionReason previousRejection) {
        return execute(OracleRequest.strict(task.getText(), limit, complexity, previousRejection),
                "strict retry of sentence " + task.getIndex());
    }

    private OracleBatchOutcome execute(OracleRequest request, String label) {
        List<OracleCallRecord> calls = new ArrayList<>();
        int expected = request.sentences().size();

        for (int attempt = 1; ; attempt++) {
            long start = System.nanoTime();
            OracleException failure;
            try {
                OracleResponse response = oracle.rewrite(request);
                calls.add(OracleCallRecord.success(oracle.name(), response.usage(), since(start)));
                return OracleBatchOutcome.completed(alignItems(response.items(), expected, label), calls);
            } catch (FatalOracleException e) {
                calls.add(OracleCallRecord.failure(oracle.name(), since(start)));
                log.error("Fatal {} error on {}: {}", oracle.name(), label, e.getMessage());
                return OracleBatchOutcome.fatal(e, calls);
            } catch (TransientOracleException e) {
                failure = e;
            } catch (RuntimeException e) {
                failure = new TransientOracleException("Unexpected oracle failure: " + e.getMessage(), e);
            }

            calls.add(OracleCallRecord.failure(oracle.name(), since(start)));
            if (!retryPolicy.canRetry(attempt)) {
                log.warn("Giving up on {} after {} attempts: {}", label, attempt, failure.getMessage());
                return OracleBatchOutcome.exhausted(failure, calls);
            }

            long delay = retryPolicy.delayBeforeRetry(attempt, ThreadLocalRandom.current().nextDouble());
            log.warn("Attempt {}/{} of {} failed ({}), retrying in {} ms",
                    attempt, retryPolicy.maxAttempts(), label, failure.getMessage(), delay);
            if (!sleeper.sleep(delay)) {
                log.warn("Backoff for {} interrupted, giving up", label);
                return OracleBatchOutcome.exhausted(failure, calls);
            }
        }
    }

    // A response with missing or surplus entries only affects the sentences concerned
    private static List<OracleItem> alignItems(List<OracleItem> items, int expected, String label) {
        if (items.size() == expected) {
            return items;
        }
        log.warn("Oracle returned {} items for {} sentences on {}", items.size(), expected, label);
        List<OracleItem> aligned = new ArrayList<>(items.subList(0, Math.min(items.size(), expected)));
        while (aligned.size() < expected) {
            aligned.add(OracleItem.malformed("missing from response"));
        }
        return aligned;
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
