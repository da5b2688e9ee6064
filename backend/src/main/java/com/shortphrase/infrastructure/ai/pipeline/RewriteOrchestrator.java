package com.shortphrase.infrastructure.ai.pipeline;

import com.shortphrase.domain.rewrite.exception.InvalidRewriteRequestException;
import com.shortphrase.domain.rewrite.model.BatchComplexityClass;
import com.shortphrase.domain.rewrite.model.OracleItem;
import com.shortphrase.domain.rewrite.model.ProcessingMode;
import com.shortphrase.domain.rewrite.model.RejectionReason;
import com.shortphrase.domain.rewrite.model.RewriteCandidate;
import com.shortphrase.domain.rewrite.model.RewriteCommand;
import com.shortphrase.domain.rewrite.model.RewriteProgressEvent;
import com.shortphrase.domain.rewrite.model.RewriteReport;
import com.shortphrase.domain.rewrite.model.RouteDecision;
import com.shortphrase.domain.rewrite.model.RunPhase;
import com.shortphrase.domain.rewrite.model.SentenceRewrite;
import com.shortphrase.domain.rewrite.model.SentenceTask;
import com.shortphrase.domain.rewrite.model.TaskStatus;
import com.shortphrase.domain.rewrite.model.ValidationVerdict;
import com.shortphrase.domain.rewrite.service.RewritingOracle;
import com.shortphrase.domain.rewrite.service.WordCounter;
import com.shortphrase.infrastructure.ai.BackoffSleeper;
import com.shortphrase.infrastructure.ai.CostRateTable;
import com.shortphrase.infrastructure.ai.OracleBatchOutcome;
import com.shortphrase.infrastructure.ai.OracleCallRecord;
import com.shortphrase.infrastructure.ai.OracleClient;
import com.shortphrase.infrastructure.ai.RetryPolicy;
import com.shortphrase.infrastructure.ai.batching.BatchScheduler;
import com.shortphrase.infrastructure.ai.batching.SentenceBatch;
import com.shortphrase.infrastructure.ai.cache.RewriteCache;
import com.shortphrase.infrastructure.ai.chunking.DeterministicChunker;
import com.shortphrase.infrastructure.ai.preprocessing.TextNormalizer;
import com.shortphrase.infrastructure.ai.routing.SentenceRouter;
import com.shortphrase.infrastructure.ai.validation.RewriteValidator;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs one document through the rewriting pipeline:
 * <p>
 * clean → route → cache lookup → batch → oracle (worker pool) → validate → strict retry? → fallback? → cache store
 * </p>
 * Oracle calls run on the executor with at most {@code maxConcurrentBatches} in flight.
 * Everything else, cache and metrics updates included, happens on the calling thread
 * as batches complete. Every sentence ends with output that respects the word limit.
 */
@Slf4j
public class RewriteOrchestrator {

    private final TextNormalizer textNormalizer;
    private final SentenceRouter router;
    private final DeterministicChunker chunker;
    private final RewriteCache cache;
    private final BatchScheduler scheduler;
    private final RewriteValidator validator;
    private final CostRateTable rateTable;
    private final RetryPolicy retryPolicy;
    private final BackoffSleeper sleeper;
    private final Executor oracleExecutor;
    private final int maxConcurrentBatches;
    private final boolean cleanInput;

    public RewriteOrchestrator(TextNormalizer textNormalizer,
                               SentenceRouter router,
                               DeterministicChunker chunker,
                               RewriteCache cache,
                               BatchScheduler scheduler,
                               RewriteValidator validator,
                               CostRateTable rateTable,
                               RetryPolicy retryPolicy,
                               BackoffSleeper sleeper,
                               Executor oracleExecutor,
                               int maxConcurrentBatches,
                               boolean cleanInput) {
        if (maxConcurrentBatches < 1) {
            throw new IllegalArgumentException("maxConcurrentBatches must be at least 1");
        }
        this.textNormalizer = textNormalizer;
        this.router = router;
        this.chunker = chunker;
        this.cache = cache;
        this.scheduler = scheduler;
        this.validator = validator;
        this.rateTable = rateTable;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.oracleExecutor = oracleExecutor;
        this.maxConcurrentBatches = maxConcurrentBatches;
        this.cleanInput = cleanInput;
    }

    public RewriteReport run(RewriteCommand command, RewritingOracle oracle) {
        return run(command, oracle, ProgressChannel.discarding(), CancellationToken.none());
    }

    /**
     * Process the command's sentences.
     *
     * @param oracle       rewriting service, may be null in MECHANICAL_ONLY mode
     * @param progress     receives events from the calling thread
     * @param cancellation checked before each batch submission
     * @throws InvalidRewriteRequestException if the command cannot be processed at all
     */
    public RewriteReport run(RewriteCommand command,
                             RewritingOracle oracle,
                             ProgressChannel progress,
                             CancellationToken cancellation) {
        validateCommand(command, oracle);

        String runId = UUID.randomUUID().toString().substring(0, 8);
        RewriteRunContext ctx = new RewriteRunContext(runId, command.wordLimit(), command.mode(),
                oracle, progress, cancellation);
        String previousRunId = MDC.get("runId");
        MDC.put("runId", runId);
        try {
            ctx.getMetrics().start();
            log.info("Rewrite run started - sentences: {}, wordLimit: {}, mode: {}, oracle: {}",
                    command.sentences().size(), command.wordLimit(), command.mode(),
                    oracle != null ? oracle.name() : "none");

            // 1. Clean, route, consult the cache
            List<SentenceTask> pending = routeAll(ctx, command.sentences());
            publishProgress(ctx, false);

            // 2. Oracle batches
            if (!pending.isEmpty()) {
                ctx.setOracleClient(new OracleClient(oracle, retryPolicy, sleeper));
                dispatch(ctx, scheduler.schedule(pending, ctx.getWordLimit()));
            }

            // 3. Reassemble by input index
            return finish(ctx);
        } finally {
            if (previousRunId != null) {
                MDC.put("runId", previousRunId);
            } else {
                MDC.remove("runId");
            }
        }
    }

    private void validateCommand(RewriteCommand command, RewritingOracle oracle) {
        if (command == null) {
            throw new InvalidRewriteRequestException("Rewrite command is required");
        }
        if (command.wordLimit() <= 0) {
            throw new InvalidRewriteRequestException("Word limit must be positive, got " + command.wordLimit());
        }
        if (command.sentences() == null) {
            throw new InvalidRewriteRequestException("Sentence list is required");
        }
        for (int i = 0; i < command.sentences().size(); i++) {
            if (command.sentences().get(i) == null) {
                throw new InvalidRewriteRequestException("Sentence " + i + " is null");
            }
        }
        if (command.mode() == null) {
            throw new InvalidRewriteRequestException("Processing mode is required");
        }
        if (command.mode() == ProcessingMode.ORACLE_REWRITE && oracle == null) {
            throw new InvalidRewriteRequestException("Oracle rewriting requested but no oracle is configured");
        }
    }

    // ===== Routing =====

    private List<SentenceTask> routeAll(RewriteRunContext ctx, List<String> sentences) {
        long start = System.nanoTime();
        int limit = ctx.getWordLimit();
        List<SentenceTask> pending = new ArrayList<>();

        for (int i = 0; i < sentences.size(); i++) {
            String raw = sentences.get(i);
            String text = cleanInput ? textNormalizer.normalize(raw) : raw;
            SentenceTask task = new SentenceTask(i, raw, text, WordCounter.count(text));
            ctx.getTasks().add(task);
            ctx.getMetrics().recordSentence();

            switch (decide(ctx, task)) {
                case DIRECT -> {
                    task.resolve(TaskStatus.ROUTED_DIRECT, RewriteCandidate.original(text), null);
                    ctx.getMetrics().recordDirect();
                    completed(ctx, task);
                }
                case MECHANICAL -> {
                    task.resolve(TaskStatus.ROUTED_MECHANICAL,
                            RewriteCandidate.mechanical(chunker.chunk(text, limit)),
                            ctx.getMode() == ProcessingMode.MECHANICAL_ONLY ? null : "not suited for oracle rewriting");
                    ctx.getMetrics().recordMechanicalRouted();
                    completed(ctx, task);
                }
                case ORACLE_CANDIDATE -> {
                    String key = RewriteCache.normalizeKey(text);
                    SentenceTask leader = ctx.getLeaders().get(key);
                    if (leader != null) {
                        ctx.addFollower(leader, task);
                        continue;
                    }
                    Optional<RewriteCandidate> cached = cache.lookup(text, limit);
                    if (cached.isPresent()) {
                        task.resolve(TaskStatus.CACHED, cached.get(), null);
                        ctx.getMetrics().recordCacheHit();
                        completed(ctx, task);
                    } else {
                        ctx.getMetrics().recordCacheMiss();
                        task.markStatus(TaskStatus.ROUTED_ORACLE);
                        ctx.getLeaders().put(key, task);
                        pending.add(task);
                    }
                }
            }
        }

        ctx.getMetrics().addPhaseTime(RunPhase.ROUTING, System.nanoTime() - start);
        log.info("Routing done - resolved: {}, awaiting oracle: {}, duplicates: {}",
                ctx.resolvedCount(), pending.size(), ctx.getTasks().size() - ctx.resolvedCount() - pending.size());
        return pending;
    }

    private RouteDecision decide(RewriteRunContext ctx, SentenceTask task) {
        if (ctx.getMode() == ProcessingMode.MECHANICAL_ONLY) {
            return task.getWordCount() <= ctx.getWordLimit() ? RouteDecision.DIRECT : RouteDecision.MECHANICAL;
        }
        return router.route(task.getWordCount(), task.getText(), ctx.getWordLimit());
    }

    // ===== Oracle dispatch =====

    private record DispatchedBatch(SentenceBatch batch, OracleBatchOutcome outcome) {}

    private void dispatch(RewriteRunContext ctx, List<SentenceBatch> batches) {
        long start = System.nanoTime();
        CompletionService<DispatchedBatch> completions = new ExecutorCompletionService<>(oracleExecutor);
        OracleClient client = ctx.getOracleClient();
        int limit = ctx.getWordLimit();
        Map<Future<DispatchedBatch>, SentenceBatch> inFlight = new HashMap<>();
        int next = 0;
        boolean interrupted = false;

        while (!inFlight.isEmpty() || (next < batches.size() && !ctx.isCancelled())) {
            while (!ctx.isCancelled() && inFlight.size() < maxConcurrentBatches && next < batches.size()) {
                if (ctx.getCancellation().isCancelled()) {
                    if (!ctx.isCancelled()) {
                        log.warn("Run cancelled - {} batches not submitted", batches.size() - next);
                    }
                    ctx.setCancelled(true);
                    break;
                }
                SentenceBatch batch = batches.get(next++);
                if (ctx.isOracleDisabled()) {
                    fallbackAll(ctx, batch.tasks(), "oracle disabled after a fatal error");
                    continue;
                }
                ctx.getMetrics().recordBatch(batch.size());
                try {
                    inFlight.put(completions.submit(() -> new DispatchedBatch(batch, client.submit(batch, limit))), batch);
                    log.info("Dispatched batch #{} - {} sentences, complexity {}, ~{} tokens",
                            batch.sequence(), batch.size(), batch.complexity(), batch.estimatedTokens());
                } catch (RejectedExecutionException e) {
                    log.warn("Executor rejected batch #{}, falling back", batch.sequence());
                    fallbackAll(ctx, batch.tasks(), "oracle executor rejected the batch");
                }
            }
            if (inFlight.isEmpty()) {
                break;
            }

            Future<DispatchedBatch> done;
            try {
                done = completions.take();
            } catch (InterruptedException e) {
                // Keep draining so in-flight calls reach the metrics; submit nothing new
                if (!interrupted) {
                    log.warn("Run interrupted - draining {} batches in flight, {} not submitted",
                            inFlight.size(), batches.size() - next);
                }
                interrupted = true;
                ctx.setCancelled(true);
                continue;
            }
            SentenceBatch batch = inFlight.remove(done);

            try {
                DispatchedBatch result = done.get();
                handleBatch(ctx, result.batch(), result.outcome());
            } catch (InterruptedException e) {
                interrupted = true;
                ctx.setCancelled(true);
                fallbackAll(ctx, batch.tasks(), "run interrupted");
            } catch (ExecutionException e) {
                log.error("Worker for batch #{} failed unexpectedly", batch.sequence(), e.getCause());
                fallbackAll(ctx, batch.tasks(), "oracle worker failed: " + e.getCause());
            }
            publishProgress(ctx, false);
        }

        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        ctx.getMetrics().addPhaseTime(RunPhase.ORACLE, System.nanoTime() - start);
    }

    private void handleBatch(RewriteRunContext ctx, SentenceBatch batch, OracleBatchOutcome outcome) {
        long start = System.nanoTime();
        recordCalls(ctx, outcome);

        switch (outcome.status()) {
            case FATAL -> {
                disableOracle(ctx, outcome);
                batch.tasks().forEach(task -> task.markStatus(TaskStatus.FAILED));
                fallbackAll(ctx, batch.tasks(), "oracle error: " + outcome.error().getMessage());
            }
            case EXHAUSTED -> fallbackAll(ctx, batch.tasks(),
                    "oracle unavailable after retries: " + outcome.error().getMessage());
            case COMPLETED -> {
                for (int i = 0; i < batch.size(); i++) {
                    handleItem(ctx, batch.tasks().get(i), batch.complexity(), outcome.items().get(i));
                }
            }
        }
        ctx.getMetrics().addPhaseTime(RunPhase.VALIDATION, System.nanoTime() - start);
    }

    private void handleItem(RewriteRunContext ctx, SentenceTask task, BatchComplexityClass complexity, OracleItem item) {
        ValidationVerdict verdict = verdictFor(ctx, task, item);
        if (verdict.accepted()) {
            accept(ctx, task, RewriteCandidate.oracle(item.fragments()));
            return;
        }
        ctx.getMetrics().recordRejection(verdict.reason());
        if (ctx.isOracleDisabled()) {
            fallback(ctx, task, "rejected: " + verdict.describe());
            return;
        }
        log.warn("Sentence {} rejected ({}), retrying strictly", task.getIndex(), verdict.describe());

        ctx.getMetrics().recordValidationRetry();
        OracleBatchOutcome retry = ctx.getOracleClient()
                .submitStrict(task, complexity, ctx.getWordLimit(), verdict.reason());
        recordCalls(ctx, retry);

        if (!retry.isCompleted()) {
            if (retry.status() == OracleBatchOutcome.Status.FATAL) {
                disableOracle(ctx, retry);
            }
            fallback(ctx, task, "rejected (" + verdict.reason() + "), retry failed: " + retry.error().getMessage());
            return;
        }

        ValidationVerdict second = verdictFor(ctx, task, retry.items().get(0));
        if (second.accepted()) {
            accept(ctx, task, RewriteCandidate.oracle(retry.items().get(0).fragments()));
            return;
        }
        ctx.getMetrics().recordRejection(second.reason());
        fallback(ctx, task, "rejected twice: " + verdict.reason() + ", then " + second.describe());
    }

    private ValidationVerdict verdictFor(RewriteRunContext ctx, SentenceTask task, OracleItem item) {
        if (item.isMalformed()) {
            return ValidationVerdict.reject(RejectionReason.MALFORMED_RESPONSE, item.malformedDetail());
        }
        return validator.validate(task.getText(), RewriteCandidate.oracle(item.fragments()), ctx.getWordLimit());
    }

    private void recordCalls(RewriteRunContext ctx, OracleBatchOutcome outcome) {
        for (OracleCallRecord call : outcome.calls()) {
            ctx.getMetrics().recordCall(call,
                    rateTable.cost(call.provider(), call.inputTokens(), call.outputTokens()));
        }
    }

    private void disableOracle(RewriteRunContext ctx, OracleBatchOutcome outcome) {
        if (ctx.isOracleDisabled()) {
            return;
        }
        ctx.setOracleDisabled(true);
        ctx.getMetrics().recordFatalWarning();
        String warning = String.format("Oracle '%s' failed fatally (%s); remaining sentences were split mechanically",
                ctx.getOracle().name(), outcome.error().getMessage());
        ctx.getWarnings().add(warning);
        log.error(warning);
    }

    // ===== Resolution =====

    private void accept(RewriteRunContext ctx, SentenceTask task, RewriteCandidate candidate) {
        task.resolve(TaskStatus.VALIDATED, candidate, null);
        cache.store(task.getText(), ctx.getWordLimit(), candidate);
        ctx.getMetrics().recordOracleSuccess();
        completed(ctx, task);

        for (SentenceTask follower : ctx.followersOf(task)) {
            Optional<RewriteCandidate> cached = cache.lookup(follower.getText(), ctx.getWordLimit());
            if (cached.isPresent()) {
                ctx.getMetrics().recordCacheHit();
            } else {
                ctx.getMetrics().recordCacheMiss();
            }
            follower.resolve(TaskStatus.CACHED, cached.orElse(candidate),
                    "same sentence as #" + task.getIndex());
            completed(ctx, follower);
        }
    }

    private void fallbackAll(RewriteRunContext ctx, List<SentenceTask> tasks, String note) {
        for (SentenceTask task : tasks) {
            fallback(ctx, task, note);
        }
    }

    private void fallback(RewriteRunContext ctx, SentenceTask task, String note) {
        long start = System.nanoTime();
        RewriteCandidate chunks = RewriteCandidate.mechanical(chunker.chunk(task.getText(), ctx.getWordLimit()));
        task.resolveForReview(chunks, note);
        ctx.getMetrics().recordMechanicalFallback();
        completed(ctx, task);
        log.warn("Sentence {} split mechanically into {} pieces: {}", task.getIndex(), chunks.fragments().size(), note);

        for (SentenceTask follower : ctx.followersOf(task)) {
            follower.resolveForReview(chunks, note);
            ctx.getMetrics().recordMechanicalFallback();
            completed(ctx, follower);
        }
        ctx.getMetrics().addPhaseTime(RunPhase.FALLBACK, System.nanoTime() - start);
        publishProgress(ctx, false);
    }

    private void completed(RewriteRunContext ctx, SentenceTask task) {
        ctx.setLastCompletedSentence(task.getOriginalSentence());
    }

    // ===== Progress & report =====

    private void publishProgress(RewriteRunContext ctx, boolean finished) {
        RewriteProgressEvent event = new RewriteProgressEvent(
                ctx.resolvedCount(),
                ctx.getTasks().size(),
                ctx.getLastCompletedSentence(),
                ctx.getMetrics().snapshot(),
                finished);
        try {
            ctx.getProgress().publish(event);
        } catch (RuntimeException e) {
            log.warn("Progress channel failed: {}", e.getMessage());
        }
    }

    private RewriteReport finish(RewriteRunContext ctx) {
        List<SentenceRewrite> results = ctx.getTasks().stream()
                .filter(SentenceTask::isResolved)
                .map(SentenceTask::toRewrite)
                .toList();
        boolean cancelled = ctx.isCancelled() || results.size() < ctx.getTasks().size();

        ctx.getMetrics().finish();
        publishProgress(ctx, true);
        ctx.getMetrics().logSummary();
        log.info("Rewrite run finished - results: {}/{}, cancelled: {}, warnings: {}",
                results.size(), ctx.getTasks().size(), cancelled, ctx.getWarnings().size());

        return new RewriteReport(results, ctx.getMetrics().snapshot(), ctx.getWarnings(), cancelled);
    }
}
