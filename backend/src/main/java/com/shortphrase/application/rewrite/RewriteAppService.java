package com.shortphrase.application.rewrite;

import com.shortphrase.domain.rewrite.exception.InvalidRewriteRequestException;
import com.shortphrase.domain.rewrite.model.AccessCheckResult;
import com.shortphrase.domain.rewrite.model.CostEstimate;
import com.shortphrase.domain.rewrite.model.ProcessingMode;
import com.shortphrase.domain.rewrite.model.RewriteCommand;
import com.shortphrase.domain.rewrite.model.RewriteReport;
import com.shortphrase.domain.rewrite.service.RewritingOracle;
import com.shortphrase.infrastructure.ai.CostEstimator;
import com.shortphrase.infrastructure.ai.cache.CacheStats;
import com.shortphrase.infrastructure.ai.cache.RewriteCache;
import com.shortphrase.infrastructure.ai.pipeline.CancellationToken;
import com.shortphrase.infrastructure.ai.pipeline.ProgressChannel;
import com.shortphrase.infrastructure.ai.pipeline.RewriteOrchestrator;
import com.shortphrase.infrastructure.config.RewriteProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Entry point for callers: runs documents, estimates cost, checks provider access.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RewriteAppService {

    private final RewriteOrchestrator orchestrator;
    private final CostEstimator costEstimator;
    private final RewriteCache rewriteCache;
    private final ObjectProvider<RewritingOracle> oracleProvider;
    private final RewriteProperties properties;

    /**
     * Rewrite with the configured oracle and the default word limit.
     */
    public RewriteReport rewrite(List<String> sentences) {
        return rewrite(RewriteCommand.of(sentences, properties.getDefaultWordLimit()));
    }

    public RewriteReport rewrite(RewriteCommand command) {
        return rewrite(command, ProgressChannel.discarding(), CancellationToken.none());
    }

    public RewriteReport rewrite(RewriteCommand command, ProgressChannel progress, CancellationToken cancellation) {
        RewritingOracle oracle = command != null && command.mode() == ProcessingMode.ORACLE_REWRITE
                ? oracleProvider.getIfAvailable()
                : null;
        return orchestrator.run(command, oracle, progress, cancellation);
    }

    /**
     * Mechanical-only rewrite; never contacts a provider.
     */
    public RewriteReport split(List<String> sentences, int wordLimit) {
        return orchestrator.run(new RewriteCommand(sentences, wordLimit, ProcessingMode.MECHANICAL_ONLY), null);
    }

    public CostEstimate estimateCost(RewriteCommand command) {
        if (command == null || command.sentences() == null || command.wordLimit() <= 0) {
            throw new InvalidRewriteRequestException("A sentence list and a positive word limit are required");
        }
        if (command.sentences().stream().anyMatch(Objects::isNull)) {
            throw new InvalidRewriteRequestException("Sentences must not be null");
        }
        RewritingOracle oracle = oracleProvider.getIfAvailable();
        String provider = oracle != null ? oracle.name() : "none";
        CostEstimate estimate = costEstimator.estimate(command, provider);
        log.info("Cost estimate - provider: {}, oracleSentences: {}, batches: {}, tokens: {}/{}, cost: ${}",
                provider, estimate.oracleSentences(), estimate.batches(), estimate.inputTokens(),
                estimate.outputTokens(), String.format("%.4f", estimate.costUsd()));
        return estimate;
    }

    public AccessCheckResult checkOracleAccess() {
        RewritingOracle oracle = oracleProvider.getIfAvailable();
        if (oracle == null) {
            return new AccessCheckResult("none", AccessCheckResult.Status.ERROR, "No oracle is configured");
        }
        AccessCheckResult result = oracle.checkAccess();
        log.info("Access check - provider: {}, status: {}", result.provider(), result.status());
        return result;
    }

    public CacheStats cacheStats() {
        return rewriteCache.stats();
    }

    public void clearCache() {
        rewriteCache.clear();
        log.info("Rewrite cache cleared");
    }
}
