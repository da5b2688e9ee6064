package com.shortphrase.infrastructure.config;

import com.shortphrase.infrastructure.ai.BackoffSleeper;
import com.shortphrase.infrastructure.ai.CostEstimator;
import com.shortphrase.infrastructure.ai.CostRateTable;
import com.shortphrase.infrastructure.ai.RetryPolicy;
import com.shortphrase.infrastructure.ai.batching.BatchScheduler;
import com.shortphrase.infrastructure.ai.batching.TokenEstimator;
import com.shortphrase.infrastructure.ai.cache.RewriteCache;
import com.shortphrase.infrastructure.ai.chunking.DeterministicChunker;
import com.shortphrase.infrastructure.ai.pipeline.RewriteOrchestrator;
import com.shortphrase.infrastructure.ai.preprocessing.TextNormalizer;
import com.shortphrase.infrastructure.ai.routing.SentenceRouter;
import com.shortphrase.infrastructure.ai.validation.LanguageDetector;
import com.shortphrase.infrastructure.ai.validation.RewriteValidator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Wires the pipeline components from {@link RewriteProperties}.
 */
@Configuration
@EnableConfigurationProperties(RewriteProperties.class)
public class PipelineConfig {

    @Bean
    public SentenceRouter sentenceRouter(RewriteProperties properties) {
        return new SentenceRouter(properties.getRouting().getCeilingMultiplier(),
                properties.getRouting().getMaxOracleWords());
    }

    @Bean
    public DeterministicChunker deterministicChunker(RewriteProperties properties) {
        return new DeterministicChunker(properties.getChunking().isPreferClauseBreaks());
    }

    @Bean
    public RewriteCache rewriteCache(RewriteProperties properties) {
        return new RewriteCache(properties.getCache().getCapacity());
    }

    @Bean
    public TokenEstimator tokenEstimator(RewriteProperties properties) {
        return new TokenEstimator(properties.getBatching().getPromptOverheadTokens());
    }

    @Bean
    public BatchScheduler batchScheduler(RewriteProperties properties, TokenEstimator tokenEstimator) {
        RewriteProperties.Batching batching = properties.getBatching();
        return new BatchScheduler(
                batching.getSimpleFactor(),
                batching.getComplexFactor(),
                batching.getSimpleBatchSize(),
                batching.getMediumBatchSize(),
                batching.getComplexBatchSize(),
                batching.getMaxBatchTokens(),
                tokenEstimator);
    }

    @Bean
    public LanguageDetector languageDetector() {
        return new LanguageDetector();
    }

    @Bean
    public RewriteValidator rewriteValidator(RewriteProperties properties, LanguageDetector languageDetector) {
        return new RewriteValidator(languageDetector,
                properties.getValidation().getMinLanguageWords(),
                properties.getValidation().getMinContentOverlap());
    }

    @Bean
    public RetryPolicy retryPolicy(RewriteProperties properties) {
        RewriteProperties.Retry retry = properties.getRetry();
        return new RetryPolicy(retry.getMaxAttempts(), retry.getBaseDelayMs(), retry.getMultiplier(),
                retry.getMaxDelayMs(), retry.getJitter());
    }

    @Bean
    public CostRateTable costRateTable(RewriteProperties properties) {
        Map<String, CostRateTable.Rate> rates = properties.getOracle().getPricing().entrySet().stream()
                .collect(Collectors.toMap(
                        Map.Entry::getKey,
                        e -> new CostRateTable.Rate(e.getValue().getInputPerMillion(), e.getValue().getOutputPerMillion())));
        return new CostRateTable(rates);
    }

    @Bean
    public CostEstimator costEstimator(TextNormalizer textNormalizer, SentenceRouter router,
                                       BatchScheduler scheduler, TokenEstimator tokenEstimator,
                                       CostRateTable costRateTable, RewriteProperties properties) {
        return new CostEstimator(textNormalizer, router, scheduler, tokenEstimator, costRateTable,
                properties.isCleanInput());
    }

    @Bean
    public RewriteOrchestrator rewriteOrchestrator(RewriteProperties properties,
                                                   TextNormalizer textNormalizer,
                                                   SentenceRouter router,
                                                   DeterministicChunker chunker,
                                                   RewriteCache cache,
                                                   BatchScheduler scheduler,
                                                   RewriteValidator validator,
                                                   CostRateTable costRateTable,
                                                   RetryPolicy retryPolicy,
                                                   @Qualifier("oracleExecutor") Executor oracleExecutor) {
        return new RewriteOrchestrator(
                textNormalizer,
                router,
                chunker,
                cache,
                scheduler,
                validator,
                costRateTable,
                retryPolicy,
                BackoffSleeper.THREAD_SLEEP,
                oracleExecutor,
                properties.getOracle().getMaxConcurrentBatches(),
                properties.isCleanInput());
    }
}
