package com.shortphrase.infrastructure.ai;

import com.shortphrase.domain.rewrite.model.CostEstimate;
import com.shortphrase.domain.rewrite.model.ProcessingMode;
import com.shortphrase.domain.rewrite.model.RewriteCommand;
import com.shortphrase.domain.rewrite.model.RouteDecision;
import com.shortphrase.domain.rewrite.model.SentenceTask;
import com.shortphrase.domain.rewrite.service.WordCounter;
import com.shortphrase.infrastructure.ai.batching.BatchScheduler;
import com.shortphrase.infrastructure.ai.batching.SentenceBatch;
import com.shortphrase.infrastructure.ai.batching.TokenEstimator;
import com.shortphrase.infrastructure.ai.cache.RewriteCache;
import com.shortphrase.infrastructure.ai.preprocessing.TextNormalizer;
import com.shortphrase.infrastructure.ai.routing.SentenceRouter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Projects oracle tokens and cost of a command before it runs, using the same
 * cleaning, routing, duplicate folding and batching as a real run. Cache hits are
 * not anticipated.
 */
public class CostEstimator {

    private final TextNormalizer textNormalizer;
    private final SentenceRouter router;
    private final BatchScheduler scheduler;
    private final TokenEstimator tokenEstimator;
    private final CostRateTable rateTable;
    private final boolean cleanInput;

    public CostEstimator(TextNormalizer textNormalizer, SentenceRouter router, BatchScheduler scheduler,
                         TokenEstimator tokenEstimator, CostRateTable rateTable, boolean cleanInput) {
        this.textNormalizer = textNormalizer;
        this.router = router;
        this.scheduler = scheduler;
        this.tokenEstimator = tokenEstimator;
        this.rateTable = rateTable;
        this.cleanInput = cleanInput;
    }

    public CostEstimate estimate(RewriteCommand command, String provider) {
        if (command.mode() == ProcessingMode.MECHANICAL_ONLY) {
            return new CostEstimate(0, 0, 0, 0, 0);
        }

        List<SentenceTask> candidates = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        List<String> sentences = command.sentences();
        for (int i = 0; i < sentences.size(); i++) {
            String raw = sentences.get(i);
            String text = cleanInput ? textNormalizer.normalize(raw) : raw;
            int wordCount = WordCounter.count(text);
            if (router.route(wordCount, text, command.wordLimit()) == RouteDecision.ORACLE_CANDIDATE
                    && seen.add(RewriteCache.normalizeKey(text))) {
                candidates.add(new SentenceTask(i, raw, text, wordCount));
            }
        }

        List<SentenceBatch> batches = scheduler.schedule(candidates, command.wordLimit());
        long inputTokens = (long) batches.size() * tokenEstimator.promptOverheadTokens();
        long outputTokens = 0;
        for (SentenceTask task : candidates) {
            inputTokens += tokenEstimator.inputTokens(task.getWordCount());
            outputTokens += tokenEstimator.outputTokens(task.getWordCount());
        }

        return new CostEstimate(candidates.size(), batches.size(), inputTokens, outputTokens,
                rateTable.cost(provider, inputTokens, outputTokens));
    }
}
