package com.shortphrase.infrastructure.ai.batching;

import com.shortphrase.domain.rewrite.model.BatchComplexityClass;
import com.shortphrase.domain.rewrite.model.SentenceTask;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Groups oracle candidates by complexity class into batches bounded by a
 * per-class size and by an estimated-token ceiling.
 */
@Slf4j
public class BatchScheduler {

    private final double simpleFactor;
    private final double complexFactor;
    private final Map<BatchComplexityClass, Integer> batchSizes;
    private final int maxBatchTokens;
    private final TokenEstimator tokenEstimator;

    public BatchScheduler(double simpleFactor,
                          double complexFactor,
                          int simpleBatchSize,
                          int mediumBatchSize,
                          int complexBatchSize,
                          int maxBatchTokens,
                          TokenEstimator tokenEstimator) {
        if (simpleFactor <= 0 || complexFactor < simpleFactor) {
            throw new IllegalArgumentException("complexity factors must satisfy 0 < simple <= complex");
        }
        if (simpleBatchSize < 1 || mediumBatchSize < 1 || complexBatchSize < 1) {
            throw new IllegalArgumentException("batch sizes must be positive");
        }
        this.simpleFactor = simpleFactor;
        this.complexFactor = complexFactor;
        this.batchSizes = new EnumMap<>(Map.of(
                BatchComplexityClass.SIMPLE, simpleBatchSize,
                BatchComplexityClass.MEDIUM, mediumBatchSize,
                BatchComplexityClass.COMPLEX, complexBatchSize));
        this.maxBatchTokens = maxBatchTokens;
        this.tokenEstimator = tokenEstimator;
    }

    public BatchComplexityClass classify(int wordCount, int limit) {
        if (wordCount <= (int) Math.floor(simpleFactor * limit)) {
            return BatchComplexityClass.SIMPLE;
        }
        if (wordCount <= (int) Math.floor(complexFactor * limit)) {
            return BatchComplexityClass.MEDIUM;
        }
        return BatchComplexityClass.COMPLEX;
    }

    /**
     * Partition the tasks into batches. Each task lands in exactly one batch; members
     * keep input order and batches are ordered by their first member's index.
     */
    public List<SentenceBatch> schedule(List<SentenceTask> tasks, int limit) {
        Map<BatchComplexityClass, OpenBatch> open = new EnumMap<>(BatchComplexityClass.class);
        List<OpenBatch> closed = new ArrayList<>();

        for (SentenceTask task : tasks) {
            BatchComplexityClass complexity = classify(task.getWordCount(), limit);
            int tokens = tokenEstimator.sentenceTokens(task.getWordCount());

            OpenBatch batch = open.get(complexity);
            if (batch != null && (batch.tasks.size() >= batchSizes.get(complexity)
                    || batch.tokens + tokens > maxBatchTokens)) {
                closed.add(batch);
                batch = null;
            }
            if (batch == null) {
                batch = new OpenBatch(complexity, tokenEstimator.promptOverheadTokens());
                open.put(complexity, batch);
            }
            batch.add(task, tokens);
        }
        closed.addAll(open.values());
        closed.sort(Comparator.comparingInt(b -> b.tasks.get(0).getIndex()));

        List<SentenceBatch> batches = new ArrayList<>(closed.size());
        for (int i = 0; i < closed.size(); i++) {
            OpenBatch batch = closed.get(i);
            batches.add(new SentenceBatch(i, batch.complexity, batch.tasks, batch.tokens));
        }

        if (!batches.isEmpty()) {
            log.info("Scheduled {} oracle candidates into {} batches (limit {}, token ceiling {})",
                    tasks.size(), batches.size(), limit, maxBatchTokens);
        }
        return batches;
    }

    private static final class OpenBatch {
        private final BatchComplexityClass complexity;
        private final List<SentenceTask> tasks = new ArrayList<>();
        private int tokens;

        private OpenBatch(BatchComplexityClass complexity, int overheadTokens) {
            this.complexity = complexity;
            this.tokens = overheadTokens;
        }

        private void add(SentenceTask task, int sentenceTokens) {
            tasks.add(task);
            tokens += sentenceTokens;
        }
    }
}
