package com.shortphrase.infrastructure.ai.batching;

import com.shortphrase.domain.rewrite.model.BatchComplexityClass;
import com.shortphrase.domain.rewrite.model.SentenceTask;

import java.util.List;

/**
 * Group of oracle candidates sent in one call.
 *
 * @param sequence        dispatch order within the run, from 0
 * @param complexity      shared complexity class of the members
 * @param tasks           members in input order
 * @param estimatedTokens projected input plus output tokens, prompt overhead included
 */
public record SentenceBatch(
        int sequence,
        BatchComplexityClass complexity,
        List<SentenceTask> tasks,
        int estimatedTokens
) {
    public SentenceBatch {
        tasks = List.copyOf(tasks);
    }

    public List<String> sentences() {
        return tasks.stream().map(SentenceTask::getText).toList();
    }

    public int size() {
        return tasks.size();
    }

    public int firstIndex() {
        return tasks.get(0).getIndex();
    }
}
