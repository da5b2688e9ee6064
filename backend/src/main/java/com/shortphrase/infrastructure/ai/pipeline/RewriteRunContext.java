package com.shortphrase.infrastructure.ai.pipeline;

import com.shortphrase.domain.rewrite.model.ProcessingMode;
import com.shortphrase.domain.rewrite.model.SentenceTask;
import com.shortphrase.domain.rewrite.service.RewritingOracle;
import com.shortphrase.infrastructure.ai.OracleClient;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one document run, confined to the thread driving it.
 */
@Data
public class RewriteRunContext {

    // --- Input ---
    private final String runId;
    private final int wordLimit;
    private final ProcessingMode mode;
    private final RewritingOracle oracle;
    private final ProgressChannel progress;
    private final CancellationToken cancellation;

    // --- Run state ---
    private final RunMetrics metrics = new RunMetrics();
    private final List<SentenceTask> tasks = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private OracleClient oracleClient;
    private boolean oracleDisabled;
    private boolean cancelled;
    private String lastCompletedSentence;

    // --- Deduplication: first task per normalized sentence, and its copies ---
    private final Map<String, SentenceTask> leaders = new LinkedHashMap<>();
    private final Map<Integer, List<SentenceTask>> followers = new HashMap<>();

    public void addFollower(SentenceTask leader, SentenceTask follower) {
        followers.computeIfAbsent(leader.getIndex(), k -> new ArrayList<>()).add(follower);
    }

    public List<SentenceTask> followersOf(SentenceTask leader) {
        return followers.getOrDefault(leader.getIndex(), List.of());
    }

    public int resolvedCount() {
        return (int) tasks.stream().filter(SentenceTask::isResolved).count();
    }
}
