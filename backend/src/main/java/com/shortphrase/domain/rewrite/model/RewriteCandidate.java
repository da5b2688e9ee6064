package com.shortphrase.domain.rewrite.model;

import java.util.List;

/**
 * Proposed rewrite of one sentence: ordered fragments plus their provenance.
 *
 * @param fragments  output sentences, in reading order
 * @param provenance ORACLE, MECHANICAL, or ORIGINAL for pass-through
 */
public record RewriteCandidate(
        List<String> fragments,
        Provenance provenance
) {
    public RewriteCandidate {
        fragments = List.copyOf(fragments);
    }

    public static RewriteCandidate original(String sentence) {
        return new RewriteCandidate(List.of(sentence), Provenance.ORIGINAL);
    }

    public static RewriteCandidate oracle(List<String> fragments) {
        return new RewriteCandidate(fragments, Provenance.ORACLE);
    }

    public static RewriteCandidate mechanical(List<String> fragments) {
        return new RewriteCandidate(fragments, Provenance.MECHANICAL);
    }

    public boolean isEmpty() {
        return fragments.isEmpty();
    }
}
