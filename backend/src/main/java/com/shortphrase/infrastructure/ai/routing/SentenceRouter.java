package com.shortphrase.infrastructure.ai.routing;

import com.shortphrase.domain.rewrite.model.RouteDecision;

import java.util.regex.Pattern;

/**
 * Decides the transformation strategy for a single sentence. Pure and thread-safe.
 */
public class SentenceRouter {

    private static final Pattern ANY_LETTER = Pattern.compile("\\p{L}");

    private final int ceilingMultiplier;
    private final int maxOracleWords;

    /**
     * @param ceilingMultiplier sentences longer than this many times the limit skip the oracle
     * @param maxOracleWords    absolute length above which sentences skip the oracle
     */
    public SentenceRouter(int ceilingMultiplier, int maxOracleWords) {
        if (ceilingMultiplier < 1) {
            throw new IllegalArgumentException("ceilingMultiplier must be at least 1");
        }
        if (maxOracleWords < 1) {
            throw new IllegalArgumentException("maxOracleWords must be at least 1");
        }
        this.ceilingMultiplier = ceilingMultiplier;
        this.maxOracleWords = maxOracleWords;
    }

    public RouteDecision route(int wordCount, String text, int limit) {
        if (wordCount <= limit) {
            return RouteDecision.DIRECT;
        }
        if ((long) wordCount > (long) ceilingMultiplier * limit || wordCount > maxOracleWords) {
            return RouteDecision.MECHANICAL;
        }
        // page numbers, references, digit runs: nothing for the oracle to rephrase
        if (text == null || !ANY_LETTER.matcher(text).find()) {
            return RouteDecision.MECHANICAL;
        }
        return RouteDecision.ORACLE_CANDIDATE;
    }
}
