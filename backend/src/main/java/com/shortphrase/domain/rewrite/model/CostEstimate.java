package com.shortphrase.domain.rewrite.model;

/**
 * Projected oracle usage of a command before it runs.
 *
 * @param oracleSentences sentences that would be sent to the oracle
 * @param batches         projected number of oracle calls
 * @param inputTokens     projected prompt tokens
 * @param outputTokens    projected completion tokens
 * @param costUsd         projected cost in USD at the configured rates
 */
public record CostEstimate(
        int oracleSentences,
        int batches,
        long inputTokens,
        long outputTokens,
        double costUsd
) {}
