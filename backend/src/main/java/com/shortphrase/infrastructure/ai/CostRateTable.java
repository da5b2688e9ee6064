package com.shortphrase.infrastructure.ai;

import java.util.Map;

/**
 * USD prices per million tokens, keyed by provider name.
 */
public class CostRateTable {

    public record Rate(double inputPerMillion, double outputPerMillion) {}

    private static final Rate FREE = new Rate(0, 0);

    private final Map<String, Rate> rates;

    public CostRateTable(Map<String, Rate> rates) {
        this.rates = Map.copyOf(rates);
    }

    public Rate rateFor(String provider) {
        return rates.getOrDefault(provider, FREE);
    }

    public double cost(String provider, long inputTokens, long outputTokens) {
        Rate rate = rateFor(provider);
        return inputTokens / 1_000_000.0 * rate.inputPerMillion()
                + outputTokens / 1_000_000.0 * rate.outputPerMillion();
    }
}
