package com.shortphrase.infrastructure.ai.batching;

/**
 * Rough token projection from word counts, used for batch sizing and cost estimates.
 */
public class TokenEstimator {

    static final double TOKENS_PER_WORD = 1.33;
    static final double OUTPUT_EXPANSION = 1.5;

    private final int promptOverheadTokens;

    /**
     * @param promptOverheadTokens fixed instruction tokens paid once per call
     */
    public TokenEstimator(int promptOverheadTokens) {
        this.promptOverheadTokens = promptOverheadTokens;
    }

    public int inputTokens(int wordCount) {
        return (int) Math.ceil(wordCount * TOKENS_PER_WORD);
    }

    public int outputTokens(int wordCount) {
        return (int) Math.ceil(wordCount * TOKENS_PER_WORD * OUTPUT_EXPANSION);
    }

    public int sentenceTokens(int wordCount) {
        return inputTokens(wordCount) + outputTokens(wordCount);
    }

    public int promptOverheadTokens() {
        return promptOverheadTokens;
    }
}
