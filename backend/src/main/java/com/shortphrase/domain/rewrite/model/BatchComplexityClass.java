package com.shortphrase.domain.rewrite.model;

/**
 * Size bucket of an oracle candidate. Decides batch size and prompt framing.
 */
public enum BatchComplexityClass {
    SIMPLE,
    MEDIUM,
    COMPLEX
}
