package com.shortphrase.domain.rewrite.model;

/**
 * Where the fragments of a result came from.
 * ORIGINAL marks a sentence that was already within the limit and passed through untouched.
 */
public enum Provenance {
    ORIGINAL,
    ORACLE,
    MECHANICAL
}
