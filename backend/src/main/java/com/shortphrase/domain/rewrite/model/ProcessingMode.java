package com.shortphrase.domain.rewrite.model;

/**
 * How over-limit sentences of a document are handled.
 */
public enum ProcessingMode {
    ORACLE_REWRITE,
    MECHANICAL_ONLY
}
