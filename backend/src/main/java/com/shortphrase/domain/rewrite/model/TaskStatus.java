package com.shortphrase.domain.rewrite.model;

public enum TaskStatus {
    PENDING,
    CACHED,
    ROUTED_DIRECT,
    ROUTED_ORACLE,
    ROUTED_MECHANICAL,
    VALIDATED,
    FALLBACK,
    FAILED
}
