package com.shortphrase.domain.rewrite.model;

public enum RunPhase {
    ROUTING,
    ORACLE,
    VALIDATION,
    FALLBACK
}
