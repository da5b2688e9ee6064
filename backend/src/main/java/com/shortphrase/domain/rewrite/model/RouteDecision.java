package com.shortphrase.domain.rewrite.model;

public enum RouteDecision {
    DIRECT,
    MECHANICAL,
    ORACLE_CANDIDATE
}
