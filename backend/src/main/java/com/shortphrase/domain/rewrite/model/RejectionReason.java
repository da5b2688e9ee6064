package com.shortphrase.domain.rewrite.model;

public enum RejectionReason {
    OVER_LIMIT,
    WRONG_LANGUAGE,
    CONTENT_DRIFT,
    MALFORMED_RESPONSE
}
