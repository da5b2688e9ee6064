package com.shortphrase.domain.rewrite.exception;

public class InvalidRewriteRequestException extends RuntimeException {

    public InvalidRewriteRequestException(String message) {
        super(message);
    }
}
