package com.shortphrase.domain.rewrite.exception;

/**
 * Timeout, I/O failure, rate limit or server-side error. Worth retrying.
 */
public class TransientOracleException extends OracleException {

    public TransientOracleException(String message) {
        super(message);
    }

    public TransientOracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
