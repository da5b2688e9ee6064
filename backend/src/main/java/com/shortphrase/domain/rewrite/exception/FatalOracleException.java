package com.shortphrase.domain.rewrite.exception;

/**
 * Rejected credentials, missing permission or a request the provider will never accept.
 */
public class FatalOracleException extends OracleException {

    public FatalOracleException(String message) {
        super(message);
    }

    public FatalOracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
