package com.framesmith.core.oracle;

/**
 * Oracle failure worth retrying: timeout, rate limiting, server-side errors.
 */
public class TransientOracleException extends RuntimeException {
    public TransientOracleException(String message) {
        super(message);
    }

    public TransientOracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
