package com.framesmith.core.oracle;

/**
 * Oracle rejected the request itself (malformed request, authentication, unknown model). Never retried.
 */
public class OracleRequestException extends RuntimeException {
    public OracleRequestException(String message) {
        super(message);
    }

    public OracleRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
