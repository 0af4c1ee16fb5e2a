package com.framesmith.core.oracle;

/**
 * Thrown when oracle output yields neither structured files nor recognizable file blocks.
 */
public class OracleParseException extends RuntimeException {
    public OracleParseException(String message) {
        super(message);
    }

    public OracleParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
