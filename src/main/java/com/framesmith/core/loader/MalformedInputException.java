package com.framesmith.core.loader;

/**
 * Thrown when a design document cannot be turned into a valid design graph: missing required fields,
 * dangling node references, cycles, shared ownership or unparseable JSON. Aborts the whole job.
 */
public class MalformedInputException extends RuntimeException {
    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
