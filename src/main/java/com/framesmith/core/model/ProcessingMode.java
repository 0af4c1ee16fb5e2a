package com.framesmith.core.model;

/**
 * How a design graph is processed, decided by node count.
 */
public enum ProcessingMode {
    /** Whole document fits into one oracle call. */
    STANDARD,
    /** Document is split into capacity-bounded screens. */
    CHUNKED
}
