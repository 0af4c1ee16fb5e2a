package com.framesmith.core.oracle;

/**
 * Backoff pause between oracle attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
