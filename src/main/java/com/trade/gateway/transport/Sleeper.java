package com.trade.gateway.transport;

/**
 * Pause between attempts; replaced in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
