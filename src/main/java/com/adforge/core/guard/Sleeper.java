package com.adforge.core.guard;

/**
 * Blocking delay used between retry attempts and poll iterations. Replaced in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
