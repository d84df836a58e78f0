package com.deviceagents.device;

/**
 * Cooperative pause used by every polling loop.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
