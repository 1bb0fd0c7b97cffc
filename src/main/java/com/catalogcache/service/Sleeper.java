package com.catalogcache.service;

/**
 * Pause hook for the rate-limit wait, swappable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
