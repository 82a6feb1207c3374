package com.frontier.outpost.client;

import java.time.Duration;

/**
 * Blocking pause between attempts. Interruptible so a caller can abort mid-backoff.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = delay -> Thread.sleep(delay.toMillis());

    void sleep(Duration delay) throws InterruptedException;
}
