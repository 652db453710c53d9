package com.eainde.nsgx.client;

import java.time.Duration;

/**
 * Suspends the calling worker; swapped out in tests so retry paths run instantly.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
