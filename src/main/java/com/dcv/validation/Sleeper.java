package com.dcv.validation;

import java.util.concurrent.TimeUnit;

/**
 * Waits between validation status checks.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Thread sleep.
     */
    Sleeper SYSTEM = seconds -> TimeUnit.SECONDS.sleep(seconds);

    /**
     * Sleep for given seconds.
     *
     * @param seconds Seconds.
     * @throws InterruptedException If interrupted while waiting.
     */
    void sleep(long seconds) throws InterruptedException;
}
