package com.logsink.core.delay;

import java.time.Duration;

/**
 * Stand-in for an expensive transform: blocks the calling unit of work and reports how long it
 * blocked for.
 */
@FunctionalInterface
public interface ProcessingDelay {

    Duration simulate(String text) throws InterruptedException;

    static ProcessingDelay none() {
        return text -> Duration.ZERO;
    }
}
