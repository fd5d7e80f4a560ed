package org.neuralchilli.shardpool.config;

import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.time.Clock;

/**
 * Provides the clock the registry measures heartbeats and the initial wait against.
 * Tests replace it with a fixed or hand-driven clock.
 */
public class ClockProducer {

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }
}
