package com.findmydevice.metrics;

import java.time.Duration;

/**
 * Fire-and-forget metrics sink. Implementations never throw into the caller.
 */
public interface Metrics {
    void increment(String name);

    void incrementBy(String name, long amount);

    void timer(String name, Duration duration);
}
