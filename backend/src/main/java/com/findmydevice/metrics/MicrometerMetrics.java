package com.findmydevice.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class MicrometerMetrics implements Metrics {
    private static final Logger logger = LoggerFactory.getLogger(MicrometerMetrics.class);
    private static final String PREFIX = "fmd.";

    private final MeterRegistry registry;

    public MicrometerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void increment(String name) {
        incrementBy(name, 1);
    }

    @Override
    public void incrementBy(String name, long amount) {
        try {
            registry.counter(PREFIX + name).increment(amount);
        } catch (RuntimeException e) {
            logger.warn("Could not record counter {}", name, e);
        }
    }

    @Override
    public void timer(String name, Duration duration) {
        try {
            registry.timer(PREFIX + name).record(duration);
        } catch (RuntimeException e) {
            logger.warn("Could not record timer {}", name, e);
        }
    }
}
