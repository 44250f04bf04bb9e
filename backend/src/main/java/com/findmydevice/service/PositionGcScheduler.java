package com.findmydevice.service;

import com.findmydevice.config.AppConfig;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;
import ru.tinkoff.kora.common.annotation.Root;

/**
 * Periodic position GC on one daemon thread. Storage writers are never blocked by it beyond a
 * single delete statement.
 */
@Component
@Root
public final class PositionGcScheduler implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PositionGcScheduler.class);

    private final PositionService positionService;
    private final ScheduledExecutorService executor;

    public PositionGcScheduler(PositionService positionService, AppConfig appConfig, MigrationRunner migrationRunner) {
        this.positionService = positionService;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "position-gc");
            thread.setDaemon(true);
            return thread;
        });
        long interval = Math.max(1, appConfig.storage().gcIntervalSec());
        executor.scheduleWithFixedDelay(this::runOnce, interval, interval, TimeUnit.SECONDS);
        logger.info("Position GC scheduled every {}s", interval);
    }

    /** One GC pass. Failures are logged so the next scheduled pass still runs. */
    public void runOnce() {
        try {
            positionService.gcDatabase();
        } catch (RuntimeException e) {
            logger.error("Position GC failed", e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
