package com.findmydevice.service;

import com.findmydevice.dao.Storage;
import com.findmydevice.domain.DeviceApi;
import com.findmydevice.metrics.Metrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;

/**
 * Pending commands: at most one per (device, type). A newer command of the same type replaces
 * the older one.
 */
@Component
public final class CommandQueueService {
    private static final Logger logger = LoggerFactory.getLogger(CommandQueueService.class);

    private final Storage storage;
    private final Metrics metrics;
    private final Clock clock;

    public CommandQueueService(Storage storage, Metrics metrics, Clock clock) {
        this.storage = storage;
        this.metrics = metrics;
        this.clock = clock;
    }

    public void storeCommand(String deviceId, String command, String type) {
        logger.debug("Storing command {} for device {}", type, deviceId);
        storage.upsertCommand(deviceId, type, command, clock.instant());
        metrics.increment("cmd.stored");
    }

    /**
     * Takes the oldest pending command of the device. The command is deleted as it is read, so it
     * is handed out at most once.
     */
    public Optional<DeviceApi.PendingCommand> getPending(String deviceId) {
        var row = storage.popOldestCommand(deviceId);
        Instant now = clock.instant();
        row.ifPresent(r -> {
            Duration lifespan = Duration.between(r.createdAt(), now);
            metrics.timer("cmd.pending", lifespan.isNegative() ? Duration.ZERO : lifespan);
        });
        storage.touch(deviceId, now);
        return row.map(r -> new DeviceApi.PendingCommand(r.command(), r.type(), r.createdAt()));
    }

    public int purgeCommands(String deviceId) {
        return storage.purgeCommands(deviceId);
    }
}
