package com.findmydevice.service;

import com.findmydevice.config.AppConfig;
import com.findmydevice.dao.Storage;
import com.findmydevice.domain.DeviceApi;
import com.findmydevice.metrics.Metrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;

/**
 * Latest-only location tracking. Writing a position drops every earlier one for the device.
 */
@Component
public final class PositionService {
    private static final Logger logger = LoggerFactory.getLogger(PositionService.class);

    private final Storage storage;
    private final Metrics metrics;
    private final Clock clock;
    private final Duration expiry;

    public PositionService(Storage storage, AppConfig appConfig, Metrics metrics, Clock clock) {
        this.storage = storage;
        this.metrics = metrics;
        this.clock = clock;
        this.expiry = Duration.ofSeconds(appConfig.storage().positionExpirySec());
    }

    public void setDeviceLocation(String deviceId, DeviceApi.Position position) {
        storage.replacePosition(deviceId, new Storage.PositionRow(
            clock.instant(),
            (float) position.latitude(),
            (float) position.longitude(),
            (float) position.altitude(),
            (float) position.accuracy()
        ));
    }

    /** The retained position as a list of at most one element. */
    public List<DeviceApi.Position> getPositions(String deviceId) {
        return storage.latestPosition(deviceId)
            .map(p -> List.of(new DeviceApi.Position(p.latitude(), p.longitude(), p.altitude(), p.accuracy(), p.time())))
            .orElse(List.of());
    }

    public int purgePosition(String deviceId) {
        return storage.purgePosition(deviceId);
    }

    /** Deletes positions older than the expiry window, whatever device they belong to. */
    public int gcDatabase() {
        Instant cutoff = clock.instant().minus(expiry);
        int deleted = storage.purgePositionsBefore(cutoff);
        if (deleted > 0) {
            logger.info("Removed {} expired positions", deleted);
            metrics.incrementBy("position.gc.deleted", deleted);
        }
        return deleted;
    }
}
