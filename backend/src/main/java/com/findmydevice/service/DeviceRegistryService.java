package com.findmydevice.service;

import com.findmydevice.config.AppConfig;
import com.findmydevice.dao.Storage;
import com.findmydevice.domain.DeviceApi;
import com.findmydevice.metrics.Metrics;
import com.findmydevice.security.SecretCryptoService;
import com.findmydevice.util.Jsons;
import jakarta.annotation.Nullable;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;

@Component
public final class DeviceRegistryService {
    private static final Logger logger = LoggerFactory.getLogger(DeviceRegistryService.class);

    private final Storage storage;
    private final IdGenerator idGenerator;
    private final SecretCryptoService secretCryptoService;
    private final Metrics metrics;
    private final Clock clock;
    private final int maxDevicesPerUser;

    public DeviceRegistryService(Storage storage,
                                 AppConfig appConfig,
                                 IdGenerator idGenerator,
                                 SecretCryptoService secretCryptoService,
                                 Metrics metrics,
                                 Clock clock) {
        this.storage = storage;
        this.idGenerator = idGenerator;
        this.secretCryptoService = secretCryptoService;
        this.metrics = metrics;
        this.clock = clock;
        this.maxDevicesPerUser = Math.max(1, appConfig.storage().maxDevicesPerUser());
    }

    /**
     * Registers a device for a user, or refreshes it in place when the user already owns it.
     *
     * @return the device id, generated when the registration carried none
     */
    public String register(String userId, DeviceApi.DeviceRegistration device) {
        Objects.requireNonNull(userId, "userId");
        String deviceId = device.id() == null || device.id().isBlank() ? idGenerator.generateId() : device.id();

        var row = new Storage.DeviceRow(
            deviceId,
            userId,
            device.hasPasscode(),
            device.loggedIn(),
            secretCryptoService.encrypt(device.secret()),
            device.pushUrl() == null ? "" : device.pushUrl(),
            Jsons.encodeTypes(device.accepts() == null ? List.of() : device.accepts()),
            null,
            null
        );
        boolean created = storage.registerDevice(userId, row, clock.instant());
        if (created) {
            logger.info("Device {} registered for user {}", deviceId, userId);
        } else {
            logger.debug("Device {} updated for user {}", deviceId, userId);
        }
        return deviceId;
    }

    public DeviceApi.DeviceInfo getDeviceInfo(String deviceId) {
        var row = storage.findDeviceInfo(deviceId)
            .orElseThrow(() -> ApiException.unknownDevice(deviceId));
        String pushUrl = row.pushUrl() == null ? "" : row.pushUrl();
        return new DeviceApi.DeviceInfo(
            row.id(),
            row.userId(),
            secretCryptoService.decrypt(row.secret()),
            row.lockable(),
            // a device with a push endpoint is logged in
            !pushUrl.isEmpty(),
            row.lastExchange(),
            pushUrl,
            Jsons.decodeTypes(row.accepts()),
            row.accessToken()
        );
    }

    /** Shared Hawk secret of a registered device. */
    public String secretFor(String deviceId) {
        return getDeviceInfo(deviceId).secret();
    }

    public DeviceApi.DeviceOwner getUserFromDevice(String deviceId) {
        return storage.findDeviceOwner(deviceId)
            .map(owner -> new DeviceApi.DeviceOwner(owner.userId(), owner.name()))
            .orElseThrow(() -> ApiException.unknownDevice(deviceId));
    }

    /**
     * Lists the user's devices, newest association first and capped at the per-user limit.
     * Mappings held under {@code oldUserId} are moved to {@code userId} first; when that move
     * fails the listing is served under the old id and the two ids stay split until a later call
     * succeeds.
     */
    public List<DeviceApi.DeviceSummary> getDevicesForUser(String userId, @Nullable String oldUserId) {
        var listing = storage.listDevicesForUser(userId, oldUserId, maxDevicesPerUser);
        if (listing.rekeyed() > 0) {
            metrics.incrementBy("db.UserID.Updated", listing.rekeyed());
        }
        if (!listing.userId().equals(userId)) {
            logger.warn("Devices of {} listed under previous id {}", userId, listing.userId());
        }
        return listing.rows().stream()
            .map(r -> new DeviceApi.DeviceSummary(r.id(), r.name()))
            .toList();
    }

    public void setAccessToken(String deviceId, String token) {
        storage.setAccessToken(deviceId, token, clock.instant());
    }

    public void setDeviceLock(String deviceId, boolean lockable) {
        storage.setDeviceLock(deviceId, lockable, clock.instant());
    }

    public void touch(String deviceId) {
        storage.touch(deviceId, clock.instant());
    }

    /** Removes the device with its pending commands, position and user mapping. */
    public void deleteDevice(String deviceId) {
        storage.deleteDevice(deviceId);
        logger.info("Device {} deleted", deviceId);
    }
}
