package com.findmydevice.dao;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence primitives for devices, pending commands, positions and nonces.
 *
 * <p>Every method is atomic on its own. Failures surface as
 * {@link com.findmydevice.service.ApiException} of kind {@code STORAGE} or
 * {@code STORAGE_TIMEOUT}; a legitimately absent row is an empty result.
 */
public interface Storage extends AutoCloseable {

    record DeviceRow(String id,
                     @Nullable String userId,
                     boolean lockable,
                     boolean loggedIn,
                     String secret,
                     String pushUrl,
                     String accepts,
                     @Nullable String accessToken,
                     @Nullable Instant lastExchange) {}

    record DeviceListRow(String id, String name) {}

    record OwnerRow(String userId, String name) {}

    /**
     * @param rows     devices of the effective user, newest association first
     * @param userId   user id the rows were listed under (the old id when re-keying failed)
     * @param rekeyed  number of mappings moved from the old user id
     */
    record DeviceListing(List<DeviceListRow> rows, String userId, int rekeyed) {}

    record CommandRow(String id, String command, String type, Instant createdAt) {}

    record PositionRow(Instant time, float latitude, float longitude, float altitude, float accuracy) {}

    /** Applies pending schema migrations and records the schema version in meta. */
    void migrate();

    Optional<String> getMeta(String key);

    void setMeta(String key, String value);

    void insertNonce(String key, String val, Instant issuedAt);

    int purgeNoncesIssuedBefore(Instant cutoff);

    /** Reads and deletes the nonce value in one step; at most one caller ever sees a given row. */
    Optional<String> takeNonce(String key);

    /**
     * Updates the device in place when it is already mapped to the user, otherwise inserts the
     * device row and the user mapping together.
     *
     * @return true when a new device was created
     */
    boolean registerDevice(String userId, DeviceRow device, Instant exchangedAt);

    Optional<DeviceRow> findDeviceInfo(String deviceId);

    Optional<OwnerRow> findDeviceOwner(String deviceId);

    /**
     * Moves all mappings of {@code oldUserId} to {@code userId} when they differ, then lists the
     * devices. Both steps run in one transaction; a failed move falls back to listing under the
     * old id.
     */
    DeviceListing listDevicesForUser(String userId, @Nullable String oldUserId, int limit);

    void setAccessToken(String deviceId, String token, Instant exchangedAt);

    void setDeviceLock(String deviceId, boolean lockable, Instant exchangedAt);

    void touch(String deviceId, Instant exchangedAt);

    void deleteDevice(String deviceId);

    void upsertCommand(String deviceId, String type, String command, Instant createdAt);

    /** Removes and returns the oldest pending command of the device across all types. */
    Optional<CommandRow> popOldestCommand(String deviceId);

    int purgeCommands(String deviceId);

    /** Deletes every stored position of the device and inserts the new one. */
    void replacePosition(String deviceId, PositionRow position);

    Optional<PositionRow> latestPosition(String deviceId);

    int purgePosition(String deviceId);

    int purgePositionsBefore(Instant cutoff);

    @Override
    void close();
}
