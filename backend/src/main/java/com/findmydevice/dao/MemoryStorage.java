package com.findmydevice.dao;

import com.findmydevice.service.ApiException;
import jakarta.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-process store with the same invariants as the relational backend. All tables share one
 * fair lock, acquired with a bounded wait.
 */
public final class MemoryStorage implements Storage {
    private static final Logger logger = LoggerFactory.getLogger(MemoryStorage.class);

    private record NonceEntry(String val, Instant issuedAt) {}

    private record Mapping(String userId, String deviceId, String name, Instant createdAt, long seq) {}

    private record CommandKey(String deviceId, String type) {}

    private record CommandEntry(CommandRow row, long seq) {}

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Duration lockTimeout;

    private final Map<String, String> meta = new HashMap<>();
    private final Map<String, NonceEntry> nonces = new HashMap<>();
    private final Map<String, DeviceRow> devices = new HashMap<>();
    private final List<Mapping> mappings = new ArrayList<>();
    private final Map<CommandKey, CommandEntry> commands = new HashMap<>();
    private final Map<String, List<PositionRow>> positions = new HashMap<>();
    private long seq;

    public MemoryStorage(Duration lockTimeout) {
        this.lockTimeout = lockTimeout;
    }

    @Override
    public void migrate() {
        withLock("migrate", null, () -> meta.put(SchemaVersion.META_KEY, SchemaVersion.CURRENT));
    }

    @Override
    public Optional<String> getMeta(String key) {
        return withLock("getMeta", key, () -> Optional.ofNullable(meta.get(key)));
    }

    @Override
    public void setMeta(String key, String value) {
        withLock("setMeta", key, () -> meta.put(key, value));
    }

    @Override
    public void insertNonce(String key, String val, Instant issuedAt) {
        withLock("insertNonce", key, () -> {
            if (nonces.putIfAbsent(key, new NonceEntry(val, issuedAt)) != null) {
                throw ApiException.storage("insertNonce", key, new IllegalStateException("duplicate nonce key"));
            }
            return null;
        });
    }

    @Override
    public int purgeNoncesIssuedBefore(Instant cutoff) {
        return withLock("purgeNoncesIssuedBefore", null, () -> {
            int removed = 0;
            for (Iterator<NonceEntry> it = nonces.values().iterator(); it.hasNext(); ) {
                if (it.next().issuedAt().isBefore(cutoff)) {
                    it.remove();
                    removed++;
                }
            }
            return removed;
        });
    }

    @Override
    public Optional<String> takeNonce(String key) {
        return withLock("takeNonce", key, () -> Optional.ofNullable(nonces.remove(key)).map(NonceEntry::val));
    }

    @Override
    public boolean registerDevice(String userId, DeviceRow device, Instant exchangedAt) {
        return withLock("registerDevice", device.id(), () -> {
            boolean mapped = mappings.stream()
                .anyMatch(m -> m.userId().equals(userId) && m.deviceId().equals(device.id()));
            if (mapped) {
                DeviceRow current = devices.get(device.id());
                devices.put(device.id(), new DeviceRow(
                    device.id(),
                    null,
                    device.lockable(),
                    device.loggedIn(),
                    device.secret(),
                    device.pushUrl(),
                    device.accepts(),
                    current == null ? null : current.accessToken(),
                    exchangedAt
                ));
                return false;
            }
            if (devices.containsKey(device.id())) {
                throw ApiException.storage("registerDevice", device.id(),
                    new IllegalStateException("device already exists"));
            }
            devices.put(device.id(), new DeviceRow(
                device.id(),
                null,
                device.lockable(),
                device.loggedIn(),
                device.secret(),
                device.pushUrl(),
                device.accepts(),
                null,
                exchangedAt
            ));
            mappings.add(new Mapping(userId, device.id(), "", exchangedAt, ++seq));
            return true;
        });
    }

    @Override
    public Optional<DeviceRow> findDeviceInfo(String deviceId) {
        return withLock("findDeviceInfo", deviceId, () -> {
            DeviceRow device = devices.get(deviceId);
            Optional<Mapping> mapping = mappingOf(deviceId);
            if (device == null || mapping.isEmpty()) {
                return Optional.<DeviceRow>empty();
            }
            return Optional.of(new DeviceRow(
                device.id(),
                mapping.get().userId(),
                device.lockable(),
                device.loggedIn(),
                device.secret(),
                device.pushUrl(),
                device.accepts(),
                device.accessToken(),
                device.lastExchange()
            ));
        });
    }

    @Override
    public Optional<OwnerRow> findDeviceOwner(String deviceId) {
        return withLock("findDeviceOwner", deviceId,
            () -> mappingOf(deviceId).map(m -> new OwnerRow(m.userId(), m.name())));
    }

    @Override
    public DeviceListing listDevicesForUser(String userId, @Nullable String oldUserId, int limit) {
        return withLock("listDevicesForUser", userId, () -> {
            int rekeyed = 0;
            // a device has a single owner here, so moving the old id's mappings cannot collide
            if (oldUserId != null && !oldUserId.isEmpty() && !oldUserId.equals(userId)) {
                for (int i = 0; i < mappings.size(); i++) {
                    Mapping m = mappings.get(i);
                    if (m.userId().equals(oldUserId)) {
                        mappings.set(i, new Mapping(userId, m.deviceId(), m.name(), m.createdAt(), m.seq()));
                        rekeyed++;
                    }
                }
            }
            List<DeviceListRow> rows = mappings.stream()
                .filter(m -> m.userId().equals(userId))
                .sorted(Comparator.comparing(Mapping::createdAt).thenComparingLong(Mapping::seq).reversed())
                .limit(limit)
                .map(m -> new DeviceListRow(m.deviceId(), m.name().isEmpty() ? m.deviceId() : m.name()))
                .toList();
            return new DeviceListing(rows, userId, rekeyed);
        });
    }

    @Override
    public void setAccessToken(String deviceId, String token, Instant exchangedAt) {
        updateDevice("setAccessToken", deviceId, d -> new DeviceRow(d.id(), null, d.lockable(), d.loggedIn(),
            d.secret(), d.pushUrl(), d.accepts(), token, exchangedAt));
    }

    @Override
    public void setDeviceLock(String deviceId, boolean lockable, Instant exchangedAt) {
        updateDevice("setDeviceLock", deviceId, d -> new DeviceRow(d.id(), null, lockable, d.loggedIn(),
            d.secret(), d.pushUrl(), d.accepts(), d.accessToken(), exchangedAt));
    }

    @Override
    public void touch(String deviceId, Instant exchangedAt) {
        updateDevice("touch", deviceId, d -> new DeviceRow(d.id(), null, d.lockable(), d.loggedIn(),
            d.secret(), d.pushUrl(), d.accepts(), d.accessToken(), exchangedAt));
    }

    @Override
    public void deleteDevice(String deviceId) {
        withLock("deleteDevice", deviceId, () -> {
            commands.keySet().removeIf(k -> k.deviceId().equals(deviceId));
            positions.remove(deviceId);
            mappings.removeIf(m -> m.deviceId().equals(deviceId));
            devices.remove(deviceId);
            return null;
        });
    }

    @Override
    public void upsertCommand(String deviceId, String type, String command, Instant createdAt) {
        withLock("upsertCommand", deviceId, () -> {
            CommandKey key = new CommandKey(deviceId, type);
            CommandEntry current = commands.get(key);
            String id = current == null ? UUID.randomUUID().toString() : current.row().id();
            commands.put(key, new CommandEntry(new CommandRow(id, command, type, createdAt), ++seq));
            return null;
        });
    }

    @Override
    public Optional<CommandRow> popOldestCommand(String deviceId) {
        return withLock("popOldestCommand", deviceId, () -> {
            Optional<Map.Entry<CommandKey, CommandEntry>> oldest = commands.entrySet().stream()
                .filter(e -> e.getKey().deviceId().equals(deviceId))
                .min(Comparator.comparing((Map.Entry<CommandKey, CommandEntry> e) -> e.getValue().row().createdAt())
                    .thenComparingLong(e -> e.getValue().seq()));
            oldest.ifPresent(e -> commands.remove(e.getKey()));
            return oldest.map(e -> e.getValue().row());
        });
    }

    @Override
    public int purgeCommands(String deviceId) {
        return withLock("purgeCommands", deviceId, () -> {
            int before = commands.size();
            commands.keySet().removeIf(k -> k.deviceId().equals(deviceId));
            return before - commands.size();
        });
    }

    @Override
    public void replacePosition(String deviceId, PositionRow position) {
        withLock("replacePosition", deviceId, () -> {
            List<PositionRow> rows = new ArrayList<>();
            rows.add(position);
            positions.put(deviceId, rows);
            return null;
        });
    }

    @Override
    public Optional<PositionRow> latestPosition(String deviceId) {
        return withLock("latestPosition", deviceId, () -> positions.getOrDefault(deviceId, List.of()).stream()
            .max(Comparator.comparing(PositionRow::time)));
    }

    @Override
    public int purgePosition(String deviceId) {
        return withLock("purgePosition", deviceId, () -> {
            List<PositionRow> removed = positions.remove(deviceId);
            return removed == null ? 0 : removed.size();
        });
    }

    @Override
    public int purgePositionsBefore(Instant cutoff) {
        return withLock("purgePositionsBefore", null, () -> {
            int removed = 0;
            for (Iterator<List<PositionRow>> it = positions.values().iterator(); it.hasNext(); ) {
                List<PositionRow> rows = it.next();
                int before = rows.size();
                rows.removeIf(p -> p.time().isBefore(cutoff));
                removed += before - rows.size();
                if (rows.isEmpty()) {
                    it.remove();
                }
            }
            return removed;
        });
    }

    @Override
    public void close() {
        logger.debug("Memory storage closed");
    }

    private Optional<Mapping> mappingOf(String deviceId) {
        return mappings.stream().filter(m -> m.deviceId().equals(deviceId)).findFirst();
    }

    private void updateDevice(String op, String deviceId, UnaryOperator<DeviceRow> change) {
        withLock(op, deviceId, () -> devices.computeIfPresent(deviceId, (id, d) -> change.apply(d)));
    }

    private <T> T withLock(String op, @Nullable String key, Supplier<T> action) {
        boolean acquired;
        try {
            acquired = lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ApiException.storage(op, key, e);
        }
        if (!acquired) {
            logger.error("Storage lock wait timed out for {} {}", op, key);
            throw ApiException.storageTimeout(op, key, null);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
