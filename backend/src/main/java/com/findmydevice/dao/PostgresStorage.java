package com.findmydevice.dao;

import com.findmydevice.service.ApiException;
import jakarta.annotation.Nullable;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.sql.Savepoint;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class PostgresStorage implements Storage {
    private static final Logger logger = LoggerFactory.getLogger(PostgresStorage.class);

    // query_canceled, raised when setQueryTimeout fires
    private static final String SQLSTATE_QUERY_CANCELED = "57014";

    private static final List<String> DEVICE_TABLES = List.of(
        "pending_command",
        "position",
        "user_device_map",
        "device"
    );

    private final DbClient dbClient;

    public PostgresStorage(DbClient dbClient) {
        this.dbClient = dbClient;
    }

    @Override
    public void migrate() {
        var flyway = Flyway.configure()
            .dataSource(dbClient.dataSource())
            .locations("classpath:db/migration")
            .load();
        try {
            var result = flyway.migrate();
            logger.info("Flyway migrations executed: {}", result.migrationsExecuted);
        } catch (RuntimeException e) {
            throw new IllegalStateException("Database migration failed", e);
        }
    }

    @Override
    public Optional<String> getMeta(String key) {
        String sql = "SELECT value FROM meta WHERE key=?";
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = prepare(connection, sql)) {
            st.setString(1, key);
            try (ResultSet rs = st.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.ofNullable(rs.getString("value"));
            }
        } catch (SQLException e) {
            throw fail("getMeta", key, e);
        }
    }

    @Override
    public void setMeta(String key, String value) {
        String sql = """
            INSERT INTO meta(key, value) VALUES (?, ?)
            ON CONFLICT (key) DO UPDATE SET value = EXCLUDED.value
            """;
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = prepare(connection, sql)) {
            st.setString(1, key);
            st.setString(2, value);
            st.executeUpdate();
        } catch (SQLException e) {
            throw fail("setMeta", key, e);
        }
    }

    @Override
    public void insertNonce(String key, String val, Instant issuedAt) {
        String sql = "INSERT INTO nonce(key, val, issued_at) VALUES (?, ?, ?)";
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = prepare(connection, sql)) {
            st.setString(1, key);
            st.setString(2, val);
            st.setTimestamp(3, Timestamp.from(issuedAt));
            st.executeUpdate();
        } catch (SQLException e) {
            throw fail("insertNonce", key, e);
        }
    }

    @Override
    public int purgeNoncesIssuedBefore(Instant cutoff) {
        String sql = "DELETE FROM nonce WHERE issued_at < ?";
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = prepare(connection, sql)) {
            st.setTimestamp(1, Timestamp.from(cutoff));
            return st.executeUpdate();
        } catch (SQLException e) {
            throw fail("purgeNoncesIssuedBefore", null, e);
        }
    }

    @Override
    public Optional<String> takeNonce(String key) {
        String sql = "DELETE FROM nonce WHERE key=? RETURNING val";
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = prepare(connection, sql)) {
            st.setString(1, key);
            try (ResultSet rs = st.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(rs.getString("val"));
            }
        } catch (SQLException e) {
            throw fail("takeNonce", key, e);
        }
    }

    @Override
    public boolean registerDevice(String userId, DeviceRow device, Instant exchangedAt) {
        String mappedSql = "SELECT 1 FROM user_device_map WHERE user_id=? AND device_id=?";
        String updateSql = """
            UPDATE device
            SET lockable=?, logged_in=?, last_exchange=?, hawk_secret=?, accepts=?, push_url=?
            WHERE device_id=?
            """;
        String insertDeviceSql = """
            INSERT INTO device(device_id, lockable, logged_in, last_exchange, hawk_secret, accepts, push_url)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;
        String insertMapSql = "INSERT INTO user_device_map(user_id, device_id, name, created_at) VALUES (?, ?, ?, ?)";

        try (Connection connection = dbClient.getConnection()) {
            connection.setAutoCommit(false);
            lockKey(connection, "user:" + userId);

            boolean mapped;
            try (PreparedStatement st = prepare(connection, mappedSql)) {
                st.setString(1, userId);
                st.setString(2, device.id());
                try (ResultSet rs = st.executeQuery()) {
                    mapped = rs.next();
                }
            }

            if (mapped) {
                logger.debug("Updating device {} for user {}", device.id(), userId);
                try (PreparedStatement st = prepare(connection, updateSql)) {
                    st.setBoolean(1, device.lockable());
                    st.setBoolean(2, device.loggedIn());
                    st.setTimestamp(3, Timestamp.from(exchangedAt));
                    st.setString(4, device.secret());
                    st.setString(5, device.accepts());
                    st.setString(6, device.pushUrl());
                    st.setString(7, device.id());
                    st.executeUpdate();
                }
            } else {
                try (PreparedStatement st = prepare(connection, insertDeviceSql)) {
                    st.setString(1, device.id());
                    st.setBoolean(2, device.lockable());
                    st.setBoolean(3, device.loggedIn());
                    st.setTimestamp(4, Timestamp.from(exchangedAt));
                    st.setString(5, device.secret());
                    st.setString(6, device.accepts());
                    st.setString(7, device.pushUrl());
                    st.executeUpdate();
                }
                try (PreparedStatement st = prepare(connection, insertMapSql)) {
                    st.setString(1, userId);
                    st.setString(2, device.id());
                    st.setString(3, "");
                    st.setTimestamp(4, Timestamp.from(exchangedAt));
                    st.executeUpdate();
                }
            }

            connection.commit();
            return !mapped;
        } catch (SQLException e) {
            throw fail("registerDevice", device.id(), e);
        }
    }

    @Override
    public Optional<DeviceRow> findDeviceInfo(String deviceId) {
        String sql = """
            SELECT d.device_id, u.user_id, d.lockable, d.logged_in, d.hawk_secret, d.push_url,
                   d.accepts, d.access_token, d.last_exchange
            FROM user_device_map u
            JOIN device d ON d.device_id = u.device_id
            WHERE u.device_id=?
            LIMIT 1
            """;
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = prepare(connection, sql)) {
            st.setString(1, deviceId);
            try (ResultSet rs = st.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapDevice(rs));
            }
        } catch (SQLException e) {
            throw fail("findDeviceInfo", deviceId, e);
        }
    }

    @Override
    public Optional<OwnerRow> findDeviceOwner(String deviceId) {
        String sql = "SELECT user_id, name FROM user_device_map WHERE device_id=? LIMIT 1";
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = prepare(connection, sql)) {
            st.setString(1, deviceId);
            try (ResultSet rs = st.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                String name = rs.getString("name");
                return Optional.of(new OwnerRow(rs.getString("user_id"), name == null ? "" : name));
            }
        } catch (SQLException e) {
            throw fail("findDeviceOwner", deviceId, e);
        }
    }

    @Override
    public DeviceListing listDevicesForUser(String userId, @Nullable String oldUserId, int limit) {
        String rekeySql = "UPDATE user_device_map SET user_id=? WHERE user_id=?";
        String listSql = """
            SELECT device_id, COALESCE(NULLIF(name, ''), device_id) AS name
            FROM user_device_map
            WHERE user_id=?
            ORDER BY created_at DESC
            LIMIT ?
            """;

        try (Connection connection = dbClient.getConnection()) {
            connection.setAutoCommit(false);
            String effectiveUserId = userId;
            int rekeyed = 0;

            if (oldUserId != null && !oldUserId.isEmpty() && !oldUserId.equals(userId)) {
                // fixed lock order so two opposite re-keys cannot deadlock
                String first = userId.compareTo(oldUserId) < 0 ? userId : oldUserId;
                String second = first.equals(userId) ? oldUserId : userId;
                lockKey(connection, "user:" + first);
                lockKey(connection, "user:" + second);

                Savepoint savepoint = connection.setSavepoint();
                try (PreparedStatement st = prepare(connection, rekeySql)) {
                    st.setString(1, userId);
                    st.setString(2, oldUserId);
                    rekeyed = st.executeUpdate();
                } catch (SQLException e) {
                    if (isTimeout(e)) {
                        throw e;
                    }
                    connection.rollback(savepoint);
                    logger.error("Could not move devices of {} to {}, listing under the old id", oldUserId, userId, e);
                    effectiveUserId = oldUserId;
                }
            }

            List<DeviceListRow> rows = new ArrayList<>();
            try (PreparedStatement st = prepare(connection, listSql)) {
                st.setString(1, effectiveUserId);
                st.setInt(2, limit);
                try (ResultSet rs = st.executeQuery()) {
                    while (rs.next()) {
                        rows.add(new DeviceListRow(rs.getString("device_id"), rs.getString("name")));
                    }
                }
            }

            connection.commit();
            return new DeviceListing(rows, effectiveUserId, rekeyed);
        } catch (SQLException e) {
            throw fail("listDevicesForUser", userId, e);
        }
    }

    @Override
    public void setAccessToken(String deviceId, String token, Instant exchangedAt) {
        String sql = "UPDATE device SET access_token=?, last_exchange=? WHERE device_id=?";
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = prepare(connection, sql)) {
            st.setString(1, token);
            st.setTimestamp(2, Timestamp.from(exchangedAt));
            st.setString(3, deviceId);
            st.executeUpdate();
        } catch (SQLException e) {
            throw fail("setAccessToken", deviceId, e);
        }
    }

    @Override
    public void setDeviceLock(String deviceId, boolean lockable, Instant exchangedAt) {
        String sql = "UPDATE device SET lockable=?, last_exchange=? WHERE device_id=?";
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = prepare(connection, sql)) {
            st.setBoolean(1, lockable);
            st.setTimestamp(2, Timestamp.from(exchangedAt));
            st.setString(3, deviceId);
            st.executeUpdate();
        } catch (SQLException e) {
            throw fail("setDeviceLock", deviceId, e);
        }
    }

    @Override
    public void touch(String deviceId, Instant exchangedAt) {
        String sql = "UPDATE device SET last_exchange=? WHERE device_id=?";
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = prepare(connection, sql)) {
            st.setTimestamp(1, Timestamp.from(exchangedAt));
            st.setString(2, deviceId);
            st.executeUpdate();
        } catch (SQLException e) {
            throw fail("touch", deviceId, e);
        }
    }

    @Override
    public void deleteDevice(String deviceId) {
        try (Connection connection = dbClient.getConnection()) {
            for (String table : DEVICE_TABLES) {
                try (PreparedStatement st = prepare(connection, "DELETE FROM " + table + " WHERE device_id=?")) {
                    st.setString(1, deviceId);
                    st.executeUpdate();
                } catch (SQLException e) {
                    throw fail("deleteDevice:" + table, deviceId, e);
                }
            }
        } catch (SQLException e) {
            throw fail("deleteDevice", deviceId, e);
        }
    }

    @Override
    public void upsertCommand(String deviceId, String type, String command, Instant createdAt) {
        String sql = """
            INSERT INTO pending_command(id, device_id, type, cmd, created_at)
            VALUES (?::uuid, ?, ?, ?, ?)
            ON CONFLICT (device_id, type) DO UPDATE
            SET cmd = EXCLUDED.cmd, created_at = EXCLUDED.created_at
            """;
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = prepare(connection, sql)) {
            st.setString(1, UUID.randomUUID().toString());
            st.setString(2, deviceId);
            st.setString(3, type);
            st.setString(4, command);
            st.setTimestamp(5, Timestamp.from(createdAt));
            st.executeUpdate();
        } catch (SQLException e) {
            throw fail("upsertCommand", deviceId, e);
        }
    }

    @Override
    public Optional<CommandRow> popOldestCommand(String deviceId) {
        String sql = """
            DELETE FROM pending_command
            WHERE id = (
                SELECT id FROM pending_command
                WHERE device_id=?
                ORDER BY created_at ASC
                LIMIT 1
                FOR UPDATE SKIP LOCKED
            )
            RETURNING id, cmd, type, created_at
            """;
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = prepare(connection, sql)) {
            st.setString(1, deviceId);
            try (ResultSet rs = st.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new CommandRow(
                    rs.getObject("id", UUID.class).toString(),
                    rs.getString("cmd"),
                    rs.getString("type"),
                    rs.getTimestamp("created_at").toInstant()
                ));
            }
        } catch (SQLException e) {
            throw fail("popOldestCommand", deviceId, e);
        }
    }

    @Override
    public int purgeCommands(String deviceId) {
        String sql = "DELETE FROM pending_command WHERE device_id=?";
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = prepare(connection, sql)) {
            st.setString(1, deviceId);
            return st.executeUpdate();
        } catch (SQLException e) {
            throw fail("purgeCommands", deviceId, e);
        }
    }

    @Override
    public void replacePosition(String deviceId, PositionRow position) {
        String deleteSql = "DELETE FROM position WHERE device_id=?";
        String insertSql = """
            INSERT INTO position(id, device_id, created_at, latitude, longitude, altitude, accuracy)
            VALUES (?::uuid, ?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = dbClient.getConnection()) {
            connection.setAutoCommit(false);
            lockKey(connection, "position:" + deviceId);

            try (PreparedStatement del = prepare(connection, deleteSql)) {
                del.setString(1, deviceId);
                del.executeUpdate();
            }

            try (PreparedStatement ins = prepare(connection, insertSql)) {
                ins.setString(1, UUID.randomUUID().toString());
                ins.setString(2, deviceId);
                ins.setTimestamp(3, Timestamp.from(position.time()));
                ins.setFloat(4, position.latitude());
                ins.setFloat(5, position.longitude());
                ins.setFloat(6, position.altitude());
                ins.setFloat(7, position.accuracy());
                ins.executeUpdate();
            }

            connection.commit();
        } catch (SQLException e) {
            throw fail("replacePosition", deviceId, e);
        }
    }

    @Override
    public Optional<PositionRow> latestPosition(String deviceId) {
        String sql = """
            SELECT created_at, latitude, longitude, altitude, accuracy
            FROM position
            WHERE device_id=?
            ORDER BY created_at DESC
            LIMIT 1
            """;
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = prepare(connection, sql)) {
            st.setString(1, deviceId);
            try (ResultSet rs = st.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new PositionRow(
                    rs.getTimestamp("created_at").toInstant(),
                    rs.getFloat("latitude"),
                    rs.getFloat("longitude"),
                    rs.getFloat("altitude"),
                    rs.getFloat("accuracy")
                ));
            }
        } catch (SQLException e) {
            throw fail("latestPosition", deviceId, e);
        }
    }

    @Override
    public int purgePosition(String deviceId) {
        String sql = "DELETE FROM position WHERE device_id=?";
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = prepare(connection, sql)) {
            st.setString(1, deviceId);
            return st.executeUpdate();
        } catch (SQLException e) {
            throw fail("purgePosition", deviceId, e);
        }
    }

    @Override
    public int purgePositionsBefore(Instant cutoff) {
        String sql = "DELETE FROM position WHERE created_at < ?";
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = prepare(connection, sql)) {
            st.setTimestamp(1, Timestamp.from(cutoff));
            return st.executeUpdate();
        } catch (SQLException e) {
            throw fail("purgePositionsBefore", null, e);
        }
    }

    @Override
    public void close() {
        dbClient.close();
    }

    private PreparedStatement prepare(Connection connection, String sql) throws SQLException {
        PreparedStatement st = connection.prepareStatement(sql);
        st.setQueryTimeout(dbClient.queryTimeoutSec());
        return st;
    }

    // transaction-scoped; released on commit or rollback
    private void lockKey(Connection connection, String key) throws SQLException {
        try (PreparedStatement st = prepare(connection, "SELECT pg_advisory_xact_lock(hashtext(?))")) {
            st.setString(1, key);
            st.execute();
        }
    }

    private DeviceRow mapDevice(ResultSet rs) throws SQLException {
        Timestamp exchanged = rs.getTimestamp("last_exchange");
        return new DeviceRow(
            rs.getString("device_id"),
            rs.getString("user_id"),
            rs.getBoolean("lockable"),
            rs.getBoolean("logged_in"),
            rs.getString("hawk_secret"),
            rs.getString("push_url"),
            rs.getString("accepts"),
            rs.getString("access_token"),
            exchanged == null ? null : exchanged.toInstant()
        );
    }

    static boolean isTimeout(SQLException e) {
        return e instanceof SQLTimeoutException
            || e instanceof SQLTransientConnectionException
            || SQLSTATE_QUERY_CANCELED.equals(e.getSQLState());
    }

    private RuntimeException fail(String op, @Nullable String key, SQLException e) {
        if (isTimeout(e)) {
            logger.error("DB operation {} timed out for {}", op, key, e);
            return ApiException.storageTimeout(op, key, e);
        }
        logger.error("DB operation {} failed for {}", op, key, e);
        return ApiException.storage(op, key, e);
    }
}
