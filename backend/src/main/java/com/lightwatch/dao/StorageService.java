package com.lightwatch.dao;

import com.lightwatch.domain.Device;
import com.lightwatch.domain.HistoryEvent;
import com.lightwatch.domain.PowerState;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;

@Component
public final class StorageService implements DeviceStore, HistoryLog {
    private static final Logger logger = LoggerFactory.getLogger(StorageService.class);

    private static final String DEVICE_COLUMNS = """
        id, owner_ref, secret_hash, encrypted_secret, timezone, paused, state, last_seen, last_change, created_at
        """;

    private final DbClient dbClient;

    public StorageService(DbClient dbClient) {
        this.dbClient = dbClient;
    }

    @Override
    public Optional<Device> findById(long deviceId) {
        String sql = "SELECT " + DEVICE_COLUMNS + " FROM devices WHERE id=?";
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            st.setLong(1, deviceId);
            try (ResultSet rs = st.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapDevice(rs));
            }
        } catch (SQLException e) {
            throw fail("findById", e);
        }
    }

    @Override
    public Optional<Device> findBySecretHash(String secretHash) {
        String sql = "SELECT " + DEVICE_COLUMNS + " FROM devices WHERE secret_hash=?";
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            st.setString(1, secretHash);
            try (ResultSet rs = st.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapDevice(rs));
            }
        } catch (SQLException e) {
            throw fail("findBySecretHash", e);
        }
    }

    @Override
    public List<Device> findByOwner(long ownerRef) {
        String sql = "SELECT " + DEVICE_COLUMNS + " FROM devices WHERE owner_ref=? ORDER BY id";
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            st.setLong(1, ownerRef);
            return readDevices(st);
        } catch (SQLException e) {
            throw fail("findByOwner", e);
        }
    }

    @Override
    public List<Device> findExpired(Instant lastSeenBefore) {
        String sql = "SELECT " + DEVICE_COLUMNS + """
             FROM devices
            WHERE state='ON' AND paused=FALSE AND last_seen IS NOT NULL AND last_seen < ?
            ORDER BY id
            """;
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            st.setTimestamp(1, Timestamp.from(lastSeenBefore));
            return readDevices(st);
        } catch (SQLException e) {
            throw fail("findExpired", e);
        }
    }

    @Override
    public boolean exists(long deviceId) {
        String sql = "SELECT 1 FROM devices WHERE id=?";
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            st.setLong(1, deviceId);
            try (ResultSet rs = st.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw fail("exists", e);
        }
    }

    @Override
    public boolean secretHashInUse(String secretHash) {
        String sql = "SELECT 1 FROM devices WHERE secret_hash=?";
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            st.setString(1, secretHash);
            try (ResultSet rs = st.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw fail("secretHashInUse", e);
        }
    }

    @Override
    public void insert(NewDevice device) {
        String sql = """
            INSERT INTO devices(id, owner_ref, secret_hash, encrypted_secret, timezone, paused, state)
            VALUES (?, ?, ?, ?, ?, FALSE, 'UNKNOWN')
            """;
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            st.setLong(1, device.id());
            st.setLong(2, device.ownerRef());
            st.setString(3, device.secretHash());
            st.setBytes(4, device.encryptedSecret());
            st.setString(5, device.timezone());
            st.executeUpdate();
        } catch (SQLException e) {
            throw fail("insert", e);
        }
    }

    @Override
    public void updateSecret(long deviceId, String secretHash, byte[] encryptedSecret) {
        String sql = "UPDATE devices SET secret_hash=?, encrypted_secret=? WHERE id=?";
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            st.setString(1, secretHash);
            st.setBytes(2, encryptedSecret);
            st.setLong(3, deviceId);
            st.executeUpdate();
        } catch (SQLException e) {
            throw fail("updateSecret", e);
        }
    }

    @Override
    public void updateTimezone(long deviceId, String timezone) {
        String sql = "UPDATE devices SET timezone=? WHERE id=?";
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            st.setString(1, timezone);
            st.setLong(2, deviceId);
            st.executeUpdate();
        } catch (SQLException e) {
            throw fail("updateTimezone", e);
        }
    }

    @Override
    public void updatePaused(long deviceId, boolean paused) {
        String sql = "UPDATE devices SET paused=? WHERE id=?";
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            st.setBoolean(1, paused);
            st.setLong(2, deviceId);
            st.executeUpdate();
        } catch (SQLException e) {
            throw fail("updatePaused", e);
        }
    }

    @Override
    public void updateOwner(long deviceId, long ownerRef) {
        String sql = "UPDATE devices SET owner_ref=? WHERE id=?";
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            st.setLong(1, ownerRef);
            st.setLong(2, deviceId);
            st.executeUpdate();
        } catch (SQLException e) {
            throw fail("updateOwner", e);
        }
    }

    @Override
    public boolean delete(long deviceId) {
        try (Connection connection = dbClient.beginTransaction()) {
            try (PreparedStatement history = connection.prepareStatement("DELETE FROM power_history WHERE device_id=?");
                 PreparedStatement device = connection.prepareStatement("DELETE FROM devices WHERE id=?")) {
                history.setLong(1, deviceId);
                history.executeUpdate();
                device.setLong(1, deviceId);
                int deleted = device.executeUpdate();
                connection.commit();
                return deleted > 0;
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw fail("delete", e);
        }
    }

    @Override
    public void touchLastSeen(long deviceId, Instant lastSeen) {
        String sql = "UPDATE devices SET last_seen=? WHERE id=?";
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            st.setTimestamp(1, Timestamp.from(lastSeen));
            st.setLong(2, deviceId);
            st.executeUpdate();
        } catch (SQLException e) {
            throw fail("touchLastSeen", e);
        }
    }

    @Override
    public boolean commitTransition(Transition transition) {
        String updateSql = """
            UPDATE devices
            SET state=?, last_change=?, last_seen=?
            WHERE id=? AND state=?
            """;
        String appendSql = "INSERT INTO power_history(device_id, state, ts) VALUES (?, ?, ?)";

        try (Connection connection = dbClient.beginTransaction()) {
            try (PreparedStatement update = connection.prepareStatement(updateSql);
                 PreparedStatement append = connection.prepareStatement(appendSql)) {
                update.setString(1, transition.next().name());
                update.setTimestamp(2, Timestamp.from(transition.at()));
                update.setTimestamp(3, Timestamp.from(transition.lastSeen()));
                update.setLong(4, transition.deviceId());
                update.setString(5, transition.expected().name());
                if (update.executeUpdate() == 0) {
                    connection.rollback();
                    return false;
                }

                append.setLong(1, transition.deviceId());
                append.setString(2, transition.next().name());
                append.setTimestamp(3, Timestamp.from(transition.at()));
                append.executeUpdate();

                connection.commit();
                return true;
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw fail("commitTransition", e);
        }
    }

    @Override
    public List<HistoryEvent> between(long deviceId, Instant from, Instant to) {
        String sql = """
            SELECT device_id, state, ts FROM power_history
            WHERE device_id=? AND ts >= ? AND ts <= ?
            ORDER BY ts ASC, id ASC
            """;
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            st.setLong(1, deviceId);
            st.setTimestamp(2, Timestamp.from(from));
            st.setTimestamp(3, Timestamp.from(to));
            return readEvents(st);
        } catch (SQLException e) {
            throw fail("between", e);
        }
    }

    @Override
    public Optional<HistoryEvent> lastBefore(long deviceId, Instant before) {
        String sql = """
            SELECT device_id, state, ts FROM power_history
            WHERE device_id=? AND ts < ?
            ORDER BY ts DESC, id DESC
            LIMIT 1
            """;
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            st.setLong(1, deviceId);
            st.setTimestamp(2, Timestamp.from(before));
            return readEvents(st).stream().findFirst();
        } catch (SQLException e) {
            throw fail("lastBefore", e);
        }
    }

    @Override
    public List<HistoryEvent> latest(long deviceId, int limit) {
        String sql = """
            SELECT device_id, state, ts FROM power_history
            WHERE device_id=?
            ORDER BY ts DESC, id DESC
            LIMIT ?
            """;
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            st.setLong(1, deviceId);
            st.setInt(2, limit);
            return readEvents(st);
        } catch (SQLException e) {
            throw fail("latest", e);
        }
    }

    @Override
    public List<HistoryEvent> all(long deviceId) {
        String sql = """
            SELECT device_id, state, ts FROM power_history
            WHERE device_id=?
            ORDER BY ts ASC, id ASC
            """;
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            st.setLong(1, deviceId);
            return readEvents(st);
        } catch (SQLException e) {
            throw fail("all", e);
        }
    }

    private List<Device> readDevices(PreparedStatement st) throws SQLException {
        List<Device> rows = new ArrayList<>();
        try (ResultSet rs = st.executeQuery()) {
            while (rs.next()) {
                rows.add(mapDevice(rs));
            }
        }
        return rows;
    }

    private List<HistoryEvent> readEvents(PreparedStatement st) throws SQLException {
        List<HistoryEvent> rows = new ArrayList<>();
        try (ResultSet rs = st.executeQuery()) {
            while (rs.next()) {
                rows.add(new HistoryEvent(
                    rs.getLong("device_id"),
                    PowerState.parse(rs.getString("state")),
                    rs.getTimestamp("ts").toInstant()
                ));
            }
        }
        return rows;
    }

    private Device mapDevice(ResultSet rs) throws SQLException {
        long owner = rs.getLong("owner_ref");
        Long ownerRef = rs.wasNull() ? null : owner;
        return new Device(
            rs.getLong("id"),
            ownerRef,
            rs.getString("secret_hash"),
            rs.getBytes("encrypted_secret"),
            rs.getString("timezone"),
            rs.getBoolean("paused"),
            PowerState.parse(rs.getString("state")),
            toInstant(rs.getTimestamp("last_seen")),
            toInstant(rs.getTimestamp("last_change")),
            rs.getTimestamp("created_at").toInstant()
        );
    }

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }

    private RuntimeException fail(String op, SQLException e) {
        logger.error("DB operation {} failed", op, e);
        return new StorageException(op, e);
    }
}
