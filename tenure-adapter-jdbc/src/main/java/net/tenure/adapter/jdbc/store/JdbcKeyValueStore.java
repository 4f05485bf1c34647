package net.tenure.adapter.jdbc.store;

import net.tenure.adapter.jdbc.JdbcUtil;
import net.tenure.adapter.jdbc.TxContext;
import net.tenure.adapter.jdbc.mapper.RowMappers;
import net.tenure.core.model.KeyEntry;
import net.tenure.core.spi.Clock;
import net.tenure.core.spi.KeyValueStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * TTL keys over TB_LEASE_KEY.
 * Expiry is evaluated against the store's clock: a row with EXPIRES_AT <= now does not exist
 * for reads, and is purged by the next SET NX on the same key.
 */
public final class JdbcKeyValueStore implements KeyValueStore {
    private final Clock clock;

    public JdbcKeyValueStore(Clock clock) {
        this.clock = clock;
    }

    // === utils ===
    private Connection mustConn() {
        return TxContext.require();
    }

    // === interface impl ===

    /**
     * SET NX PX:
     * 1) purge an expired row for the key
     * 2) INSERT under a savepoint; a primary key conflict means the key is live
     */
    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) throws Exception {
        Connection c = mustConn();
        long now = clock.now().toEpochMilli();

        try (var ps = c.prepareStatement("DELETE FROM TB_LEASE_KEY WHERE KEY_NAME = ? AND EXPIRES_AT <= ?")) {
            ps.setString(1, key);
            ps.setLong(2, now);
            ps.executeUpdate();
        }

        Savepoint sp = c.setSavepoint();
        try (var ps = c.prepareStatement("""
            INSERT INTO TB_LEASE_KEY (KEY_NAME, KEY_VALUE, EXPIRES_AT, WRITTEN_AT)
            VALUES (?, ?, ?, ?)
        """)) {
            ps.setString(1, key);
            ps.setString(2, value);
            ps.setLong(3, now + ttl.toMillis());
            ps.setLong(4, now);
            ps.executeUpdate();
        } catch (SQLException e) {
            if (!JdbcUtil.isUniqueViolation(e)) throw e;
            c.rollback(sp);
            return false;
        }
        c.releaseSavepoint(sp);
        return true;
    }

    @Override
    public Optional<String> get(String key) throws Exception {
        return entry(key).map(KeyEntry::value);
    }

    /** PEXPIRE: no owner check. */
    @Override
    public boolean expire(String key, Duration ttl) throws Exception {
        long now = clock.now().toEpochMilli();
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_LEASE_KEY
               SET EXPIRES_AT = ?,
                   WRITTEN_AT = ?
             WHERE KEY_NAME = ?
               AND EXPIRES_AT > ?
        """)) {
            ps.setLong(1, now + ttl.toMillis());
            ps.setLong(2, now);
            ps.setString(3, key);
            ps.setLong(4, now);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public void delete(String key) throws Exception {
        try (var ps = mustConn().prepareStatement("DELETE FROM TB_LEASE_KEY WHERE KEY_NAME = ?")) {
            ps.setString(1, key);
            ps.executeUpdate();
        }
    }

    @Override
    public Optional<KeyEntry> entry(String key) throws Exception {
        Instant now = clock.now();
        try (var ps = mustConn().prepareStatement("""
            SELECT * FROM TB_LEASE_KEY WHERE KEY_NAME = ? AND EXPIRES_AT > ?
        """)) {
            ps.setString(1, key);
            ps.setLong(2, now.toEpochMilli());
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toKeyEntry(rs)) : Optional.empty();
            }
        }
    }
}
