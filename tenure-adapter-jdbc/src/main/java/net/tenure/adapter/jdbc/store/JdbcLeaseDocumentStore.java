package net.tenure.adapter.jdbc.store;

import net.tenure.adapter.jdbc.JdbcUtil;
import net.tenure.adapter.jdbc.TxContext;
import net.tenure.adapter.jdbc.mapper.RowMappers;
import net.tenure.core.model.LeaseDocument;
import net.tenure.core.spi.DuplicateKeyException;
import net.tenure.core.spi.LeaseDocumentStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Optional;

/** Lease documents as rows of TB_LEASE_DOCUMENT. Needs a transaction from a TxRunner. */
public final class JdbcLeaseDocumentStore implements LeaseDocumentStore {

    // === utils ===
    private Connection mustConn() {
        return TxContext.require();
    }

    // === interface impl ===

    /** Single UPDATE; the row lock makes concurrent takeovers serialize. */
    @Override
    public boolean updateIfExpired(String id, String owner, long expiresAt, long now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_LEASE_DOCUMENT
               SET OWNER_ID   = ?,
                   EXPIRES_AT = ?,
                   UPDATED_AT = ?
             WHERE ID = ?
               AND (EXPIRES_AT IS NULL OR EXPIRES_AT < ?)
        """)) {
            ps.setString(1, owner);
            ps.setLong(2, expiresAt);
            ps.setLong(3, now);
            ps.setString(4, id);
            ps.setLong(5, now);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public void insert(LeaseDocument doc) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_LEASE_DOCUMENT (ID, OWNER_ID, EXPIRES_AT, UPDATED_AT)
            VALUES (?, ?, ?, ?)
        """)) {
            ps.setString(1, doc.id());
            ps.setString(2, doc.owner());
            if (doc.expiresAt() == null) ps.setNull(3, Types.BIGINT); else ps.setLong(3, doc.expiresAt());
            ps.setLong(4, doc.updatedAt());
            ps.executeUpdate();
        } catch (SQLException e) {
            if (JdbcUtil.isUniqueViolation(e)) throw new DuplicateKeyException(doc.id(), e);
            throw e;
        }
    }

    /** Fencing update: only the current owner can move the expiry. */
    @Override
    public boolean updateIfOwner(String id, String owner, long expiresAt, long now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_LEASE_DOCUMENT
               SET EXPIRES_AT = ?,
                   UPDATED_AT = ?
             WHERE ID = ?
               AND OWNER_ID = ?
        """)) {
            ps.setLong(1, expiresAt);
            ps.setLong(2, now);
            ps.setString(3, id);
            ps.setString(4, owner);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public void delete(String id) throws Exception {
        try (var ps = mustConn().prepareStatement("DELETE FROM TB_LEASE_DOCUMENT WHERE ID = ?")) {
            ps.setString(1, id);
            ps.executeUpdate();
        }
    }

    @Override
    public void deleteAll() throws Exception {
        try (var st = mustConn().createStatement()) {
            st.executeUpdate("DELETE FROM TB_LEASE_DOCUMENT");
        }
    }

    @Override
    public Optional<LeaseDocument> findById(String id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_LEASE_DOCUMENT WHERE ID = ?")) {
            ps.setString(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toLeaseDocument(rs)) : Optional.empty();
            }
        }
    }
}
