package net.tenure.adapter.jdbc.mapper;

import net.tenure.adapter.jdbc.JdbcUtil;
import net.tenure.core.model.KeyEntry;
import net.tenure.core.model.LeaseDocument;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

public final class RowMappers {
    private RowMappers() {}

    // --- TB_LEASE_DOCUMENT ---
    public static LeaseDocument toLeaseDocument(ResultSet rs) throws SQLException {
        return new LeaseDocument(
                rs.getString("ID"),
                rs.getString("OWNER_ID"),
                JdbcUtil.getNullableLong(rs, "EXPIRES_AT"),
                rs.getLong("UPDATED_AT")
        );
    }

    // --- TB_LEASE_KEY ---
    public static KeyEntry toKeyEntry(ResultSet rs) throws SQLException {
        return new KeyEntry(
                rs.getString("KEY_NAME"),
                rs.getString("KEY_VALUE"),
                Instant.ofEpochMilli(rs.getLong("EXPIRES_AT")),
                Instant.ofEpochMilli(rs.getLong("WRITTEN_AT"))
        );
    }
}
