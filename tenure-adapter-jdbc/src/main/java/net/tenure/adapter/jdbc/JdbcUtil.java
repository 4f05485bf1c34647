package net.tenure.adapter.jdbc;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class JdbcUtil {
    private JdbcUtil() {}

    /** Primary key / unique constraint violation, across H2, PostgreSQL, MySQL and Oracle. */
    public static boolean isUniqueViolation(SQLException e) {
        for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
            String state = cur.getSQLState();
            if ("23505".equals(state)) return true;
            if ("23000".equals(state) && (cur.getErrorCode() == 1 || cur.getErrorCode() == 1062)) return true;
        }
        return false;
    }

    public static Long getNullableLong(ResultSet rs, String column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : v;
    }
}
