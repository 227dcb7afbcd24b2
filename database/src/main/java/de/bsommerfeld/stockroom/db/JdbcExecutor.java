package de.bsommerfeld.stockroom.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Shared JDBC plumbing for the store and its transactions. Subclasses only
 * decide which connection is handed out and when it may no longer be used.
 */
abstract class JdbcExecutor implements StatementExecutor, QueryExecutor {

    /**
     * The connection to run statements on.
     *
     * @throws IllegalStateException if this executor may no longer be used
     */
    abstract Connection connection();

    @Override
    public int update(String sql, Object... args) throws SQLException {
        try (PreparedStatement ps = connection().prepareStatement(sql)) {
            bind(ps, args);
            return ps.executeUpdate();
        }
    }

    @Override
    public long insert(String sql, Object... args) throws SQLException {
        Connection conn = connection();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, args);
            ps.executeUpdate();
        }
        // last_insert_rowid() is per connection, so this sees our insert
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-last-id"));
                ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                return rs.getLong(1);
            }
        }
        throw new SQLException("No row id reported for insert");
    }

    @Override
    public SqlCursor query(String sql, Object... args) throws SQLException {
        PreparedStatement ps = connection().prepareStatement(sql);
        try {
            bind(ps, args);
            return new SqlCursor(ps, ps.executeQuery());
        } catch (SQLException e) {
            ps.close();
            throw e;
        }
    }

    private static void bind(PreparedStatement ps, Object[] args) throws SQLException {
        if (args == null)
            return;
        for (int i = 0; i < args.length; i++) {
            ps.setObject(i + 1, args[i]);
        }
    }
}
