package de.bsommerfeld.stockroom.db;

import java.sql.SQLException;

/**
 * Runs parameterized queries. The caller owns the returned cursor and must
 * close it.
 */
public interface QueryExecutor {

    SqlCursor query(String sql, Object... args) throws SQLException;
}
