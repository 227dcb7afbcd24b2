package de.bsommerfeld.stockroom.db;

import java.sql.SQLException;

/**
 * Runs parameterized write statements. Implemented by the store itself
 * (auto-commit) and by {@link TransactionExecutor}, so {@link ItemRecords}
 * does not care which one it is given.
 */
public interface StatementExecutor {

    /**
     * Executes {@code sql} with positional {@code args}.
     *
     * @return number of rows affected
     */
    int update(String sql, Object... args) throws SQLException;

    /**
     * Executes an {@code INSERT} and returns the row id SQLite assigned to it.
     */
    long insert(String sql, Object... args) throws SQLException;
}
