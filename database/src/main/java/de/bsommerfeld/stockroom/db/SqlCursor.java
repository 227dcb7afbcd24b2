package de.bsommerfeld.stockroom.db;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * An open result set together with the statement that produced it. Closing
 * the cursor releases both; further {@link #close()} calls do nothing.
 */
public final class SqlCursor implements AutoCloseable {

    private final PreparedStatement statement;
    private final ResultSet resultSet;
    private boolean closed;

    SqlCursor(PreparedStatement statement, ResultSet resultSet) {
        this.statement = statement;
        this.resultSet = resultSet;
    }

    /** Advances to the next row; {@code false} once the rows are used up. */
    public boolean next() throws SQLException {
        return resultSet.next();
    }

    /** The current row. Only valid after {@link #next()} returned {@code true}. */
    public ResultSet row() {
        return resultSet;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() throws SQLException {
        if (closed)
            return;
        closed = true;
        try {
            resultSet.close();
        } finally {
            statement.close();
        }
    }
}
