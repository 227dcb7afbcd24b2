package de.bsommerfeld.stockroom.db;

import java.sql.Connection;

/**
 * Executor bound to one open transaction. Handed to the callback of
 * {@link InventoryStore#execute} and invalidated as soon as that call
 * returns; any later use throws {@link IllegalStateException}.
 */
public final class TransactionExecutor extends JdbcExecutor {

    private final Connection connection;
    private boolean active = true;

    TransactionExecutor(Connection connection) {
        this.connection = connection;
    }

    @Override
    Connection connection() {
        if (!active) {
            throw new IllegalStateException("Transaction already resolved");
        }
        return connection;
    }

    public boolean isActive() {
        return active;
    }

    void invalidate() {
        active = false;
    }
}
