package de.bsommerfeld.stockroom.db;

import java.sql.SQLException;

/**
 * A transaction could not be started or committed. Failures of the work
 * inside a transaction are rethrown as they are and never wrapped in this type.
 */
public class TransactionException extends InventoryException {

    public enum Phase {
        BEGIN,
        COMMIT
    }

    private final Phase phase;

    public TransactionException(Phase phase, SQLException cause) {
        super(phase == Phase.BEGIN ? "begin transaction" : "commit transaction", cause);
        this.phase = phase;
    }

    public Phase getPhase() {
        return phase;
    }
}
