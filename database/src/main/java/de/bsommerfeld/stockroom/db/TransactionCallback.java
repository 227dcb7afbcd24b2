package de.bsommerfeld.stockroom.db;

/**
 * Unit of work run inside {@link InventoryStore#execute}. Throwing rolls the
 * whole transaction back.
 */
@FunctionalInterface
public interface TransactionCallback {

    void run(TransactionExecutor tx) throws InventoryException;
}
