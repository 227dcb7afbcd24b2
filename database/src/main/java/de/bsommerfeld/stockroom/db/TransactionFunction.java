package de.bsommerfeld.stockroom.db;

/**
 * Like {@link TransactionCallback}, but produces a value once the
 * transaction commits.
 */
@FunctionalInterface
public interface TransactionFunction<T> {

    T apply(TransactionExecutor tx) throws InventoryException;
}
