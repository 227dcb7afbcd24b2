package de.bsommerfeld.stockroom.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.stockroom.core.domain.Item;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.OptionalLong;

/**
 * Single entry point for inventory data: binds {@link ItemRecords} to one
 * owned {@link InventoryStore}.
 *
 * <p>
 * Every mutating call runs in its own transaction. Reads go straight to the
 * store. For several writes that must succeed or fail together, use
 * {@link #execute} and call {@link #records()} with the executor it hands out.
 *
 * <p>
 * Synchronous and not thread-safe, like the store beneath it.
 */
@Singleton
public class InventoryRepository implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(InventoryRepository.class);

    private final InventoryStore store;
    private final ItemRecords records;

    @Inject
    public InventoryRepository(InventoryStore store, ItemRecords records) {
        this.store = store;
        this.records = records;
    }

    // -- Writes (one transaction each) --

    /** Adds an item with an auto-assigned id and returns the stored copy. */
    public Item add(Item item) throws InventoryException {
        Item stored = store.executeAndGet(tx -> records.add(tx, item));
        LOG.info("Added item {} ({})", stored.id(), stored.description());
        return stored;
    }

    /** Inserts or fully replaces the row with {@code item.id()}. */
    public Item appendItem(Item item) throws InventoryException {
        return store.executeAndGet(tx -> records.appendItem(tx, item));
    }

    /**
     * @return {@code false} if the id does not exist
     */
    public boolean edit(Item item) throws InventoryException {
        return store.executeAndGet(tx -> records.edit(tx, item));
    }

    /**
     * @throws ItemNotFoundException if the id does not exist
     */
    public void appendRemarksEntry(int id, String message) throws InventoryException {
        store.execute(tx -> records.appendRemarksEntry(tx, id, message));
    }

    /**
     * @return {@code false} if the id did not exist
     */
    public boolean delete(int id) throws InventoryException {
        boolean deleted = store.executeAndGet(tx -> records.delete(tx, id));
        if (deleted) {
            LOG.info("Deleted item {}", id);
        }
        return deleted;
    }

    /** Resets the id sequence to the store's configured floor. */
    public void resetSequence() throws InventoryException {
        store.execute(tx -> records.resetSequence(tx, store.indexStart()));
    }

    // -- Reads --

    public OptionalLong currentSequence() throws InventoryException {
        return records.currentSequence(store);
    }

    /**
     * @throws ItemNotFoundException if the id does not exist
     */
    public Item getById(int id) throws InventoryException {
        return records.getById(store, id);
    }

    public List<Item> listAll() throws InventoryException {
        return records.listAll(store);
    }

    public List<Item> listPaged(int afterId, int limit) throws InventoryException {
        return records.listPaged(store, afterId, limit);
    }

    /**
     * Opens a streaming iterator; the caller must close it.
     *
     * @see ItemIterator#open
     */
    public ItemIterator newIterator(String filter, Object... args) throws InventoryException {
        return records.iterate(store, filter, args);
    }

    // -- Grouped writes --

    /** Runs {@code work} in one transaction. */
    public void execute(TransactionCallback work) throws InventoryException {
        store.execute(work);
    }

    /** Runs {@code work} in one transaction and returns its result. */
    public <T> T executeAndGet(TransactionFunction<T> work) throws InventoryException {
        return store.executeAndGet(work);
    }

    /** The record operations, for use with the executor of {@link #execute}. */
    public ItemRecords records() {
        return records;
    }

    public InventoryStore store() {
        return store;
    }

    @Override
    public void close() {
        store.close();
    }
}
