package de.bsommerfeld.stockroom.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.stockroom.core.domain.Item;
import de.bsommerfeld.stockroom.core.domain.RemarksFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * Read and write operations on the {@code inventory} table.
 *
 * <p>
 * Writes take a {@link StatementExecutor} and reads a {@link QueryExecutor},
 * so the same code runs standalone against the store or inside a transaction
 * handed out by {@link InventoryStore#execute}. The class holds no database
 * state; its only dependency is the {@link RemarksFormatter} that stamps
 * remarks.
 *
 * <h3>Remarks are append-only</h3>
 * {@link #edit} and {@link #appendRemarksEntry} extend the remarks column with
 * a single {@code UPDATE} whose value expression reads the current column and
 * concatenates in the same statement. There is no read-modify-write in Java,
 * so two appends to the same row can never lose each other's line. Only
 * {@link #add} and {@link #appendItem} write the column from scratch.
 *
 * <h3>Missing ids</h3>
 * {@link #edit} and {@link #delete} treat a missing id as a no-op and report it
 * through their return value. {@link #appendRemarksEntry} and {@link #getById}
 * throw {@link ItemNotFoundException} instead: an explicit audit append is
 * expected to target a known record.
 */
@Singleton
public class ItemRecords {

    private static final Logger LOG = LoggerFactory.getLogger(ItemRecords.class);

    private final RemarksFormatter formatter;

    @Inject
    public ItemRecords(RemarksFormatter formatter) {
        this.formatter = formatter;
    }

    // =====================================================================
    // Writes
    // =====================================================================

    /**
     * Inserts {@code item} with an auto-assigned id. Any id on the input is
     * ignored.
     *
     * @return the stored item, carrying its new id and formatted remarks
     */
    public Item add(StatementExecutor exec, Item item) throws InventoryException {
        String remarks = formatter.format(item.remarks());
        try {
            long id = exec.insert(SqlLoader.load("insert-item"),
                    item.description(), item.location(), item.status(), remarks);
            LOG.debug("[DB] Added item {}", id);
            return new Item(Math.toIntExact(id), item.description(), item.location(), item.status(), remarks);
        } catch (SQLException e) {
            throw new InventoryException("add", e);
        }
    }

    /**
     * Inserts {@code item} under its own id, replacing every column of an
     * existing row with that id. The previous remarks are discarded.
     *
     * @throws IllegalArgumentException if {@code item} has no id
     */
    public Item appendItem(StatementExecutor exec, Item item) throws InventoryException {
        if (!item.hasId()) {
            throw new IllegalArgumentException("appendItem requires an id, got " + item.id());
        }
        String remarks = formatter.format(item.remarks());
        try {
            exec.update(SqlLoader.load("replace-item"),
                    item.id(), item.description(), item.location(), item.status(), remarks);
            LOG.debug("[DB] Stored item {} (insert or replace)", item.id());
            return item.withRemarks(remarks);
        } catch (SQLException e) {
            throw new InventoryException("insert or replace", item.id(), e);
        }
    }

    /**
     * Replaces description, location and status of {@code item.id()} and
     * appends its formatted remarks as a new audit line. Blank remarks still
     * append a timestamp-only line so the edit itself is recorded.
     *
     * @return {@code false} if no row has that id (not an error)
     */
    public boolean edit(StatementExecutor exec, Item item) throws InventoryException {
        String entry = formatter.format(item.remarks());
        try {
            int rows = exec.update(SqlLoader.load("update-item"),
                    item.description(), item.location(), item.status(), entry, entry, item.id());
            if (rows == 0) {
                LOG.debug("[DB] Edit skipped, item {} does not exist", item.id());
                return false;
            }
            LOG.debug("[DB] Edited item {}", item.id());
            return true;
        } catch (SQLException e) {
            throw new InventoryException("edit", item.id(), e);
        }
    }

    /**
     * Appends one timestamped line to the remarks of item {@code id} without
     * touching any other column.
     *
     * @throws ItemNotFoundException if no row has that id
     */
    public void appendRemarksEntry(StatementExecutor exec, int id, String message) throws InventoryException {
        String entry = formatter.format(message);
        int rows;
        try {
            rows = exec.update(SqlLoader.load("append-remarks"), entry, entry, id);
        } catch (SQLException e) {
            throw new InventoryException("append remarks to", id, e);
        }
        if (rows == 0) {
            throw new ItemNotFoundException("append remarks to", id);
        }
        LOG.debug("[DB] Appended remarks entry to item {}", id);
    }

    /**
     * Deletes item {@code id}.
     *
     * @return {@code false} if no row had that id (not an error)
     */
    public boolean delete(StatementExecutor exec, int id) throws InventoryException {
        try {
            int rows = exec.update(SqlLoader.load("delete-item"), id);
            LOG.debug("[DB] Deleted {} row(s) for item {}", rows, id);
            return rows > 0;
        } catch (SQLException e) {
            throw new InventoryException("delete", id, e);
        }
    }

    /**
     * Sets the id sequence back to {@code floor}. The next auto-assigned id is
     * {@code floor + 1} unless rows with higher ids still exist, in which case
     * SQLite continues above the highest one.
     */
    public void resetSequence(StatementExecutor exec, int floor) throws InventoryException {
        try {
            if (exec.update(SqlLoader.load("reset-sequence"), floor) == 0) {
                // Counter row was removed behind our back
                exec.update(SqlLoader.load("init-sequence"), floor);
            }
            LOG.info("[DB] Reset id sequence to {}", floor);
        } catch (SQLException e) {
            throw new InventoryException("reset sequence", e);
        }
    }

    // =====================================================================
    // Reads
    // =====================================================================

    /**
     * Current value of the id sequence, or empty if the counter row is
     * missing.
     */
    public OptionalLong currentSequence(QueryExecutor query) throws InventoryException {
        try (SqlCursor cursor = query.query(SqlLoader.load("select-sequence"))) {
            return cursor.next() ? OptionalLong.of(cursor.row().getLong(1)) : OptionalLong.empty();
        } catch (SQLException e) {
            throw new InventoryException("read sequence", e);
        }
    }

    /**
     * @throws ItemNotFoundException if no row has that id
     */
    public Item getById(QueryExecutor query, int id) throws InventoryException {
        try (SqlCursor cursor = query.query(SqlLoader.load("select-item"), id)) {
            if (!cursor.next()) {
                throw new ItemNotFoundException("get", id);
            }
            return mapItem(cursor.row());
        } catch (SQLException e) {
            throw new InventoryException("get", id, e);
        }
    }

    /**
     * Every row ordered by id. Loads the whole table; use {@link #listPaged}
     * or {@link ItemIterator} for large inventories.
     */
    public List<Item> listAll(QueryExecutor query) throws InventoryException {
        try (SqlCursor cursor = query.query(SqlLoader.load("select-all-items"))) {
            return collect(cursor);
        } catch (SQLException e) {
            throw new InventoryException("list", e);
        }
    }

    /**
     * Up to {@code limit} rows with an id greater than {@code afterId},
     * ordered by id. Pass the last id of one page as {@code afterId} of the
     * next.
     *
     * @throws IllegalArgumentException if {@code limit} is not positive
     */
    public List<Item> listPaged(QueryExecutor query, int afterId, int limit) throws InventoryException {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        try (SqlCursor cursor = query.query(SqlLoader.load("select-items-after"), afterId, limit)) {
            return collect(cursor);
        } catch (SQLException e) {
            throw new InventoryException("list page", e);
        }
    }

    /**
     * Opens a streaming iterator. See {@link ItemIterator#open}.
     */
    public ItemIterator iterate(QueryExecutor query, String filter, Object... args) throws InventoryException {
        return ItemIterator.open(query, filter, args);
    }

    private static List<Item> collect(SqlCursor cursor) throws SQLException {
        List<Item> items = new ArrayList<>();
        while (cursor.next()) {
            items.add(mapItem(cursor.row()));
        }
        return items;
    }

    /**
     * Maps the current row. NULL text columns (possible after a raw import)
     * are read as empty strings.
     */
    static Item mapItem(ResultSet rs) throws SQLException {
        return new Item(
                rs.getInt("id"),
                text(rs, "description"),
                text(rs, "location"),
                text(rs, "status"),
                text(rs, "remarks"));
    }

    private static String text(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        return value == null ? "" : value;
    }
}
