package de.bsommerfeld.stockroom.db;

import de.bsommerfeld.stockroom.core.domain.Item;

import java.sql.SQLException;
import java.util.Optional;

/**
 * Forward-only, single-pass stream over inventory rows, ordered by id.
 *
 * <p>
 * Rows are read from an open cursor one at a time, so memory use stays flat
 * regardless of table size. The iterator cannot be restarted and must only be
 * used by one thread. Always close it; {@link #close()} is safe to call more
 * than once and before any row was read.
 *
 * <pre>{@code
 * try (ItemIterator it = repository.newIterator("WHERE status = ?", "Operational")) {
 *     Optional<Item> next;
 *     while ((next = it.next()).isPresent()) {
 *         ...
 *     }
 * }
 * }</pre>
 */
public final class ItemIterator implements AutoCloseable {

    private final SqlCursor cursor;
    private boolean exhausted;

    private ItemIterator(SqlCursor cursor) {
        this.cursor = cursor;
    }

    /**
     * Runs the query and positions the iterator before the first row.
     *
     * @param filter empty or {@code null} for all rows, otherwise a predicate
     *               with {@code ?} placeholders, with or without a leading
     *               {@code WHERE}
     * @param args   values for the placeholders in {@code filter}
     * @throws InventoryException if the query cannot be prepared or run,
     *                            including a malformed filter
     */
    public static ItemIterator open(QueryExecutor query, String filter, Object... args) throws InventoryException {
        String sql = buildQuery(filter);
        try {
            return new ItemIterator(query.query(sql, args));
        } catch (SQLException e) {
            throw new InventoryException("open iterator", e);
        }
    }

    static String buildQuery(String filter) {
        StringBuilder sql = new StringBuilder(SqlLoader.load("select-items"));
        if (filter != null && !filter.isBlank()) {
            String predicate = filter.trim();
            sql.append('\n');
            if (!predicate.regionMatches(true, 0, "WHERE", 0, 5)) {
                sql.append("WHERE ");
            }
            sql.append(predicate);
        }
        return sql.append("\nORDER BY id").toString();
    }

    /**
     * Advances by one row.
     *
     * @return the next item, or empty once all rows were read
     * @throws InventoryException    if the row cannot be read or decoded
     * @throws IllegalStateException if the iterator was closed
     */
    public Optional<Item> next() throws InventoryException {
        if (cursor.isClosed()) {
            throw new IllegalStateException("Iterator is closed");
        }
        if (exhausted) {
            return Optional.empty();
        }
        try {
            if (!cursor.next()) {
                exhausted = true;
                return Optional.empty();
            }
            return Optional.of(ItemRecords.mapItem(cursor.row()));
        } catch (SQLException e) {
            throw new InventoryException("read next row", e);
        }
    }

    public boolean isClosed() {
        return cursor.isClosed();
    }

    @Override
    public void close() throws InventoryException {
        try {
            cursor.close();
        } catch (SQLException e) {
            throw new InventoryException("close iterator", e);
        }
    }
}
