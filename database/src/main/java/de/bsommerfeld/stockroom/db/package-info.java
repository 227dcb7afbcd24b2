/**
 * Persistence layer for inventory items, backed by SQLite.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [CLI / Interchange]
 *          │
 *          ▼
 *   InventoryRepository   ← facade, one transaction per write
 *          │
 *          ▼
 *   ItemRecords           ← stateless operations on an executor
 *      ┌───┴──────────────┐
 *      │                  │
 *  InventoryStore   TransactionExecutor
 *  (auto-commit)    (inside execute)
 * </pre>
 *
 * Both executors implement {@link de.bsommerfeld.stockroom.db.StatementExecutor}
 * and {@link de.bsommerfeld.stockroom.db.QueryExecutor}, which keeps
 * {@link de.bsommerfeld.stockroom.db.ItemRecords} unaware of whether it runs
 * inside a transaction.
 *
 * <h2>Schema</h2>
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ inventory                                                         │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK, auto)   │ Assigned from sqlite_sequence, floor 1000     │
 * │ description      │ Free text                                     │
 * │ location         │ Free text                                     │
 * │ status           │ Free text                                     │
 * │ remarks          │ Append-only audit log, one stamped line each  │
 * └──────────────────┴────────────────────────────────────────────────┘
 * </pre>
 *
 * The counter lives in SQLite's own {@code sqlite_sequence} table under the
 * name {@code inventory}. It is seeded once when the file is created and only
 * moves through inserts or an explicit
 * {@link de.bsommerfeld.stockroom.db.ItemRecords#resetSequence reset}.
 *
 * <h2>SQL File Inventory</h2>
 * DDL is in {@code schema.sql}; every other statement is in {@code sql/*.sql},
 * loaded via {@link de.bsommerfeld.stockroom.db.SqlLoader}:
 * <ul>
 * <li>{@code init-sequence.sql} - seed the counter if missing</li>
 * <li>{@code reset-sequence.sql} - set the counter to the floor</li>
 * <li>{@code select-sequence.sql} - read the counter</li>
 * <li>{@code select-last-id.sql} - id of the last insert on this connection</li>
 * <li>{@code insert-item.sql} - insert with auto id</li>
 * <li>{@code replace-item.sql} - INSERT OR REPLACE by id</li>
 * <li>{@code update-item.sql} - replace fields, append remarks</li>
 * <li>{@code append-remarks.sql} - append remarks only</li>
 * <li>{@code delete-item.sql} - delete by id</li>
 * <li>{@code select-item.sql} - single row</li>
 * <li>{@code select-all-items.sql} - all rows by id</li>
 * <li>{@code select-items-after.sql} - keyset page</li>
 * <li>{@code select-items.sql} - iterator base, filter appended at runtime</li>
 * </ul>
 */
package de.bsommerfeld.stockroom.db;
