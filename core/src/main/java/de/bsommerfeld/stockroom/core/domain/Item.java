package de.bsommerfeld.stockroom.core.domain;

/**
 * One inventory record. Instances are immutable snapshots of a row in the
 * {@code inventory} table.
 *
 * <p>
 * The {@code remarks} field is an append-only audit log. Every logical update
 * adds one line of the form {@code [YYYY-MM-DD HH:MM] message}; lines are
 * joined with {@code \n}. See {@link RemarksFormatter}.
 *
 * @param id          store-assigned identifier, {@code 0} before insertion
 * @param description free-form description of the asset
 * @param location    where the asset currently lives
 * @param status      free-form state (e.g. "Operational")
 * @param remarks     timestamped audit log
 */
public record Item(
        int id,
        String description,
        String location,
        String status,
        String remarks) {

    /** Marker for "not yet stored". */
    public static final int NO_ID = 0;

    /**
     * Convenience constructor for items that have not been inserted yet.
     */
    public Item(String description, String location, String status, String remarks) {
        this(NO_ID, description, location, status, remarks);
    }

    /** Returns {@code true} when this item carries a store-assigned id. */
    public boolean hasId() {
        return id > NO_ID;
    }

    public Item withId(int newId) {
        return new Item(newId, description, location, status, remarks);
    }

    public Item withRemarks(String newRemarks) {
        return new Item(id, description, location, status, newRemarks);
    }
}
