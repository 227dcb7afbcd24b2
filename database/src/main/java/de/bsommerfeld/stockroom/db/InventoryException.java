package de.bsommerfeld.stockroom.db;

import de.bsommerfeld.stockroom.core.domain.Item;

/**
 * Thrown when an operation against the inventory store fails. Carries the
 * operation name and, where one applies, the id of the item involved so the
 * caller can log or display it without parsing the message.
 */
public class InventoryException extends Exception {

    private final String operation;
    private final int itemId;

    public InventoryException(String operation, Throwable cause) {
        this(operation, Item.NO_ID, cause);
    }

    public InventoryException(String operation, int itemId, Throwable cause) {
        super(describe(operation, itemId, cause == null ? null : cause.getMessage()), cause);
        this.operation = operation;
        this.itemId = itemId;
    }

    protected InventoryException(String operation, int itemId, String detail) {
        super(describe(operation, itemId, detail));
        this.operation = operation;
        this.itemId = itemId;
    }

    public String getOperation() {
        return operation;
    }

    /** Id of the affected item, or {@link Item#NO_ID} when none applies. */
    public int getItemId() {
        return itemId;
    }

    private static String describe(String operation, int itemId, String detail) {
        StringBuilder sb = new StringBuilder(operation);
        if (itemId != Item.NO_ID) {
            sb.append(" item ").append(itemId);
        }
        sb.append(" failed");
        if (detail != null && !detail.isEmpty()) {
            sb.append(": ").append(detail);
        }
        return sb.toString();
    }
}
