package de.bsommerfeld.stockroom.db;

/**
 * The targeted item does not exist. Kept distinct from a generic
 * {@link InventoryException} so callers can tell "absent" from "broken".
 */
public class ItemNotFoundException extends InventoryException {

    public ItemNotFoundException(String operation, int itemId) {
        super(operation, itemId, "item " + itemId + " not found");
    }
}
