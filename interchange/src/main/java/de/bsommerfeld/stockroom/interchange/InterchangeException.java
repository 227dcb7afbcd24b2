package de.bsommerfeld.stockroom.interchange;

/**
 * Raised when import or export data cannot be read, written or decoded:
 * malformed CSV or JSON, a wrong column count, an unparseable id, or file I/O.
 *
 * <p>
 * Store failures during an import are not wrapped; they surface as
 * {@link de.bsommerfeld.stockroom.db.InventoryException}.
 */
public class InterchangeException extends Exception {

    public InterchangeException(String message) {
        super(message);
    }

    public InterchangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
