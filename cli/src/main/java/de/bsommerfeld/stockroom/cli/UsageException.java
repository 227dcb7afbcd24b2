package de.bsommerfeld.stockroom.cli;

/**
 * Command line could not be understood. Maps to exit code
 * {@value StockroomCli#EXIT_USAGE}.
 */
public class UsageException extends Exception {

    public UsageException(String message) {
        super(message);
    }

    public UsageException(String message, Throwable cause) {
        super(message, cause);
    }
}
