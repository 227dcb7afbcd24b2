package de.bsommerfeld.stockroom.cli;

import ch.qos.logback.classic.Level;
import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import de.bsommerfeld.stockroom.db.InventoryException;
import de.bsommerfeld.stockroom.db.InventoryStore;
import de.bsommerfeld.stockroom.db.StoreBootstrapException;
import de.bsommerfeld.stockroom.interchange.InterchangeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Entry point of the {@code stockroom} command.
 *
 * <h3>Exit codes</h3>
 * <ul>
 * <li>{@value #EXIT_OK} - command succeeded (including no-op edits and
 * deletes)</li>
 * <li>{@value #EXIT_FAILURE} - the store could not be opened, or an operation
 * or file transfer failed</li>
 * <li>{@value #EXIT_USAGE} - the command line could not be understood</li>
 * </ul>
 */
public final class StockroomCli {

    private static final Logger LOG = LoggerFactory.getLogger(StockroomCli.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private StockroomCli() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs one command and returns its exit code. Never calls
     * {@link System#exit}.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (UsageException e) {
            err.println(e.getMessage());
            err.println(CommandDispatcher.USAGE);
            return EXIT_USAGE;
        }

        if ("help".equals(options.command())) {
            out.println(CommandDispatcher.USAGE);
            return EXIT_OK;
        }
        if (options.verbose()) {
            enableDebugLogging();
        }

        Injector injector;
        try {
            injector = Guice.createInjector(new StockroomModule(options.configFile(), options.database(), out));
        } catch (CreationException e) {
            err.println("Failed to start: " + rootMessage(e));
            LOG.debug("Injector creation failed", e);
            return EXIT_FAILURE;
        }

        InventoryStore store = null;
        try {
            store = injector.getInstance(InventoryStore.class);
            injector.getInstance(CommandDispatcher.class).dispatch(options.command(), options.arguments());
            return EXIT_OK;
        } catch (UsageException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        } catch (InventoryException | InterchangeException e) {
            err.println("Error: " + e.getMessage());
            LOG.debug("Command {} failed", options.command(), e);
            return EXIT_FAILURE;
        } catch (ProvisionException e) {
            String prefix = e.getCause() instanceof StoreBootstrapException
                    ? "Failed to open inventory: "
                    : "Failed to start: ";
            err.println(prefix + rootMessage(e));
            LOG.debug("Provisioning failed", e);
            return EXIT_FAILURE;
        } finally {
            if (store != null) {
                store.close();
            }
        }
    }

    private static void enableDebugLogging() {
        ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME)).setLevel(Level.DEBUG);
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
