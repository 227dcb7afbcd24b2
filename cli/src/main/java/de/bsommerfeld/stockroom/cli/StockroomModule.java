package de.bsommerfeld.stockroom.cli;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.stockroom.core.config.ApplicationMode;
import de.bsommerfeld.stockroom.core.config.ConfigLoader;
import de.bsommerfeld.stockroom.core.config.DatabaseConfig;
import de.bsommerfeld.stockroom.core.config.RemarksConfig;
import de.bsommerfeld.stockroom.core.config.StockroomConfig;
import de.bsommerfeld.stockroom.core.domain.RemarksFormatter;
import de.bsommerfeld.stockroom.core.util.StorageUtils;
import de.bsommerfeld.stockroom.db.InventoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Guice wiring for the command-line tool.
 *
 * <p>
 * Loads {@code config.toml} (creating it with defaults on first run) and
 * binds the configuration sections. The {@link InventoryStore} is a
 * singleton opened on first injection; in {@link ApplicationMode#TEST} it is
 * always in-memory unless {@code --db} names a location.
 */
public class StockroomModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(StockroomModule.class);

    private final Path configFile;
    private final String databaseOverride;
    private final PrintStream out;

    /**
     * @param configFile       configuration file, {@code null} for the
     *                         platform default
     * @param databaseOverride database location that wins over the
     *                         configuration, or {@code null}
     * @param out              where command output is printed
     */
    public StockroomModule(Path configFile, String databaseOverride, PrintStream out) {
        this.configFile = configFile;
        this.databaseOverride = databaseOverride;
        this.out = out;
    }

    @Override
    protected void configure() {
        Path configPath = configFile != null ? configFile : StorageUtils.getConfigFile(StorageUtils.APP_NAME);
        LOG.debug("Loading configuration from: {}", configPath.toAbsolutePath());

        StockroomConfig config;
        try {
            config = new ConfigLoader().load(configPath);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load configuration " + configPath, e);
        }

        bind(StockroomConfig.class).toInstance(config);
        bind(DatabaseConfig.class).toInstance(config.getDatabase());
        bind(RemarksConfig.class).toInstance(config.getRemarks());
        bind(ItemPrinter.class).toInstance(new ItemPrinter(out));
    }

    @Provides
    @Singleton
    Clock clock(RemarksConfig remarks) {
        return Clock.system(remarks.zoneId());
    }

    @Provides
    @Singleton
    RemarksFormatter remarksFormatter(Clock clock) {
        return new RemarksFormatter(clock);
    }

    @Provides
    @Singleton
    InventoryStore inventoryStore(DatabaseConfig database) {
        return InventoryStore.open(resolveLocation(database), database.getIndexStart());
    }

    /**
     * Command-line override first, then TEST mode, then the configured path,
     * then the default file in the application data directory.
     */
    String resolveLocation(DatabaseConfig database) {
        if (databaseOverride != null && !databaseOverride.isBlank()) {
            return databaseOverride;
        }
        ApplicationMode mode = ApplicationMode.get();
        if (mode.usesInMemoryStore()) {
            LOG.info("Application mode {}: using in-memory inventory", mode);
            return InventoryStore.IN_MEMORY;
        }
        String path = database.getPath();
        if (path != null && !path.isBlank()) {
            return path;
        }
        return StorageUtils.getDefaultDatabaseFile(StorageUtils.APP_NAME).toString();
    }
}
