package de.bsommerfeld.stockroom.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link StockroomConfig} from a TOML file.
 *
 * <p>
 * A missing file is not an error: the defaults are written to {@code path}
 * so the user has a template to edit, and the defaults are returned.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private final ObjectMapper mapper = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    /**
     * Loads the configuration at {@code path}, creating it with defaults when
     * absent.
     *
     * @throws IOException if the file exists but cannot be read or parsed, or
     *                     the default file cannot be written
     */
    public StockroomConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            StockroomConfig defaults = new StockroomConfig();
            write(path, defaults);
            LOG.info("Created default configuration at {}", path.toAbsolutePath());
            return defaults;
        }
        LOG.debug("Loading configuration from {}", path.toAbsolutePath());
        return mapper.readValue(path.toFile(), StockroomConfig.class);
    }

    /** Serializes {@code config} to {@code path}, creating parent directories. */
    public void write(Path path, StockroomConfig config) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(path.toFile(), config);
    }
}
