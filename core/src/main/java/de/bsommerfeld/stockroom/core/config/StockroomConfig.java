package de.bsommerfeld.stockroom.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Each section maps to its own class so the
 * TOML layout mirrors the object graph.
 *
 * @see ConfigLoader
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StockroomConfig {

    @JsonProperty("database")
    private DatabaseConfig database = new DatabaseConfig();

    @JsonProperty("remarks")
    private RemarksConfig remarks = new RemarksConfig();

    public DatabaseConfig getDatabase() {
        return database;
    }

    public RemarksConfig getRemarks() {
        return remarks;
    }
}
