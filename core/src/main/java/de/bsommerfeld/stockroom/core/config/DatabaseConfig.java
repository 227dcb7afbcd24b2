package de.bsommerfeld.stockroom.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Location of the SQLite file and the id sequence floor.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DatabaseConfig {

    /** Default sequence floor; the first auto-assigned id is one above it. */
    public static final int DEFAULT_INDEX_START = 1000;

    // Empty means <app-data>/stockroom.db
    @JsonProperty("path")
    private String path = "";

    @JsonProperty("index-start")
    private int indexStart = DEFAULT_INDEX_START;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public int getIndexStart() {
        return indexStart;
    }

    public void setIndexStart(int indexStart) {
        this.indexStart = indexStart;
    }
}
