package de.bsommerfeld.stockroom.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.ZoneId;

/**
 * Settings for the audit timestamps written into the remarks field.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RemarksConfig {

    @JsonProperty("time-zone")
    private String timeZone = "";

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    /**
     * Resolves {@link #getTimeZone()} to a {@link ZoneId}, falling back to the
     * system default when the value is blank.
     *
     * @throws java.time.DateTimeException if the configured id is not a valid zone
     */
    @JsonIgnore
    public ZoneId zoneId() {
        if (timeZone == null || timeZone.isBlank()) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(timeZone.trim());
    }
}
