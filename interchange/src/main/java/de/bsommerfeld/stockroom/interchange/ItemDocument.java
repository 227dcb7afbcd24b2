package de.bsommerfeld.stockroom.interchange;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import de.bsommerfeld.stockroom.core.domain.Item;

/**
 * JSON shape of an {@link Item}: an object with lowercase keys. Missing keys
 * decode as {@code 0} (id) or an empty string.
 */
@JsonPropertyOrder({ "id", "description", "location", "status", "remarks" })
record ItemDocument(
        @JsonProperty("id") int id,
        @JsonProperty("description") String description,
        @JsonProperty("location") String location,
        @JsonProperty("status") String status,
        @JsonProperty("remarks") String remarks) {

    static ItemDocument of(Item item) {
        return new ItemDocument(item.id(), item.description(), item.location(), item.status(), item.remarks());
    }

    Item toItem() {
        return new Item(id, nullToEmpty(description), nullToEmpty(location), nullToEmpty(status),
                nullToEmpty(remarks));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
