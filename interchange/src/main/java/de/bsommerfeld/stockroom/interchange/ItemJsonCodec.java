package de.bsommerfeld.stockroom.interchange;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.type.CollectionType;
import com.google.inject.Singleton;
import de.bsommerfeld.stockroom.core.domain.Item;
import de.bsommerfeld.stockroom.db.InventoryException;
import de.bsommerfeld.stockroom.db.ItemIterator;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JSON encoding of items: a single object, or an array of objects for a
 * whole table. Output is pretty printed with two-space indentation and one
 * array element per line block:
 *
 * <pre>
 * [
 *   {
 *     "id": 1001,
 *     "description": "UPS",
 *     ...
 *   }
 * ]
 * </pre>
 *
 * Unknown keys are ignored on input.
 */
@Singleton
public class ItemJsonCodec {

    private final ObjectMapper mapper;
    private final ObjectWriter writer;
    private final CollectionType listType;

    public ItemJsonCodec() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.writer = mapper.writer(prettyPrinter());
        this.listType = mapper.getTypeFactory().constructCollectionType(List.class, ItemDocument.class);
    }

    private static DefaultPrettyPrinter prettyPrinter() {
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter();
        printer.indentArraysWith(indenter);
        printer.indentObjectsWith(indenter);
        return printer.withSeparators(Separators.createDefaultInstance()
                .withObjectFieldValueSpacing(Separators.Spacing.AFTER));
    }

    // -- Single item --

    public String toJson(Item item) throws InterchangeException {
        try {
            return writer.writeValueAsString(ItemDocument.of(item));
        } catch (JsonProcessingException e) {
            throw new InterchangeException("Failed to encode item " + item.id(), e);
        }
    }

    public Item fromJson(String json) throws InterchangeException {
        try {
            ItemDocument document = mapper.readValue(json, ItemDocument.class);
            if (document == null) {
                throw new InterchangeException("JSON input is empty");
            }
            return document.toItem();
        } catch (JsonProcessingException e) {
            throw new InterchangeException("Malformed item JSON", e);
        }
    }

    // -- Whole table --

    /**
     * Streams every item the iterator yields into one JSON array.
     *
     * @return number of items written
     */
    public int write(Writer out, ItemIterator items) throws InterchangeException, InventoryException {
        int count = 0;
        try (JsonGenerator generator = writer.createGenerator(out)) {
            generator.writeStartArray();
            Optional<Item> next;
            while ((next = items.next()).isPresent()) {
                generator.writeObject(ItemDocument.of(next.get()));
                count++;
            }
            generator.writeEndArray();
        } catch (IOException e) {
            throw new InterchangeException("Failed to write JSON", e);
        }
        return count;
    }

    public String writeAll(List<Item> items) throws InterchangeException {
        List<ItemDocument> documents = new ArrayList<>(items.size());
        for (Item item : items) {
            documents.add(ItemDocument.of(item));
        }
        try {
            return writer.writeValueAsString(documents);
        } catch (JsonProcessingException e) {
            throw new InterchangeException("Failed to encode items", e);
        }
    }

    /**
     * Decodes a JSON array of items.
     *
     * @throws InterchangeException if the input is not a JSON array of objects
     */
    public List<Item> read(Reader in) throws InterchangeException {
        List<ItemDocument> documents;
        try {
            documents = mapper.readValue(in, listType);
        } catch (IOException e) {
            throw new InterchangeException("Malformed JSON", e);
        }
        if (documents == null) {
            throw new InterchangeException("JSON input is empty");
        }
        List<Item> items = new ArrayList<>(documents.size());
        for (ItemDocument document : documents) {
            if (document == null) {
                throw new InterchangeException("JSON array contains null at index " + items.size());
            }
            items.add(document.toItem());
        }
        return items;
    }

    /**
     * Re-indents arbitrary JSON for display. The content is not checked
     * against the item shape.
     */
    public String prettyPrint(Reader in) throws InterchangeException {
        try {
            JsonNode tree = mapper.readTree(in);
            if (tree == null || tree.isMissingNode()) {
                throw new InterchangeException("JSON input is empty");
            }
            return writer.writeValueAsString(tree);
        } catch (IOException e) {
            throw new InterchangeException("Malformed JSON", e);
        }
    }
}
