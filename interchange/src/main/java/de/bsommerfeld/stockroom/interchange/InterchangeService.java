package de.bsommerfeld.stockroom.interchange;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.stockroom.core.domain.Item;
import de.bsommerfeld.stockroom.db.InventoryException;
import de.bsommerfeld.stockroom.db.InventoryRepository;
import de.bsommerfeld.stockroom.db.ItemIterator;
import de.bsommerfeld.stockroom.db.ItemRecords;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Moves the whole inventory table in and out of CSV and JSON files.
 *
 * <p>
 * Exports stream rows through an {@link ItemIterator}, so the table is never
 * held in memory. Imports parse the complete input first and then write
 * every item in a single transaction: an item with an id is inserted or
 * replaced under that id, an item without one is added with a fresh id. A
 * failure anywhere leaves the store unchanged.
 */
@Singleton
public class InterchangeService {

    private static final Logger LOG = LoggerFactory.getLogger(InterchangeService.class);

    private final InventoryRepository repository;
    private final ItemCsvCodec csv;
    private final ItemJsonCodec json;

    @Inject
    public InterchangeService(InventoryRepository repository, ItemCsvCodec csv, ItemJsonCodec json) {
        this.repository = repository;
        this.csv = csv;
        this.json = json;
    }

    // =====================================================================
    // CSV
    // =====================================================================

    /** @return number of rows exported */
    public int exportCsv(Path file) throws InterchangeException, InventoryException {
        int count;
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                ItemIterator items = repository.newIterator("")) {
            count = csv.write(out, items);
        } catch (IOException e) {
            throw new InterchangeException("Failed to write " + file, e);
        }
        LOG.info("Exported {} rows to {}", count, file);
        return count;
    }

    /** @return number of rows imported */
    public int importCsv(Path file) throws InterchangeException, InventoryException {
        List<Item> items;
        try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            items = csv.read(in);
        } catch (IOException e) {
            throw new InterchangeException("Failed to read " + file, e);
        }
        int count = store(items);
        LOG.info("Imported {} records from {}", count, file);
        return count;
    }

    // =====================================================================
    // JSON
    // =====================================================================

    /** @return number of items exported */
    public int exportJson(Path file) throws InterchangeException, InventoryException {
        int count;
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                ItemIterator items = repository.newIterator("")) {
            count = json.write(out, items);
        } catch (IOException e) {
            throw new InterchangeException("Failed to write " + file, e);
        }
        LOG.info("Exported {} items to {}", count, file);
        return count;
    }

    public String exportJsonToString() throws InterchangeException, InventoryException {
        StringWriter out = new StringWriter();
        try (ItemIterator items = repository.newIterator("")) {
            json.write(out, items);
        }
        return out.toString();
    }

    /** @return number of items imported */
    public int importJson(Path file) throws InterchangeException, InventoryException {
        List<Item> items;
        try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            items = json.read(in);
        } catch (IOException e) {
            throw new InterchangeException("Failed to read " + file, e);
        }
        int count = store(items);
        LOG.info("Imported {} items from {}", count, file);
        return count;
    }

    /** @return number of items imported */
    public int importJsonFromString(String content) throws InterchangeException, InventoryException {
        return store(json.read(new StringReader(content)));
    }

    /**
     * Returns the content of a JSON file re-indented for display.
     */
    public String viewJson(Path file) throws InterchangeException {
        try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return json.prettyPrint(in);
        } catch (IOException e) {
            throw new InterchangeException("Failed to read " + file, e);
        }
    }

    // =====================================================================
    // Internal
    // =====================================================================

    private int store(List<Item> items) throws InterchangeException, InventoryException {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i).id() < Item.NO_ID) {
                throw new InterchangeException("Item " + (i + 1) + " has negative id " + items.get(i).id());
            }
        }
        ItemRecords records = repository.records();
        repository.execute(tx -> {
            for (Item item : items) {
                if (item.hasId()) {
                    records.appendItem(tx, item);
                } else {
                    records.add(tx, item);
                }
            }
        });
        return items.size();
    }
}
