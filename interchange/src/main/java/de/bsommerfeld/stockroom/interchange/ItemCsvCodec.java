package de.bsommerfeld.stockroom.interchange;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
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
 * Reads and writes inventory rows as CSV.
 *
 * <pre>
 * id,description,location,status,remarks
 * 1001,UPS,Rack 1,Operational,"[2025-06-21 14:30] installed
 * [2025-06-22 09:00] replaced battery"
 * </pre>
 *
 * The first row is always the header. Fields holding separators, quotes or
 * line breaks are quoted, so multi-line remarks survive a round trip. Every
 * data row must have exactly five columns; a blank id means "assign one".
 */
@Singleton
public class ItemCsvCodec {

    public static final String[] HEADER = { "id", "description", "location", "status", "remarks" };

    private final CsvMapper mapper = new CsvMapper();

    /**
     * Writes the header and then every item the iterator yields.
     *
     * @return number of data rows written
     */
    public int write(Writer out, ItemIterator items) throws InterchangeException, InventoryException {
        int count = 0;
        try (SequenceWriter rows = mapper.writerFor(String[].class)
                .with(CsvSchema.emptySchema())
                .with(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
                .writeValues(out)) {
            rows.write(HEADER);
            Optional<Item> next;
            while ((next = items.next()).isPresent()) {
                rows.write(toRow(next.get()));
                count++;
            }
        } catch (IOException e) {
            throw new InterchangeException("Failed to write CSV", e);
        }
        return count;
    }

    /**
     * Parses every data row. Nothing is returned unless the whole input is
     * valid.
     *
     * @throws InterchangeException on malformed CSV, a row without exactly
     *                              five columns, or an id that is not an
     *                              integer
     */
    public List<Item> read(Reader in) throws InterchangeException {
        List<Item> items = new ArrayList<>();
        int record = 0;
        try (MappingIterator<String[]> rows = mapper.readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .readValues(in)) {
            while (rows.hasNextValue()) {
                String[] row = rows.nextValue();
                record++;
                if (row.length != HEADER.length) {
                    throw new InterchangeException("CSV record " + record + " has " + row.length
                            + " columns, expected " + HEADER.length);
                }
                if (record == 1) {
                    continue; // header
                }
                items.add(fromRow(row, record));
            }
        } catch (IOException | RuntimeException e) {
            throw new InterchangeException("Malformed CSV near record " + (record + 1), e);
        }
        return items;
    }

    static String[] toRow(Item item) {
        return new String[] {
                Integer.toString(item.id()),
                item.description(),
                item.location(),
                item.status(),
                item.remarks()
        };
    }

    private static Item fromRow(String[] row, int record) throws InterchangeException {
        String rawId = row[0].trim();
        int id = Item.NO_ID;
        if (!rawId.isEmpty()) {
            try {
                id = Integer.parseInt(rawId);
            } catch (NumberFormatException e) {
                throw new InterchangeException("CSV record " + record + " has invalid id '" + rawId + "'", e);
            }
        }
        return new Item(id, row[1], row[2], row[3], row[4]);
    }
}
