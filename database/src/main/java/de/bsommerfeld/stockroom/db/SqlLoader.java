package de.bsommerfeld.stockroom.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches SQL statements from classpath resources.
 *
 * <p>
 * Statements live in {@code sql/<operation>-<subject>.sql}, e.g.
 * {@code sql/append-remarks.sql}; the DDL lives in {@code schema.sql} at the
 * classpath root. Each file is read once and cached for the lifetime of the
 * JVM.
 *
 * @see InventoryStore
 * @see ItemRecords
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the statement in {@code sql/<name>.sql}, trimmed.
     *
     * @param name the file stem without path prefix or extension
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent("sql/" + name + ".sql", SqlLoader::readResource);
    }

    /**
     * Returns the individual DDL statements of {@code schema.sql}. The file is
     * split on semicolons that end a line; blank fragments are dropped.
     *
     * @throws IllegalStateException if {@code schema.sql} is missing
     */
    public static List<String> schemaStatements() {
        String schema = CACHE.computeIfAbsent("schema.sql", SqlLoader::readResource);
        List<String> statements = new ArrayList<>();
        for (String sql : schema.split(";\\s*(\\r?\\n|$)")) {
            if (!sql.isBlank()) {
                statements.add(sql.trim());
            }
        }
        return statements;
    }

    private static String readResource(String path) {
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
