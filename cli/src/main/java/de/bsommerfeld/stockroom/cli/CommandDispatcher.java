package de.bsommerfeld.stockroom.cli;

import com.google.inject.Inject;
import de.bsommerfeld.stockroom.core.domain.Item;
import de.bsommerfeld.stockroom.db.InventoryException;
import de.bsommerfeld.stockroom.db.InventoryRepository;
import de.bsommerfeld.stockroom.db.ItemIterator;
import de.bsommerfeld.stockroom.interchange.InterchangeException;
import de.bsommerfeld.stockroom.interchange.InterchangeService;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Maps a command name and its arguments onto the repository and the
 * interchange service, and prints the result.
 *
 * <p>
 * Argument errors surface as {@link UsageException}; everything the store or
 * the file codecs report is passed through unchanged so the caller can map it
 * to an exit code.
 */
public class CommandDispatcher {

    static final String USAGE = String.join("\n",
            "Usage: stockroom [--db <path>] [--config <file>] [--verbose] <command> [args]",
            "",
            "Commands:",
            "  add <description> <location> <status> [remarks]",
            "  edit <id> <description> <location> <status> [remarks]",
            "  replace <id> <description> <location> <status> [remarks]",
            "  log <id> <message>",
            "  delete <id>",
            "  show <id>",
            "  list",
            "  page <afterId> <limit>",
            "  find <status>",
            "  reset-sequence",
            "  export-csv <file>",
            "  import-csv <file>",
            "  export-json [file]",
            "  import-json <file>",
            "  view-json <file>",
            "  help",
            "",
            "Use --db :memory: for a throwaway in-memory database.");

    private final InventoryRepository repository;
    private final InterchangeService interchange;
    private final ItemPrinter printer;

    @Inject
    public CommandDispatcher(InventoryRepository repository, InterchangeService interchange, ItemPrinter printer) {
        this.repository = repository;
        this.interchange = interchange;
        this.printer = printer;
    }

    public void dispatch(String command, List<String> args)
            throws UsageException, InventoryException, InterchangeException {
        switch (command) {
            case "add" -> add(args);
            case "edit" -> edit(args);
            case "replace" -> replace(args);
            case "log" -> log(args);
            case "delete" -> delete(args);
            case "show" -> show(args);
            case "list" -> list(args);
            case "page" -> page(args);
            case "find" -> find(args);
            case "reset-sequence" -> resetSequence(args);
            case "export-csv" -> exportCsv(args);
            case "import-csv" -> importCsv(args);
            case "export-json" -> exportJson(args);
            case "import-json" -> importJson(args);
            case "view-json" -> viewJson(args);
            case "help" -> printer.message(USAGE);
            default -> throw new UsageException("Unknown command '" + command + "'");
        }
    }

    // =====================================================================
    // Record commands
    // =====================================================================

    private void add(List<String> args) throws UsageException, InventoryException {
        arity(args, 3, 4, "add <description> <location> <status> [remarks]");
        Item stored = repository.add(new Item(args.get(0), args.get(1), args.get(2), optional(args, 3)));
        printer.message("Added item " + stored.id());
    }

    private void edit(List<String> args) throws UsageException, InventoryException {
        arity(args, 4, 5, "edit <id> <description> <location> <status> [remarks]");
        int id = id(args.get(0));
        if (repository.edit(new Item(id, args.get(1), args.get(2), args.get(3), optional(args, 4)))) {
            printer.message("Updated item " + id);
        } else {
            printer.message("Item " + id + " does not exist, nothing changed");
        }
    }

    private void replace(List<String> args) throws UsageException, InventoryException {
        arity(args, 4, 5, "replace <id> <description> <location> <status> [remarks]");
        int id = id(args.get(0));
        repository.appendItem(new Item(id, args.get(1), args.get(2), args.get(3), optional(args, 4)));
        printer.message("Stored item " + id);
    }

    private void log(List<String> args) throws UsageException, InventoryException {
        arity(args, 2, 2, "log <id> <message>");
        int id = id(args.get(0));
        repository.appendRemarksEntry(id, args.get(1));
        printer.message("Logged entry on item " + id);
    }

    private void delete(List<String> args) throws UsageException, InventoryException {
        arity(args, 1, 1, "delete <id>");
        int id = id(args.get(0));
        if (repository.delete(id)) {
            printer.message("Deleted item " + id);
        } else {
            printer.message("Item " + id + " does not exist, nothing changed");
        }
    }

    private void show(List<String> args) throws UsageException, InventoryException {
        arity(args, 1, 1, "show <id>");
        printer.print(repository.getById(id(args.get(0))));
    }

    private void list(List<String> args) throws UsageException, InventoryException {
        arity(args, 0, 0, "list");
        printer.printAll(repository.listAll());
    }

    private void page(List<String> args) throws UsageException, InventoryException {
        arity(args, 2, 2, "page <afterId> <limit>");
        int afterId = number(args.get(0), "afterId");
        int limit = number(args.get(1), "limit");
        if (limit <= 0) {
            throw new UsageException("limit must be positive");
        }
        printer.printAll(repository.listPaged(afterId, limit));
    }

    private void find(List<String> args) throws UsageException, InventoryException {
        arity(args, 1, 1, "find <status>");
        int found = 0;
        try (ItemIterator it = repository.newIterator("status = ?", args.get(0))) {
            Optional<Item> next;
            while ((next = it.next()).isPresent()) {
                printer.print(next.get());
                found++;
            }
        }
        if (found == 0) {
            printer.message("(no items)");
        }
    }

    private void resetSequence(List<String> args) throws UsageException, InventoryException {
        arity(args, 0, 0, "reset-sequence");
        repository.resetSequence();
        OptionalLong current = repository.currentSequence();
        printer.message("Id sequence reset to " + (current.isPresent() ? current.getAsLong() : "?"));
    }

    // =====================================================================
    // Interchange commands
    // =====================================================================

    private void exportCsv(List<String> args) throws UsageException, InventoryException, InterchangeException {
        arity(args, 1, 1, "export-csv <file>");
        Path file = Paths.get(args.get(0));
        printer.message("Exported " + interchange.exportCsv(file) + " rows to " + file);
    }

    private void importCsv(List<String> args) throws UsageException, InventoryException, InterchangeException {
        arity(args, 1, 1, "import-csv <file>");
        Path file = Paths.get(args.get(0));
        printer.message("Imported " + interchange.importCsv(file) + " records from " + file);
    }

    private void exportJson(List<String> args) throws UsageException, InventoryException, InterchangeException {
        arity(args, 0, 1, "export-json [file]");
        if (args.isEmpty()) {
            printer.message(interchange.exportJsonToString());
            return;
        }
        Path file = Paths.get(args.get(0));
        printer.message("Exported " + interchange.exportJson(file) + " items to " + file);
    }

    private void importJson(List<String> args) throws UsageException, InventoryException, InterchangeException {
        arity(args, 1, 1, "import-json <file>");
        Path file = Paths.get(args.get(0));
        printer.message("Imported " + interchange.importJson(file) + " items from " + file);
    }

    private void viewJson(List<String> args) throws UsageException, InterchangeException {
        arity(args, 1, 1, "view-json <file>");
        printer.message(interchange.viewJson(Paths.get(args.get(0))));
    }

    // =====================================================================
    // Argument helpers
    // =====================================================================

    private static void arity(List<String> args, int min, int max, String usage) throws UsageException {
        if (args.size() < min || args.size() > max) {
            throw new UsageException("Usage: stockroom " + usage);
        }
    }

    private static String optional(List<String> args, int index) {
        return index < args.size() ? args.get(index) : "";
    }

    private static int id(String raw) throws UsageException {
        int id = number(raw, "id");
        if (id <= 0) {
            throw new UsageException("id must be positive, got " + id);
        }
        return id;
    }

    private static int number(String raw, String name) throws UsageException {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new UsageException(name + " must be an integer, got '" + raw + "'", e);
        }
    }
}
