package de.bsommerfeld.stockroom.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs whole commands through Guice against a database file in a temp
 * directory.
 */
class StockroomCliTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... command) {
        String[] args = new String[command.length + 4];
        args[0] = "--db";
        args[1] = tempDir.resolve("inventory.db").toString();
        args[2] = "--config";
        args[3] = tempDir.resolve("config.toml").toString();
        System.arraycopy(command, 0, args, 4, command.length);
        return StockroomCli.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void addThenShow_shouldPersistAcrossRuns() {
        assertEquals(StockroomCli.EXIT_OK, run("add", "UPS", "Rack 1", "Operational", "installed"));
        assertTrue(stdout().contains("Added item 1001"), stdout());

        assertEquals(StockroomCli.EXIT_OK, run("log", "1001", "replaced battery"));
        assertEquals(StockroomCli.EXIT_OK, run("show", "1001"));

        assertTrue(stdout().matches("(?s).*#1001 UPS.*\\] installed\n.*\\] replaced battery.*"), stdout());
        assertTrue(Files.exists(tempDir.resolve("config.toml")));
    }

    @Test
    void show_ofMissingItem_shouldExitWithFailure() {
        assertEquals(StockroomCli.EXIT_FAILURE, run("show", "4242"));
        assertTrue(stderr().contains("4242"), stderr());
    }

    @Test
    void unknownCommand_shouldExitWithUsage() {
        assertEquals(StockroomCli.EXIT_USAGE, run("frobnicate"));
    }

    @Test
    void unknownOption_shouldExitWithUsage() {
        int code = StockroomCli.run(new String[] { "--nope" },
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));

        assertEquals(StockroomCli.EXIT_USAGE, code);
        assertTrue(stderr().contains("Usage:"));
    }

    @Test
    void help_shouldPrintUsage() {
        int code = StockroomCli.run(new String[0],
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));

        assertEquals(StockroomCli.EXIT_OK, code);
        assertTrue(stdout().contains("export-csv <file>"));
    }

    @Test
    void unopenableDatabase_shouldExitWithFailure() throws Exception {
        Path blocker = Files.createFile(tempDir.resolve("blocker"));
        int code = StockroomCli.run(new String[] {
                "--db", blocker.resolve("inventory.db").toString(),
                "--config", tempDir.resolve("config.toml").toString(),
                "list" },
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));

        assertEquals(StockroomCli.EXIT_FAILURE, code);
        assertTrue(stderr().contains("Failed to open inventory"), stderr());
    }

    @Test
    void exportAndImportCsv_shouldRoundTrip() {
        run("add", "UPS", "Rack 1", "Operational", "installed");
        Path csv = tempDir.resolve("out.csv");

        assertEquals(StockroomCli.EXIT_OK, run("export-csv", csv.toString()));
        assertEquals(StockroomCli.EXIT_OK, run("delete", "1001"));
        assertEquals(StockroomCli.EXIT_OK, run("import-csv", csv.toString()));
        assertEquals(StockroomCli.EXIT_OK, run("show", "1001"));

        assertTrue(stdout().contains("Imported 1 records"));
    }
}
