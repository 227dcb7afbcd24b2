package de.bsommerfeld.stockroom.cli;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CliOptionsTest {

    @Test
    void parse_shouldReadGlobalOptionsBeforeCommand() throws Exception {
        CliOptions options = CliOptions.parse("--db", "inv.db", "--config", "c.toml", "--verbose",
                "add", "UPS", "Rack 1", "Operational");

        assertEquals("inv.db", options.database());
        assertEquals(Paths.get("c.toml"), options.configFile());
        assertTrue(options.verbose());
        assertEquals("add", options.command());
        assertEquals(List.of("UPS", "Rack 1", "Operational"), options.arguments());
    }

    @Test
    void parse_shouldPassLaterDashesToCommand() throws Exception {
        CliOptions options = CliOptions.parse("log", "1001", "--verbose");

        assertFalse(options.verbose());
        assertEquals(List.of("1001", "--verbose"), options.arguments());
    }

    @Test
    void parse_withoutCommand_shouldMeanHelp() throws Exception {
        assertEquals("help", CliOptions.parse().command());
        assertEquals("help", CliOptions.parse("--verbose").command());
        assertEquals("help", CliOptions.parse("--help", "list").command());
    }

    @Test
    void parse_shouldRejectUnknownOption() {
        assertThrows(UsageException.class, () -> CliOptions.parse("--colour", "list"));
    }

    @Test
    void parse_shouldRejectMissingOptionValue() {
        assertThrows(UsageException.class, () -> CliOptions.parse("--db"));
        assertThrows(UsageException.class, () -> CliOptions.parse("--config", " ", "list"));
    }
}
