package de.bsommerfeld.stockroom.cli;

import de.bsommerfeld.stockroom.core.domain.Item;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ItemPrinterTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final ItemPrinter printer = new ItemPrinter(new PrintStream(buffer, true, StandardCharsets.UTF_8));

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    @Test
    void print_shouldIndentEachRemarksLine() {
        printer.print(new Item(1001, "UPS", "Rack 1", "Operational",
                "[2025-06-21 14:30] installed\n[2025-06-22 09:00] replaced battery"));

        assertEquals("#1001 UPS\n"
                + "  location: Rack 1\n"
                + "  status:   Operational\n"
                + "  remarks:\n"
                + "    [2025-06-21 14:30] installed\n"
                + "    [2025-06-22 09:00] replaced battery\n", output());
    }

    @Test
    void print_shouldOmitEmptyRemarks() {
        printer.print(new Item(7, "PDU", "", "Spare", ""));

        assertFalse(output().contains("remarks"));
    }

    @Test
    void printAll_shouldMarkEmptyResult() {
        printer.printAll(List.of());

        assertEquals("(no items)\n", output());
    }
}
