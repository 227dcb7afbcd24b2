package de.bsommerfeld.stockroom.cli;

import de.bsommerfeld.stockroom.core.domain.Item;

import java.io.PrintStream;
import java.util.List;

/**
 * Renders items for the terminal, one block per item:
 *
 * <pre>
 * #1001 UPS
 *   location: Rack 1
 *   status:   Operational
 *   remarks:
 *     [2025-06-21 14:30] installed
 * </pre>
 */
public class ItemPrinter {

    private final PrintStream out;

    public ItemPrinter(PrintStream out) {
        this.out = out;
    }

    public void print(Item item) {
        out.println("#" + item.id() + " " + item.description());
        out.println("  location: " + item.location());
        out.println("  status:   " + item.status());
        if (item.remarks().isEmpty()) {
            return;
        }
        out.println("  remarks:");
        for (String line : item.remarks().split("\n")) {
            out.println("    " + line);
        }
    }

    public void printAll(List<Item> items) {
        if (items.isEmpty()) {
            out.println("(no items)");
            return;
        }
        items.forEach(this::print);
    }

    public void message(String text) {
        out.println(text);
    }
}
