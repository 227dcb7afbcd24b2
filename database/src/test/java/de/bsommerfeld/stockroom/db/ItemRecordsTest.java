package de.bsommerfeld.stockroom.db;

import de.bsommerfeld.stockroom.core.domain.Item;
import de.bsommerfeld.stockroom.core.domain.RemarksFormatter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Record operations run directly against an in-memory store (auto-commit
 * executor) with a fixed clock, so every stamp is "[2025-06-21 14:30]".
 */
class ItemRecordsTest {

    private static final String TS = "[2025-06-21 14:30]";

    private InventoryStore store;
    private ItemRecords records;

    @BeforeEach
    void setUp() {
        store = InventoryStore.openInMemory(1000);
        records = new ItemRecords(
                new RemarksFormatter(Clock.fixed(Instant.parse("2025-06-21T14:30:00Z"), ZoneOffset.UTC)));
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    // -- Add --

    @Test
    void add_shouldAssignIdAboveFloorAndStampRemarks() throws Exception {
        Item stored = records.add(store, new Item("UPS", "Rack 1", "Operational", "installed"));

        assertEquals(1001, stored.id());
        assertEquals(TS + " installed", stored.remarks());
        assertEquals(stored, records.getById(store, 1001));
    }

    @Test
    void add_shouldIgnoreIdOnInput() throws Exception {
        Item stored = records.add(store, new Item(42, "UPS", "Rack 1", "Operational", ""));

        assertEquals(1001, stored.id());
        assertThrows(ItemNotFoundException.class, () -> records.getById(store, 42));
    }

    @Test
    void add_shouldStoreBareStampForBlankRemarks() throws Exception {
        Item stored = records.add(store, new Item("UPS", "Rack 1", "Operational", ""));
        assertEquals(TS + " ", records.getById(store, stored.id()).remarks());
    }

    @Test
    void add_shouldKeepAlreadyStampedRemarks() throws Exception {
        String history = "[2020-01-01 08:00] bought\n[2021-02-03 09:10] moved";
        Item stored = records.add(store, new Item("UPS", "Rack 1", "Operational", history));
        assertEquals(history, records.getById(store, stored.id()).remarks());
    }

    // -- AppendItem --

    @Test
    void appendItem_shouldInsertUnderGivenId() throws Exception {
        records.appendItem(store, new Item(7, "Switch", "Rack 3", "Spare", "boxed"));

        Item loaded = records.getById(store, 7);
        assertEquals("Switch", loaded.description());
        assertEquals(TS + " boxed", loaded.remarks());
    }

    @Test
    void appendItem_shouldReplaceExistingRowIncludingRemarks() throws Exception {
        Item first = records.add(store, new Item("UPS", "Rack 1", "Operational", "installed"));
        records.appendRemarksEntry(store, first.id(), "battery swapped");

        records.appendItem(store, new Item(first.id(), "UPS v2", "Rack 9", "Retired", "replaced unit"));

        Item loaded = records.getById(store, first.id());
        assertEquals(new Item(first.id(), "UPS v2", "Rack 9", "Retired", TS + " replaced unit"), loaded);
        assertEquals(1, records.listAll(store).size());
    }

    @Test
    void appendItem_shouldRejectMissingId() {
        assertThrows(IllegalArgumentException.class,
                () -> records.appendItem(store, new Item("x", "y", "z", "")));
    }

    // -- Edit --

    @Test
    void edit_shouldReplaceFieldsAndAppendRemarks() throws Exception {
        Item stored = records.add(store, new Item("UPS", "Rack 1", "Operational", "installed"));

        boolean updated = records.edit(store, new Item(stored.id(), "UPS 3kVA", "Rack 2", "Maintenance", "moved"));

        assertTrue(updated);
        Item loaded = records.getById(store, stored.id());
        assertEquals("UPS 3kVA", loaded.description());
        assertEquals("Rack 2", loaded.location());
        assertEquals("Maintenance", loaded.status());
        assertEquals(TS + " installed\n" + TS + " moved", loaded.remarks());
    }

    @Test
    void edit_withBlankRemarks_shouldStillAppendStampLine() throws Exception {
        Item stored = records.add(store, new Item("UPS", "Rack 1", "Operational", "installed"));

        records.edit(store, new Item(stored.id(), "UPS", "Rack 1", "Operational", "  "));

        assertEquals(TS + " installed\n" + TS + " ", records.getById(store, stored.id()).remarks());
    }

    @Test
    void edit_shouldBeSilentNoOpForMissingId() throws Exception {
        assertFalse(records.edit(store, new Item(9999, "x", "y", "z", "note")));
        assertTrue(records.listAll(store).isEmpty());
    }

    // -- AppendRemarksEntry --

    @Test
    void appendRemarksEntry_shouldAppendOneLinePerCallInOrder() throws Exception {
        Item stored = records.add(store, new Item("UPS", "Rack 1", "Operational", "installed"));

        for (int i = 1; i <= 5; i++) {
            records.appendRemarksEntry(store, stored.id(), "check " + i);
        }

        String[] lines = records.getById(store, stored.id()).remarks().split("\n", -1);
        assertEquals(6, lines.length);
        assertEquals(TS + " installed", lines[0]);
        for (int i = 1; i <= 5; i++) {
            assertEquals(TS + " check " + i, lines[i]);
            assertTrue(RemarksFormatter.isStamped(lines[i]));
        }
    }

    @Test
    void appendRemarksEntry_shouldLeaveOtherFieldsAlone() throws Exception {
        Item stored = records.add(store, new Item("UPS", "Rack 1", "Operational", "installed"));

        records.appendRemarksEntry(store, stored.id(), "replaced battery");

        Item loaded = records.getById(store, stored.id());
        assertEquals("UPS", loaded.description());
        assertEquals("Rack 1", loaded.location());
        assertEquals("Operational", loaded.status());
        assertEquals(TS + " installed\n" + TS + " replaced battery", loaded.remarks());
    }

    @Test
    void appendRemarksEntry_shouldNotStartWithNewlineWhenRemarksEmpty() throws Exception {
        store.update("INSERT INTO inventory (id, description, location, status, remarks) VALUES (?, ?, ?, ?, ?)",
                5, "raw", "import", "unknown", null);

        records.appendRemarksEntry(store, 5, "first note");

        assertEquals(TS + " first note", records.getById(store, 5).remarks());
    }

    @Test
    void appendRemarksEntry_shouldFailForMissingId() {
        ItemNotFoundException e = assertThrows(ItemNotFoundException.class,
                () -> records.appendRemarksEntry(store, 4242, "ghost"));
        assertEquals(4242, e.getItemId());
        assertTrue(e.getMessage().contains("4242"));
    }

    // -- Delete --

    @Test
    void delete_shouldRemoveRow() throws Exception {
        Item stored = records.add(store, new Item("UPS", "Rack 1", "Operational", ""));

        assertTrue(records.delete(store, stored.id()));
        assertThrows(ItemNotFoundException.class, () -> records.getById(store, stored.id()));
    }

    @Test
    void delete_shouldBeSilentNoOpForMissingId() throws Exception {
        assertFalse(records.delete(store, 4242));
    }

    @Test
    void delete_shouldNotReuseIdForNextAdd() throws Exception {
        Item a = records.add(store, new Item("A", "", "", ""));
        Item b = records.add(store, new Item("B", "", "", ""));
        records.delete(store, b.id());

        Item c = records.add(store, new Item("C", "", "", ""));

        assertEquals(1001, a.id());
        assertEquals(1003, c.id());
    }

    // -- Sequence --

    @Test
    void resetSequence_shouldReturnCounterToFloorAfterDeletes() throws Exception {
        for (int i = 0; i < 3; i++) {
            Item stored = records.add(store, new Item("I" + i, "", "", ""));
            records.delete(store, stored.id());
        }
        assertEquals(OptionalLong.of(1003), records.currentSequence(store));

        records.resetSequence(store, 1000);
        assertEquals(OptionalLong.of(1000), records.currentSequence(store));
        records.resetSequence(store, 1000);
        assertEquals(OptionalLong.of(1000), records.currentSequence(store));

        assertEquals(1001, records.add(store, new Item("fresh", "", "", "")).id());
    }

    @Test
    void resetSequence_shouldContinueAboveRemainingRows() throws Exception {
        records.appendItem(store, new Item(1500, "kept", "", "", ""));
        records.resetSequence(store, 1000);

        assertEquals(1501, records.add(store, new Item("next", "", "", "")).id());
    }

    @Test
    void resetSequence_shouldRecreateMissingCounterRow() throws Exception {
        store.update("DELETE FROM sqlite_sequence WHERE name = 'inventory'");
        assertEquals(OptionalLong.empty(), records.currentSequence(store));

        records.resetSequence(store, 1000);

        assertEquals(OptionalLong.of(1000), records.currentSequence(store));
    }

    // -- Reads --

    @Test
    void getById_shouldDistinguishNotFoundFromFailure() throws Exception {
        InventoryException notFound = assertThrows(InventoryException.class, () -> records.getById(store, 1));
        assertInstanceOf(ItemNotFoundException.class, notFound);
        assertEquals("get", notFound.getOperation());
        assertEquals(1, notFound.getItemId());

        store.update("DROP TABLE inventory");
        InventoryException broken = assertThrows(InventoryException.class, () -> records.getById(store, 7));
        assertFalse(broken instanceof ItemNotFoundException);
        assertEquals("get", broken.getOperation());
        assertEquals(7, broken.getItemId());
        assertInstanceOf(SQLException.class, broken.getCause());

        store.close();
        assertThrows(IllegalStateException.class, () -> records.getById(store, 1));
    }

    @Test
    void listAll_shouldReturnEmptyListForEmptyTable() throws Exception {
        assertTrue(records.listAll(store).isEmpty());
    }

    @Test
    void listAll_shouldOrderById() throws Exception {
        records.appendItem(store, new Item(3000, "c", "", "", ""));
        records.appendItem(store, new Item(2000, "b", "", "", ""));
        records.add(store, new Item("d", "", "", ""));

        List<Integer> ids = records.listAll(store).stream().map(Item::id).toList();
        assertEquals(List.of(2000, 3000, 3001), ids);
    }

    @Test
    void listAll_shouldReadNullColumnsAsEmpty() throws Exception {
        store.update("INSERT INTO inventory (id) VALUES (?)", 12);

        assertEquals(new Item(12, "", "", "", ""), records.listAll(store).get(0));
    }

    @Test
    void listPaged_shouldReturnKeysetPages() throws Exception {
        for (int i = 0; i < 5; i++) {
            records.add(store, new Item("I" + i, "", "", ""));
        }

        List<Item> first = records.listPaged(store, 0, 3);
        assertEquals(List.of(1001, 1002, 1003), first.stream().map(Item::id).toList());

        List<Item> second = records.listPaged(store, first.get(2).id(), 3);
        assertEquals(List.of(1004, 1005), second.stream().map(Item::id).toList());

        assertTrue(records.listPaged(store, 9999, 5).isEmpty());
    }

    @Test
    void listPaged_shouldRejectNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> records.listPaged(store, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> records.listPaged(store, 0, -1));
    }
}
