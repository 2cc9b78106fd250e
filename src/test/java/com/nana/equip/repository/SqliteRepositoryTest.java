package com.nana.equip.repository;

import com.nana.equip.domain.BatchStatus;
import com.nana.equip.domain.GlobalPart;
import com.nana.equip.domain.ImportBatch;
import com.nana.equip.domain.InstallSide;
import com.nana.equip.domain.LaborBudgetLine;
import com.nana.equip.domain.LinkSnapshot;
import com.nana.equip.domain.ProjectEquipment;
import com.nana.equip.domain.ProjectRoom;
import com.nana.equip.domain.SupplierMatch;
import com.nana.equip.domain.WireDropLink;
import com.nana.equip.util.DatabaseManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Repository tests against a throwaway SQLite file per test.
 */
class SqliteRepositoryTest {

    private static final String PROJECT = "proj-1";

    @TempDir
    Path tempDir;

    private DatabaseManager db;

    @BeforeEach
    void openDatabase() {
        db = DatabaseManager.forFile(tempDir.resolve("equipment.db"));
    }

    @AfterEach
    void closeDatabase() {
        db.shutdown();
    }

    // -----------------------------------------------------------------------
    // SHARED FACTORY METHODS
    // -----------------------------------------------------------------------

    private ProjectRoom insertRoom(String name) {
        ProjectRoom room = ProjectRoom.newFromImport(PROJECT, name, null);
        new SqliteRoomRepository(db).insertAll(List.of(room));
        return room;
    }

    private static ProjectEquipment equipment(String roomId, String partNumber, String name, int instance) {
        ProjectEquipment e = new ProjectEquipment();
        e.setProjectId(PROJECT);
        e.setRoomId(roomId);
        e.setPartNumber(partNumber);
        e.setName(name);
        e.setInstallSide(InstallSide.ROOM_END);
        e.setInstanceNumber(instance);
        e.setInstanceName(name + " " + instance);
        e.setPlannedQuantity(1);
        return e;
    }

    // ======================================================================
    // DatabaseManager
    // ======================================================================

    @Nested
    @DisplayName("DatabaseManager Tests")
    class DatabaseManagerTests {

        @Test
        @DisplayName("Schema creation builds every table")
        void schemaCreated() throws SQLException {
            List<String> tables = new ArrayList<>();
            try (Statement st = db.getConnection().createStatement();
                 ResultSet rs = st.executeQuery("SELECT name FROM sqlite_master WHERE type = 'table'")) {
                while (rs.next()) {
                    tables.add(rs.getString(1));
                }
            }
            assertTrue(tables.containsAll(List.of(
                    "equipment_import_batches", "project_rooms", "project_room_aliases",
                    "global_parts", "suppliers", "project_equipment", "project_equipment_inventory",
                    "project_equipment_instances", "project_labor_budget", "wire_drop_equipment_links")));
        }

        @Test
        @DisplayName("Reopening an existing file keeps its data")
        void reopenKeepsData() {
            insertRoom("Den");
            db.shutdown();
            db = DatabaseManager.forFile(tempDir.resolve("equipment.db"));
            assertEquals(1, new SqliteRoomRepository(db).findByProject(PROJECT).size());
        }

        @Test
        @DisplayName("A database stamped with another schema version is refused")
        void rejectsOtherSchemaVersion() throws SQLException {
            try (Statement st = db.getConnection().createStatement()) {
                st.executeUpdate("UPDATE schema_version SET version = 99");
            }
            db.shutdown();

            Path file = tempDir.resolve("equipment.db");
            DatabaseManager.DatabaseInitException ex = assertThrows(
                    DatabaseManager.DatabaseInitException.class, () -> DatabaseManager.forFile(file));
            assertTrue(ex.getCause().getMessage().contains("Unsupported schema version 99"));
        }

        @Test
        @DisplayName("A non-SQLite URL is rejected")
        void rejectsForeignUrl() {
            assertThrows(IllegalArgumentException.class,
                    () -> new DatabaseManager("jdbc:postgresql://localhost/equip"));
        }
    }

    // ======================================================================
    // ImportBatchRepository
    // ======================================================================

    @Nested
    @DisplayName("SqliteImportBatchRepository Tests")
    class BatchTests {

        private SqliteImportBatchRepository batches;

        @BeforeEach
        void setUp() {
            batches = new SqliteImportBatchRepository(db);
        }

        @Test
        @DisplayName("A new batch is pending and moves to processed with a completion time")
        void lifecycle() {
            ImportBatch batch = batches.create(new ImportBatch(PROJECT, "proposal.csv", 12, "user-1"));
            assertNotNull(batch.getId());
            assertEquals(BatchStatus.PENDING, batches.findById(batch.getId()).orElseThrow().getStatus());

            batches.markProcessed(batch.getId(), 9);

            ImportBatch stored = batches.findById(batch.getId()).orElseThrow();
            assertEquals(BatchStatus.PROCESSED, stored.getStatus());
            assertEquals(9, stored.getProcessedRows());
            assertEquals(12, stored.getTotalRows());
            assertNotNull(stored.getCompletedAt());
        }

        @Test
        @DisplayName("A failed batch keeps its error message and no completion time")
        void failed() {
            ImportBatch batch = batches.create(new ImportBatch(PROJECT, "proposal.csv", 3, null));
            batches.markFailed(batch.getId(), "disk full");

            ImportBatch stored = batches.findById(batch.getId()).orElseThrow();
            assertEquals(BatchStatus.FAILED, stored.getStatus());
            assertEquals("disk full", stored.getErrorMessage());
            assertNull(stored.getCompletedAt());
        }

        @Test
        @DisplayName("Marking an unknown batch processed throws")
        void unknownBatch() {
            assertThrows(RepositoryException.class, () -> batches.markProcessed("missing", 1));
        }
    }

    // ======================================================================
    // EquipmentRepository
    // ======================================================================

    @Nested
    @DisplayName("SqliteEquipmentRepository Tests")
    class EquipmentTests {

        private SqliteEquipmentRepository equipmentRepo;
        private ProjectRoom room;

        @BeforeEach
        void setUp() {
            equipmentRepo = new SqliteEquipmentRepository(db);
            room = insertRoom("Living Room");
        }

        @Test
        @DisplayName("Inserted rows read back with metadata and in instance order")
        void insertAndRead() {
            ProjectEquipment second = equipment(room.getId(), "SPK", "Speaker", 2);
            ProjectEquipment first = equipment(room.getId(), "SPK", "Speaker", 1);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("fabric", "Basketweave");
            first.setMetadata(metadata);

            equipmentRepo.insertAll(List.of(second, first));

            List<ProjectEquipment> stored = equipmentRepo.findByProject(PROJECT);
            assertEquals(2, stored.size());
            assertEquals(1, stored.get(0).getInstanceNumber());
            assertEquals("Basketweave", stored.get(0).getMetadata().get("fabric"));
            assertEquals(InstallSide.ROOM_END, stored.get(0).getInstallSide());
        }

        @Test
        @DisplayName("Inventory rows are created once per equipment and warehouse")
        void inventory() {
            ProjectEquipment e = equipment(room.getId(), "SPK", "Speaker", 1);
            equipmentRepo.insertAll(List.of(e));
            equipmentRepo.insertInventory(List.of(e), "main");
            equipmentRepo.insertInventory(List.of(e), "main");

            assertEquals(1, equipmentRepo.countInventory(e.getId()));
        }

        @Test
        @DisplayName("Updating a row that no longer exists throws")
        void updateMissing() {
            ProjectEquipment ghost = equipment(room.getId(), "SPK", "Speaker", 1);
            ghost.setId("ghost");
            assertThrows(RepositoryException.class, () -> equipmentRepo.updateAll(List.of(ghost)));
        }

        @Test
        @DisplayName("Deleting a project's equipment removes its inventory and links too")
        void deleteCascades() {
            ProjectEquipment e = equipment(room.getId(), "SPK", "Speaker", 1);
            equipmentRepo.insertAll(List.of(e));
            equipmentRepo.insertInventory(List.of(e), "main");
            SqliteWireDropLinkRepository links = new SqliteWireDropLinkRepository(db);
            links.insertAll(List.of(new WireDropLink("WD-1", e.getId())));

            assertEquals(1, equipmentRepo.deleteAllForProject(PROJECT));
            assertTrue(equipmentRepo.findByProject(PROJECT).isEmpty());
            assertEquals(0, equipmentRepo.countInventory(e.getId()));
            assertTrue(links.findByProject(PROJECT).isEmpty());
        }

        @Test
        @DisplayName("Catalog assignment matches part numbers case-insensitively")
        void assignGlobalPart() {
            ProjectEquipment e = equipment(room.getId(), "SPK-X", "Speaker", 1);
            equipmentRepo.insertAll(List.of(e));
            GlobalPart part = GlobalPart.fromEquipment(e);
            String partId = new SqliteGlobalPartRepository(db).upsertByPartNumber(part);

            assertEquals(1, equipmentRepo.assignGlobalPart(PROJECT, "spk-x", null, partId));
            assertEquals(partId, equipmentRepo.findById(e.getId()).orElseThrow().getGlobalPartId());
        }
    }

    // ======================================================================
    // WireDropLinkRepository
    // ======================================================================

    @Nested
    @DisplayName("SqliteWireDropLinkRepository Tests")
    class LinkTests {

        @Test
        @DisplayName("Captured snapshots carry the identity of the linked equipment")
        void capture() {
            ProjectRoom room = insertRoom("Theater");
            ProjectEquipment e = equipment(room.getId(), "PJ-1", "Projector", 1);
            new SqliteEquipmentRepository(db).insertAll(List.of(e));
            WireDropLink link = new WireDropLink("WD-9", e.getId());
            link.setLinkSide("head_end");
            SqliteWireDropLinkRepository links = new SqliteWireDropLinkRepository(db);
            links.insertAll(List.of(link));
            assertNotNull(link.getId());

            List<LinkSnapshot> snapshots = links.captureForProject(PROJECT);

            assertEquals(1, snapshots.size());
            LinkSnapshot snapshot = snapshots.get(0);
            assertEquals("WD-9", snapshot.getWireDropId());
            assertEquals(e.getId(), snapshot.getOldEquipmentId());
            assertEquals("PJ-1", snapshot.getOldPartNumber());
            assertEquals(room.getId(), snapshot.getOldRoomId());
            assertEquals("head_end", snapshot.getLink().getLinkSide());
            assertEquals(e.naturalKey(), snapshot.oldKey());
        }

        @Test
        @DisplayName("A duplicate (wire drop, equipment, side) triple is rejected")
        void duplicateRejected() {
            ProjectEquipment e = equipment(null, "PJ-1", "Projector", 1);
            new SqliteEquipmentRepository(db).insertAll(List.of(e));
            SqliteWireDropLinkRepository links = new SqliteWireDropLinkRepository(db);
            links.insertAll(List.of(new WireDropLink("WD-9", e.getId())));

            assertThrows(RepositoryException.class,
                    () -> links.insertAll(List.of(new WireDropLink("WD-9", e.getId()))));
            assertEquals(1, links.findByEquipment(e.getId()).size());
        }
    }

    // ======================================================================
    // Labor
    // ======================================================================

    @Nested
    @DisplayName("SqliteLaborBudgetRepository Tests")
    class LaborTests {

        @Test
        @DisplayName("Only imported labor is removed by a replace")
        void deleteImportedOnly() {
            SqliteImportBatchRepository batches = new SqliteImportBatchRepository(db);
            ImportBatch batch = batches.create(new ImportBatch(PROJECT, "a.csv", 1, null));
            SqliteLaborBudgetRepository labor = new SqliteLaborBudgetRepository(db);

            LaborBudgetLine imported = new LaborBudgetLine();
            imported.setProjectId(PROJECT);
            imported.setLaborType("Install");
            imported.setPlannedHours(4);
            imported.setCsvBatchId(batch.getId());
            LaborBudgetLine manual = new LaborBudgetLine();
            manual.setProjectId(PROJECT);
            manual.setLaborType("Design");
            manual.setPlannedHours(2);
            labor.insertAll(List.of(imported, manual));

            assertEquals(1, labor.deleteImportedForProject(PROJECT));
            List<LaborBudgetLine> remaining = labor.findByProject(PROJECT);
            assertEquals(1, remaining.size());
            assertEquals("Design", remaining.get(0).getLaborType());
        }
    }

    // ======================================================================
    // Catalog and suppliers
    // ======================================================================

    @Nested
    @DisplayName("Catalog and Supplier Tests")
    class CatalogTests {

        @Test
        @DisplayName("Upserting the same part number twice yields one catalog row")
        void globalPartUpsert() {
            SqliteGlobalPartRepository parts = new SqliteGlobalPartRepository(db);
            GlobalPart a = new GlobalPart();
            a.setPartNumber("SPK-X");
            a.setName("Speaker X");
            GlobalPart b = new GlobalPart();
            b.setPartNumber("spk-x");
            b.setDescription("Ceiling speaker");

            String first = parts.upsertByPartNumber(a);
            String second = parts.upsertByPartNumber(b);

            assertEquals(first, second);
            GlobalPart stored = parts.findByPartNumber("SPK-X").orElseThrow();
            assertEquals("Speaker X", stored.getName());
            assertEquals("Ceiling speaker", stored.getDescription());
        }

        @Test
        @DisplayName("A blank part number is rejected")
        void blankPartNumber() {
            assertThrows(RepositoryException.class,
                    () -> new SqliteGlobalPartRepository(db).upsertByPartNumber(new GlobalPart()));
        }

        @Test
        @DisplayName("Exact supplier names match with full confidence, close names match fuzzily")
        void supplierMatching() {
            SqliteSupplierDirectory suppliers = new SqliteSupplierDirectory(db);
            SupplierMatch created = suppliers.matchOrCreate("ADI Global", 0.7);
            assertTrue(created.isCreated());

            SupplierMatch exact = suppliers.matchOrCreate("adi global", 0.7);
            assertFalse(exact.isCreated());
            assertEquals(1.0, exact.getConfidence());
            assertEquals(created.getSupplierId(), exact.getSupplierId());

            SupplierMatch fuzzy = suppliers.matchOrCreate("ADI Global Inc", 0.7);
            assertFalse(fuzzy.isCreated());
            assertEquals(created.getSupplierId(), fuzzy.getSupplierId());
            assertTrue(fuzzy.getConfidence() >= 0.7 && fuzzy.getConfidence() < 1.0);

            assertEquals(1, suppliers.findActive().size());
        }

        @Test
        @DisplayName("New suppliers get unique short codes")
        void shortCodes() {
            SqliteSupplierDirectory suppliers = new SqliteSupplierDirectory(db);
            suppliers.matchOrCreate("Snap One", 0.99);
            suppliers.matchOrCreate("Sonos Outlet", 0.99);

            List<String> codes = suppliers.findActive().stream().map(s -> s.getShortCode()).sorted().toList();
            assertEquals(List.of("SO", "SO2"), codes);
            assertEquals("SNAPA", SqliteSupplierDirectory.shortCodeFor("snap-av"));
            assertEquals("SUP", SqliteSupplierDirectory.shortCodeFor("!!!"));
        }
    }
}
