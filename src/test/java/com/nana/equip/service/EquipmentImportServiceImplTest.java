package com.nana.equip.service;

import com.nana.equip.domain.BatchStatus;
import com.nana.equip.domain.ImportBatch;
import com.nana.equip.domain.ImportMode;
import com.nana.equip.domain.LaborBudgetLine;
import com.nana.equip.domain.ProjectEquipment;
import com.nana.equip.domain.WireDropLink;
import com.nana.equip.repository.RepositoryException;
import com.nana.equip.repository.SqliteEquipmentRepository;
import com.nana.equip.repository.SqliteGlobalPartRepository;
import com.nana.equip.repository.SqliteImportBatchRepository;
import com.nana.equip.repository.SqliteLaborBudgetRepository;
import com.nana.equip.repository.SqliteRoomRepository;
import com.nana.equip.repository.SqliteSupplierDirectory;
import com.nana.equip.repository.SqliteWireDropLinkRepository;
import com.nana.equip.util.AppConfig;
import com.nana.equip.util.DatabaseManager;
import com.nana.equip.util.ImportReport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end import tests against a throwaway SQLite file.
 */
class EquipmentImportServiceImplTest {

    private static final String PROJECT = "proj-1";

    private static final String HEADER =
            "Area,ItemType,AreaQty,Model or Labor/Fee Name,PartNumber,Supplier,SellPrice\n";

    @TempDir
    Path tempDir;

    private DatabaseManager            db;
    private EquipmentImportService     service;
    private SqliteEquipmentRepository  equipmentRepo;
    private SqliteLaborBudgetRepository laborRepo;
    private SqliteWireDropLinkRepository linkRepo;
    private SqliteImportBatchRepository batchRepo;

    @BeforeEach
    void setUp() {
        db            = DatabaseManager.forFile(tempDir.resolve("import.db"));
        service       = EquipmentImportServiceImpl.create(db, AppConfig.of(new Properties()));
        equipmentRepo = new SqliteEquipmentRepository(db);
        laborRepo     = new SqliteLaborBudgetRepository(db);
        linkRepo      = new SqliteWireDropLinkRepository(db);
        batchRepo     = new SqliteImportBatchRepository(db);
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    // -----------------------------------------------------------------------
    // SHARED FACTORY METHODS
    // -----------------------------------------------------------------------

    private Path csv(String name, String body) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, HEADER + body, StandardCharsets.UTF_8);
        return file;
    }

    private static ImportOptions mode(ImportMode mode) {
        return ImportOptions.builder().mode(mode).userId("pm-1").build();
    }

    private ProjectEquipment stored(String partNumber, int instance) {
        return equipmentRepo.findByProject(PROJECT).stream()
                .filter(e -> partNumber.equals(e.getPartNumber()) && e.getInstanceNumber() == instance)
                .findFirst()
                .orElseThrow();
    }

    // ======================================================================
    // Basic import
    // ======================================================================

    @Nested
    @DisplayName("Standard Import Tests")
    class StandardImportTests {

        @Test
        @DisplayName("Data rows are numbered from 2 because the header is row 1")
        void rowNumbersFollowHeader() {
            List<SpreadsheetRow> rows = EquipmentImportServiceImpl.toRows(List.of(
                    Map.of("Area", "Den"), Map.of("Area", "Kitchen")));

            assertEquals(List.of(2, 3), rows.stream().map(SpreadsheetRow::getRowNumber).toList());
        }

        @Test
        @DisplayName("Parts expand into instances, labor aggregates, zero quantity rows drop")
        void livingRoomScenario() throws Exception {
            Path file = csv("proposal.csv", """
                    Living Room,Part,2,Speaker X,,,150
                    Living Room,Labor,4,Install,,,95
                    Living Room,Part,0,Ignored,,,10
                    """);

            ImportReport report = service.importFile(PROJECT, file);

            assertEquals(2, report.getEquipmentInserted());
            assertEquals(1, report.getLaborInserted());
            assertEquals(1, report.getSkippedRows());
            assertEquals(1, report.getRoomsCreated());
            assertEquals(ImportFormat.STANDARD, report.getFormat());

            List<ProjectEquipment> equipment = equipmentRepo.findByProject(PROJECT);
            assertEquals(List.of("Living Room - Speaker X 1", "Living Room - Speaker X 2"),
                    equipment.stream().map(ProjectEquipment::getInstanceName).toList());
            equipment.forEach(e -> assertEquals(1, equipmentRepo.countInventory(e.getId())));

            List<LaborBudgetLine> labor = laborRepo.findByProject(PROJECT);
            assertEquals(1, labor.size());
            assertEquals(4.0, labor.get(0).getPlannedHours());

            ImportBatch batch = batchRepo.findById(report.getBatchId()).orElseThrow();
            assertEquals(BatchStatus.PROCESSED, batch.getStatus());
            assertEquals(3, batch.getProcessedRows());
            assertEquals(3, batch.getTotalRows());
            assertEquals("proposal.csv", batch.getFilename());
        }

        @Test
        @DisplayName("Catalog parts and suppliers are linked to the imported rows")
        void catalogAndSuppliers() throws Exception {
            Path file = csv("proposal.csv", """
                    Living Room,Part,1,Speaker X,SPK-X,ADI Global,150
                    Kitchen,Part,1,Speaker X,spk-x,ADI Global,150
                    """);

            ImportReport report = service.importFile(PROJECT, file, mode(ImportMode.REPLACE));

            assertEquals(1, report.getSyncOutcome().getCatalogPartsResolved());
            assertEquals(1, report.getSyncOutcome().getSuppliersCreated());
            String partId = new SqliteGlobalPartRepository(db).findByPartNumber("SPK-X").orElseThrow().getId();
            for (ProjectEquipment e : equipmentRepo.findByProject(PROJECT)) {
                assertEquals(partId, e.getGlobalPartId());
                assertNotNull(e.getSupplierId());
            }
            assertEquals(1, new SqliteSupplierDirectory(db).findActive().size());
        }

        @Test
        @DisplayName("A vendor catalog export is detected from its header")
        void vendorCatalog() throws Exception {
            Path file = tempDir.resolve("shades.csv");
            Files.writeString(file, """
                    Area,Name,Technology,Product,Product Details,System Mount,Quantity,List Price
                    Bedroom,Bedroom Shade,Sivoia QS,Roller 64,Wire-free,Inside,1,$900
                    """, StandardCharsets.UTF_8);

            ImportReport report = service.importFile(PROJECT, file);

            assertEquals(ImportFormat.VENDOR_CATALOG, report.getFormat());
            ProjectEquipment shade = equipmentRepo.findByProject(PROJECT).get(0);
            assertEquals("Sivoia QS Roller 64", shade.getPartNumber());
            assertEquals("Inside", shade.getMetadata().get("mount_type"));
            assertEquals(0, report.getLaborInserted());
        }
    }

    // ======================================================================
    // Modes
    // ======================================================================

    @Nested
    @DisplayName("Import Mode Tests")
    class ModeTests {

        private static final String PROPOSAL = """
                Living Room,Part,2,Speaker X,SPK-X,,150
                Living Room,Part,1,Old Amp,AMP-1,,400
                Living Room,Labor,4,Install,,,95
                """;

        @Test
        @DisplayName("Replace restores links whose equipment survives and reports the rest")
        void replaceRelinks() throws Exception {
            service.importFile(PROJECT, csv("v1.csv", PROPOSAL), mode(ImportMode.REPLACE));
            ProjectEquipment oldSpeaker = stored("SPK-X", 2);
            ProjectEquipment oldAmp = stored("AMP-1", 1);
            linkRepo.insertAll(List.of(new WireDropLink("WD-1", oldSpeaker.getId()),
                                       new WireDropLink("WD-2", oldAmp.getId())));

            ImportReport report = service.importFile(PROJECT,
                    csv("v2.csv", "Living Room,Part,2,Speaker X,SPK-X,,175\n"), mode(ImportMode.REPLACE));

            assertEquals(3, report.getEquipmentDeleted());
            assertEquals(2, report.getEquipmentInserted());
            LinkRestorationResult links = report.getLinkRestoration();
            assertEquals(1, links.getRestored());
            assertEquals(1, links.getFailed());
            assertEquals("WD-2", links.getFailures().get(0).getWireDropId());
            assertEquals(LinkRestorationResult.REASON_NOT_IN_PROPOSAL, links.getFailures().get(0).getReason());

            List<WireDropLink> stored = linkRepo.findByProject(PROJECT);
            assertEquals(1, stored.size());
            assertEquals(stored("SPK-X", 1).getId(), stored.get(0).getEquipmentId());

            Set<String> liveIds = equipmentRepo.findByProject(PROJECT).stream()
                    .map(ProjectEquipment::getId).collect(Collectors.toSet());
            assertFalse(liveIds.contains(oldSpeaker.getId()));
            assertTrue(liveIds.contains(stored.get(0).getEquipmentId()));
            assertTrue(laborRepo.findByProject(PROJECT).isEmpty());
        }

        @Test
        @DisplayName("Replace with relinking skipped returns the captured links untouched")
        void replaceSkipRelink() throws Exception {
            service.importFile(PROJECT, csv("v1.csv", PROPOSAL), mode(ImportMode.REPLACE));
            linkRepo.insertAll(List.of(new WireDropLink("WD-1", stored("SPK-X", 1).getId())));

            ImportReport report = service.importFile(PROJECT, csv("v2.csv", PROPOSAL),
                    ImportOptions.builder().mode(ImportMode.REPLACE).skipRelink(true).build());

            assertFalse(report.getLinkRestoration().wasAttempted());
            assertEquals(1, report.getLinkRestoration().getPendingSnapshots().size());
            assertTrue(linkRepo.findByProject(PROJECT).isEmpty());
        }

        @Test
        @DisplayName("Merge updates matching rows in place and keeps their procurement progress")
        void mergePreservesProgress() throws Exception {
            service.importFile(PROJECT, csv("v1.csv", PROPOSAL), mode(ImportMode.REPLACE));
            ProjectEquipment ordered = stored("SPK-X", 1);
            ordered.setOrderedQuantity(1);
            ordered.setReceivedQuantity(1);
            equipmentRepo.updateAll(List.of(ordered));
            linkRepo.insertAll(List.of(new WireDropLink("WD-1", ordered.getId())));

            ImportReport report = service.importFile(PROJECT, csv("v2.csv", """
                    Living Room,Part,3,Speaker X,SPK-X,,175
                    Living Room,Labor,6,Install,,,95
                    """), mode(ImportMode.MERGE));

            assertEquals(2, report.getEquipmentUpdated());
            assertEquals(1, report.getEquipmentInserted());
            assertEquals(1, report.getLaborUpdated());
            assertNull(report.getLinkRestoration());

            ProjectEquipment after = equipmentRepo.findById(ordered.getId()).orElseThrow();
            assertEquals(175.0, after.getUnitPrice());
            assertEquals(1.0, after.getOrderedQuantity());
            assertEquals(1.0, after.getReceivedQuantity());
            assertEquals(1, linkRepo.findByEquipment(ordered.getId()).size());
            assertEquals(4, equipmentRepo.findByProject(PROJECT).size());
            assertEquals(6.0, laborRepo.findByProject(PROJECT).get(0).getPlannedHours());
        }

        @Test
        @DisplayName("Append inserts duplicates alongside existing rows")
        void appendDuplicates() throws Exception {
            service.importFile(PROJECT, csv("v1.csv", PROPOSAL), mode(ImportMode.APPEND));
            ImportReport second = service.importFile(PROJECT, csv("v2.csv", PROPOSAL), mode(ImportMode.APPEND));

            assertEquals(3, second.getEquipmentInserted());
            assertEquals(6, equipmentRepo.findByProject(PROJECT).size());
            assertEquals(2, laborRepo.findByProject(PROJECT).size());
            assertEquals(0, second.getRoomsCreated());
        }
    }

    // ======================================================================
    // Failures
    // ======================================================================

    @Nested
    @DisplayName("Import Failure Tests")
    class FailureTests {

        @Test
        @DisplayName("A header-only file is rejected before any batch is written")
        void emptyFile() throws Exception {
            Path file = csv("empty.csv", "");

            ImportException ex = assertThrows(ImportException.class, () -> service.importFile(PROJECT, file));

            assertEquals(ImportException.Reason.EMPTY_FILE, ex.getReason());
            assertTrue(batchRepo.findByProject(PROJECT).isEmpty());
        }

        @Test
        @DisplayName("A blank project id is an invalid request")
        void blankProject() throws Exception {
            Path file = csv("p.csv", "Den,Part,1,TV,,,1\n");
            ImportException ex = assertThrows(ImportException.class, () -> service.importFile(" ", file));
            assertEquals(ImportException.Reason.INVALID_REQUEST, ex.getReason());
        }

        @Test
        @DisplayName("A missing file is a read failure")
        void missingFile() {
            ImportException ex = assertThrows(ImportException.class,
                    () -> service.importFile(PROJECT, tempDir.resolve("nope.csv")));
            assertEquals(ImportException.Reason.READ_FAILURE, ex.getReason());
        }

        @Test
        @DisplayName("A store failure during reconciliation aborts and marks the batch failed")
        void storeFailureMarksBatchFailed() throws Exception {
            ReconciliationStrategy failing = new ReconciliationStrategy() {
                @Override
                public ImportMode mode() {
                    return ImportMode.REPLACE;
                }

                @Override
                public ReconcileOutcome apply(String projectId, List<ProjectEquipment> equipment,
                                              List<LaborBudgetLine> labor) {
                    throw new RepositoryException("database is locked");
                }
            };
            SqliteEquipmentRepository equipment = new SqliteEquipmentRepository(db);
            SqliteLaborBudgetRepository labor = new SqliteLaborBudgetRepository(db);
            EquipmentImportService broken = new EquipmentImportServiceImpl(
                    batchRepo,
                    new FormatDetector(),
                    new RoomResolver(new SqliteRoomRepository(db)),
                    List.of(new StandardRecordBuilder(), new VendorCatalogRecordBuilder()),
                    List.of(failing,
                            new MergeStrategy(equipment, labor, "main"),
                            new AppendStrategy(equipment, labor, "main")),
                    new LinkPreservationService(linkRepo),
                    new CatalogSyncService(new SqliteGlobalPartRepository(db), equipment, labor,
                            new SqliteSupplierDirectory(db), 0.7),
                    "equipment-upload.csv");

            ImportException ex = assertThrows(ImportException.class,
                    () -> broken.importFile(PROJECT, csv("p.csv", "Den,Part,1,TV,,,1\n")));

            assertEquals(ImportException.Reason.STORE_FAILURE, ex.getReason());
            assertNotNull(ex.getBatchId());
            ImportBatch batch = batchRepo.findById(ex.getBatchId()).orElseThrow();
            assertEquals(BatchStatus.FAILED, batch.getStatus());
            assertEquals("database is locked", batch.getErrorMessage());
            assertNull(batch.getCompletedAt());
        }

        @Test
        @DisplayName("Every format and mode must have a handler")
        void incompleteWiring() {
            assertThrows(IllegalArgumentException.class, () -> new EquipmentImportServiceImpl(
                    batchRepo, new FormatDetector(), new RoomResolver(new SqliteRoomRepository(db)),
                    List.of(new StandardRecordBuilder()), List.of(),
                    new LinkPreservationService(linkRepo),
                    new CatalogSyncService(new SqliteGlobalPartRepository(db), equipmentRepo, laborRepo,
                            new SqliteSupplierDirectory(db), 0.7),
                    null));
        }
    }
}
