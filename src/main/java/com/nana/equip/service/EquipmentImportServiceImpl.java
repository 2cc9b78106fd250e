package com.nana.equip.service;

import com.nana.equip.domain.ImportBatch;
import com.nana.equip.domain.ImportMode;
import com.nana.equip.domain.LinkSnapshot;
import com.nana.equip.repository.EquipmentRepository;
import com.nana.equip.repository.ImportBatchRepository;
import com.nana.equip.repository.LaborBudgetRepository;
import com.nana.equip.repository.RepositoryException;
import com.nana.equip.repository.SqliteEquipmentRepository;
import com.nana.equip.repository.SqliteGlobalPartRepository;
import com.nana.equip.repository.SqliteImportBatchRepository;
import com.nana.equip.repository.SqliteLaborBudgetRepository;
import com.nana.equip.repository.SqliteRoomRepository;
import com.nana.equip.repository.SqliteSupplierDirectory;
import com.nana.equip.repository.SqliteWireDropLinkRepository;
import com.nana.equip.util.AppConfig;
import com.nana.equip.util.AppLogger;
import com.nana.equip.util.DatabaseManager;
import com.nana.equip.util.ImportReport;
import com.nana.equip.util.RowSource;
import com.nana.equip.util.RowSources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * EquipmentImportServiceImpl: runs one spreadsheet through the import
 * pipeline.
 *
 * <p>PIPELINE:
 * <ol>
 *   <li>Read the file and detect its format from the raw text.</li>
 *   <li>Record a {@code pending} batch.</li>
 *   <li>Resolve room names to project rooms, creating missing ones.</li>
 *   <li>Build equipment instances and labor lines.</li>
 *   <li>Replace only: capture wire drop links before anything is deleted.</li>
 *   <li>Reconcile with the existing project according to the mode.</li>
 *   <li>Replace only: restore the captured links onto the new instances.</li>
 *   <li>Sync catalog parts and suppliers.</li>
 *   <li>Mark the batch {@code processed}.</li>
 * </ol>
 *
 * <p>ERROR HANDLING:
 * Reading, room creation, link capture and the equipment and labor writes
 * are fail-fast; any {@link RepositoryException} there aborts the import
 * with {@link ImportException.Reason#STORE_FAILURE} and the batch is marked
 * {@code failed}. Alias writes, link restoration, catalog and supplier sync
 * are best-effort and surface in the {@link ImportReport} instead.
 */
public class EquipmentImportServiceImpl implements EquipmentImportService {

    private static final Logger log = LoggerFactory.getLogger(EquipmentImportServiceImpl.class);

    private static final String OPERATION = "equipment-import";

    // -----------------------------------------------------------------------
    // COLLABORATORS
    // -----------------------------------------------------------------------

    private final ImportBatchRepository                   batchRepository;
    private final FormatDetector                          formatDetector;
    private final RoomResolver                            roomResolver;
    private final Map<ImportFormat, RecordBuilder>        builders;
    private final Map<ImportMode, ReconciliationStrategy> strategies;
    private final LinkPreservationService                 linkService;
    private final CatalogSyncService                      catalogSyncService;
    private final String                                  defaultFilename;

    public EquipmentImportServiceImpl(ImportBatchRepository batchRepository,
                                      FormatDetector formatDetector,
                                      RoomResolver roomResolver,
                                      List<RecordBuilder> builders,
                                      List<ReconciliationStrategy> strategies,
                                      LinkPreservationService linkService,
                                      CatalogSyncService catalogSyncService,
                                      String defaultFilename) {
        this.batchRepository    = Objects.requireNonNull(batchRepository, "batchRepository");
        this.formatDetector     = Objects.requireNonNull(formatDetector, "formatDetector");
        this.roomResolver       = Objects.requireNonNull(roomResolver, "roomResolver");
        this.linkService        = Objects.requireNonNull(linkService, "linkService");
        this.catalogSyncService = Objects.requireNonNull(catalogSyncService, "catalogSyncService");
        this.defaultFilename    = defaultFilename;

        this.builders = new EnumMap<>(ImportFormat.class);
        for (RecordBuilder builder : builders) {
            this.builders.put(builder.format(), builder);
        }
        this.strategies = new EnumMap<>(ImportMode.class);
        for (ReconciliationStrategy strategy : strategies) {
            this.strategies.put(strategy.mode(), strategy);
        }
        for (ImportFormat format : ImportFormat.values()) {
            if (!this.builders.containsKey(format)) {
                throw new IllegalArgumentException("No record builder for format " + format);
            }
        }
        for (ImportMode mode : ImportMode.values()) {
            if (!this.strategies.containsKey(mode)) {
                throw new IllegalArgumentException("No reconciliation strategy for mode " + mode);
            }
        }
    }

    /**
     * Wires the SQLite-backed pipeline.
     *
     * @param db     open database
     * @param config supplier threshold, inventory warehouse and default file name
     * @return a ready service
     */
    public static EquipmentImportServiceImpl create(DatabaseManager db, AppConfig config) {
        EquipmentRepository equipmentRepository = new SqliteEquipmentRepository(db);
        LaborBudgetRepository laborRepository   = new SqliteLaborBudgetRepository(db);
        String warehouse = config.getInventoryWarehouse();

        return new EquipmentImportServiceImpl(
                new SqliteImportBatchRepository(db),
                new FormatDetector(),
                new RoomResolver(new SqliteRoomRepository(db)),
                List.of(new StandardRecordBuilder(), new VendorCatalogRecordBuilder()),
                List.of(new ReplaceStrategy(equipmentRepository, laborRepository, warehouse),
                        new MergeStrategy(equipmentRepository, laborRepository, warehouse),
                        new AppendStrategy(equipmentRepository, laborRepository, warehouse)),
                new LinkPreservationService(new SqliteWireDropLinkRepository(db)),
                new CatalogSyncService(new SqliteGlobalPartRepository(db),
                        equipmentRepository, laborRepository,
                        new SqliteSupplierDirectory(db),
                        config.getSupplierMatchThreshold()),
                config.getDefaultFilename());
    }

    // -----------------------------------------------------------------------
    // IMPORT
    // -----------------------------------------------------------------------

    @Override
    public ImportReport importFile(String projectId, Path file, ImportOptions options)
            throws ImportException {
        validateRequest(projectId, file, options);
        AppLogger.setImportContext(OPERATION, projectId);
        String batchId = null;
        try {
            RowSource source = RowSources.forFile(file);
            String rawText;
            List<Map<String, String>> rawRows;
            try {
                rawText = source.readText(file);
                rawRows = source.readRows(file);
            } catch (IOException ex) {
                AppLogger.logErrorEvent("IMPORT_READ_FAILED", "file=" + file, ex);
                throw new ImportException(ImportException.Reason.READ_FAILURE,
                        "Could not read " + file.getFileName() + ": " + ex.getMessage(), null, ex);
            }
            if (rawRows.isEmpty()) {
                throw new ImportException(ImportException.Reason.EMPTY_FILE,
                        "No data rows found in " + file.getFileName());
            }

            ImportFormat format = formatDetector.detect(rawText);
            RecordBuilder builder = builders.get(format);
            List<SpreadsheetRow> rows = toRows(rawRows);
            ImportMode mode = options.getMode();
            String filename = displayName(file, options);

            ImportBatch batch = batchRepository.create(
                    new ImportBatch(projectId, filename, rows.size(), options.getUserId()));
            batchId = batch.getId();
            AppLogger.setBatchContext(batchId);
            AppLogger.logEvent("IMPORT_STARTED", "file=" + filename + " format=" + format.getLabel()
                    + " mode=" + mode + " rows=" + rows.size());

            List<String> roomNames = new ArrayList<>();
            for (SpreadsheetRow row : rows) {
                roomNames.add(builder.roomNameOf(row));
            }
            RoomResolution rooms = roomResolver.resolve(projectId, roomNames, options.getUserId());

            BuildResult built = builder.build(rows, rooms, projectId, batchId, options.getUserId());

            List<LinkSnapshot> snapshots = mode == ImportMode.REPLACE
                    ? linkService.capture(projectId)
                    : List.of();

            ReconcileOutcome outcome = strategies.get(mode)
                    .apply(projectId, built.getEquipment(), built.getLabor());

            LinkRestorationResult restoration = null;
            if (mode == ImportMode.REPLACE) {
                restoration = options.isSkipRelink()
                        ? linkService.skip(snapshots)
                        : linkService.restore(snapshots, outcome.getInsertedEquipment());
            }

            SyncOutcome sync = catalogSyncService.sync(projectId, batchId,
                    outcome.getWrittenEquipment(), outcome.getWrittenLabor());

            ImportReport report = new ImportReport.Builder(projectId, batchId)
                    .filename(filename)
                    .format(format)
                    .mode(mode)
                    .totalRows(rows.size())
                    .skippedRows(built.getSkippedRows())
                    .equipmentInserted(outcome.getInsertedEquipment().size())
                    .equipmentUpdated(outcome.getUpdatedEquipment().size())
                    .equipmentDeleted(outcome.getEquipmentDeleted())
                    .laborInserted(outcome.getInsertedLabor().size())
                    .laborUpdated(outcome.getUpdatedLabor().size())
                    .roomsCreated(rooms.getRoomsCreated())
                    .aliasesWritten(rooms.getAliasesWritten())
                    .aliasFailures(rooms.getAliasFailures())
                    .linkRestoration(restoration)
                    .syncOutcome(sync)
                    .build();

            batchRepository.markProcessed(batchId, report.getProcessedRows());
            AppLogger.logEvent("IMPORT_COMPLETED", report.getSummary());
            return report;

        } catch (RepositoryException ex) {
            AppLogger.logErrorEvent("IMPORT_ABORTED", "batch=" + batchId + " error=" + ex.getMessage(), ex);
            markFailedQuietly(batchId, ex.getMessage());
            throw new ImportException(ImportException.Reason.STORE_FAILURE,
                    "Import aborted: " + ex.getMessage(), batchId, ex);
        } finally {
            AppLogger.clearImportContext();
        }
    }

    // -----------------------------------------------------------------------
    // PRIVATE HELPERS
    // -----------------------------------------------------------------------

    private static void validateRequest(String projectId, Path file, ImportOptions options)
            throws ImportException {
        if (projectId == null || projectId.isBlank()) {
            throw new ImportException(ImportException.Reason.INVALID_REQUEST, "Project id is required.");
        }
        if (file == null) {
            throw new ImportException(ImportException.Reason.INVALID_REQUEST, "An import file is required.");
        }
        if (options == null) {
            throw new ImportException(ImportException.Reason.INVALID_REQUEST, "Import options are required.");
        }
        if (!Files.isRegularFile(file)) {
            throw new ImportException(ImportException.Reason.READ_FAILURE,
                    "File not found: " + file);
        }
    }

    static List<SpreadsheetRow> toRows(List<Map<String, String>> rawRows) {
        List<SpreadsheetRow> rows = new ArrayList<>(rawRows.size());
        // Row 1 is the header line.
        int rowNumber = 2;
        for (Map<String, String> raw : rawRows) {
            rows.add(new SpreadsheetRow(rowNumber++, raw));
        }
        return rows;
    }

    private String displayName(Path file, ImportOptions options) {
        if (options.getFilename() != null && !options.getFilename().isBlank()) {
            return options.getFilename().trim();
        }
        Path name = file.getFileName();
        if (name != null && !name.toString().isBlank()) {
            return name.toString();
        }
        return defaultFilename;
    }

    private void markFailedQuietly(String batchId, String message) {
        if (batchId == null) {
            return;
        }
        try {
            batchRepository.markFailed(batchId, message);
        } catch (RepositoryException ex) {
            log.error("Could not mark batch {} failed: {}", batchId, ex.getMessage(), ex);
        }
    }
}
