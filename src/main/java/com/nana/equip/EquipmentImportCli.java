package com.nana.equip;

import com.nana.equip.domain.ImportMode;
import com.nana.equip.service.EquipmentImportService;
import com.nana.equip.service.EquipmentImportServiceImpl;
import com.nana.equip.service.ImportException;
import com.nana.equip.service.ImportOptions;
import com.nana.equip.util.AppConfig;
import com.nana.equip.util.DatabaseManager;
import com.nana.equip.util.ImportReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Command-line entry point.
 *
 * <pre>
 * equipment-import &lt;projectId&gt; &lt;file&gt; [--mode replace|merge|append]
 *                  [--user &lt;id&gt;] [--skip-relink] [--db &lt;jdbc-url&gt;]
 * </pre>
 *
 * Exit codes: 0 success, 1 import failed, 2 bad arguments.
 */
public final class EquipmentImportCli {

    private static final Logger log = LoggerFactory.getLogger(EquipmentImportCli.class);

    static final int EXIT_OK          = 0;
    static final int EXIT_FAILED      = 1;
    static final int EXIT_USAGE       = 2;

    private static final String USAGE =
            "Usage: equipment-import <projectId> <file> [--mode replace|merge|append]"
            + " [--user <id>] [--skip-relink] [--db <jdbc-url>]";

    private EquipmentImportCli() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Arguments parsed;
        try {
            parsed = Arguments.parse(args);
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        AppConfig config = AppConfig.getInstance();
        String dbUrl = parsed.dbUrl != null ? parsed.dbUrl : config.getDatabaseUrl();
        DatabaseManager db;
        try {
            db = new DatabaseManager(dbUrl);
        } catch (DatabaseManager.DatabaseInitException | IllegalArgumentException ex) {
            log.error("Database unavailable: {}", ex.getMessage(), ex);
            err.println("Database unavailable: " + ex.getMessage());
            return EXIT_FAILED;
        }

        try {
            EquipmentImportService service = EquipmentImportServiceImpl.create(db, config);
            ImportOptions options = ImportOptions.builder()
                    .mode(parsed.mode)
                    .userId(parsed.userId)
                    .skipRelink(parsed.skipRelink)
                    .build();
            ImportReport report = service.importFile(parsed.projectId, parsed.file, options);
            out.print(report.toReportText());
            return EXIT_OK;
        } catch (ImportException ex) {
            err.println("Import failed (" + ex.getReason() + "): " + ex.getMessage());
            if (ex.getBatchId() != null) {
                err.println("Batch: " + ex.getBatchId());
            }
            return EXIT_FAILED;
        } finally {
            db.shutdown();
        }
    }

    // -----------------------------------------------------------------------
    // ARGUMENT PARSING
    // -----------------------------------------------------------------------

    static final class Arguments {

        String     projectId;
        Path       file;
        ImportMode mode = ImportMode.REPLACE;
        String     userId;
        boolean    skipRelink;
        String     dbUrl;

        static Arguments parse(String[] args) {
            Arguments parsed = new Arguments();
            int positional = 0;
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--mode" -> parsed.mode = parseMode(valueAfter(args, ++i, arg));
                    case "--user" -> parsed.userId = valueAfter(args, ++i, arg);
                    case "--db" -> parsed.dbUrl = valueAfter(args, ++i, arg);
                    case "--skip-relink" -> parsed.skipRelink = true;
                    default -> {
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        if (positional == 0) {
                            parsed.projectId = arg;
                        } else if (positional == 1) {
                            parsed.file = Path.of(arg);
                        } else {
                            throw new IllegalArgumentException("Unexpected argument: " + arg);
                        }
                        positional++;
                    }
                }
            }
            if (positional < 2) {
                throw new IllegalArgumentException("A project id and a file are required.");
            }
            return parsed;
        }

        private static String valueAfter(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + option);
            }
            return args[index];
        }

        // Strict here; ImportMode.fromString would silently fall back to REPLACE.
        private static ImportMode parseMode(String value) {
            for (ImportMode mode : ImportMode.values()) {
                if (mode.name().equalsIgnoreCase(value)) {
                    return mode;
                }
            }
            throw new IllegalArgumentException("Unknown mode: " + value);
        }
    }
}
