package com.nana.equip.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * AppLogger: Logging Utility
 *
 * <p>Classes log through their own SLF4J logger:
 * <pre>
 *     private static final Logger log = LoggerFactory.getLogger(MyClass.class);
 * </pre>
 * This class adds the two things that per-class loggers do not give:
 * <ul>
 *   <li>Structured business events ({@code [EVENT] name | details}) written
 *       to one well-known logger, so imports can be audited by grepping a
 *       single prefix.</li>
 *   <li>MDC management for the import context. While an import runs every
 *       log line carries the operation name, project id and batch id (see
 *       the pattern in {@code logback.xml}).</li>
 * </ul>
 *
 * <p>MDC is thread-local: set the context on the thread that runs the
 * import and always clear it in a {@code finally} block.
 */
public final class AppLogger {

    // -----------------------------------------------------------------------
    // CONSTANTS
    // -----------------------------------------------------------------------

    private static final Logger APP_LOG =
            LoggerFactory.getLogger("com.nana.equip.APP");

    /** MDC key for the current operation name. */
    public static final String MDC_OPERATION = "operation";

    /** MDC key for the project being imported into. */
    public static final String MDC_PROJECT = "project";

    /** MDC key for the import batch id, once the ledger row exists. */
    public static final String MDC_BATCH = "batch";

    private AppLogger() {
        throw new UnsupportedOperationException(
                "AppLogger is a static utility class.");
    }

    // -----------------------------------------------------------------------
    // STRUCTURED EVENT LOGGING
    // -----------------------------------------------------------------------

    /**
     * Logs a significant business event.
     *
     * <p>Format: {@code [EVENT] <eventName> | <details>}
     *
     * @param eventName a short event label (e.g., "EQUIPMENT_IMPORT_COMPLETE")
     * @param details   additional context (e.g., "batch=..., inserted=12")
     */
    public static void logEvent(String eventName, String details) {
        APP_LOG.info("[EVENT] {} | {}", eventName, details);
    }

    /**
     * Logs a warning-level business event, e.g. an import that completed
     * with unrestored wire drop links.
     *
     * @param eventName a short event label
     * @param details   additional context
     */
    public static void logWarningEvent(String eventName, String details) {
        APP_LOG.warn("[WARN_EVENT] {} | {}", eventName, details);
    }

    /**
     * Logs an error-level business event with its cause.
     *
     * @param eventName a short event label
     * @param details   what was attempted
     * @param throwable the failure
     */
    public static void logErrorEvent(String eventName,
                                     String details,
                                     Throwable throwable) {
        APP_LOG.error("[ERROR_EVENT] {} | {}", eventName, details, throwable);
    }

    // -----------------------------------------------------------------------
    // MDC CONTEXT MANAGEMENT
    // -----------------------------------------------------------------------

    /**
     * Tags subsequent log lines on this thread with an operation and project.
     *
     * @param operationName operation label (e.g., "EQUIPMENT_IMPORT")
     * @param projectId     project being processed, may be null
     */
    public static void setImportContext(String operationName, String projectId) {
        MDC.put(MDC_OPERATION, operationName);
        if (projectId != null) {
            MDC.put(MDC_PROJECT, projectId);
        }
    }

    /**
     * Adds the batch id to the current context once it is known.
     *
     * @param batchId ledger row id
     */
    public static void setBatchContext(String batchId) {
        if (batchId != null) {
            MDC.put(MDC_BATCH, batchId);
        }
    }

    /**
     * Removes every key set by this utility. Call from a {@code finally}
     * block so pooled threads do not leak context onto later work.
     */
    public static void clearImportContext() {
        MDC.remove(MDC_OPERATION);
        MDC.remove(MDC_PROJECT);
        MDC.remove(MDC_BATCH);
    }
}
