package com.elclab.components.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * AppLogger - Logging Utility
 *
 * <p>Classes log through their own SLF4J logger:
 * <pre>
 *     private static final Logger log = LoggerFactory.getLogger(MyClass.class);
 * </pre>
 *
 * <p>{@code AppLogger} adds the cross-cutting pieces on top of that:
 * <ul>
 *   <li>startup and shutdown banners marking each CLI session in the log file;</li>
 *   <li>structured business events ({@code [EVENT] name | details}) such as
 *       an import finishing or a category being removed;</li>
 *   <li>the MDC {@code operation} key, which {@code logback.xml} prints on
 *       every line emitted while an operation is in progress.</li>
 * </ul>
 *
 * <p>MDC is thread-local. Always clear the operation context in a
 * {@code finally} block:
 * <pre>
 *     AppLogger.setOperationContext("CSV_IMPORT");
 *     try {
 *         // every log line here carries operation=CSV_IMPORT
 *     } finally {
 *         AppLogger.clearOperationContext();
 *     }
 * </pre>
 */
public final class AppLogger {

    // -----------------------------------------------------------------------
    // PRIVATE CONSTANTS
    // -----------------------------------------------------------------------

    /** Application-level logger for banners and business events. */
    private static final Logger APP_LOG =
            LoggerFactory.getLogger("com.elclab.components.APP");

    private static final DateTimeFormatter EVENT_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /** MDC key for the current operation name. */
    public static final String MDC_OPERATION = "operation";

    private static final String APP_VERSION = "1.0.0-SNAPSHOT";

    private static final String APP_NAME = "Component Catalog";

    private AppLogger() {
        throw new UnsupportedOperationException(
                "AppLogger is a static utility class.");
    }

    // -----------------------------------------------------------------------
    // STARTUP / SHUTDOWN BANNERS
    // -----------------------------------------------------------------------

    /**
     * Logs a startup banner with the runtime environment and the database
     * in use.
     *
     * @param dbPath the catalog database file for this session
     */
    public static void logStartup(Path dbPath) {
        String separator = "=".repeat(60);
        APP_LOG.info(separator);
        APP_LOG.info("  {} v{}", APP_NAME, APP_VERSION);
        APP_LOG.info("  Starting up - {}",
                LocalDateTime.now().format(EVENT_FORMAT));
        APP_LOG.info("  Java:     {} ({})",
                System.getProperty("java.version"),
                System.getProperty("java.vendor"));
        APP_LOG.info("  OS:       {} {} ({})",
                System.getProperty("os.name"),
                System.getProperty("os.version"),
                System.getProperty("os.arch"));
        APP_LOG.info("  Database: {}", dbPath);
        APP_LOG.info(separator);
    }

    /**
     * Logs a shutdown banner including the session duration.
     *
     * @param startTime when the session started; null reports zero duration
     */
    public static void logShutdown(LocalDateTime startTime) {
        String separator = "-".repeat(60);
        long millis = 0;
        if (startTime != null) {
            millis = Duration.between(startTime, LocalDateTime.now()).toMillis();
        }

        APP_LOG.info(separator);
        APP_LOG.info("  {} shutting down - {}",
                APP_NAME, LocalDateTime.now().format(EVENT_FORMAT));
        APP_LOG.info("  Session duration: {} ms", millis);
        APP_LOG.info(separator);
    }

    // -----------------------------------------------------------------------
    // STRUCTURED EVENT LOGGING
    // -----------------------------------------------------------------------

    /**
     * Logs a significant business event.
     * Format: {@code [EVENT] <eventName> | <details>}
     *
     * @param eventName short event label (e.g., "COMPONENT_ADDED")
     * @param details   additional context (e.g., "identifier=R10K")
     */
    public static void logEvent(String eventName, String details) {
        APP_LOG.info("[EVENT] {} | {}", eventName, details);
    }

    /**
     * Logs a business event that completed but warrants attention, such
     * as an import with skipped rows.
     *
     * @param eventName short event label
     * @param details   additional context
     */
    public static void logWarningEvent(String eventName, String details) {
        APP_LOG.warn("[WARN_EVENT] {} | {}", eventName, details);
    }

    /**
     * Logs a failed business operation together with its cause.
     *
     * @param eventName short event label
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

    /** @param operationName operation label (e.g., "CSV_IMPORT") */
    public static void setOperationContext(String operationName) {
        MDC.put(MDC_OPERATION, operationName);
    }

    public static void clearOperationContext() {
        MDC.remove(MDC_OPERATION);
    }
}
