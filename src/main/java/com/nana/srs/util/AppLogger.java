package com.nana.srs.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * AppLogger - Logging Utility
 *
 * <p>Every class declares its own SLF4J logger:
 * <pre>
 *     private static final Logger log = LoggerFactory.getLogger(MyClass.class);
 * </pre>
 * {@code AppLogger} adds what goes beyond per-class logging:
 * <ul>
 *   <li>Startup/shutdown banners marking where each session begins and ends.</li>
 *   <li>MDC keys ({@code session}, {@code operation}) that Logback prints on
 *       every line while they are set.</li>
 *   <li>Structured {@code [EVENT]} lines for record changes.</li>
 *   <li>The log file location, mirroring {@code logback.xml}.</li>
 * </ul>
 */
public final class AppLogger {

    // -----------------------------------------------------------------------
    // CONSTANTS
    // -----------------------------------------------------------------------

    /** Application-level logger for banners and events. */
    private static final Logger APP_LOG =
            LoggerFactory.getLogger("com.nana.srs.APP");

    private static final DateTimeFormatter EVENT_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /** MDC key for the current operation name. */
    public static final String MDC_OPERATION = "operation";

    /** MDC key for the current session. */
    public static final String MDC_SESSION = "session";

    public static final String APP_VERSION = "1.0.0-SNAPSHOT";

    public static final String APP_NAME = "Student Records Store";

    /** Must match the file appender in logback.xml. */
    private static final String LOG_DIR = "logs";
    private static final String LOG_FILE = "student-records.log";

    private AppLogger() {
        throw new UnsupportedOperationException(
                "AppLogger is a static utility class.");
    }

    // -----------------------------------------------------------------------
    // STARTUP / SHUTDOWN BANNERS
    // -----------------------------------------------------------------------

    /**
     * Logs the session start banner with JVM and OS details.
     *
     * @param dbPath the backing file this session will use
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
     * Logs the session end banner with the session duration.
     *
     * @param startTime when the application started; may be null
     */
    public static void logShutdown(LocalDateTime startTime) {
        String separator = "-".repeat(60);
        long seconds = 0;
        if (startTime != null) {
            seconds = Duration.between(startTime, LocalDateTime.now()).getSeconds();
        }
        long hours   = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs    = seconds % 60;

        APP_LOG.info(separator);
        APP_LOG.info("  {} shutting down - {}",
                APP_NAME, LocalDateTime.now().format(EVENT_FORMAT));
        APP_LOG.info("  Session duration: {}h {}m {}s", hours, minutes, secs);
        APP_LOG.info(separator);
    }

    // -----------------------------------------------------------------------
    // STRUCTURED EVENT LOGGING
    // -----------------------------------------------------------------------

    /**
     * Format: {@code [EVENT] <eventName> | <details>}
     *
     * @param eventName a short label, e.g. "STUDENT_ADDED"
     * @param details   context, e.g. "id=42"
     */
    public static void logEvent(String eventName, String details) {
        APP_LOG.info("[EVENT] {} | {}", eventName, details);
    }

    public static void logWarningEvent(String eventName, String details) {
        APP_LOG.warn("[WARN_EVENT] {} | {}", eventName, details);
    }

    public static void logErrorEvent(String eventName,
                                     String details,
                                     Throwable throwable) {
        APP_LOG.error("[ERROR_EVENT] {} | {}", eventName, details, throwable);
    }

    // -----------------------------------------------------------------------
    // MDC CONTEXT MANAGEMENT
    // -----------------------------------------------------------------------

    /**
     * Tags every log line on the current thread with the operation name.
     * Pair with {@link #clearOperationContext()} in a {@code finally} block:
     * <pre>
     *     AppLogger.setOperationContext("STUDENT_DELETE");
     *     try {
     *         // ...
     *     } finally {
     *         AppLogger.clearOperationContext();
     *     }
     * </pre>
     */
    public static void setOperationContext(String operationName) {
        MDC.put(MDC_OPERATION, operationName);
    }

    public static void clearOperationContext() {
        MDC.remove(MDC_OPERATION);
    }

    public static void setSessionContext(String sessionId) {
        MDC.put(MDC_SESSION, sessionId);
    }

    public static void clearAllContext() {
        MDC.remove(MDC_OPERATION);
        MDC.remove(MDC_SESSION);
    }

    // -----------------------------------------------------------------------
    // LOG FILE PATH
    // -----------------------------------------------------------------------

    /**
     * @return the active log file, relative to the working directory as
     *         configured in {@code logback.xml}
     */
    public static Path getLogFilePath() {
        return Paths.get(LOG_DIR, LOG_FILE).toAbsolutePath();
    }

    /**
     * @return a timestamp-based session id, e.g. "SESSION-20250115-143200"
     */
    public static String generateSessionId() {
        return "SESSION-" + LocalDateTime.now()
                .format(DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss"));
    }
}
