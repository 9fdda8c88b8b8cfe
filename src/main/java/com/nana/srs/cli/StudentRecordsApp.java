package com.nana.srs.cli;

import com.nana.srs.repository.SqliteStudentRecordRepository;
import com.nana.srs.repository.StorageUnavailableException;
import com.nana.srs.repository.StudentRecordRepository;
import com.nana.srs.service.StudentRecordService;
import com.nana.srs.service.StudentRecordServiceImpl;
import com.nana.srs.util.AppConfig;
import com.nana.srs.util.AppLogger;
import com.nana.srs.util.DatabaseManager;
import com.nana.srs.util.GlobalExceptionHandler;
import com.nana.srs.util.SchemaManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;

/**
 * StudentRecordsApp - Command-Line Entry Point
 *
 * <p>Composition root: all wiring happens here, configuration →
 * {@link DatabaseManager} → {@link SchemaManager} → repository → service →
 * {@link StudentRecordsCli}.
 *
 * <p>Exit status is 0 after a normal session and 1 when the database cannot
 * be prepared at startup.
 */
public final class StudentRecordsApp {

    private static final Logger log = LoggerFactory.getLogger(StudentRecordsApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_STORAGE_UNAVAILABLE = 1;

    private StudentRecordsApp() {
    }

    public static void main(String[] args) {
        GlobalExceptionHandler.install();
        AppLogger.setSessionContext(AppLogger.generateSessionId());

        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        int status = run(AppConfig.getInstance(), in, System.out, System.err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Runs a full session against the given streams.
     *
     * @return the process exit status
     */
    static int run(AppConfig config, BufferedReader in, PrintStream out, PrintStream err) {
        LocalDateTime startTime = LocalDateTime.now();
        DatabaseManager databaseManager = new DatabaseManager(config.getDbFile(), config.getBusyTimeoutMs());
        AppLogger.logStartup(databaseManager.getDbPath());

        try {
            new SchemaManager(databaseManager).ensureSchema();
        } catch (StorageUnavailableException ex) {
            log.error("Startup aborted: database unavailable.", ex);
            AppLogger.logErrorEvent("STARTUP_FAILED", "db=" + databaseManager.getDbPath(), ex);
            err.println("Cannot open the student database at " + databaseManager.getDbPath() + ":");
            err.println("  " + ex.getMessage());
            AppLogger.logShutdown(startTime);
            return EXIT_STORAGE_UNAVAILABLE;
        }

        StudentRecordRepository repository = new SqliteStudentRecordRepository(databaseManager);
        StudentRecordService service = new StudentRecordServiceImpl(repository);
        StudentRecordsCli cli = new StudentRecordsCli(service, in, out, config.isConfirmDelete());

        out.println(AppLogger.APP_NAME + " v" + AppLogger.APP_VERSION
                + " (" + service.countStudents() + " student(s) on record)");
        cli.run();

        AppLogger.logShutdown(startTime);
        AppLogger.clearAllContext();
        return EXIT_OK;
    }
}
