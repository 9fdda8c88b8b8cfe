package com.nana.srs.util;

import com.nana.srs.repository.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.lang.Thread.UncaughtExceptionHandler;

/**
 * GlobalExceptionHandler - Application-Wide Uncaught Exception Handler
 *
 * <p>Logs anything that escapes a thread and prints a short message on the
 * error stream pointing at the log file for the full stack trace.
 */
public final class GlobalExceptionHandler implements UncaughtExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final PrintStream err;

    GlobalExceptionHandler(PrintStream err) {
        this.err = err;
    }

    public static void install() {
        GlobalExceptionHandler handler = new GlobalExceptionHandler(System.err);
        Thread.setDefaultUncaughtExceptionHandler(handler);
        Thread.currentThread().setUncaughtExceptionHandler(handler);
        log.info("GlobalExceptionHandler installed on all threads.");
    }

    @Override
    public void uncaughtException(Thread thread, Throwable throwable) {
        log.error("UNCAUGHT EXCEPTION on thread '{}': {}", thread.getName(), throwable.getMessage(), throwable);
        AppLogger.logErrorEvent("UNCAUGHT_EXCEPTION",
                "thread=" + thread.getName() + ", exception=" + throwable.getClass().getSimpleName(),
                throwable);
        err.println(buildUserMessage(throwable));
        err.println("Full log file: " + AppLogger.getLogFilePath());
    }

    static String buildUserMessage(Throwable throwable) {
        if (throwable instanceof OutOfMemoryError) {
            return "The application ran out of memory. Please restart the application.";
        }
        if (throwable instanceof StorageUnavailableException) {
            return "The student database could not be accessed:\n" + throwable.getMessage();
        }
        String message = throwable.getMessage();
        if (message == null || message.isBlank()) {
            message = throwable.getClass().getSimpleName();
        }
        return "An unexpected error occurred:\n" + message;
    }
}
