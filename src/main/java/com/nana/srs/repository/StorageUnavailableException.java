package com.nana.srs.repository;

/**
 * Unchecked exception raised when the SQLite backing file cannot be opened,
 * read or written (permissions, full disk, corruption, incompatible table).
 *
 * <p>Wraps the underlying {@link java.sql.SQLException} or
 * {@link java.io.IOException} so the service and CLI layers never depend on
 * JDBC types. It is always propagated to the caller. Raised from schema setup
 * it is fatal to startup; raised from a single store operation it only fails
 * that operation.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageUnavailableException(String message) {
        super(message);
    }
}
