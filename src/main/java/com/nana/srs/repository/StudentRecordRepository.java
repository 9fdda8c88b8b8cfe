package com.nana.srs.repository;

import com.nana.srs.domain.StudentRecord;

import java.util.List;
import java.util.Optional;

/**
 * StudentRecordRepository - Repository Layer Interface
 *
 * <p>Declares the data operations available over the {@code students} table
 * without saying how they are implemented. The service layer depends on this
 * interface only, so it can be unit-tested against a Mockito mock.
 *
 * <p>EXCEPTION STRATEGY:
 * Every method may throw {@link StorageUnavailableException}, an unchecked
 * wrapper around {@link java.sql.SQLException}.
 *
 * <p>ABSENT IDS:
 * {@link #update} and {@link #delete} never throw for an id that does not
 * exist. The statement still runs (and still commits); the {@code boolean}
 * result tells the caller whether a row was affected.
 *
 * <p>VALIDATION:
 * Implementations do not validate field contents. Empty strings are stored as
 * given; only {@code null} is rejected, as a programming error.
 */
public interface StudentRecordRepository {

    // -----------------------------------------------------------------------
    // CREATE
    // -----------------------------------------------------------------------

    /**
     * Inserts a new record and returns it with the id SQLite assigned.
     *
     * @param name  student name; must not be null
     * @param grade grade text; must not be null
     * @param email email text; must not be null
     * @return the persisted record carrying its new, never-before-used id
     * @throws NullPointerException        if any argument is null
     * @throws StorageUnavailableException on database failure
     */
    StudentRecord create(String name, String grade, String email);

    // -----------------------------------------------------------------------
    // READ
    // -----------------------------------------------------------------------

    /**
     * Returns every record ordered by ascending id.
     *
     * @return all records; an empty list when the table is empty, never null
     * @throws StorageUnavailableException on database failure
     */
    List<StudentRecord> findAll();

    /**
     * Looks up a single record by its surrogate key.
     *
     * @param id the surrogate key
     * @return the record, or {@link Optional#empty()} when absent
     * @throws StorageUnavailableException on database failure
     */
    Optional<StudentRecord> findById(int id);

    /**
     * @return number of records currently stored
     * @throws StorageUnavailableException on database failure
     */
    int count();

    // -----------------------------------------------------------------------
    // UPDATE
    // -----------------------------------------------------------------------

    /**
     * Overwrites name, grade and email of the record with the given id in a
     * single statement.
     *
     * @return true if a row was updated, false if no record has that id
     * @throws NullPointerException        if any text argument is null
     * @throws StorageUnavailableException on database failure
     */
    boolean update(int id, String name, String grade, String email);

    // -----------------------------------------------------------------------
    // DELETE
    // -----------------------------------------------------------------------

    /**
     * Permanently removes the record with the given id.
     *
     * @return true if a row was removed, false if no record has that id
     * @throws StorageUnavailableException on database failure
     */
    boolean delete(int id);
}
