package com.nana.srs.repository;

import com.nana.srs.domain.StudentRecord;
import com.nana.srs.util.DatabaseManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * SqliteStudentRecordRepository - Repository Layer Concrete Implementation
 *
 * <p>Implements {@link StudentRecordRepository} on the SQLite file managed by
 * {@link DatabaseManager}.
 *
 * <p>RULES:
 * <ul>
 *   <li>All SQL lives in this class and uses prepared statements.</li>
 *   <li>Every {@link SQLException} is wrapped in
 *       {@link StorageUnavailableException} before propagating.</li>
 *   <li>No validation beyond rejecting {@code null}.</li>
 * </ul>
 *
 * <p>CONNECTION MANAGEMENT:
 * Each method opens its own connection in a try-with-resources block, runs
 * one statement in auto-commit mode and closes the connection. Every call is
 * therefore its own transaction and nothing is held between calls.
 *
 * <p>The table is expected to exist already; see
 * {@link com.nana.srs.util.SchemaManager#ensureSchema()}.
 */
public class SqliteStudentRecordRepository implements StudentRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(SqliteStudentRecordRepository.class);

    // -----------------------------------------------------------------------
    // SQL CONSTANTS
    // -----------------------------------------------------------------------

    private static final String SQL_INSERT = """
            INSERT INTO students (name, grade, email)
            VALUES (?, ?, ?)
            """;

    /** Connection-scoped, so it must run on the connection that did the INSERT. */
    private static final String SQL_LAST_ID = "SELECT last_insert_rowid()";

    private static final String SQL_FIND_ALL = """
            SELECT id, name, grade, email
            FROM students
            ORDER BY id ASC
            """;

    private static final String SQL_FIND_BY_ID = """
            SELECT id, name, grade, email
            FROM students
            WHERE id = ?
            """;

    private static final String SQL_COUNT_ALL = "SELECT COUNT(*) FROM students";

    private static final String SQL_UPDATE = """
            UPDATE students
            SET name = ?, grade = ?, email = ?
            WHERE id = ?
            """;

    private static final String SQL_DELETE = "DELETE FROM students WHERE id = ?";

    // -----------------------------------------------------------------------
    // DEPENDENCIES
    // -----------------------------------------------------------------------

    private final DatabaseManager databaseManager;

    public SqliteStudentRecordRepository(DatabaseManager databaseManager) {
        if (databaseManager == null) {
            throw new IllegalArgumentException("DatabaseManager must not be null.");
        }
        this.databaseManager = databaseManager;
    }

    // -----------------------------------------------------------------------
    // CREATE
    // -----------------------------------------------------------------------

    /**
     * {@inheritDoc}
     *
     * <p>The generated key is read back with {@code last_insert_rowid()} on
     * the same connection, before it is closed.
     */
    @Override
    public StudentRecord create(String name, String grade, String email) {
        StudentRecord record = StudentRecord.unsaved(name, grade, email);
        log.debug("Inserting new student: {}", record);

        try (Connection connection = databaseManager.openConnection();
             PreparedStatement ps = connection.prepareStatement(SQL_INSERT);
             PreparedStatement idQuery = connection.prepareStatement(SQL_LAST_ID)) {

            bindFields(ps, record.getName(), record.getGrade(), record.getEmail());
            ps.executeUpdate();

            try (ResultSet keys = idQuery.executeQuery()) {
                if (keys.next()) {
                    StudentRecord saved = record.withId(keys.getInt(1));
                    log.info("Student inserted with id={}.", saved.getId());
                    return saved;
                }
            }
            throw new StorageUnavailableException(
                    "Insert succeeded but no generated id was returned for: " + record);

        } catch (SQLException ex) {
            throw new StorageUnavailableException("Failed to insert student: " + record, ex);
        }
    }

    // -----------------------------------------------------------------------
    // READ
    // -----------------------------------------------------------------------

    @Override
    public List<StudentRecord> findAll() {
        log.debug("Fetching all students.");
        List<StudentRecord> students = new ArrayList<>();

        try (Connection connection = databaseManager.openConnection();
             PreparedStatement ps = connection.prepareStatement(SQL_FIND_ALL);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                students.add(mapRow(rs));
            }

        } catch (SQLException ex) {
            throw new StorageUnavailableException("Failed to retrieve all students.", ex);
        }

        log.debug("findAll() returned {} students.", students.size());
        return students;
    }

    @Override
    public Optional<StudentRecord> findById(int id) {
        log.debug("Finding student by id={}.", id);

        try (Connection connection = databaseManager.openConnection();
             PreparedStatement ps = connection.prepareStatement(SQL_FIND_BY_ID)) {
            ps.setInt(1, id);

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }

        } catch (SQLException ex) {
            throw new StorageUnavailableException("Failed to find student by id: " + id, ex);
        }

        return Optional.empty();
    }

    @Override
    public int count() {
        try (Connection connection = databaseManager.openConnection();
             PreparedStatement ps = connection.prepareStatement(SQL_COUNT_ALL);
             ResultSet rs = ps.executeQuery()) {

            if (rs.next()) {
                return rs.getInt(1);
            }

        } catch (SQLException ex) {
            throw new StorageUnavailableException("Failed to count students.", ex);
        }

        return 0;
    }

    // -----------------------------------------------------------------------
    // UPDATE
    // -----------------------------------------------------------------------

    /**
     * {@inheritDoc}
     *
     * <p>A zero affected-row count is reported as {@code false}, not as an
     * error. The statement has still been executed and committed.
     */
    @Override
    public boolean update(int id, String name, String grade, String email) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(grade, "grade must not be null");
        Objects.requireNonNull(email, "email must not be null");
        log.debug("Updating student id={}.", id);

        try (Connection connection = databaseManager.openConnection();
             PreparedStatement ps = connection.prepareStatement(SQL_UPDATE)) {

            bindFields(ps, name, grade, email);
            // WHERE clause, last parameter
            ps.setInt(4, id);

            int affected = ps.executeUpdate();
            if (affected == 0) {
                log.info("Update matched no student with id={}.", id);
                return false;
            }
            log.info("Student id={} updated.", id);
            return true;

        } catch (SQLException ex) {
            throw new StorageUnavailableException("Failed to update student id: " + id, ex);
        }
    }

    // -----------------------------------------------------------------------
    // DELETE
    // -----------------------------------------------------------------------

    /**
     * {@inheritDoc}
     *
     * <p>Same affected-row handling as {@link #update}.
     */
    @Override
    public boolean delete(int id) {
        log.debug("Deleting student id={}.", id);

        try (Connection connection = databaseManager.openConnection();
             PreparedStatement ps = connection.prepareStatement(SQL_DELETE)) {
            ps.setInt(1, id);

            int affected = ps.executeUpdate();
            if (affected == 0) {
                log.info("Delete matched no student with id={}.", id);
                return false;
            }
            log.info("Student id={} deleted.", id);
            return true;

        } catch (SQLException ex) {
            throw new StorageUnavailableException("Failed to delete student with id: " + id, ex);
        }
    }

    // -----------------------------------------------------------------------
    // PRIVATE HELPERS
    // -----------------------------------------------------------------------

    /**
     * Binds name, grade and email to parameters 1-3. Shared by INSERT and
     * UPDATE, which list the columns in the same order.
     */
    private static void bindFields(PreparedStatement ps,
                                   String name,
                                   String grade,
                                   String email) throws SQLException {
        ps.setString(1, name);
        ps.setString(2, grade);
        ps.setString(3, email);
    }

    /**
     * Maps the current {@link ResultSet} row to a {@link StudentRecord}.
     * Columns are read by name so the SELECT column order does not matter.
     */
    private static StudentRecord mapRow(ResultSet rs) throws SQLException {
        return new StudentRecord(
                rs.getInt("id"),
                rs.getString("name"),
                rs.getString("grade"),
                rs.getString("email"));
    }
}
