package com.nana.srs.domain;

import java.util.Objects;

/**
 * StudentRecord - Core Domain Entity
 *
 * <p>One row of the {@code students} table. The {@code id} is a surrogate key
 * assigned by SQLite when the record is first inserted and never changes
 * afterwards; {@code 0} marks a record that has not been saved yet.
 *
 * <p>FIELD OVERVIEW:
 * <pre>
 *   id     - Auto-incremented surrogate PK from SQLite (0 = unsaved)
 *   name   - Student name, must not be blank at the service boundary
 *   grade  - Free-text grade (e.g. "A", "10th", "B+")
 *   email  - Contact address, duplicates allowed
 * </pre>
 *
 * <p>Instances are immutable. An update produces a new record through
 * {@link #withFields(String, String, String)}, which keeps the id and
 * replaces all three data fields together.
 */
public final class StudentRecord {

    /** Marker id for a record that has not been persisted. */
    public static final int UNSAVED_ID = 0;

    private final int id;
    private final String name;
    private final String grade;
    private final String email;

    // -----------------------------------------------------------------------
    // CONSTRUCTORS
    // -----------------------------------------------------------------------

    /**
     * Creates a record with an explicit id, as read back from the database.
     *
     * @param id    surrogate key
     * @param name  student name; must not be null
     * @param grade grade text; must not be null
     * @param email email text; must not be null
     * @throws NullPointerException if any text field is null
     */
    public StudentRecord(int id, String name, String grade, String email) {
        this.id = id;
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.grade = Objects.requireNonNull(grade, "grade must not be null");
        this.email = Objects.requireNonNull(email, "email must not be null");
    }

    /**
     * Creates an unsaved record. The id is assigned when it is persisted.
     */
    public static StudentRecord unsaved(String name, String grade, String email) {
        return new StudentRecord(UNSAVED_ID, name, grade, email);
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getGrade() {
        return grade;
    }

    public String getEmail() {
        return email;
    }

    /** @return true once the record has been assigned a database id */
    public boolean isSaved() {
        return id != UNSAVED_ID;
    }

    // -----------------------------------------------------------------------
    // COPY HELPERS
    // -----------------------------------------------------------------------

    /**
     * Returns a copy of this record carrying the given id.
     * Used by the repository after SQLite hands back the generated key.
     */
    public StudentRecord withId(int newId) {
        return new StudentRecord(newId, name, grade, email);
    }

    /**
     * Returns a copy with the same id and all three data fields replaced.
     */
    public StudentRecord withFields(String newName, String newGrade, String newEmail) {
        return new StudentRecord(id, newName, newGrade, newEmail);
    }

    // -----------------------------------------------------------------------
    // OBJECT OVERRIDES
    // -----------------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StudentRecord other)) return false;
        return id == other.id
                && name.equals(other.name)
                && grade.equals(other.grade)
                && email.equals(other.email);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, grade, email);
    }

    /**
     * Concise description for logging. The email is left out so addresses
     * do not end up in log files.
     */
    @Override
    public String toString() {
        return "StudentRecord{" +
               "id=" + id +
               ", name='" + name + '\'' +
               ", grade='" + grade + '\'' +
               '}';
    }
}
