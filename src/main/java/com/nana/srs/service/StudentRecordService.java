package com.nana.srs.service;

import com.nana.srs.domain.StudentRecord;

import java.util.List;
import java.util.Optional;

/**
 * StudentRecordService - Service Layer Interface
 *
 * <p>The contract the CLI programs against. Implementations validate input
 * and delegate persistence to a
 * {@link com.nana.srs.repository.StudentRecordRepository}.
 *
 * <p>EXCEPTIONS:
 * <ul>
 *   <li>{@link ValidationException} (checked): bad field values.</li>
 *   <li>{@link InvalidIdException} (checked): id text that is not a positive
 *       integer.</li>
 *   <li>{@link com.nana.srs.repository.StorageUnavailableException}
 *       (unchecked): passed through unchanged from the repository.</li>
 * </ul>
 */
public interface StudentRecordService {

    /**
     * Validates and stores a new student.
     *
     * @return the stored record with its assigned id
     * @throws ValidationException if name is blank or any field is null
     */
    StudentRecord addStudent(String name, String grade, String email) throws ValidationException;

    /** @return every student ordered by ascending id; empty when none */
    List<StudentRecord> getAllStudents();

    Optional<StudentRecord> findStudent(int id);

    /** @return number of stored students */
    int countStudents();

    /**
     * Replaces name, grade and email of an existing student.
     *
     * @return true if the student existed and was updated, false if absent
     * @throws ValidationException if name is blank or any field is null
     */
    boolean updateStudent(int id, String name, String grade, String email) throws ValidationException;

    /**
     * @return true if the student existed and was deleted, false if absent
     */
    boolean deleteStudent(int id);

    /**
     * Converts user-typed text into a student id.
     *
     * @param rawId text as entered; surrounding whitespace is ignored
     * @return the parsed, positive id
     * @throws InvalidIdException if the text is blank, not an integer, out of
     *         {@code int} range, or not positive
     */
    int parseId(String rawId) throws InvalidIdException;
}
