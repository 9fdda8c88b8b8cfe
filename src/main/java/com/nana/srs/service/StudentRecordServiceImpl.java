package com.nana.srs.service;

import com.nana.srs.domain.StudentRecord;
import com.nana.srs.repository.StudentRecordRepository;
import com.nana.srs.util.AppLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * StudentRecordServiceImpl - Service Layer Concrete Implementation
 *
 * <p>Holds the application-boundary rules the store itself does not enforce:
 * <ul>
 *   <li>{@code name} must not be blank.</li>
 *   <li>{@code grade} and {@code email} must be present but may be empty,
 *       matching what the store accepts.</li>
 *   <li>Ids typed by the user must be positive integers.</li>
 * </ul>
 * Text fields are trimmed before they are stored.
 *
 * <p>All field errors are collected into one {@link LinkedHashMap} before
 * throwing, so the caller sees every problem in a single pass.
 */
public class StudentRecordServiceImpl implements StudentRecordService {

    private static final Logger log = LoggerFactory.getLogger(StudentRecordServiceImpl.class);

    private final StudentRecordRepository repository;

    /**
     * @param repository the repository to delegate persistence to
     * @throws IllegalArgumentException if repository is null
     */
    public StudentRecordServiceImpl(StudentRecordRepository repository) {
        if (repository == null) {
            throw new IllegalArgumentException("StudentRecordRepository must not be null.");
        }
        this.repository = repository;
        log.debug("StudentRecordServiceImpl instantiated with repository: {}",
                repository.getClass().getSimpleName());
    }

    // -----------------------------------------------------------------------
    // COMMANDS
    // -----------------------------------------------------------------------

    @Override
    public StudentRecord addStudent(String name, String grade, String email) throws ValidationException {
        validateFields(name, grade, email);

        StudentRecord saved = repository.create(name.trim(), grade.trim(), email.trim());
        AppLogger.logEvent("STUDENT_ADDED", "id=" + saved.getId());
        return saved;
    }

    @Override
    public boolean updateStudent(int id, String name, String grade, String email) throws ValidationException {
        validateFields(name, grade, email);

        boolean updated = repository.update(id, name.trim(), grade.trim(), email.trim());
        if (updated) {
            AppLogger.logEvent("STUDENT_UPDATED", "id=" + id);
        } else {
            AppLogger.logWarningEvent("STUDENT_NOT_FOUND", "update id=" + id);
        }
        return updated;
    }

    @Override
    public boolean deleteStudent(int id) {
        boolean deleted = repository.delete(id);
        if (deleted) {
            AppLogger.logEvent("STUDENT_DELETED", "id=" + id);
        } else {
            AppLogger.logWarningEvent("STUDENT_NOT_FOUND", "delete id=" + id);
        }
        return deleted;
    }

    // -----------------------------------------------------------------------
    // QUERIES
    // -----------------------------------------------------------------------

    @Override
    public List<StudentRecord> getAllStudents() {
        return repository.findAll();
    }

    @Override
    public Optional<StudentRecord> findStudent(int id) {
        return repository.findById(id);
    }

    @Override
    public int countStudents() {
        return repository.count();
    }

    // -----------------------------------------------------------------------
    // ID PARSING
    // -----------------------------------------------------------------------

    @Override
    public int parseId(String rawId) throws InvalidIdException {
        if (rawId == null || rawId.isBlank()) {
            throw new InvalidIdException(rawId, "must not be blank");
        }
        String trimmed = rawId.trim();
        int id;
        try {
            id = Integer.parseInt(trimmed);
        } catch (NumberFormatException ex) {
            throw new InvalidIdException(rawId, "'" + trimmed + "' is not a whole number");
        }
        if (id <= 0) {
            throw new InvalidIdException(rawId, "must be a positive number");
        }
        return id;
    }

    // -----------------------------------------------------------------------
    // VALIDATION
    // -----------------------------------------------------------------------

    private void validateFields(String name, String grade, String email) throws ValidationException {
        Map<String, String> errors = new LinkedHashMap<>();

        if (name == null) {
            errors.put("name", "must not be null");
        } else if (name.isBlank()) {
            errors.put("name", "must not be blank");
        }
        if (grade == null) {
            errors.put("grade", "must not be null");
        }
        if (email == null) {
            errors.put("email", "must not be null");
        }

        if (!errors.isEmpty()) {
            log.debug("Validation failed: {}", errors);
            throw new ValidationException(errors);
        }
    }
}
