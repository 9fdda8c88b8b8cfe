package com.nana.srs.cli;

import com.nana.srs.domain.StudentRecord;
import com.nana.srs.repository.StorageUnavailableException;
import com.nana.srs.service.InvalidIdException;
import com.nana.srs.service.StudentRecordService;
import com.nana.srs.service.ValidationException;
import com.nana.srs.util.AppLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * StudentRecordsCli - interactive text menu over {@link StudentRecordService}.
 *
 * <p>RESPONSIBILITIES:
 * <ul>
 *   <li>Print the menu and dispatch the chosen action.</li>
 *   <li>Turn raw input into typed arguments, re-prompting on an invalid id.</li>
 *   <li>Ask for confirmation before a delete (when enabled).</li>
 *   <li>Report validation and storage failures and keep the loop running.</li>
 * </ul>
 *
 * <p>The loop ends on menu choice 5 or at end of input.
 */
public class StudentRecordsCli {

    private static final Logger log = LoggerFactory.getLogger(StudentRecordsCli.class);

    static final String CHOICE_ADD    = "1";
    static final String CHOICE_VIEW   = "2";
    static final String CHOICE_UPDATE = "3";
    static final String CHOICE_DELETE = "4";
    static final String CHOICE_EXIT   = "5";

    private static final String ROW_FORMAT = "%-6s %-24s %-8s %s%n";

    private final StudentRecordService service;
    private final BufferedReader in;
    private final PrintStream out;
    private final boolean confirmDelete;

    public StudentRecordsCli(StudentRecordService service,
                             BufferedReader in,
                             PrintStream out,
                             boolean confirmDelete) {
        if (service == null) {
            throw new IllegalArgumentException("StudentRecordService must not be null.");
        }
        this.service = service;
        this.in = in;
        this.out = out;
        this.confirmDelete = confirmDelete;
    }

    // -----------------------------------------------------------------------
    // MAIN LOOP
    // -----------------------------------------------------------------------

    /**
     * Runs the menu until the user exits or input ends.
     */
    public void run() {
        boolean done = false;
        while (!done) {
            printMenu();
            String choice = prompt("Choose an option (1-5): ");
            if (choice == null) {
                out.println();
                break;
            }
            done = dispatch(choice);
        }
        out.println("Exiting program...");
    }

    /**
     * Executes one menu choice.
     *
     * @return true when the loop should stop
     */
    boolean dispatch(String choice) {
        try {
            switch (choice) {
                case CHOICE_ADD -> runOperation("STUDENT_ADD", this::addStudent);
                case CHOICE_VIEW -> runOperation("STUDENT_VIEW", this::viewStudents);
                case CHOICE_UPDATE -> runOperation("STUDENT_UPDATE", this::updateStudent);
                case CHOICE_DELETE -> runOperation("STUDENT_DELETE", this::deleteStudent);
                case CHOICE_EXIT -> {
                    return true;
                }
                default -> out.println("Invalid choice, try again.");
            }
        } catch (EndOfInputException ex) {
            out.println();
            return true;
        }
        return false;
    }

    // -----------------------------------------------------------------------
    // OPERATIONS
    // -----------------------------------------------------------------------

    private void addStudent() throws ValidationException {
        String name = requireLine("Name: ");
        String grade = requireLine("Grade: ");
        String email = requireLine("Email: ");

        StudentRecord saved = service.addStudent(name, grade, email);
        out.println("Student added with ID " + saved.getId() + ".");
    }

    private void viewStudents() {
        List<StudentRecord> students = service.getAllStudents();
        if (students.isEmpty()) {
            out.println("No students on record.");
            return;
        }
        out.printf(ROW_FORMAT, "ID", "Name", "Grade", "Email");
        for (StudentRecord s : students) {
            out.printf(ROW_FORMAT, s.getId(), s.getName(), s.getGrade(), s.getEmail());
        }
        out.println(students.size() + " student(s).");
    }

    private void updateStudent() throws ValidationException {
        int id = promptForId("Student ID to update: ");
        String name = requireLine("New name: ");
        String grade = requireLine("New grade: ");
        String email = requireLine("New email: ");

        if (service.updateStudent(id, name, grade, email)) {
            out.println("Student " + id + " updated.");
        } else {
            out.println("No student found with ID " + id + ".");
        }
    }

    private void deleteStudent() {
        int id = promptForId("Student ID to delete: ");

        Optional<StudentRecord> existing = service.findStudent(id);
        if (existing.isEmpty()) {
            out.println("No student found with ID " + id + ".");
            return;
        }

        if (confirmDelete) {
            StudentRecord s = existing.get();
            String answer = requireLine("Delete student " + id + " (" + s.getName() + ")? (y/n): ");
            if (!answer.trim().toLowerCase(Locale.ROOT).equals("y")) {
                out.println("Delete cancelled.");
                return;
            }
        }

        if (service.deleteStudent(id)) {
            out.println("Student " + id + " deleted.");
        } else {
            out.println("No student found with ID " + id + ".");
        }
    }

    // -----------------------------------------------------------------------
    // ERROR HANDLING
    // -----------------------------------------------------------------------

    /**
     * Runs one operation under an MDC operation tag. Validation and storage
     * failures are reported to the user; the menu loop carries on.
     */
    private void runOperation(String operationName, Operation operation) {
        AppLogger.setOperationContext(operationName);
        try {
            operation.execute();
        } catch (ValidationException ex) {
            out.println("Invalid input:");
            ex.getFieldErrors().forEach((field, msg) ->
                    out.println("  " + field + ": " + msg));
        } catch (StorageUnavailableException ex) {
            log.error("{} failed.", operationName, ex);
            out.println("Database error: " + ex.getMessage());
            out.println("The operation was not completed. See " + AppLogger.getLogFilePath());
        } finally {
            AppLogger.clearOperationContext();
        }
    }

    @FunctionalInterface
    private interface Operation {
        void execute() throws ValidationException;
    }

    // -----------------------------------------------------------------------
    // INPUT HELPERS
    // -----------------------------------------------------------------------

    /**
     * Asks for an id until a valid one is entered.
     *
     * @throws EndOfInputException if input ends first
     */
    private int promptForId(String message) {
        while (true) {
            String raw = requireLine(message);
            try {
                return service.parseId(raw);
            } catch (InvalidIdException ex) {
                out.println("Invalid ID: " + ex.getError(InvalidIdException.FIELD_ID) + ". Try again.");
            }
        }
    }

    /**
     * @throws EndOfInputException if input has ended
     */
    private String requireLine(String message) {
        String line = prompt(message);
        if (line == null) {
            throw new EndOfInputException();
        }
        return line;
    }

    /**
     * @return the trimmed line, or null at end of input
     */
    private String prompt(String message) {
        out.print(message);
        out.flush();
        try {
            String line = in.readLine();
            return line == null ? null : line.trim();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read from console.", ex);
        }
    }

    private void printMenu() {
        out.println();
        out.println("--- Student Records Menu ---");
        out.println("1) Add student");
        out.println("2) View students");
        out.println("3) Update student");
        out.println("4) Delete student");
        out.println("5) Exit");
    }

    /** Input ended in the middle of an operation. */
    private static final class EndOfInputException extends RuntimeException {
        EndOfInputException() {
            super("End of input.");
        }
    }
}
