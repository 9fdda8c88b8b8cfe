package com.nana.srs.cli;

import com.nana.srs.domain.StudentRecord;
import com.nana.srs.repository.StorageUnavailableException;
import com.nana.srs.repository.StudentRecordRepository;
import com.nana.srs.service.StudentRecordServiceImpl;
import com.nana.srs.util.AppConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Drives the menu with scripted input. The service is real so id parsing and
 * field validation behave as in production; only the repository is mocked.
 * The {@code StudentRecordsApp} tests run end to end on a temporary file.
 */
@ExtendWith(MockitoExtension.class)
class StudentRecordsCliTest {

    @Mock
    private StudentRecordRepository mockRepository;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private String runCli(String script, boolean confirmDelete) {
        StudentRecordsCli cli = new StudentRecordsCli(
                new StudentRecordServiceImpl(mockRepository),
                new BufferedReader(new StringReader(script)),
                new PrintStream(buffer, true, StandardCharsets.UTF_8),
                confirmDelete);
        cli.run();
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private String runCli(String script) {
        return runCli(script, true);
    }

    // ======================================================================
    // MENU
    // ======================================================================

    @Nested
    @DisplayName("Menu Loop Tests")
    class MenuTests {

        @Test
        @DisplayName("exit choice ends the loop")
        void exit_endsLoop() {
            String output = runCli("5\n");

            assertTrue(output.contains("--- Student Records Menu ---"));
            assertTrue(output.contains("Exiting program..."));
            verifyNoInteractions(mockRepository);
        }

        @Test
        @DisplayName("end of input ends the loop")
        void endOfInput_endsLoop() {
            assertTrue(runCli("").contains("Exiting program..."));
        }

        @Test
        @DisplayName("end of input in the middle of an operation ends the loop")
        void endOfInput_midOperation_endsLoop() {
            String output = runCli("1\nAnn\n");

            assertTrue(output.contains("Exiting program..."));
            verifyNoInteractions(mockRepository);
        }

        @Test
        @DisplayName("unknown choice is reported and the menu is shown again")
        void unknownChoice_reprompts() {
            String output = runCli("9\n5\n");

            assertTrue(output.contains("Invalid choice, try again."));
            assertEquals(2, output.split("--- Student Records Menu ---", -1).length - 1);
        }

        @Test
        @DisplayName("storage failure is reported and the loop continues")
        void storageFailure_loopContinues() {
            when(mockRepository.findAll())
                    .thenThrow(new StorageUnavailableException("database is locked"))
                    .thenReturn(List.of());

            String output = runCli("2\n2\n5\n");

            assertTrue(output.contains("Database error: database is locked"));
            assertTrue(output.contains("No students on record."));
        }
    }

    // ======================================================================
    // ADD / VIEW
    // ======================================================================

    @Nested
    @DisplayName("Add and View Tests")
    class AddViewTests {

        @Test
        @DisplayName("add prompts for fields and reports the new id")
        void add_reportsId() {
            when(mockRepository.create("Ann", "A", "ann@x.com"))
                    .thenReturn(new StudentRecord(1, "Ann", "A", "ann@x.com"));

            String output = runCli("1\n Ann \nA\nann@x.com\n5\n");

            assertTrue(output.contains("Student added with ID 1."));
        }

        @Test
        @DisplayName("add with a blank name prints the field error and stores nothing")
        void add_blankName_printsError() {
            String output = runCli("1\n\nA\nann@x.com\n5\n");

            assertTrue(output.contains("Invalid input:"));
            assertTrue(output.contains("name: must not be blank"));
            verify(mockRepository, never()).create(any(), any(), any());
        }

        @Test
        @DisplayName("view on an empty store prints a message")
        void view_empty() {
            when(mockRepository.findAll()).thenReturn(List.of());

            assertTrue(runCli("2\n5\n").contains("No students on record."));
        }

        @Test
        @DisplayName("view lists every record and a total")
        void view_listsRecords() {
            when(mockRepository.findAll()).thenReturn(List.of(
                    new StudentRecord(1, "Ann", "A", "ann@x.com"),
                    new StudentRecord(3, "Ben", "B", "ben@x.com")));

            String output = runCli("2\n5\n");

            assertTrue(output.contains("ann@x.com"));
            assertTrue(output.contains("ben@x.com"));
            assertTrue(output.indexOf("Ann") < output.indexOf("Ben"));
            assertTrue(output.contains("2 student(s)."));
        }
    }

    // ======================================================================
    // UPDATE
    // ======================================================================

    @Nested
    @DisplayName("Update Tests")
    class UpdateTests {

        @Test
        @DisplayName("invalid ids are re-prompted until a valid one is given")
        void update_invalidId_reprompts() {
            when(mockRepository.update(7, "Ben", "B", "ben@x.com")).thenReturn(true);

            String output = runCli("3\nabc\n0\n7\nBen\nB\nben@x.com\n5\n");

            assertEquals(2, output.split("Invalid ID:", -1).length - 1);
            assertTrue(output.contains("Student 7 updated."));
        }

        @Test
        @DisplayName("update of an absent id reports not found")
        void update_absentId_reportsNotFound() {
            when(mockRepository.update(9, "Ben", "B", "ben@x.com")).thenReturn(false);

            String output = runCli("3\n9\nBen\nB\nben@x.com\n5\n");

            assertTrue(output.contains("No student found with ID 9."));
        }
    }

    // ======================================================================
    // DELETE
    // ======================================================================

    @Nested
    @DisplayName("Delete Tests")
    class DeleteTests {

        private final StudentRecord ann = new StudentRecord(2, "Ann", "A", "ann@x.com");

        @Test
        @DisplayName("confirmed delete removes the record")
        void delete_confirmed() {
            when(mockRepository.findById(2)).thenReturn(Optional.of(ann));
            when(mockRepository.delete(2)).thenReturn(true);

            String output = runCli("4\n2\ny\n5\n");

            assertTrue(output.contains("Delete student 2 (Ann)? (y/n): "));
            assertTrue(output.contains("Student 2 deleted."));
        }

        @Test
        @DisplayName("anything other than y cancels the delete")
        void delete_declined() {
            when(mockRepository.findById(2)).thenReturn(Optional.of(ann));

            String output = runCli("4\n2\nn\n5\n");

            assertTrue(output.contains("Delete cancelled."));
            verify(mockRepository, never()).delete(anyInt());
        }

        @Test
        @DisplayName("delete of an absent id reports not found without asking")
        void delete_absentId() {
            when(mockRepository.findById(999)).thenReturn(Optional.empty());

            String output = runCli("4\n999\n5\n");

            assertTrue(output.contains("No student found with ID 999."));
            assertFalse(output.contains("(y/n)"));
            verify(mockRepository, never()).delete(anyInt());
        }

        @Test
        @DisplayName("confirmation can be switched off")
        void delete_withoutConfirmation() {
            when(mockRepository.findById(2)).thenReturn(Optional.of(ann));
            when(mockRepository.delete(2)).thenReturn(true);

            String output = runCli("4\n2\n5\n", false);

            assertFalse(output.contains("(y/n)"));
            assertTrue(output.contains("Student 2 deleted."));
        }
    }

    // ======================================================================
    // APPLICATION
    // ======================================================================

    @Nested
    @DisplayName("StudentRecordsApp Tests")
    class AppTests {

        @TempDir
        Path tempDir;

        private AppConfig configFor(Path dbFile) {
            AppConfig config = AppConfig.load(tempDir.resolve("absent.properties"));
            config.set(AppConfig.KEY_DB_FILE, dbFile.toString());
            return config;
        }

        private int runApp(AppConfig config, String script, ByteArrayOutputStream out, ByteArrayOutputStream err) {
            return StudentRecordsApp.run(config,
                    new BufferedReader(new StringReader(script)),
                    new PrintStream(out, true, StandardCharsets.UTF_8),
                    new PrintStream(err, true, StandardCharsets.UTF_8));
        }

        @Test
        @DisplayName("records added in one session are visible in the next")
        void sessions_shareDurableFile() {
            AppConfig config = configFor(tempDir.resolve("students.db"));

            ByteArrayOutputStream first = new ByteArrayOutputStream();
            assertEquals(StudentRecordsApp.EXIT_OK,
                    runApp(config, "1\nAnn\nA\nann@x.com\n5\n", first, new ByteArrayOutputStream()));
            assertTrue(first.toString(StandardCharsets.UTF_8).contains("(0 student(s) on record)"));

            ByteArrayOutputStream second = new ByteArrayOutputStream();
            assertEquals(StudentRecordsApp.EXIT_OK,
                    runApp(config, "2\n5\n", second, new ByteArrayOutputStream()));
            String output = second.toString(StandardCharsets.UTF_8);
            assertTrue(output.contains("(1 student(s) on record)"));
            assertTrue(output.contains("ann@x.com"));
        }

        @Test
        @DisplayName("an unusable database location aborts startup with status 1")
        void unusableDatabase_exitsWithError() throws IOException {
            Path blocker = Files.writeString(tempDir.resolve("blocker"), "x", StandardCharsets.UTF_8);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ByteArrayOutputStream err = new ByteArrayOutputStream();

            int status = runApp(configFor(blocker.resolve("students.db")), "5\n", out, err);

            assertEquals(StudentRecordsApp.EXIT_STORAGE_UNAVAILABLE, status);
            assertTrue(err.toString(StandardCharsets.UTF_8).contains("Cannot open the student database"));
            assertFalse(out.toString(StandardCharsets.UTF_8).contains("Menu"));
        }
    }
}
