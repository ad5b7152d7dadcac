package com.flagship.library_ledger.desk;

import com.flagship.library_ledger.catalog.BookCondition;
import com.flagship.library_ledger.common.FailureReason;
import com.flagship.library_ledger.common.OperationResult;
import com.flagship.library_ledger.loan.ReturnResult;
import com.flagship.library_ledger.support.LibraryStoreTestSupport;
import com.flagship.library_ledger.tenant.LibrarySession;
import com.flagship.library_ledger.tenant.School;
import com.flagship.library_ledger.tenant.UserAccount;
import com.flagship.library_ledger.tenant.UserRole;
import com.flagship.library_ledger.undo.UndoLogEntry;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Staff-facing flows: role checks, lookups by admission number and barcode,
 * and the non-circulating filter.
 */
class LibraryDeskTest extends LibraryStoreTestSupport {

    @Autowired
    private LibraryDesk desk;

    @Autowired
    private MeterRegistry meterRegistry;

    private School school;
    private LibrarySession admin;
    private LibrarySession librarian;
    private LibrarySession assistant;

    @BeforeEach
    void setUp() {
        school = registerSchool("Desk", 10, 14);
        admin = sessionService.openSession(school.getName(), "secret", "admin", "admin").orElseThrow();

        assertTrue(desk.addUser(admin, "lib", "pw", UserRole.LIBRARIAN).isSuccess());
        assertTrue(desk.addUser(admin, "asst", "pw", UserRole.ASSISTANT).isSuccess());
        librarian = sessionService.loginUser(school, "lib", "pw").orElseThrow();
        assistant = sessionService.loginUser(school, "asst", "pw").orElseThrow();

        assertTrue(desk.addStudent(assistant, "A100", "Jane", "4B").isSuccess());
        assertTrue(desk.addBook(librarian, "Matilda", "Roald Dahl", "BC001").isSuccess());
    }

    @Nested
    @DisplayName("Lending")
    class Lending {

        @Test
        @DisplayName("Oakview example through the desk: fine of 30 on day 17")
        void testBorrowAndLateReturn() {
            printTestHeader("Desk Borrow And Return");

            OperationResult borrowed = desk.borrow(assistant, "A100", "BC001");
            printOutput("Borrow", borrowed);
            assertTrue(borrowed.isSuccess());
            assertEquals("Borrowed by Jane", borrowed.getMessage());
            assertEquals(1, desk.currentLoans(assistant).size());
            assertEquals(1, desk.studentActiveLoans(assistant, "A100").size());

            clock.advanceDays(17);
            ReturnResult returned = desk.returnBook(assistant, "BC001");
            printOutput("Return", returned);

            assertTrue(returned.isSuccess());
            assertEquals(30, returned.getFine());
            assertTrue(desk.currentLoans(assistant).isEmpty());
            assertEquals(1, desk.studentLoanHistory(assistant, "A100").size());
            printSuccess(returned.getMessage());
        }

        @Test
        @DisplayName("Reference copies are never lent")
        void testNonCirculating() {
            desk.addBook(librarian, "Atlas", "Collins", "REF-1", true, BookCondition.GOOD);

            OperationResult result = desk.borrow(assistant, "A100", "REF-1");

            assertEquals(FailureReason.NOT_CIRCULATING, result.getReason());
            assertEquals("Book not for borrowing", result.getMessage());
            assertTrue(desk.currentLoans(assistant).isEmpty());
        }

        @Test
        @DisplayName("Unknown admission numbers and barcodes are reported by name")
        void testUnknownRecords() {
            assertEquals("Student not found", desk.borrow(assistant, "ZZZ", "BC001").getMessage());
            assertEquals("Book not found", desk.borrow(assistant, "A100", "ZZZ").getMessage());
            assertEquals(FailureReason.INVALID_INPUT, desk.borrow(assistant, " ", "BC001").getReason());
            assertEquals(FailureReason.INVALID_INPUT, desk.borrow(assistant, "A100", "BC001", 0).getReason());
            assertEquals(FailureReason.NOT_FOUND, desk.returnBook(assistant, "ZZZ").getReason());
            assertEquals(FailureReason.NO_ACTIVE_LOAN, desk.returnBook(assistant, "BC001").getReason());
        }

        @Test
        @DisplayName("A second borrow of the same copy is refused")
        void testAlreadyBorrowed() {
            desk.addStudent(assistant, "A101", "Tom", "4B");
            assertTrue(desk.borrow(assistant, "A100", "BC001").isSuccess());

            OperationResult second = desk.borrow(assistant, "A101", "BC001");

            assertEquals(FailureReason.ALREADY_BORROWED, second.getReason());
        }
    }

    @Nested
    @DisplayName("Roles")
    class Roles {

        @Test
        @DisplayName("Assistants cannot add or delete books and denials are counted")
        void testAssistantDenied() {
            double before = meterRegistry.counter("library.access.denied", "operation", "add_book").count();

            OperationResult result = desk.addBook(assistant, "Matilda", "Roald Dahl", "BC002");

            assertEquals(FailureReason.PERMISSION_DENIED, result.getReason());
            assertEquals(before + 1, meterRegistry.counter("library.access.denied", "operation", "add_book").count());
            assertEquals(FailureReason.PERMISSION_DENIED, desk.deleteBook(assistant, "BC001").getReason());
            assertEquals(FailureReason.PERMISSION_DENIED, desk.deleteStudent(assistant, "A100").getReason());
            assertEquals(1, desk.listBooks(admin).size());
        }

        @Test
        @DisplayName("Librarians delete students but only admins delete books")
        void testDeletePermissions() {
            assertEquals(FailureReason.PERMISSION_DENIED, desk.deleteBook(librarian, "BC001").getReason());
            assertTrue(desk.deleteBook(admin, "BC001").isSuccess());
            assertTrue(desk.deleteStudent(librarian, "A100").isSuccess());
            assertTrue(desk.listStudents(assistant).isEmpty());
        }

        @Test
        @DisplayName("Only admins change settings and manage users")
        void testAdminOnly() {
            assertEquals(FailureReason.PERMISSION_DENIED, desk.updateSettings(librarian, 20, 7).getReason());
            assertEquals(FailureReason.INVALID_INPUT, desk.updateSettings(admin, -1, 7).getReason());
            assertTrue(desk.updateSettings(admin, 20, 7).isSuccess());
            assertEquals(20, schoolService.findById(school.getId()).orElseThrow().getFinePerDay());

            assertEquals(FailureReason.PERMISSION_DENIED,
                desk.addUser(librarian, "x", "pw", UserRole.ADMIN).getReason());
            assertTrue(desk.listUsers(librarian).isEmpty());
            assertEquals(List.of("admin", "asst", "lib"),
                desk.listUsers(admin).stream().map(UserAccount::getUsername).toList());
            assertEquals(FailureReason.DUPLICATE_KEY, desk.addUser(admin, "lib", "pw", UserRole.ADMIN).getReason());
        }

        @Test
        @DisplayName("Admins cannot delete their own account")
        void testDeleteUsers() {
            assertEquals(FailureReason.INVALID_INPUT, desk.deleteUser(admin, "admin").getReason());
            assertTrue(desk.deleteUser(admin, "asst").isSuccess());
            assertEquals(FailureReason.NOT_FOUND, desk.deleteUser(admin, "asst").getReason());
        }
    }

    @Nested
    @DisplayName("Undo")
    class Undo {

        @Test
        @DisplayName("A librarian can undo a deletion from the recent list")
        void testUndoFromRecentList() {
            assertTrue(desk.deleteStudent(librarian, "A100").isSuccess());
            List<UndoLogEntry> recent = desk.recentDeletions(librarian);
            assertEquals(1, recent.size());

            assertEquals(FailureReason.PERMISSION_DENIED,
                desk.undoDeletion(assistant, recent.get(0).getId()).getReason());
            assertTrue(desk.undoDeletion(librarian, recent.get(0).getId()).isSuccess());

            assertEquals(1, desk.searchStudents(assistant, "jane").size());
            assertTrue(desk.recentDeletions(librarian).isEmpty());
        }

        @Test
        @DisplayName("A copy on loan is not deleted")
        void testDeleteBookOnLoan() {
            assertTrue(desk.borrow(assistant, "A100", "BC001").isSuccess());

            OperationResult result = desk.deleteBook(admin, "BC001");

            assertEquals(FailureReason.ACTIVE_LOANS, result.getReason());
            assertEquals(1, desk.searchBooks(assistant, "bc0").size());
            assertEquals(List.of("Roald Dahl"), desk.bookAuthors(assistant));
            assertEquals(List.of("4B"), desk.studentClasses(assistant));
        }
    }

    @Test
    @DisplayName("Admission numbers and barcodes are trimmed on every path")
    void testIdentifiersTrimmed() {
        assertTrue(desk.borrow(assistant, "A100", "BC001").isSuccess());
        assertEquals(1, desk.studentActiveLoans(assistant, " A100 ").size());
        assertEquals(1, desk.studentLoanHistory(assistant, "A100  ").size());
        assertTrue(desk.returnBook(assistant, " BC001").isSuccess());

        assertEquals("Book deleted", desk.deleteBook(admin, " BC001 ").getMessage());
        assertTrue(desk.searchBooks(assistant, "bc001").isEmpty());
        assertEquals("Student deleted", desk.deleteStudent(librarian, " A100 ").getMessage());
        assertTrue(desk.searchStudents(assistant, "A100").isEmpty());

        assertEquals(FailureReason.INVALID_INPUT, desk.deleteStudent(librarian, "  ").getReason());
        assertEquals(FailureReason.INVALID_INPUT, desk.deleteBook(admin, null).getReason());
        assertTrue(desk.studentActiveLoans(assistant, " ").isEmpty());
    }

    @Test
    @DisplayName("Search is gated like every other operation; a session without a role finds nothing")
    void testSearchRequiresRole() {
        LibrarySession roleless = new LibrarySession(school.getId(), school.getName(), 0L, "nobody", null);
        double before = meterRegistry.counter("library.access.denied", "operation", "search").count();

        assertEquals(1, desk.searchStudents(assistant, "jane").size());
        assertEquals(1, desk.searchBooks(assistant, "matilda").size());
        assertTrue(desk.searchStudents(roleless, "jane").isEmpty());
        assertTrue(desk.searchBooks(roleless, "matilda").isEmpty());
        assertEquals(before + 2, meterRegistry.counter("library.access.denied", "operation", "search").count());
    }

    @Test
    @DisplayName("Backup operations are role-gated before touching the store")
    void testBackupPermissions() {
        assertEquals(FailureReason.PERMISSION_DENIED,
            desk.exportDatabase(assistant, Path.of("backup.mv.db")).getReason());
        assertEquals(FailureReason.PERMISSION_DENIED,
            desk.restoreDatabase(librarian, Path.of("backup.mv.db")).getReason());
        assertFalse(desk.licenseStatus(assistant).isValid());
    }
}
