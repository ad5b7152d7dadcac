package com.flagship.library_ledger.desk;

import com.flagship.library_ledger.access.AccessPolicy;
import com.flagship.library_ledger.access.LibraryOperation;
import com.flagship.library_ledger.backup.DatabaseBackupService;
import com.flagship.library_ledger.catalog.Book;
import com.flagship.library_ledger.catalog.BookCondition;
import com.flagship.library_ledger.catalog.BookService;
import com.flagship.library_ledger.catalog.Student;
import com.flagship.library_ledger.catalog.StudentService;
import com.flagship.library_ledger.common.FailureReason;
import com.flagship.library_ledger.common.OperationResult;
import com.flagship.library_ledger.license.LicenseStatus;
import com.flagship.library_ledger.license.LicenseVerifier;
import com.flagship.library_ledger.loan.LoanQueryService;
import com.flagship.library_ledger.loan.LoanService;
import com.flagship.library_ledger.loan.LoanView;
import com.flagship.library_ledger.loan.ReturnResult;
import com.flagship.library_ledger.observability.LibraryMetrics;
import com.flagship.library_ledger.observability.SessionLogContext;
import com.flagship.library_ledger.tenant.LibrarySession;
import com.flagship.library_ledger.tenant.SchoolService;
import com.flagship.library_ledger.tenant.UserAccount;
import com.flagship.library_ledger.tenant.UserRole;
import com.flagship.library_ledger.tenant.UserService;
import com.flagship.library_ledger.undo.UndoLogEntry;
import com.flagship.library_ledger.undo.UndoLogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Entry point for staff-facing screens.
 *
 * Every call carries the {@link LibrarySession} of the acting staff member.
 * The desk:
 * 1. Checks the role against {@link AccessPolicy}
 * 2. Resolves admission numbers and barcodes to records of the session's school
 * 3. Applies the non-circulating filter before borrowing
 * 4. Delegates to the ledger and catalog services
 *
 * Expected conditions come back as results, never as exceptions.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LibraryDesk {

    private final AccessPolicy accessPolicy;
    private final StudentService studentService;
    private final BookService bookService;
    private final LoanService loanService;
    private final LoanQueryService loanQueryService;
    private final UndoLogService undoLogService;
    private final SchoolService schoolService;
    private final UserService userService;
    private final DatabaseBackupService backupService;
    private final LicenseVerifier licenseVerifier;
    private final LibraryMetrics metrics;

    // ---- Students ----

    public OperationResult addStudent(LibrarySession session, String admissionNo, String name, String className) {
        return guarded(session, LibraryOperation.ADD_STUDENT, () -> {
            if (isBlank(admissionNo) || isBlank(name)) {
                return OperationResult.failure(FailureReason.INVALID_INPUT, "Admission number and name required");
            }
            if (!studentService.addStudent(session.getSchoolId(), admissionNo.trim(), name.trim(), trimToNull(className))) {
                return OperationResult.failure(FailureReason.DUPLICATE_KEY, "Admission number already exists");
            }
            return OperationResult.ok("Student added");
        });
    }

    public OperationResult deleteStudent(LibrarySession session, String admissionNo) {
        return guarded(session, LibraryOperation.DELETE_STUDENT, () -> {
            if (isBlank(admissionNo)) {
                return OperationResult.failure(FailureReason.INVALID_INPUT, "Admission number required");
            }
            return studentService.deleteStudent(session.getSchoolId(), admissionNo.trim());
        });
    }

    public List<Student> listStudents(LibrarySession session) {
        return studentService.listStudents(session.getSchoolId());
    }

    /**
     * @return matching students, or an empty list when the role may not search
     */
    public List<Student> searchStudents(LibrarySession session, String term) {
        if (authorize(session, LibraryOperation.SEARCH).isFailure()) {
            return List.of();
        }
        return studentService.searchStudents(session.getSchoolId(), term);
    }

    public List<String> studentClasses(LibrarySession session) {
        return studentService.getUniqueClasses(session.getSchoolId());
    }

    // ---- Books ----

    public OperationResult addBook(LibrarySession session, String title, String author, String barcode) {
        return addBook(session, title, author, barcode, false, BookCondition.GOOD);
    }

    public OperationResult addBook(LibrarySession session, String title, String author, String barcode,
                                   boolean nonCirculating, BookCondition condition) {
        return guarded(session, LibraryOperation.ADD_BOOK, () -> {
            if (isBlank(title) || isBlank(barcode)) {
                return OperationResult.failure(FailureReason.INVALID_INPUT, "Title and barcode required");
            }
            boolean added = bookService.addBook(session.getSchoolId(), title.trim(), trimToNull(author),
                barcode.trim(), nonCirculating, condition);
            if (!added) {
                return OperationResult.failure(FailureReason.DUPLICATE_KEY, "Barcode already exists");
            }
            return OperationResult.ok("Book added");
        });
    }

    public OperationResult deleteBook(LibrarySession session, String barcode) {
        return guarded(session, LibraryOperation.DELETE_BOOK, () -> {
            if (isBlank(barcode)) {
                return OperationResult.failure(FailureReason.INVALID_INPUT, "Barcode required");
            }
            return bookService.deleteBook(session.getSchoolId(), barcode.trim());
        });
    }

    public List<Book> listBooks(LibrarySession session) {
        return bookService.listBooks(session.getSchoolId());
    }

    public List<Book> searchBooks(LibrarySession session, String term) {
        if (authorize(session, LibraryOperation.SEARCH).isFailure()) {
            return List.of();
        }
        return bookService.searchBooks(session.getSchoolId(), term);
    }

    public List<String> bookAuthors(LibrarySession session) {
        return bookService.getUniqueAuthors(session.getSchoolId());
    }

    // ---- Loans ----

    public OperationResult borrow(LibrarySession session, String admissionNo, String barcode) {
        return borrow(session, admissionNo, barcode, null);
    }

    /**
     * Lends the book with {@code barcode} to the student with {@code admissionNo}.
     *
     * @param days loan period override; null uses the school's default
     */
    public OperationResult borrow(LibrarySession session, String admissionNo, String barcode, Integer days) {
        return guarded(session, LibraryOperation.BORROW, () -> {
            if (isBlank(admissionNo) || isBlank(barcode)) {
                return OperationResult.failure(FailureReason.INVALID_INPUT, "Enter admission and barcode");
            }
            if (days != null && days < 1) {
                return OperationResult.failure(FailureReason.INVALID_INPUT, "Loan period must be at least one day");
            }
            Optional<Student> student = studentService.findStudent(session.getSchoolId(), admissionNo.trim());
            if (student.isEmpty()) {
                return OperationResult.failure(FailureReason.NOT_FOUND, "Student not found");
            }
            Optional<Book> book = bookService.findBook(session.getSchoolId(), barcode.trim());
            if (book.isEmpty()) {
                return OperationResult.failure(FailureReason.NOT_FOUND, "Book not found");
            }
            if (book.get().isNonCirculating()) {
                return OperationResult.failure(FailureReason.NOT_CIRCULATING, "Book not for borrowing");
            }

            OperationResult result = loanService.borrow(session.getSchoolId(), book.get().getId(),
                student.get().getId(), days);
            if (result.isFailure()) {
                return result;
            }
            return OperationResult.ok("Borrowed by " + student.get().getName());
        });
    }

    public ReturnResult returnBook(LibrarySession session, String barcode) {
        OperationResult allowed = authorize(session, LibraryOperation.RETURN);
        if (allowed.isFailure()) {
            return ReturnResult.failure(allowed.getReason(), allowed.getMessage());
        }
        return SessionLogContext.within(session, () -> {
            if (isBlank(barcode)) {
                return ReturnResult.failure(FailureReason.INVALID_INPUT, "Enter barcode");
            }
            return bookService.findBook(session.getSchoolId(), barcode.trim())
                .map(book -> loanService.returnBook(session.getSchoolId(), book.getId()))
                .orElseGet(() -> ReturnResult.failure(FailureReason.NOT_FOUND, "Book not found"));
        });
    }

    public List<LoanView> currentLoans(LibrarySession session) {
        return loanQueryService.currentLoans(session.getSchoolId());
    }

    public List<LoanView> loanHistory(LibrarySession session) {
        return loanQueryService.loanHistory(session.getSchoolId());
    }

    /**
     * @return the student's open loans, soonest due first; empty if the admission number is unknown
     */
    public List<LoanView> studentActiveLoans(LibrarySession session, String admissionNo) {
        if (isBlank(admissionNo)) {
            return List.of();
        }
        return studentService.findStudent(session.getSchoolId(), admissionNo.trim())
            .map(student -> loanQueryService.studentActiveLoans(session.getSchoolId(), student.getId()))
            .orElse(List.of());
    }

    public List<LoanView> studentLoanHistory(LibrarySession session, String admissionNo) {
        if (isBlank(admissionNo)) {
            return List.of();
        }
        return studentService.findStudent(session.getSchoolId(), admissionNo.trim())
            .map(student -> loanQueryService.studentLoanHistory(session.getSchoolId(), student.getId()))
            .orElse(List.of());
    }

    // ---- Undo ----

    public List<UndoLogEntry> recentDeletions(LibrarySession session) {
        return undoLogService.listRecent(session.getSchoolId());
    }

    public OperationResult undoDeletion(LibrarySession session, long entryId) {
        return guarded(session, LibraryOperation.UNDO_DELETION,
            () -> undoLogService.undo(session.getSchoolId(), entryId));
    }

    // ---- Settings and users ----

    public OperationResult updateSettings(LibrarySession session, int finePerDay, int loanDays) {
        return guarded(session, LibraryOperation.UPDATE_SETTINGS, () -> {
            if (finePerDay < 0 || loanDays < 1) {
                return OperationResult.failure(FailureReason.INVALID_INPUT,
                    "Fine per day must be >= 0 and loan days >= 1");
            }
            if (!schoolService.updateSettings(session.getSchoolId(), finePerDay, loanDays)) {
                return OperationResult.failure(FailureReason.NOT_FOUND, "School not found");
            }
            return OperationResult.ok("Settings saved");
        });
    }

    public OperationResult addUser(LibrarySession session, String username, String password, UserRole role) {
        return guarded(session, LibraryOperation.MANAGE_USERS, () -> {
            if (isBlank(username) || isBlank(password) || role == null) {
                return OperationResult.failure(FailureReason.INVALID_INPUT, "Username, password and role required");
            }
            if (!userService.addUser(session.getSchoolId(), username.trim(), password, role)) {
                return OperationResult.failure(FailureReason.DUPLICATE_KEY, "Username exists");
            }
            return OperationResult.ok(String.format("User %s created with role %s", username.trim(), role.getLabel()));
        });
    }

    public OperationResult deleteUser(LibrarySession session, String username) {
        return guarded(session, LibraryOperation.MANAGE_USERS, () -> {
            if (session.getUsername().equals(username)) {
                return OperationResult.failure(FailureReason.INVALID_INPUT, "Cannot delete the signed-in user");
            }
            if (!userService.deleteUser(session.getSchoolId(), username)) {
                return OperationResult.failure(FailureReason.NOT_FOUND, "User not found");
            }
            return OperationResult.ok("User deleted");
        });
    }

    /**
     * @return the school's staff accounts, or an empty list when the role may not manage users
     */
    public List<UserAccount> listUsers(LibrarySession session) {
        if (!accessPolicy.isAllowed(LibraryOperation.MANAGE_USERS, session.getRole())) {
            return List.of();
        }
        return userService.listUsers(session.getSchoolId());
    }

    // ---- Backup and license ----

    public OperationResult exportDatabase(LibrarySession session, Path target) {
        return guarded(session, LibraryOperation.EXPORT_DATABASE, () -> backupService.exportTo(target));
    }

    public OperationResult restoreDatabase(LibrarySession session, Path source) {
        return guarded(session, LibraryOperation.RESTORE_DATABASE, () -> backupService.restoreFrom(source));
    }

    public LicenseStatus licenseStatus(LibrarySession session) {
        return licenseVerifier.validateInstalled(session.getSchoolName());
    }

    public OperationResult activateLicense(LibrarySession session, Path licenseFile) {
        return guarded(session, LibraryOperation.UPDATE_SETTINGS,
            () -> licenseVerifier.install(licenseFile, session.getSchoolName()));
    }

    private OperationResult guarded(LibrarySession session, LibraryOperation operation,
                                    Supplier<OperationResult> action) {
        OperationResult allowed = authorize(session, operation);
        if (allowed.isFailure()) {
            return allowed;
        }
        return SessionLogContext.within(session, action);
    }

    private OperationResult authorize(LibrarySession session, LibraryOperation operation) {
        OperationResult allowed = accessPolicy.check(operation, session.getRole());
        if (allowed.isFailure()) {
            metrics.recordAccessDenied(operation.name());
            log.warn("User '{}' denied {} in school {}", session.getUsername(), operation, session.getSchoolId());
        }
        return allowed;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String trimToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }
}
