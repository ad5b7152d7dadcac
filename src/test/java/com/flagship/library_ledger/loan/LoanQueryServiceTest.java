package com.flagship.library_ledger.loan;

import com.flagship.library_ledger.catalog.BookService;
import com.flagship.library_ledger.catalog.StudentService;
import com.flagship.library_ledger.support.LibraryStoreTestSupport;
import com.flagship.library_ledger.tenant.School;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Read-side listings and their orderings.
 */
class LoanQueryServiceTest extends LibraryStoreTestSupport {

    @Autowired
    private LoanQueryService loanQueryService;

    @Autowired
    private LoanService loanService;

    @Autowired
    private StudentService studentService;

    @Autowired
    private BookService bookService;

    private School school;
    private long jane;
    private long tom;

    @BeforeEach
    void setUp() {
        school = registerSchool("Queries");
        studentService.addStudent(school.getId(), "A100", "Jane", "4B");
        studentService.addStudent(school.getId(), "A101", "Tom", "4B");
        jane = studentService.findStudent(school.getId(), "A100").orElseThrow().getId();
        tom = studentService.findStudent(school.getId(), "A101").orElseThrow().getId();
        for (String barcode : List.of("BC001", "BC002", "BC003")) {
            bookService.addBook(school.getId(), "Title " + barcode, "Author", barcode);
        }
    }

    private long book(String barcode) {
        return bookService.findBook(school.getId(), barcode).orElseThrow().getId();
    }

    @Test
    @DisplayName("Current loans come back in the order they were opened")
    void testCurrentLoansInsertionOrder() {
        loanService.borrow(school.getId(), book("BC003"), jane);
        clock.advanceDays(1);
        loanService.borrow(school.getId(), book("BC001"), tom);
        clock.advanceDays(1);
        loanService.borrow(school.getId(), book("BC002"), jane);
        loanService.returnBook(school.getId(), book("BC001"));

        List<LoanView> current = loanQueryService.currentLoans(school.getId());

        assertEquals(List.of("BC003", "BC002"), current.stream().map(LoanView::getBarcode).toList());
        assertTrue(current.stream().allMatch(LoanView::isActive));
        assertEquals("Jane", current.get(0).getStudentName());
        assertEquals("A100", current.get(0).getAdmissionNo());
    }

    @Test
    @DisplayName("A student's open loans are listed soonest due first")
    void testStudentActiveLoansByDueDate() {
        loanService.borrow(school.getId(), book("BC001"), jane, 14);
        loanService.borrow(school.getId(), book("BC002"), jane, 3);
        loanService.borrow(school.getId(), book("BC003"), tom, 1);

        List<LoanView> loans = loanQueryService.studentActiveLoans(school.getId(), jane);

        assertEquals(List.of("BC002", "BC001"), loans.stream().map(LoanView::getBarcode).toList());
        clock.advanceDays(5);
        assertTrue(loans.get(0).isOverdue(clock.instant()));
        assertFalse(loans.get(1).isOverdue(clock.instant()));
    }

    @Test
    @DisplayName("A loan becomes overdue on the calendar day after its due date, like the fine")
    void testOverdueFollowsCalendarDays() {
        loanService.borrow(school.getId(), book("BC001"), jane, 3);
        LoanView loan = loanQueryService.currentLoans(school.getId()).get(0);

        assertFalse(loan.isOverdue(Instant.parse("2024-03-07T10:00:00Z")));
        assertFalse(loan.isOverdue(Instant.parse("2024-03-07T23:59:00Z")));
        assertTrue(loan.isOverdue(Instant.parse("2024-03-08T00:30:00Z")));

        clock.set(Instant.parse("2024-03-07T23:59:00Z"));
        assertEquals(0, loanService.returnBook(school.getId(), book("BC001")).getFine());
    }

    @Test
    @DisplayName("History includes returned loans, most recent borrow first")
    void testHistoryMostRecentFirst() {
        loanService.borrow(school.getId(), book("BC001"), jane);
        clock.advance(Duration.ofHours(2));
        loanService.returnBook(school.getId(), book("BC001"));
        clock.advanceDays(1);
        loanService.borrow(school.getId(), book("BC002"), tom);
        clock.advanceDays(1);
        loanService.borrow(school.getId(), book("BC001"), jane);

        List<LoanView> history = loanQueryService.loanHistory(school.getId());
        List<LoanView> janeHistory = loanQueryService.studentLoanHistory(school.getId(), jane);

        assertEquals(3, history.size());
        assertEquals(List.of("BC001", "BC002", "BC001"), history.stream().map(LoanView::getBarcode).toList());
        assertTrue(history.get(0).isActive());
        assertFalse(history.get(2).isActive());
        assertEquals(2, janeHistory.size());
        assertTrue(janeHistory.stream().allMatch(view -> view.getStudentId() == jane));
    }

    @Test
    @DisplayName("Listings never show another school's loans")
    void testScopedToSchool() {
        loanService.borrow(school.getId(), book("BC001"), jane);
        School other = registerSchool("Queries-Other");

        assertTrue(loanQueryService.currentLoans(other.getId()).isEmpty());
        assertTrue(loanQueryService.loanHistory(other.getId()).isEmpty());
    }
}
