package com.flagship.library_ledger.loan;

import com.flagship.library_ledger.common.FailureReason;
import com.flagship.library_ledger.common.OperationResult;
import com.flagship.library_ledger.observability.LibraryMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.PreparedStatement;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * Borrow / return transitions and fine reporting.
 *
 * This service enforces the loan invariants:
 * 1. At most one open loan per book (existence check, backed by a unique
 *    constraint on the open loan's book)
 * 2. A loan is due {@code days} after borrowing, where {@code days} defaults
 *    to the school's configured loan period
 * 3. Fines are computed from calendar dates on return and reported, never stored
 *
 * The ledger does not check whether a book is non-circulating or whether
 * the caller's role permits the operation; the desk does both.
 */
@Service
@Slf4j
public class LoanService {

    private final JdbcTemplate jdbcTemplate;
    private final FineCalculator fineCalculator;
    private final LibraryMetrics metrics;
    private final Clock clock;
    private final int fallbackFinePerDay;
    private final int fallbackLoanDays;

    public LoanService(JdbcTemplate jdbcTemplate,
                       FineCalculator fineCalculator,
                       LibraryMetrics metrics,
                       Clock clock,
                       @Value("${library.defaults.fine-per-day:10}") int fallbackFinePerDay,
                       @Value("${library.defaults.loan-days:14}") int fallbackLoanDays) {
        this.jdbcTemplate = jdbcTemplate;
        this.fineCalculator = fineCalculator;
        this.metrics = metrics;
        this.clock = clock;
        this.fallbackFinePerDay = fallbackFinePerDay;
        this.fallbackLoanDays = fallbackLoanDays;
    }

    public OperationResult borrow(long schoolId, long bookId, long studentId) {
        return borrow(schoolId, bookId, studentId, null);
    }

    /**
     * Opens a loan.
     *
     * @param days loan period override, or null for the school's default
     * @return success, or ALREADY_BORROWED / NOT_FOUND
     * @throws IllegalArgumentException if {@code days} is given and shorter than one day
     */
    @Transactional
    public OperationResult borrow(long schoolId, long bookId, long studentId, Integer days) {
        if (days != null && days < 1) {
            throw new IllegalArgumentException("Loan period must be at least one day: " + days);
        }
        if (!existsInSchool("books", schoolId, bookId)) {
            return OperationResult.failure(FailureReason.NOT_FOUND, "Book not found");
        }
        if (!existsInSchool("students", schoolId, studentId)) {
            return OperationResult.failure(FailureReason.NOT_FOUND, "Student not found");
        }
        if (findActiveLoan(schoolId, bookId).isPresent()) {
            log.warn("Book {} in school {} is already borrowed", bookId, schoolId);
            return OperationResult.failure(FailureReason.ALREADY_BORROWED, "Book already borrowed");
        }

        int loanDays = days != null ? days : defaultLoanDays(schoolId);
        Loan loan = Loan.open(schoolId, bookId, studentId, Instant.now(clock), loanDays);

        long loanId;
        try {
            loanId = insertLoan(loan);
        } catch (DuplicateKeyException e) {
            // a concurrent borrow won between the check and the insert
            log.warn("Book {} in school {} was borrowed concurrently", bookId, schoolId);
            return OperationResult.failure(FailureReason.ALREADY_BORROWED, "Book already borrowed");
        }

        metrics.recordBorrowed();
        log.info("Loan {} opened: book={}, student={}, due={}", loanId, bookId, studentId, loan.getDueDate());
        return OperationResult.ok("Borrow recorded");
    }

    /**
     * Closes the open loan of a book and reports any fine.
     *
     * @return the fine assessment, or a NO_ACTIVE_LOAN failure
     */
    @Transactional
    public ReturnResult returnBook(long schoolId, long bookId) {
        Optional<Loan> active = findActiveLoan(schoolId, bookId);
        if (active.isEmpty()) {
            log.warn("Return of book {} in school {} rejected: no active loan", bookId, schoolId);
            return ReturnResult.failure(FailureReason.NO_ACTIVE_LOAN, "No active loan");
        }

        Loan returned = active.get().close(Instant.now(clock));
        int updated = jdbcTemplate.update(
            "UPDATE loans SET returned_at = ? WHERE id = ? AND returned_at IS NULL",
            toTimestamp(returned.getReturnedAt()),
            returned.getId()
        );
        if (updated == 0) {
            return ReturnResult.failure(FailureReason.NO_ACTIVE_LOAN, "No active loan");
        }

        FineAssessment assessment = fineCalculator.assess(
            returned.getDueDate(), returned.getReturnedAt(), finePerDay(schoolId));

        metrics.recordReturned(assessment.getDaysLate(), assessment.getFine());
        if (assessment.isLate()) {
            log.info("Loan {} closed {} day(s) late: fine={}", returned.getId(),
                    assessment.getDaysLate(), assessment.getFine());
        } else {
            log.info("Loan {} closed on time", returned.getId());
        }
        return ReturnResult.returned(returned.getId(), assessment);
    }

    public Optional<Loan> findActiveLoan(long schoolId, long bookId) {
        List<Loan> loans = jdbcTemplate.query(
            "SELECT id, school_id, book_id, student_id, borrowed_at, due_date, returned_at, fine_paid " +
            "FROM loans WHERE school_id = ? AND book_id = ? AND returned_at IS NULL",
            loanRowMapper(),
            schoolId,
            bookId
        );
        if (loans.size() > 1) {
            throw new IllegalStateException(
                String.format("Book %d in school %d has %d open loans", bookId, schoolId, loans.size()));
        }
        return loans.stream().findFirst();
    }

    public boolean isBorrowed(long schoolId, long bookId) {
        return findActiveLoan(schoolId, bookId).isPresent();
    }

    private long insertLoan(Loan loan) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO loans (school_id, book_id, student_id, borrowed_at, due_date, returned_at, fine_paid) " +
                "VALUES (?, ?, ?, ?, ?, NULL, FALSE)",
                new String[] {"ID"});
            ps.setLong(1, loan.getSchoolId());
            ps.setLong(2, loan.getBookId());
            ps.setLong(3, loan.getStudentId());
            ps.setObject(4, toTimestamp(loan.getBorrowedAt()));
            ps.setObject(5, toTimestamp(loan.getDueDate()));
            return ps;
        }, keyHolder);

        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Store did not return an id for the new loan");
        }
        return key.longValue();
    }

    private boolean existsInSchool(String table, long schoolId, long id) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM " + table + " WHERE school_id = ? AND id = ?",
            Integer.class,
            schoolId,
            id
        );
        return count != null && count > 0;
    }

    private int defaultLoanDays(long schoolId) {
        List<Integer> days = jdbcTemplate.queryForList(
            "SELECT default_loan_days FROM schools WHERE id = ?", Integer.class, schoolId);
        return days.isEmpty() ? fallbackLoanDays : days.get(0);
    }

    private int finePerDay(long schoolId) {
        List<Integer> rates = jdbcTemplate.queryForList(
            "SELECT fine_per_day FROM schools WHERE id = ?", Integer.class, schoolId);
        return rates.isEmpty() ? fallbackFinePerDay : rates.get(0);
    }

    static OffsetDateTime toTimestamp(Instant instant) {
        return instant == null ? null : OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    static Instant toInstant(OffsetDateTime timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private RowMapper<Loan> loanRowMapper() {
        return (rs, rowNum) -> new Loan(
            rs.getLong("id"),
            rs.getLong("school_id"),
            rs.getLong("book_id"),
            rs.getLong("student_id"),
            toInstant(rs.getObject("borrowed_at", OffsetDateTime.class)),
            toInstant(rs.getObject("due_date", OffsetDateTime.class)),
            toInstant(rs.getObject("returned_at", OffsetDateTime.class)),
            rs.getBoolean("fine_paid")
        );
    }
}
