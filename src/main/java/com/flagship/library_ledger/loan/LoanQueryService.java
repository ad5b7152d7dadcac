package com.flagship.library_ledger.loan;

import com.flagship.library_ledger.catalog.BookCondition;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Read-only loan listings, each a join of loans with books and students of one school.
 */
@Service
public class LoanQueryService {

    private static final String LOAN_VIEW_SELECT =
        "SELECT loans.id, loans.book_id, loans.student_id, loans.borrowed_at, loans.due_date, " +
        "loans.returned_at, loans.fine_paid, books.barcode, books.title, books.condition, " +
        "students.admission_no, students.name AS student_name " +
        "FROM loans " +
        "JOIN books ON books.id = loans.book_id " +
        "JOIN students ON students.id = loans.student_id ";

    private final JdbcTemplate jdbcTemplate;

    public LoanQueryService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Open loans of the school in the order they were opened.
     */
    public List<LoanView> currentLoans(long schoolId) {
        return jdbcTemplate.query(
            LOAN_VIEW_SELECT + "WHERE loans.school_id = ? AND loans.returned_at IS NULL ORDER BY loans.id",
            loanViewRowMapper(),
            schoolId
        );
    }

    /**
     * Open loans of one student, soonest due first.
     */
    public List<LoanView> studentActiveLoans(long schoolId, long studentId) {
        return jdbcTemplate.query(
            LOAN_VIEW_SELECT + "WHERE loans.school_id = ? AND loans.student_id = ? AND loans.returned_at IS NULL " +
            "ORDER BY loans.due_date, loans.id",
            loanViewRowMapper(),
            schoolId,
            studentId
        );
    }

    /**
     * All loans of the school, most recently borrowed first.
     */
    public List<LoanView> loanHistory(long schoolId) {
        return jdbcTemplate.query(
            LOAN_VIEW_SELECT + "WHERE loans.school_id = ? ORDER BY loans.borrowed_at DESC, loans.id DESC",
            loanViewRowMapper(),
            schoolId
        );
    }

    public List<LoanView> studentLoanHistory(long schoolId, long studentId) {
        return jdbcTemplate.query(
            LOAN_VIEW_SELECT + "WHERE loans.school_id = ? AND loans.student_id = ? " +
            "ORDER BY loans.borrowed_at DESC, loans.id DESC",
            loanViewRowMapper(),
            schoolId,
            studentId
        );
    }

    private RowMapper<LoanView> loanViewRowMapper() {
        return (rs, rowNum) -> new LoanView(
            rs.getLong("id"),
            rs.getLong("book_id"),
            rs.getLong("student_id"),
            rs.getString("barcode"),
            rs.getString("title"),
            BookCondition.valueOf(rs.getString("condition")),
            rs.getString("admission_no"),
            rs.getString("student_name"),
            LoanService.toInstant(rs.getObject("borrowed_at", OffsetDateTime.class)),
            LoanService.toInstant(rs.getObject("due_date", OffsetDateTime.class)),
            LoanService.toInstant(rs.getObject("returned_at", OffsetDateTime.class)),
            rs.getBoolean("fine_paid")
        );
    }
}
