package com.flagship.library_ledger.catalog;

import com.flagship.library_ledger.common.FailureReason;
import com.flagship.library_ledger.common.OperationResult;
import com.flagship.library_ledger.observability.LibraryMetrics;
import com.flagship.library_ledger.undo.RecordKind;
import com.flagship.library_ledger.undo.UndoLogRecorder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Book copies of a school, keyed by barcode within the school.
 */
@Service
@Slf4j
public class BookService {

    private static final String BOOK_COLUMNS = "id, school_id, title, author, barcode, non_circulating, condition";

    private final JdbcTemplate jdbcTemplate;
    private final UndoLogRecorder undoLogRecorder;
    private final LibraryMetrics metrics;

    public BookService(JdbcTemplate jdbcTemplate, UndoLogRecorder undoLogRecorder, LibraryMetrics metrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.undoLogRecorder = undoLogRecorder;
        this.metrics = metrics;
    }

    public boolean addBook(long schoolId, String title, String author, String barcode) {
        return addBook(schoolId, title, author, barcode, false, BookCondition.GOOD);
    }

    /**
     * Adds a copy to the catalog.
     *
     * @return true if added, false if the barcode is already used in this school
     * @throws IllegalArgumentException if the title or barcode is blank
     */
    public boolean addBook(long schoolId, String title, String author, String barcode,
                           boolean nonCirculating, BookCondition condition) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Title is required");
        }
        if (barcode == null || barcode.isBlank()) {
            throw new IllegalArgumentException("Barcode is required");
        }
        BookCondition effectiveCondition = condition != null ? condition : BookCondition.GOOD;

        try {
            jdbcTemplate.update(
                "INSERT INTO books (school_id, title, author, barcode, non_circulating, condition) " +
                "VALUES (?, ?, ?, ?, ?, ?)",
                schoolId,
                title,
                author,
                barcode,
                nonCirculating,
                effectiveCondition.name()
            );
            log.debug("Added book {} '{}' to school {}", barcode, title, schoolId);
            return true;
        } catch (DuplicateKeyException e) {
            log.warn("Barcode {} already exists in school {}", barcode, schoolId);
            return false;
        }
    }

    /**
     * Deletes a copy, keeping a snapshot for undo. A copy on loan is never
     * deleted; an unknown barcode is a no-op.
     */
    @Transactional
    public OperationResult deleteBook(long schoolId, String barcode) {
        Optional<Book> book = findBook(schoolId, barcode);
        if (book.isEmpty()) {
            log.debug("No book {} in school {}; nothing to delete", barcode, schoolId);
            return OperationResult.ok("No matching book; nothing deleted");
        }
        if (hasActiveLoans(schoolId, barcode)) {
            return OperationResult.failure(FailureReason.ACTIVE_LOANS, "Book is on loan");
        }

        undoLogRecorder.record(schoolId, RecordKind.BOOK, book.get());
        jdbcTemplate.update("DELETE FROM books WHERE school_id = ? AND barcode = ?", schoolId, barcode);

        metrics.recordDeleted(RecordKind.BOOK.name());
        log.info("Deleted book {} '{}' from school {}", barcode, book.get().getTitle(), schoolId);
        return OperationResult.ok("Book deleted");
    }

    public boolean hasActiveLoans(long schoolId, String barcode) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM loans " +
            "JOIN books ON books.id = loans.book_id " +
            "WHERE loans.school_id = ? AND books.barcode = ? AND loans.returned_at IS NULL",
            Integer.class,
            schoolId,
            barcode
        );
        return count != null && count > 0;
    }

    public Optional<Book> findBook(long schoolId, String barcode) {
        return jdbcTemplate.query(
            "SELECT " + BOOK_COLUMNS + " FROM books WHERE school_id = ? AND barcode = ?",
            bookRowMapper(),
            schoolId,
            barcode
        ).stream().findFirst();
    }

    public Optional<Book> findBookById(long schoolId, long bookId) {
        return jdbcTemplate.query(
            "SELECT " + BOOK_COLUMNS + " FROM books WHERE school_id = ? AND id = ?",
            bookRowMapper(),
            schoolId,
            bookId
        ).stream().findFirst();
    }

    public List<Book> listBooks(long schoolId) {
        return jdbcTemplate.query(
            "SELECT " + BOOK_COLUMNS + " FROM books WHERE school_id = ? ORDER BY title, barcode",
            bookRowMapper(),
            schoolId
        );
    }

    /**
     * Case-insensitive substring search over title or barcode.
     */
    public List<Book> searchBooks(long schoolId, String term) {
        String pattern = SearchPatterns.containing(term);
        return jdbcTemplate.query(
            "SELECT " + BOOK_COLUMNS + " FROM books WHERE school_id = ? " +
            "AND (LOWER(title) LIKE ? ESCAPE '\\' OR LOWER(barcode) LIKE ? ESCAPE '\\') " +
            "ORDER BY title, barcode",
            bookRowMapper(),
            schoolId,
            pattern,
            pattern
        );
    }

    public List<String> getUniqueAuthors(long schoolId) {
        return jdbcTemplate.queryForList(
            "SELECT DISTINCT author FROM books WHERE school_id = ? AND author IS NOT NULL AND author <> '' " +
            "ORDER BY author",
            String.class,
            schoolId
        );
    }

    private RowMapper<Book> bookRowMapper() {
        return (rs, rowNum) -> Book.builder()
            .id(rs.getLong("id"))
            .schoolId(rs.getLong("school_id"))
            .title(rs.getString("title"))
            .author(rs.getString("author"))
            .barcode(rs.getString("barcode"))
            .nonCirculating(rs.getBoolean("non_circulating"))
            .condition(BookCondition.valueOf(rs.getString("condition")))
            .build();
    }
}
