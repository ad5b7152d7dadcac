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
 * Student records of a school.
 *
 * Every query is scoped by {@code school_id}. Deleting a student snapshots the
 * row into the undo log first, in the same transaction.
 */
@Service
@Slf4j
public class StudentService {

    private static final String STUDENT_COLUMNS = "id, school_id, admission_no, name, class";

    private final JdbcTemplate jdbcTemplate;
    private final UndoLogRecorder undoLogRecorder;
    private final LibraryMetrics metrics;

    public StudentService(JdbcTemplate jdbcTemplate, UndoLogRecorder undoLogRecorder, LibraryMetrics metrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.undoLogRecorder = undoLogRecorder;
        this.metrics = metrics;
    }

    /**
     * Adds a student.
     *
     * @return true if added, false if the admission number is already used in this school
     * @throws IllegalArgumentException if the admission number or name is blank
     */
    public boolean addStudent(long schoolId, String admissionNo, String name, String className) {
        if (admissionNo == null || admissionNo.isBlank()) {
            throw new IllegalArgumentException("Admission number is required");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Student name is required");
        }

        try {
            jdbcTemplate.update(
                "INSERT INTO students (school_id, admission_no, name, class) VALUES (?, ?, ?, ?)",
                schoolId,
                admissionNo,
                name,
                className
            );
            log.debug("Added student {} to school {}", admissionNo, schoolId);
            return true;
        } catch (DuplicateKeyException e) {
            log.warn("Admission number {} already exists in school {}", admissionNo, schoolId);
            return false;
        }
    }

    /**
     * Deletes a student, keeping a snapshot for undo.
     *
     * A student with an open loan is never deleted. Deleting an admission
     * number that does not exist succeeds without doing anything.
     */
    @Transactional
    public OperationResult deleteStudent(long schoolId, String admissionNo) {
        Optional<Student> student = findStudent(schoolId, admissionNo);
        if (student.isEmpty()) {
            log.debug("No student {} in school {}; nothing to delete", admissionNo, schoolId);
            return OperationResult.ok("No matching student; nothing deleted");
        }
        if (hasActiveLoans(schoolId, admissionNo)) {
            return OperationResult.failure(FailureReason.ACTIVE_LOANS, "Student has active loans");
        }

        undoLogRecorder.record(schoolId, RecordKind.STUDENT, student.get());
        jdbcTemplate.update("DELETE FROM students WHERE school_id = ? AND admission_no = ?", schoolId, admissionNo);

        metrics.recordDeleted(RecordKind.STUDENT.name());
        log.info("Deleted student {} ({}) from school {}", admissionNo, student.get().getName(), schoolId);
        return OperationResult.ok("Student deleted");
    }

    public boolean hasActiveLoans(long schoolId, String admissionNo) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM loans " +
            "JOIN students ON students.id = loans.student_id " +
            "WHERE loans.school_id = ? AND students.admission_no = ? AND loans.returned_at IS NULL",
            Integer.class,
            schoolId,
            admissionNo
        );
        return count != null && count > 0;
    }

    public Optional<Student> findStudent(long schoolId, String admissionNo) {
        return jdbcTemplate.query(
            "SELECT " + STUDENT_COLUMNS + " FROM students WHERE school_id = ? AND admission_no = ?",
            studentRowMapper(),
            schoolId,
            admissionNo
        ).stream().findFirst();
    }

    public Optional<Student> findStudentById(long schoolId, long studentId) {
        return jdbcTemplate.query(
            "SELECT " + STUDENT_COLUMNS + " FROM students WHERE school_id = ? AND id = ?",
            studentRowMapper(),
            schoolId,
            studentId
        ).stream().findFirst();
    }

    public List<Student> listStudents(long schoolId) {
        return jdbcTemplate.query(
            "SELECT " + STUDENT_COLUMNS + " FROM students WHERE school_id = ? ORDER BY name, admission_no",
            studentRowMapper(),
            schoolId
        );
    }

    /**
     * Case-insensitive substring search over admission number or name.
     */
    public List<Student> searchStudents(long schoolId, String term) {
        String pattern = SearchPatterns.containing(term);
        return jdbcTemplate.query(
            "SELECT " + STUDENT_COLUMNS + " FROM students WHERE school_id = ? " +
            "AND (LOWER(admission_no) LIKE ? ESCAPE '\\' OR LOWER(name) LIKE ? ESCAPE '\\') " +
            "ORDER BY name, admission_no",
            studentRowMapper(),
            schoolId,
            pattern,
            pattern
        );
    }

    /**
     * Distinct non-empty class names, sorted; used for pick-lists.
     */
    public List<String> getUniqueClasses(long schoolId) {
        return jdbcTemplate.queryForList(
            "SELECT DISTINCT class FROM students WHERE school_id = ? AND class IS NOT NULL AND class <> '' " +
            "ORDER BY class",
            String.class,
            schoolId
        );
    }

    private RowMapper<Student> studentRowMapper() {
        return (rs, rowNum) -> Student.builder()
            .id(rs.getLong("id"))
            .schoolId(rs.getLong("school_id"))
            .admissionNo(rs.getString("admission_no"))
            .name(rs.getString("name"))
            .className(rs.getString("class"))
            .build();
    }
}
