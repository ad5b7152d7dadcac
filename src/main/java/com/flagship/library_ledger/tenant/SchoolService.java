package com.flagship.library_ledger.tenant;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * Registration, lookup and settings of schools.
 *
 * Schools are created once and never deleted. Their fine rate and default
 * loan period are read by the loan ledger at borrow and return time, so a
 * settings change applies to loans returned afterwards.
 */
@Service
@Slf4j
public class SchoolService {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public SchoolService(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    /**
     * Registers a new school.
     *
     * @return true if registered, false if the name is already taken
     * @throws IllegalArgumentException if the name or password is blank, the fine
     *         rate is negative or the loan period is shorter than one day
     */
    public boolean registerSchool(String name, String password, int finePerDay, int defaultLoanDays) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("School name is required");
        }
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("School password is required");
        }
        validateSettings(finePerDay, defaultLoanDays);

        try {
            jdbcTemplate.update(
                "INSERT INTO schools (name, password, created_at, fine_per_day, default_loan_days) " +
                "VALUES (?, ?, ?, ?, ?)",
                name,
                password,
                OffsetDateTime.ofInstant(Instant.now(clock), ZoneOffset.UTC),
                finePerDay,
                defaultLoanDays
            );
            log.info("Registered school '{}' (finePerDay={}, loanDays={})", name, finePerDay, defaultLoanDays);
            return true;
        } catch (DuplicateKeyException e) {
            log.warn("School '{}' is already registered", name);
            return false;
        }
    }

    public Optional<School> findByName(String name) {
        List<School> rows = jdbcTemplate.query(
            "SELECT id, name, created_at, fine_per_day, default_loan_days FROM schools WHERE name = ?",
            schoolRowMapper(),
            name
        );
        return rows.stream().findFirst();
    }

    public Optional<School> findById(long schoolId) {
        List<School> rows = jdbcTemplate.query(
            "SELECT id, name, created_at, fine_per_day, default_loan_days FROM schools WHERE id = ?",
            schoolRowMapper(),
            schoolId
        );
        return rows.stream().findFirst();
    }

    /**
     * Checks a school's name and password.
     *
     * @return the school if both match, empty otherwise
     */
    public Optional<School> validateCredentials(String name, String password) {
        List<School> rows = jdbcTemplate.query(
            "SELECT id, name, created_at, fine_per_day, default_loan_days FROM schools " +
            "WHERE name = ? AND password = ?",
            schoolRowMapper(),
            name,
            password
        );
        return rows.stream().findFirst();
    }

    /**
     * Updates the fine rate and default loan period.
     *
     * @return true if the school exists and was updated
     */
    public boolean updateSettings(long schoolId, int finePerDay, int defaultLoanDays) {
        validateSettings(finePerDay, defaultLoanDays);
        int updated = jdbcTemplate.update(
            "UPDATE schools SET fine_per_day = ?, default_loan_days = ? WHERE id = ?",
            finePerDay,
            defaultLoanDays,
            schoolId
        );
        if (updated > 0) {
            log.info("Updated settings of school {}: finePerDay={}, loanDays={}",
                    schoolId, finePerDay, defaultLoanDays);
        }
        return updated > 0;
    }

    private void validateSettings(int finePerDay, int defaultLoanDays) {
        if (finePerDay < 0) {
            throw new IllegalArgumentException("Fine per day cannot be negative: " + finePerDay);
        }
        if (defaultLoanDays < 1) {
            throw new IllegalArgumentException("Default loan period must be at least one day: " + defaultLoanDays);
        }
    }

    private RowMapper<School> schoolRowMapper() {
        return (rs, rowNum) -> new School(
            rs.getLong("id"),
            rs.getString("name"),
            rs.getObject("created_at", OffsetDateTime.class).toInstant(),
            rs.getInt("fine_per_day"),
            rs.getInt("default_loan_days")
        );
    }
}
