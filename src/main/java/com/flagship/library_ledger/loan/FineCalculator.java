package com.flagship.library_ledger.loan;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * Computes late-return fines.
 *
 * Lateness is the difference between the UTC calendar dates of return and
 * due date; time of day is dropped before subtracting, so a partial day
 * never counts. {@code daysLate = max(0, returnDate - dueDate)} and
 * {@code fine = daysLate * finePerDay}.
 */
@Component
public class FineCalculator {

    public FineAssessment assess(Instant dueDate, Instant returnedAt, int finePerDay) {
        if (dueDate == null || returnedAt == null) {
            throw new IllegalArgumentException("Due date and return time are required");
        }
        if (finePerDay < 0) {
            throw new IllegalArgumentException("Fine per day cannot be negative: " + finePerDay);
        }

        long daysLate = daysLate(dueDate, returnedAt);
        if (daysLate <= 0) {
            return FineAssessment.none();
        }
        return new FineAssessment(daysLate, Math.multiplyExact(daysLate, (long) finePerDay));
    }

    long daysLate(Instant dueDate, Instant returnedAt) {
        LocalDate due = LocalDate.ofInstant(dueDate, ZoneOffset.UTC);
        LocalDate returned = LocalDate.ofInstant(returnedAt, ZoneOffset.UTC);
        return ChronoUnit.DAYS.between(due, returned);
    }
}
