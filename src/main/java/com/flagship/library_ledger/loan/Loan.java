package com.flagship.library_ledger.loan;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * A loan of one book to one student.
 *
 * State machine per book: Available -&gt; Borrowed (open loan) -&gt; Available
 * (loan closed by stamping {@code returnedAt}). A closed loan never reopens.
 *
 * {@code finePaid} is persisted but not consumed: fines are reported on
 * return, not tracked for settlement.
 */
@Value
public class Loan {
    Long id;
    long schoolId;
    long bookId;
    long studentId;
    Instant borrowedAt;
    Instant dueDate;
    Instant returnedAt;
    boolean finePaid;

    /**
     * Opens a loan due {@code days} after {@code borrowedAt}. The id is assigned by the store.
     */
    public static Loan open(long schoolId, long bookId, long studentId, Instant borrowedAt, int days) {
        if (days < 1) {
            throw new IllegalArgumentException("Loan period must be at least one day: " + days);
        }
        return new Loan(null, schoolId, bookId, studentId, borrowedAt,
            borrowedAt.plus(Duration.ofDays(days)), null, false);
    }

    public boolean isActive() {
        return returnedAt == null;
    }

    /**
     * Closes this loan.
     *
     * @return new Loan instance stamped with {@code at}
     * @throws IllegalStateException if the loan was already returned
     */
    public Loan close(Instant at) {
        if (!isActive()) {
            throw new IllegalStateException(
                String.format("Loan %s was already returned at %s", id, returnedAt));
        }
        return new Loan(id, schoolId, bookId, studentId, borrowedAt, dueDate, at, finePaid);
    }
}
