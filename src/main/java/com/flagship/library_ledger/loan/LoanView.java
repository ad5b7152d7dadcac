package com.flagship.library_ledger.loan;

import com.flagship.library_ledger.catalog.BookCondition;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * A loan joined with the book and student it references, for listings.
 */
@Value
public class LoanView {
    long loanId;
    long bookId;
    long studentId;
    String barcode;
    String title;
    BookCondition condition;
    String admissionNo;
    String studentName;
    Instant borrowedAt;
    Instant dueDate;
    Instant returnedAt;
    boolean finePaid;

    public boolean isActive() {
        return returnedAt == null;
    }

    /**
     * Overdue from the first UTC calendar day after the due date, matching the fine rule.
     */
    public boolean isOverdue(Instant now) {
        return isActive()
            && LocalDate.ofInstant(dueDate, ZoneOffset.UTC).isBefore(LocalDate.ofInstant(now, ZoneOffset.UTC));
    }
}
