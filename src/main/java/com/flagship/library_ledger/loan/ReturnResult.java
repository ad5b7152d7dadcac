package com.flagship.library_ledger.loan;

import com.flagship.library_ledger.common.FailureReason;
import lombok.Value;

/**
 * Outcome of returning a book: the fine is reported here and nowhere else.
 */
@Value
public class ReturnResult {
    boolean success;
    FailureReason reason;
    Long loanId;
    long daysLate;
    long fine;
    String message;

    public static ReturnResult returned(long loanId, FineAssessment assessment) {
        String message = assessment.isLate()
            ? String.format("Returned. Fine due: %d (days late: %d)", assessment.getFine(), assessment.getDaysLate())
            : "Returned. No fine.";
        return new ReturnResult(true, null, loanId, assessment.getDaysLate(), assessment.getFine(), message);
    }

    public static ReturnResult failure(FailureReason reason, String message) {
        return new ReturnResult(false, reason, null, 0, 0, message);
    }

    public boolean hasFine() {
        return fine > 0;
    }
}
