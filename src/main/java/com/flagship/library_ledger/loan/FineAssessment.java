package com.flagship.library_ledger.loan;

import lombok.Value;

/**
 * Whole days late and the resulting fine. Both are zero for an on-time return.
 */
@Value
public class FineAssessment {
    long daysLate;
    long fine;

    public static FineAssessment none() {
        return new FineAssessment(0, 0);
    }

    public boolean isLate() {
        return daysLate > 0;
    }
}
