package com.flagship.library_ledger.common;

/**
 * Why an expected business operation did not go through.
 *
 * None of these are faults: they are returned to the caller inside an
 * {@link OperationResult} so presentation code can decide how to show them.
 */
public enum FailureReason {
    /** A school with the same name is already registered. */
    ALREADY_EXISTS,
    /** A per-school unique key (username, admission number, barcode) is taken. */
    DUPLICATE_KEY,
    /** The book already has an open loan. */
    ALREADY_BORROWED,
    /** The book has no open loan to close. */
    NO_ACTIVE_LOAN,
    NOT_FOUND,
    /** The student or book still has an open loan and cannot be deleted. */
    ACTIVE_LOANS,
    /** The book is reference-only. */
    NOT_CIRCULATING,
    PERMISSION_DENIED,
    INVALID_INPUT,
    IO_ERROR
}
