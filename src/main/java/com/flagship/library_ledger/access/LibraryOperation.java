package com.flagship.library_ledger.access;

import com.flagship.library_ledger.tenant.UserRole;

/**
 * Operations exposed through the desk, each with the least privileged role
 * allowed to perform it.
 */
public enum LibraryOperation {
    SEARCH(UserRole.ASSISTANT),
    ADD_STUDENT(UserRole.ASSISTANT),
    BORROW(UserRole.ASSISTANT),
    RETURN(UserRole.ASSISTANT),
    ADD_BOOK(UserRole.LIBRARIAN),
    DELETE_STUDENT(UserRole.LIBRARIAN),
    UNDO_DELETION(UserRole.LIBRARIAN),
    EXPORT_DATABASE(UserRole.LIBRARIAN),
    DELETE_BOOK(UserRole.ADMIN),
    UPDATE_SETTINGS(UserRole.ADMIN),
    MANAGE_USERS(UserRole.ADMIN),
    RESTORE_DATABASE(UserRole.ADMIN);

    private final UserRole minimumRole;

    LibraryOperation(UserRole minimumRole) {
        this.minimumRole = minimumRole;
    }

    public UserRole getMinimumRole() {
        return minimumRole;
    }
}
