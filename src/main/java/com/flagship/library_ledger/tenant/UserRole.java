package com.flagship.library_ledger.tenant;

/**
 * Staff roles, ranked from least to most privileged.
 */
public enum UserRole {
    ASSISTANT("Assistant", 1),
    LIBRARIAN("Librarian", 2),
    ADMIN("Admin", 3);

    private final String label;
    private final int rank;

    UserRole(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    public String getLabel() {
        return label;
    }

    /**
     * True if this role grants at least the privileges of {@code required}.
     */
    public boolean isAtLeast(UserRole required) {
        return this.rank >= required.rank;
    }
}
