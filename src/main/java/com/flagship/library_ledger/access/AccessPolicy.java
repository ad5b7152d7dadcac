package com.flagship.library_ledger.access;

import com.flagship.library_ledger.common.FailureReason;
import com.flagship.library_ledger.common.OperationResult;
import com.flagship.library_ledger.tenant.UserRole;
import org.springframework.stereotype.Component;

/**
 * Single decision point for role-based permissions.
 *
 * The ledger and store services are role-agnostic; the desk asks this policy
 * before every mutation. Rules:
 * 1. Every operation names a minimum role ({@link LibraryOperation#getMinimumRole()})
 * 2. Roles are ranked Assistant &lt; Librarian &lt; Admin
 * 3. A missing role is always denied
 */
@Component
public class AccessPolicy {

    public boolean isAllowed(LibraryOperation operation, UserRole role) {
        if (operation == null) {
            throw new IllegalArgumentException("Operation is required");
        }
        return role != null && role.isAtLeast(operation.getMinimumRole());
    }

    /**
     * @return a successful result if allowed, otherwise a {@code PERMISSION_DENIED} failure
     */
    public OperationResult check(LibraryOperation operation, UserRole role) {
        if (isAllowed(operation, role)) {
            return OperationResult.ok("Allowed");
        }
        return OperationResult.failure(FailureReason.PERMISSION_DENIED,
            String.format("Permission denied: %s requires %s", describe(operation),
                operation.getMinimumRole().getLabel()));
    }

    private String describe(LibraryOperation operation) {
        return operation.name().toLowerCase().replace('_', ' ');
    }
}
