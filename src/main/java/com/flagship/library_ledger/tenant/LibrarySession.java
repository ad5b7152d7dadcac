package com.flagship.library_ledger.tenant;

import lombok.Value;

/**
 * The logged-in tenant and staff member.
 *
 * Passed explicitly into every desk operation; there is no ambient session.
 */
@Value
public class LibrarySession {
    long schoolId;
    String schoolName;
    long userId;
    String username;
    UserRole role;

    public static LibrarySession of(School school, UserAccount user) {
        if (school.getId() != user.getSchoolId()) {
            throw new IllegalArgumentException(
                String.format("User %s does not belong to school %s", user.getUsername(), school.getName()));
        }
        return new LibrarySession(school.getId(), school.getName(), user.getId(), user.getUsername(), user.getRole());
    }
}
