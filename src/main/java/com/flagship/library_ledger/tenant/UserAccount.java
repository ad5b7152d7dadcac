package com.flagship.library_ledger.tenant;

import lombok.Value;

/**
 * A staff member of one school. Usernames are unique within the school.
 */
@Value
public class UserAccount {
    long id;
    long schoolId;
    String username;
    UserRole role;
}
