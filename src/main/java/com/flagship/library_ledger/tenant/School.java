package com.flagship.library_ledger.tenant;

import lombok.Value;

import java.time.Instant;

/**
 * A registered school: the tenant every other record is scoped by.
 *
 * The password is never carried on the domain object; credential checks
 * happen in the store.
 */
@Value
public class School {
    long id;
    String name;
    Instant createdAt;
    int finePerDay;
    int defaultLoanDays;
}
