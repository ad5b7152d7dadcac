package com.flagship.library_ledger.catalog;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A student of one school. The admission number is unique within the school.
 *
 * Serialized as-is into the undo log when deleted.
 */
@Value
@Builder
@Jacksonized
public class Student {
    long id;
    long schoolId;
    String admissionNo;
    String name;
    String className;
}
