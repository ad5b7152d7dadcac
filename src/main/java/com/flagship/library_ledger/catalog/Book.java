package com.flagship.library_ledger.catalog;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A copy in a school's catalog, identified within the school by its barcode.
 *
 * Non-circulating copies are reference-only; the desk refuses to lend them.
 */
@Value
@Builder
@Jacksonized
public class Book {
    long id;
    long schoolId;
    String title;
    String author;
    String barcode;
    boolean nonCirculating;
    BookCondition condition;
}
