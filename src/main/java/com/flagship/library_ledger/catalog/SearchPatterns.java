package com.flagship.library_ledger.catalog;

/**
 * LIKE patterns for case-insensitive substring search. Used with {@code ESCAPE '\'}.
 */
final class SearchPatterns {

    private SearchPatterns() {
    }

    static String containing(String term) {
        String safe = term == null ? "" : term.trim().toLowerCase()
            .replace("\\", "\\\\")
            .replace("%", "\\%")
            .replace("_", "\\_");
        return "%" + safe + "%";
    }
}
