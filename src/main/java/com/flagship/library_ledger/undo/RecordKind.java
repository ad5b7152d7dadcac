package com.flagship.library_ledger.undo;

/**
 * Kinds of records whose deletion can be undone, tagged by the table they live in.
 */
public enum RecordKind {
    STUDENT("students"),
    BOOK("books");

    private final String tableName;

    RecordKind(String tableName) {
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }

    public static RecordKind fromTableName(String tableName) {
        for (RecordKind kind : values()) {
            if (kind.tableName.equals(tableName)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown undo record table: " + tableName);
    }
}
