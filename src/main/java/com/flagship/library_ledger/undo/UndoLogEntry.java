package com.flagship.library_ledger.undo;

import lombok.Value;

import java.time.Instant;

/**
 * Snapshot of a deleted student or book, kept until it is replayed.
 *
 * {@code recordData} is the JSON serialization of the full row at deletion time.
 */
@Value
public class UndoLogEntry {
    long id;
    long schoolId;
    RecordKind kind;
    String recordData;
    Instant deletedAt;
}
