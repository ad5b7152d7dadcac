package com.flagship.library_ledger.undo;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for the {@code undo_log} table.
 *
 * Entries are append-only: they are written once by {@link #create} and later
 * either deleted by a successful undo or kept indefinitely.
 */
@Entity
@Table(
    name = "undo_log",
    indexes = @Index(name = "idx_undo_log_school_deleted", columnList = "school_id, deleted_at")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class UndoLogEntryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "school_id", nullable = false, updatable = false)
    private long schoolId;

    @Column(name = "table_name", nullable = false, updatable = false)
    private String tableName;

    @Lob
    @Column(name = "record_data", nullable = false, updatable = false)
    private String recordData;

    @Column(name = "deleted_at", nullable = false, updatable = false)
    private Instant deletedAt;

    public static UndoLogEntryEntity create(long schoolId, RecordKind kind, String recordData, Instant deletedAt) {
        return new UndoLogEntryEntity(null, schoolId, kind.getTableName(), recordData, deletedAt);
    }

    public UndoLogEntry toDomain() {
        return new UndoLogEntry(id, schoolId, RecordKind.fromTableName(tableName), recordData, deletedAt);
    }
}
