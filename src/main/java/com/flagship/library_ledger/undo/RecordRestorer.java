package com.flagship.library_ledger.undo;

import com.flagship.library_ledger.common.OperationResult;

/**
 * Re-inserts a snapshotted record of one {@link RecordKind}.
 *
 * Implementations are Spring beans; {@link UndoLogService} indexes them by
 * kind. Restoring goes through the normal add path, so the same uniqueness
 * rules apply as for a fresh insert.
 */
public interface RecordRestorer {

    RecordKind kind();

    /**
     * @param schoolId tenant the record belongs to
     * @param recordData JSON snapshot written at deletion time
     * @return success, or a {@code DUPLICATE_KEY} failure if the key was reused since
     */
    OperationResult restore(long schoolId, String recordData);
}
