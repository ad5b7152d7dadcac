package com.flagship.library_ledger.undo;

import com.flagship.library_ledger.common.FailureReason;
import com.flagship.library_ledger.common.OperationResult;
import com.flagship.library_ledger.observability.LibraryMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lists and replays deletion snapshots.
 *
 * This only reverses the two operations that write snapshots (student and
 * book deletion). Inserts, edits and loan transitions cannot be undone.
 *
 * Undo semantics:
 * 1. A missing entry (or one of another school) fails with NOT_FOUND
 * 2. The snapshot is re-inserted by the restorer registered for its kind
 * 3. If the restorer fails, the entry stays in the log for a later retry
 * 4. On success the entry is removed in the same transaction
 */
@Service
@Slf4j
public class UndoLogService {

    private final UndoLogRepository repository;
    private final Map<RecordKind, RecordRestorer> restorers;
    private final LibraryMetrics metrics;
    private final int defaultRecentLimit;

    public UndoLogService(UndoLogRepository repository,
                          List<RecordRestorer> restorers,
                          LibraryMetrics metrics,
                          @Value("${library.undo.recent-limit:10}") int defaultRecentLimit) {
        this.repository = repository;
        this.metrics = metrics;
        this.defaultRecentLimit = defaultRecentLimit;

        Map<RecordKind, RecordRestorer> byKind = new EnumMap<>(RecordKind.class);
        for (RecordRestorer restorer : restorers) {
            RecordRestorer previous = byKind.put(restorer.kind(), restorer);
            if (previous != null) {
                throw new IllegalStateException(String.format("Two restorers registered for %s: %s and %s",
                    restorer.kind(), previous.getClass().getSimpleName(), restorer.getClass().getSimpleName()));
            }
        }
        this.restorers = Collections.unmodifiableMap(byKind);
    }

    @Transactional(readOnly = true)
    public List<UndoLogEntry> listRecent(long schoolId) {
        return listRecent(schoolId, defaultRecentLimit);
    }

    /**
     * @return at most {@code limit} entries of the school, most recent first
     */
    @Transactional(readOnly = true)
    public List<UndoLogEntry> listRecent(long schoolId, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be positive: " + limit);
        }
        return repository.findBySchoolIdOrderByDeletedAtDescIdDesc(schoolId, PageRequest.of(0, limit))
            .stream()
            .map(UndoLogEntryEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public Optional<UndoLogEntry> findEntry(long schoolId, long entryId) {
        return repository.findByIdAndSchoolId(entryId, schoolId).map(UndoLogEntryEntity::toDomain);
    }

    @Transactional
    public OperationResult undo(long schoolId, long entryId) {
        Optional<UndoLogEntryEntity> found = repository.findByIdAndSchoolId(entryId, schoolId);
        if (found.isEmpty()) {
            log.warn("Undo entry {} not found in school {}", entryId, schoolId);
            return OperationResult.failure(FailureReason.NOT_FOUND, "Undo record not found");
        }

        UndoLogEntry entry = found.get().toDomain();
        RecordRestorer restorer = restorers.get(entry.getKind());
        if (restorer == null) {
            throw new IllegalStateException("No restorer registered for " + entry.getKind());
        }

        OperationResult restored = restorer.restore(schoolId, entry.getRecordData());
        if (restored.isFailure()) {
            metrics.recordUndo(entry.getKind().name(), "failed");
            log.warn("Undo of entry {} ({}) failed: {}", entryId, entry.getKind(), restored.getMessage());
            return OperationResult.failure(restored.getReason(), "Failed to restore: " + restored.getMessage());
        }

        repository.delete(found.get());
        metrics.recordUndo(entry.getKind().name(), "restored");
        log.info("Restored {} from undo entry {}", entry.getKind(), entryId);
        return OperationResult.ok("Record restored");
    }
}
