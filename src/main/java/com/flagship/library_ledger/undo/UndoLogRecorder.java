package com.flagship.library_ledger.undo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Writes deletion snapshots to the undo log.
 *
 * Must be called within the deleting transaction (MANDATORY propagation):
 * if the delete rolls back, so does its snapshot, and a row is never
 * deleted without one.
 */
@Service
@Slf4j
public class UndoLogRecorder {

    private final UndoLogRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public UndoLogRecorder(UndoLogRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public UndoLogEntry record(long schoolId, RecordKind kind, Object snapshot) {
        String recordData = serializeSnapshot(snapshot);

        UndoLogEntryEntity saved = repository.save(
            UndoLogEntryEntity.create(schoolId, kind, recordData, Instant.now(clock)));

        log.debug("Recorded undo snapshot: kind={}, schoolId={}, entryId={}", kind, schoolId, saved.getId());
        return saved.toDomain();
    }

    private String serializeSnapshot(Object snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize undo snapshot", e);
        }
    }
}
