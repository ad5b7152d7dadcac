package com.flagship.library_ledger.undo;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UndoLogRepository extends JpaRepository<UndoLogEntryEntity, Long> {

    /**
     * Most recent deletions first; entries stamped at the same instant are
     * ordered by insertion, newest first.
     */
    List<UndoLogEntryEntity> findBySchoolIdOrderByDeletedAtDescIdDesc(long schoolId, Pageable pageable);

    Optional<UndoLogEntryEntity> findByIdAndSchoolId(long id, long schoolId);
}
