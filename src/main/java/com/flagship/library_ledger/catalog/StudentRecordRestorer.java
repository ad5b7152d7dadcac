package com.flagship.library_ledger.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.library_ledger.common.FailureReason;
import com.flagship.library_ledger.common.OperationResult;
import com.flagship.library_ledger.undo.RecordKind;
import com.flagship.library_ledger.undo.RecordRestorer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Replays a deleted student as a fresh insert. The restored row gets a new id.
 */
@Component
@RequiredArgsConstructor
public class StudentRecordRestorer implements RecordRestorer {

    private final ObjectMapper objectMapper;
    private final StudentService studentService;

    @Override
    public RecordKind kind() {
        return RecordKind.STUDENT;
    }

    @Override
    public OperationResult restore(long schoolId, String recordData) {
        Student snapshot = readSnapshot(recordData);
        boolean added = studentService.addStudent(
            schoolId, snapshot.getAdmissionNo(), snapshot.getName(), snapshot.getClassName());
        if (!added) {
            return OperationResult.failure(FailureReason.DUPLICATE_KEY,
                "Admission number " + snapshot.getAdmissionNo() + " is already in use");
        }
        return OperationResult.ok("Student " + snapshot.getAdmissionNo() + " restored");
    }

    private Student readSnapshot(String recordData) {
        try {
            return objectMapper.readValue(recordData, Student.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt student snapshot in undo log", e);
        }
    }
}
