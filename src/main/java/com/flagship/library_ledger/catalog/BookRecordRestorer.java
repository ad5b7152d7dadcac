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
 * Replays a deleted book as a fresh insert, keeping its circulation flag and condition.
 */
@Component
@RequiredArgsConstructor
public class BookRecordRestorer implements RecordRestorer {

    private final ObjectMapper objectMapper;
    private final BookService bookService;

    @Override
    public RecordKind kind() {
        return RecordKind.BOOK;
    }

    @Override
    public OperationResult restore(long schoolId, String recordData) {
        Book snapshot = readSnapshot(recordData);
        boolean added = bookService.addBook(schoolId, snapshot.getTitle(), snapshot.getAuthor(),
            snapshot.getBarcode(), snapshot.isNonCirculating(), snapshot.getCondition());
        if (!added) {
            return OperationResult.failure(FailureReason.DUPLICATE_KEY,
                "Barcode " + snapshot.getBarcode() + " is already in use");
        }
        return OperationResult.ok("Book " + snapshot.getBarcode() + " restored");
    }

    private Book readSnapshot(String recordData) {
        try {
            return objectMapper.readValue(recordData, Book.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt book snapshot in undo log", e);
        }
    }
}
