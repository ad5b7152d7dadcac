package com.flagship.library_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - library.loans.borrowed: Counter of opened loans
 * - library.loans.returned: Counter of closed loans, tagged on_time / late
 * - library.fines.assessed: Summary of reported fine amounts
 * - library.records.deleted: Counter of deleted students/books, tagged by kind
 * - library.undo.restored: Counter of undo attempts, tagged by kind and result
 * - library.access.denied: Counter of permission denials, tagged by operation
 */
@Component
public class LibraryMetrics {

    private final MeterRegistry registry;

    private final Counter loansBorrowed;
    private final DistributionSummary finesAssessed;

    public LibraryMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.loansBorrowed = Counter.builder("library.loans.borrowed")
                .description("Number of loans opened")
                .register(registry);

        this.finesAssessed = DistributionSummary.builder("library.fines.assessed")
                .description("Fine amounts reported on late returns")
                .register(registry);
    }

    public void recordBorrowed() {
        loansBorrowed.increment();
    }

    /**
     * Records a closed loan. A positive fine also feeds the fines summary.
     */
    public void recordReturned(long daysLate, long fine) {
        registry.counter("library.loans.returned",
                "outcome", daysLate > 0 ? "late" : "on_time"
        ).increment();
        if (fine > 0) {
            finesAssessed.record(fine);
        }
    }

    public void recordDeleted(String kind) {
        registry.counter("library.records.deleted", "kind", sanitizeTag(kind)).increment();
    }

    public void recordUndo(String kind, String result) {
        registry.counter("library.undo.restored",
                "kind", sanitizeTag(kind),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordAccessDenied(String operation) {
        registry.counter("library.access.denied", "operation", sanitizeTag(operation)).increment();
    }

    private String sanitizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        return value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
    }
}
