package com.flagship.library_ledger.support;

import com.flagship.library_ledger.LibraryLedgerApplication;
import com.flagship.library_ledger.tenant.School;
import com.flagship.library_ledger.tenant.SchoolService;
import com.flagship.library_ledger.tenant.SessionService;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.UUID;

/**
 * Base for tests that run against a real store.
 *
 * All subclasses share one Spring context backed by an H2 file in a fresh
 * temporary directory. Schools get unique names so classes never see each
 * other's data. The clock is reset to {@link #START} before every test.
 */
@SpringBootTest(classes = {LibraryLedgerApplication.class, TestClockConfig.class})
public abstract class LibraryStoreTestSupport {

    public static final Instant START = Instant.parse("2024-03-04T09:00:00Z");

    private static final Path DATA_DIR = createDataDir("library-store-test");

    @DynamicPropertySource
    static void storeProperties(DynamicPropertyRegistry registry) {
        registry.add("library.data-dir", DATA_DIR::toString);
    }

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected SessionService sessionService;

    @Autowired
    protected SchoolService schoolService;

    @BeforeEach
    void resetClock() {
        clock.set(START);
    }

    protected School registerSchool(String prefix) {
        return registerSchool(prefix, 10, 14);
    }

    protected School registerSchool(String prefix, int finePerDay, int loanDays) {
        String name = prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
        if (!sessionService.registerSchool(name, "secret", finePerDay, loanDays).isSuccess()) {
            throw new IllegalStateException("Could not register test school " + name);
        }
        return schoolService.findByName(name).orElseThrow();
    }

    public static Path createDataDir(String prefix) {
        try {
            return Files.createTempDirectory(prefix);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    // Helper methods for test output
    protected void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    protected void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    protected void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    protected void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }
}
