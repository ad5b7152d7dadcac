package com.flagship.library_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the school library ledger.
 *
 * The application has no network surface: presentation code embeds the
 * context and talks to {@link com.flagship.library_ledger.desk.LibraryDesk}.
 */
@SpringBootApplication
public class LibraryLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LibraryLedgerApplication.class, args);
    }
}
