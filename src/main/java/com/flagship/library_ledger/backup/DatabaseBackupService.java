package com.flagship.library_ledger.backup;

import com.flagship.library_ledger.common.FailureReason;
import com.flagship.library_ledger.common.OperationResult;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Whole-file backup and restore of the store.
 *
 * Both directions copy the H2 file at rest. While copying, the connection
 * pool is suspended and the database is shut down, so no connection holds the
 * file; the pool reopens the (possibly replaced) file on the next request.
 *
 * Restore stages the backup next to the live file first and then moves it
 * into place atomically, so a failed copy leaves the live store untouched.
 *
 * I/O failures are reported as IO_ERROR results and never abort the session.
 */
@Service
@Slf4j
public class DatabaseBackupService {

    static final String STORE_FILE_SUFFIX = ".mv.db";
    private static final String STAGING_SUFFIX = ".restore";

    private final DataSource dataSource;
    private final Path storeFile;

    public DatabaseBackupService(DataSource dataSource,
                                 @Value("${library.data-dir}") String dataDir,
                                 @Value("${library.database-name:ellvins}") String databaseName) {
        this.dataSource = dataSource;
        this.storeFile = Paths.get(dataDir).toAbsolutePath().resolve(databaseName + STORE_FILE_SUFFIX);
    }

    public Path getStoreFile() {
        return storeFile;
    }

    /**
     * Copies the store file to {@code target}, replacing it if present.
     */
    public synchronized OperationResult exportTo(Path target) {
        if (target == null) {
            throw new IllegalArgumentException("Export target is required");
        }
        Path destination = target.toAbsolutePath();
        if (destination.equals(storeFile)) {
            return OperationResult.failure(FailureReason.INVALID_INPUT, "Cannot export the database onto itself");
        }

        try {
            Path parent = destination.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            withStoreClosed(() -> Files.copy(storeFile, destination, StandardCopyOption.REPLACE_EXISTING));
            log.info("Database exported to {}", destination);
            return OperationResult.ok("Database exported");
        } catch (IOException e) {
            log.error("Database export to {} failed: {}", destination, e.getMessage());
            return OperationResult.failure(FailureReason.IO_ERROR, "Export failed: " + e.getMessage());
        }
    }

    /**
     * Replaces the store file with the backup at {@code source}.
     */
    public synchronized OperationResult restoreFrom(Path source) {
        if (source == null) {
            throw new IllegalArgumentException("Backup source is required");
        }
        Path backup = source.toAbsolutePath();
        if (!Files.isRegularFile(backup)) {
            return OperationResult.failure(FailureReason.INVALID_INPUT, "Backup file not found: " + backup);
        }
        if (backup.equals(storeFile)) {
            return OperationResult.failure(FailureReason.INVALID_INPUT, "Cannot restore the database from itself");
        }

        Path staging = storeFile.resolveSibling(storeFile.getFileName() + STAGING_SUFFIX);
        try {
            Files.copy(backup, staging, StandardCopyOption.REPLACE_EXISTING);
            withStoreClosed(() -> moveIntoPlace(staging));
            log.info("Database restored from {}", backup);
            return OperationResult.ok("Database restored");
        } catch (IOException e) {
            log.error("Database restore from {} failed: {}", backup, e.getMessage());
            discardStaging(staging);
            return OperationResult.failure(FailureReason.IO_ERROR, "Import failed: " + e.getMessage());
        }
    }

    private void moveIntoPlace(Path staging) throws IOException {
        try {
            Files.move(staging, storeFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}; replacing in place", storeFile);
            Files.move(staging, storeFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void discardStaging(Path staging) {
        try {
            Files.deleteIfExists(staging);
        } catch (IOException e) {
            log.warn("Could not remove staging file {}: {}", staging, e.getMessage());
        }
    }

    /**
     * Runs {@code fileOperation} while no connection has the store open.
     */
    private void withStoreClosed(FileOperation fileOperation) throws IOException {
        Connection connection;
        try {
            connection = dataSource.getConnection();
        } catch (SQLException e) {
            throw new IOException("Could not open the store: " + e.getMessage(), e);
        }

        HikariPoolMXBean pool = dataSource instanceof HikariDataSource
            ? ((HikariDataSource) dataSource).getHikariPoolMXBean()
            : null;
        if (pool != null) {
            pool.suspendPool();
        }
        try {
            shutdown(connection);
            if (pool != null) {
                pool.softEvictConnections();
            }
            fileOperation.run();
        } finally {
            release(connection);
            if (pool != null) {
                pool.resumePool();
            }
        }
    }

    private void shutdown(Connection connection) throws IOException {
        try {
            // the statement is closed together with its connection
            Statement statement = connection.createStatement();
            statement.execute("SHUTDOWN");
            log.debug("Store {} shut down", storeFile);
        } catch (SQLException e) {
            throw new IOException("Could not close the store: " + e.getMessage(), e);
        }
    }

    private void release(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.debug("Connection closed after store shutdown: {}", e.getMessage());
        }
    }

    @FunctionalInterface
    private interface FileOperation {
        void run() throws IOException;
    }
}
