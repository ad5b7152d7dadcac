package com.flagship.library_ledger.observability;

import com.flagship.library_ledger.backup.DatabaseBackupService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Health of the local store: reachable through the pool and backed by a file.
 */
@Component("storageHealth")
public class StorageHealthIndicator implements HealthIndicator {

    private final JdbcTemplate jdbcTemplate;
    private final DatabaseBackupService backupService;

    public StorageHealthIndicator(JdbcTemplate jdbcTemplate, DatabaseBackupService backupService) {
        this.jdbcTemplate = jdbcTemplate;
        this.backupService = backupService;
    }

    @Override
    public Health health() {
        Path storeFile = backupService.getStoreFile();
        try {
            Integer schools = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM schools", Integer.class);
            long sizeBytes = Files.exists(storeFile) ? Files.size(storeFile) : 0L;

            return Health.up()
                    .withDetail("storeFile", storeFile.toString())
                    .withDetail("sizeBytes", sizeBytes)
                    .withDetail("schools", schools != null ? schools : 0)
                    .build();

        } catch (Exception e) {
            return Health.down()
                    .withDetail("storeFile", storeFile.toString())
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
