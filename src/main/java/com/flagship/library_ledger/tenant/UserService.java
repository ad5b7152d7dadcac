package com.flagship.library_ledger.tenant;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.Optional;

/**
 * Staff accounts of a school.
 *
 * Every registered school gets an initial {@code admin}/{@code admin} account;
 * further accounts are created by an Admin through the desk.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    static final String DEFAULT_ADMIN_USERNAME = "admin";
    static final String DEFAULT_ADMIN_PASSWORD = "admin";

    private final UserAccountRepository repository;

    /**
     * Creates a staff account.
     *
     * Must not run inside a caller's transaction: a unique-key violation at
     * flush marks the surrounding transaction rollback-only.
     *
     * @return true if created, false if the username is already taken in this school
     */
    public boolean addUser(long schoolId, String username, String password, UserRole role) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username is required");
        }
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("Password is required");
        }
        if (role == null) {
            throw new IllegalArgumentException("Role is required");
        }
        if (repository.existsBySchoolIdAndUsername(schoolId, username)) {
            log.warn("User '{}' already exists in school {}", username, schoolId);
            return false;
        }

        try {
            repository.saveAndFlush(UserAccountEntity.create(schoolId, username, password, role));
            log.info("Created user '{}' with role {} in school {}", username, role, schoolId);
            return true;
        } catch (DataIntegrityViolationException e) {
            log.warn("Could not create user '{}' in school {}: {}", username, schoolId, e.getMessage());
            return false;
        }
    }

    /**
     * Creates the initial Admin account if the school has no users yet.
     *
     * @return true if the account was created
     */
    @Transactional
    public boolean createDefaultAdmin(long schoolId) {
        if (repository.existsBySchoolId(schoolId)) {
            return false;
        }
        repository.save(UserAccountEntity.create(
            schoolId, DEFAULT_ADMIN_USERNAME, DEFAULT_ADMIN_PASSWORD, UserRole.ADMIN));
        log.info("Created default admin for school {}", schoolId);
        return true;
    }

    @Transactional(readOnly = true)
    public Optional<UserAccount> authenticate(long schoolId, String username, String password) {
        if (username == null || password == null) {
            return Optional.empty();
        }
        return repository.findBySchoolIdAndUsername(schoolId, username)
            .filter(entity -> MessageDigest.isEqual(
                entity.getPassword().getBytes(StandardCharsets.UTF_8),
                password.getBytes(StandardCharsets.UTF_8)))
            .map(UserAccountEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<UserAccount> listUsers(long schoolId) {
        return repository.findBySchoolIdOrderByUsernameAsc(schoolId)
            .stream()
            .map(UserAccountEntity::toDomain)
            .toList();
    }

    /**
     * @return true if an account was removed
     */
    @Transactional
    public boolean deleteUser(long schoolId, String username) {
        long removed = repository.deleteBySchoolIdAndUsername(schoolId, username);
        if (removed > 0) {
            log.info("Deleted user '{}' from school {}", username, schoolId);
        }
        return removed > 0;
    }
}
