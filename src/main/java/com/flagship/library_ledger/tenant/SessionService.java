package com.flagship.library_ledger.tenant;

import com.flagship.library_ledger.common.FailureReason;
import com.flagship.library_ledger.common.OperationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * School registration and the two-step login (school, then staff member).
 */
@Service
@Slf4j
public class SessionService {

    private final SchoolService schoolService;
    private final UserService userService;
    private final int defaultFinePerDay;
    private final int defaultLoanDays;

    public SessionService(SchoolService schoolService,
                          UserService userService,
                          @Value("${library.defaults.fine-per-day:10}") int defaultFinePerDay,
                          @Value("${library.defaults.loan-days:14}") int defaultLoanDays) {
        this.schoolService = schoolService;
        this.userService = userService;
        this.defaultFinePerDay = defaultFinePerDay;
        this.defaultLoanDays = defaultLoanDays;
    }

    public OperationResult registerSchool(String name, String password) {
        return registerSchool(name, password, defaultFinePerDay, defaultLoanDays);
    }

    /**
     * Registers a school together with its initial {@code admin}/{@code admin} account.
     */
    @Transactional
    public OperationResult registerSchool(String name, String password, int finePerDay, int loanDays) {
        if (!schoolService.registerSchool(name, password, finePerDay, loanDays)) {
            return OperationResult.failure(FailureReason.ALREADY_EXISTS, "School already exists");
        }
        School school = schoolService.findByName(name)
            .orElseThrow(() -> new IllegalStateException("Registered school not found: " + name));
        userService.createDefaultAdmin(school.getId());
        return OperationResult.ok("School registered. Default admin user 'admin' created");
    }

    public Optional<School> loginSchool(String name, String password) {
        Optional<School> school = schoolService.validateCredentials(name, password);
        if (school.isEmpty()) {
            log.warn("Failed school login for '{}'", name);
        }
        return school;
    }

    public Optional<LibrarySession> loginUser(School school, String username, String password) {
        Optional<LibrarySession> session = userService.authenticate(school.getId(), username, password)
            .map(user -> LibrarySession.of(school, user));
        if (session.isPresent()) {
            log.info("User '{}' logged in to school '{}'", username, school.getName());
        } else {
            log.warn("Failed login for user '{}' in school '{}'", username, school.getName());
        }
        return session;
    }

    public Optional<LibrarySession> openSession(String schoolName, String schoolPassword,
                                                String username, String password) {
        return loginSchool(schoolName, schoolPassword)
            .flatMap(school -> loginUser(school, username, password));
    }
}
