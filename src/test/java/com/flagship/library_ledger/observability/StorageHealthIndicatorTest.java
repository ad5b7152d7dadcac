package com.flagship.library_ledger.observability;

import com.flagship.library_ledger.support.LibraryStoreTestSupport;
import com.flagship.library_ledger.tenant.LibrarySession;
import com.flagship.library_ledger.tenant.School;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.junit.jupiter.api.Assertions.*;

class StorageHealthIndicatorTest extends LibraryStoreTestSupport {

    @Autowired
    private StorageHealthIndicator storageHealth;

    @Test
    @DisplayName("Store is reported UP with its file and school count")
    void testHealthUp() {
        registerSchool("Health");

        Health health = storageHealth.health();

        assertEquals(Status.UP, health.getStatus());
        assertTrue(health.getDetails().get("storeFile").toString().endsWith(".mv.db"));
        assertTrue((Integer) health.getDetails().get("schools") >= 1);
        assertTrue((Long) health.getDetails().get("sizeBytes") > 0);
    }

    @Test
    @DisplayName("Session keys are on the MDC only while the action runs")
    void testSessionLogContext() {
        School school = registerSchool("Mdc");
        LibrarySession session = sessionService.loginUser(school, "admin", "admin").orElseThrow();

        String seen = SessionLogContext.within(session,
            () -> MDC.get(SessionLogContext.SCHOOL_ID_MDC_KEY) + "/" + MDC.get(SessionLogContext.USER_MDC_KEY));

        assertEquals(school.getId() + "/admin", seen);
        assertNull(MDC.get(SessionLogContext.SCHOOL_ID_MDC_KEY));
        assertNull(MDC.get(SessionLogContext.USER_MDC_KEY));
    }
}
