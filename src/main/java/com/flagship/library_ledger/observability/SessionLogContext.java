package com.flagship.library_ledger.observability;

import com.flagship.library_ledger.tenant.LibrarySession;
import org.slf4j.MDC;

import java.util.function.Supplier;

/**
 * Puts the acting school and staff member on the logging MDC for the
 * duration of one desk operation.
 *
 * The keys show up in every log line via the console pattern.
 */
public final class SessionLogContext {

    public static final String SCHOOL_ID_MDC_KEY = "schoolId";
    public static final String USER_MDC_KEY = "user";

    private SessionLogContext() {
        // Utility class
    }

    public static <T> T within(LibrarySession session, Supplier<T> action) {
        String previousSchool = MDC.get(SCHOOL_ID_MDC_KEY);
        String previousUser = MDC.get(USER_MDC_KEY);
        MDC.put(SCHOOL_ID_MDC_KEY, String.valueOf(session.getSchoolId()));
        MDC.put(USER_MDC_KEY, session.getUsername());
        try {
            return action.get();
        } finally {
            restore(SCHOOL_ID_MDC_KEY, previousSchool);
            restore(USER_MDC_KEY, previousUser);
        }
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }
}
