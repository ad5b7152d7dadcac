package com.flagship.library_ledger.license;

import lombok.Value;

/**
 * Result of checking a license file. Advisory only.
 */
@Value
public class LicenseStatus {
    boolean valid;
    String message;

    public static LicenseStatus valid() {
        return new LicenseStatus(true, "License valid");
    }

    public static LicenseStatus invalid(String message) {
        return new LicenseStatus(false, message);
    }

    public static LicenseStatus notActivated() {
        return new LicenseStatus(false, "License not activated");
    }
}
