package com.flagship.library_ledger.license;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.library_ledger.common.FailureReason;
import com.flagship.library_ledger.common.OperationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Offline license check.
 *
 * A license is a JSON document {@code {"school": ..., "mac": ...}} where
 * {@code mac} is the hex HMAC-SHA256 of the school name under a shared secret.
 * Validity is displayed to staff but never gates ledger operations.
 */
@Component
@Slf4j
public class LicenseVerifier {

    private static final String ALGORITHM = "HmacSHA256";

    private final ObjectMapper objectMapper;
    private final byte[] secret;
    private final Path installedLicense;

    public LicenseVerifier(ObjectMapper objectMapper,
                           @Value("${library.license.secret}") String secret,
                           @Value("${library.data-dir}") String dataDir,
                           @Value("${library.license.file-name:license.json}") String fileName) {
        this.objectMapper = objectMapper;
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.installedLicense = Path.of(dataDir, fileName).toAbsolutePath();
    }

    public Path getInstalledLicense() {
        return installedLicense;
    }

    public LicenseStatus validate(Path licenseFile, String schoolName) {
        try {
            JsonNode license = objectMapper.readTree(licenseFile.toFile());
            if (license == null || !license.isObject()) {
                return LicenseStatus.invalid("Failed to read license: not a JSON object");
            }
            String school = license.path("school").asText("");
            String mac = license.path("mac").asText("");
            if (!school.equals(schoolName)) {
                return LicenseStatus.invalid("License file school name mismatch");
            }
            byte[] expected = sign(schoolName).getBytes(StandardCharsets.UTF_8);
            if (MessageDigest.isEqual(expected, mac.getBytes(StandardCharsets.UTF_8))) {
                return LicenseStatus.valid();
            }
            return LicenseStatus.invalid("License HMAC invalid");
        } catch (IOException e) {
            log.warn("Could not read license file {}: {}", licenseFile, e.getMessage());
            return LicenseStatus.invalid("Failed to read license: " + e.getMessage());
        }
    }

    public LicenseStatus validateInstalled(String schoolName) {
        if (!Files.exists(installedLicense)) {
            return LicenseStatus.notActivated();
        }
        return validate(installedLicense, schoolName);
    }

    /**
     * Validates {@code source} for the school and, when valid, copies it over the installed license.
     */
    public OperationResult install(Path source, String schoolName) {
        LicenseStatus status = validate(source, schoolName);
        if (!status.isValid()) {
            return OperationResult.failure(FailureReason.INVALID_INPUT, status.getMessage());
        }
        try {
            Files.createDirectories(installedLicense.getParent());
            Files.copy(source, installedLicense, StandardCopyOption.REPLACE_EXISTING);
            log.info("License activated for school '{}'", schoolName);
            return OperationResult.ok("License activated");
        } catch (IOException e) {
            log.error("Failed to install license from {}", source, e);
            return OperationResult.failure(FailureReason.IO_ERROR, "Failed to install license: " + e.getMessage());
        }
    }

    /**
     * @return lowercase hex HMAC-SHA256 of the school name
     */
    public String sign(String schoolName) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret, ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(schoolName.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }
}
