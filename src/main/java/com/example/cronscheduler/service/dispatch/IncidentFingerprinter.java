package com.example.cronscheduler.service.dispatch;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives a stable idempotency key from an incident.
 * <p>
 * The description is normalized so that incidents differing only in numbers
 * (timestamps, counts, ids) share a key. Changing environment, type,
 * component or severity yields a different key.
 */
public class IncidentFingerprinter {

    static final int DESCRIPTION_PREFIX_LENGTH = 200;
    static final int KEY_LENGTH = 16;
    static final String UNKNOWN = "unknown";

    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9\\s]");

    private final String keyPrefix;

    public IncidentFingerprinter(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public String fingerprint(Incident incident, String environment) {
        var material = String.join(":",
                orUnknown(environment),
                orUnknown(incident.getType()),
                orUnknown(incident.getComponent()),
                orUnknown(incident.getSeverity()),
                normalizeDescription(incident.getDescription()));

        return keyPrefix + sha256Hex(material).substring(0, KEY_LENGTH);
    }

    static String normalizeDescription(String description) {
        if (description == null) {
            return "";
        }
        var prefix = description.length() > DESCRIPTION_PREFIX_LENGTH
                ? description.substring(0, DESCRIPTION_PREFIX_LENGTH)
                : description;

        // upper-case placeholder falls outside [a-z0-9] and is stripped with the rest
        var normalized = DIGITS.matcher(prefix.toLowerCase(Locale.ROOT)).replaceAll("N");
        return NON_ALPHANUMERIC.matcher(normalized).replaceAll("").trim();
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? UNKNOWN : value;
    }

    private static String sha256Hex(String value) {
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
