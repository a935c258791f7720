package org.replaysafe.datapipeline.services.pipeline.components;

import org.replaysafe.datapipeline.api.contracts.Event;
import org.replaysafe.datapipeline.api.contracts.FingerprintedEvent;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Derives the dedup key of an event from its identity fields.
 * <p>
 * The key is the SHA-256 of {@code principal_id}, {@code event_type} and the canonical
 * {@code event_timestamp}, joined with U+001F and encoded as UTF-8, rendered as 64 lowercase
 * hex characters. Canonicalization:
 * <ul>
 *   <li>text fields are NFC-normalized and trimmed;</li>
 *   <li>the timestamp is accepted as epoch milliseconds or ISO-8601 (zone-less values are UTC)
 *       and rendered as {@code <epochSecond>.<nanos, 9 digits>}.</li>
 * </ul>
 * So {@code 1704067200000}, {@code "2024-01-01T00:00:00Z"} and {@code "2024-01-01T01:00:00+01:00"}
 * yield the same key. The function is pure, independent of the JVM's locale and time zone,
 * and thread-safe.
 */
public class KeyDeriver {

    static final char SEPARATOR = '\u001F';

    private static final HexFormat HEX = HexFormat.of();

    /**
     * @return The 64-character dedup key.
     * @throws MissingFieldException if an identity field is missing, blank or unparsable.
     */
    public String derive(Event event) throws MissingFieldException {
        return fingerprint(event).dedupKey();
    }

    /**
     * Derives the key and pairs it with the event and its canonical timestamp.
     *
     * @throws MissingFieldException if an identity field is missing, blank or unparsable.
     */
    public FingerprintedEvent fingerprint(Event event) throws MissingFieldException {
        String principalId = canonicalText("principal_id", event.principalId());
        String eventType = canonicalText("event_type", event.eventType());
        Instant timestamp = canonicalTimestamp(event.eventTimestamp());

        String canonical = principalId + SEPARATOR + eventType + SEPARATOR + formatTimestamp(timestamp);
        return new FingerprintedEvent(event, sha256Hex(canonical), timestamp);
    }

    private static String canonicalText(String field, String value) throws MissingFieldException {
        if (value == null) {
            throw new MissingFieldException(field, "Identity field '" + field + "' is missing");
        }
        String normalized = Normalizer.normalize(value, Normalizer.Form.NFC).trim();
        if (normalized.isEmpty()) {
            throw new MissingFieldException(field, "Identity field '" + field + "' is blank");
        }
        if (normalized.indexOf(SEPARATOR) >= 0) {
            throw new MissingFieldException(field, "Identity field '" + field + "' contains the reserved character U+001F");
        }
        return normalized;
    }

    /**
     * Parses epoch milliseconds or an ISO-8601 date-time.
     *
     * @throws MissingFieldException if the value is missing, blank or neither format.
     */
    static Instant canonicalTimestamp(String value) throws MissingFieldException {
        if (value == null || value.isBlank()) {
            throw new MissingFieldException("event_timestamp", "Identity field 'event_timestamp' is missing");
        }
        String trimmed = value.trim();
        if (isEpochMillis(trimmed)) {
            try {
                return Instant.ofEpochMilli(Long.parseLong(trimmed));
            } catch (NumberFormatException e) {
                throw new MissingFieldException("event_timestamp", "Epoch milliseconds out of range: " + trimmed);
            }
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(trimmed, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new MissingFieldException("event_timestamp",
                "Identity field 'event_timestamp' is neither epoch milliseconds nor ISO-8601: " + trimmed);
        }
    }

    private static boolean isEpochMillis(String value) {
        int start = value.startsWith("-") ? 1 : 0;
        if (start == value.length()) {
            return false;
        }
        for (int i = start; i < value.length(); i++) {
            if (value.charAt(i) < '0' || value.charAt(i) > '9') {
                return false;
            }
        }
        return true;
    }

    static String formatTimestamp(Instant timestamp) {
        return timestamp.getEpochSecond() + "." + String.format(Locale.ROOT, "%09d", timestamp.getNano());
    }

    private static String sha256Hex(String canonical) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HEX.formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
