package org.replaysafe.datapipeline.services.pipeline.components;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.replaysafe.datapipeline.api.contracts.Event;
import org.replaysafe.datapipeline.api.contracts.FingerprintedEvent;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class KeyDeriverTest {

    private final KeyDeriver deriver = new KeyDeriver();

    private static Event event(String principal, String type, String timestamp) {
        return new Event(0, 0L, principal, type, timestamp, null, "{}");
    }

    @Test
    void derive_matchesSha256OfCanonicalIdentity() throws Exception {
        String key = deriver.derive(event("alice", "login", "1704067200000"));

        assertThat(key)
            .hasSize(64)
            .isEqualTo("8d3804b7b8d23fb5e1d989af2af619009402848d020c55b8b63caf398c5fe065");
    }

    @Test
    void derive_isDeterministic() throws Exception {
        Event e = event("bob", "purchase", "2024-03-01T12:00:00Z");

        assertThat(deriver.derive(e)).isEqualTo(deriver.derive(e));
        assertThat(new KeyDeriver().derive(e)).isEqualTo(deriver.derive(e));
    }

    @Test
    void derive_sameInstantInDifferentRepresentations_yieldsSameKey() throws Exception {
        String millis = deriver.derive(event("alice", "login", "1704067200000"));

        assertThat(deriver.derive(event("alice", "login", "2024-01-01T00:00:00Z"))).isEqualTo(millis);
        assertThat(deriver.derive(event("alice", "login", "2024-01-01T01:00:00+01:00"))).isEqualTo(millis);
        assertThat(deriver.derive(event("alice", "login", "2024-01-01T00:00:00.000Z"))).isEqualTo(millis);
    }

    @Test
    void derive_zonelessIsoTimestamp_isTreatedAsUtc() throws Exception {
        assertThat(deriver.derive(event("alice", "login", "2024-01-01T00:00:00")))
            .isEqualTo(deriver.derive(event("alice", "login", "2024-01-01T00:00:00Z")));
    }

    @Test
    void derive_normalizesUnicodeAndWhitespace() throws Exception {
        String composed = deriver.derive(event("caf\u00e9", "login", "1000"));
        String decomposed = deriver.derive(event("cafe\u0301", "login", "1000"));
        String padded = deriver.derive(event("  caf\u00e9 ", " login\t", " 1000 "));

        assertThat(decomposed).isEqualTo(composed);
        assertThat(padded).isEqualTo(composed);
    }

    @Test
    void derive_ignoresPayloadSequenceAndPosition() throws Exception {
        Event a = new Event(0, 5L, "alice", "login", "1000", 1L, "{\"a\":1}");
        Event b = new Event(3, 99L, "alice", "login", "1000", 7L, "{\"b\":2}");

        assertThat(deriver.derive(a)).isEqualTo(deriver.derive(b));
    }

    @Test
    void derive_differentIdentity_yieldsDifferentKeys() throws Exception {
        String base = deriver.derive(event("alice", "login", "1000"));

        assertThat(deriver.derive(event("alice", "logout", "1000"))).isNotEqualTo(base);
        assertThat(deriver.derive(event("alicia", "login", "1000"))).isNotEqualTo(base);
        assertThat(deriver.derive(event("alice", "login", "1001"))).isNotEqualTo(base);
    }

    @Test
    void derive_fieldBoundariesAreNotAmbiguous() throws Exception {
        assertThat(deriver.derive(event("ab", "c", "1000")))
            .isNotEqualTo(deriver.derive(event("a", "bc", "1000")));
    }

    @Test
    void fingerprint_carriesCanonicalTimestamp() throws Exception {
        FingerprintedEvent fingerprinted = deriver.fingerprint(event("alice", "login", "2024-01-01T01:00:00+01:00"));

        assertThat(fingerprinted.eventTimestamp()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(fingerprinted.event().principalId()).isEqualTo("alice");
    }

    @Test
    void derive_blankPrincipal_isRejected() {
        assertThatThrownBy(() -> deriver.derive(event("   ", "login", "1000")))
            .isInstanceOf(MissingFieldException.class)
            .extracting(e -> ((MissingFieldException) e).getField())
            .isEqualTo("principal_id");
    }

    @Test
    void derive_missingEventType_isRejected() {
        assertThatThrownBy(() -> deriver.derive(event("alice", null, "1000")))
            .isInstanceOf(MissingFieldException.class)
            .extracting(e -> ((MissingFieldException) e).getField())
            .isEqualTo("event_type");
    }

    @Test
    void derive_separatorCharacterInField_isRejected() {
        assertThatThrownBy(() -> deriver.derive(event("ali\u001Fce", "login", "1000")))
            .isInstanceOf(MissingFieldException.class)
            .hasMessageContaining("U+001F");
    }

    @Test
    void derive_unparsableTimestamp_isRejected() {
        assertThatThrownBy(() -> deriver.derive(event("alice", "login", "yesterday")))
            .isInstanceOf(MissingFieldException.class)
            .extracting(e -> ((MissingFieldException) e).getField())
            .isEqualTo("event_timestamp");
    }

    @Test
    void canonicalTimestamp_acceptsNegativeEpochMillis() throws Exception {
        assertThat(KeyDeriver.canonicalTimestamp("-1")).isEqualTo(Instant.ofEpochMilli(-1));
    }

    @Test
    void canonicalTimestamp_rejectsNonAsciiDigits() {
        // Arabic-Indic digits pass Character.isDigit but are not epoch millis
        assertThatThrownBy(() -> KeyDeriver.canonicalTimestamp("\u0661\u0662\u0663"))
            .isInstanceOf(MissingFieldException.class);
    }

    @Test
    void formatTimestamp_rendersSecondsAndNineDigitNanos() {
        assertThat(KeyDeriver.formatTimestamp(Instant.ofEpochMilli(1500))).isEqualTo("1.500000000");
        assertThat(KeyDeriver.formatTimestamp(Instant.ofEpochMilli(-1))).isEqualTo("-1.999000000");
        assertThat(KeyDeriver.formatTimestamp(Instant.ofEpochSecond(1704067200))).isEqualTo("1704067200.000000000");
    }
}
