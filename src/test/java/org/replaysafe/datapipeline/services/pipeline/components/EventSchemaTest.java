package org.replaysafe.datapipeline.services.pipeline.components;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.replaysafe.datapipeline.api.contracts.Event;
import org.replaysafe.datapipeline.api.resources.log.LogRecord;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class EventSchemaTest {

    private final EventSchema schema = new EventSchema();

    private static LogRecord record(String json) {
        return new LogRecord(2, 17L, json);
    }

    @Test
    void parse_completeRecord() throws Exception {
        Event event = schema.parse(record("""
            {"principal_id":"alice","event_type":"login","event_timestamp":1704067200000,
             "sequence":3,"payload":{"ip":"10.0.0.1","ok":true},"ignored":"x"}
            """));

        assertThat(event.partitionId()).isEqualTo(2);
        assertThat(event.offset()).isEqualTo(17L);
        assertThat(event.principalId()).isEqualTo("alice");
        assertThat(event.eventType()).isEqualTo("login");
        assertThat(event.eventTimestamp()).isEqualTo("1704067200000");
        assertThat(event.sequence()).isEqualTo(3L);
        assertThat(event.payload()).isEqualTo("{\"ip\":\"10.0.0.1\",\"ok\":true}");
    }

    @Test
    void parse_isoTimestampIsKeptAsText() throws Exception {
        Event event = schema.parse(record(
            "{\"principal_id\":\"a\",\"event_type\":\"t\",\"event_timestamp\":\"2024-01-01T00:00:00Z\"}"));

        assertThat(event.eventTimestamp()).isEqualTo("2024-01-01T00:00:00Z");
    }

    @Test
    void parse_missingOptionalFields_useDefaults() throws Exception {
        Event event = schema.parse(record(
            "{\"principal_id\":\"a\",\"event_type\":\"t\",\"event_timestamp\":1,\"payload\":null}"));

        assertThat(event.sequence()).isNull();
        assertThat(event.payload()).isEqualTo(EventSchema.EMPTY_PAYLOAD);
    }

    @Test
    void parse_missingPrincipal_namesTheField() {
        assertThatThrownBy(() -> schema.parse(record("{\"event_type\":\"t\",\"event_timestamp\":1}")))
            .isInstanceOf(MissingFieldException.class)
            .extracting(e -> ((MissingFieldException) e).getField())
            .isEqualTo("principal_id");
    }

    @Test
    void parse_nonTextualEventType_isRejected() {
        assertThatThrownBy(() -> schema.parse(record(
            "{\"principal_id\":\"a\",\"event_type\":42,\"event_timestamp\":1}")))
            .isInstanceOf(MissingFieldException.class)
            .extracting(e -> ((MissingFieldException) e).getField())
            .isEqualTo("event_type");
    }

    @Test
    void parse_missingTimestamp_isRejected() {
        assertThatThrownBy(() -> schema.parse(record("{\"principal_id\":\"a\",\"event_type\":\"t\"}")))
            .isInstanceOf(MissingFieldException.class)
            .extracting(e -> ((MissingFieldException) e).getField())
            .isEqualTo("event_timestamp");
    }

    @Test
    void parse_fractionalTimestamp_isRejected() {
        assertThatThrownBy(() -> schema.parse(record(
            "{\"principal_id\":\"a\",\"event_type\":\"t\",\"event_timestamp\":1.5}")))
            .isInstanceOf(MissingFieldException.class);
    }

    @Test
    void parse_nonIntegralSequence_isRejected() {
        assertThatThrownBy(() -> schema.parse(record(
            "{\"principal_id\":\"a\",\"event_type\":\"t\",\"event_timestamp\":1,\"sequence\":\"7\"}")))
            .isInstanceOf(MissingFieldException.class)
            .extracting(e -> ((MissingFieldException) e).getField())
            .isEqualTo("sequence");
    }

    @Test
    void parse_invalidJson_isRejectedAsRecord() {
        assertThatThrownBy(() -> schema.parse(record("{not json")))
            .isInstanceOf(MissingFieldException.class)
            .extracting(e -> ((MissingFieldException) e).getField())
            .isEqualTo("record");
    }

    @Test
    void parse_jsonArray_isRejected() {
        assertThatThrownBy(() -> schema.parse(record("[1,2,3]")))
            .isInstanceOf(MissingFieldException.class)
            .hasMessageContaining("not a JSON object");
    }
}
