package org.replaysafe.datapipeline.resources.parking;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.replaysafe.datapipeline.api.resources.IResource;
import org.replaysafe.datapipeline.api.resources.parking.ParkedBatch;
import org.replaysafe.junit.extensions.logging.ExpectLog;
import org.replaysafe.junit.extensions.logging.LogLevel;
import org.replaysafe.junit.extensions.logging.LogWatchExtension;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class InMemoryParkedBatchStoreTest {

    private static ParkedBatch batch(long batchId) {
        return new ParkedBatch("pipeline", batchId, Map.of(0, 9L), Map.of(0, 19L), 10,
            "RETRIES_EXHAUSTED", "conflict", 5, Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    void park_keepsRecordsInOrder() {
        InMemoryParkedBatchStore store = new InMemoryParkedBatchStore("parked", ConfigFactory.empty());

        assertThat(store.park(batch(1))).isTrue();
        assertThat(store.park(batch(2))).isTrue();

        assertThat(store.list()).extracting(ParkedBatch::batchId).containsExactly(1L, 2L);
        assertThat(store.size()).isEqualTo(2);
        assertThat(store.getCapacityLimit()).isEqualTo(1000);
        assertThat(store.getUsageState(null)).isEqualTo(IResource.UsageState.ACTIVE);
        assertThat(store.getMetrics()).containsEntry("total_parked", 2L);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Parked batch store 'parked' is full, dropped record of batch 3.*")
    void park_whenFull_dropsRecordAndReportsError() {
        InMemoryParkedBatchStore store = new InMemoryParkedBatchStore("parked",
            ConfigFactory.parseMap(Map.of("capacity", 2)));
        store.park(batch(1));
        store.park(batch(2));

        assertThat(store.park(batch(3))).isFalse();

        assertThat(store.size()).isEqualTo(2);
        assertThat(store.getDroppedCount()).isEqualTo(1);
        assertThat(store.isHealthy()).isFalse();
        assertThat(store.getErrors()).singleElement()
            .satisfies(e -> assertThat(e.errorType()).isEqualTo("PARKED_RECORD_DROPPED"));
        assertThat(store.getUsageState(null)).isEqualTo(IResource.UsageState.FAILED);
    }

    @Test
    void constructor_rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new InMemoryParkedBatchStore("parked", ConfigFactory.parseMap(Map.of("capacity", 0))))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
