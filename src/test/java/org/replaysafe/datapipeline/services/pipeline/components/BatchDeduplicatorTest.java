package org.replaysafe.datapipeline.services.pipeline.components;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.replaysafe.datapipeline.api.contracts.Event;
import org.replaysafe.datapipeline.api.contracts.FingerprintedEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class BatchDeduplicatorTest {

    private static FingerprintedEvent event(String key, int partition, long offset, Long sequence) {
        Event e = new Event(partition, offset, "p-" + key, "type", "1000", sequence, "{\"o\":" + offset + "}");
        return new FingerprintedEvent(e, key, Instant.ofEpochMilli(1000));
    }

    @Test
    void firstArrival_keepsLowestPartitionAndOffset() throws Exception {
        BatchDeduplicator dedup = new BatchDeduplicator(DedupPolicy.FIRST_ARRIVAL, 100);
        List<FingerprintedEvent> batch = List.of(
            event("k1", 1, 5, null),
            event("k1", 0, 9, null),
            event("k2", 0, 3, null),
            event("k1", 0, 2, null));

        DedupResult result = dedup.dedupe(batch);

        assertThat(result.unique()).hasSize(2);
        assertThat(result.duplicates()).isEqualTo(2);
        assertThat(result.unique().get(0).dedupKey()).isEqualTo("k1");
        assertThat(result.unique().get(0).event().offset()).isEqualTo(2L);
        assertThat(result.unique().get(1).dedupKey()).isEqualTo("k2");
    }

    @Test
    void firstArrival_resultDoesNotDependOnInputOrder() throws Exception {
        BatchDeduplicator dedup = new BatchDeduplicator(DedupPolicy.FIRST_ARRIVAL, 1000);
        List<FingerprintedEvent> batch = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            batch.add(event("k" + (i % 37), i % 4, i, null));
        }
        DedupResult expected = dedup.dedupe(batch);

        Random random = new Random(42);
        for (int round = 0; round < 10; round++) {
            List<FingerprintedEvent> shuffled = new ArrayList<>(batch);
            Collections.shuffle(shuffled, random);
            assertThat(dedup.dedupe(shuffled).unique()).isEqualTo(expected.unique());
        }
    }

    @Test
    void dedupe_isIdempotent() throws Exception {
        BatchDeduplicator dedup = new BatchDeduplicator(DedupPolicy.FIRST_ARRIVAL, 100);
        List<FingerprintedEvent> batch = List.of(event("a", 0, 1, null), event("a", 0, 2, null), event("b", 1, 1, null));

        DedupResult once = dedup.dedupe(batch);
        DedupResult twice = dedup.dedupe(once.unique());

        assertThat(twice.unique()).isEqualTo(once.unique());
        assertThat(twice.duplicates()).isZero();
    }

    @Test
    void highestSequence_prefersLargerSequence() throws Exception {
        BatchDeduplicator dedup = new BatchDeduplicator(DedupPolicy.HIGHEST_SEQUENCE, 100);
        List<FingerprintedEvent> batch = List.of(
            event("k", 0, 1, 3L),
            event("k", 0, 2, 9L),
            event("k", 1, 0, 5L));

        DedupResult result = dedup.dedupe(batch);

        assertThat(result.unique()).singleElement()
            .satisfies(e -> assertThat(e.event().sequence()).isEqualTo(9L));
    }

    @Test
    void highestSequence_missingSequenceRanksLowest_andTiesGoToFirstArrival() throws Exception {
        BatchDeduplicator dedup = new BatchDeduplicator(DedupPolicy.HIGHEST_SEQUENCE, 100);

        DedupResult withMissing = dedup.dedupe(List.of(event("k", 0, 1, null), event("k", 0, 2, 0L)));
        DedupResult tie = dedup.dedupe(List.of(event("k", 0, 7, 4L), event("k", 0, 3, 4L)));
        DedupResult allMissing = dedup.dedupe(List.of(event("k", 0, 8, null), event("k", 0, 6, null)));

        assertThat(withMissing.unique().get(0).event().offset()).isEqualTo(2L);
        assertThat(tie.unique().get(0).event().offset()).isEqualTo(3L);
        assertThat(allMissing.unique().get(0).event().offset()).isEqualTo(6L);
    }

    @Test
    void highestSequence_keepsArrivalOrderOfWinners() throws Exception {
        BatchDeduplicator dedup = new BatchDeduplicator(DedupPolicy.HIGHEST_SEQUENCE, 100);
        List<FingerprintedEvent> batch = List.of(
            event("a", 0, 1, 1L),
            event("b", 0, 2, 1L),
            event("a", 0, 3, 2L));

        DedupResult result = dedup.dedupe(batch);

        assertThat(result.unique()).extracting(FingerprintedEvent::dedupKey).containsExactly("b", "a");
    }

    @Test
    void emptyBatch_yieldsEmptyResult() throws Exception {
        DedupResult result = new BatchDeduplicator(DedupPolicy.FIRST_ARRIVAL, 1).dedupe(List.of());

        assertThat(result.unique()).isEmpty();
        assertThat(result.duplicates()).isZero();
    }

    @Test
    void oversizedBatch_isRejected() {
        BatchDeduplicator dedup = new BatchDeduplicator(DedupPolicy.FIRST_ARRIVAL, 2);

        assertThatThrownBy(() -> dedup.dedupe(List.of(event("a", 0, 1, null), event("b", 0, 2, null), event("c", 0, 3, null))))
            .isInstanceOf(BatchTooLargeException.class)
            .satisfies(e -> {
                BatchTooLargeException tooLarge = (BatchTooLargeException) e;
                assertThat(tooLarge.getSize()).isEqualTo(3);
                assertThat(tooLarge.getLimit()).isEqualTo(2);
            });
    }

    @Test
    void nonPositiveLimit_isRejected() {
        assertThatThrownBy(() -> new BatchDeduplicator(DedupPolicy.FIRST_ARRIVAL, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
