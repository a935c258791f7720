package org.replaysafe.datapipeline.resources.database;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.replaysafe.datapipeline.api.contracts.AnalyticalRow;
import org.replaysafe.datapipeline.api.contracts.Checkpoint;
import org.replaysafe.datapipeline.api.contracts.Event;
import org.replaysafe.datapipeline.api.contracts.FingerprintedEvent;
import org.replaysafe.datapipeline.api.contracts.MergeResult;
import org.replaysafe.datapipeline.api.contracts.MergeTableRow;
import org.replaysafe.datapipeline.api.resources.IResource;
import org.replaysafe.datapipeline.api.resources.ResourceContext;
import org.replaysafe.datapipeline.api.resources.database.IAnalyticalReader;
import org.replaysafe.datapipeline.api.resources.database.IAnalyticalWriter;
import org.replaysafe.datapipeline.api.resources.database.ICheckpointStore;
import org.replaysafe.datapipeline.api.resources.database.IMergeTableReader;
import org.replaysafe.datapipeline.api.resources.database.IMergeTableWriter;
import org.replaysafe.datapipeline.api.resources.database.StorageException;
import org.replaysafe.datapipeline.api.resources.database.StorageUnavailableException;
import org.replaysafe.datapipeline.api.resources.database.TransactionConflictException;
import org.replaysafe.datapipeline.api.resources.database.TransactionTimeoutException;
import org.replaysafe.junit.extensions.logging.AllowLog;
import org.replaysafe.junit.extensions.logging.LogLevel;
import org.replaysafe.junit.extensions.logging.LogWatchExtension;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class H2DatabaseIntegrationTest {

    private static final Instant TS = Instant.parse("2024-01-01T00:00:00Z");

    private H2Database database;

    @BeforeEach
    void setUp() {
        database = open(Map.of());
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    private static H2Database open(Map<String, Object> extra) {
        Map<String, Object> options = new HashMap<>(extra);
        options.put("jdbcUrl", "jdbc:h2:mem:merge-" + UUID.randomUUID());
        return new H2Database("merge-db", ConfigFactory.parseMap(options));
    }

    private <T> T bind(String usageType, Class<T> type) {
        return bind(usageType, Map.of(), type);
    }

    private <T> T bind(String usageType, Map<String, String> params, Class<T> type) {
        return type.cast(database.getWrappedResource(new ResourceContext("test", "port", usageType, "merge-db", params)));
    }

    private static FingerprintedEvent event(int id, String payload) {
        Event event = new Event(0, id, "user-" + id, "click", Long.toString(TS.toEpochMilli()), null, payload);
        return new FingerprintedEvent(event, String.format("%064x", id), TS);
    }

    private static List<FingerprintedEvent> events(int from, int to, String payload) {
        List<FingerprintedEvent> result = new ArrayList<>();
        for (int i = from; i < to; i++) {
            result.add(event(i, payload));
        }
        return result;
    }

    @Test
    void merge_insertsThenLeavesReplayUnchanged() throws Exception {
        IMergeTableWriter writer = bind("db-merge", IMergeTableWriter.class);
        IMergeTableReader reader = bind("db-merge-read", IMergeTableReader.class);

        MergeResult first = writer.merge(events(0, 10_000, "{}"));
        MergeResult replay = writer.merge(events(0, 10_000, "{}"));

        assertThat(first).isEqualTo(new MergeResult(10_000, 0, 0));
        assertThat(replay).isEqualTo(new MergeResult(0, 0, 10_000));
        assertThat(reader.countRows()).isEqualTo(10_000);
        assertThat(reader.sumMergeVersions()).isEqualTo(10_000);
    }

    @Test
    void merge_onChange_bumpsVersionOnlyForChangedPayloads() throws Exception {
        IMergeTableWriter writer = bind("db-merge", IMergeTableWriter.class);
        IMergeTableReader reader = bind("db-merge-read", IMergeTableReader.class);
        writer.merge(events(0, 1_000, "{\"v\":1}"));

        List<FingerprintedEvent> replay = new ArrayList<>(events(0, 900, "{\"v\":1}"));
        replay.addAll(events(900, 1_000, "{\"v\":2}"));
        MergeResult result = writer.merge(replay);

        assertThat(result).isEqualTo(new MergeResult(0, 100, 900));
        assertThat(reader.countRows()).isEqualTo(1_000);
        assertThat(reader.sumMergeVersions()).isEqualTo(1_100);
        MergeTableRow changed = reader.findRow(event(950, "{}").dedupKey()).orElseThrow();
        assertThat(changed.mergeVersion()).isEqualTo(2);
        assertThat(changed.payload()).isEqualTo("{\"v\":2}");
        assertThat(changed.eventTimestamp()).isEqualTo(TS);
    }

    @Test
    void merge_always_bumpsVersionOnEveryMatch() throws Exception {
        IMergeTableWriter writer = bind("db-merge", Map.of("mergeVersionPolicy", "always"), IMergeTableWriter.class);
        IMergeTableReader reader = bind("db-merge-read", IMergeTableReader.class);
        writer.merge(events(0, 100, "{}"));

        MergeResult result = writer.merge(events(0, 100, "{}"));

        assertThat(result).isEqualTo(new MergeResult(0, 100, 0));
        assertThat(reader.sumMergeVersions()).isEqualTo(200);
    }

    @Test
    void merge_rejectsBatchWithDuplicateKeysAndWritesNothing() throws Exception {
        IMergeTableWriter writer = bind("db-merge", IMergeTableWriter.class);

        assertThatThrownBy(() -> writer.merge(List.of(event(1, "{}"), event(1, "{\"x\":1}"))))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(bind("db-merge-read", IMergeTableReader.class).countRows()).isZero();
    }

    @Test
    void merge_emptyBatch_isNoOp() throws Exception {
        assertThat(bind("db-merge", IMergeTableWriter.class).merge(List.of())).isEqualTo(MergeResult.EMPTY);
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "Merge of 1 rows failed on database 'merge-db'.*")
    void merge_afterClose_reportsStoreUnavailable() {
        IMergeTableWriter writer = bind("db-merge", IMergeTableWriter.class);
        database.close();

        assertThatThrownBy(() -> writer.merge(List.of(event(1, "{}"))))
            .isInstanceOf(StorageUnavailableException.class)
            .satisfies(e -> assertThat(((StorageUnavailableException) e).isRetryable()).isFalse());
        assertThat(database.getUsageState("db-merge")).isEqualTo(IResource.UsageState.FAILED);
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "Merge of 51 rows failed on database 'merge-db'.*")
    void merge_failingUpdateRollsBackInsertsOfSameBatch() throws Exception {
        IMergeTableWriter writer = bind("db-merge", IMergeTableWriter.class);
        IMergeTableReader reader = bind("db-merge-read", IMergeTableReader.class);
        writer.merge(events(0, 10, "{}"));

        // inserts run before updates, the null payload then violates NOT NULL
        List<FingerprintedEvent> batch = new ArrayList<>(events(100, 150, "{}"));
        batch.add(event(5, null));

        assertThatThrownBy(() -> writer.merge(batch)).isInstanceOf(StorageException.class);
        assertThat(reader.countRows()).isEqualTo(10);
        assertThat(reader.sumMergeVersions()).isEqualTo(10);
        assertThat(reader.findRow(event(120, "{}").dedupKey())).isEmpty();
        assertThat(reader.findRow(event(5, "{}").dedupKey()).orElseThrow().payload()).isEqualTo("{}");
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "Merge of 20000 rows failed on database 'merge-db'.*")
    void merge_exceedingTimeoutRaisesTimeoutAndWritesNothing() throws Exception {
        IMergeTableWriter writer = bind("db-merge", IMergeTableWriter.class);
        IMergeTableReader reader = bind("db-merge-read", IMergeTableReader.class);
        writer.merge(events(0, 20_000, "{\"v\":1}"));

        IMergeTableWriter impatient = bind("db-merge", Map.of("mergeTimeoutMs", "1"), IMergeTableWriter.class);

        assertThatThrownBy(() -> impatient.merge(events(0, 20_000, "{\"v\":2}")))
            .isInstanceOf(TransactionTimeoutException.class);
        assertThat(reader.sumMergeVersions()).isEqualTo(20_000);
        assertThat(reader.findRow(event(19_999, "{}").dedupKey()).orElseThrow().payload()).isEqualTo("{\"v\":1}");
    }

    @Test
    void translate_mapsH2ErrorCodes() {
        assertThat(H2Database.translate(new SQLException("dup", "23505", 23505), "op"))
            .isInstanceOf(TransactionConflictException.class);
        assertThat(H2Database.translate(new SQLException("lock", "HYT00", 50200), "op"))
            .isInstanceOf(TransactionConflictException.class);
        assertThat(H2Database.translate(new SQLTimeoutException("slow"), "op"))
            .isInstanceOf(TransactionTimeoutException.class);
        assertThat(H2Database.translate(new SQLException("cancel", "57014", 57014), "op"))
            .isInstanceOf(TransactionTimeoutException.class);
        assertThat(H2Database.translate(new SQLException("io", "90028", 90028), "op"))
            .isInstanceOf(StorageUnavailableException.class)
            .hasMessageStartingWith("op failed");
    }

    @Test
    void analytical_appendCountAndCompact() throws Exception {
        IAnalyticalWriter writer = bind("db-analytical", IAnalyticalWriter.class);
        IAnalyticalReader reader = bind("db-analytical-read", IAnalyticalReader.class);
        writer.append(List.of(AnalyticalRow.of(event(1, "{\"v\":1}"), 10), AnalyticalRow.of(event(2, "{}"), 10)));
        writer.append(List.of(AnalyticalRow.of(event(1, "{\"v\":2}"), 20)));

        assertThat(reader.countRows()).isEqualTo(3);
        assertThat(reader.countDistinctKeys()).isEqualTo(2);
        assertThat(reader.findLatest(event(1, "{}").dedupKey())).get()
            .satisfies(row -> {
                assertThat(row.version()).isEqualTo(20);
                assertThat(row.payload()).isEqualTo("{\"v\":2}");
            });

        assertThat(database.compactAnalytical()).isEqualTo(1);
        assertThat(reader.countRows()).isEqualTo(2);
        assertThat(reader.findLatest(event(1, "{}").dedupKey())).get()
            .extracting(AnalyticalRow::version).isEqualTo(20L);
        assertThat(reader.findLatest("missing")).isEmpty();
    }

    @Test
    void checkpoint_isEmptyUntilCommittedThenNeverMovesBackwards() throws Exception {
        ICheckpointStore store = bind("db-checkpoint", ICheckpointStore.class);
        assertThat(store.load("pipeline").isEmpty()).isTrue();

        store.commit("pipeline", 1, Map.of(0, 10L, 1, 5L));
        store.commit("pipeline", 2, Map.of(0, 7L, 2, 3L));

        Checkpoint checkpoint = store.load("pipeline");
        assertThat(checkpoint.batchId()).isEqualTo(2);
        assertThat(checkpoint.offsets()).containsExactlyInAnyOrderEntriesOf(Map.of(0, 10L, 1, 5L, 2, 3L));
        assertThat(checkpoint.committedAt()).isNotNull();
        assertThat(store.load("other").isEmpty()).isTrue();
    }

    @Test
    void listCheckpointedPipelines_returnsSortedIds() throws Exception {
        ICheckpointStore store = bind("db-checkpoint", ICheckpointStore.class);
        store.commit("b-pipeline", 1, Map.of(0, 1L));
        store.commit("a-pipeline", 1, Map.of(0, 1L));

        assertThat(database.listCheckpointedPipelines()).containsExactly("a-pipeline", "b-pipeline");
    }

    @Test
    void wrappedResource_rejectsUnknownUsageType() {
        assertThatThrownBy(() -> bind("log-read", Object.class)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> bind(null, Object.class)).isInstanceOf(IllegalArgumentException.class);
    }
}
