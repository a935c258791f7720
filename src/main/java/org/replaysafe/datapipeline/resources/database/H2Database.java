package org.replaysafe.datapipeline.resources.database;

import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.replaysafe.datapipeline.api.contracts.AnalyticalRow;
import org.replaysafe.datapipeline.api.contracts.Checkpoint;
import org.replaysafe.datapipeline.api.contracts.FingerprintedEvent;
import org.replaysafe.datapipeline.api.contracts.MergeResult;
import org.replaysafe.datapipeline.api.contracts.MergeTableRow;
import org.replaysafe.datapipeline.api.resources.database.AnalyticalSinkException;
import org.replaysafe.datapipeline.api.resources.database.MergeVersionPolicy;
import org.replaysafe.datapipeline.api.resources.database.StorageException;
import org.replaysafe.datapipeline.api.resources.database.StorageUnavailableException;
import org.replaysafe.datapipeline.api.resources.database.TransactionConflictException;
import org.replaysafe.datapipeline.api.resources.database.TransactionTimeoutException;
import org.replaysafe.datapipeline.utils.H2SchemaUtil;
import org.replaysafe.datapipeline.utils.PathExpansion;
import org.replaysafe.datapipeline.utils.monitoring.SlidingWindowCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransactionRollbackException;
import java.sql.Statement;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * H2-backed database resource holding the merge table, the analytical table and the
 * checkpoint table. Connections come from a HikariCP pool.
 * <p>
 * Options:
 * <ul>
 *   <li>{@code jdbcUrl} or {@code dbPath} (e.g. {@code "${user.home}/replaysafe/merge"} or {@code "mem:test"})</li>
 *   <li>{@code username} / {@code password} (default {@code sa} / empty)</li>
 *   <li>{@code maxPoolSize} (10), {@code minIdle} (2), {@code connectionTimeoutMs} (30000)</li>
 *   <li>{@code lockTimeoutMs} (5000): wait for the single-writer merge lock</li>
 *   <li>{@code mergeTimeoutMs} (30000), {@code mergeVersionPolicy} (ON_CHANGE): defaults for {@code db-merge} bindings</li>
 *   <li>{@code analyticalCompactionIntervalMs} (0 = disabled): periodic last-write-wins compaction</li>
 * </ul>
 */
public class H2Database extends AbstractDatabaseResource {

    private static final Logger log = LoggerFactory.getLogger(H2Database.class);

    static final String MERGE_TABLE = "merge_events";
    static final String ANALYTICAL_TABLE = "analytical_events";
    static final String CHECKPOINT_TABLE = "pipeline_checkpoints";

    private static final int KEY_LOOKUP_CHUNK = 500;

    // H2 error codes (org.h2.api.ErrorCode)
    private static final int DUPLICATE_KEY = 23505;
    private static final int DEADLOCK = 40001;
    private static final int LOCK_TIMEOUT = 50200;
    private static final int CONCURRENT_UPDATE = 90131;
    private static final int STATEMENT_WAS_CANCELED = 57014;

    private final HikariDataSource dataSource;
    private final ReentrantLock mergeLock = new ReentrantLock(true);
    private final long lockTimeoutMs;
    private final Set<String> ensuredTables = ConcurrentHashMap.newKeySet();
    private final Object schemaLock = new Object();
    private final SlidingWindowCounter diskWritesCounter;
    private final AtomicLong compactedRows = new AtomicLong(0);
    private final ScheduledExecutorService compactionExecutor;

    public H2Database(String name, Config options) {
        super(name, options);

        final String jdbcUrl = getJdbcUrl(options);
        final String username = options.hasPath("username") ? options.getString("username") : "sa";
        final String password = options.hasPath("password") ? options.getString("password") : "";
        this.lockTimeoutMs = options.hasPath("lockTimeoutMs") ? options.getLong("lockTimeoutMs") : 5000L;

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setDriverClassName("org.h2.Driver");
        hikariConfig.setMaximumPoolSize(options.hasPath("maxPoolSize") ? options.getInt("maxPoolSize") : 10);
        hikariConfig.setMinimumIdle(options.hasPath("minIdle") ? options.getInt("minIdle") : 2);
        hikariConfig.setConnectionTimeout(options.hasPath("connectionTimeoutMs") ? options.getLong("connectionTimeoutMs") : 30_000L);
        hikariConfig.setUsername(username);
        hikariConfig.setPassword(password);
        hikariConfig.setPoolName(name);

        try {
            this.dataSource = new HikariDataSource(hikariConfig);
            log.debug("H2 database '{}' connection pool started (max={}, minIdle={})",
                name, hikariConfig.getMaximumPoolSize(), hikariConfig.getMinimumIdle());
        } catch (Exception e) {
            Throwable cause = e;
            while (cause.getCause() != null && cause.getCause() != cause) {
                cause = cause.getCause();
            }
            String causeMsg = cause.getMessage() != null ? cause.getMessage() : "";

            if (causeMsg.contains("already in use") || causeMsg.contains("file is locked")) {
                String errorMsg = String.format(
                    "Cannot open H2 database '%s': file already in use by another process. File: %s.mv.db. "
                        + "Stop the other pipeline instance or remove stale lock files.",
                    name, jdbcUrl.replace("jdbc:h2:", ""));
                log.error(errorMsg);
                throw new RuntimeException(errorMsg, e);
            }
            if (causeMsg.contains("Wrong user name or password")) {
                String errorMsg = String.format("Failed to connect to H2 database '%s': wrong username/password. URL=%s, User=%s",
                    name, jdbcUrl, username.isEmpty() ? "(empty)" : username);
                log.error(errorMsg);
                throw new RuntimeException(errorMsg, e);
            }
            String errorMsg = String.format("Failed to initialize H2 database '%s': %s. Database: %s. Error: %s",
                name, cause.getClass().getSimpleName(), jdbcUrl, causeMsg);
            log.error(errorMsg);
            throw new RuntimeException(errorMsg, e);
        }

        int metricsWindowSeconds = options.hasPath("metricsWindowSeconds") ? options.getInt("metricsWindowSeconds") : 5;
        this.diskWritesCounter = new SlidingWindowCounter(metricsWindowSeconds);

        long compactionIntervalMs = options.hasPath("analyticalCompactionIntervalMs")
            ? options.getLong("analyticalCompactionIntervalMs")
            : 0L;
        if (compactionIntervalMs > 0) {
            this.compactionExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, name + "-compaction");
                t.setDaemon(true);
                return t;
            });
            compactionExecutor.scheduleWithFixedDelay(this::compactQuietly, compactionIntervalMs, compactionIntervalMs, TimeUnit.MILLISECONDS);
        } else {
            this.compactionExecutor = null;
        }
    }

    private String getJdbcUrl(Config options) {
        String jdbcUrl;
        if (options.hasPath("jdbcUrl")) {
            jdbcUrl = options.getString("jdbcUrl");
        } else if (options.hasPath("dbPath")) {
            jdbcUrl = "jdbc:h2:" + options.getString("dbPath");
        } else {
            throw new IllegalArgumentException("Either 'jdbcUrl' or 'dbPath' must be configured for H2Database '" + resourceName + "'.");
        }
        String expandedUrl = PathExpansion.expandPath(jdbcUrl);
        if (!jdbcUrl.equals(expandedUrl)) {
            log.debug("Expanded jdbcUrl: '{}' -> '{}'", jdbcUrl, expandedUrl);
        }
        // in-memory databases must outlive the last pooled connection
        if (expandedUrl.startsWith("jdbc:h2:mem:") && !expandedUrl.toUpperCase().contains("DB_CLOSE_DELAY")) {
            expandedUrl = expandedUrl + ";DB_CLOSE_DELAY=-1";
        }
        return expandedUrl;
    }

    @Override
    protected Connection acquireDedicatedConnection() throws SQLException {
        Connection conn = dataSource.getConnection();
        conn.setAutoCommit(false);
        return conn;
    }

    // ========================================================================
    // Schema
    // ========================================================================

    private void ensureTables(Connection conn, String table) throws SQLException {
        if (ensuredTables.contains(table)) {
            return;
        }
        synchronized (schemaLock) {
            if (ensuredTables.contains(table)) {
                return;
            }
            switch (table) {
                case MERGE_TABLE -> H2SchemaUtil.executeDdlIfNotExists(conn,
                    "CREATE TABLE IF NOT EXISTS " + MERGE_TABLE + " ("
                        + "dedup_key VARCHAR(64) PRIMARY KEY, "
                        + "principal_id VARCHAR NOT NULL, "
                        + "event_type VARCHAR NOT NULL, "
                        + "event_timestamp TIMESTAMP WITH TIME ZONE NOT NULL, "
                        + "payload CHARACTER LARGE OBJECT NOT NULL, "
                        + "merge_version BIGINT NOT NULL)",
                    MERGE_TABLE);
                case ANALYTICAL_TABLE -> {
                    H2SchemaUtil.executeDdlIfNotExists(conn,
                        "CREATE TABLE IF NOT EXISTS " + ANALYTICAL_TABLE + " ("
                            + "row_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                            + "dedup_key VARCHAR(64) NOT NULL, "
                            + "principal_id VARCHAR NOT NULL, "
                            + "event_type VARCHAR NOT NULL, "
                            + "event_timestamp TIMESTAMP WITH TIME ZONE NOT NULL, "
                            + "payload CHARACTER LARGE OBJECT NOT NULL, "
                            + "version BIGINT NOT NULL)",
                        ANALYTICAL_TABLE);
                    H2SchemaUtil.executeDdlIfNotExists(conn,
                        "CREATE INDEX IF NOT EXISTS idx_analytical_key_version ON " + ANALYTICAL_TABLE + " (dedup_key, version)",
                        "idx_analytical_key_version");
                }
                case CHECKPOINT_TABLE -> H2SchemaUtil.executeDdlIfNotExists(conn,
                    "CREATE TABLE IF NOT EXISTS " + CHECKPOINT_TABLE + " ("
                        + "pipeline_id VARCHAR(200) NOT NULL, "
                        + "partition_id INT NOT NULL, "
                        + "log_offset BIGINT NOT NULL, "
                        + "batch_id BIGINT NOT NULL, "
                        + "committed_at TIMESTAMP WITH TIME ZONE NOT NULL, "
                        + "PRIMARY KEY (pipeline_id, partition_id))",
                    CHECKPOINT_TABLE);
                default -> throw new IllegalArgumentException("Unknown table: " + table);
            }
            ensuredTables.add(table);
        }
    }

    // ========================================================================
    // Merge table
    // ========================================================================

    private record ExistingRow(String payload, long mergeVersion) {}

    @Override
    protected MergeResult doMerge(Connection conn, List<FingerprintedEvent> batch,
                                  MergeVersionPolicy policy, long timeoutMs) throws StorageException {
        if (batch.isEmpty()) {
            return MergeResult.EMPTY;
        }
        Map<String, FingerprintedEvent> byKey = new LinkedHashMap<>();
        for (FingerprintedEvent event : batch) {
            if (byKey.putIfAbsent(event.dedupKey(), event) != null) {
                throw new IllegalArgumentException("Merge batch contains dedup key twice: " + event.dedupKey());
            }
        }

        try {
            ensureTables(conn, MERGE_TABLE);
        } catch (SQLException e) {
            rollbackQuietly(conn);
            writeErrors.incrementAndGet();
            throw translate(e, "Preparing merge table");
        }

        acquireMergeLock();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        int timeoutSeconds = (int) Math.max(1, (timeoutMs + 999) / 1000);
        try {
            Map<String, ExistingRow> existing = loadExisting(conn, byKey.keySet(), timeoutSeconds);
            checkDeadline(deadline, timeoutMs);

            List<FingerprintedEvent> inserts = new ArrayList<>();
            List<FingerprintedEvent> updates = new ArrayList<>();
            int unchanged = 0;
            for (FingerprintedEvent event : byKey.values()) {
                ExistingRow row = existing.get(event.dedupKey());
                if (row == null) {
                    inserts.add(event);
                } else if (policy == MergeVersionPolicy.ALWAYS || !row.payload().equals(event.event().payload())) {
                    updates.add(event);
                } else {
                    unchanged++;
                }
            }

            if (!inserts.isEmpty()) {
                executeInserts(conn, inserts, timeoutSeconds);
                checkDeadline(deadline, timeoutMs);
            }
            if (!updates.isEmpty()) {
                executeUpdates(conn, updates, timeoutSeconds);
                checkDeadline(deadline, timeoutMs);
            }
            conn.commit();

            mergeTransactions.incrementAndGet();
            rowsInserted.addAndGet(inserts.size());
            rowsUpdated.addAndGet(updates.size());
            diskWritesCounter.recordCount();
            log.debug("Merged {} events into '{}': inserted={}, updated={}, unchanged={}",
                byKey.size(), getResourceName(), inserts.size(), updates.size(), unchanged);
            return new MergeResult(inserts.size(), updates.size(), unchanged);
        } catch (SQLException e) {
            rollbackQuietly(conn);
            writeErrors.incrementAndGet();
            throw translate(e, "Merge of " + byKey.size() + " events");
        } catch (StorageException e) {
            rollbackQuietly(conn);
            writeErrors.incrementAndGet();
            throw e;
        } finally {
            mergeLock.unlock();
        }
    }

    private void acquireMergeLock() throws TransactionConflictException {
        boolean locked;
        try {
            locked = mergeLock.tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransactionConflictException("Interrupted while waiting for the merge lock of '" + getResourceName() + "'", e);
        }
        if (!locked) {
            throw new TransactionConflictException(String.format(
                "Merge table of '%s' is held by another writer (waited %d ms)", getResourceName(), lockTimeoutMs), null);
        }
    }

    private static void checkDeadline(long deadlineNanos, long timeoutMs) throws TransactionTimeoutException {
        if (System.nanoTime() > deadlineNanos) {
            throw new TransactionTimeoutException("Merge transaction exceeded its timeout of " + timeoutMs + " ms", null);
        }
    }

    private Map<String, ExistingRow> loadExisting(Connection conn, Collection<String> keys, int timeoutSeconds) throws SQLException {
        Map<String, ExistingRow> existing = new HashMap<>();
        List<String> keyList = new ArrayList<>(keys);
        for (int from = 0; from < keyList.size(); from += KEY_LOOKUP_CHUNK) {
            List<String> chunk = keyList.subList(from, Math.min(from + KEY_LOOKUP_CHUNK, keyList.size()));
            String placeholders = String.join(",", Collections.nCopies(chunk.size(), "?"));
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT dedup_key, payload, merge_version FROM " + MERGE_TABLE + " WHERE dedup_key IN (" + placeholders + ")")) {
                stmt.setQueryTimeout(timeoutSeconds);
                for (int i = 0; i < chunk.size(); i++) {
                    stmt.setString(i + 1, chunk.get(i));
                }
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        existing.put(rs.getString(1), new ExistingRow(rs.getString(2), rs.getLong(3)));
                    }
                }
            }
        }
        return existing;
    }

    private void executeInserts(Connection conn, List<FingerprintedEvent> inserts, int timeoutSeconds) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT INTO " + MERGE_TABLE
                    + " (dedup_key, principal_id, event_type, event_timestamp, payload, merge_version) VALUES (?, ?, ?, ?, ?, 1)")) {
            stmt.setQueryTimeout(timeoutSeconds);
            for (FingerprintedEvent event : inserts) {
                stmt.setString(1, event.dedupKey());
                stmt.setString(2, event.event().principalId());
                stmt.setString(3, event.event().eventType());
                stmt.setObject(4, toTimestamp(event.eventTimestamp()));
                stmt.setString(5, event.event().payload());
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private void executeUpdates(Connection conn, List<FingerprintedEvent> updates, int timeoutSeconds) throws SQLException, TransactionConflictException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "UPDATE " + MERGE_TABLE + " SET payload = ?, merge_version = merge_version + 1 WHERE dedup_key = ?")) {
            stmt.setQueryTimeout(timeoutSeconds);
            for (FingerprintedEvent event : updates) {
                stmt.setString(1, event.event().payload());
                stmt.setString(2, event.dedupKey());
                stmt.addBatch();
            }
            int[] counts = stmt.executeBatch();
            for (int i = 0; i < counts.length; i++) {
                if (counts[i] == 0) {
                    throw new TransactionConflictException(
                        "Row " + updates.get(i).dedupKey() + " disappeared during the merge transaction", null);
                }
            }
        }
    }

    @Override
    protected long doCountMergeRows(Connection conn) throws StorageException {
        return querySingleLong(conn, MERGE_TABLE, "SELECT COUNT(*) FROM " + MERGE_TABLE);
    }

    @Override
    protected long doSumMergeVersions(Connection conn) throws StorageException {
        return querySingleLong(conn, MERGE_TABLE, "SELECT COALESCE(SUM(merge_version), 0) FROM " + MERGE_TABLE);
    }

    @Override
    protected Optional<MergeTableRow> doFindMergeRow(Connection conn, String dedupKey) throws StorageException {
        try {
            ensureTables(conn, MERGE_TABLE);
            Optional<MergeTableRow> result = Optional.empty();
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT dedup_key, principal_id, event_type, event_timestamp, payload, merge_version FROM "
                        + MERGE_TABLE + " WHERE dedup_key = ?")) {
                stmt.setString(1, dedupKey);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (rs.next()) {
                        result = Optional.of(new MergeTableRow(rs.getString(1), rs.getString(2), rs.getString(3),
                            rs.getObject(4, OffsetDateTime.class).toInstant(), rs.getString(5), rs.getLong(6)));
                    }
                }
            }
            conn.commit();
            return result;
        } catch (SQLException e) {
            rollbackQuietly(conn);
            readErrors.incrementAndGet();
            throw translate(e, "Reading merge row");
        }
    }

    // ========================================================================
    // Analytical table
    // ========================================================================

    @Override
    protected void doAppendAnalytical(Connection conn, List<AnalyticalRow> rows) throws AnalyticalSinkException {
        if (rows.isEmpty()) {
            return;
        }
        try {
            ensureTables(conn, ANALYTICAL_TABLE);
            try (PreparedStatement stmt = conn.prepareStatement(
                    "INSERT INTO " + ANALYTICAL_TABLE
                        + " (dedup_key, principal_id, event_type, event_timestamp, payload, version) VALUES (?, ?, ?, ?, ?, ?)")) {
                for (AnalyticalRow row : rows) {
                    stmt.setString(1, row.dedupKey());
                    stmt.setString(2, row.principalId());
                    stmt.setString(3, row.eventType());
                    stmt.setObject(4, toTimestamp(row.eventTimestamp()));
                    stmt.setString(5, row.payload());
                    stmt.setLong(6, row.version());
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }
            conn.commit();
            analyticalRowsAppended.addAndGet(rows.size());
            diskWritesCounter.recordCount();
        } catch (SQLException e) {
            rollbackQuietly(conn);
            writeErrors.incrementAndGet();
            throw new AnalyticalSinkException("Analytical append of " + rows.size() + " rows to '"
                + getResourceName() + "' failed: " + e.getMessage(), e);
        }
    }

    @Override
    protected long doCountAnalyticalRows(Connection conn) throws StorageException {
        return querySingleLong(conn, ANALYTICAL_TABLE, "SELECT COUNT(*) FROM " + ANALYTICAL_TABLE);
    }

    @Override
    protected long doCountAnalyticalKeys(Connection conn) throws StorageException {
        return querySingleLong(conn, ANALYTICAL_TABLE, "SELECT COUNT(DISTINCT dedup_key) FROM " + ANALYTICAL_TABLE);
    }

    @Override
    protected Optional<AnalyticalRow> doFindLatestAnalytical(Connection conn, String dedupKey) throws StorageException {
        try {
            ensureTables(conn, ANALYTICAL_TABLE);
            Optional<AnalyticalRow> result = Optional.empty();
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT dedup_key, principal_id, event_type, event_timestamp, payload, version FROM "
                        + ANALYTICAL_TABLE + " WHERE dedup_key = ? ORDER BY version DESC, row_id DESC LIMIT 1")) {
                stmt.setString(1, dedupKey);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (rs.next()) {
                        result = Optional.of(new AnalyticalRow(rs.getString(1), rs.getString(2), rs.getString(3),
                            rs.getObject(4, OffsetDateTime.class).toInstant(), rs.getString(5), rs.getLong(6)));
                    }
                }
            }
            conn.commit();
            return result;
        } catch (SQLException e) {
            rollbackQuietly(conn);
            readErrors.incrementAndGet();
            throw translate(e, "Reading analytical row");
        }
    }

    @Override
    public int compactAnalytical() throws StorageException {
        try (Connection conn = acquireDedicatedConnection()) {
            try {
                ensureTables(conn, ANALYTICAL_TABLE);
                int removed;
                try (Statement stmt = conn.createStatement()) {
                    removed = stmt.executeUpdate("DELETE FROM " + ANALYTICAL_TABLE + " a WHERE EXISTS ("
                        + "SELECT 1 FROM " + ANALYTICAL_TABLE + " b WHERE b.dedup_key = a.dedup_key "
                        + "AND (b.version > a.version OR (b.version = a.version AND b.row_id > a.row_id)))");
                }
                conn.commit();
                compactedRows.addAndGet(removed);
                if (removed > 0) {
                    log.debug("Compacted {} superseded analytical rows in '{}'", removed, getResourceName());
                }
                return removed;
            } catch (SQLException e) {
                rollbackQuietly(conn);
                throw e;
            }
        } catch (SQLException e) {
            writeErrors.incrementAndGet();
            throw translate(e, "Analytical compaction");
        }
    }

    private void compactQuietly() {
        try {
            compactAnalytical();
        } catch (StorageException e) {
            log.warn("Scheduled analytical compaction of '{}' failed: {}", getResourceName(), e.getMessage());
            recordError("COMPACTION_FAILED", "Scheduled analytical compaction failed", e.getMessage());
        }
    }

    // ========================================================================
    // Checkpoints
    // ========================================================================

    @Override
    protected void doCommitCheckpoint(Connection conn, String pipelineId, long batchId,
                                      Map<Integer, Long> offsets) throws StorageException {
        try {
            ensureTables(conn, CHECKPOINT_TABLE);
            Map<Integer, Long> merged = new TreeMap<>(readOffsets(conn, pipelineId));
            offsets.forEach((partition, offset) -> merged.merge(partition, offset, Math::max));

            OffsetDateTime committedAt = toTimestamp(Instant.now());
            try (PreparedStatement stmt = conn.prepareStatement(
                    "MERGE INTO " + CHECKPOINT_TABLE + " (pipeline_id, partition_id, log_offset, batch_id, committed_at) "
                        + "KEY (pipeline_id, partition_id) VALUES (?, ?, ?, ?, ?)")) {
                for (Map.Entry<Integer, Long> entry : merged.entrySet()) {
                    stmt.setString(1, pipelineId);
                    stmt.setInt(2, entry.getKey());
                    stmt.setLong(3, entry.getValue());
                    stmt.setLong(4, batchId);
                    stmt.setObject(5, committedAt);
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }
            conn.commit();
            checkpointCommits.incrementAndGet();
            diskWritesCounter.recordCount();
        } catch (SQLException e) {
            rollbackQuietly(conn);
            writeErrors.incrementAndGet();
            throw translate(e, "Checkpoint commit for batch " + batchId);
        }
    }

    @Override
    protected Checkpoint doLoadCheckpoint(Connection conn, String pipelineId) throws StorageException {
        try {
            ensureTables(conn, CHECKPOINT_TABLE);
            Map<Integer, Long> offsets = new TreeMap<>();
            long batchId = 0L;
            Instant committedAt = null;
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT partition_id, log_offset, batch_id, committed_at FROM " + CHECKPOINT_TABLE + " WHERE pipeline_id = ?")) {
                stmt.setString(1, pipelineId);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        offsets.put(rs.getInt(1), rs.getLong(2));
                        batchId = Math.max(batchId, rs.getLong(3));
                        Instant at = rs.getObject(4, OffsetDateTime.class).toInstant();
                        if (committedAt == null || at.isAfter(committedAt)) {
                            committedAt = at;
                        }
                    }
                }
            }
            conn.commit();
            return offsets.isEmpty() ? Checkpoint.empty() : new Checkpoint(offsets, batchId, committedAt);
        } catch (SQLException e) {
            rollbackQuietly(conn);
            readErrors.incrementAndGet();
            throw translate(e, "Checkpoint load for pipeline " + pipelineId);
        }
    }

    private Map<Integer, Long> readOffsets(Connection conn, String pipelineId) throws SQLException {
        Map<Integer, Long> offsets = new HashMap<>();
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT partition_id, log_offset FROM " + CHECKPOINT_TABLE + " WHERE pipeline_id = ?")) {
            stmt.setString(1, pipelineId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    offsets.put(rs.getInt(1), rs.getLong(2));
                }
            }
        }
        return offsets;
    }

    /**
     * @return All pipeline ids with a stored checkpoint, sorted.
     */
    public Set<String> listCheckpointedPipelines() throws StorageException {
        try (Connection conn = acquireDedicatedConnection()) {
            ensureTables(conn, CHECKPOINT_TABLE);
            Set<String> ids = new TreeSet<>();
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT DISTINCT pipeline_id FROM " + CHECKPOINT_TABLE)) {
                while (rs.next()) {
                    ids.add(rs.getString(1));
                }
            }
            conn.commit();
            return ids;
        } catch (SQLException e) {
            readErrors.incrementAndGet();
            throw translate(e, "Listing checkpoints");
        }
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private long querySingleLong(Connection conn, String table, String sql) throws StorageException {
        try {
            ensureTables(conn, table);
            long value;
            try (Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery(sql)) {
                rs.next();
                value = rs.getLong(1);
            }
            conn.commit();
            return value;
        } catch (SQLException e) {
            rollbackQuietly(conn);
            readErrors.incrementAndGet();
            throw translate(e, "Query on " + table);
        }
    }

    private static OffsetDateTime toTimestamp(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static void rollbackQuietly(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException rollbackEx) {
            log.warn("Rollback failed (connection may be closed): {}", rollbackEx.getMessage());
        }
    }

    /**
     * Maps an H2 failure to the storage error taxonomy: lock and key collisions are conflicts,
     * cancelled statements are timeouts, everything else makes the store unavailable for the batch.
     */
    static StorageException translate(SQLException e, String operation) {
        int code = e.getErrorCode();
        String message = operation + " failed: " + e.getMessage();
        if (e instanceof SQLTimeoutException || code == STATEMENT_WAS_CANCELED) {
            return new TransactionTimeoutException(message, e);
        }
        if (e instanceof SQLTransactionRollbackException
                || code == DUPLICATE_KEY || code == LOCK_TIMEOUT || code == DEADLOCK || code == CONCURRENT_UPDATE) {
            return new TransactionConflictException(message, e);
        }
        return new StorageUnavailableException(message, e);
    }

    @Override
    protected void closeConnectionPool() {
        if (compactionExecutor != null) {
            compactionExecutor.shutdownNow();
        }
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.debug("H2 database '{}' connection pool closed", getResourceName());
        }
    }

    @Override
    public UsageState getUsageState(String usageType) {
        if (dataSource == null || dataSource.isClosed()) {
            return UsageState.FAILED;
        }
        return super.getUsageState(usageType);
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("h2_disk_writes_per_sec", diskWritesCounter.getRate());
        metrics.put("analytical_rows_compacted", compactedRows.get());
        if (dataSource != null && !dataSource.isClosed() && dataSource.getHikariPoolMXBean() != null) {
            metrics.put("h2_pool_active_connections", dataSource.getHikariPoolMXBean().getActiveConnections());
            metrics.put("h2_pool_idle_connections", dataSource.getHikariPoolMXBean().getIdleConnections());
            metrics.put("h2_pool_threads_awaiting", dataSource.getHikariPoolMXBean().getThreadsAwaitingConnection());
        }
    }
}
