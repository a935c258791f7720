package org.replaysafe.datapipeline.resources.log;

import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.replaysafe.datapipeline.api.resources.log.LogRecord;
import org.replaysafe.datapipeline.utils.H2SchemaUtil;
import org.replaysafe.datapipeline.utils.PathExpansion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable event log stored in an H2 table. Survives restarts, which is what crash-replay
 * relies on.
 * <p>
 * Options: {@code jdbcUrl} or {@code dbPath}, {@code username}, {@code password},
 * {@code maxPoolSize} (default 4), {@code partitions} (default 4).
 */
public class H2EventLog extends AbstractEventLogResource {

    private static final Logger log = LoggerFactory.getLogger(H2EventLog.class);

    static final String TABLE = "event_log";

    private final HikariDataSource dataSource;
    private final Object[] partitionLocks;
    private final long[] nextOffsets;

    public H2EventLog(String name, Config options) {
        super(name, options);

        String jdbcUrl;
        if (options.hasPath("jdbcUrl")) {
            jdbcUrl = options.getString("jdbcUrl");
        } else if (options.hasPath("dbPath")) {
            jdbcUrl = "jdbc:h2:" + options.getString("dbPath");
        } else {
            throw new IllegalArgumentException("Either 'jdbcUrl' or 'dbPath' must be configured for H2EventLog '" + name + "'.");
        }
        jdbcUrl = PathExpansion.expandPath(jdbcUrl);
        if (jdbcUrl.startsWith("jdbc:h2:mem:") && !jdbcUrl.toUpperCase().contains("DB_CLOSE_DELAY")) {
            jdbcUrl = jdbcUrl + ";DB_CLOSE_DELAY=-1";
        }

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setDriverClassName("org.h2.Driver");
        hikariConfig.setUsername(options.hasPath("username") ? options.getString("username") : "sa");
        hikariConfig.setPassword(options.hasPath("password") ? options.getString("password") : "");
        hikariConfig.setMaximumPoolSize(options.hasPath("maxPoolSize") ? options.getInt("maxPoolSize") : 4);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setPoolName(name);

        try {
            this.dataSource = new HikariDataSource(hikariConfig);
        } catch (Exception e) {
            String errorMsg = String.format("Failed to open event log '%s' at %s: %s", name, jdbcUrl, e.getMessage());
            log.error(errorMsg);
            throw new RuntimeException(errorMsg, e);
        }

        this.partitionLocks = new Object[partitions];
        this.nextOffsets = new long[partitions];
        for (int i = 0; i < partitions; i++) {
            partitionLocks[i] = new Object();
        }

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            H2SchemaUtil.executeDdlIfNotExists(conn,
                "CREATE TABLE IF NOT EXISTS " + TABLE + " ("
                    + "partition_id INT NOT NULL, "
                    + "log_offset BIGINT NOT NULL, "
                    + "payload CHARACTER LARGE OBJECT NOT NULL, "
                    + "appended_at TIMESTAMP WITH TIME ZONE NOT NULL, "
                    + "PRIMARY KEY (partition_id, log_offset))",
                TABLE);
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT partition_id, MAX(log_offset) FROM " + TABLE + " GROUP BY partition_id")) {
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        int partition = rs.getInt(1);
                        if (partition < partitions) {
                            nextOffsets[partition] = rs.getLong(2) + 1;
                        } else {
                            log.warn("Event log '{}' contains records of partition {} beyond the configured {} partitions",
                                name, partition, partitions);
                        }
                    }
                }
            }
            conn.commit();
        } catch (SQLException e) {
            dataSource.close();
            String errorMsg = String.format("Failed to initialize event log table of '%s': %s", name, e.getMessage());
            log.error(errorMsg);
            throw new RuntimeException(errorMsg, e);
        }
    }

    @Override
    protected LogRecord doAppend(int partition, String value) {
        synchronized (partitionLocks[partition]) {
            long offset = nextOffsets[partition];
            try (Connection conn = dataSource.getConnection();
                 PreparedStatement stmt = conn.prepareStatement(
                     "INSERT INTO " + TABLE + " (partition_id, log_offset, payload, appended_at) VALUES (?, ?, ?, ?)")) {
                conn.setAutoCommit(true);
                stmt.setInt(1, partition);
                stmt.setLong(2, offset);
                stmt.setString(3, value);
                stmt.setObject(4, OffsetDateTime.now(ZoneOffset.UTC));
                stmt.executeUpdate();
            } catch (SQLException e) {
                log.warn("Append to partition {} of event log '{}' failed: {}", partition, getResourceName(), e.getMessage());
                recordError("APPEND_FAILED", "Event log append failed", "Partition: " + partition + ", Error: " + e.getMessage());
                throw new IllegalStateException("Append to event log '" + getResourceName() + "' failed", e);
            }
            nextOffsets[partition] = offset + 1;
            return new LogRecord(partition, offset, value);
        }
    }

    @Override
    protected List<LogRecord> doRead(int partition, long afterOffset, int maxRecords) {
        List<LogRecord> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(
                 "SELECT log_offset, payload FROM " + TABLE
                     + " WHERE partition_id = ? AND log_offset > ? ORDER BY log_offset LIMIT ?")) {
            stmt.setInt(1, partition);
            stmt.setLong(2, afterOffset);
            stmt.setInt(3, maxRecords);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(new LogRecord(partition, rs.getLong(1), rs.getString(2)));
                }
            }
        } catch (SQLException e) {
            log.warn("Poll from event log '{}' failed: {}", getResourceName(), e.getMessage());
            recordError("POLL_FAILED", "Event log poll failed", e.getMessage());
            throw new IllegalStateException("Poll from event log '" + getResourceName() + "' failed", e);
        }
        return result;
    }

    @Override
    public long getEndOffset(int partition) {
        checkPartition(partition);
        synchronized (partitionLocks[partition]) {
            return nextOffsets[partition] - 1;
        }
    }

    @Override
    public void close() throws Exception {
        super.close();
        if (!dataSource.isClosed()) {
            dataSource.close();
            log.debug("Event log '{}' closed", getResourceName());
        }
    }
}
