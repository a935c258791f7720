package org.replaysafe.datapipeline.services.pipeline.components;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.replaysafe.datapipeline.api.contracts.BatchStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one JSON line per dispatched batch to the {@code org.replaysafe.datapipeline.batchstats}
 * logger, so the records can be routed to their own appender and parsed offline.
 */
public class BatchStatsLogger {

    static final String LOGGER_NAME = "org.replaysafe.datapipeline.batchstats";

    private static final Logger statsLog = LoggerFactory.getLogger(LOGGER_NAME);
    private static final Logger log = LoggerFactory.getLogger(BatchStatsLogger.class);

    private final ObjectMapper mapper;

    public BatchStatsLogger() {
        this(new ObjectMapper());
    }

    public BatchStatsLogger(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public void log(BatchStats stats) {
        if (!statsLog.isInfoEnabled()) {
            return;
        }
        statsLog.info(toJson(stats));
    }

    String toJson(BatchStats stats) {
        try {
            return mapper.writeValueAsString(stats);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize stats of batch {}: {}", stats.batchId(), e.getMessage());
            return stats.toString();
        }
    }
}
