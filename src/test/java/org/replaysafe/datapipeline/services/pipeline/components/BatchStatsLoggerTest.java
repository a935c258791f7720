package org.replaysafe.datapipeline.services.pipeline.components;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.replaysafe.datapipeline.api.contracts.BatchStats;
import org.replaysafe.junit.extensions.logging.ExpectLog;
import org.replaysafe.junit.extensions.logging.LogLevel;
import org.replaysafe.junit.extensions.logging.LogWatchExtension;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class BatchStatsLoggerTest {

    private final BatchStats stats = new BatchStats(7, 100, 2, 8, 90, 80, 5, 5, 1, 42, BatchStats.Outcome.COMMITTED);

    @Test
    void toJson_writesOneFlatObject() throws Exception {
        String json = new BatchStatsLogger().toJson(stats);

        assertThat(json).doesNotContain("\n");
        JsonNode node = new ObjectMapper().readTree(json);
        assertThat(node.get("batchId").asLong()).isEqualTo(7);
        assertThat(node.get("duplicatesInBatch").asInt()).isEqualTo(8);
        assertThat(node.get("rowsUnchanged").asInt()).isEqualTo(5);
        assertThat(node.get("outcome").asText()).isEqualTo("COMMITTED");
    }

    @Test
    @ExpectLog(level = LogLevel.INFO, loggerPattern = BatchStatsLogger.LOGGER_NAME, messagePattern = "(?=.*\"batchId\":7\\b)(?=.*\"outcome\":\"COMMITTED\")\\{.*\\}")
    void log_writesToDedicatedLogger() {
        new BatchStatsLogger().log(stats);
    }
}
