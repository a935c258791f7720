package org.replaysafe.datapipeline.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.replaysafe.datapipeline.ServiceManager;
import org.replaysafe.datapipeline.api.services.IService;
import picocli.CommandLine;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Drives the CLI end to end against file databases in a temporary directory.
 * Reloads the main Logback configuration as a side effect, so no log watching here.
 */
@Tag("integration")
class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private File configFile;

    @BeforeEach
    void setUp() throws IOException {
        String dir = tempDir.toAbsolutePath().toString().replace('\\', '/');
        configFile = tempDir.resolve("replaysafe.conf").toFile();
        Files.writeString(configFile.toPath(), """
            pipeline {
              resources {
                event-log.options.dbPath = "%1$s/event-log"
                merge-db.options.dbPath = "%1$s/merge"
                analytical-db.options {
                  dbPath = "%1$s/analytical"
                  analyticalCompactionIntervalMs = 0
                }
              }
              services.dedup-pipeline.options {
                triggerIntervalMs = 50
                parallelism = 2
              }
            }
            logging.default-level = "WARN"
            """.formatted(dir), StandardCharsets.UTF_8);
    }

    private record Result(int exitCode, String out, String err) {
    }

    private Result execute(String... args) {
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        int exitCode = commandLine.execute(args);
        return new Result(exitCode, out.toString(), err.toString());
    }

    @Test
    void loadConfig_fileOverridesDefaults() {
        Config config = CommandLineInterface.loadConfig(configFile);

        assertThat(config.getInt("pipeline.services.dedup-pipeline.options.parallelism")).isEqualTo(2);
        assertThat(config.getInt("pipeline.services.dedup-pipeline.options.maxRecordsPerTrigger")).isEqualTo(10_000);
        assertThat(config.getString("pipeline.resources.merge-db.className"))
            .isEqualTo("org.replaysafe.datapipeline.resources.database.H2Database");
    }

    @Test
    void missingConfigFile_isAUsageError() {
        Result result = execute("-c", tempDir.resolve("absent.conf").toString(), "status");

        assertThat(result.exitCode()).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(result.out()).isEmpty();
    }

    @Test
    void ingestRunAndStatus_endToEnd() throws Exception {
        Path input = tempDir.resolve("events.jsonl");
        Files.write(input, List.of(
            "{\"principal_id\":\"alice\",\"event_type\":\"login\",\"event_timestamp\":1704067200000,\"payload\":{\"ip\":\"1.2.3.4\"}}",
            "{\"principal_id\":\"alice\",\"event_type\":\"login\",\"event_timestamp\":\"2024-01-01T00:00:00Z\",\"payload\":{\"ip\":\"1.2.3.4\"}}",
            "",
            "{\"principal_id\":\"bob\",\"event_type\":\"logout\",\"event_timestamp\":1704067260000}"), StandardCharsets.UTF_8);

        Result ingest = execute("-c", configFile.toString(), "ingest", input.toString());
        assertThat(ingest.exitCode()).isZero();
        assertThat(ingest.out()).contains("Appended 3 records to 'event-log'");

        CommandLineInterface cli = new CommandLineInterface();
        new CommandLine(cli).parseArgs("-c", configFile.toString());
        ServiceManager serviceManager = cli.createServiceManager(true);
        try {
            await().atMost(Duration.ofSeconds(30)).until(() ->
                serviceManager.getServiceStatus("dedup-pipeline").metrics().get("records_processed").longValue() == 3);
        } finally {
            serviceManager.shutdown();
        }
        assertThat(serviceManager.getServiceStatus("dedup-pipeline").state()).isEqualTo(IService.State.STOPPED);

        Result status = execute("-c", configFile.toString(), "status", "--json");
        assertThat(status.exitCode()).isZero();
        JsonNode report = new ObjectMapper().readTree(status.out());
        assertThat(report.get("mergeRows").asLong()).isEqualTo(2);
        assertThat(report.get("mergeVersionSum").asLong()).isEqualTo(2);
        assertThat(report.get("analyticalKeys").asLong()).isEqualTo(2);
        assertThat(report.path("checkpoints").path("dedup-pipeline").path("batchId").asLong()).isPositive();

        Result text = execute("-c", configFile.toString(), "status");
        assertThat(text.out()).contains("Pipeline: dedup-pipeline").contains("Merge table: 2 rows");
    }
}
