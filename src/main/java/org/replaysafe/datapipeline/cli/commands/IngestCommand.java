package org.replaysafe.datapipeline.cli.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.replaysafe.datapipeline.ServiceManager;
import org.replaysafe.datapipeline.api.resources.IContextualResource;
import org.replaysafe.datapipeline.api.resources.IResource;
import org.replaysafe.datapipeline.api.resources.ResourceContext;
import org.replaysafe.datapipeline.api.resources.log.IEventLogWriter;
import org.replaysafe.datapipeline.cli.CommandLineInterface;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Appends every non-blank line of a JSON-lines file to the event log, partitioned by
 * {@code principal_id}. Lines are stored verbatim; validation happens when the pipeline reads them.
 */
@Command(name = "ingest", description = "Appends a JSON-lines file to the event log.")
public class IngestCommand implements Callable<Integer> {

    static final String PARTITION_KEY_FIELD = "principal_id";

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", paramLabel = "FILE", description = "JSON-lines file, one event per line.")
    private File file;

    @Option(names = "--log", defaultValue = "event-log", description = "Name of the event log resource (default: ${DEFAULT-VALUE}).")
    private String logResource;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public Integer call() throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (!file.isFile()) {
            err.printf("Input file not found: %s%n", file.getAbsolutePath());
            return 1;
        }

        ServiceManager serviceManager = parent.createServiceManager(false);
        try {
            IResource resource = serviceManager.getResource(logResource).orElse(null);
            if (!(resource instanceof IContextualResource contextual)) {
                err.printf("'%s' is not a configured event log resource.%n", logResource);
                return 1;
            }
            IResource wrapped = contextual.getWrappedResource(
                new ResourceContext("cli", "ingest", "log-write", logResource, Map.of()));
            if (!(wrapped instanceof IEventLogWriter writer)) {
                err.printf("Resource '%s' does not support log-write.%n", logResource);
                return 1;
            }

            long appended = 0;
            long unkeyed = 0;
            try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.isBlank()) {
                        continue;
                    }
                    String partitionKey = partitionKey(line);
                    if (partitionKey.isEmpty()) {
                        unkeyed++;
                    }
                    writer.append(partitionKey, line);
                    appended++;
                }
            }
            out.printf("Appended %d records to '%s' (%d partitions).%n", appended, logResource, writer.getPartitionCount());
            if (unkeyed > 0) {
                out.printf("%d records had no usable %s and will be rejected by the pipeline.%n", unkeyed, PARTITION_KEY_FIELD);
            }
            return 0;
        } finally {
            serviceManager.shutdown();
        }
    }

    String partitionKey(String line) {
        try {
            JsonNode node = mapper.readTree(line);
            JsonNode key = node == null ? null : node.get(PARTITION_KEY_FIELD);
            return key != null && key.isTextual() ? key.textValue().trim() : "";
        } catch (JsonProcessingException e) {
            return "";
        }
    }
}
