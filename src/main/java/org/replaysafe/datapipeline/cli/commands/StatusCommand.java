package org.replaysafe.datapipeline.cli.commands;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.replaysafe.datapipeline.ServiceManager;
import org.replaysafe.datapipeline.api.contracts.Checkpoint;
import org.replaysafe.datapipeline.api.resources.IContextualResource;
import org.replaysafe.datapipeline.api.resources.IResource;
import org.replaysafe.datapipeline.api.resources.ResourceContext;
import org.replaysafe.datapipeline.api.resources.database.IAnalyticalReader;
import org.replaysafe.datapipeline.api.resources.database.ICheckpointStore;
import org.replaysafe.datapipeline.api.resources.database.IMergeTableReader;
import org.replaysafe.datapipeline.api.resources.database.StorageException;
import org.replaysafe.datapipeline.cli.CommandLineInterface;
import org.replaysafe.datapipeline.resources.database.H2Database;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;

/**
 * Prints checkpoints and row counts straight from the databases. Services are not started.
 */
@Command(name = "status", description = "Shows checkpoints and row counts of the pipeline databases.")
public class StatusCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = "--json", description = "Output the status in JSON format.")
    private boolean json;

    @Option(names = "--merge-db", defaultValue = "merge-db",
            description = "Database resource holding the merge table and checkpoints (default: ${DEFAULT-VALUE}).")
    private String mergeDb;

    @Option(names = "--analytical-db", defaultValue = "analytical-db",
            description = "Database resource holding the analytical table (default: ${DEFAULT-VALUE}).")
    private String analyticalDb;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    record CheckpointView(long batchId, String committedAt, Map<Integer, Long> offsets) {
    }

    record StatusReport(Map<String, CheckpointView> checkpoints, long mergeRows, long mergeVersionSum,
                        Long analyticalRows, Long analyticalKeys) {
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ServiceManager serviceManager = parent.createServiceManager(false);
        try {
            IResource merge = serviceManager.getResource(mergeDb).orElse(null);
            if (!(merge instanceof H2Database mergeDatabase)) {
                err.printf("'%s' is not a configured database resource.%n", mergeDb);
                return 1;
            }
            StatusReport report = collect(mergeDatabase, serviceManager.getResource(analyticalDb).orElse(null));

            if (json) {
                ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
                out.println(mapper.writeValueAsString(report));
            } else {
                printHumanReadable(report, out);
            }
            return 0;
        } catch (StorageException e) {
            err.printf("Failed to read pipeline status: %s%n", e.getMessage());
            return 1;
        } finally {
            serviceManager.shutdown();
        }
    }

    private StatusReport collect(H2Database mergeDatabase, IResource analytical) throws StorageException {
        ICheckpointStore checkpoints = wrap(mergeDatabase, "db-checkpoint", ICheckpointStore.class);
        IMergeTableReader mergeReader = wrap(mergeDatabase, "db-merge-read", IMergeTableReader.class);

        Map<String, CheckpointView> views = new LinkedHashMap<>();
        for (String pipelineId : mergeDatabase.listCheckpointedPipelines()) {
            Checkpoint checkpoint = checkpoints.load(pipelineId);
            views.put(pipelineId, new CheckpointView(
                checkpoint.batchId(),
                checkpoint.committedAt() != null ? checkpoint.committedAt().toString() : null,
                new TreeMap<>(checkpoint.offsets())));
        }

        Long analyticalRows = null;
        Long analyticalKeys = null;
        if (analytical instanceof IContextualResource contextual) {
            IAnalyticalReader reader = wrap(contextual, "db-analytical-read", IAnalyticalReader.class);
            analyticalRows = reader.countRows();
            analyticalKeys = reader.countDistinctKeys();
        }

        return new StatusReport(views, mergeReader.countRows(), mergeReader.sumMergeVersions(), analyticalRows, analyticalKeys);
    }

    private <T> T wrap(IContextualResource resource, String usageType, Class<T> type) {
        ResourceContext context = new ResourceContext("cli", "status", usageType, resource.getResourceName(), Map.of());
        return type.cast(resource.getWrappedResource(context));
    }

    private void printHumanReadable(StatusReport report, PrintWriter out) {
        if (report.checkpoints().isEmpty()) {
            out.println("No checkpoints committed yet.");
        }
        for (Map.Entry<String, CheckpointView> entry : report.checkpoints().entrySet()) {
            CheckpointView view = entry.getValue();
            out.printf("Pipeline: %s, Batch: %d, Committed: %s, Offsets: %s%n",
                entry.getKey(), view.batchId(), view.committedAt(), view.offsets());
        }
        out.printf("Merge table: %d rows, merge_version sum %d%n", report.mergeRows(), report.mergeVersionSum());
        if (report.analyticalRows() != null) {
            out.printf("Analytical table: %d rows, %d distinct keys%n", report.analyticalRows(), report.analyticalKeys());
        } else {
            out.println("Analytical table: not configured");
        }
    }
}
