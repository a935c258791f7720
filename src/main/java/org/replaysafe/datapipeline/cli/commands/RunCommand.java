package org.replaysafe.datapipeline.cli.commands;

import org.replaysafe.datapipeline.ServiceManager;
import org.replaysafe.datapipeline.cli.CommandLineInterface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Starts the pipeline and runs it until interrupted (Ctrl-C)."
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = "--service", description = "Start only this service instead of the configured startup sequence.")
    private String serviceName;

    @Override
    public Integer call() {
        final ServiceManager serviceManager = parent.createServiceManager(serviceName == null);
        if (serviceName != null) {
            LOGGER.info("Starting single service '{}'", serviceName);
            serviceManager.startService(serviceName);
        }

        final Thread shutdownHook = new Thread(() -> {
            LOGGER.info("Shutdown sequence initiated...");
            serviceManager.shutdown();
            LOGGER.info("Pipeline stopped. Goodbye.");
        }, "shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        LOGGER.info("Pipeline running until interrupted.");

        // The shutdown hook stops the services; this thread only keeps the JVM alive.
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.info("Main thread interrupted.");
        }
        return 0;
    }
}
