package org.replaysafe.datapipeline.cli;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;
import org.replaysafe.datapipeline.ServiceManager;
import org.replaysafe.datapipeline.cli.commands.IngestCommand;
import org.replaysafe.datapipeline.cli.commands.RunCommand;
import org.replaysafe.datapipeline.cli.commands.StatusCommand;
import org.replaysafe.datapipeline.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

@Command(
    name = "replaysafe",
    mixinStandardHelpOptions = true,
    version = "ReplaySafe Pipeline 1.0",
    description = "Replay-safe micro-batch deduplication pipeline",
    subcommands = {
        RunCommand.class,
        IngestCommand.class,
        StatusCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    static final String CONFIG_FILE_NAME = "replaysafe.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("replaysafe");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        // Precedence: --config, then -Dconfig.file, then ./replaysafe.conf, then classpath defaults.
        // System properties and environment variables override any file.
        final File selectedFile;
        if (this.configFile != null) {
            if (!this.configFile.exists()) {
                throw new CommandLine.ParameterException(new CommandLine(this),
                    "Configuration file specified via --config was not found: " + this.configFile.getAbsolutePath());
            }
            logger.info("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
            selectedFile = this.configFile;
        } else {
            final String systemConfigPath = System.getProperty("config.file");
            if (systemConfigPath != null && !systemConfigPath.isBlank()) {
                final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
                if (!systemConfigFile.exists()) {
                    throw new CommandLine.ParameterException(new CommandLine(this),
                        "Configuration file specified via -Dconfig.file was not found: " + systemConfigFile.getAbsolutePath());
                }
                logger.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile.getAbsolutePath());
                selectedFile = systemConfigFile;
            } else {
                final File cwdConfigFile = new File(CONFIG_FILE_NAME);
                if (cwdConfigFile.exists()) {
                    logger.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
                    selectedFile = cwdConfigFile;
                } else {
                    logger.info("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
                    selectedFile = null;
                }
            }
        }

        try {
            this.config = loadConfig(selectedFile);
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                "Failed to load or parse configuration: " + e.getMessage(), e, null, null);
        }

        LoggingConfigurator.configure(config);
        reconfigureLogback(logger);
        initialized = true;
    }

    static Config loadConfig(File file) {
        Config fileConfig = file != null ? ConfigFactory.parseFile(file) : ConfigFactory.empty();
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.load())
                .resolve();
    }

    /**
     * Reloads {@code logback.xml} so the appender selected by the configured format is attached.
     * Levels from the configuration are applied again afterwards because a reload resets them.
     */
    private void reconfigureLogback(Logger logger) {
        final URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
        LoggingConfigurator.reset();
        LoggingConfigurator.configure(config);
        logger.debug("Logback reconfigured from {}", configUrl);
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    /**
     * Builds a {@link ServiceManager} from the loaded configuration.
     *
     * @param autoStart {@code false} to only open resources, e.g. for one-shot commands.
     */
    public ServiceManager createServiceManager(boolean autoStart) {
        Config effective = getConfig().withValue("pipeline.autoStart", ConfigValueFactory.fromAnyRef(autoStart));
        return new ServiceManager(effective);
    }
}
