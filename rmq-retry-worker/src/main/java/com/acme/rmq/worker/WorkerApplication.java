package com.acme.rmq.worker;

import com.acme.rmq.config.ConfigurationException;
import com.acme.rmq.config.Settings;
import com.acme.rmq.core.ConnectivityException;
import com.acme.rmq.dispatch.RetryAwareDispatcher;
import com.acme.rmq.rabbit.RabbitMqTransport;
import com.acme.rmq.spi.BusinessLogic;
import com.acme.rmq.spi.MessageTransport;
import com.acme.rmq.worker.config.DotenvSettingsSource;
import com.acme.rmq.worker.sample.EchoBusinessLogic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Worker process: consumes one queue, runs the business logic and routes failures through the
 * retry and dead-letter queues. Run several processes to scale out; never share a connection.
 */
@Command(
        name = "rmq-retry-worker",
        description = "Consume a RabbitMQ queue with retry and dead-letter routing",
        mixinStandardHelpOptions = true,
        version = "1.0.0"
)
public class WorkerApplication implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(WorkerApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_CONFIGURATION = 2;
    static final int EXIT_CONNECTIVITY = 3;

    @Option(names = {"-d", "--env-dir"}, description = "Directory containing the env file (default: .)", defaultValue = ".")
    private Path envDir;

    @Option(names = {"-f", "--env-file"}, description = "Env file name (default: .env)", defaultValue = ".env")
    private String envFile;

    @Option(names = {"-l", "--logic"}, description = "BusinessLogic implementation class (default: echo sample)")
    private String logicClass = EchoBusinessLogic.class.getName();

    private final Function<Settings, MessageTransport> transportFactory;

    public WorkerApplication() {
        this(RabbitMqTransport::open);
    }

    WorkerApplication(Function<Settings, MessageTransport> transportFactory) {
        this.transportFactory = transportFactory;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new WorkerApplication()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        Settings settings;
        BusinessLogic businessLogic;
        try {
            settings = DotenvSettingsSource.load(envDir, envFile).toSettings();
            businessLogic = BusinessLogicLoader.load(logicClass);
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_CONFIGURATION;
        }
        log.info("Starting worker with {} and logic {}", settings, logicClass);

        try (MessageTransport transport = transportFactory.apply(settings)) {
            Thread shutdownHook = new Thread(transport::stop, "rmq-retry-shutdown");
            Runtime.getRuntime().addShutdownHook(shutdownHook);
            try {
                new RetryAwareDispatcher(settings, transport, businessLogic).run();
            } finally {
                removeShutdownHook(shutdownHook);
            }
            log.info("Worker stopped");
            return EXIT_OK;
        } catch (ConnectivityException e) {
            log.error("Broker connectivity failure, exiting", e);
            return EXIT_CONNECTIVITY;
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, hook stays registered");
        }
    }
}
