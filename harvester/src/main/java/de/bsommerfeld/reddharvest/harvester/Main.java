package de.bsommerfeld.reddharvest.harvester;

import ch.qos.logback.classic.Level;
import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.reddharvest.core.concurrent.CancellationToken;
import de.bsommerfeld.reddharvest.core.config.HarvestConfigException;
import de.bsommerfeld.reddharvest.core.config.HarvestConfigLoader;
import de.bsommerfeld.reddharvest.core.config.HarvestConfiguration;
import de.bsommerfeld.reddharvest.core.event.HarvestEventBus;
import de.bsommerfeld.reddharvest.core.util.StorageUtils;
import de.bsommerfeld.reddharvest.reddit.RedditClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Command line entry point.
 *
 * <pre>
 * redd-harvest run [-c FILE] [-s] [-r] [-o NAME] [--debug]
 * redd-harvest setup
 * redd-harvest --version
 * redd-harvest --help
 * </pre>
 *
 * <h3>Exit codes</h3>
 * {@code 0} on success, {@code 1} when the configuration cannot be loaded,
 * the run fails or {@code setup} finds an existing file, {@code 2} on
 * invalid arguments.
 *
 * <h3>Shutdown</h3>
 * A JVM shutdown hook cancels the run and waits briefly for the harvest
 * loop to reach its next cancellation point, so Ctrl+C never leaves a
 * half-written file behind.
 */
public final class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final long SHUTDOWN_GRACE_MILLIS = 10_000;

    private static final String USAGE = """
            Usage: redd-harvest <command> [options]

            Download media from Reddit posts.

            Commands:
              run                  Run the harvester
                -c, --config FILE      Path to config file (default: %s)
                -s, --subreddits-only  Only download from configured subreddits
                -r, --redditors-only   Only download from configured redditors
                -o, --only-name NAME   Only download from the configured entity with this name
                    --debug            Enable debug logging
              setup                Write an example config to the default location

            Options:
              --version            Print the version and exit
              -h, --help           Print this help and exit
            """;

    private Main() {
    }

    public static void main(String[] args) {
        System.exit(execute(args, System.out, System.err));
    }

    static int execute(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            printUsage(err);
            return EXIT_USAGE;
        }
        List<String> rest = Arrays.asList(args).subList(1, args.length);
        switch (args[0]) {
            case "-h", "--help", "help" -> {
                printUsage(out);
                return EXIT_OK;
            }
            case "--version" -> {
                out.println("redd-harvest " + RedditClient.appVersion());
                return EXIT_OK;
            }
            case "setup" -> {
                return setup(StorageUtils.getDefaultConfigFile());
            }
            case "run" -> {
                HarvestRunOptions options;
                try {
                    options = HarvestRunOptions.parse(rest);
                } catch (IllegalArgumentException e) {
                    err.println(e.getMessage());
                    printUsage(err);
                    return EXIT_USAGE;
                }
                return run(options);
            }
            default -> {
                err.println("Unknown command: " + args[0]);
                printUsage(err);
                return EXIT_USAGE;
            }
        }
    }

    // =====================================================================
    // Commands
    // =====================================================================

    static int setup(Path configFile) {
        try {
            return ExampleConfigWriter.writeIfAbsent(configFile) ? EXIT_OK : EXIT_FAILURE;
        } catch (IOException e) {
            LOG.error("Could not write example configuration to '{}'", configFile, e);
            return EXIT_FAILURE;
        }
    }

    static int run(HarvestRunOptions options) {
        if (options.debug()) {
            enableDebugLogging();
        }
        LOG.info("Using config file: {}", options.configFile());

        HarvestConfiguration config;
        try {
            config = new HarvestConfigLoader().load(options.configFile());
        } catch (HarvestConfigException e) {
            LOG.error("Configuration error: {}", e.getMessage());
            LOG.debug("Configuration error details", e);
            return EXIT_FAILURE;
        }

        CancellationToken cancellationToken = new CancellationToken();
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = shutdownHook(cancellationToken, finished);
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            Injector injector = Guice.createInjector(new HarvestModule(config, cancellationToken));
            HarvestEventBus eventBus = injector.getInstance(HarvestEventBus.class);
            eventBus.register(injector.getInstance(HarvestReport.class));

            injector.getInstance(Harvester.class).harvest(options);
            return EXIT_OK;
        } catch (RuntimeException e) {
            LOG.error("Harvest failed", e);
            return EXIT_FAILURE;
        } finally {
            finished.countDown();
            removeShutdownHook(hook);
        }
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private static Thread shutdownHook(CancellationToken token, CountDownLatch finished) {
        return new Thread(() -> {
            LOG.info("Shutdown requested, finishing current download");
            token.cancel();
            try {
                finished.await(SHUTDOWN_GRACE_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "redd-harvest-shutdown");
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM is already shutting down; the hook is running.
            LOG.debug("Shutdown in progress, hook stays registered");
        }
    }

    private static void enableDebugLogging() {
        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logbackRoot) {
            logbackRoot.setLevel(Level.DEBUG);
            LOG.debug("Debug logging enabled");
        }
    }

    private static void printUsage(PrintStream stream) {
        stream.printf(USAGE, StorageUtils.getDefaultConfigFile());
    }
}
