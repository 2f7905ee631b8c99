package com.repotimeline.collector.orchestrator;

import com.repotimeline.collector.aggregate.StatisticsFormatter;
import com.repotimeline.collector.client.AbstractPlatformProvider;
import com.repotimeline.collector.client.Platform;
import com.repotimeline.collector.client.PlatformProviders;
import com.repotimeline.collector.config.AppConfig;
import com.repotimeline.collector.export.ChartDataExporter;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Main entry point for the repo timeline collector.
 * Parses CLI arguments, initializes components, runs the collection pipeline,
 * and exits with appropriate status codes.
 *
 * <p>Usage:
 * <pre>
 *   java -jar collector.jar --platform github --user octocat
 *   java -jar collector.jar --platform gitlab --user jdoe --repos api,web --no-merges --output timeline.json
 * </pre>
 */
public class TimelineApp {

    private static final Logger logger = LoggerFactory.getLogger(TimelineApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = "Usage: --platform <github|gitlab|bitbucket|sourcehut> --user <name>"
            + " [--repos a,b,c] [--no-merges] [--output file.json] [--quiet]";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        CliOptions options;
        try {
            options = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return EXIT_USAGE;
        }

        logger.info("Starting repo timeline collector (platform: {}, user: {})",
                options.platform().id(), options.identity());

        try {
            AppConfig config = new AppConfig();
            OkHttpClient httpClient = AbstractPlatformProvider.defaultHttpClient(config.getHttpTimeout());
            PlatformProviders providers = new PlatformProviders(httpClient, config.getCredentials());
            ProgressListener listener = options.quiet() ? ProgressListener.NONE : new LoggingProgressListener();

            TimelineOrchestrator orchestrator = new TimelineOrchestrator(providers, listener,
                    config.getConcurrency());
            IngestionResult result = orchestrator.run(options.toRequest());

            printSummary(result);

            if (options.output() != null) {
                new ChartDataExporter().export(options.platform(), options.identity(), result, options.output());
            }

            logger.info("Repo timeline collector finished successfully.");
            return EXIT_OK;

        } catch (TimelineException e) {
            logger.error("Timeline collection failed ({}): {}", e.kind(), e.getMessage());
            System.err.println(e.getMessage());
            return EXIT_FAILURE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Timeline collection cancelled");
            return EXIT_FAILURE;
        } catch (IOException e) {
            logger.error("Failed to write timeline data", e);
            return EXIT_FAILURE;
        } catch (Exception e) {
            logger.error("Fatal error during timeline collection", e);
            return EXIT_FAILURE;
        }
    }

    static CliOptions parseArgs(String[] args) {
        Platform platform = null;
        String identity = null;
        List<String> repositories = new ArrayList<>();
        boolean includeMerges = true;
        Path output = null;
        boolean quiet = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--platform", "-p" -> platform = Platform.fromId(value(args, ++i, arg));
                case "--user", "-u" -> identity = value(args, ++i, arg);
                case "--repos", "-r" -> repositories.addAll(splitRepositories(value(args, ++i, arg)));
                case "--no-merges" -> includeMerges = false;
                case "--output", "-o" -> output = Path.of(value(args, ++i, arg));
                case "--quiet", "-q" -> quiet = true;
                default -> throw new IllegalArgumentException("Unknown argument: " + arg);
            }
        }

        if (platform == null) {
            throw new IllegalArgumentException("Missing required argument: --platform");
        }
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("Missing required argument: --user");
        }
        return new CliOptions(platform, identity.trim(), List.copyOf(repositories), includeMerges, output, quiet);
    }

    private static String value(String[] args, int index, String flag) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException("Missing value for " + flag);
        }
        return args[index];
    }

    static List<String> splitRepositories(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .toList();
    }

    private static void printSummary(IngestionResult result) {
        System.out.println();
        System.out.println("=== Repo Timeline Summary ===");
        System.out.println("Total commits analyzed: " + result.totalCommitsAnalyzed());
        System.out.println("Repositories included:  " + result.series().size()
                + " of " + result.processedCount());

        if (result.hasSkips()) {
            System.out.println();
            System.out.println("Skipped repositories:");
            result.skippedRepositories()
                    .forEach(s -> System.out.println("  - " + s.repository() + ": " + s.reason()));
        }

        System.out.println();
        System.out.print(StatisticsFormatter.format(result.statistics()));
        System.out.println();
    }

    record CliOptions(
            Platform platform,
            String identity,
            List<String> repositories,
            boolean includeMerges,
            Path output,
            boolean quiet
    ) {

        TimelineRequest toRequest() {
            return new TimelineRequest(platform, identity, repositories, includeMerges);
        }
    }
}
