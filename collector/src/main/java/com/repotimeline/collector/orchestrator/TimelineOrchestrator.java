package com.repotimeline.collector.orchestrator;

import com.repotimeline.collector.aggregate.DateBucketer;
import com.repotimeline.collector.client.ErrorKind;
import com.repotimeline.collector.client.GitPlatformProvider;
import com.repotimeline.collector.client.Platform;
import com.repotimeline.collector.client.ProviderException;
import com.repotimeline.collector.client.ProviderFactory;
import com.repotimeline.collector.model.Commit;
import com.repotimeline.collector.model.DailySeries;
import com.repotimeline.collector.model.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Coordinates one timeline run: resolve repositories, fetch each repository's commits, bucket
 * them per day, and assemble the {@link IngestionResult}.
 *
 * <p>Failures while discovering repositories abort the run. Failures for a single repository are
 * recorded as skips and never stop its siblings. Repositories are processed in input order; with
 * a concurrency above one they are fetched by a worker pool and reassembled in input order.</p>
 *
 * <p>Cancellation: interrupting the calling thread stops the run before the next repository
 * starts. An in-flight request is allowed to complete.</p>
 */
public class TimelineOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(TimelineOrchestrator.class);

    private final ProviderFactory providerFactory;
    private final ProgressListener listener;
    private final int concurrency;

    public TimelineOrchestrator(ProviderFactory providerFactory) {
        this(providerFactory, ProgressListener.NONE, 1);
    }

    public TimelineOrchestrator(ProviderFactory providerFactory, ProgressListener listener, int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, was " + concurrency);
        }
        this.providerFactory = providerFactory;
        this.listener = listener != null ? listener : ProgressListener.NONE;
        this.concurrency = concurrency;
    }

    /**
     * Runs the full pipeline for one platform and identity.
     *
     * @throws IllegalArgumentException if the platform or identity is missing
     * @throws TimelineException        if repository discovery fails, or no repository yields commits
     * @throws InterruptedException     if the calling thread is interrupted between repositories
     */
    public IngestionResult run(TimelineRequest request) throws TimelineException, InterruptedException {
        Instant runStart = Instant.now();

        if (request.platform() == null) {
            throw new IllegalArgumentException("A platform is required");
        }
        if (request.identity() == null || request.identity().isBlank()) {
            throw new IllegalArgumentException("An identity is required");
        }
        Platform platform = request.platform();
        String identity = request.identity().trim();

        logger.info("Starting timeline collection for '{}' on {}", identity, platform.displayName());
        GitPlatformProvider provider = providerFactory.create(platform, identity);

        List<String> repositories = resolveRepositories(provider, platform, identity, request);

        List<RepositoryOutcome> outcomes = concurrency == 1 || repositories.size() < 2
                ? processSequentially(provider, identity, repositories, request.includeMergeCommits())
                : processConcurrently(provider, identity, repositories, request.includeMergeCommits());

        IngestionResult result = aggregate(platform, identity, outcomes);
        logSummary(result, Instant.now().toEpochMilli() - runStart.toEpochMilli());
        return result;
    }

    // -------------------------------------------------------------------------
    // Repository discovery
    // -------------------------------------------------------------------------

    private List<String> resolveRepositories(GitPlatformProvider provider, Platform platform, String identity,
                                             TimelineRequest request)
            throws TimelineException, InterruptedException {
        if (!request.explicitRepositories().isEmpty()) {
            logger.info("Using {} explicitly requested repositories", request.explicitRepositories().size());
            return request.explicitRepositories();
        }

        listener.onResolvingRepositories(platform, identity);
        List<Repository> repositories;
        try {
            repositories = provider.listRepositories(identity);
        } catch (ProviderException e) {
            logger.debug("Repository discovery failed for '{}' on {}", identity, platform.displayName(), e);
            throw new TimelineException(e.kind(), "Failed to fetch repositories for '" + identity + "' on "
                    + platform.displayName() + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            logger.debug("Repository discovery failed for '{}' on {}", identity, platform.displayName(), e);
            throw new TimelineException(ErrorKind.PROVIDER_ERROR, "Failed to fetch repositories for '"
                    + identity + "' on " + platform.displayName() + ": " + describe(e), e);
        }

        if (repositories.isEmpty()) {
            throw new TimelineException(ErrorKind.NO_DATA,
                    "No repositories found for '" + identity + "' on " + platform.displayName());
        }
        listener.onRepositoriesResolved(repositories.size());
        logger.info("Found {} repositories", repositories.size());
        return repositories.stream().map(Repository::name).toList();
    }

    // -------------------------------------------------------------------------
    // Per-repository processing
    // -------------------------------------------------------------------------

    private List<RepositoryOutcome> processSequentially(GitPlatformProvider provider, String identity,
                                                        List<String> repositories, boolean includeMerges)
            throws InterruptedException {
        List<RepositoryOutcome> outcomes = new ArrayList<>(repositories.size());
        for (int i = 0; i < repositories.size(); i++) {
            if (Thread.interrupted()) {
                throw new InterruptedException("Run cancelled before processing " + repositories.get(i));
            }
            outcomes.add(processRepository(provider, identity, repositories.get(i), i + 1,
                    repositories.size(), includeMerges));
        }
        return outcomes;
    }

    private List<RepositoryOutcome> processConcurrently(GitPlatformProvider provider, String identity,
                                                        List<String> repositories, boolean includeMerges)
            throws InterruptedException {
        int workers = Math.min(concurrency, repositories.size());
        logger.debug("Fetching {} repositories with {} workers", repositories.size(), workers);
        ExecutorService executor = Executors.newFixedThreadPool(workers, workerThreadFactory());

        try {
            List<Future<RepositoryOutcome>> futures = new ArrayList<>(repositories.size());
            for (int i = 0; i < repositories.size(); i++) {
                String repository = repositories.get(i);
                int index = i + 1;
                futures.add(executor.submit(() -> {
                    if (Thread.interrupted()) {
                        throw new InterruptedException("Run cancelled before processing " + repository);
                    }
                    return processRepository(provider, identity, repository, index,
                            repositories.size(), includeMerges);
                }));
            }

            List<RepositoryOutcome> outcomes = new ArrayList<>(repositories.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof InterruptedException) {
                        throw new InterruptedException("Run cancelled while processing " + repositories.get(i));
                    }
                    logger.error("Worker failed for {}", repositories.get(i), cause);
                    outcomes.add(RepositoryOutcome.skipped(repositories.get(i), describe(cause)));
                }
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    RepositoryOutcome processRepository(GitPlatformProvider provider, String identity, String repository,
                                        int index, int total, boolean includeMerges)
            throws InterruptedException {
        listener.onProcessingRepository(index, total, repository);

        List<Commit> commits;
        try {
            commits = provider.listCommits(identity, repository);
        } catch (ProviderException e) {
            logger.warn("Skipped {}: {}", repository, e.getMessage());
            listener.onRepositorySkipped(repository, e.getMessage());
            return RepositoryOutcome.skipped(repository, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected failure fetching commits for {}", repository, e);
            listener.onRepositorySkipped(repository, describe(e));
            return RepositoryOutcome.skipped(repository, describe(e));
        }

        if (!includeMerges) {
            commits = commits.stream().filter(c -> !c.merge()).toList();
        }

        if (commits.isEmpty()) {
            logger.warn("Skipped {}: {}", repository, SkippedRepository.NO_COMMITS);
            listener.onRepositorySkipped(repository, SkippedRepository.NO_COMMITS);
            return RepositoryOutcome.empty(repository);
        }

        DailySeries series = DateBucketer.bucket(repository, commits);
        listener.onRepositoryProcessed(repository, commits.size());
        logger.debug("{}: {} commits over {} days", repository, commits.size(), series.labels().size());
        return RepositoryOutcome.success(repository, series);
    }

    // -------------------------------------------------------------------------
    // Aggregation
    // -------------------------------------------------------------------------

    private IngestionResult aggregate(Platform platform, String identity, List<RepositoryOutcome> outcomes)
            throws TimelineException {
        List<DailySeries> series = new ArrayList<>();
        List<SkippedRepository> skipped = new ArrayList<>();
        int totalCommits = 0;

        for (RepositoryOutcome outcome : outcomes) {
            if (outcome.success()) {
                series.add(outcome.series());
                totalCommits += outcome.series().totalCommits();
            } else {
                skipped.add(outcome.skipped());
            }
        }

        if (series.isEmpty()) {
            long failed = skipped.stream().filter(SkippedRepository::failed).count();
            if (failed > 0) {
                throw new TimelineException(ErrorKind.NO_DATA, "No data to generate timeline for '" + identity
                        + "' on " + platform.displayName() + ": all repositories failed or are empty ("
                        + failed + " failed, " + (skipped.size() - failed) + " empty)");
            }
            throw new TimelineException(ErrorKind.NO_DATA, "No repositories with commits found for '"
                    + identity + "' on " + platform.displayName());
        }

        return new IngestionResult(series, totalCommits, skipped, outcomes.size());
    }

    private void logSummary(IngestionResult result, long durationMs) {
        logger.info("=== Timeline Summary ===");
        logger.info("Total duration: {}ms", durationMs);
        logger.info("Repositories: {} processed, {} included, {} skipped",
                result.processedCount(), result.series().size(), result.skippedRepositories().size());
        logger.info("Total commits analyzed: {}", result.totalCommitsAnalyzed());

        if (result.hasSkips()) {
            result.skippedRepositories()
                    .forEach(s -> logger.warn("  SKIPPED: {} - {}", s.repository(), s.reason()));
        }
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "timeline-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
