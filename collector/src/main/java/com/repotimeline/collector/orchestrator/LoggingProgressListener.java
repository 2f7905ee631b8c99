package com.repotimeline.collector.orchestrator;

import com.repotimeline.collector.client.Platform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports run progress through SLF4J, for headless invocations.
 */
public class LoggingProgressListener implements ProgressListener {

    private static final Logger logger = LoggerFactory.getLogger(LoggingProgressListener.class);

    @Override
    public void onResolvingRepositories(Platform platform, String identity) {
        logger.info("Fetching repositories for '{}' on {}...", identity, platform.displayName());
    }

    @Override
    public void onRepositoriesResolved(int count) {
        logger.info("Found {} repositories", count);
    }

    @Override
    public void onProcessingRepository(int index, int total, String repository) {
        logger.info("Processing {} ({}/{})", repository, index, total);
    }

    @Override
    public void onRepositoryProcessed(String repository, int commitCount) {
        logger.info("{}: {} commits", repository, commitCount);
    }

    @Override
    public void onRepositorySkipped(String repository, String reason) {
        logger.info("Skipped {}: {}", repository, reason);
    }
}
