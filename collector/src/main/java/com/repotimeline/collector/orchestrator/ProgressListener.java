package com.repotimeline.collector.orchestrator;

import com.repotimeline.collector.client.Platform;

/**
 * Receives progress events from a run. All methods default to no-ops. When the run uses more
 * than one worker, per-repository callbacks arrive from worker threads.
 */
public interface ProgressListener {

    ProgressListener NONE = new ProgressListener() {};

    default void onResolvingRepositories(Platform platform, String identity) {
    }

    default void onRepositoriesResolved(int count) {
    }

    default void onProcessingRepository(int index, int total, String repository) {
    }

    default void onRepositoryProcessed(String repository, int commitCount) {
    }

    default void onRepositorySkipped(String repository, String reason) {
    }
}
