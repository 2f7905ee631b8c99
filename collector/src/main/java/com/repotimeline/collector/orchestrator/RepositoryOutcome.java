package com.repotimeline.collector.orchestrator;

import com.repotimeline.collector.model.DailySeries;

/**
 * Result of processing a single repository: either a series or a skip record.
 */
record RepositoryOutcome(
        String repository,
        DailySeries series,
        SkippedRepository skipped
) {

    static RepositoryOutcome success(String repository, DailySeries series) {
        return new RepositoryOutcome(repository, series, null);
    }

    static RepositoryOutcome skipped(String repository, String reason) {
        return new RepositoryOutcome(repository, null, new SkippedRepository(repository, reason));
    }

    static RepositoryOutcome empty(String repository) {
        return new RepositoryOutcome(repository, null, SkippedRepository.empty(repository));
    }

    boolean success() {
        return series != null;
    }
}
