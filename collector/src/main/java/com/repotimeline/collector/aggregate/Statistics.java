package com.repotimeline.collector.aggregate;

import java.time.LocalDate;
import java.util.List;

/**
 * Summary figures over a run's series. {@code dateRange} is {@code null} when no labels exist.
 */
public record Statistics(
        int totalCommits,
        int repositoryCount,
        DateRange dateRange,
        List<RepositoryTotal> topRepositories,
        long averageCommitsPerRepository,
        double averageCommitsPerDay
) {

    public record DateRange(LocalDate start, LocalDate end, long days) {}

    public record RepositoryTotal(String repository, int commits) {}
}
