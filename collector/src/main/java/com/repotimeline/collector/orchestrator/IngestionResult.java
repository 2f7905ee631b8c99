package com.repotimeline.collector.orchestrator;

import com.repotimeline.collector.aggregate.DateBucketer;
import com.repotimeline.collector.aggregate.Statistics;
import com.repotimeline.collector.aggregate.StatisticsCalculator;
import com.repotimeline.collector.model.DailySeries;

import java.time.LocalDate;
import java.util.List;

/**
 * Output of a successful run, handed to the rendering side and the statistics module.
 *
 * @param series                 one entry per repository with at least one commit, in processing order
 * @param totalCommitsAnalyzed   sum of all counts across {@code series}
 * @param skippedRepositories    repositories that contributed nothing, in processing order
 * @param processedCount         repositories attempted
 */
public record IngestionResult(
        List<DailySeries> series,
        int totalCommitsAnalyzed,
        List<SkippedRepository> skippedRepositories,
        int processedCount
) {

    public IngestionResult {
        series = List.copyOf(series);
        skippedRepositories = List.copyOf(skippedRepositories);
    }

    public boolean hasSkips() {
        return !skippedRepositories.isEmpty();
    }

    /**
     * Common date axis across all series.
     */
    public List<LocalDate> labelUnion() {
        return DateBucketer.unionLabels(series);
    }

    public Statistics statistics() {
        return StatisticsCalculator.calculate(series);
    }
}
