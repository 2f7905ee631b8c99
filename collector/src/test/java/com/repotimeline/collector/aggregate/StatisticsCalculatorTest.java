package com.repotimeline.collector.aggregate;

import com.repotimeline.collector.model.DailySeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link StatisticsCalculator} and {@link StatisticsFormatter}.
 */
class StatisticsCalculatorTest {

    private static DailySeries single(String repository, String day, int count) {
        return new DailySeries(repository, List.of(LocalDate.parse(day)), List.of(count));
    }

    // =========================================================================
    // calculate
    // =========================================================================

    @Test
    @DisplayName("Ranks the busier repository first and averages per repository")
    void calculate_twoRepositories() {
        Statistics stats = StatisticsCalculator.calculate(List.of(
                single("small", "2024-01-01", 10),
                single("large", "2024-01-11", 30)));

        assertEquals(40, stats.totalCommits());
        assertEquals(2, stats.repositoryCount());
        assertEquals("large", stats.topRepositories().get(0).repository());
        assertEquals(30, stats.topRepositories().get(0).commits());
        assertEquals(20, stats.averageCommitsPerRepository());
        assertEquals(LocalDate.parse("2024-01-01"), stats.dateRange().start());
        assertEquals(LocalDate.parse("2024-01-11"), stats.dateRange().end());
        assertEquals(10, stats.dateRange().days());
        assertEquals(4.0, stats.averageCommitsPerDay());
    }

    @Test
    @DisplayName("Ties keep their input order")
    void calculate_stableTies() {
        Statistics stats = StatisticsCalculator.calculate(List.of(
                single("first", "2024-01-01", 7),
                single("second", "2024-01-02", 7),
                single("third", "2024-01-03", 9)));

        assertEquals(List.of("third", "first", "second"),
                stats.topRepositories().stream().map(Statistics.RepositoryTotal::repository).toList());
    }

    @Test
    @DisplayName("Only the top five repositories are reported")
    void calculate_topFive() {
        List<DailySeries> series = new ArrayList<>();
        for (int i = 1; i <= 8; i++) {
            series.add(single("repo" + i, "2024-01-0" + i, i));
        }

        Statistics stats = StatisticsCalculator.calculate(series);

        assertEquals(5, stats.topRepositories().size());
        assertEquals("repo8", stats.topRepositories().get(0).repository());
        assertEquals("repo4", stats.topRepositories().get(4).repository());
        assertEquals(8, stats.repositoryCount());
    }

    @Test
    @DisplayName("A single-day range reports zero days and zero per-day average")
    void calculate_singleDay() {
        Statistics stats = StatisticsCalculator.calculate(List.of(single("only", "2024-02-29", 12)));

        assertEquals(0, stats.dateRange().days());
        assertEquals(0.0, stats.averageCommitsPerDay());
        assertEquals(12, stats.averageCommitsPerRepository());
    }

    @Test
    @DisplayName("Per-day average is rounded to two decimals and per-repo average to an integer")
    void calculate_rounding() {
        Statistics stats = StatisticsCalculator.calculate(List.of(
                single("a", "2024-01-01", 5),
                single("b", "2024-01-04", 5),
                single("c", "2024-01-02", 6)));

        assertEquals(16, stats.totalCommits());
        assertEquals(5, stats.averageCommitsPerRepository());
        assertEquals(5.33, stats.averageCommitsPerDay());
    }

    @Test
    @DisplayName("No series yields zeros and no date range")
    void calculate_empty() {
        Statistics stats = StatisticsCalculator.calculate(List.of());

        assertEquals(0, stats.totalCommits());
        assertEquals(0, stats.repositoryCount());
        assertNull(stats.dateRange());
        assertTrue(stats.topRepositories().isEmpty());
        assertEquals(0, stats.averageCommitsPerRepository());
        assertEquals(0.0, stats.averageCommitsPerDay());
    }

    // =========================================================================
    // format
    // =========================================================================

    @Test
    @DisplayName("Formats the summary with ranked repositories")
    void format_summary() {
        Statistics stats = StatisticsCalculator.calculate(List.of(
                single("small", "2024-01-01", 10),
                single("large", "2024-01-11", 30)));

        String text = StatisticsFormatter.format(stats);

        assertTrue(text.startsWith("Statistics Summary\n"));
        assertTrue(text.contains("Total Commits: 40\n"));
        assertTrue(text.contains("Date Range: 2024-01-01 to 2024-01-11 (10 days)\n"));
        assertTrue(text.contains("Average per Repo: 20 commits\n"));
        assertTrue(text.contains("Average per Day: 4.0 commits\n"));
        assertTrue(text.indexOf("  1. large: 30 commits") < text.indexOf("  2. small: 10 commits"));
    }

    @Test
    @DisplayName("Formats an empty run without a date range")
    void format_empty() {
        String text = StatisticsFormatter.format(StatisticsCalculator.calculate(List.of()));

        assertTrue(text.contains("Date Range: n/a\n"));
        assertTrue(text.endsWith("Top Repositories:\n"));
    }
}
