package com.repotimeline.collector.aggregate;

/**
 * Renders {@link Statistics} as the plain-text summary shown after a run.
 */
public final class StatisticsFormatter {

    private StatisticsFormatter() {
    }

    public static String format(Statistics stats) {
        StringBuilder out = new StringBuilder();
        out.append("Statistics Summary\n");
        out.append("------------------\n");
        out.append("Total Commits: ").append(stats.totalCommits()).append('\n');
        out.append("Repositories: ").append(stats.repositoryCount()).append('\n');
        if (stats.dateRange() != null) {
            out.append("Date Range: ").append(stats.dateRange().start())
                    .append(" to ").append(stats.dateRange().end())
                    .append(" (").append(stats.dateRange().days()).append(" days)\n");
        } else {
            out.append("Date Range: n/a\n");
        }
        out.append("Average per Repo: ").append(stats.averageCommitsPerRepository()).append(" commits\n");
        out.append("Average per Day: ").append(stats.averageCommitsPerDay()).append(" commits\n");
        out.append('\n');
        out.append("Top Repositories:\n");

        int rank = 1;
        for (Statistics.RepositoryTotal repo : stats.topRepositories()) {
            out.append("  ").append(rank++).append(". ").append(repo.repository())
                    .append(": ").append(repo.commits()).append(" commits\n");
        }
        return out.toString();
    }
}
