package com.repotimeline.collector.aggregate;

import com.repotimeline.collector.model.DailySeries;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Computes {@link Statistics} from a list of series. Pure; nothing is cached.
 */
public final class StatisticsCalculator {

    static final int TOP_N = 5;

    private StatisticsCalculator() {
    }

    public static Statistics calculate(List<DailySeries> series) {
        int totalCommits = 0;
        List<Statistics.RepositoryTotal> totals = new ArrayList<>(series.size());
        LocalDate start = null;
        LocalDate end = null;

        for (DailySeries s : series) {
            int commits = s.totalCommits();
            totalCommits += commits;
            totals.add(new Statistics.RepositoryTotal(s.repository(), commits));

            if (!s.isEmpty()) {
                LocalDate first = s.labels().get(0);
                LocalDate last = s.labels().get(s.labels().size() - 1);
                if (start == null || first.isBefore(start)) {
                    start = first;
                }
                if (end == null || last.isAfter(end)) {
                    end = last;
                }
            }
        }

        // List.sort is stable, so equal totals keep input order
        totals.sort(Comparator.comparingInt(Statistics.RepositoryTotal::commits).reversed());
        List<Statistics.RepositoryTotal> top = List.copyOf(totals.subList(0, Math.min(TOP_N, totals.size())));

        Statistics.DateRange dateRange = start == null
                ? null
                : new Statistics.DateRange(start, end, ChronoUnit.DAYS.between(start, end));

        long perRepository = series.isEmpty() ? 0 : Math.round((double) totalCommits / series.size());

        double perDay = 0;
        if (dateRange != null && dateRange.days() > 0) {
            perDay = BigDecimal.valueOf(totalCommits)
                    .divide(BigDecimal.valueOf(dateRange.days()), 2, RoundingMode.HALF_UP)
                    .doubleValue();
        }

        return new Statistics(totalCommits, series.size(), dateRange, top, perRepository, perDay);
    }
}
