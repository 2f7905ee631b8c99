package com.repotimeline.collector.aggregate;

import com.repotimeline.collector.model.Commit;
import com.repotimeline.collector.model.DailySeries;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Groups commits into per-day counts and builds the shared date axis across repositories.
 */
public final class DateBucketer {

    private DateBucketer() {
    }

    /**
     * Buckets commits by their UTC calendar date. Input order is irrelevant; the resulting labels
     * are strictly ascending and every count is at least one.
     */
    public static DailySeries bucket(String repository, Collection<Commit> commits) {
        Map<LocalDate, Integer> perDay = new TreeMap<>();
        for (Commit commit : commits) {
            LocalDate day = LocalDate.ofInstant(commit.timestamp(), ZoneOffset.UTC);
            perDay.merge(day, 1, Integer::sum);
        }
        return new DailySeries(repository, new ArrayList<>(perDay.keySet()), new ArrayList<>(perDay.values()));
    }

    /**
     * Union of all series labels, deduplicated and ascending. Recomputed on every call.
     */
    public static List<LocalDate> unionLabels(Collection<DailySeries> series) {
        SortedSet<LocalDate> union = new TreeSet<>();
        for (DailySeries s : series) {
            union.addAll(s.labels());
        }
        return List.copyOf(union);
    }

    /**
     * Projects a series onto {@code axis}, filling days the series does not contain with zero.
     */
    public static List<Integer> alignToAxis(DailySeries series, List<LocalDate> axis) {
        Map<LocalDate, Integer> byDay = new TreeMap<>();
        for (int i = 0; i < series.labels().size(); i++) {
            byDay.put(series.labels().get(i), series.counts().get(i));
        }
        List<Integer> aligned = new ArrayList<>(axis.size());
        for (LocalDate day : axis) {
            aligned.add(byDay.getOrDefault(day, 0));
        }
        return aligned;
    }
}
