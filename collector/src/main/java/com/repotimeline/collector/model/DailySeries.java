package com.repotimeline.collector.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Per-day commit counts for one repository. Labels are strictly ascending UTC dates;
 * days without commits are omitted rather than zero-filled.
 */
public record DailySeries(
        String repository,
        List<LocalDate> labels,
        List<Integer> counts
) {

    public DailySeries {
        Objects.requireNonNull(repository, "repository");
        labels = List.copyOf(labels);
        counts = List.copyOf(counts);

        if (labels.size() != counts.size()) {
            throw new IllegalArgumentException("labels and counts differ in length for " + repository
                    + ": " + labels.size() + " vs " + counts.size());
        }
        for (int i = 0; i < labels.size(); i++) {
            if (i > 0 && !labels.get(i).isAfter(labels.get(i - 1))) {
                throw new IllegalArgumentException("labels must be strictly ascending for " + repository
                        + " at index " + i);
            }
            if (counts.get(i) < 1) {
                throw new IllegalArgumentException("counts must be positive for " + repository
                        + " at index " + i);
            }
        }
    }

    public int totalCommits() {
        return counts.stream().mapToInt(Integer::intValue).sum();
    }

    public boolean isEmpty() {
        return labels.isEmpty();
    }
}
