package com.repotimeline.collector.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DailySeriesTest {

    private static final LocalDate JAN_1 = LocalDate.of(2024, 1, 1);
    private static final LocalDate JAN_2 = LocalDate.of(2024, 1, 2);

    @Test
    @DisplayName("Accepts ascending labels with positive counts and sums them")
    void validSeries() {
        DailySeries series = new DailySeries("repo", List.of(JAN_1, JAN_2), List.of(3, 2));

        assertEquals(5, series.totalCommits());
        assertFalse(series.isEmpty());
    }

    @Test
    @DisplayName("Rejects mismatched lengths")
    void mismatchedLengths() {
        assertThrows(IllegalArgumentException.class,
                () -> new DailySeries("repo", List.of(JAN_1, JAN_2), List.of(1)));
    }

    @Test
    @DisplayName("Rejects duplicate or descending labels")
    void nonAscendingLabels() {
        assertThrows(IllegalArgumentException.class,
                () -> new DailySeries("repo", List.of(JAN_2, JAN_1), List.of(1, 1)));
        assertThrows(IllegalArgumentException.class,
                () -> new DailySeries("repo", List.of(JAN_1, JAN_1), List.of(1, 1)));
    }

    @Test
    @DisplayName("Rejects zero counts")
    void zeroCount() {
        assertThrows(IllegalArgumentException.class,
                () -> new DailySeries("repo", List.of(JAN_1), List.of(0)));
    }

    @Test
    @DisplayName("Copies its input so later mutation of the source lists has no effect")
    void defensiveCopy() {
        List<LocalDate> labels = new ArrayList<>(List.of(JAN_1));
        List<Integer> counts = new ArrayList<>(List.of(4));

        DailySeries series = new DailySeries("repo", labels, counts);
        labels.add(JAN_2);
        counts.add(9);

        assertEquals(List.of(JAN_1), series.labels());
        assertEquals(4, series.totalCommits());
        assertThrows(UnsupportedOperationException.class, () -> series.counts().add(1));
    }
}
