package com.finsight.model;

import java.time.LocalDate;

public final class HistoryRange {
    public final LocalDate start;
    public final LocalDate end;

    public HistoryRange(LocalDate start, LocalDate end) {
        if (start == null || end == null || start.isAfter(end)) {
            throw new IllegalArgumentException("invalid history range: " + start + ".." + end);
        }
        this.start = start;
        this.end = end;
    }

    public static HistoryRange lastDays(LocalDate end, int days) {
        return new HistoryRange(end.minusDays(Math.max(1, days)), end);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
