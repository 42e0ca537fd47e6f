package kr.hdmeal.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Inclusive range of calendar dates.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        if (start == null || end == null)
            throw new IllegalArgumentException("start and end are required");
        if (start.isAfter(end))
            throw new IllegalArgumentException("start " + start + " is after end " + end);
    }

    public static DateRange of(LocalDate start, LocalDate end) {
        return new DateRange(start, end);
    }

    public static DateRange single(LocalDate day) {
        return new DateRange(day, day);
    }

    /**
     * Builds the window {@code [center - before, center + after]}.
     */
    public static DateRange around(LocalDate center, int before, int after) {
        return new DateRange(center.minusDays(before), center.plusDays(after));
    }

    /**
     * Number of days in the range, both ends included.
     */
    public int days() {
        return (int) ChronoUnit.DAYS.between(start, end) + 1;
    }

    public boolean contains(LocalDate day) {
        return !day.isBefore(start) && !day.isAfter(end);
    }

    public List<LocalDate> dates() {
        List<LocalDate> out = new ArrayList<>(days());
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
            out.add(d);
        }
        return out;
    }

    /**
     * Overlap with another range, or null when the two are disjoint.
     */
    public DateRange intersect(DateRange other) {
        LocalDate s = start.isAfter(other.start) ? start : other.start;
        LocalDate e = end.isBefore(other.end) ? end : other.end;
        return s.isAfter(e) ? null : new DateRange(s, e);
    }

    /**
     * Splits this range into consecutive pieces of at most {@code maxSpanDays}
     * days each.
     */
    public List<DateRange> split(int maxSpanDays) {
        int span = Math.max(1, maxSpanDays);
        List<DateRange> out = new ArrayList<>();
        LocalDate s = start;
        while (!s.isAfter(end)) {
            LocalDate e = s.plusDays(span - 1L);
            if (e.isAfter(end))
                e = end;
            out.add(new DateRange(s, e));
            s = e.plusDays(1);
        }
        return out;
    }

    /**
     * Groups a set of dates into maximal runs of consecutive days.
     */
    public static List<DateRange> runsOf(Collection<LocalDate> dates) {
        List<DateRange> out = new ArrayList<>();
        LocalDate runStart = null;
        LocalDate prev = null;
        for (LocalDate d : new TreeSet<>(dates)) {
            if (runStart == null) {
                runStart = d;
            } else if (!d.equals(prev.plusDays(1))) {
                out.add(new DateRange(runStart, prev));
                runStart = d;
            }
            prev = d;
        }
        if (runStart != null)
            out.add(new DateRange(runStart, prev));
        return out;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
