package kr.hdmeal.model;

import java.util.List;

/**
 * Academic calendar events of one day.
 */
public record ScheduleDay(List<Entry> entries, String summary) {

    /**
     * One event. An empty grade list means the event applies to the whole school.
     */
    public record Entry(String name, List<Integer> grades) {
    }
}
