package kr.hdmeal.model;

import java.util.List;

/**
 * Subjects of one grade/class on one day, in period order.
 */
public record TimetableDay(List<String> lessons) {
}
