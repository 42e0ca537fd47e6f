package kr.hdmeal.model;

import java.util.List;

/**
 * Lunch menu of one day. {@code calories} is null when the provider value is
 * missing or unreadable.
 */
public record MealDay(List<MenuItem> menus, Double calories) {

    public record MenuItem(String name, List<Integer> allergies) {
    }
}
