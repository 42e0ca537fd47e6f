package kr.hdmeal.model;

/**
 * Families of data kept in the cache.
 *
 * <p>
 * {@link #TIMETABLE} records are additionally keyed by grade and class number;
 * every other type is keyed by date alone.
 * </p>
 */
public enum DataType {
    MEAL,
    SCHEDULE,
    TIMETABLE,
    WEATHER,
    WATER_TEMPERATURE;

    /**
     * True when records of this type are keyed per grade/class section.
     */
    public boolean isSectioned() {
        return this == TIMETABLE;
    }

    /**
     * Parses a type name case-insensitively, accepting dashes for underscores.
     */
    public static DataType parse(String s) {
        if (s == null || s.isBlank())
            throw new IllegalArgumentException("data type is required");
        return DataType.valueOf(s.trim().toUpperCase().replace('-', '_'));
    }
}
