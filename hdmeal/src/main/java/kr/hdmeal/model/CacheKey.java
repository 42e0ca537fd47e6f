package kr.hdmeal.model;

import java.time.LocalDate;
import java.util.Comparator;

/**
 * Full key of one cached record. Grade and class number are 0 for types that
 * are not sectioned.
 */
public record CacheKey(DataType type, LocalDate date, int grade, int classNo) implements Comparable<CacheKey> {

    private static final Comparator<CacheKey> ORDER = Comparator
            .comparing(CacheKey::type)
            .thenComparing(CacheKey::date)
            .thenComparingInt(CacheKey::grade)
            .thenComparingInt(CacheKey::classNo);

    public CacheKey {
        if (type == null || date == null)
            throw new IllegalArgumentException("type and date are required");
        if (!type.isSectioned() && (grade != 0 || classNo != 0))
            throw new IllegalArgumentException(type + " records are not keyed by grade/class");
    }

    public static CacheKey of(DataType type, LocalDate date) {
        return new CacheKey(type, date, 0, 0);
    }

    public static CacheKey of(DataType type, LocalDate date, int grade, int classNo) {
        return new CacheKey(type, date, grade, classNo);
    }

    @Override
    public int compareTo(CacheKey o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return type.isSectioned() ? type + ":" + date + ":" + grade + "-" + classNo : type + ":" + date;
    }
}
