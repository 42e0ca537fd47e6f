package kr.hdmeal.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * A date range plus the data types to refresh over it.
 */
public record SyncWindow(DateRange range, Set<DataType> types) {

    public SyncWindow {
        if (range == null)
            throw new IllegalArgumentException("range is required");
        if (types == null || types.isEmpty())
            throw new IllegalArgumentException("at least one data type is required");
        types = Collections.unmodifiableSet(EnumSet.copyOf(types));
    }

    public static SyncWindow all(DateRange range) {
        return new SyncWindow(range, EnumSet.allOf(DataType.class));
    }

    public static SyncWindow of(DateRange range, DataType first, DataType... rest) {
        return new SyncWindow(range, EnumSet.of(first, rest));
    }
}
