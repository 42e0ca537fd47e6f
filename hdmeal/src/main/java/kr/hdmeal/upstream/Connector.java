package kr.hdmeal.upstream;

import kr.hdmeal.model.DataType;
import kr.hdmeal.model.DateRange;

import java.util.List;
import java.util.Set;

/**
 * Fetches raw records for a date range from one upstream provider.
 *
 * <p>
 * Implementations own request shaping, pagination and grouping of provider
 * rows into {@link RawRecord}s. They hold no data cache and may be called
 * repeatedly with the same range. Callers must not pass ranges longer than
 * {@link #maxSpanDays()}.
 * </p>
 */
public interface Connector {

    /**
     * Short provider name used in logs and metrics.
     */
    String name();

    /**
     * Data types this connector can fetch.
     */
    Set<DataType> dataTypes();

    /**
     * Longest range, in days, accepted by a single {@link #fetch} call.
     */
    int maxSpanDays();

    /**
     * Part of {@code range} the provider can answer for right now, or null when
     * none of it is. Dates outside it are never requested, so an empty fetch
     * says nothing about them.
     */
    default DateRange coverage(DataType type, DateRange range) {
        return range;
    }

    /**
     * Returns the provider's records for the range, ordered by date.
     */
    List<RawRecord> fetch(DataType type, DateRange range) throws UpstreamException;
}
