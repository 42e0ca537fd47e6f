package kr.hdmeal.model;

import java.time.LocalDate;
import java.util.List;

/**
 * What a caller of the sync engine learns about its range.
 *
 * @param coveredDates dates for which every requested type is now fresh
 * @param missing      cells that are still missing or stale after the pass
 */
public record SyncResult(Status status, DateRange range, List<LocalDate> coveredDates, List<Cell> missing) {

    public enum Status {
        DONE,
        PARTIAL_FAILURE
    }

    public SyncResult {
        coveredDates = List.copyOf(coveredDates);
        missing = List.copyOf(missing);
    }

    public boolean isDone() {
        return status == Status.DONE;
    }
}
