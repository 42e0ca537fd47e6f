package kr.hdmeal.model;

/**
 * Outcome of a sync pass for one {@link Cell}.
 */
public enum CellStatus {
    /** Already within TTL; nothing fetched. */
    FRESH,
    /** Fetched and persisted in this pass (as data or as an absent marker). */
    SYNCED,
    /** Fetch, normalization or persistence failed; the cell stays missing or stale. */
    FAILED,
    /** The caller stopped waiting before the cell finished. */
    PENDING;

    public boolean isCovered() {
        return this == FRESH || this == SYNCED;
    }
}
