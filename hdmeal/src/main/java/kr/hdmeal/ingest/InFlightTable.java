package kr.hdmeal.ingest;

import kr.hdmeal.model.Cell;
import kr.hdmeal.model.CellStatus;
import kr.hdmeal.model.DataType;

import java.time.LocalDate;
import java.util.*;
import java.util.concurrent.CompletableFuture;

/**
 * Registry of (type, date) cells currently being synchronized.
 *
 * <p>
 * All mutations happen under one lock. A caller claims its stale dates in a
 * single step: dates already owned by a running {@link Flight} are attached to,
 * the rest become a new flight owned by the caller.
 * </p>
 */
final class InFlightTable {
    private final Object lock = new Object();
    private final Map<Cell, Flight> flights = new HashMap<>();

    /**
     * One in-progress fetch of a set of dates for one type. The outcome maps
     * each of its dates to the status it ended with.
     */
    static final class Flight {
        final DataType type;
        final SortedSet<LocalDate> dates;
        final CompletableFuture<Map<LocalDate, CellStatus>> outcome = new CompletableFuture<>();

        Flight(DataType type, SortedSet<LocalDate> dates) {
            this.type = type;
            this.dates = Collections.unmodifiableSortedSet(dates);
        }

        @Override
        public String toString() {
            return type + "[" + dates.first() + ".." + dates.last() + ", " + dates.size() + " day(s)]";
        }
    }

    /**
     * Result of {@link #claim}: the caller's own flight (null when every date was
     * already in flight) and the flights it attached to.
     */
    record Claim(Flight owned, List<Flight> attached) {
    }

    Claim claim(DataType type, Collection<LocalDate> dates) {
        synchronized (lock) {
            Set<Flight> attached = new LinkedHashSet<>();
            TreeSet<LocalDate> mine = new TreeSet<>();
            for (LocalDate d : dates) {
                Flight f = flights.get(new Cell(type, d));
                if (f != null)
                    attached.add(f);
                else
                    mine.add(d);
            }
            Flight owned = null;
            if (!mine.isEmpty()) {
                owned = new Flight(type, mine);
                for (LocalDate d : mine) {
                    flights.put(new Cell(type, d), owned);
                }
            }
            return new Claim(owned, List.copyOf(attached));
        }
    }

    /**
     * Removes the flight's cells. Must run after its records are persisted and
     * before its outcome is completed.
     */
    void release(Flight flight) {
        synchronized (lock) {
            for (LocalDate d : flight.dates) {
                flights.remove(new Cell(flight.type, d), flight);
            }
        }
    }

    int size() {
        synchronized (lock) {
            return flights.size();
        }
    }
}
