package kr.hdmeal.service;

import com.fasterxml.jackson.databind.JsonNode;
import kr.hdmeal.model.CacheRecord;
import kr.hdmeal.model.Payload;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/**
 * Everything known about one date, as served to clients. Every value is
 * present; missing data is an explicit {@link Slot#noData()} marker.
 *
 * @param timetable grade -> class -> slot for every configured section
 */
public record DayView(
        LocalDate date,
        Slot meal,
        Slot schedule,
        Slot weather,
        Slot waterTemperature,
        Map<Integer, Map<Integer, Slot>> timetable) {

    /**
     * One cached value or its absence.
     *
     * @param available true when {@code value} holds a canonical record
     * @param reason    why there is no value ({@code no-data}, {@code holiday}, ...)
     * @param syncedAt  when the value was fetched; null if never
     */
    public record Slot(boolean available, JsonNode value, String reason, Instant syncedAt) {

        public static Slot of(CacheRecord r) {
            Payload p = r.payload();
            return new Slot(p.isPresent(), p.value(), p.reason(), r.syncedAt());
        }

        public static Slot noData() {
            return new Slot(false, null, Payload.NO_DATA, null);
        }
    }
}
