package kr.hdmeal.model;

import java.time.OffsetDateTime;

/**
 * Averaged river water temperature for one day.
 *
 * @param samples number of measuring points that reported a numeric value
 */
public record WaterTemperatureDay(double temperatureC, OffsetDateTime measuredAt, int samples) {
}
