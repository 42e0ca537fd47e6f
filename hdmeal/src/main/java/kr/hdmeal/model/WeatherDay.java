package kr.hdmeal.model;

/**
 * Forecast for one day taken from its representative time slot.
 * Min/max temperatures are null when the forecast does not carry them.
 */
public record WeatherDay(
        String forecastTime,
        String temperature,
        String temperatureMin,
        String temperatureMax,
        String sky,
        String precipitation,
        String precipitationProbability,
        String humidity) {
}
