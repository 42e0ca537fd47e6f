package kr.hdmeal.model;

import java.time.LocalDate;

/**
 * Unit of synchronization: one data type on one date.
 */
public record Cell(DataType type, LocalDate date) {
    @Override
    public String toString() {
        return type + ":" + date;
    }
}
