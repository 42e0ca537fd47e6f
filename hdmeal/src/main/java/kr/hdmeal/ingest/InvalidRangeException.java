package kr.hdmeal.ingest;

/**
 * A requested date range is longer than the configured maximum.
 */
public class InvalidRangeException extends IllegalArgumentException {
    public InvalidRangeException(String message) {
        super(message);
    }
}
