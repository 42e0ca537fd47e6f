package kr.hdmeal.db;

/**
 * The cache store could not complete an operation (connection lost, SQL error,
 * unreadable stored payload). Fatal to the current sync pass.
 */
public class StoreException extends RuntimeException {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
