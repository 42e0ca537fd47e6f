package kr.hdmeal.upstream;

/**
 * Failure reported by an upstream provider call.
 *
 * <p>
 * {@link Kind#TRANSIENT} failures (timeouts, rate limits, server errors) may be
 * retried by the caller; {@link Kind#PERMANENT} failures (bad credentials,
 * malformed request or response) may not.
 * </p>
 */
public class UpstreamException extends Exception {

    public enum Kind {
        TRANSIENT,
        PERMANENT
    }

    private final String provider;
    private final Kind kind;

    public UpstreamException(String provider, Kind kind, String message) {
        this(provider, kind, message, null);
    }

    public UpstreamException(String provider, Kind kind, String message, Throwable cause) {
        super(provider + ": " + message, cause);
        this.provider = provider;
        this.kind = kind;
    }

    public static UpstreamException transientFailure(String provider, String message) {
        return new UpstreamException(provider, Kind.TRANSIENT, message);
    }

    public static UpstreamException permanentFailure(String provider, String message) {
        return new UpstreamException(provider, Kind.PERMANENT, message);
    }

    public String provider() {
        return provider;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isTransient() {
        return kind == Kind.TRANSIENT;
    }
}
