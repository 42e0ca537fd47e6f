package kr.hdmeal.ingest;

import kr.hdmeal.upstream.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Bounded retry with exponential backoff for upstream calls.
 *
 * <p>
 * Only transient failures are retried. The delay before attempt {@code n+1} is
 * {@code baseDelay * 2^(n-1)}; there is no jitter so runs are reproducible.
 * </p>
 */
public final class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final Duration baseDelay;

    public RetryPolicy(int maxAttempts, Duration baseDelay) {
        if (maxAttempts < 1)
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay == null || baseDelay.isNegative() ? Duration.ZERO : baseDelay;
    }

    @FunctionalInterface
    public interface Call<T> {
        T call() throws UpstreamException;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Delay slept after the given failed attempt (1-based).
     */
    Duration delayAfter(int attempt) {
        return baseDelay.multipliedBy(1L << Math.min(attempt - 1, 20));
    }

    /**
     * Runs {@code call}, retrying transient failures. The last failure is
     * rethrown once attempts are exhausted; permanent failures are rethrown
     * immediately.
     */
    public <T> T run(String what, Call<T> call) throws UpstreamException {
        int attempt = 1;
        while (true) {
            try {
                return call.call();
            } catch (UpstreamException e) {
                if (!e.isTransient() || attempt >= maxAttempts)
                    throw e;
                Duration d = delayAfter(attempt);
                log.warn("{} failed (attempt {}/{}), retrying in {}ms: {}", what, attempt, maxAttempts,
                        d.toMillis(), e.getMessage());
                try {
                    Thread.sleep(d.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
                attempt++;
            }
        }
    }
}
