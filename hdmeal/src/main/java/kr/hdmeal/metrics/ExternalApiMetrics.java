package kr.hdmeal.metrics;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks call outcomes for upstream providers (NEIS, KMA, SEOUL).
 *
 * <p>
 * Uses a rolling 60-minute window to compute basic health status. Failures are
 * split into transient (retryable) and permanent ones.
 * </p>
 */
public final class ExternalApiMetrics {
    private static final int WINDOW_MINUTES = 60;
    private static final Map<String, ProviderBuckets> PROVIDERS = new ConcurrentHashMap<>();

    public enum Outcome {
        OK,
        TRANSIENT_FAILURE,
        PERMANENT_FAILURE
    }

    /**
     * Utility class; no instances.
     */
    private ExternalApiMetrics() {
    }

    /**
     * Records one call outcome for a named provider.
     */
    public static void record(String provider, Outcome outcome) {
        if (provider == null || provider.isBlank())
            return;
        PROVIDERS.computeIfAbsent(provider, k -> new ProviderBuckets()).record(outcome);
    }

    /**
     * Returns a snapshot of call counts and failure rates by provider, sorted
     * by name.
     */
    public static Map<String, ProviderSnapshot> snapshot() {
        Map<String, ProviderSnapshot> out = new TreeMap<>();
        for (var e : PROVIDERS.entrySet()) {
            out.put(e.getKey(), e.getValue().snapshot());
        }
        return out;
    }

    /**
     * Returns the rolling window size (minutes) used for metrics.
     */
    public static int windowMinutes() {
        return WINDOW_MINUTES;
    }

    /**
     * Summary metrics for a single provider.
     */
    public record ProviderSnapshot(long calls, long transientFailures, long permanentFailures, double failurePct,
            String status) {
    }

    /**
     * Ring buffer of per-minute counts for a provider.
     */
    private static final class ProviderBuckets {
        private final long[] total = new long[WINDOW_MINUTES];
        private final long[] transientFail = new long[WINDOW_MINUTES];
        private final long[] permanentFail = new long[WINDOW_MINUTES];
        private final long[] minute = new long[WINDOW_MINUTES];

        private synchronized void record(Outcome outcome) {
            long nowMin = System.currentTimeMillis() / 60000L;
            int idx = (int) (nowMin % WINDOW_MINUTES);
            if (minute[idx] != nowMin) {
                minute[idx] = nowMin;
                total[idx] = 0L;
                transientFail[idx] = 0L;
                permanentFail[idx] = 0L;
            }
            total[idx] += 1L;
            if (outcome == Outcome.TRANSIENT_FAILURE)
                transientFail[idx] += 1L;
            else if (outcome == Outcome.PERMANENT_FAILURE)
                permanentFail[idx] += 1L;
        }

        private synchronized ProviderSnapshot snapshot() {
            long nowMin = System.currentTimeMillis() / 60000L;
            long totalSum = 0L;
            long transientSum = 0L;
            long permanentSum = 0L;
            for (int i = 0; i < WINDOW_MINUTES; i++) {
                long bucketMin = minute[i];
                if (bucketMin == 0L || (nowMin - bucketMin) >= WINDOW_MINUTES)
                    continue;
                totalSum += total[i];
                transientSum += transientFail[i];
                permanentSum += permanentFail[i];
            }
            long failSum = transientSum + permanentSum;
            double failurePct = totalSum == 0 ? 0.0 : (failSum * 100.0) / totalSum;
            String status;
            if (totalSum == 0) {
                status = "no-data";
            } else if (failurePct >= 50.0) {
                status = "down";
            } else if (failurePct >= 10.0) {
                status = "degraded";
            } else {
                status = "ok";
            }
            return new ProviderSnapshot(totalSum, transientSum, permanentSum, failurePct, status);
        }
    }
}
