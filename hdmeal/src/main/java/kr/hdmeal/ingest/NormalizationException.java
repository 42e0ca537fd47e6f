package kr.hdmeal.ingest;

import kr.hdmeal.model.CacheKey;

/**
 * A provider record could not be turned into a canonical record. Permanent for
 * that cache key until the provider data changes.
 */
public class NormalizationException extends Exception {
    private final CacheKey key;

    public NormalizationException(CacheKey key, String message) {
        super(key + ": " + message);
        this.key = key;
    }

    public CacheKey key() {
        return key;
    }
}
