package com.example.healthrag;

import java.util.Objects;

/**
 * Lookup key of a cached response. The hash covers every request parameter; endpoint and time
 * frame are also kept apart so invalidation can target them.
 */
public final class CacheKey {

    private final String endpoint;
    private final String timeFrame;
    private final String hash;

    public CacheKey(String endpoint, String timeFrame, String hash) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.timeFrame = Objects.requireNonNull(timeFrame, "timeFrame");
        this.hash = Objects.requireNonNull(hash, "hash");
    }

    public String getEndpoint() { return endpoint; }
    public String getTimeFrame() { return timeFrame; }
    public String getHash() { return hash; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CacheKey)) return false;
        CacheKey that = (CacheKey) o;
        return endpoint.equals(that.endpoint) && timeFrame.equals(that.timeFrame) && hash.equals(that.hash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(endpoint, timeFrame, hash);
    }

    @Override
    public String toString() {
        return endpoint + "/" + timeFrame + "/" + hash;
    }
}
