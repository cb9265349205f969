package com.example.healthrag;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Parameters of one owner-scoped similarity search. All filters are conjunctive.
 * {@code from} is inclusive and {@code to} exclusive; either may be null.
 */
public final class VectorSearchRequest {

    private final String ownerId;
    private final String category;
    private final float[] queryVector;
    private final DistanceMetric metric;
    private final Double maxDistance;
    private final int limit;
    private final Instant from;
    private final Instant to;
    private final Map<String, String> extraFilters;

    private VectorSearchRequest(Builder b) {
        this.ownerId = Objects.requireNonNull(b.ownerId, "ownerId is mandatory");
        this.queryVector = Objects.requireNonNull(b.queryVector, "queryVector");
        if (b.limit <= 0) throw new IllegalArgumentException("limit must be positive");
        this.category = b.category;
        this.metric = b.metric == null ? DistanceMetric.COSINE : b.metric;
        this.maxDistance = b.maxDistance;
        this.limit = b.limit;
        this.from = b.from;
        this.to = b.to;
        this.extraFilters = b.extraFilters == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(b.extraFilters));
    }

    public static Builder forOwner(String ownerId, float[] queryVector) {
        Builder b = new Builder();
        b.ownerId = ownerId;
        b.queryVector = queryVector;
        return b;
    }

    public String getOwnerId() { return ownerId; }
    public String getCategory() { return category; }
    public float[] getQueryVector() { return queryVector; }
    public DistanceMetric getMetric() { return metric; }
    public Double getMaxDistance() { return maxDistance; }
    public int getLimit() { return limit; }
    public Instant getFrom() { return from; }
    public Instant getTo() { return to; }
    public Map<String, String> getExtraFilters() { return extraFilters; }

    public static final class Builder {
        private String ownerId;
        private String category;
        private float[] queryVector;
        private DistanceMetric metric;
        private Double maxDistance;
        private int limit = 10;
        private Instant from;
        private Instant to;
        private Map<String, String> extraFilters;

        private Builder() {}

        public Builder category(String category) { this.category = category; return this; }
        public Builder metric(DistanceMetric metric) { this.metric = metric; return this; }
        public Builder maxDistance(Double maxDistance) { this.maxDistance = maxDistance; return this; }
        public Builder limit(int limit) { this.limit = limit; return this; }
        public Builder between(Instant from, Instant to) { this.from = from; this.to = to; return this; }
        public Builder extraFilters(Map<String, String> extraFilters) { this.extraFilters = extraFilters; return this; }

        /** Sets {@code maxDistance} from a similarity threshold under the chosen metric. */
        public Builder minSimilarity(double minSimilarity) {
            DistanceMetric m = metric == null ? DistanceMetric.COSINE : metric;
            this.maxDistance = m.maxDistanceFor(minSimilarity);
            return this;
        }

        public VectorSearchRequest build() { return new VectorSearchRequest(this); }
    }
}
