package com.example.healthrag;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Filter and exact-scoring logic shared by the index implementations.
 */
final class VectorScan {

    static final Comparator<ScoredRecord> ASCENDING = Comparator
            .comparingDouble(ScoredRecord::getDistance)
            .thenComparing(s -> s.getRecord().getId());

    private VectorScan() {}

    static float[] prepareQuery(VectorSearchRequest q) {
        return q.getMetric() == DistanceMetric.COSINE ? VectorMath.normalize(q.getQueryVector()) : q.getQueryVector();
    }

    static boolean matches(IndexedRecord r, VectorSearchRequest q) {
        if (!q.getOwnerId().equals(r.getOwnerId())) return false;
        if (q.getCategory() != null && !q.getCategory().equals(r.getCategory())) return false;
        if (q.getFrom() != null || q.getTo() != null) {
            if (r.getTimestamp() == null) return false;
            if (q.getFrom() != null && r.getTimestamp().isBefore(q.getFrom())) return false;
            if (q.getTo() != null && !r.getTimestamp().isBefore(q.getTo())) return false;
        }
        for (Map.Entry<String, String> f : q.getExtraFilters().entrySet()) {
            if (!f.getValue().equals(r.getMetadata().get(f.getKey()))) return false;
        }
        return true;
    }

    static boolean withinThreshold(double distance, VectorSearchRequest q) {
        return q.getMaxDistance() == null || distance <= q.getMaxDistance();
    }

    static ScoredRecord score(IndexedRecord r, float[] query, VectorSearchRequest q) {
        double d = q.getMetric().distance(query, r.embeddingRef());
        return new ScoredRecord(r, d, q.getMetric().similarityOf(d));
    }

    static List<ScoredRecord> exact(Collection<IndexedRecord> candidates, VectorSearchRequest q) {
        float[] query = prepareQuery(q);
        List<ScoredRecord> hits = new ArrayList<>();
        for (IndexedRecord r : candidates) {
            if (!matches(r, q)) continue;
            ScoredRecord s = score(r, query, q);
            if (withinThreshold(s.getDistance(), q)) hits.add(s);
        }
        hits.sort(ASCENDING);
        return hits.size() > q.getLimit() ? new ArrayList<>(hits.subList(0, q.getLimit())) : hits;
    }
}
