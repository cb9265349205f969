package com.example.healthrag;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * What the vector index keeps about a record: identity, filterable fields and the embedding.
 * The record body stays with the store that owns it.
 */
public final class IndexedRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String ownerId;
    private final String category;
    private final Instant timestamp;
    private final Map<String, String> metadata;
    private final float[] embedding;

    public IndexedRecord(String id, String ownerId, String category, Instant timestamp,
                         Map<String, String> metadata, float[] embedding) {
        this.id = Objects.requireNonNull(id, "id");
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
        this.category = category;
        this.timestamp = timestamp;
        this.metadata = metadata == null ? Collections.emptyMap() : Collections.unmodifiableMap(new TreeMap<>(metadata));
        this.embedding = VectorMath.copy(Objects.requireNonNull(embedding, "embedding"));
    }

    public String getId() { return id; }
    public String getOwnerId() { return ownerId; }
    public String getCategory() { return category; }
    public Instant getTimestamp() { return timestamp; }
    public Map<String, String> getMetadata() { return metadata; }

    /** Returns a copy; the stored vector never changes. */
    public float[] getEmbedding() { return VectorMath.copy(embedding); }

    float[] embeddingRef() { return embedding; }

    @Override
    public String toString() {
        return "IndexedRecord{id=" + id + ", owner=" + ownerId + ", category=" + category + ", timestamp=" + timestamp + "}";
    }
}
