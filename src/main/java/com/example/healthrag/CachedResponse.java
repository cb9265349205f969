package com.example.healthrag;

import jakarta.persistence.*;

@Entity
@Table(name = "cached_responses", indexes = {
        @Index(name = "idx_cache_lookup", columnList = "owner_id,endpoint,time_frame,query_hash"),
        @Index(name = "idx_cache_expires", columnList = "expires_at")
})
public class CachedResponse {

    @Id
    private String id;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Column(name = "endpoint", nullable = false)
    private String endpoint;

    @Column(name = "time_frame", nullable = false)
    private String timeFrame;

    @Column(name = "query_hash", nullable = false, length = 64)
    private String queryHash;

    @Lob
    @Column(name = "payload", columnDefinition = "CLOB")
    private String payload;

    @Column(name = "created_at", nullable = false)
    private long createdAt;

    @Column(name = "expires_at", nullable = false)
    private long expiresAt;

    public CachedResponse() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }
    public String getEndpoint() { return endpoint; }
    public void setEndpoint(String endpoint) { this.endpoint = endpoint; }
    public String getTimeFrame() { return timeFrame; }
    public void setTimeFrame(String timeFrame) { this.timeFrame = timeFrame; }
    public String getQueryHash() { return queryHash; }
    public void setQueryHash(String queryHash) { this.queryHash = queryHash; }
    public String getPayload() { return payload; }
    public void setPayload(String payload) { this.payload = payload; }
    public long getCreatedAt() { return createdAt; }
    public void setCreatedAt(long createdAt) { this.createdAt = createdAt; }
    public long getExpiresAt() { return expiresAt; }
    public void setExpiresAt(long expiresAt) { this.expiresAt = expiresAt; }
}
