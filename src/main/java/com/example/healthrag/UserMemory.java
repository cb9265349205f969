package com.example.healthrag;

import jakarta.persistence.*;

@Entity
@Table(name = "user_memories", indexes = {
        @Index(name = "idx_memory_last_updated", columnList = "last_updated")
})
public class UserMemory {

    @Id
    @Column(name = "owner_id")
    private String ownerId;

    // JSON array of {timestamp, content}, oldest first
    @Lob
    @Column(name = "entries", columnDefinition = "CLOB")
    private String entriesJson;

    @Lob
    @Column(name = "embedding_blob", columnDefinition = "BLOB")
    private byte[] embeddingBlob;

    @Column(name = "last_updated", nullable = false)
    private long lastUpdated;

    @Version
    private Long version;

    public UserMemory() {}

    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }
    public String getEntriesJson() { return entriesJson; }
    public void setEntriesJson(String entriesJson) { this.entriesJson = entriesJson; }
    public byte[] getEmbeddingBlob() { return embeddingBlob; }
    public void setEmbeddingBlob(byte[] embeddingBlob) { this.embeddingBlob = embeddingBlob; }
    public long getLastUpdated() { return lastUpdated; }
    public void setLastUpdated(long lastUpdated) { this.lastUpdated = lastUpdated; }
    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }
}
