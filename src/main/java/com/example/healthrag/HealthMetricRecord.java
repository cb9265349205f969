package com.example.healthrag;

import jakarta.persistence.*;

import java.io.IOException;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;

@Entity
@Table(name = "health_metrics", indexes = {
        @Index(name = "idx_metric_owner_category", columnList = "owner_id,category"),
        @Index(name = "idx_metric_owner_date", columnList = "owner_id,record_date")
})
public class HealthMetricRecord {

    @Id
    private String id;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Column(name = "category", nullable = false)
    private String category;

    @Column(name = "record_date", nullable = false)
    private LocalDate recordDate;

    @Column(name = "source", nullable = false)
    private String source;

    // field map as produced by the RecordCipher, never plaintext at rest
    @Lob
    @Column(name = "payload", columnDefinition = "CLOB")
    private String payload;

    // compressed binary embedding blob (GZIPped float bytes)
    @Lob
    @Column(name = "vector_blob", columnDefinition = "BLOB")
    private byte[] vectorBlob;

    @Lob
    @Column(name = "vector", columnDefinition = "CLOB")
    private String vectorJson;

    @Column(name = "checksum")
    private String checksum;

    private long createdAt;

    private long updatedAt;

    public HealthMetricRecord() {}

    /**
     * Index view of this row. The record date maps to midnight UTC.
     */
    public IndexedRecord toIndexedRecord() throws IOException {
        float[] v = VectorUtils.decode(vectorBlob, vectorJson);
        if (v == null) throw new IOException("no stored embedding for metric " + id);
        return new IndexedRecord(id, ownerId, category, recordDate.atStartOfDay(ZoneOffset.UTC).toInstant(),
                Map.of("source", source), v);
    }

    // getters/setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }
    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }
    public LocalDate getRecordDate() { return recordDate; }
    public void setRecordDate(LocalDate recordDate) { this.recordDate = recordDate; }
    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }
    public String getPayload() { return payload; }
    public void setPayload(String payload) { this.payload = payload; }
    public byte[] getVectorBlob() { return vectorBlob; }
    public void setVectorBlob(byte[] vectorBlob) { this.vectorBlob = vectorBlob; }
    public String getVectorJson() { return vectorJson; }
    public void setVectorJson(String vectorJson) { this.vectorJson = vectorJson; }
    public String getChecksum() { return checksum; }
    public void setChecksum(String checksum) { this.checksum = checksum; }
    public long getCreatedAt() { return createdAt; }
    public void setCreatedAt(long createdAt) { this.createdAt = createdAt; }
    public long getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(long updatedAt) { this.updatedAt = updatedAt; }
}
