package com.example.healthrag;

import java.time.LocalDate;
import java.util.Map;

/**
 * Decrypted, read-side view of a stored health metric.
 */
public class HealthMetricView {

    private String id;
    private String ownerId;
    private String category;
    private LocalDate date;
    private String source;
    private Map<String, Object> fields;

    public HealthMetricView() {}

    public HealthMetricView(String id, String ownerId, String category, LocalDate date, String source, Map<String, Object> fields) {
        this.id = id;
        this.ownerId = ownerId;
        this.category = category;
        this.date = date;
        this.source = source;
        this.fields = fields;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }
    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }
    public LocalDate getDate() { return date; }
    public void setDate(LocalDate date) { this.date = date; }
    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }
    public Map<String, Object> getFields() { return fields; }
    public void setFields(Map<String, Object> fields) { this.fields = fields; }
}
