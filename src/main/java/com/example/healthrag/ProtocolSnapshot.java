package com.example.healthrag;

import java.util.List;

/**
 * A caller-supplied view of one active protocol. The engine only renders it.
 */
public class ProtocolSnapshot {

    private String name;
    private String description;
    private List<String> targetMetrics;
    private String startDate;
    private String durationType;
    private Integer durationDays;

    public ProtocolSnapshot() {}

    public ProtocolSnapshot(String name, String description, List<String> targetMetrics, String startDate,
                            String durationType, Integer durationDays) {
        this.name = name;
        this.description = description;
        this.targetMetrics = targetMetrics;
        this.startDate = startDate;
        this.durationType = durationType;
        this.durationDays = durationDays;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public List<String> getTargetMetrics() { return targetMetrics; }
    public void setTargetMetrics(List<String> targetMetrics) { this.targetMetrics = targetMetrics; }
    public String getStartDate() { return startDate; }
    public void setStartDate(String startDate) { this.startDate = startDate; }
    public String getDurationType() { return durationType; }
    public void setDurationType(String durationType) { this.durationType = durationType; }
    public Integer getDurationDays() { return durationDays; }
    public void setDurationDays(Integer durationDays) { this.durationDays = durationDays; }
}
