package com.example.healthrag;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request-scoped result of a context build. Never persisted.
 */
public class RetrievalContext {

    private final String ownerId;
    private final String query;
    private final TimeFrame timeFrame;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final Map<String, List<RankedMetric>> metricsByCategory;
    private final MemoryDocument recentMemory;
    private final List<MemoryRecall> memoryRecall;
    private final List<MemoryEntry> insights;
    private final List<ProtocolSnapshot> protocols;
    private final Map<String, Object> debug;
    private final List<String> failedCategories;
    private String rendered;

    RetrievalContext(String ownerId, String query, TimeFrame timeFrame, LocalDate startDate, LocalDate endDate,
                     Map<String, List<RankedMetric>> metricsByCategory, MemoryDocument recentMemory,
                     List<MemoryRecall> memoryRecall, List<MemoryEntry> insights, List<ProtocolSnapshot> protocols,
                     Map<String, Object> debug, List<String> failedCategories) {
        this.ownerId = ownerId;
        this.query = query;
        this.timeFrame = timeFrame;
        this.startDate = startDate;
        this.endDate = endDate;
        this.metricsByCategory = Collections.unmodifiableMap(new LinkedHashMap<>(metricsByCategory));
        this.recentMemory = recentMemory;
        this.memoryRecall = List.copyOf(memoryRecall);
        this.insights = List.copyOf(insights);
        this.protocols = List.copyOf(protocols);
        this.debug = Collections.unmodifiableMap(new LinkedHashMap<>(debug));
        this.failedCategories = List.copyOf(failedCategories);
    }

    public String getOwnerId() { return ownerId; }
    public String getQuery() { return query; }
    public TimeFrame getTimeFrame() { return timeFrame; }
    public LocalDate getStartDate() { return startDate; }
    public LocalDate getEndDate() { return endDate; }

    /** Only categories with at least one hit, in request order. */
    public Map<String, List<RankedMetric>> getMetricsByCategory() { return metricsByCategory; }
    public MemoryDocument getRecentMemory() { return recentMemory; }
    public List<MemoryRecall> getMemoryRecall() { return memoryRecall; }

    /** Newest first. */
    public List<MemoryEntry> getInsights() { return insights; }
    public List<ProtocolSnapshot> getProtocols() { return protocols; }
    public Map<String, Object> getDebug() { return debug; }
    public List<String> getFailedCategories() { return failedCategories; }

    public boolean hasHealthData() { return !metricsByCategory.isEmpty(); }
    public boolean hasProtocols() { return !protocols.isEmpty(); }
    public boolean hasMemory() { return recentMemory != null || !memoryRecall.isEmpty(); }

    public String getRendered() { return rendered; }

    void setRendered(String rendered) { this.rendered = rendered; }
}
