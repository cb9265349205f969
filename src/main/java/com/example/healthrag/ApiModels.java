package com.example.healthrag;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public class ApiModels {

    public static class InsightRequest {
        private String ownerId;
        private String query;
        private List<String> metricTypes;   // optional, empty means every category
        private String timeFrame;
        private List<ProtocolSnapshot> protocols;
        private boolean updateMemory = true;
        private boolean useCache = true;
        private boolean includeDebug;

        public String getOwnerId() { return ownerId; }
        public void setOwnerId(String ownerId) { this.ownerId = ownerId; }
        public String getQuery() { return query; }
        public void setQuery(String query) { this.query = query; }
        public List<String> getMetricTypes() { return metricTypes; }
        public void setMetricTypes(List<String> metricTypes) { this.metricTypes = metricTypes; }
        public String getTimeFrame() { return timeFrame; }
        public void setTimeFrame(String timeFrame) { this.timeFrame = timeFrame; }
        public List<ProtocolSnapshot> getProtocols() { return protocols; }
        public void setProtocols(List<ProtocolSnapshot> protocols) { this.protocols = protocols; }
        public boolean isUpdateMemory() { return updateMemory; }
        public void setUpdateMemory(boolean updateMemory) { this.updateMemory = updateMemory; }
        public boolean isUseCache() { return useCache; }
        public void setUseCache(boolean useCache) { this.useCache = useCache; }
        public boolean isIncludeDebug() { return includeDebug; }
        public void setIncludeDebug(boolean includeDebug) { this.includeDebug = includeDebug; }

        ContextRequest toContextRequest() {
            ContextRequest c = new ContextRequest(ownerId, query);
            c.setCategories(metricTypes);
            c.setTimeFrame(TimeFrame.fromName(timeFrame));
            c.setProtocols(protocols);
            c.setIncludeDebug(includeDebug);
            return c;
        }
    }

    public static class TrendRequest {
        private String ownerId;
        private String metricType;
        private String timePeriod = "last_month";
        private boolean useCache = true;

        public String getOwnerId() { return ownerId; }
        public void setOwnerId(String ownerId) { this.ownerId = ownerId; }
        public String getMetricType() { return metricType; }
        public void setMetricType(String metricType) { this.metricType = metricType; }
        public String getTimePeriod() { return timePeriod; }
        public void setTimePeriod(String timePeriod) { this.timePeriod = timePeriod; }
        public boolean isUseCache() { return useCache; }
        public void setUseCache(boolean useCache) { this.useCache = useCache; }
    }

    public static class ContextPreview {
        private String rendered;
        private Map<String, Object> debug;
        private List<String> categoriesWithData;
        private List<String> failedCategories;

        public String getRendered() { return rendered; }
        public void setRendered(String rendered) { this.rendered = rendered; }
        public Map<String, Object> getDebug() { return debug; }
        public void setDebug(Map<String, Object> debug) { this.debug = debug; }
        public List<String> getCategoriesWithData() { return categoriesWithData; }
        public void setCategoriesWithData(List<String> categoriesWithData) { this.categoriesWithData = categoriesWithData; }
        public List<String> getFailedCategories() { return failedCategories; }
        public void setFailedCategories(List<String> failedCategories) { this.failedCategories = failedCategories; }
    }

    public static class MetricIngestRequest {
        private String ownerId;
        private LocalDate date;
        private String category;
        private String source;
        private Map<String, Object> fields;

        public String getOwnerId() { return ownerId; }
        public void setOwnerId(String ownerId) { this.ownerId = ownerId; }
        public LocalDate getDate() { return date; }
        public void setDate(LocalDate date) { this.date = date; }
        public String getCategory() { return category; }
        public void setCategory(String category) { this.category = category; }
        public String getSource() { return source; }
        public void setSource(String source) { this.source = source; }
        public Map<String, Object> getFields() { return fields; }
        public void setFields(Map<String, Object> fields) { this.fields = fields; }
    }

    public static class MemoryAppendRequest {
        private String text;
        private Map<String, Object> context;

        public String getText() { return text; }
        public void setText(String text) { this.text = text; }
        public Map<String, Object> getContext() { return context; }
        public void setContext(Map<String, Object> context) { this.context = context; }
    }

    public static class MemoryResponse {
        private String ownerId;
        private String text;
        private String lastUpdated;
        private int entryCount;

        static MemoryResponse of(MemoryDocument doc) {
            MemoryResponse r = new MemoryResponse();
            r.ownerId = doc.getOwnerId();
            r.text = doc.getText();
            r.lastUpdated = doc.getLastUpdated() == null ? null : doc.getLastUpdated().toString();
            r.entryCount = doc.getEntries().size();
            return r;
        }

        public String getOwnerId() { return ownerId; }
        public String getText() { return text; }
        public String getLastUpdated() { return lastUpdated; }
        public int getEntryCount() { return entryCount; }
    }

    public static class MemoryEntryView {
        private String timestamp;
        private String content;

        static MemoryEntryView of(MemoryEntry e) {
            MemoryEntryView v = new MemoryEntryView();
            v.timestamp = e.getTimestamp() == null ? null : e.getTimestamp().toString();
            v.content = e.getContent();
            return v;
        }

        public String getTimestamp() { return timestamp; }
        public String getContent() { return content; }
    }
}
