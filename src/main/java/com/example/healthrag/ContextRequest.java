package com.example.healthrag;

import java.util.ArrayList;
import java.util.List;

/**
 * Input of one context build. An empty category list means every category the owner has.
 */
public class ContextRequest {

    private String ownerId;
    private String query;
    private List<String> categories = new ArrayList<>();
    private TimeFrame timeFrame = TimeFrame.LAST_DAY;
    private List<ProtocolSnapshot> protocols = new ArrayList<>();
    private boolean includeDebug;

    public ContextRequest() {}

    public ContextRequest(String ownerId, String query) {
        this.ownerId = ownerId;
        this.query = query;
    }

    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }
    public String getQuery() { return query; }
    public void setQuery(String query) { this.query = query; }
    public List<String> getCategories() { return categories; }
    public void setCategories(List<String> categories) { this.categories = categories == null ? new ArrayList<>() : categories; }
    public TimeFrame getTimeFrame() { return timeFrame; }
    public void setTimeFrame(TimeFrame timeFrame) { this.timeFrame = timeFrame == null ? TimeFrame.LAST_DAY : timeFrame; }
    public List<ProtocolSnapshot> getProtocols() { return protocols; }
    public void setProtocols(List<ProtocolSnapshot> protocols) { this.protocols = protocols == null ? new ArrayList<>() : protocols; }
    public boolean isIncludeDebug() { return includeDebug; }
    public void setIncludeDebug(boolean includeDebug) { this.includeDebug = includeDebug; }
}
