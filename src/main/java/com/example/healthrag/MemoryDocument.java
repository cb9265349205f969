package com.example.healthrag;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An owner's memory: entries oldest first, the embedding of the rendered text and the time of
 * the last append.
 */
public final class MemoryDocument {

    static final String SEPARATOR = "\n\n";

    private final String ownerId;
    private final List<MemoryEntry> entries;
    private final float[] embedding;
    private final Instant lastUpdated;

    public MemoryDocument(String ownerId, List<MemoryEntry> entries, float[] embedding, Instant lastUpdated) {
        this.ownerId = ownerId;
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
        this.embedding = embedding == null ? null : VectorMath.copy(embedding);
        this.lastUpdated = lastUpdated;
    }

    public String getOwnerId() { return ownerId; }
    public List<MemoryEntry> getEntries() { return entries; }
    public float[] getEmbedding() { return embedding == null ? null : VectorMath.copy(embedding); }
    public Instant getLastUpdated() { return lastUpdated; }

    public String getText() {
        return render(entries);
    }

    static String render(List<MemoryEntry> entries) {
        StringBuilder sb = new StringBuilder();
        for (MemoryEntry e : entries) {
            if (sb.length() > 0) sb.append(SEPARATOR);
            sb.append(e.render());
        }
        return sb.toString();
    }

    /**
     * Drops whole entries from the front until the rendered text fits in {@code maxChars}.
     * A lone entry that is still too long keeps its header and the start of its content.
     */
    static List<MemoryEntry> fit(List<MemoryEntry> entries, int maxChars) {
        List<MemoryEntry> out = new ArrayList<>(entries);
        int length = render(out).length();
        while (length > maxChars && out.size() > 1) {
            length -= out.get(0).render().length() + SEPARATOR.length();
            out.remove(0);
        }
        if (out.size() == 1 && length > maxChars) {
            MemoryEntry only = out.get(0);
            int header = only.render().length() - only.getContent().length();
            int keep = Math.max(0, maxChars - header);
            out.set(0, only.withContent(only.getContent().substring(0, Math.min(keep, only.getContent().length()))));
        }
        return out;
    }
}
