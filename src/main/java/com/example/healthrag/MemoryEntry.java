package com.example.healthrag;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * One timestamped note in an owner's memory document.
 */
public final class MemoryEntry {

    static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final Instant timestamp;
    private final String content;

    public MemoryEntry(Instant timestamp, String content) {
        this.timestamp = timestamp;
        this.content = Objects.requireNonNull(content, "content");
    }

    public Instant getTimestamp() { return timestamp; }
    public String getContent() { return content; }

    /** {@code [yyyy-MM-dd HH:mm:ss] content}, or just the content when there is no timestamp. */
    public String render() {
        if (timestamp == null) return content;
        return "[" + STAMP.format(timestamp) + "] " + content;
    }

    MemoryEntry withContent(String newContent) {
        return new MemoryEntry(timestamp, newContent);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MemoryEntry)) return false;
        MemoryEntry that = (MemoryEntry) o;
        return Objects.equals(timestamp, that.timestamp) && content.equals(that.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, content);
    }

    @Override
    public String toString() {
        return render();
    }
}
