package com.example.healthrag;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-owner narrative memory: a bounded list of timestamped entries with one embedding of the
 * whole rendered document.
 *
 * <p>Appends for one owner run one at a time inside this process; the row version catches
 * writers in other processes, and a conflicting append is retried from a fresh read.
 */
@Service
public class MemoryStore {

    private static final Logger log = LoggerFactory.getLogger(MemoryStore.class);

    private static final TypeReference<List<Map<String, String>>> ENTRY_LIST = new TypeReference<>() {};
    private static final int MAX_ATTEMPTS = 3;

    private final UserMemoryRepository repo;
    private final EmbeddingGenerator embeddingGenerator;
    private final ObjectMapper mapper;
    private final TransactionTemplate tx;
    private final Clock clock;
    private final int maxChars;

    private final ConcurrentHashMap<String, OwnerLock> ownerLocks = new ConcurrentHashMap<>();

    // users is only read and written inside ConcurrentHashMap.compute for the owner's key
    private static final class OwnerLock {
        final ReentrantLock lock = new ReentrantLock();
        int users;
    }

    public MemoryStore(UserMemoryRepository repo, EmbeddingGenerator embeddingGenerator, ObjectMapper mapper,
                       PlatformTransactionManager transactionManager, Clock clock, RetrievalProperties properties) {
        this.repo = repo;
        this.embeddingGenerator = embeddingGenerator;
        this.mapper = mapper;
        this.tx = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.maxChars = properties.getMemory().getMaxChars();
    }

    public Optional<MemoryDocument> get(String ownerId) {
        try {
            return repo.findById(ownerId).map(this::toDocument);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("failed to read memory for " + ownerId, e);
        }
    }

    public MemoryDocument append(String ownerId, String text) {
        return append(ownerId, text, null);
    }

    /**
     * Adds a timestamped entry, drops the oldest entries past the size cap and re-embeds the
     * whole document. A non-empty {@code context} is appended to the entry as
     * {@code "\nContext: k: v, ..."} in key order.
     */
    public MemoryDocument append(String ownerId, String text, Map<String, ?> context) {
        if (ownerId == null || ownerId.isBlank()) throw new IllegalArgumentException("ownerId is required");
        if (text == null || text.isBlank()) throw new IllegalArgumentException("memory text must not be blank");
        String content = text.trim() + contextSuffix(context);

        OwnerLock held = ownerLocks.compute(ownerId, (k, l) -> {
            OwnerLock ol = l == null ? new OwnerLock() : l;
            ol.users++;
            return ol;
        });
        held.lock.lock();
        try {
            for (int attempt = 1; ; attempt++) {
                try {
                    return tx.execute(status -> appendOnce(ownerId, content));
                } catch (OptimisticLockingFailureException e) {
                    if (attempt >= MAX_ATTEMPTS) {
                        throw new StoreUnavailableException("memory for " + ownerId + " kept changing concurrently", e);
                    }
                    log.debug("memory append for {} lost a version race, retrying", ownerId);
                } catch (DataAccessException e) {
                    throw new StoreUnavailableException("failed to append memory for " + ownerId, e);
                }
            }
        } finally {
            held.lock.unlock();
            ownerLocks.computeIfPresent(ownerId, (k, l) -> --l.users == 0 ? null : l);
        }
    }

    int heldOwnerLocks() {
        return ownerLocks.size();
    }

    private MemoryDocument appendOnce(String ownerId, String content) {
        UserMemory row = repo.findById(ownerId).orElse(null);
        List<MemoryEntry> entries = row == null ? new ArrayList<>() : readEntries(row);
        Instant now = clock.instant();
        entries.add(new MemoryEntry(now, content));
        List<MemoryEntry> kept = MemoryDocument.fit(entries, maxChars);
        if (kept.size() < entries.size()) {
            log.debug("memory for {} dropped {} old entries", ownerId, entries.size() - kept.size());
        }

        float[] embedding = embeddingGenerator.embed(MemoryDocument.render(kept));
        if (row == null) {
            row = new UserMemory();
            row.setOwnerId(ownerId);
        }
        row.setEntriesJson(writeEntries(kept));
        try {
            row.setEmbeddingBlob(VectorUtils.floatArrayToGzipBytes(embedding));
        } catch (IOException e) {
            throw new StoreUnavailableException("failed to encode memory embedding for " + ownerId, e);
        }
        row.setLastUpdated(now.toEpochMilli());
        repo.saveAndFlush(row);
        return new MemoryDocument(ownerId, kept, embedding, now);
    }

    /**
     * Ranks the stored document against {@code queryVector}. With one embedding per owner the
     * result holds at most one snippet.
     */
    public List<MemoryRecall> recall(String ownerId, float[] queryVector, int limit, double minSimilarity) {
        if (limit <= 0) return Collections.emptyList();
        Optional<MemoryDocument> doc = get(ownerId);
        if (doc.isEmpty() || doc.get().getEmbedding() == null || doc.get().getEntries().isEmpty()) {
            return Collections.emptyList();
        }
        double similarity = 1.0 - VectorMath.cosineDistance(queryVector, doc.get().getEmbedding());
        if (similarity < minSimilarity) return Collections.emptyList();
        List<MemoryRecall> out = new ArrayList<>(1);
        out.add(new MemoryRecall(doc.get().getText(), similarity, doc.get().getLastUpdated()));
        return out;
    }

    /** Entries oldest first; empty when the owner has no memory. */
    public List<MemoryEntry> extractEntries(String ownerId) {
        return get(ownerId).map(MemoryDocument::getEntries).orElse(Collections.emptyList());
    }

    /** Deletes memory documents not updated within {@code days}. Returns how many were removed. */
    public int pruneOlderThan(int days) {
        if (days < 0) throw new IllegalArgumentException("days must not be negative");
        long cutoff = clock.instant().minus(Duration.ofDays(days)).toEpochMilli();
        try {
            int removed = repo.deleteNotUpdatedSince(cutoff);
            log.info("pruned {} memory documents older than {} days", removed, days);
            return removed;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("failed to prune memories", e);
        }
    }

    static String contextSuffix(Map<String, ?> context) {
        if (context == null || context.isEmpty()) return "";
        StringBuilder sb = new StringBuilder("\nContext: ");
        boolean first = true;
        for (Map.Entry<String, ?> e : new TreeMap<String, Object>(context).entrySet()) {
            if (!first) sb.append(", ");
            sb.append(e.getKey()).append(": ").append(CanonicalRecordText.valueText(e.getValue()));
            first = false;
        }
        return sb.toString();
    }

    private MemoryDocument toDocument(UserMemory row) {
        float[] embedding;
        try {
            embedding = row.getEmbeddingBlob() == null ? null : VectorUtils.gzipBytesToFloatArray(row.getEmbeddingBlob());
        } catch (IOException e) {
            log.warn("stored memory embedding for {} is unreadable: {}", row.getOwnerId(), e.getMessage());
            embedding = null;
        }
        return new MemoryDocument(row.getOwnerId(), readEntries(row), embedding, Instant.ofEpochMilli(row.getLastUpdated()));
    }

    private List<MemoryEntry> readEntries(UserMemory row) {
        List<MemoryEntry> out = new ArrayList<>();
        if (row.getEntriesJson() == null || row.getEntriesJson().isBlank()) return out;
        try {
            for (Map<String, String> m : mapper.readValue(row.getEntriesJson(), ENTRY_LIST)) {
                String ts = m.get("timestamp");
                out.add(new MemoryEntry(ts == null ? null : Instant.parse(ts), m.getOrDefault("content", "")));
            }
        } catch (JsonProcessingException e) {
            throw new StoreUnavailableException("stored memory for " + row.getOwnerId() + " is not valid JSON", e);
        }
        return out;
    }

    private String writeEntries(List<MemoryEntry> entries) {
        List<Map<String, String>> out = new ArrayList<>(entries.size());
        for (MemoryEntry e : entries) {
            Map<String, String> m = new LinkedHashMap<>();
            m.put("timestamp", e.getTimestamp() == null ? null : e.getTimestamp().toString());
            m.put("content", e.getContent());
            out.add(m);
        }
        try {
            return mapper.writeValueAsString(out);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("memory entries are not serializable", e);
        }
    }
}
