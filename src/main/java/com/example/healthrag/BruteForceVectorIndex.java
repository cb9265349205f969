package com.example.healthrag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Exact-scan index: every search scores all of the owner's records. Used for development
 * ({@code ann-dev} profile) and as the reference the HNSW index is tested against.
 */
@Service
@Profile("ann-dev")
public class BruteForceVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(BruteForceVectorIndex.class);

    private final Map<String, IndexedRecord> store = new HashMap<>();
    private final Map<String, Set<String>> idsByOwner = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Autowired(required = false)
    private HealthMetricRepository metricRepository;

    public BruteForceVectorIndex() {
    }

    @Override
    public void upsert(IndexedRecord record) {
        lock.writeLock().lock();
        try {
            IndexedRecord previous = store.put(record.getId(), record);
            if (previous != null && !previous.getOwnerId().equals(record.getOwnerId())) {
                idsByOwner.getOrDefault(previous.getOwnerId(), Collections.emptySet()).remove(record.getId());
            }
            idsByOwner.computeIfAbsent(record.getOwnerId(), k -> new HashSet<>()).add(record.getId());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean remove(String id) {
        lock.writeLock().lock();
        try {
            IndexedRecord removed = store.remove(id);
            if (removed == null) return false;
            Set<String> ids = idsByOwner.get(removed.getOwnerId());
            if (ids != null) {
                ids.remove(id);
                if (ids.isEmpty()) idsByOwner.remove(removed.getOwnerId());
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<ScoredRecord> search(VectorSearchRequest request) {
        lock.readLock().lock();
        try {
            return VectorScan.exact(ownerRecords(request.getOwnerId()), request);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Set<String> categories(String ownerId) {
        lock.readLock().lock();
        try {
            Set<String> out = new TreeSet<>();
            for (IndexedRecord r : ownerRecords(ownerId)) {
                if (r.getCategory() != null) out.add(r.getCategory());
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void rebuildFromDatabase() {
        // reload all persisted vectors into the in-memory store
        lock.writeLock().lock();
        try {
            store.clear();
            idsByOwner.clear();
            if (metricRepository == null) return;
            for (HealthMetricRecord r : metricRepository.findAll()) {
                try {
                    IndexedRecord ir = r.toIndexedRecord();
                    store.put(ir.getId(), ir);
                    idsByOwner.computeIfAbsent(ir.getOwnerId(), k -> new HashSet<>()).add(ir.getId());
                } catch (Exception ex) {
                    log.warn("skipping metric {} with unreadable vector: {}", r.getId(), ex.getMessage());
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public long size() {
        lock.readLock().lock();
        try { return store.size(); } finally { lock.readLock().unlock(); }
    }

    private List<IndexedRecord> ownerRecords(String ownerId) {
        Set<String> ids = idsByOwner.getOrDefault(ownerId, Collections.emptySet());
        List<IndexedRecord> out = new ArrayList<>(ids.size());
        for (String id : ids) out.add(store.get(id));
        return out;
    }
}
