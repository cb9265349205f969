package com.example.healthrag;

import com.github.jelmerk.hnswlib.core.Item;
import com.github.jelmerk.hnswlib.core.SearchResult;
import com.github.jelmerk.hnswlib.core.hnsw.HnswIndex;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.io.*;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Vector index partitioned by owner. Each partition is scanned exactly while it is small and
 * switches to its own jelmerk HNSW graph once it grows past {@code hnsw.exact-scan.threshold},
 * so query cost stays sub-linear for large owners and owners never share candidates.
 *
 * <p>Graphs are built for {@code hnsw.metric}. A search under a different metric falls back to
 * an exact scan of the partition.
 */
@Service
@Profile("!ann-dev")
public class HnswVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(HnswVectorIndex.class);

    private final Map<String, IndexedRecord> records = new HashMap<>();
    private final Map<String, OwnerPartition> partitions = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile int dimension = -1;

    // configurable HNSW parameters (can be overridden in application.properties)
    @Value("${hnsw.m:16}")
    private int m;

    @Value("${hnsw.efConstruction:200}")
    private int efConstruction;

    @Value("${hnsw.ef:64}")
    private int ef;

    @Value("${hnsw.initial.capacity:1024}")
    private int initialCapacity;

    @Value("${hnsw.exact-scan.threshold:256}")
    private int exactScanThreshold;

    @Value("${hnsw.metric:cosine}")
    private String metricName;

    @Value("${hnsw.rebuild.page.size:1000}")
    private int rebuildPageSize;

    @Value("${hnsw.persist.path:./data/vector-index.idx}")
    private String persistPath;

    @Value("${hnsw.auto.persist.enabled:false}")
    private boolean autoPersistEnabled;

    @Value("${hnsw.auto.load.enabled:false}")
    private boolean autoLoadEnabled;

    private volatile String lastPersistedPath = null;
    private volatile Instant lastPersistedAt = null;

    @Autowired(required = false)
    private HealthMetricRepository metricRepository; // used for full rebuild

    public HnswVectorIndex() {
    }

    // package-private constructor for tests to configure small HNSW params without reflection
    HnswVectorIndex(int m, int efConstruction, int ef, int initialCapacity, int exactScanThreshold) {
        this.m = m;
        this.efConstruction = efConstruction;
        this.ef = ef;
        this.initialCapacity = initialCapacity;
        this.exactScanThreshold = exactScanThreshold;
        this.metricName = "cosine";
        this.rebuildPageSize = 1000;
    }

    @PostConstruct
    public void tryAutoLoad() {
        if (!autoLoadEnabled || persistPath == null || persistPath.isBlank()) return;
        Path p = Path.of(persistPath);
        if (!Files.exists(p)) return;
        try {
            loadFrom(p);
            lastPersistedPath = p.toAbsolutePath().toString();
            lastPersistedAt = Instant.now();
            log.info("Loaded vector index from {}", lastPersistedPath);
        } catch (Exception e) {
            log.warn("Failed to load persisted vector index from {}: {}", persistPath, e.getMessage());
        }
    }

    DistanceMetric indexMetric() {
        return DistanceMetric.fromName(metricName);
    }

    @Override
    public void upsert(IndexedRecord record) {
        lock.writeLock().lock();
        try {
            float[] v = record.embeddingRef();
            if (dimension == -1) dimension = v.length;
            else VectorMath.requireDimension(v, dimension);

            IndexedRecord previous = records.put(record.getId(), record);
            if (previous != null && !previous.getOwnerId().equals(record.getOwnerId())) {
                OwnerPartition old = partitions.get(previous.getOwnerId());
                if (old != null) old.remove(previous.getId());
            }
            partitions.computeIfAbsent(record.getOwnerId(), k -> new OwnerPartition(k)).add(record);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean remove(String id) {
        lock.writeLock().lock();
        try {
            IndexedRecord removed = records.remove(id);
            if (removed == null) return false;
            OwnerPartition p = partitions.get(removed.getOwnerId());
            if (p != null) {
                p.remove(id);
                if (p.ids.isEmpty()) partitions.remove(removed.getOwnerId());
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
            OwnerPartition p = partitions.get(request.getOwnerId());
            if (p == null) return new ArrayList<>();
            if (dimension != -1) VectorMath.requireDimension(request.getQueryVector(), dimension);
            if (p.graph == null || request.getMetric() != indexMetric()) {
                return VectorScan.exact(p.records(), request);
            }
            return approximate(p, request);
        } finally {
            lock.readLock().unlock();
        }
    }

    // widen k until enough filtered hits, the partition is exhausted, or results pass the threshold
    private List<ScoredRecord> approximate(OwnerPartition p, VectorSearchRequest q) {
        float[] query = VectorScan.prepareQuery(q);
        int total = p.ids.size();
        int k = Math.min(total, Math.max(q.getLimit() * 4, ef));
        while (true) {
            List<SearchResult<IndexedItem, Float>> nearest = p.graph.findNearest(query, k);
            List<ScoredRecord> hits = new ArrayList<>();
            boolean passedThreshold = false;
            for (SearchResult<IndexedItem, Float> res : nearest) {
                IndexedRecord r = records.get(res.item().id());
                if (r == null) continue;
                ScoredRecord s = VectorScan.score(r, query, q);
                if (!VectorScan.withinThreshold(s.getDistance(), q)) {
                    passedThreshold = true;
                    continue;
                }
                if (VectorScan.matches(r, q)) hits.add(s);
            }
            if (hits.size() >= q.getLimit() || k >= total || passedThreshold) {
                hits.sort(VectorScan.ASCENDING);
                return hits.size() > q.getLimit() ? new ArrayList<>(hits.subList(0, q.getLimit())) : hits;
            }
            k = Math.min(total, k * 2);
        }
    }

    @Override
    public Set<String> categories(String ownerId) {
        lock.readLock().lock();
        try {
            Set<String> out = new TreeSet<>();
            OwnerPartition p = partitions.get(ownerId);
            if (p == null) return out;
            for (IndexedRecord r : p.records()) {
                if (r.getCategory() != null) out.add(r.getCategory());
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long size() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void rebuildFromDatabase() throws Exception {
        if (metricRepository == null) {
            throw new IllegalStateException("HealthMetricRepository not available for rebuild");
        }
        lock.writeLock().lock();
        try {
            records.clear();
            partitions.clear();
            dimension = -1;
            // Paged scan to avoid loading all vectors into memory at once
            int page = 0;
            int skipped = 0;
            while (true) {
                Page<HealthMetricRecord> p = metricRepository.findAll(PageRequest.of(page, rebuildPageSize));
                if (!p.hasContent()) break;
                for (HealthMetricRecord r : p.getContent()) {
                    try {
                        upsert(r.toIndexedRecord());
                    } catch (IOException | DimensionMismatchException ex) {
                        skipped++;
                        log.warn("skipping metric {} during rebuild: {}", r.getId(), ex.getMessage());
                    }
                }
                if (!p.hasNext()) break;
                page++;
            }
            log.info("Rebuilt vector index: {} records, {} owners, {} skipped", records.size(), partitions.size(), skipped);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void persistTo(Path file) throws Exception {
        lock.readLock().lock();
        try {
            ArrayList<IndexedRecord> snapshot = new ArrayList<>(records.values());
            snapshot.sort(Comparator.comparing(IndexedRecord::getId));
            try (ObjectOutputStream oos = new ObjectOutputStream(new BufferedOutputStream(new FileOutputStream(file.toFile())))) {
                oos.writeObject(snapshot);
            }
            lastPersistedPath = file.toAbsolutePath().toString();
            lastPersistedAt = Instant.now();
            log.info("Persisted vector index ({} records) to {}", snapshot.size(), lastPersistedPath);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public void loadFrom(Path file) throws Exception {
        List<IndexedRecord> loaded;
        try (ObjectInputStream ois = new ObjectInputStream(new BufferedInputStream(new FileInputStream(file.toFile())))) {
            Object o = ois.readObject();
            if (!(o instanceof List)) throw new IOException("not a vector index snapshot: " + file);
            loaded = (List<IndexedRecord>) o;
        }
        lock.writeLock().lock();
        try {
            records.clear();
            partitions.clear();
            dimension = -1;
            for (IndexedRecord r : loaded) upsert(r);
            log.info("loadFrom: index size after load={} owners={}", records.size(), partitions.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    // allow runtime reconfiguration of HNSW params (rebuilds every graph)
    public void reconfigure(int newM, int newEfConstruction, int newEf) {
        lock.writeLock().lock();
        try {
            this.m = newM;
            this.efConstruction = newEfConstruction;
            this.ef = newEf;
            for (OwnerPartition p : partitions.values()) {
                if (p.graph != null) p.buildGraph(p.graph.getMaxItemCount());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Map<String, Object> getHnswParams() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("m", m);
        out.put("efConstruction", efConstruction);
        out.put("ef", ef);
        out.put("initialCapacity", initialCapacity);
        out.put("exactScanThreshold", exactScanThreshold);
        out.put("metric", indexMetric().name());
        return out;
    }

    public int getDimensions() { return this.dimension; }

    /** Owners whose partition is currently served by an HNSW graph. */
    public int graphPartitionCount() {
        lock.readLock().lock();
        try {
            int n = 0;
            for (OwnerPartition p : partitions.values()) if (p.graph != null) n++;
            return n;
        } finally {
            lock.readLock().unlock();
        }
    }

    @PreDestroy
    public void autoPersistOnShutdown() {
        if (!autoPersistEnabled) return;
        if (persistPath == null || persistPath.isBlank()) {
            log.warn("persistPath not configured; skipping auto-persist");
            return;
        }
        try {
            Path p = Path.of(persistPath);
            if (p.getParent() != null) Files.createDirectories(p.getParent());
            persistTo(p);
        } catch (Exception e) {
            log.error("Failed to auto-persist vector index: {}", e.getMessage(), e);
        }
    }

    public Map<String, Object> getLastPersistInfo() {
        Map<String, Object> out = new HashMap<>();
        out.put("path", lastPersistedPath);
        out.put("timestamp", lastPersistedAt == null ? null : lastPersistedAt.toString());
        out.put("autoPersistEnabled", autoPersistEnabled);
        return out;
    }

    private final class OwnerPartition {
        private final String ownerId;
        private final Set<String> ids = new HashSet<>();
        private HnswIndex<String, float[], IndexedItem, Float> graph;
        // graph slots consumed since the last build; replaced items still hold a slot
        private int insertions;

        OwnerPartition(String ownerId) {
            this.ownerId = ownerId;
        }

        void add(IndexedRecord r) {
            ids.add(r.getId());
            if (graph == null) {
                if (ids.size() > exactScanThreshold) buildGraph(Math.max(initialCapacity, ids.size() * 2));
                return;
            }
            if (insertions >= graph.getMaxItemCount()) {
                buildGraph(Math.max(graph.getMaxItemCount() * 2, ids.size() * 2));
                return;
            }
            graph.add(new IndexedItem(r.getId(), r.embeddingRef()));
            insertions++;
        }

        void remove(String id) {
            if (!ids.remove(id)) return;
            if (graph != null) graph.remove(id, 0L);
        }

        void buildGraph(int capacity) {
            HnswIndex<String, float[], IndexedItem, Float> g = HnswIndex
                    .newBuilder(dimension, indexMetric().hnswFunction(), capacity)
                    .withM(m)
                    .withEfConstruction(efConstruction)
                    .withEf(ef)
                    .withRemoveEnabled()
                    .build();
            for (String id : ids) {
                g.add(new IndexedItem(id, records.get(id).embeddingRef()));
            }
            this.graph = g;
            this.insertions = ids.size();
            log.debug("built HNSW graph for owner {} with {} items (capacity {})", ownerId, ids.size(), capacity);
        }

        List<IndexedRecord> records() {
            List<IndexedRecord> out = new ArrayList<>(ids.size());
            for (String id : ids) out.add(records.get(id));
            return out;
        }
    }
}

// Item implementation for jelmerk HNSW; shares the record's vector array
class IndexedItem implements Item<String, float[]> {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final float[] vector;

    IndexedItem(String id, float[] vector) {
        this.id = id;
        this.vector = vector;
    }

    @Override
    public String id() { return id; }

    @Override
    public float[] vector() { return vector; }

    @Override
    public int dimensions() { return vector.length; }

    @Override
    public long version() { return 0L; }
}
