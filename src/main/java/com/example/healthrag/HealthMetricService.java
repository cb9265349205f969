package com.example.healthrag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable side of metric ingestion. One row per owner, category, date and source: a repeated
 * ingest replaces the row and re-embeds it when the canonical text changed.
 *
 * <p>The vector index only learns about a row once its transaction has committed.
 */
@Service
public class HealthMetricService implements MetricRecordLookup {

    private static final Logger log = LoggerFactory.getLogger(HealthMetricService.class);

    private final HealthMetricRepository repo;
    private final EmbeddingGenerator embeddingGenerator;
    private final VectorIndex vectorIndex;
    private final RecordCipher cipher;
    private final SourceFieldMapper fieldMapper;
    private final Clock clock;
    private final TransactionTemplate tx;

    public HealthMetricService(HealthMetricRepository repo, EmbeddingGenerator embeddingGenerator, VectorIndex vectorIndex,
                               RecordCipher cipher, SourceFieldMapper fieldMapper, Clock clock,
                               PlatformTransactionManager transactionManager) {
        this.repo = repo;
        this.embeddingGenerator = embeddingGenerator;
        this.vectorIndex = vectorIndex;
        this.cipher = cipher;
        this.fieldMapper = fieldMapper;
        this.clock = clock;
        this.tx = new TransactionTemplate(transactionManager);
    }

    static String idFor(String ownerId, String category, LocalDate date, String source) {
        return ownerId + ":" + category + ":" + date + ":" + source;
    }

    public HealthMetricView ingest(String ownerId, LocalDate date, String category, String source, Map<String, Object> rawFields) {
        if (ownerId == null || ownerId.isBlank()) throw new IllegalArgumentException("ownerId is required");
        if (date == null) throw new IllegalArgumentException("date is required");
        if (category == null || category.isBlank()) throw new IllegalArgumentException("category is required");
        String src = source == null || source.isBlank() ? "manual" : source;

        MetricValue value = MetricValue.of(category, fieldMapper.standardize(src, category, rawFields));
        Map<String, Object> fields = new LinkedHashMap<>(value.toFields());
        String canonical = CanonicalRecordText.render(category, fields, src);
        String checksum = checksumFor(canonical);
        String id = idFor(ownerId, category, date, src);

        try {
            tx.executeWithoutResult(status -> store(id, ownerId, date, category, src, fields, canonical, checksum));
        } catch (DataAccessException | TransactionException e) {
            throw new StoreUnavailableException("failed to store metric " + id, e);
        }
        return new HealthMetricView(id, ownerId, category, date, src, fields);
    }

    private void store(String id, String ownerId, LocalDate date, String category, String src,
                       Map<String, Object> fields, String canonical, String checksum) {
        HealthMetricRecord existing = repo.findById(id).orElse(null);
        if (existing != null && checksum.equals(existing.getChecksum())) {
            log.debug("metric {} unchanged", id);
            return;
        }
        float[] vec = embeddingGenerator.embed(canonical);
        long now = clock.millis();
        HealthMetricRecord r = existing == null ? new HealthMetricRecord() : existing;
        r.setId(id);
        r.setOwnerId(ownerId);
        r.setCategory(category);
        r.setRecordDate(date);
        r.setSource(src);
        r.setPayload(cipher.encrypt(fields));
        IndexedRecord indexed;
        try {
            r.setVectorBlob(VectorUtils.floatArrayToGzipBytes(vec));
            r.setVectorJson(VectorUtils.floatArrayToJson(vec));
            indexed = r.toIndexedRecord();
        } catch (IOException e) {
            throw new StoreUnavailableException("failed to encode embedding for metric " + id, e);
        }
        r.setChecksum(checksum);
        if (existing == null) r.setCreatedAt(now);
        r.setUpdatedAt(now);
        repo.saveAndFlush(r);
        afterCommit(() -> vectorIndex.upsert(indexed));
        log.info("stored metric {} ({} fields)", id, fields.size());
    }

    public Optional<HealthMetricView> get(String ownerId, String id) {
        try {
            return repo.findById(id).filter(r -> r.getOwnerId().equals(ownerId)).map(this::toView);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("failed to read metric " + id, e);
        }
    }

    public List<HealthMetricView> list(String ownerId, String category, LocalDate start, LocalDate end) {
        try {
            List<HealthMetricRecord> rows = repo.findAll(HealthMetricSpecifications.matching(ownerId, category, start, end),
                    Sort.by(Sort.Direction.DESC, "recordDate").and(Sort.by("category")));
            List<HealthMetricView> out = new ArrayList<>(rows.size());
            for (HealthMetricRecord r : rows) out.add(toView(r));
            return out;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("failed to list metrics for " + ownerId, e);
        }
    }

    public boolean delete(String ownerId, String id) {
        try {
            Boolean deleted = tx.execute(status -> {
                Optional<HealthMetricRecord> r = repo.findById(id).filter(x -> x.getOwnerId().equals(ownerId));
                if (r.isEmpty()) return false;
                repo.delete(r.get());
                afterCommit(() -> vectorIndex.remove(id));
                return true;
            });
            return Boolean.TRUE.equals(deleted);
        } catch (DataAccessException | TransactionException e) {
            throw new StoreUnavailableException("failed to delete metric " + id, e);
        }
    }

    // runs the action once the surrounding transaction commits, or right away without one
    private static void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }

    @Override
    public Map<String, HealthMetricView> findByIds(String ownerId, Collection<String> ids) {
        Map<String, HealthMetricView> out = new LinkedHashMap<>();
        if (ids == null || ids.isEmpty()) return out;
        try {
            for (HealthMetricRecord r : repo.findByOwnerIdAndIdIn(ownerId, ids)) out.put(r.getId(), toView(r));
            return out;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("failed to resolve metrics for " + ownerId, e);
        }
    }

    private HealthMetricView toView(HealthMetricRecord r) {
        return new HealthMetricView(r.getId(), r.getOwnerId(), r.getCategory(), r.getRecordDate(), r.getSource(),
                cipher.decrypt(r.getPayload()));
    }

    private static String checksumFor(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-1");
            byte[] d = md.digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte bb : d) sb.append(String.format("%02x", bb));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
