package com.example.healthrag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Builds the retrieval context for one query: embeds it once, searches every category in
 * parallel, pulls memory recall and recent insights, and renders the result.
 *
 * <p>A category whose search fails is left out and reported in the debug counters. Embedding
 * failures and dimension mismatches abort the whole build.
 */
@Service
public class ContextAssembler {

    private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);

    private final EmbeddingGenerator embeddingGenerator;
    private final VectorIndex vectorIndex;
    private final MetricRecordLookup metricLookup;
    private final MemoryStore memoryStore;
    private final ContextRenderer renderer;
    private final ExecutorService executor;
    private final Clock clock;
    private final RetrievalProperties properties;

    public ContextAssembler(EmbeddingGenerator embeddingGenerator, VectorIndex vectorIndex, MetricRecordLookup metricLookup,
                            MemoryStore memoryStore, ContextRenderer renderer,
                            @Qualifier("retrievalExecutor") ExecutorService executor, Clock clock,
                            RetrievalProperties properties) {
        this.embeddingGenerator = embeddingGenerator;
        this.vectorIndex = vectorIndex;
        this.metricLookup = metricLookup;
        this.memoryStore = memoryStore;
        this.renderer = renderer;
        this.executor = executor;
        this.clock = clock;
        this.properties = properties;
    }

    // null and blank entries would search without a category filter
    static List<String> requestedCategories(List<String> requested) {
        Set<String> out = new LinkedHashSet<>();
        for (String category : requested) {
            if (category != null && !category.isBlank()) out.add(category.trim());
        }
        return new ArrayList<>(out);
    }

    public RetrievalContext buildContext(ContextRequest request) {
        String ownerId = request.getOwnerId();
        if (ownerId == null || ownerId.isBlank()) throw new IllegalArgumentException("ownerId is required");
        if (request.getQuery() == null || request.getQuery().isBlank()) throw new IllegalArgumentException("query is required");

        float[] queryVector = embeddingGenerator.embed(request.getQuery());

        TimeFrame timeFrame = request.getTimeFrame();
        LocalDate end = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        LocalDate start = timeFrame.startFrom(end);
        Map<String, Object> debug = new LinkedHashMap<>();
        debug.put("date_range", start + " to " + end);

        List<String> categories = requestedCategories(request.getCategories());
        if (categories.isEmpty()) {
            categories = new ArrayList<>(new TreeSet<>(vectorIndex.categories(ownerId)));
            debug.put("available_metric_types", categories);
        }

        Instant from = start.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant to = end.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        Map<String, Future<List<RankedMetric>>> pending = new LinkedHashMap<>();
        for (String category : categories) {
            pending.put(category, executor.submit(() -> searchCategory(ownerId, category, queryVector, from, to)));
        }

        // memory runs on the caller thread while the category searches proceed
        MemoryDocument recent = null;
        List<MemoryRecall> recall = Collections.emptyList();
        List<MemoryEntry> insights = Collections.emptyList();
        try {
            RetrievalProperties.Memory mem = properties.getMemory();
            recent = memoryStore.get(ownerId).orElse(null);
            recall = memoryStore.recall(ownerId, queryVector, mem.getRecallLimit(), mem.getRecallMinSimilarity());
            if (recent != null) insights = newestFirst(recent.getEntries(), mem.getMaxInsights());
        } catch (StoreUnavailableException e) {
            log.warn("memory unavailable for {}: {}", ownerId, e.getMessage());
            debug.put("memory_error", e.getMessage());
        }

        Map<String, List<RankedMetric>> found = new LinkedHashMap<>();
        List<String> failed = new ArrayList<>();
        for (Map.Entry<String, Future<List<RankedMetric>>> e : pending.entrySet()) {
            String category = e.getKey();
            try {
                List<RankedMetric> hits = e.getValue().get();
                debug.put("metrics_found_" + category, hits.size());
                if (!hits.isEmpty()) found.put(category, hits);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                cancelAll(pending);
                throw new RetrievalException("interrupted while searching " + category, ie);
            } catch (ExecutionException ee) {
                Throwable cause = ee.getCause();
                if (cause instanceof EmbeddingUnavailableException || cause instanceof DimensionMismatchException) {
                    cancelAll(pending);
                    throw (RuntimeException) cause;
                }
                log.warn("search for category {} of {} failed: {}", category, ownerId, String.valueOf(cause));
                debug.put("metrics_found_" + category, 0);
                debug.put("metrics_error_" + category, cause == null ? "unknown" : cause.getClass().getSimpleName());
                failed.add(category);
            }
        }

        if (!request.getProtocols().isEmpty()) debug.put("active_protocols_count", request.getProtocols().size());

        RetrievalContext ctx = new RetrievalContext(ownerId, request.getQuery(), timeFrame, start, end, found, recent,
                recall, insights, request.getProtocols(), debug, failed);
        ctx.setRendered(renderer.render(ctx, request.isIncludeDebug()));
        log.debug("context for {}: {} categories with data, {} failed", ownerId, found.size(), failed.size());
        return ctx;
    }

    private List<RankedMetric> searchCategory(String ownerId, String category, float[] queryVector, Instant from, Instant to) {
        VectorSearchRequest search = VectorSearchRequest.forOwner(ownerId, queryVector)
                .category(category)
                .metric(DistanceMetric.COSINE)
                .minSimilarity(properties.getSimilarityThreshold())
                .limit(properties.getMaxMetricsPerType())
                .between(from, to)
                .build();
        List<ScoredRecord> hits = vectorIndex.search(search);
        if (hits.isEmpty()) return Collections.emptyList();

        List<String> ids = new ArrayList<>(hits.size());
        for (ScoredRecord h : hits) ids.add(h.getRecord().getId());
        Map<String, HealthMetricView> bodies = metricLookup.findByIds(ownerId, ids);

        List<RankedMetric> out = new ArrayList<>(hits.size());
        for (ScoredRecord h : hits) {
            HealthMetricView body = bodies.get(h.getRecord().getId());
            // index ahead of the store after a delete
            if (body == null) continue;
            out.add(new RankedMetric(body, h.getDistance(), h.getSimilarity()));
        }
        return out;
    }

    static List<MemoryEntry> newestFirst(List<MemoryEntry> entries, int max) {
        List<MemoryEntry> out = new ArrayList<>(entries);
        Collections.reverse(out);
        return out.size() > max ? new ArrayList<>(out.subList(0, max)) : out;
    }

    private static void cancelAll(Map<String, Future<List<RankedMetric>>> pending) {
        for (Future<?> f : pending.values()) f.cancel(true);
    }
}
