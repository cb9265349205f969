package com.example.healthrag;

import com.example.healthrag.testutils.KeywordEmbeddingService;
import com.example.healthrag.testutils.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class ContextAssemblerTest {

    private static final Instant NOW = Instant.parse("2024-05-10T08:00:00Z");

    private EmbeddingGenerator embeddings;
    private final Map<String, HealthMetricView> bodies = new HashMap<>();
    private final MetricRecordLookup lookup = (owner, ids) -> {
        Map<String, HealthMetricView> out = new LinkedHashMap<>();
        for (String id : ids) {
            HealthMetricView v = bodies.get(id);
            if (v != null && v.getOwnerId().equals(owner)) out.put(id, v);
        }
        return out;
    };
    private MemoryStore memoryStore;
    private ExecutorService executor;
    private RetrievalProperties properties;

    @BeforeEach
    public void setUp() {
        embeddings = new EmbeddingGenerator(new KeywordEmbeddingService(8, "sleep", "steps", "heart"), 8);
        memoryStore = mock(MemoryStore.class);
        executor = Executors.newFixedThreadPool(2);
        properties = new RetrievalProperties();
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    private ContextAssembler assembler(VectorIndex index) {
        return new ContextAssembler(embeddings, index, lookup, memoryStore, new ContextRenderer(), executor,
                new MutableClock(NOW), properties);
    }

    private void store(VectorIndex index, String id, String owner, String category, LocalDate date, String text,
                       Map<String, Object> fields) {
        bodies.put(id, new HealthMetricView(id, owner, category, date, "oura", fields));
        index.upsert(new IndexedRecord(id, owner, category, date.atStartOfDay(ZoneOffset.UTC).toInstant(),
                Map.of(), embeddings.embed(text)));
    }

    private static ContextRequest request(String owner, String query, TimeFrame tf) {
        ContextRequest r = new ContextRequest(owner, query);
        r.setTimeFrame(tf);
        return r;
    }

    @Test
    public void emptyOwnerRendersNoDataMarker() {
        RetrievalContext ctx = assembler(new BruteForceVectorIndex()).buildContext(request("nobody", "how did I sleep", TimeFrame.LAST_WEEK));

        assertThat(ctx.hasHealthData()).isFalse();
        assertThat(ctx.getRendered()).contains(ContextRenderer.NO_DATA_MARKER);
        assertThat(ctx.getDebug()).containsEntry("date_range", "2024-05-03 to 2024-05-10")
                .containsEntry("available_metric_types", List.of());
    }

    @Test
    public void findsRelevantRecordsWithinTheTimeFrame() {
        BruteForceVectorIndex index = new BruteForceVectorIndex();
        store(index, "u:sleep:2024-05-09", "u", "sleep", LocalDate.of(2024, 5, 9), "sleep sleep", Map.of("duration_hours", 7.5));
        store(index, "u:sleep:2024-04-01", "u", "sleep", LocalDate.of(2024, 4, 1), "sleep", Map.of("duration_hours", 5.0));
        store(index, "u:activity:2024-05-09", "u", "activity", LocalDate.of(2024, 5, 9), "steps", Map.of("steps", 9000));
        store(index, "v:sleep:2024-05-09", "v", "sleep", LocalDate.of(2024, 5, 9), "sleep", Map.of("duration_hours", 9.0));

        RetrievalContext ctx = assembler(index).buildContext(request("u", "how did I sleep", TimeFrame.LAST_WEEK));

        assertThat(ctx.getMetricsByCategory()).containsOnlyKeys("sleep");
        List<RankedMetric> sleep = ctx.getMetricsByCategory().get("sleep");
        assertThat(sleep).extracting(m -> m.getMetric().getId()).containsExactly("u:sleep:2024-05-09");
        assertThat(sleep.get(0).getSimilarity()).isGreaterThanOrEqualTo(0.7);
        assertThat(ctx.getDebug()).containsEntry("metrics_found_sleep", 1)
                .containsEntry("metrics_found_activity", 0)
                .containsEntry("available_metric_types", List.of("activity", "sleep"));
        assertThat(ctx.getRendered()).contains("### Sleep Data").contains("duration_hours: 7.5")
                .doesNotContain(ContextRenderer.NO_DATA_MARKER);
    }

    @Test
    public void nullAndBlankCategoriesAreIgnored() {
        BruteForceVectorIndex index = new BruteForceVectorIndex();
        store(index, "u:sleep:1", "u", "sleep", LocalDate.of(2024, 5, 10), "sleep", Map.of("duration_hours", 8));

        ContextRequest req = request("u", "sleep", TimeFrame.LAST_DAY);
        req.setCategories(Arrays.asList("steps_x", null, " "));
        RetrievalContext ctx = assembler(index).buildContext(req);

        assertThat(ctx.getMetricsByCategory()).isEmpty();
        assertThat(ctx.getDebug()).containsEntry("metrics_found_steps_x", 0).doesNotContainKey("metrics_found_null");
        assertThat(ctx.getRendered()).contains(ContextRenderer.NO_DATA_MARKER);

        req.setCategories(Arrays.asList(null, "sleep"));
        assertThat(assembler(index).buildContext(req).getMetricsByCategory()).containsOnlyKeys("sleep");
    }

    @Test
    public void requestedCategoriesRestrictTheSearch() {
        BruteForceVectorIndex index = new BruteForceVectorIndex();
        store(index, "u:sleep:1", "u", "sleep", LocalDate.of(2024, 5, 10), "sleep", Map.of("duration_hours", 8));
        store(index, "u:heart:1", "u", "heart_rate", LocalDate.of(2024, 5, 10), "sleep", Map.of("resting_bpm", 55));

        ContextRequest req = request("u", "sleep", TimeFrame.LAST_DAY);
        req.setCategories(List.of("heart_rate"));
        RetrievalContext ctx = assembler(index).buildContext(req);

        assertThat(ctx.getMetricsByCategory()).containsOnlyKeys("heart_rate");
        assertThat(ctx.getDebug()).doesNotContainKey("available_metric_types");
    }

    @Test
    public void failingCategoryIsSkippedAndRecorded() {
        BruteForceVectorIndex index = new BruteForceVectorIndex() {
            @Override
            public List<ScoredRecord> search(VectorSearchRequest request) {
                if ("heart_rate".equals(request.getCategory())) throw new IllegalStateException("partition corrupt");
                return super.search(request);
            }
        };
        store(index, "u:sleep:1", "u", "sleep", LocalDate.of(2024, 5, 10), "sleep", Map.of("duration_hours", 8));
        store(index, "u:heart:1", "u", "heart_rate", LocalDate.of(2024, 5, 10), "heart", Map.of("resting_bpm", 55));

        RetrievalContext ctx = assembler(index).buildContext(request("u", "sleep", TimeFrame.LAST_DAY));

        assertThat(ctx.getMetricsByCategory()).containsOnlyKeys("sleep");
        assertThat(ctx.getFailedCategories()).containsExactly("heart_rate");
        assertThat(ctx.getDebug()).containsEntry("metrics_found_heart_rate", 0)
                .containsEntry("metrics_error_heart_rate", "IllegalStateException");
    }

    @Test
    public void embeddingFailureAbortsTheBuild() {
        embeddings = new EmbeddingGenerator(text -> { throw new IllegalStateException("model offline"); }, 8);

        assertThatThrownBy(() -> assembler(new BruteForceVectorIndex()).buildContext(request("u", "sleep", TimeFrame.LAST_DAY)))
                .isInstanceOf(EmbeddingUnavailableException.class);
    }

    @Test
    public void dimensionMismatchInsideASearchPropagates() {
        BruteForceVectorIndex index = new BruteForceVectorIndex();
        index.upsert(new IndexedRecord("u:sleep:old", "u", "sleep", NOW, Map.of(), new float[]{1f, 0f, 0f}));

        assertThatThrownBy(() -> assembler(index).buildContext(request("u", "sleep", TimeFrame.LAST_DAY)))
                .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    public void blankQueryIsRejected() {
        assertThatThrownBy(() -> assembler(new BruteForceVectorIndex()).buildContext(new ContextRequest("u", " ")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> assembler(new BruteForceVectorIndex()).buildContext(new ContextRequest(null, "q")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void memoryAndProtocolsAreRenderedBeforeHealthData() {
        BruteForceVectorIndex index = new BruteForceVectorIndex();
        store(index, "u:sleep:1", "u", "sleep", LocalDate.of(2024, 5, 10), "sleep", Map.of("duration_hours", 8));
        MemoryDocument doc = new MemoryDocument("u", List.of(
                new MemoryEntry(NOW.minusSeconds(3600), "asked about sleep"),
                new MemoryEntry(NOW.minusSeconds(60), "asked about caffeine")), new float[8], NOW);
        when(memoryStore.get("u")).thenReturn(Optional.of(doc));
        when(memoryStore.recall(eq("u"), any(), anyInt(), anyDouble()))
                .thenReturn(List.of(new MemoryRecall(doc.getText(), 0.83, NOW)));

        ContextRequest req = request("u", "sleep", TimeFrame.LAST_DAY);
        req.setProtocols(List.of(new ProtocolSnapshot("No caffeine after noon", "Cut afternoon coffee",
                List.of("sleep"), "2024-05-01", "fixed", 30)));
        req.setIncludeDebug(true);
        RetrievalContext ctx = assembler(index).buildContext(req);
        String text = ctx.getRendered();

        assertThat(ctx.getInsights()).extracting(MemoryEntry::getContent)
                .containsExactly("asked about caffeine", "asked about sleep");
        assertThat(ctx.getDebug()).containsEntry("active_protocols_count", 1);
        int protocols = text.indexOf("## Active Protocols");
        int memory = text.indexOf("## AI Memory");
        int insights = text.indexOf("## Key User Insights");
        int data = text.indexOf("## Relevant Health Data");
        int debug = text.indexOf("## Debug Information");
        assertThat(protocols).isGreaterThan(0);
        assertThat(memory).isGreaterThan(protocols);
        assertThat(insights).isGreaterThan(memory);
        assertThat(data).isGreaterThan(insights);
        assertThat(debug).isGreaterThan(data);
        assertThat(text).contains("- (0.83) ");
    }

    @Test
    public void memoryOutageStillBuildsTheContext() {
        when(memoryStore.get("u")).thenThrow(new StoreUnavailableException("db down", new RuntimeException()));

        RetrievalContext ctx = assembler(new BruteForceVectorIndex()).buildContext(request("u", "sleep", TimeFrame.LAST_DAY));

        assertThat(ctx.hasMemory()).isFalse();
        assertThat(ctx.getDebug()).containsKey("memory_error");
    }
}
