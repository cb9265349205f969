package com.example.healthrag;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@SpringBootTest
@ActiveProfiles("ann-dev")
public class HealthMetricServiceTest {

    @Autowired
    private HealthMetricService metricService;

    @Autowired
    private HealthMetricRepository repository;

    @Autowired
    private VectorIndex vectorIndex;

    @SpyBean
    private EmbeddingGenerator embeddingGenerator;

    private static final LocalDate DAY = LocalDate.of(2024, 5, 9);

    @Test
    public void ingestStoresStandardizedFieldsAndIndexes() {
        HealthMetricView v = metricService.ingest("hm-store", DAY, "activity", "garmin",
                Map.of("steps", 10234, "distanceInMeters", 8450));

        assertThat(v.getId()).isEqualTo("hm-store:activity:2024-05-09:garmin");
        assertThat(v.getFields()).containsEntry("distance_km", 8.45);
        assertThat(repository.findById(v.getId())).isPresent();
        assertThat(metricService.get("hm-store", v.getId())).get()
                .extracting(HealthMetricView::getFields)
                .isEqualTo(v.getFields());
        assertThat(vectorIndex.categories("hm-store")).containsExactly("activity");

        float[] q = embeddingGenerator.embed(CanonicalRecordText.render("activity", v.getFields(), "garmin"));
        List<ScoredRecord> hits = vectorIndex.search(VectorSearchRequest.forOwner("hm-store", q).minSimilarity(0.99).build());
        assertThat(hits).extracting(h -> h.getRecord().getId()).containsExactly(v.getId());
    }

    @Test
    public void unchangedReingestSkipsEmbedding() {
        Map<String, Object> fields = Map.of("duration", 7.5, "score", 80);
        metricService.ingest("hm-same", DAY, "sleep", "oura", fields);
        metricService.ingest("hm-same", DAY, "sleep", "oura", fields);
        verify(embeddingGenerator, times(1)).embed(anyString());

        metricService.ingest("hm-same", DAY, "sleep", "oura", Map.of("duration", 6.0, "score", 70));
        verify(embeddingGenerator, times(2)).embed(anyString());
        assertThat(metricService.list("hm-same", null, null, null)).hasSize(1)
                .first().extracting(m -> m.getFields().get("duration_hours")).isEqualTo(6.0);
    }

    @Test
    public void listFiltersByCategoryAndDate() {
        metricService.ingest("hm-list", DAY, "sleep", "manual", Map.of("duration_hours", 7));
        metricService.ingest("hm-list", DAY.minusDays(3), "sleep", "manual", Map.of("duration_hours", 6));
        metricService.ingest("hm-list", DAY, "activity", null, Map.of("steps", 5000));
        metricService.ingest("hm-other", DAY, "sleep", "manual", Map.of("duration_hours", 9));

        assertThat(metricService.list("hm-list", null, null, null)).hasSize(3);
        assertThat(metricService.list("hm-list", "sleep", null, null)).extracting(HealthMetricView::getDate)
                .containsExactly(DAY, DAY.minusDays(3));
        assertThat(metricService.list("hm-list", "sleep", DAY.minusDays(1), DAY)).hasSize(1);
        assertThat(metricService.list("hm-list", "activity", null, null)).extracting(HealthMetricView::getSource)
                .containsExactly("manual");
    }

    @Test
    public void deleteRemovesFromStoreAndIndex() {
        HealthMetricView v = metricService.ingest("hm-del", DAY, "heart_rate", "apple_watch", Map.of("restingHeartRate", 54));

        assertThat(metricService.delete("someone-else", v.getId())).isFalse();
        assertThat(metricService.delete("hm-del", v.getId())).isTrue();
        assertThat(metricService.get("hm-del", v.getId())).isEmpty();
        assertThat(vectorIndex.categories("hm-del")).isEmpty();
        assertThat(metricService.delete("hm-del", v.getId())).isFalse();
    }

    @Test
    public void findByIdsNeverCrossesOwners() {
        HealthMetricView mine = metricService.ingest("hm-a", DAY, "sleep", "manual", Map.of("duration_hours", 8));
        HealthMetricView theirs = metricService.ingest("hm-b", DAY, "sleep", "manual", Map.of("duration_hours", 5));

        assertThat(metricService.findByIds("hm-a", List.of(mine.getId(), theirs.getId()))).containsOnlyKeys(mine.getId());
    }

    @Test
    public void missingRequiredFieldsAreRejected() {
        assertThatThrownBy(() -> metricService.ingest("hm-x", null, "sleep", "oura", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> metricService.ingest("hm-x", DAY, " ", "oura", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
