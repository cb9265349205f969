package com.example.healthrag;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class HnswVectorIndexTest {

    private static final Instant DAY = Instant.parse("2024-05-10T00:00:00Z");

    @TempDir
    Path tmp;

    private static float[] randomVector(Random rnd, int dim) {
        float[] v = new float[dim];
        for (int i = 0; i < dim; i++) v[i] = (float) rnd.nextGaussian();
        return v;
    }

    private static IndexedRecord rec(String id, String owner, String category, float[] v) {
        return new IndexedRecord(id, owner, category, DAY, Map.of(), v);
    }

    @Test
    public void approximateSearchAgreesWithExactScanOnNearestHit() {
        HnswVectorIndex hnsw = new HnswVectorIndex(16, 200, 100, 64, 8);
        BruteForceVectorIndex exact = new BruteForceVectorIndex();
        Random rnd = new Random(7);
        for (int i = 0; i < 300; i++) {
            IndexedRecord r = rec("r" + i, "u", i % 2 == 0 ? "sleep" : "activity", randomVector(rnd, 16));
            hnsw.upsert(r);
            exact.upsert(r);
        }
        assertThat(hnsw.graphPartitionCount()).isEqualTo(1);

        // query right on top of a stored vector: both must put it first
        Random again = new Random(7);
        float[] r42 = null;
        for (int i = 0; i <= 42; i++) r42 = randomVector(again, 16);
        VectorSearchRequest q = VectorSearchRequest.forOwner("u", r42).category("sleep").minSimilarity(0.0).limit(3).build();
        List<ScoredRecord> approx = hnsw.search(q);
        List<ScoredRecord> truth = exact.search(q);
        assertThat(approx).isNotEmpty();
        assertThat(approx.get(0).getRecord().getId()).isEqualTo("r42").isEqualTo(truth.get(0).getRecord().getId());
        assertThat(approx).allMatch(h -> h.getRecord().getCategory().equals("sleep"));
        assertThat(approx).allMatch(h -> h.getSimilarity() >= 0.0);
    }

    @Test
    public void ownersNeverLeakAcrossPartitions() {
        HnswVectorIndex hnsw = new HnswVectorIndex(8, 100, 50, 32, 4);
        Random rnd = new Random(3);
        for (int i = 0; i < 40; i++) {
            hnsw.upsert(rec("a" + i, "alice", "sleep", randomVector(rnd, 8)));
            hnsw.upsert(rec("b" + i, "bob", "sleep", randomVector(rnd, 8)));
        }
        List<ScoredRecord> hits = hnsw.search(VectorSearchRequest.forOwner("alice", randomVector(rnd, 8)).limit(10).build());
        assertThat(hits).hasSize(10).allMatch(h -> h.getRecord().getOwnerId().equals("alice"));
        assertThat(hnsw.categories("bob")).containsExactly("sleep");
    }

    @Test
    public void thresholdIsRespectedOnTheGraphPath() {
        HnswVectorIndex hnsw = new HnswVectorIndex(8, 100, 50, 32, 2);
        hnsw.upsert(rec("near", "u", "sleep", new float[]{1f, 0.1f, 0f}));
        hnsw.upsert(rec("far1", "u", "sleep", new float[]{0f, 1f, 0f}));
        hnsw.upsert(rec("far2", "u", "sleep", new float[]{0f, 0f, 1f}));
        hnsw.upsert(rec("far3", "u", "sleep", new float[]{-1f, 0f, 0f}));

        List<ScoredRecord> hits = hnsw.search(VectorSearchRequest.forOwner("u", new float[]{1f, 0f, 0f})
                .minSimilarity(0.7).limit(10).build());
        assertThat(hits).extracting(h -> h.getRecord().getId()).containsExactly("near");
    }

    @Test
    public void upsertReplacesAndRemoveForgets() {
        HnswVectorIndex hnsw = new HnswVectorIndex(8, 100, 50, 4, 2);
        for (int i = 0; i < 10; i++) hnsw.upsert(rec("r" + i, "u", "sleep", new float[]{1f, i, 0f}));
        hnsw.upsert(rec("r3", "u", "activity", new float[]{0f, 0f, 1f}));
        assertThat(hnsw.size()).isEqualTo(10);

        List<ScoredRecord> hits = hnsw.search(VectorSearchRequest.forOwner("u", new float[]{0f, 0f, 1f}).limit(1).build());
        assertThat(hits.get(0).getRecord().getId()).isEqualTo("r3");
        assertThat(hits.get(0).getRecord().getCategory()).isEqualTo("activity");

        assertThat(hnsw.remove("r3")).isTrue();
        assertThat(hnsw.categories("u")).containsExactly("sleep");
        assertThat(hnsw.search(VectorSearchRequest.forOwner("u", new float[]{0f, 0f, 1f}).category("activity").build())).isEmpty();
    }

    @Test
    public void dimensionIsFixedByTheFirstRecord() {
        HnswVectorIndex hnsw = new HnswVectorIndex(8, 100, 50, 8, 2);
        hnsw.upsert(rec("r1", "u", "sleep", new float[]{1f, 0f, 0f}));
        assertThatThrownBy(() -> hnsw.upsert(rec("r2", "u", "sleep", new float[]{1f, 0f})))
                .isInstanceOf(DimensionMismatchException.class);
        assertThatThrownBy(() -> hnsw.search(VectorSearchRequest.forOwner("u", new float[]{1f, 0f}).build()))
                .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    public void persistAndLoad() throws Exception {
        HnswVectorIndex h = new HnswVectorIndex(8, 100, 50, 16, 2);
        h.upsert(rec("x:1", "u", "sleep", new float[]{1f, 0f, 0f}));
        h.upsert(rec("x:2", "u", "sleep", new float[]{0f, 1f, 0f}));
        h.upsert(rec("x:3", "v", "activity", new float[]{0f, 0f, 1f}));

        Path file = tmp.resolve("index.idx");
        h.persistTo(file);
        assertThat(Files.size(file)).isGreaterThan(0);

        HnswVectorIndex fresh = new HnswVectorIndex(8, 100, 50, 16, 2);
        fresh.loadFrom(file);
        assertThat(fresh.size()).isEqualTo(3);
        List<ScoredRecord> res = fresh.search(VectorSearchRequest.forOwner("u", new float[]{1f, 0f, 0f}).limit(1).build());
        assertThat(res).isNotEmpty();
        assertThat(res.get(0).getRecord().getId()).isEqualTo("x:1");
        assertThat(fresh.categories("v")).containsExactly("activity");
    }
}
