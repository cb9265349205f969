package com.example.healthrag;

import com.example.healthrag.testutils.MutableClock;
import com.example.healthrag.testutils.TestClockConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Import(TestClockConfig.class)
public class ResponseCacheTest {

    @Autowired
    private ResponseCache cache;

    @Autowired
    private MutableClock clock;

    @Autowired
    private ObjectMapper mapper;

    @BeforeEach
    public void resetClock() {
        clock.set(TestClockConfig.START);
    }

    private JsonNode payload(String response) throws Exception {
        return mapper.readTree("{\"response\":\"" + response + "\",\"metadata\":{\"cached\":false,\"metric_types\":[\"sleep\"]}}");
    }

    @Test
    public void keyIgnoresParameterOrder() {
        Map<String, Object> a = new HashMap<>();
        a.put("metric_types", Arrays.asList("sleep", "activity"));
        a.put("protocols", List.of("p2", "p1"));
        Map<String, Object> b = new HashMap<>();
        b.put("protocols", List.of("p1", "p2"));
        b.put("metric_types", Arrays.asList("activity", "sleep"));

        CacheKey k1 = cache.makeKey("health_insight", "last_week", "how did I sleep?", a);
        CacheKey k2 = cache.makeKey("health_insight", "last_week", "how did I sleep?", b);
        assertThat(k1).isEqualTo(k2);
        assertThat(k1.getHash()).hasSize(64);

        assertThat(cache.makeKey("health_insight", "last_month", "how did I sleep?", a)).isNotEqualTo(k1);
        assertThat(cache.makeKey("health_insight", "last_week", "how did I sleep", a).getHash()).isNotEqualTo(k1.getHash());
        assertThat(cache.makeKey("trend_analysis", "last_week", "how did I sleep?", a).getHash()).isNotEqualTo(k1.getHash());
    }

    @Test
    public void storedPayloadComesBackUnchanged() throws Exception {
        CacheKey key = cache.makeKey("health_insight", "last_day", "q-roundtrip", null);
        JsonNode p = payload("you slept well");
        cache.put("cache-a", key, p);

        assertThat(cache.get("cache-a", key)).contains(p);
        assertThat(cache.get("cache-b", key)).isEmpty();
    }

    @Test
    public void entriesExpireAfterTheirTtl() throws Exception {
        CacheKey key = cache.makeKey("health_insight", "last_day", "q-ttl", null);
        cache.put("cache-ttl", key, payload("short lived"), Duration.ofHours(1));

        clock.advance(Duration.ofMinutes(59));
        assertThat(cache.get("cache-ttl", key)).isPresent();

        clock.advance(Duration.ofHours(1));
        assertThat(cache.get("cache-ttl", key)).isEmpty();
    }

    @Test
    public void newestEntryWins() throws Exception {
        CacheKey key = cache.makeKey("health_insight", "last_day", "q-newest", null);
        cache.put("cache-new", key, payload("first"));
        clock.advance(Duration.ofSeconds(1));
        cache.put("cache-new", key, payload("second"));

        assertThat(cache.get("cache-new", key)).get()
                .extracting(n -> n.get("response").asText())
                .isEqualTo("second");
    }

    @Test
    public void invalidateByEndpointLeavesOtherEndpoints() throws Exception {
        CacheKey insight = cache.makeKey("health_insight", "last_week", "q-inv", null);
        CacheKey trend = cache.makeKey("trend_analysis", "last_month", "q-inv", null);
        cache.put("cache-inv", insight, payload("insight"));
        cache.put("cache-inv", trend, payload("trend"));
        cache.put("cache-other", insight, payload("other user"));

        assertThat(cache.invalidate("cache-inv", "health_insight", null)).isEqualTo(1);
        assertThat(cache.get("cache-inv", insight)).isEmpty();
        assertThat(cache.get("cache-inv", trend)).isPresent();

        assertThat(cache.invalidate("cache-inv", null, null)).isEqualTo(1);
        assertThat(cache.get("cache-inv", trend)).isEmpty();
        assertThat(cache.get("cache-other", insight)).isPresent();
    }

    @Test
    public void invalidateByTimeFrame() throws Exception {
        CacheKey week = cache.makeKey("health_insight", "last_week", "q-tf", null);
        CacheKey month = cache.makeKey("health_insight", "last_month", "q-tf", null);
        cache.put("cache-tf", week, payload("w"));
        cache.put("cache-tf", month, payload("m"));

        assertThat(cache.invalidate("cache-tf", null, "last_month")).isEqualTo(1);
        assertThat(cache.get("cache-tf", week)).isPresent();
        assertThat(cache.get("cache-tf", month)).isEmpty();
        assertThat(cache.invalidate("cache-nobody", null, null)).isZero();
    }

    @Test
    public void nonPositiveTtlIsRejected() {
        CacheKey key = cache.makeKey("health_insight", "last_day", "q-bad", null);
        assertThatThrownBy(() -> cache.put("cache-bad", key, payload("x"), Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(cache.defaultTtl()).isEqualTo(Duration.ofHours(24));
    }
}
