package com.example.healthrag;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Durable, TTL-bound cache of generated responses. Expired and never-cached entries look the
 * same to callers. Store failures surface as {@link CacheUnavailableException}.
 */
@Service
public class ResponseCache {

    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    private static final ObjectMapper canonical = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final CachedResponseRepository repo;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Duration defaultTtl;

    public ResponseCache(CachedResponseRepository repo, ObjectMapper mapper, Clock clock, RetrievalProperties properties) {
        this.repo = repo;
        this.mapper = mapper;
        this.clock = clock;
        this.defaultTtl = Duration.ofHours(properties.getCache().getDefaultTtlHours());
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    /**
     * Hashes the endpoint, time frame, query and extra parameters into a key. Map keys are
     * sorted and list values are sorted by their text, so client-side ordering never changes
     * the key.
     */
    public CacheKey makeKey(String endpoint, String timeFrame, String query, Map<String, ?> extraParams) {
        Map<String, Object> params = new TreeMap<>();
        if (extraParams != null) {
            for (Map.Entry<String, ?> e : extraParams.entrySet()) params.put(e.getKey(), canonicalize(e.getValue()));
        }
        params.put("endpoint", endpoint);
        params.put("time_frame", timeFrame);
        params.put("query", query);
        try {
            return new CacheKey(endpoint, timeFrame, sha256(canonical.writeValueAsString(params)));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("cache key parameters are not serializable", e);
        }
    }

    private static Object canonicalize(Object value) {
        if (value instanceof Map) {
            Map<String, Object> sorted = new TreeMap<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                sorted.put(String.valueOf(e.getKey()), canonicalize(e.getValue()));
            }
            return sorted;
        }
        if (value instanceof Collection) {
            List<Object> items = new ArrayList<>();
            for (Object o : (Collection<?>) value) items.add(canonicalize(o));
            items.sort(Comparator.comparing(String::valueOf));
            return items;
        }
        return value;
    }

    public Optional<JsonNode> get(String ownerId, CacheKey key) {
        long now = clock.millis();
        try {
            Optional<CachedResponse> hit = repo
                    .findFirstByOwnerIdAndEndpointAndTimeFrameAndQueryHashAndExpiresAtGreaterThanOrderByCreatedAtDesc(
                            ownerId, key.getEndpoint(), key.getTimeFrame(), key.getHash(), now);
            if (hit.isEmpty()) {
                log.debug("cache miss {} for {}", key, ownerId);
                return Optional.empty();
            }
            log.debug("cache hit {} for {}", key, ownerId);
            return Optional.of(mapper.readTree(hit.get().getPayload()));
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("cache lookup failed for " + ownerId, e);
        } catch (JsonProcessingException e) {
            throw new CacheUnavailableException("cached payload for " + key + " is unreadable", e);
        }
    }

    public CachedResponse put(String ownerId, CacheKey key, JsonNode payload) {
        return put(ownerId, key, payload, defaultTtl);
    }

    /** Always writes a new entry; older entries under the same key simply age out. */
    public CachedResponse put(String ownerId, CacheKey key, JsonNode payload, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) throw new IllegalArgumentException("ttl must be positive");
        long now = clock.millis();
        CachedResponse entry = new CachedResponse();
        entry.setId(UUID.randomUUID().toString());
        entry.setOwnerId(ownerId);
        entry.setEndpoint(key.getEndpoint());
        entry.setTimeFrame(key.getTimeFrame());
        entry.setQueryHash(key.getHash());
        entry.setCreatedAt(now);
        entry.setExpiresAt(now + ttl.toMillis());
        try {
            entry.setPayload(mapper.writeValueAsString(payload));
            return repo.save(entry);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("payload is not serializable", e);
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("cache write failed for " + ownerId, e);
        }
    }

    /**
     * Expires every fresh entry of the owner, optionally narrowed by endpoint and time frame.
     * Returns the number of entries expired.
     */
    public int invalidate(String ownerId, String endpoint, String timeFrame) {
        try {
            int n = repo.expireMatching(ownerId, endpoint, timeFrame, clock.millis());
            log.info("invalidated {} cached responses for {} (endpoint={}, timeFrame={})", n, ownerId, endpoint, timeFrame);
            return n;
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("cache invalidation failed for " + ownerId, e);
        }
    }

    private static String sha256(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] d = md.digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte bb : d) sb.append(String.format("%02x", bb));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
