package com.example.healthrag;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cache-first insight and trend generation. A down cache only costs a regeneration.
 */
@Slf4j
@Service
public class InsightService {

    static final String INSIGHT_ENDPOINT = "health_insight";
    static final String TREND_ENDPOINT = "trend_analysis";

    private final ContextAssembler assembler;
    private final ResponseCache cache;
    private final MemoryStore memoryStore;
    private final TextGenerator textGenerator;
    private final InsightPromptBuilder promptBuilder;
    private final ObjectMapper mapper;

    public InsightService(ContextAssembler assembler, ResponseCache cache, MemoryStore memoryStore,
                          TextGenerator textGenerator, InsightPromptBuilder promptBuilder, ObjectMapper mapper) {
        this.assembler = assembler;
        this.cache = cache;
        this.memoryStore = memoryStore;
        this.textGenerator = textGenerator;
        this.promptBuilder = promptBuilder;
        this.mapper = mapper;
    }

    public JsonNode generateInsight(ApiModels.InsightRequest req) {
        ContextRequest contextRequest = req.toContextRequest();
        TimeFrame timeFrame = contextRequest.getTimeFrame();
        List<String> metricTypes = contextRequest.getCategories();

        CacheKey key = null;
        if (req.isUseCache()) {
            key = cache.makeKey(INSIGHT_ENDPOINT, timeFrame.wireName(), req.getQuery(), metricTypeParams(metricTypes));
            Optional<JsonNode> cached = cachedOrEmpty(req.getOwnerId(), key);
            if (cached.isPresent()) {
                log.info("Using cached insight for {} ({})", req.getOwnerId(), timeFrame.wireName());
                return cached.get();
            }
        }

        RetrievalContext ctx = assembler.buildContext(contextRequest);
        String answer = textGenerator.generate(promptBuilder.buildInsightPrompt(ctx), GenerationOptions.INSIGHT);

        if (req.isUpdateMemory()) {
            remember(req.getOwnerId(), promptBuilder.memorySummary(
                    "Health insights for " + timeFrame.describe(), metricTypes, answer));
        }

        ObjectNode payload = mapper.createObjectNode();
        payload.put("response", answer);
        payload.put("has_data", ctx.hasHealthData());
        ObjectNode meta = payload.putObject("metadata");
        meta.put("model", textGenerator.modelName());
        if (metricTypes.isEmpty()) {
            meta.putNull("metric_types");
        } else {
            ArrayNode types = meta.putArray("metric_types");
            metricTypes.forEach(types::add);
        }
        meta.put("has_memory", ctx.hasMemory());
        meta.put("has_active_protocols", ctx.hasProtocols());
        meta.put("protocol_count", ctx.getProtocols().size());
        meta.put("time_frame", timeFrame.wireName());
        meta.put("cached", false);

        if (key != null) store(req.getOwnerId(), key, payload);
        return payload;
    }

    public JsonNode analyzeTrends(ApiModels.TrendRequest req) {
        String category = req.getMetricType();
        if (category == null || category.isBlank()) throw new IllegalArgumentException("metricType is required");
        TimeFrame period = TimeFrame.fromName(req.getTimePeriod());

        CacheKey key = null;
        if (req.isUseCache()) {
            key = cache.makeKey(TREND_ENDPOINT, period.wireName(), "Analyze my " + category + " trends",
                    metricTypeParams(Collections.singletonList(category)));
            Optional<JsonNode> cached = cachedOrEmpty(req.getOwnerId(), key);
            if (cached.isPresent()) {
                log.info("Using cached trend analysis for {} ({}, {})", req.getOwnerId(), category, period.wireName());
                return cached.get();
            }
        }

        ContextRequest contextRequest = new ContextRequest(req.getOwnerId(),
                "Analyze my " + category + " trends for the " + period.describe());
        contextRequest.setCategories(new ArrayList<>(Collections.singletonList(category)));
        contextRequest.setTimeFrame(period);
        RetrievalContext ctx = assembler.buildContext(contextRequest);
        boolean hasData = ctx.getMetricsByCategory().containsKey(category);

        String analysis = textGenerator.generate(promptBuilder.buildTrendPrompt(ctx, category), GenerationOptions.TREND);
        remember(req.getOwnerId(), promptBuilder.memorySummary(
                "Analysis of " + category + " trends for " + period.describe(), Collections.singletonList(category), analysis));

        ObjectNode payload = mapper.createObjectNode();
        payload.put("trend_analysis", analysis);
        payload.put("has_data", hasData);
        ObjectNode meta = payload.putObject("metadata");
        meta.put("model", textGenerator.modelName());
        meta.put("metric_type", category);
        meta.put("time_period", period.wireName());
        meta.put("has_memory", ctx.hasMemory());
        meta.put("cached", false);

        if (key != null) store(req.getOwnerId(), key, payload);
        return payload;
    }

    public RetrievalContext previewContext(ApiModels.InsightRequest req) {
        return assembler.buildContext(req.toContextRequest());
    }

    public int invalidate(String ownerId, String endpoint, String timeFrame) {
        return cache.invalidate(ownerId, endpoint, timeFrame);
    }

    private static Map<String, Object> metricTypeParams(List<String> metricTypes) {
        Map<String, Object> params = new HashMap<>();
        params.put("metric_types", metricTypes == null || metricTypes.isEmpty() ? null : metricTypes);
        return params;
    }

    private Optional<JsonNode> cachedOrEmpty(String ownerId, CacheKey key) {
        try {
            return cache.get(ownerId, key);
        } catch (CacheUnavailableException e) {
            log.warn("Cache unavailable, regenerating: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void store(String ownerId, CacheKey key, JsonNode payload) {
        try {
            cache.put(ownerId, key, payload);
        } catch (CacheUnavailableException e) {
            log.warn("Cache unavailable, response not cached: {}", e.getMessage());
        }
    }

    private void remember(String ownerId, String summary) {
        try {
            memoryStore.append(ownerId, summary);
        } catch (StoreUnavailableException e) {
            log.warn("Could not update memory for {}: {}", ownerId, e.getMessage());
        }
    }
}
