package com.example.healthrag;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Map;

@RestController
@RequestMapping("/api/insights")
public class InsightController {

    private static final Logger log = LoggerFactory.getLogger(InsightController.class);

    @Autowired
    private InsightService insightService;

    @PostMapping
    public JsonNode insight(@RequestBody ApiModels.InsightRequest req) {
        log.info("Insight request for {} (timeFrame={}, metricTypes={})", req.getOwnerId(), req.getTimeFrame(), req.getMetricTypes());
        return insightService.generateInsight(req);
    }

    @PostMapping("/trends")
    public JsonNode trends(@RequestBody ApiModels.TrendRequest req) {
        log.info("Trend request for {} ({}, {})", req.getOwnerId(), req.getMetricType(), req.getTimePeriod());
        return insightService.analyzeTrends(req);
    }

    @PostMapping("/context")
    public ApiModels.ContextPreview context(@RequestBody ApiModels.InsightRequest req) {
        RetrievalContext ctx = insightService.previewContext(req);
        ApiModels.ContextPreview out = new ApiModels.ContextPreview();
        out.setRendered(ctx.getRendered());
        out.setDebug(ctx.getDebug());
        out.setCategoriesWithData(new ArrayList<>(ctx.getMetricsByCategory().keySet()));
        out.setFailedCategories(ctx.getFailedCategories());
        return out;
    }

    @DeleteMapping("/cache/{ownerId}")
    public Map<String, Object> invalidate(@PathVariable String ownerId,
                                          @RequestParam(name = "endpoint", required = false) String endpoint,
                                          @RequestParam(name = "timeFrame", required = false) String timeFrame) {
        int n = insightService.invalidate(ownerId, endpoint, timeFrame);
        return Collections.singletonMap("invalidated", n);
    }
}
