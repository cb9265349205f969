package com.example.healthrag;

import java.util.Collection;
import java.util.Map;

/**
 * Resolves index hits back to record bodies. Ids owned by someone else, or no longer stored,
 * are absent from the result.
 */
public interface MetricRecordLookup {

    Map<String, HealthMetricView> findByIds(String ownerId, Collection<String> ids);
}
