package com.example.healthrag;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Health metric payload as a tagged union: typed variants for the well-known shapes and a
 * generic key/value fallback. Every variant flattens to the same sorted field map, so text
 * rendering and embedding never depend on the variant.
 */
public abstract class MetricValue {

    private final SortedMap<String, Object> extras;

    protected MetricValue(Map<String, ?> extras) {
        this.extras = extras == null ? new TreeMap<>() : new TreeMap<>(extras);
    }

    public abstract String category();

    /** Fields this variant knows how to type. Null values are omitted. */
    protected abstract Map<String, Object> knownFields();

    public SortedMap<String, Object> toFields() {
        SortedMap<String, Object> out = new TreeMap<>(extras);
        for (Map.Entry<String, Object> e : knownFields().entrySet()) {
            if (e.getValue() != null) out.put(e.getKey(), e.getValue());
        }
        return Collections.unmodifiableSortedMap(out);
    }

    public static MetricValue of(String category, Map<String, ?> fields) {
        Map<String, Object> rest = fields == null ? new LinkedHashMap<>() : new LinkedHashMap<>(fields);
        switch (category == null ? "" : category) {
            case "sleep":
                return new Sleep(number(rest, "duration_hours"), number(rest, "deep_sleep_hours"),
                        number(rest, "rem_sleep_hours"), number(rest, "light_sleep_hours"),
                        number(rest, "awake_hours"), number(rest, "sleep_score"), rest);
            case "activity":
                return new Activity(number(rest, "steps"), number(rest, "active_calories"),
                        number(rest, "total_calories"), number(rest, "active_minutes"),
                        number(rest, "distance_km"), rest);
            case "heart_rate":
                return new HeartRate(number(rest, "average_bpm"), number(rest, "resting_bpm"),
                        number(rest, "max_bpm"), number(rest, "min_bpm"), number(rest, "hrv_ms"), rest);
            default:
                return new Generic(category, rest);
        }
    }

    // removes the key only when it holds a number, non-numeric values stay in extras untouched
    private static Double number(Map<String, Object> fields, String key) {
        Object v = fields.get(key);
        Double d = null;
        if (v instanceof Number) {
            d = ((Number) v).doubleValue();
        } else if (v instanceof String) {
            try {
                d = Double.parseDouble(((String) v).trim());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        if (d != null) fields.remove(key);
        return d;
    }

    private static Map<String, Object> fieldsOf(Object... keyValues) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) m.put((String) keyValues[i], keyValues[i + 1]);
        return m;
    }

    public static final class Sleep extends MetricValue {
        private final Double durationHours;
        private final Double deepSleepHours;
        private final Double remSleepHours;
        private final Double lightSleepHours;
        private final Double awakeHours;
        private final Double sleepScore;

        Sleep(Double durationHours, Double deepSleepHours, Double remSleepHours, Double lightSleepHours,
              Double awakeHours, Double sleepScore, Map<String, ?> extras) {
            super(extras);
            this.durationHours = durationHours;
            this.deepSleepHours = deepSleepHours;
            this.remSleepHours = remSleepHours;
            this.lightSleepHours = lightSleepHours;
            this.awakeHours = awakeHours;
            this.sleepScore = sleepScore;
        }

        @Override
        public String category() { return "sleep"; }

        @Override
        protected Map<String, Object> knownFields() {
            return fieldsOf("duration_hours", durationHours, "deep_sleep_hours", deepSleepHours,
                    "rem_sleep_hours", remSleepHours, "light_sleep_hours", lightSleepHours,
                    "awake_hours", awakeHours, "sleep_score", sleepScore);
        }

        public Double getDurationHours() { return durationHours; }
        public Double getSleepScore() { return sleepScore; }
    }

    public static final class Activity extends MetricValue {
        private final Double steps;
        private final Double activeCalories;
        private final Double totalCalories;
        private final Double activeMinutes;
        private final Double distanceKm;

        Activity(Double steps, Double activeCalories, Double totalCalories, Double activeMinutes,
                 Double distanceKm, Map<String, ?> extras) {
            super(extras);
            this.steps = steps;
            this.activeCalories = activeCalories;
            this.totalCalories = totalCalories;
            this.activeMinutes = activeMinutes;
            this.distanceKm = distanceKm;
        }

        @Override
        public String category() { return "activity"; }

        @Override
        protected Map<String, Object> knownFields() {
            return fieldsOf("steps", steps, "active_calories", activeCalories, "total_calories", totalCalories,
                    "active_minutes", activeMinutes, "distance_km", distanceKm);
        }

        public Double getSteps() { return steps; }
    }

    public static final class HeartRate extends MetricValue {
        private final Double averageBpm;
        private final Double restingBpm;
        private final Double maxBpm;
        private final Double minBpm;
        private final Double hrvMs;

        HeartRate(Double averageBpm, Double restingBpm, Double maxBpm, Double minBpm, Double hrvMs,
                  Map<String, ?> extras) {
            super(extras);
            this.averageBpm = averageBpm;
            this.restingBpm = restingBpm;
            this.maxBpm = maxBpm;
            this.minBpm = minBpm;
            this.hrvMs = hrvMs;
        }

        @Override
        public String category() { return "heart_rate"; }

        @Override
        protected Map<String, Object> knownFields() {
            return fieldsOf("average_bpm", averageBpm, "resting_bpm", restingBpm, "max_bpm", maxBpm,
                    "min_bpm", minBpm, "hrv_ms", hrvMs);
        }

        public Double getRestingBpm() { return restingBpm; }
    }

    public static final class Generic extends MetricValue {
        private final String category;

        Generic(String category, Map<String, ?> fields) {
            super(fields);
            this.category = category;
        }

        @Override
        public String category() { return category; }

        @Override
        protected Map<String, Object> knownFields() { return Collections.emptyMap(); }
    }
}
