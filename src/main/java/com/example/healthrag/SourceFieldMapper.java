package com.example.healthrag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps device-specific payloads (oura, fitbit, apple_watch, garmin) onto the standard field
 * names used for embedding and rendering, converting units on the way. Payloads from sources
 * or categories without a mapping pass through unchanged; mapped payloads keep only the
 * mapped fields.
 */
@Component
public class SourceFieldMapper {

    private static final Logger log = LoggerFactory.getLogger(SourceFieldMapper.class);

    enum Conversion { NONE, MINUTES_TO_HOURS, SECONDS_TO_HOURS, SECONDS_TO_MINUTES, METERS_TO_KM, MILES_TO_KM, EPOCH_MILLIS, SOURCE_TIME }

    private static final class Rule {
        final String target;
        final Conversion conversion;

        Rule(String target, Conversion conversion) {
            this.target = target;
            this.conversion = conversion;
        }
    }

    // source -> category -> source field -> rule
    private final Map<String, Map<String, Map<String, Rule>>> mappings = new HashMap<>();

    private static final Map<String, DateTimeFormatter> SOURCE_TIME_FORMATS = Map.of(
            "oura", DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssXXX"),
            "fitbit", DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS"),
            "apple_watch", DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"));

    public SourceFieldMapper() {
        rule("oura", "sleep", "duration", "duration_hours", Conversion.NONE);
        rule("oura", "sleep", "deep", "deep_sleep_hours", Conversion.NONE);
        rule("oura", "sleep", "rem", "rem_sleep_hours", Conversion.NONE);
        rule("oura", "sleep", "light", "light_sleep_hours", Conversion.NONE);
        rule("oura", "sleep", "awake", "awake_hours", Conversion.NONE);
        rule("oura", "sleep", "score", "sleep_score", Conversion.NONE);
        rule("oura", "sleep", "bedtime_start", "bedtime", Conversion.SOURCE_TIME);
        rule("oura", "sleep", "bedtime_end", "wake_time", Conversion.SOURCE_TIME);
        rule("oura", "activity", "steps", "steps", Conversion.NONE);
        rule("oura", "activity", "cal_active", "active_calories", Conversion.NONE);
        rule("oura", "activity", "cal_total", "total_calories", Conversion.NONE);
        rule("oura", "activity", "daily_movement", "active_minutes", Conversion.NONE);
        rule("oura", "activity", "score", "activity_score", Conversion.NONE);
        rule("oura", "readiness", "score", "readiness_score", Conversion.NONE);
        rule("oura", "readiness", "hrv_balance", "hrv_balance", Conversion.NONE);
        rule("oura", "readiness", "recovery_index", "recovery_index", Conversion.NONE);

        rule("fitbit", "sleep", "minutesAsleep", "duration_hours", Conversion.MINUTES_TO_HOURS);
        rule("fitbit", "sleep", "deepSleepMinutes", "deep_sleep_hours", Conversion.MINUTES_TO_HOURS);
        rule("fitbit", "sleep", "remSleepMinutes", "rem_sleep_hours", Conversion.MINUTES_TO_HOURS);
        rule("fitbit", "sleep", "lightSleepMinutes", "light_sleep_hours", Conversion.MINUTES_TO_HOURS);
        rule("fitbit", "sleep", "awakeMinutes", "awake_hours", Conversion.MINUTES_TO_HOURS);
        rule("fitbit", "sleep", "efficiency", "sleep_score", Conversion.NONE);
        rule("fitbit", "sleep", "startTime", "bedtime", Conversion.SOURCE_TIME);
        rule("fitbit", "sleep", "endTime", "wake_time", Conversion.SOURCE_TIME);
        rule("fitbit", "activity", "steps", "steps", Conversion.NONE);
        rule("fitbit", "activity", "activeCalories", "active_calories", Conversion.NONE);
        rule("fitbit", "activity", "caloriesBurned", "total_calories", Conversion.NONE);
        rule("fitbit", "activity", "activeMinutes", "active_minutes", Conversion.NONE);
        rule("fitbit", "activity", "floors", "floors_climbed", Conversion.NONE);
        rule("fitbit", "activity", "distance", "distance_km", Conversion.MILES_TO_KM);

        rule("apple_watch", "sleep", "sleepHours", "duration_hours", Conversion.NONE);
        rule("apple_watch", "sleep", "deepSleepHours", "deep_sleep_hours", Conversion.NONE);
        rule("apple_watch", "sleep", "remSleepHours", "rem_sleep_hours", Conversion.NONE);
        rule("apple_watch", "sleep", "lightSleepHours", "light_sleep_hours", Conversion.NONE);
        rule("apple_watch", "sleep", "awakeHours", "awake_hours", Conversion.NONE);
        rule("apple_watch", "sleep", "sleepQuality", "sleep_score", Conversion.NONE);
        rule("apple_watch", "sleep", "sleepStart", "bedtime", Conversion.SOURCE_TIME);
        rule("apple_watch", "sleep", "sleepEnd", "wake_time", Conversion.SOURCE_TIME);
        rule("apple_watch", "activity", "steps", "steps", Conversion.NONE);
        rule("apple_watch", "activity", "activeEnergyBurned", "active_calories", Conversion.NONE);
        rule("apple_watch", "activity", "totalEnergyBurned", "total_calories", Conversion.NONE);
        rule("apple_watch", "activity", "exerciseMinutes", "active_minutes", Conversion.NONE);
        rule("apple_watch", "activity", "standHours", "stand_hours", Conversion.NONE);
        rule("apple_watch", "activity", "distance", "distance_km", Conversion.NONE);
        rule("apple_watch", "heart_rate", "avgHeartRate", "average_bpm", Conversion.NONE);
        rule("apple_watch", "heart_rate", "restingHeartRate", "resting_bpm", Conversion.NONE);
        rule("apple_watch", "heart_rate", "maxHeartRate", "max_bpm", Conversion.NONE);
        rule("apple_watch", "heart_rate", "minHeartRate", "min_bpm", Conversion.NONE);
        rule("apple_watch", "heart_rate", "heartRateVariability", "hrv_ms", Conversion.NONE);

        rule("garmin", "sleep", "sleepTimeSeconds", "duration_hours", Conversion.SECONDS_TO_HOURS);
        rule("garmin", "sleep", "deepSleepSeconds", "deep_sleep_hours", Conversion.SECONDS_TO_HOURS);
        rule("garmin", "sleep", "remSleepSeconds", "rem_sleep_hours", Conversion.SECONDS_TO_HOURS);
        rule("garmin", "sleep", "lightSleepSeconds", "light_sleep_hours", Conversion.SECONDS_TO_HOURS);
        rule("garmin", "sleep", "awakeSleepSeconds", "awake_hours", Conversion.SECONDS_TO_HOURS);
        rule("garmin", "sleep", "sleepQuality", "sleep_score", Conversion.NONE);
        rule("garmin", "sleep", "sleepStartTimestampGMT", "bedtime", Conversion.EPOCH_MILLIS);
        rule("garmin", "sleep", "sleepEndTimestampGMT", "wake_time", Conversion.EPOCH_MILLIS);
        rule("garmin", "activity", "steps", "steps", Conversion.NONE);
        rule("garmin", "activity", "activeKilocalories", "active_calories", Conversion.NONE);
        rule("garmin", "activity", "totalKilocalories", "total_calories", Conversion.NONE);
        rule("garmin", "activity", "activeTimeSeconds", "active_minutes", Conversion.SECONDS_TO_MINUTES);
        rule("garmin", "activity", "floorsClimbed", "floors_climbed", Conversion.NONE);
        rule("garmin", "activity", "distanceInMeters", "distance_km", Conversion.METERS_TO_KM);
        rule("garmin", "heart_rate", "averageHeartRate", "average_bpm", Conversion.NONE);
        rule("garmin", "heart_rate", "restingHeartRate", "resting_bpm", Conversion.NONE);
        rule("garmin", "heart_rate", "maxHeartRate", "max_bpm", Conversion.NONE);
        rule("garmin", "heart_rate", "minHeartRate", "min_bpm", Conversion.NONE);
    }

    private void rule(String source, String category, String from, String to, Conversion conversion) {
        mappings.computeIfAbsent(source, k -> new HashMap<>())
                .computeIfAbsent(category, k -> new LinkedHashMap<>())
                .put(from, new Rule(to, conversion));
    }

    public boolean hasMapping(String source, String category) {
        Map<String, Map<String, Rule>> bySource = mappings.get(source);
        return bySource != null && bySource.containsKey(category);
    }

    public Map<String, Object> standardize(String source, String category, Map<String, Object> data) {
        if (data == null) return new LinkedHashMap<>();
        if (!hasMapping(source, category)) return new LinkedHashMap<>(data);
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, Rule> e : mappings.get(source).get(category).entrySet()) {
            if (!data.containsKey(e.getKey())) continue;
            Rule rule = e.getValue();
            result.put(rule.target, convert(data.get(e.getKey()), rule.conversion, source));
        }
        return result;
    }

    Object convert(Object value, Conversion conversion, String source) {
        if (value == null || conversion == Conversion.NONE) return value;
        switch (conversion) {
            case MINUTES_TO_HOURS:
                return numeric(value, v -> round2(v / 60.0));
            case SECONDS_TO_HOURS:
                return numeric(value, v -> round2(v / 3600.0));
            case SECONDS_TO_MINUTES:
                return numeric(value, v -> round2(v / 60.0));
            case METERS_TO_KM:
                return numeric(value, v -> round2(v / 1000.0));
            case MILES_TO_KM:
                return numeric(value, v -> round2(v * 1.60934));
            case EPOCH_MILLIS:
                if (value instanceof Number) {
                    return LocalDateTime.ofInstant(Instant.ofEpochMilli(((Number) value).longValue()), ZoneOffset.UTC).toString();
                }
                return value;
            case SOURCE_TIME:
                return parseSourceTime(String.valueOf(value), source);
            default:
                return value;
        }
    }

    private static Object numeric(Object value, java.util.function.DoubleUnaryOperator op) {
        if (value instanceof Number) return op.applyAsDouble(((Number) value).doubleValue());
        try {
            return op.applyAsDouble(Double.parseDouble(String.valueOf(value).trim()));
        } catch (NumberFormatException e) {
            log.debug("leaving non-numeric value '{}' unconverted", value);
            return value;
        }
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }

    // ISO-8601 local date-time; the original text if the source format does not match
    private static String parseSourceTime(String text, String source) {
        DateTimeFormatter f = SOURCE_TIME_FORMATS.get(source);
        if (f == null) return text;
        try {
            if ("oura".equals(source)) return OffsetDateTime.parse(text, f).toLocalDateTime().toString();
            return LocalDateTime.parse(text, f).toString();
        } catch (DateTimeParseException e) {
            return text;
        }
    }
}
