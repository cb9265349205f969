package com.example.healthrag;

import java.time.LocalDate;

/**
 * Look-back windows a request can ask for. Unknown names fall back to {@link #LAST_DAY}.
 */
public enum TimeFrame {

    LAST_DAY("last_day", 1),
    LAST_WEEK("last_week", 7),
    LAST_MONTH("last_month", 30),
    LAST_3_MONTHS("last_3_months", 90),
    LAST_6_MONTHS("last_6_months", 180),
    LAST_YEAR("last_year", 365);

    private final String wireName;
    private final int days;

    TimeFrame(String wireName, int days) {
        this.wireName = wireName;
        this.days = days;
    }

    public String wireName() { return wireName; }

    public int days() { return days; }

    /** "last 3 months" */
    public String describe() {
        return wireName.replace('_', ' ');
    }

    public LocalDate startFrom(LocalDate today) {
        return today.minusDays(days);
    }

    public static TimeFrame fromName(String name) {
        if (name == null) return LAST_DAY;
        for (TimeFrame t : values()) {
            if (t.wireName.equalsIgnoreCase(name.trim())) return t;
        }
        return LAST_DAY;
    }
}
