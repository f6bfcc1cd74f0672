package com.kblabs.analytics.domain.query;

import java.util.Arrays;
import java.util.List;

/**
 * Time bucket resolutions for stats queries, each with its {@code date_trunc} unit and the
 * {@code to_char} pattern of the bucket label.
 *
 * <p>WEEK uses {@code WW}, which counts weeks from January 1st rather than ISO-8601 weeks; week labels
 * will not line up with ISO week numbers produced elsewhere.
 */
public enum Granularity {

    HOUR("hour", "hour", "YYYY-MM-DD\"T\"HH24"),
    DAY("day", "day", "YYYY-MM-DD"),
    WEEK("week", "week", "YYYY-\"W\"WW"),
    MONTH("month", "month", "YYYY-MM");

    private final String key;
    private final String truncUnit;
    private final String displayFormat;

    Granularity(String key, String truncUnit, String displayFormat) {
        this.key = key;
        this.truncUnit = truncUnit;
        this.displayFormat = displayFormat;
    }

    public String getKey() {
        return key;
    }

    public String getTruncUnit() {
        return truncUnit;
    }

    public String getDisplayFormat() {
        return displayFormat;
    }

    /** Exact, case-sensitive lookup; anything else is an {@link InvalidGranularityException}. */
    public static Granularity fromKey(String key) {
        for (Granularity granularity : values()) {
            if (granularity.key.equals(key)) {
                return granularity;
            }
        }
        throw new InvalidGranularityException(key);
    }

    public static List<String> keys() {
        return Arrays.stream(values())
                .map(Granularity::getKey)
                .toList();
    }
}
