package com.pulse.context;

import java.time.ZoneId;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Whitelist of timezones the dashboard accepts.
 *
 * Timezone names end up inside rendered query text, so only values from this
 * fixed set are ever passed through. Anything else is coerced to
 * {@link #DEFAULT_TIMEZONE}.
 */
public final class Timezones {

    public static final String DEFAULT_TIMEZONE = "America/Chicago";

    private static final Map<String, String> LABELS;

    static {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("UTC", "UTC");
        labels.put("America/New_York", "Eastern (ET)");
        labels.put("America/Chicago", "Central (CT)");
        labels.put("America/Denver", "Mountain (MT)");
        labels.put("America/Los_Angeles", "Pacific (PT)");
        LABELS = Collections.unmodifiableMap(labels);
    }

    private Timezones() {
        throw new UnsupportedOperationException("Timezones is a utility class and cannot be instantiated");
    }

    /**
     * @return whitelisted timezone names mapped to their display labels, in display order
     */
    public static Map<String, String> labels() {
        return LABELS;
    }

    public static boolean isValid(String timezone) {
        return timezone != null && LABELS.containsKey(timezone);
    }

    /**
     * Returns the given timezone if whitelisted, otherwise the default.
     *
     * @param timezone raw timezone name, may be null
     * @return a whitelisted timezone name, never null
     */
    public static String sanitize(String timezone) {
        return isValid(timezone) ? timezone : DEFAULT_TIMEZONE;
    }

    public static ZoneId zoneId(String timezone) {
        return ZoneId.of(sanitize(timezone));
    }
}
