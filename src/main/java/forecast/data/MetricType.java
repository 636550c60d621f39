package forecast.data;

import java.util.Locale;

/**
 * Kind of metric being forecast. Constrains growth mode and the ARIMA search space.
 */
public enum MetricType {
    PROBABILITY("probability"),
    LOAD("load"),
    GENERAL("general");

    private final String wireName;

    MetricType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Null or blank means {@link #GENERAL}. */
    public static MetricType fromWireName(String name) {
        if (name == null || name.isBlank()) return GENERAL;
        String key = name.trim().toLowerCase(Locale.ROOT);
        for (MetricType t : values()) {
            if (t.wireName.equals(key)) return t;
        }
        throw new InvalidInputException("Unknown metric_type '" + name + "' (expected probability, load or general)");
    }
}
