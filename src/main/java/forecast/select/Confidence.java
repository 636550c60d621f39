package forecast.select;

/**
 * How far a caller should trust a forecast. Degraded runs are reported here rather than as errors.
 */
public enum Confidence {
    VERY_LOW("very_low"),
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String wireName;

    Confidence(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
