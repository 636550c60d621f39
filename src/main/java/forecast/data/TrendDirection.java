package forecast.data;

public enum TrendDirection {
    INCREASING("increasing"),
    DECREASING("decreasing");

    private final String wireName;

    TrendDirection(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
