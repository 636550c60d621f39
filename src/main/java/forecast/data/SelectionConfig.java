package forecast.data;

/**
 * Per-run model configuration derived from the {@link MetricType}. Immutable and passed to every
 * component of a selection run, so concurrent runs never share settings.
 */
public final class SelectionConfig {

    private final MetricType metricType;
    private final int maxP;
    private final int maxD;
    private final int maxQ;
    /** Upper bound on p + d + q for grid candidates. */
    private final int orderBudget;
    private final boolean logisticGrowth;
    private final double floor;
    private final double cap;
    /** Trend flexibility: larger admits slope changes more readily. */
    private final double changepointScale;
    private final double seasonalityScale;
    private final double significance;
    private final double arimaIntervalLevel;
    private final double seasonalIntervalLevel;

    private SelectionConfig(MetricType metricType, int maxP, int maxD, int maxQ, int orderBudget,
                            boolean logisticGrowth, double changepointScale) {
        this.metricType = metricType;
        this.maxP = maxP;
        this.maxD = maxD;
        this.maxQ = maxQ;
        this.orderBudget = orderBudget;
        this.logisticGrowth = logisticGrowth;
        this.floor = 0.0;
        this.cap = 1.0;
        this.changepointScale = changepointScale;
        this.seasonalityScale = 10.0;
        this.significance = 0.05;
        this.arimaIntervalLevel = 0.95;
        this.seasonalIntervalLevel = 0.80;
    }

    public static SelectionConfig forMetric(MetricType metricType) {
        switch (metricType) {
            case PROBABILITY:
                return new SelectionConfig(metricType, 3, 1, 3, 4, true, 0.05);
            case LOAD:
                return new SelectionConfig(metricType, 3, 1, 3, 4, false, 0.05);
            case GENERAL:
            default:
                return new SelectionConfig(MetricType.GENERAL, 4, 2, 4, 5, false, 0.05);
        }
    }

    public MetricType getMetricType() { return metricType; }
    public int getMaxP() { return maxP; }
    public int getMaxD() { return maxD; }
    public int getMaxQ() { return maxQ; }
    public int getOrderBudget() { return orderBudget; }
    public boolean isLogisticGrowth() { return logisticGrowth; }
    public double getFloor() { return floor; }
    public double getCap() { return cap; }
    public double getChangepointScale() { return changepointScale; }
    public double getSeasonalityScale() { return seasonalityScale; }
    public double getSignificance() { return significance; }
    public double getArimaIntervalLevel() { return arimaIntervalLevel; }
    public double getSeasonalIntervalLevel() { return seasonalIntervalLevel; }

    /** Forecasts for bounded metrics must stay inside [floor, cap]. */
    public boolean isBounded() {
        return metricType == MetricType.PROBABILITY;
    }
}
