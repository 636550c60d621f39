package forecast.data;

/**
 * Summary statistics and structural signals of one series, computed once per selection run.
 */
public final class DataQualityAssessment {

    private final int dataPoints;
    private final long dateRangeDays;
    private final int missingValues;
    private final int zeroValues;
    private final int negativeValues;
    private final double variance;
    private final double mean;
    private final double std;
    private final TrendDirection trendDirection;
    private final boolean seasonalityDetected;
    private final double qualityScore;

    public DataQualityAssessment(int dataPoints, long dateRangeDays, int missingValues, int zeroValues,
                                 int negativeValues, double variance, double mean, double std,
                                 TrendDirection trendDirection, boolean seasonalityDetected, double qualityScore) {
        this.dataPoints = dataPoints;
        this.dateRangeDays = dateRangeDays;
        this.missingValues = missingValues;
        this.zeroValues = zeroValues;
        this.negativeValues = negativeValues;
        this.variance = variance;
        this.mean = mean;
        this.std = std;
        this.trendDirection = trendDirection;
        this.seasonalityDetected = seasonalityDetected;
        this.qualityScore = qualityScore;
    }

    public int getDataPoints() { return dataPoints; }
    public long getDateRangeDays() { return dateRangeDays; }
    public int getMissingValues() { return missingValues; }
    public int getZeroValues() { return zeroValues; }
    public int getNegativeValues() { return negativeValues; }
    public double getVariance() { return variance; }
    public double getMean() { return mean; }
    public double getStd() { return std; }
    public TrendDirection getTrendDirection() { return trendDirection; }
    public boolean isSeasonalityDetected() { return seasonalityDetected; }
    public double getQualityScore() { return qualityScore; }
}
