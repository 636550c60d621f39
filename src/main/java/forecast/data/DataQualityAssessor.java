package forecast.data;

import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Computes a {@link DataQualityAssessment}. Best effort: never throws for a non-empty series.
 */
public class DataQualityAssessor {

    private static final Logger log = LoggerFactory.getLogger(DataQualityAssessor.class);

    /** Smallest series any model is fitted on. */
    public static final int MIN_VIABLE_POINTS = 10;
    static final double SEASONALITY_THRESHOLD = 0.3;
    static final int WEEKLY_LAG = 7;
    static final int MONTHLY_LAG = 30;

    public DataQualityAssessment assess(TimeSeries series) {
        double[] y = series.values();
        int n = y.length;

        SummaryStatistics stats = new SummaryStatistics();
        int zeros = 0, negatives = 0;
        for (double v : y) {
            stats.addValue(v);
            if (v == 0) zeros++;
            if (v < 0) negatives++;
        }
        double variance = n > 1 ? stats.getVariance() : 0.0;
        double std = Math.sqrt(variance);
        TrendDirection trend = y[n - 1] > y[0] ? TrendDirection.INCREASING : TrendDirection.DECREASING;
        boolean seasonal = detectSeasonality(y);

        double score = 1.0;
        if (series.missingCount() > 0.1 * n) score -= 0.2;
        if (n < 2 * MIN_VIABLE_POINTS) score -= 0.3;
        if (variance == 0.0) score -= 0.3;
        score = Math.max(0.0, Math.min(1.0, score));

        log.info("Data assessment - points: {}, quality: {}, seasonality: {}",
                n, String.format("%.2f", score), seasonal);
        return new DataQualityAssessment(n, series.spanDays(), series.missingCount(), zeros, negatives,
                variance, stats.getMean(), std, trend, seasonal, score);
    }

    static boolean detectSeasonality(double[] y) {
        double weekly = autocorrelation(y, WEEKLY_LAG);
        double monthly = autocorrelation(y, MONTHLY_LAG);
        return Math.abs(weekly) > SEASONALITY_THRESHOLD || Math.abs(monthly) > SEASONALITY_THRESHOLD;
    }

    /**
     * Pearson correlation of the series with itself shifted by {@code lag}. NaN when fewer than two
     * overlapping pairs exist or either side is constant.
     */
    static double autocorrelation(double[] y, int lag) {
        if (y.length - lag < 2) return Double.NaN;
        double[] head = Arrays.copyOfRange(y, 0, y.length - lag);
        double[] tail = Arrays.copyOfRange(y, lag, y.length);
        return new PearsonsCorrelation().correlation(head, tail);
    }
}
