package forecast.ml;

import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ljung-Box portmanteau test and moment summary of model residuals. A p-value above 0.05 means no
 * autocorrelation is left in the residuals, which is a sign of a healthy fit.
 */
public final class ResidualDiagnostics {

    static final int DEFAULT_LAGS = 10;

    private final int lags;
    private final double ljungBoxStatistic;
    private final double ljungBoxPValue;
    private final double mean;
    private final double std;
    private final double skewness;
    private final double kurtosis;

    private ResidualDiagnostics(int lags, double q, double pValue, DescriptiveStatistics stats) {
        this.lags = lags;
        this.ljungBoxStatistic = q;
        this.ljungBoxPValue = pValue;
        this.mean = stats.getMean();
        this.std = stats.getStandardDeviation();
        this.skewness = stats.getSkewness();
        this.kurtosis = stats.getKurtosis();
    }

    public static ResidualDiagnostics of(double[] residuals) {
        DescriptiveStatistics stats = new DescriptiveStatistics(residuals);
        int n = residuals.length;
        int lags = Math.min(DEFAULT_LAGS, n - 1);
        if (lags < 1) return new ResidualDiagnostics(0, 0, 1.0, stats);

        double mean = stats.getMean();
        double denom = 0;
        for (double r : residuals) denom += (r - mean) * (r - mean);
        if (denom == 0) return new ResidualDiagnostics(lags, 0, 1.0, stats);

        double q = 0;
        for (int k = 1; k <= lags; k++) {
            double num = 0;
            for (int t = k; t < n; t++) num += (residuals[t] - mean) * (residuals[t - k] - mean);
            double rk = num / denom;
            q += rk * rk / (n - k);
        }
        q *= n * (n + 2.0);
        double p = 1.0 - new ChiSquaredDistribution(lags).cumulativeProbability(q);
        return new ResidualDiagnostics(lags, q, p, stats);
    }

    public int getLags() { return lags; }
    public double getLjungBoxStatistic() { return ljungBoxStatistic; }
    public double getLjungBoxPValue() { return ljungBoxPValue; }

    public boolean isNoAutocorrelation() {
        return ljungBoxPValue > 0.05;
    }

    public double getMean() { return mean; }
    public double getStd() { return std; }
    public double getSkewness() { return skewness; }
    public double getKurtosis() { return kurtosis; }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("ljung_box_lags", lags);
        m.put("ljung_box_statistic", ljungBoxStatistic);
        m.put("ljung_box_p_value", ljungBoxPValue);
        m.put("no_autocorrelation", isNoAutocorrelation());
        m.put("residual_mean", mean);
        m.put("residual_std", std);
        m.put("residual_skewness", skewness);
        m.put("residual_kurtosis", kurtosis);
        return m;
    }
}
