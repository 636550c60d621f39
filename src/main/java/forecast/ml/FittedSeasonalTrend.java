package forecast.ml;

import forecast.data.TimeSeries;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A fitted {@link SeasonalTrendModel}. Interval bounds use the posterior predictive variance
 * σ²(1 + xᵀ(XᵀX + Λ)⁻¹x) on the modelling scale and are mapped back like the point forecast.
 */
public class FittedSeasonalTrend implements FittedModel {

    private final TimeSeries series;
    private final SeasonalTrendModel.DesignLayout layout;
    private final SeasonalTrendModel.GrowthTransform transform;
    private final RealVector beta;
    private final RealMatrix covariance;
    private final double sigma2;
    private final double aic;
    private final double intervalLevel;
    private final double changepointScale;

    FittedSeasonalTrend(TimeSeries series, SeasonalTrendModel.DesignLayout layout,
                        SeasonalTrendModel.GrowthTransform transform, double[] beta, RealMatrix covariance,
                        double sigma2, double aic, double intervalLevel, double changepointScale) {
        this.series = series;
        this.layout = layout;
        this.transform = transform;
        this.beta = MatrixUtils.createRealVector(beta);
        this.covariance = covariance;
        this.sigma2 = sigma2;
        this.aic = aic;
        this.intervalLevel = intervalLevel;
        this.changepointScale = changepointScale;
    }

    @Override
    public String getModelName() {
        return SeasonalTrendModel.NAME;
    }

    @Override
    public ForecastTable predict(int periods) {
        if (periods <= 0) throw new IllegalArgumentException("periods must be positive");
        double z = new NormalDistribution(0, 1).inverseCumulativeProbability(0.5 + intervalLevel / 2);
        double[] point = new double[periods];
        double[] lower = new double[periods];
        double[] upper = new double[periods];
        for (int h = 0; h < periods; h++) {
            double day = ChronoUnit.DAYS.between(series.firstDate(), series.dateAfter(h + 1));
            RealVector x = MatrixUtils.createRealVector(layout.row(day));
            double mean = beta.dotProduct(x);
            double half = z * Math.sqrt(sigma2 * (1 + x.dotProduct(covariance.operate(x))));
            point[h] = transform.inverse(mean);
            lower[h] = transform.inverse(mean - half);
            upper[h] = transform.inverse(mean + half);
        }
        return ForecastTable.of(series, point, lower, upper);
    }

    /**
     * Additive decomposition over the history followed by {@code periods} forecast steps: the trend
     * and one entry per fitted seasonality, keyed by name. For linear growth the parts sum to the
     * point forecast; for logistic growth they are reported on the logit scale.
     */
    public Map<String, double[]> components(int periods) {
        if (periods < 0) throw new IllegalArgumentException("periods must not be negative");
        int n = series.size();
        double[] days = new double[n + periods];
        double[] history = series.dayOffsets();
        System.arraycopy(history, 0, days, 0, n);
        for (int h = 0; h < periods; h++) {
            days[n + h] = ChronoUnit.DAYS.between(series.firstDate(), series.dateAfter(h + 1));
        }

        List<SeasonalTrendModel.Seasonality> seasonalities = layout.seasonalities();
        Map<String, double[]> parts = new LinkedHashMap<>();
        parts.put("trend", new double[days.length]);
        for (SeasonalTrendModel.Seasonality s : seasonalities) parts.put(s.name, new double[days.length]);

        for (int i = 0; i < days.length; i++) {
            double[] row = layout.row(days[i]);
            int c = 0;
            double trend = 0;
            for (; c < layout.trendWidth(); c++) trend += beta.getEntry(c) * row[c];
            parts.get("trend")[i] = transform.component(trend);
            for (SeasonalTrendModel.Seasonality s : seasonalities) {
                double v = 0;
                for (int k = 0; k < 2 * s.order; k++, c++) v += beta.getEntry(c) * row[c];
                parts.get(s.name)[i] = transform.component(v);
            }
        }
        return parts;
    }

    @Override
    public double getInformationCriterion() {
        return aic;
    }

    @Override
    public Map<String, Object> getParameters() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("growth", transform.isLogistic() ? "logistic" : "linear");
        m.put("changepoints", layout.changepointCount());
        m.put("changepoint_scale", changepointScale);
        m.put("seasonalities", layout.seasonalityNames());
        m.put("interval_width", intervalLevel);
        m.put("sigma2", sigma2);
        m.put("aic", aic);
        return m;
    }
}
