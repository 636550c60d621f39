package forecast.ml;

import forecast.data.TimeSeries;
import org.apache.commons.math3.distribution.NormalDistribution;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Model-free forecast used below the minimum sample size and as the last-resort fallback: an OLS
 * line through the points (last value carried forward for a single point), with bands of ±z times
 * the residual standard deviation.
 */
public final class NaiveForecaster {

    public static final String NAME = "simple_forecast";
    public static final String METHOD_LINEAR_TREND = "linear_trend";
    public static final String METHOD_LAST_VALUE = "last_value";
    static final double INTERVAL_LEVEL = 0.95;

    private NaiveForecaster() {
    }

    public static String methodFor(TimeSeries series) {
        return series.size() >= 2 ? METHOD_LINEAR_TREND : METHOD_LAST_VALUE;
    }

    public static ForecastTable forecast(TimeSeries series, int periods) {
        if (periods <= 0) throw new IllegalArgumentException("periods must be positive");
        int n = series.size();
        double[] point = new double[periods];
        double[] lower = new double[periods];
        double[] upper = new double[periods];
        if (n < 2) {
            double last = series.value(n - 1);
            for (int h = 0; h < periods; h++) {
                point[h] = last;
                lower[h] = last;
                upper[h] = last;
            }
            return ForecastTable.of(series, point, lower, upper);
        }

        LinearRegression trend = LinearRegression.onIndex(series.values());
        double z = new NormalDistribution(0, 1).inverseCumulativeProbability(0.5 + INTERVAL_LEVEL / 2);
        double half = z * Math.sqrt(trend.getResidualVariance());
        for (int h = 0; h < periods; h++) {
            point[h] = trend.predict(new double[]{n - 1 + h + 1});
            lower[h] = point[h] - half;
            upper[h] = point[h] + half;
        }
        return ForecastTable.of(series, point, lower, upper);
    }

    /** Method plus, for the linear trend, intercept, slope and R² of the fitted line. */
    public static Map<String, Object> parameters(TimeSeries series) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("method", methodFor(series));
        if (series.size() >= 2) {
            LinearRegression trend = LinearRegression.onIndex(series.values());
            m.put("intercept", trend.getIntercept());
            m.put("slope", trend.getCoefficient(0));
            m.put("r_squared", trend.getRSquared());
        }
        return m;
    }
}
