package forecast.ml;

import forecast.data.SelectionConfig;
import forecast.data.TimeSeries;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Additive decomposition y(t) = g(t) + s(t) + ε with a piecewise-linear trend g and Fourier
 * seasonal terms s.
 * <p>
 * The trend has changepoints spread over the first 80% of history; their slope adjustments are
 * ridge-penalised by σ̂²/τ², where τ is the trend flexibility. Weekly, monthly and quarterly
 * seasonalities are added only when the history spans 14, 60 and 180 days respectively.
 * <p>
 * Growth is linear (values scaled by max |y|) or, for bounded metrics, logistic: the model is
 * fitted on logit((y − floor)/(cap − floor)) and mapped back, so forecasts and interval bounds
 * always stay inside [floor, cap].
 */
public class SeasonalTrendModel implements ForecastModel {

    private static final Logger log = LoggerFactory.getLogger(SeasonalTrendModel.class);

    public static final String NAME = "seasonal_trend";
    static final int MIN_POINTS = 5;
    static final int MAX_CHANGEPOINTS = 25;
    static final double CHANGEPOINT_RANGE = 0.8;
    static final double LOGIT_EPSILON = 1e-3;
    private static final double PENALTY_FLOOR = 1e-8;
    private static final double VARIANCE_FLOOR = 1e-6;

    static final Seasonality WEEKLY = new Seasonality("weekly", 7.0, 3, 14);
    static final Seasonality MONTHLY = new Seasonality("monthly", 30.5, 5, 60);
    static final Seasonality QUARTERLY = new Seasonality("quarterly", 91.25, 3, 180);
    private static final Seasonality[] SEASONALITIES = {WEEKLY, MONTHLY, QUARTERLY};

    private final SelectionConfig config;

    public SeasonalTrendModel(SelectionConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public FitResult fit(TimeSeries series) {
        int n = series.size();
        if (n < MIN_POINTS) {
            return FitResult.failure(NAME, "insufficient data points: " + n);
        }
        try {
            log.info("Fitting seasonal-trend model for {} metric ({} points)", config.getMetricType().wireName(), n);
            return FitResult.success(estimate(series));
        } catch (RuntimeException e) {
            log.warn("Seasonal-trend fit failed: {}", e.getMessage());
            return FitResult.failure(FitFailure.of(NAME, e));
        }
    }

    private FittedSeasonalTrend estimate(TimeSeries series) {
        int n = series.size();
        double[] y = series.values();
        double[] days = series.dayOffsets();
        double horizon = Math.max(1.0, series.spanDays());

        GrowthTransform transform = config.isLogisticGrowth()
                ? GrowthTransform.logistic(config.getFloor(), config.getCap())
                : GrowthTransform.linear(y);
        double[] target = new double[n];
        for (int i = 0; i < n; i++) target[i] = transform.forward(y[i]);

        List<Seasonality> seasonalities = new ArrayList<>();
        for (Seasonality s : SEASONALITIES) {
            if (series.spanDays() >= s.minSpanDays) seasonalities.add(s);
        }
        double[] changepoints = changepoints(days, horizon);
        DesignLayout layout = new DesignLayout(horizon, changepoints, seasonalities);

        double[][] x = new double[n][];
        for (int i = 0; i < n; i++) x[i] = layout.row(days[i]);

        double noise = preliminaryNoise(days, target);
        double[] penalty = new double[layout.width()];
        for (int j = 0; j < penalty.length; j++) {
            if (j < 2) continue; // intercept and base slope are unpenalised
            double scale = j < 2 + changepoints.length ? config.getChangepointScale() : config.getSeasonalityScale();
            penalty[j] = Math.max(PENALTY_FLOOR, noise / (scale * scale));
        }

        RealMatrix X = MatrixUtils.createRealMatrix(x);
        RealMatrix Xt = X.transpose();
        RealMatrix XtX = Xt.multiply(X);
        RealMatrix A = XtX.add(MatrixUtils.createRealDiagonalMatrix(penalty));
        DecompositionSolver solver = new LUDecomposition(A).getSolver();
        if (!solver.isNonSingular()) {
            throw new IllegalStateException("penalised normal equations are singular");
        }
        RealVector beta = solver.solve(Xt.operate(MatrixUtils.createRealVector(target)));
        RealMatrix covariance = solver.getInverse();
        for (double b : beta.toArray()) {
            if (!Double.isFinite(b)) throw new IllegalStateException("non-finite coefficients");
        }

        double rss = 0;
        for (int i = 0; i < n; i++) {
            double r = target[i] - beta.dotProduct(MatrixUtils.createRealVector(x[i]));
            rss += r * r;
        }
        double dof = covariance.multiply(XtX).getTrace();
        double sigma2 = Math.max(rss / Math.max(1.0, n - dof), VARIANCE_FLOOR * VARIANCE_FLOOR);
        double aic = n * Math.log(Math.max(rss / n, 1e-300)) + 2.0 * (dof + 1);

        log.info("Seasonal-trend fitted: {} changepoints, seasonalities {}, effective df {}",
                changepoints.length, layout.seasonalityNames(), String.format("%.1f", dof));
        return new FittedSeasonalTrend(series, layout, transform, beta.toArray(), covariance, sigma2, aic,
                config.getSeasonalIntervalLevel(), config.getChangepointScale());
    }

    /** Changepoint positions (scaled time) at evenly spaced observations of the first 80% of history. */
    static double[] changepoints(double[] days, double horizon) {
        int histSize = (int) Math.floor(days.length * CHANGEPOINT_RANGE);
        int count = Math.min(MAX_CHANGEPOINTS, histSize - 1);
        if (count <= 0) return new double[0];
        double[] cps = new double[count];
        for (int j = 1; j <= count; j++) {
            int idx = (int) Math.round(j * (histSize - 1) / (double) count);
            cps[j - 1] = days[idx] / horizon;
        }
        return cps;
    }

    /** Residual variance of a plain straight-line fit, floored. */
    private static double preliminaryNoise(double[] days, double[] target) {
        double[][] t = new double[days.length][1];
        for (int i = 0; i < days.length; i++) t[i][0] = days[i];
        try {
            return Math.max(VARIANCE_FLOOR, new LinearRegression(t, target).getResidualVariance());
        } catch (IllegalArgumentException e) {
            log.debug("Preliminary trend fit unavailable: {}", e.getMessage());
            return VARIANCE_FLOOR;
        }
    }

    static final class Seasonality {
        final String name;
        final double period;
        final int order;
        final long minSpanDays;

        Seasonality(String name, double period, int order, long minSpanDays) {
            this.name = name;
            this.period = period;
            this.order = order;
            this.minSpanDays = minSpanDays;
        }
    }

    /** Column layout: [1, t, (t − c_j)+ ..., sin/cos pairs per seasonality]. */
    static final class DesignLayout {
        private final double horizon;
        private final double[] changepoints;
        private final List<Seasonality> seasonalities;

        DesignLayout(double horizon, double[] changepoints, List<Seasonality> seasonalities) {
            this.horizon = horizon;
            this.changepoints = changepoints;
            this.seasonalities = seasonalities;
        }

        int width() {
            int w = 2 + changepoints.length;
            for (Seasonality s : seasonalities) w += 2 * s.order;
            return w;
        }

        double[] row(double day) {
            double[] r = new double[width()];
            double t = day / horizon;
            r[0] = 1.0;
            r[1] = t;
            int c = 2;
            for (double cp : changepoints) r[c++] = Math.max(0.0, t - cp);
            for (Seasonality s : seasonalities) {
                for (int k = 1; k <= s.order; k++) {
                    double angle = 2 * Math.PI * k * day / s.period;
                    r[c++] = Math.sin(angle);
                    r[c++] = Math.cos(angle);
                }
            }
            return r;
        }

        int changepointCount() {
            return changepoints.length;
        }

        /** Intercept, base slope and changepoint columns. */
        int trendWidth() {
            return 2 + changepoints.length;
        }

        List<Seasonality> seasonalities() {
            return seasonalities;
        }

        List<String> seasonalityNames() {
            List<String> names = new ArrayList<>();
            for (Seasonality s : seasonalities) names.add(s.name);
            return names;
        }
    }

    /** Maps observations to the modelling scale and back. */
    static final class GrowthTransform {
        private final boolean logistic;
        private final double floor;
        private final double cap;
        private final double scale;

        private GrowthTransform(boolean logistic, double floor, double cap, double scale) {
            this.logistic = logistic;
            this.floor = floor;
            this.cap = cap;
            this.scale = scale;
        }

        static GrowthTransform logistic(double floor, double cap) {
            return new GrowthTransform(true, floor, cap, 1.0);
        }

        static GrowthTransform linear(double[] y) {
            double max = 0;
            for (double v : y) max = Math.max(max, Math.abs(v));
            return new GrowthTransform(false, 0, 0, max > 0 ? max : 1.0);
        }

        double forward(double v) {
            if (!logistic) return v / scale;
            double u = (v - floor) / (cap - floor);
            u = Math.max(LOGIT_EPSILON, Math.min(1 - LOGIT_EPSILON, u));
            return Math.log(u / (1 - u));
        }

        double inverse(double v) {
            if (!logistic) return v * scale;
            return floor + (cap - floor) / (1 + Math.exp(-v));
        }

        boolean isLogistic() {
            return logistic;
        }

        /** An additive part of the modelling-scale fit, on the scale components are reported in. */
        double component(double v) {
            return logistic ? v : v * scale;
        }
    }
}
