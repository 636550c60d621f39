package forecast.ml;

import forecast.data.SelectionConfig;
import forecast.data.TimeSeries;
import org.apache.commons.math3.analysis.solvers.LaguerreSolver;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.BOBYQAOptimizer;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Autoregressive Integrated Moving Average, ARIMA(p,d,q), with automatic order selection.
 * <p>
 * Model: φ(B) (∇^d y_t − μ) = θ(B) ε_t, where μ is a mean (d = 0) or drift (d = 1) term and is
 * omitted for d = 2.
 * <p>
 * d comes from the {@link DifferencingSelector}; (p, q) from a grid bounded by the metric type,
 * scored by AIC. Coefficients are estimated by conditional sum of squares. If no grid candidate
 * fits, ARIMA(1,1,1) is tried once before the fit is reported as failed.
 */
public class ArimaModel implements ForecastModel {

    private static final Logger log = LoggerFactory.getLogger(ArimaModel.class);

    public static final String NAME = "arima";
    static final int MIN_POINTS = 5;
    private static final int[] FALLBACK_ORDER = {1, 1, 1};
    private static final double COEFFICIENT_BOUND = 1.5;
    private static final double SINGLE_COEFFICIENT_BOUND = 0.99;

    private final SelectionConfig config;
    private final DifferencingSelector differencing;

    public ArimaModel(SelectionConfig config) {
        this.config = config;
        this.differencing = new DifferencingSelector(new StationarityTester(config.getSignificance()));
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public FitResult fit(TimeSeries series) {
        if (series.size() < MIN_POINTS) {
            return FitResult.failure(NAME, "insufficient data points: " + series.size());
        }
        double[] y = series.values();
        int d = differencing.select(y, config.getMaxD()).getOrder();
        log.info("Grid searching ARIMA parameters with d={}", d);

        FittedArima best = null;
        for (int p = 0; p <= config.getMaxP(); p++) {
            for (int q = 0; q <= config.getMaxQ(); q++) {
                if (p + d + q > config.getOrderBudget()) continue;
                if (Thread.currentThread().isInterrupted()) {
                    return FitResult.failure(NAME, "interrupted during grid search");
                }
                FitResult candidate = fitOrder(series, p, d, q);
                if (!candidate.isSuccess()) {
                    log.debug("Skipping ARIMA({},{},{}): {}", p, d, q, candidate.failure().get().getReason());
                    continue;
                }
                FittedArima fitted = (FittedArima) candidate.get();
                if (best == null || fitted.getInformationCriterion() < best.getInformationCriterion()) {
                    best = fitted;
                }
            }
        }

        if (best == null) {
            log.warn("Grid search found no ARIMA fit, trying fallback order (1,1,1)");
            FitResult fallback = fitOrder(series, FALLBACK_ORDER[0], FALLBACK_ORDER[1], FALLBACK_ORDER[2]);
            if (!fallback.isSuccess()) {
                log.error("Fallback ARIMA model also failed: {}", fallback.failure().get().getReason());
                return FitResult.failure(NAME, "no ARIMA order could be fitted: " + fallback.failure().get().getReason());
            }
            return fallback;
        }
        log.info("Best ARIMA parameters: ({},{},{}) with AIC: {}",
                best.getP(), best.getD(), best.getQ(), String.format("%.2f", best.getInformationCriterion()));
        return FitResult.success(best);
    }

    /** Fit one fixed order. */
    public FitResult fitOrder(TimeSeries series, int p, int d, int q) {
        try {
            return FitResult.success(estimate(series, p, d, q));
        } catch (RuntimeException e) {
            return FitResult.failure(FitFailure.of(NAME, e));
        }
    }

    private FittedArima estimate(TimeSeries series, int p, int d, int q) {
        double[] y = series.values();
        double[] z = DifferencingSelector.difference(y, d);
        boolean constant = d <= 1;
        double mu = constant ? Arrays.stream(z).average().orElse(0) : 0;
        double[] w = new double[z.length];
        for (int i = 0; i < z.length; i++) w[i] = z[i] - mu;

        int start = p;
        int nEff = w.length - start;
        int nParams = p + q + (constant ? 1 : 0);
        if (nEff < nParams + 2) {
            throw new IllegalArgumentException("too few observations (" + nEff + ") for ARIMA(" + p + "," + d + "," + q + ")");
        }

        double[] params = estimateParameters(w, p, q, start);
        double[] ar = Arrays.copyOfRange(params, 0, p);
        double[] ma = Arrays.copyOfRange(params, p, p + q);
        if (!isStationary(ar)) {
            throw new IllegalStateException("non-stationary AR polynomial");
        }

        double[] innovations = innovations(w, ar, ma, start);
        double rss = 0;
        for (int t = start; t < w.length; t++) rss += innovations[t] * innovations[t];
        if (!Double.isFinite(rss)) throw new IllegalStateException("non-finite residuals");

        double scale = 0;
        for (double v : y) scale += v * v;
        double sigma2 = Math.max(rss / nEff, 1e-12 * Math.max(1.0, scale / y.length));
        double aic = nEff * Math.log(2 * Math.PI * sigma2) + nEff + 2.0 * (nParams + 1);

        double[] residuals = Arrays.copyOfRange(innovations, start, w.length);
        return new FittedArima(series, p, d, q, ar, ma, mu, sigma2, aic, w, innovations,
                ResidualDiagnostics.of(residuals), config.getArimaIntervalLevel());
    }

    /** Estimate (φ, θ) by minimising the conditional sum of squares. */
    private double[] estimateParameters(double[] w, int p, int q, int start) {
        int k = p + q;
        if (k == 0) return new double[0];
        double[] guess = initialGuess(w, p, q);
        ObjectiveFunctionCss css = new ObjectiveFunctionCss(w, p, q, start);

        if (k == 1) {
            BrentOptimizer brent = new BrentOptimizer(1e-10, 1e-12);
            UnivariatePointValuePair result = brent.optimize(
                    new MaxEval(500),
                    new UnivariateObjectiveFunction(x -> css.value(new double[]{x})),
                    GoalType.MINIMIZE,
                    new SearchInterval(-SINGLE_COEFFICIENT_BOUND, SINGLE_COEFFICIENT_BOUND, guess[0]));
            return new double[]{result.getPoint()};
        }

        double[] lower = new double[k];
        double[] upper = new double[k];
        Arrays.fill(lower, -COEFFICIENT_BOUND);
        Arrays.fill(upper, COEFFICIENT_BOUND);
        BOBYQAOptimizer opt = new BOBYQAOptimizer(2 * k + 1, 0.5, 1e-6);
        PointValuePair result = opt.optimize(
                new MaxEval(2000),
                new ObjectiveFunction(css::value),
                GoalType.MINIMIZE,
                new InitialGuess(guess),
                new SimpleBounds(lower, upper));
        return result.getPoint();
    }

    /** AR terms from a regression of w_t on its own lags, MA terms 0.1. */
    private static double[] initialGuess(double[] w, int p, int q) {
        double[] params = new double[p + q];
        Arrays.fill(params, 0.1);
        if (p > 0 && w.length > 2 * p + 1) {
            double[][] X = new double[w.length - p][p];
            double[] target = new double[w.length - p];
            for (int i = p; i < w.length; i++) {
                for (int j = 0; j < p; j++) X[i - p][j] = w[i - 1 - j];
                target[i - p] = w[i];
            }
            try {
                LinearRegression lr = new LinearRegression(X, target);
                for (int i = 0; i < p; i++) params[i] = lr.getCoefficient(i);
            } catch (IllegalArgumentException e) {
                log.debug("AR starting values unavailable, using defaults: {}", e.getMessage());
            }
        }
        double limit = (p + q == 1 ? SINGLE_COEFFICIENT_BOUND : COEFFICIENT_BOUND) * 0.9;
        for (int i = 0; i < params.length; i++) {
            if (!Double.isFinite(params[i])) params[i] = 0.1;
            params[i] = Math.max(-limit, Math.min(limit, params[i]));
        }
        return params;
    }

    static double[] innovations(double[] w, double[] ar, double[] ma, int start) {
        double[] e = new double[w.length];
        for (int t = start; t < w.length; t++) {
            double pred = 0;
            for (int i = 0; i < ar.length && t - 1 - i >= 0; i++) pred += ar[i] * w[t - 1 - i];
            for (int i = 0; i < ma.length && t - 1 - i >= 0; i++) pred += ma[i] * e[t - 1 - i];
            e[t] = w[t] - pred;
        }
        return e;
    }

    /** All roots of 1 − φ₁x − … − φₚxᵖ must lie outside the unit circle. */
    static boolean isStationary(double[] ar) {
        int degree = ar.length;
        while (degree > 0 && ar[degree - 1] == 0) degree--;
        if (degree == 0) return true;
        double[] coefficients = new double[degree + 1];
        coefficients[0] = 1;
        for (int i = 0; i < degree; i++) coefficients[i + 1] = -ar[i];
        Complex[] roots = new LaguerreSolver().solveAllComplex(coefficients, 0);
        for (Complex r : roots) {
            if (r.abs() <= 1.0 + 1e-6) return false;
        }
        return true;
    }

    private static final class ObjectiveFunctionCss {
        private final double[] w;
        private final int p;
        private final int q;
        private final int start;

        ObjectiveFunctionCss(double[] w, int p, int q, int start) {
            this.w = w;
            this.p = p;
            this.q = q;
            this.start = start;
        }

        double value(double[] params) {
            double[] e = innovations(w, Arrays.copyOfRange(params, 0, p), Arrays.copyOfRange(params, p, p + q), start);
            double rss = 0;
            for (int t = start; t < w.length; t++) rss += e[t] * e[t];
            return Double.isFinite(rss) ? rss : Double.MAX_VALUE;
        }
    }
}
