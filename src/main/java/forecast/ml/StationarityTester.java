package forecast.ml;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Augmented Dickey-Fuller (null: unit root) and KPSS (null: level stationary) tests.
 * <p>
 * ADF: Δy_t = α + γ y_{t-1} + Σ β_i Δy_{t-i} + ε_t, lag order chosen by AIC, statistic γ/se(γ),
 * p-value from MacKinnon's (1994) response surface for the constant-only case.
 * <p>
 * KPSS: η = Σ S_t² / (n² σ̂²) with S_t the partial sums of the demeaned series and σ̂² the
 * Bartlett long-run variance (Hobijn et al. bandwidth); p-value interpolated on the
 * Kwiatkowski et al. table.
 */
public class StationarityTester {

    private static final Logger log = LoggerFactory.getLogger(StationarityTester.class);

    static final int MIN_OBSERVATIONS = 6;

    // MacKinnon (1994), one variable, constant term
    private static final double TAU_MAX = 2.74;
    private static final double TAU_MIN = -18.83;
    private static final double TAU_STAR = -1.61;
    private static final double[] TAU_SMALL_P = {2.1659, 1.4412, 0.038269};
    private static final double[] TAU_LARGE_P = {1.7339, 0.93202, -0.12745, -0.010368};

    private static final double[] KPSS_CRITICAL = {0.347, 0.463, 0.574, 0.739};
    private static final double[] KPSS_P = {0.10, 0.05, 0.025, 0.01};

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0, 1);

    private final double significance;

    public StationarityTester() {
        this(0.05);
    }

    public StationarityTester(double significance) {
        this.significance = significance;
    }

    /** Leading or embedded NaNs (e.g. from differencing) are dropped before testing. */
    public StationarityResult test(double[] series) {
        double[] y = Arrays.stream(series).filter(v -> !Double.isNaN(v)).toArray();
        try {
            if (y.length < MIN_OBSERVATIONS) {
                throw new IllegalArgumentException("too few observations for stationarity tests: " + y.length);
            }
            StationarityResult.TestOutcome adf = adf(y);
            StationarityResult.TestOutcome kpss = kpss(y);
            log.debug("Stationarity test - ADF p-value: {}, KPSS p-value: {}", adf.getPValue(), kpss.getPValue());
            return new StationarityResult(adf, kpss);
        } catch (RuntimeException e) {
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.debug("Stationarity testing failed: {}", msg);
            return StationarityResult.failed(msg);
        }
    }

    StationarityResult.TestOutcome adf(double[] y) {
        int n = y.length;
        int maxLag = (int) Math.ceil(12.0 * Math.pow(n / 100.0, 0.25));
        maxLag = Math.min(n / 2 - 2, maxLag);
        if (maxLag < 0) throw new IllegalArgumentException("series too short for ADF");

        double[] dy = new double[n - 1];
        for (int i = 1; i < n; i++) dy[i - 1] = y[i] - y[i - 1];

        int bestLag = 0;
        double bestAic = Double.POSITIVE_INFINITY;
        for (int lag = 0; lag <= maxLag; lag++) {
            OLSMultipleLinearRegression ols = adfRegression(y, dy, lag, maxLag);
            int nobs = dy.length - maxLag;
            double rss = ols.calculateResidualSumOfSquares();
            double aic = nobs * Math.log(Math.max(rss, 1e-300) / nobs) + 2.0 * (lag + 2);
            if (aic < bestAic) {
                bestAic = aic;
                bestLag = lag;
            }
        }

        OLSMultipleLinearRegression ols = adfRegression(y, dy, bestLag, bestLag);
        double[] beta = ols.estimateRegressionParameters();
        double[] se = ols.estimateRegressionParametersStandardErrors();
        double stat = beta[1] / se[1];
        if (!Double.isFinite(stat)) throw new IllegalStateException("degenerate ADF regression");
        double p = mackinnonPValue(stat);
        return new StationarityResult.TestOutcome(stat, p, bestLag, p < significance);
    }

    /** Rows t = start .. n-2 of Δy regressed on y_t and Δy_{t-1..t-lag}, with intercept. */
    private static OLSMultipleLinearRegression adfRegression(double[] y, double[] dy, int lag, int start) {
        int rows = dy.length - start;
        double[] target = new double[rows];
        double[][] x = new double[rows][1 + lag];
        for (int r = 0; r < rows; r++) {
            int t = start + r;
            target[r] = dy[t];
            x[r][0] = y[t];
            for (int i = 1; i <= lag; i++) x[r][i] = dy[t - i];
        }
        OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
        ols.newSampleData(target, x);
        return ols;
    }

    StationarityResult.TestOutcome kpss(double[] y) {
        int n = y.length;
        double mean = Arrays.stream(y).average().orElse(0);
        double[] e = new double[n];
        for (int i = 0; i < n; i++) e[i] = y[i] - mean;

        int lags = Math.min(kpssAutoLag(e), n - 1);
        double longRun = 0;
        for (double v : e) longRun += v * v;
        for (int k = 1; k <= lags; k++) {
            longRun += 2.0 * (1.0 - k / (lags + 1.0)) * lagProduct(e, k);
        }
        longRun /= n;
        if (!(longRun > 0) || !Double.isFinite(longRun)) {
            throw new IllegalStateException("KPSS long-run variance is not positive");
        }

        double partial = 0, eta = 0;
        for (double v : e) {
            partial += v;
            eta += partial * partial;
        }
        double stat = eta / ((double) n * n) / longRun;
        double p = kpssPValue(stat);
        return new StationarityResult.TestOutcome(stat, p, lags, p > significance);
    }

    private static int kpssAutoLag(double[] e) {
        int n = e.length;
        int covLags = (int) Math.pow(n, 2.0 / 9.0);
        double s0 = 0;
        for (double v : e) s0 += v * v;
        s0 /= n;
        double s1 = 0;
        for (int i = 1; i <= covLags; i++) {
            double prod = lagProduct(e, i) / (n / 2.0);
            s0 += prod;
            s1 += i * prod;
        }
        double sHat = s1 / s0;
        double gamma = 1.1447 * Math.pow(sHat * sHat, 1.0 / 3.0);
        int lags = (int) (gamma * Math.pow(n, 1.0 / 3.0));
        return Double.isFinite(gamma) ? Math.max(lags, 0) : 0;
    }

    private static double lagProduct(double[] e, int k) {
        double s = 0;
        for (int t = k; t < e.length; t++) s += e[t] * e[t - k];
        return s;
    }

    static double mackinnonPValue(double stat) {
        if (stat > TAU_MAX) return 1.0;
        if (stat < TAU_MIN) return 0.0;
        double[] coef = stat <= TAU_STAR ? TAU_SMALL_P : TAU_LARGE_P;
        double z = 0, pow = 1;
        for (double c : coef) {
            z += c * pow;
            pow *= stat;
        }
        return STANDARD_NORMAL.cumulativeProbability(z);
    }

    static double kpssPValue(double stat) {
        if (stat <= KPSS_CRITICAL[0]) return KPSS_P[0];
        int last = KPSS_CRITICAL.length - 1;
        if (stat >= KPSS_CRITICAL[last]) return KPSS_P[last];
        for (int i = 1; i <= last; i++) {
            if (stat <= KPSS_CRITICAL[i]) {
                double w = (stat - KPSS_CRITICAL[i - 1]) / (KPSS_CRITICAL[i] - KPSS_CRITICAL[i - 1]);
                return KPSS_P[i - 1] + w * (KPSS_P[i] - KPSS_P[i - 1]);
            }
        }
        return KPSS_P[last];
    }
}
