package forecast.ml;

import forecast.data.TimeSeries;
import org.apache.commons.math3.distribution.NormalDistribution;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A fitted ARIMA(p,d,q). Forecasts run the ARMA recursion on the demeaned differenced series with
 * future innovations set to zero, then integrate d times. Interval half-widths come from the
 * ψ-weights of the integrated model: var_h = σ² Σ_{j<h} ψ_j².
 */
public class FittedArima implements FittedModel {

    private final TimeSeries series;
    private final int p, d, q;
    private final double[] ar;      // φ₁..φₚ
    private final double[] ma;      // θ₁..θq
    private final double mean;      // μ of the differenced series
    private final double sigma2;
    private final double aic;
    private final double[] demeaned;
    private final double[] innovations;
    private final ResidualDiagnostics diagnostics;
    private final double intervalLevel;

    FittedArima(TimeSeries series, int p, int d, int q, double[] ar, double[] ma, double mean, double sigma2,
                double aic, double[] demeaned, double[] innovations, ResidualDiagnostics diagnostics,
                double intervalLevel) {
        this.series = series;
        this.p = p;
        this.d = d;
        this.q = q;
        this.ar = ar;
        this.ma = ma;
        this.mean = mean;
        this.sigma2 = sigma2;
        this.aic = aic;
        this.demeaned = demeaned;
        this.innovations = innovations;
        this.diagnostics = diagnostics;
        this.intervalLevel = intervalLevel;
    }

    @Override
    public String getModelName() {
        return ArimaModel.NAME;
    }

    @Override
    public ForecastTable predict(int periods) {
        if (periods <= 0) throw new IllegalArgumentException("periods must be positive");
        double[] point = forecastLevels(periods);
        double[] psi = psiWeights(periods);
        double z = new NormalDistribution(0, 1).inverseCumulativeProbability(0.5 + intervalLevel / 2);
        double[] lower = new double[periods];
        double[] upper = new double[periods];
        double cumulative = 0;
        for (int h = 0; h < periods; h++) {
            cumulative += psi[h] * psi[h];
            double half = z * Math.sqrt(sigma2 * cumulative);
            lower[h] = point[h] - half;
            upper[h] = point[h] + half;
        }
        return ForecastTable.of(series, point, lower, upper);
    }

    /** Forecast of the differenced series, re-integrated to the original scale. */
    double[] forecastLevels(int steps) {
        int T = demeaned.length;
        double[] w = Arrays.copyOf(demeaned, T + steps);
        double[] e = Arrays.copyOf(innovations, T + steps);
        double[] out = new double[steps];
        for (int t = T; t < T + steps; t++) {
            double pred = 0;
            for (int i = 0; i < p && t - 1 - i >= 0; i++) pred += ar[i] * w[t - 1 - i];
            for (int i = 0; i < q && t - 1 - i >= 0; i++) pred += ma[i] * e[t - 1 - i];
            w[t] = pred;
            e[t] = 0;
            out[t - T] = pred + mean;
        }
        double[] y = series.values();
        for (int k = d; k >= 1; k--) {
            double[] base = DifferencingSelector.difference(y, k - 1);
            double level = base[base.length - 1];
            for (int i = 0; i < steps; i++) {
                level += out[i];
                out[i] = level;
            }
        }
        return out;
    }

    /** ψ-weights of θ(B) / (φ(B)(1−B)^d). */
    double[] psiWeights(int count) {
        double[] poly = new double[p + 1];
        poly[0] = 1;
        for (int i = 0; i < p; i++) poly[i + 1] = -ar[i];
        for (int k = 0; k < d; k++) {
            double[] next = new double[poly.length + 1];
            for (int i = 0; i < poly.length; i++) {
                next[i] += poly[i];
                next[i + 1] -= poly[i];
            }
            poly = next;
        }
        double[] psi = new double[count];
        psi[0] = 1;
        for (int j = 1; j < count; j++) {
            double v = j <= q ? ma[j - 1] : 0;
            for (int i = 1; i < poly.length && i <= j; i++) v += -poly[i] * psi[j - i];
            psi[j] = v;
        }
        return psi;
    }

    @Override
    public double getInformationCriterion() {
        return aic;
    }

    @Override
    public Map<String, Object> getParameters() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("order", "(" + p + "," + d + "," + q + ")");
        m.put("p", p);
        m.put("d", d);
        m.put("q", q);
        m.put("ar", toList(ar));
        m.put("ma", toList(ma));
        m.put("constant", d <= 1 ? mean : 0.0);
        m.put("sigma2", sigma2);
        m.put("aic", aic);
        m.put("diagnostics", diagnostics.toMap());
        return m;
    }

    private static List<Double> toList(double[] a) {
        List<Double> out = new ArrayList<>(a.length);
        for (double v : a) out.add(v);
        return out;
    }

    public int getP() { return p; }
    public int getD() { return d; }
    public int getQ() { return q; }
    public double[] getArCoefficients() { return ar.clone(); }
    public double[] getMaCoefficients() { return ma.clone(); }
    public double getSigma2() { return sigma2; }
    public ResidualDiagnostics getDiagnostics() { return diagnostics; }
}
