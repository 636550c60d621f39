package forecast.ml;

import org.apache.commons.math3.linear.*;

/**
 * Ordinary Least Squares (OLS) linear regression.
 * <p>
 * Model: y = β₀ + β₁x₁ + β₂x₂ + ... + βₙxₙ
 * <p>
 * Closed-form solution (normal equation): β = (X'X)⁻¹X'y
 * where X is the design matrix (with column of 1s for intercept) and y is the response vector.
 * Used for the naive trend forecast, for AR starting values and for residual-scale estimates.
 */
public class LinearRegression {

    private final double[] coefficients;  // β₀, β₁, ..., βₙ
    private final double rSquared;
    private final double residualVariance;
    private final int n;
    private final int p;

    /**
     * Fit the model using the normal equation: β = (X'X)⁻¹X'y
     *
     * @param X design matrix (rows = observations, columns = features; no intercept column)
     * @param y response vector (length = number of observations)
     */
    public LinearRegression(double[][] X, double[] y) {
        if (X == null || y == null || X.length != y.length || X.length == 0) {
            throw new IllegalArgumentException("X and y must be non-null, same length, and non-empty");
        }
        n = X.length;
        int features = X[0].length;
        p = features + 1; // +1 for intercept

        double[][] design = new double[n][p];
        for (int i = 0; i < n; i++) {
            design[i][0] = 1.0;
            System.arraycopy(X[i], 0, design[i], 1, features);
        }

        RealMatrix Xm = MatrixUtils.createRealMatrix(design);
        RealMatrix Xt = Xm.transpose();
        DecompositionSolver solver = new LUDecomposition(Xt.multiply(Xm)).getSolver();
        if (!solver.isNonSingular()) {
            throw new IllegalArgumentException("Design matrix X'X is singular; cannot compute (X'X)⁻¹");
        }
        coefficients = solver.solve(Xt.operate(MatrixUtils.createRealVector(y))).toArray();

        double meanY = 0;
        for (double v : y) meanY += v;
        meanY /= n;
        double ssTot = 0, ssRes = 0;
        for (int i = 0; i < n; i++) {
            double r = y[i] - predict(X[i]);
            ssTot += (y[i] - meanY) * (y[i] - meanY);
            ssRes += r * r;
        }
        rSquared = (ssTot > 0) ? 1.0 - (ssRes / ssTot) : 0;
        residualVariance = (n > p) ? ssRes / (n - p) : 0;
    }

    /** Regression of y on its position 0..n-1. */
    public static LinearRegression onIndex(double[] y) {
        double[][] t = new double[y.length][1];
        for (int i = 0; i < y.length; i++) t[i][0] = i;
        return new LinearRegression(t, y);
    }

    /** Intercept β₀ */
    public double getIntercept() {
        return coefficients[0];
    }

    /** Coefficient βᵢ for feature i (0-based). β₁ is first feature. */
    public double getCoefficient(int i) {
        return coefficients[i + 1];
    }

    public double getRSquared() { return rSquared; }

    /** Unbiased residual variance SS_res / (n - p); 0 when there are no degrees of freedom left. */
    public double getResidualVariance() { return residualVariance; }

    /** Predict y for one observation (no intercept in x). */
    public double predict(double[] x) {
        double y = coefficients[0];
        for (int i = 0; i < x.length; i++) {
            y += coefficients[i + 1] * x[i];
        }
        return y;
    }
}
