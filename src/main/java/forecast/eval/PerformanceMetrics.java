package forecast.eval;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accuracy of one fitted model on one held-out test split.
 */
public final class PerformanceMetrics {

    private final String modelName;
    private final int testPeriods;
    private final double mae;
    private final double mse;
    private final double rmse;
    private final double mape;
    private final double r2;
    private final double mase;
    private final double smape;
    private final double meanError;
    private final double informationCriterion;

    public PerformanceMetrics(String modelName, int testPeriods, double mae, double mse, double rmse, double mape,
                              double r2, double mase, double smape, double meanError, double informationCriterion) {
        this.modelName = modelName;
        this.testPeriods = testPeriods;
        this.mae = mae;
        this.mse = mse;
        this.rmse = rmse;
        this.mape = mape;
        this.r2 = r2;
        this.mase = mase;
        this.smape = smape;
        this.meanError = meanError;
        this.informationCriterion = informationCriterion;
    }

    public String getModelName() { return modelName; }
    public int getTestPeriods() { return testPeriods; }
    public double getMae() { return mae; }
    public double getMse() { return mse; }
    public double getRmse() { return rmse; }
    public double getMape() { return mape; }
    public double getR2() { return r2; }
    public double getMase() { return mase; }
    public double getSmape() { return smape; }
    public double getMeanError() { return meanError; }
    public double getInformationCriterion() { return informationCriterion; }

    public Map<String, Double> toMap() {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put("mae", mae);
        m.put("mse", mse);
        m.put("rmse", rmse);
        m.put("mape", mape);
        m.put("r2", r2);
        m.put("mase", mase);
        m.put("smape", smape);
        m.put("me", meanError);
        m.put("aic", informationCriterion);
        return m;
    }
}
