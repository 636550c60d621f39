package forecast.eval;

import java.util.Collections;
import java.util.List;

/**
 * Rolling-origin evaluation of one model: per-fold metrics in cutoff order.
 */
public final class CrossValidationResult {

    private final String modelName;
    private final int horizon;
    private final List<Integer> cutoffs;
    private final List<PerformanceMetrics> folds;
    private final int failedFolds;

    CrossValidationResult(String modelName, int horizon, List<Integer> cutoffs, List<PerformanceMetrics> folds,
                          int failedFolds) {
        this.modelName = modelName;
        this.horizon = horizon;
        this.cutoffs = Collections.unmodifiableList(cutoffs);
        this.folds = Collections.unmodifiableList(folds);
        this.failedFolds = failedFolds;
    }

    public String getModelName() { return modelName; }
    public int getHorizon() { return horizon; }

    /** Training length of each evaluated fold. */
    public List<Integer> getCutoffs() { return cutoffs; }
    public List<PerformanceMetrics> getFolds() { return folds; }
    public int getFailedFolds() { return failedFolds; }

    public double getMeanMae() {
        double sum = 0;
        for (PerformanceMetrics m : folds) sum += m.getMae();
        return sum / folds.size();
    }

    public double getMeanRmse() {
        double sum = 0;
        for (PerformanceMetrics m : folds) sum += m.getRmse();
        return sum / folds.size();
    }
}
