package forecast.select;

import forecast.eval.ModelComparison;
import forecast.eval.PerformanceMetrics;
import forecast.eval.TrainTestSplit;

import java.util.Collections;
import java.util.Map;

/**
 * Hold-out results of every candidate: metrics for those that fitted, failure reasons for the rest.
 */
public final class CandidateEvaluation {

    private final TrainTestSplit split;
    private final Map<String, PerformanceMetrics> metrics;
    private final Map<String, String> failures;
    private final ModelComparison comparison;

    CandidateEvaluation(TrainTestSplit split, Map<String, PerformanceMetrics> metrics, Map<String, String> failures,
                        ModelComparison comparison) {
        this.split = split;
        this.metrics = Collections.unmodifiableMap(metrics);
        this.failures = Collections.unmodifiableMap(failures);
        this.comparison = comparison;
    }

    public TrainTestSplit getSplit() { return split; }

    /** Candidate name to metrics, in candidate order. */
    public Map<String, PerformanceMetrics> getMetrics() { return metrics; }

    public Map<String, String> getFailures() { return failures; }

    /** Null when no candidate could be evaluated. */
    public ModelComparison getComparison() { return comparison; }

    public boolean hasWinner() {
        return comparison != null;
    }
}
