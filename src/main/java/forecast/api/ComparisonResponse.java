package forecast.api;

import forecast.eval.CrossValidationResult;
import forecast.eval.ModelComparison;
import forecast.select.CandidateEvaluation;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON shape of a hold-out comparison between the model families.
 */
public final class ComparisonResponse {

    private ComparisonResponse() { }

    public static Map<String, Object> of(CandidateEvaluation evaluation, Map<String, CrossValidationResult> crossValidation,
                                         String metricType) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", "success");
        out.put("metric_type", metricType);
        out.put("train_points", evaluation.getSplit().getTrain().size());
        out.put("test_points", evaluation.getSplit().getTest().size());
        out.put("results", ForecastResponse.evaluations(evaluation.getMetrics()));
        out.put("failures", evaluation.getFailures());
        ModelComparison comparison = evaluation.getComparison();
        if (comparison != null) {
            out.put("best_model", comparison.getBestModelName());
            out.put("best_by_metric", comparison.getBestByMetric());
            out.put("ratings", comparison.getRatings());
            out.put("recommendations", comparison.getNotes());
        } else {
            out.put("best_model", null);
            out.put("recommendations", Collections.singletonList("No model could be trained on this series"));
        }
        out.put("cross_validation", crossValidation(crossValidation));
        out.put("timestamp", Instant.now().toString());
        return out;
    }

    static Map<String, Object> crossValidation(Map<String, CrossValidationResult> results) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, CrossValidationResult> e : results.entrySet()) {
            CrossValidationResult cv = e.getValue();
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("folds", cv.getFolds().size());
            m.put("failed_folds", cv.getFailedFolds());
            m.put("horizon", cv.getHorizon());
            m.put("cutoffs", cv.getCutoffs());
            m.put("mean_mae", cv.getMeanMae());
            m.put("mean_rmse", cv.getMeanRmse());
            out.put(e.getKey(), m);
        }
        return out;
    }
}
