package forecast.api;

import forecast.data.DataQualityAssessment;
import forecast.eval.PerformanceMetrics;
import forecast.ml.ForecastPoint;
import forecast.ml.ForecastTable;
import forecast.select.SelectionResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON shape of a {@link SelectionResult}.
 */
public final class ForecastResponse {

    private static final double STABLE_TOLERANCE = 1e-9;

    private ForecastResponse() { }

    public static Map<String, Object> of(SelectionResult result, String metricType) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", "success");
        out.put("metric_type", metricType);
        out.put("model_used", result.getModelUsed());
        out.put("selection_state", result.getState().wireName());
        out.put("selection_reason", result.getReason());
        out.put("forecast_data", forecastData(result.getForecast()));
        out.put("accuracy_metrics", result.getMetrics() != null ? result.getMetrics().toMap() : null);
        out.put("data_quality", dataQuality(result.getAssessment()));
        out.put("confidence", result.getConfidence().wireName());
        out.put("recommendations", result.getRecommendations());
        out.put("summary", summary(result.getForecast()));
        out.put("model_parameters", result.getModelParameters());
        out.put("evaluations", evaluations(result.getEvaluations()));
        if (result.getError() != null) out.put("error", result.getError());
        out.put("timestamp", Instant.now().toString());
        return out;
    }

    static List<Map<String, Object>> forecastData(ForecastTable table) {
        List<Map<String, Object>> rows = new ArrayList<>(table.size());
        for (ForecastPoint p : table.getPoints()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("date", p.getDate().toString());
            row.put("predicted_value", p.getValue());
            row.put("lower_bound", p.getLower());
            row.put("upper_bound", p.getUpper());
            rows.add(row);
        }
        return rows;
    }

    static Map<String, Object> dataQuality(DataQualityAssessment a) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("data_points", a.getDataPoints());
        m.put("date_range_days", a.getDateRangeDays());
        m.put("missing_values", a.getMissingValues());
        m.put("zero_values", a.getZeroValues());
        m.put("negative_values", a.getNegativeValues());
        m.put("variance", a.getVariance());
        m.put("mean", a.getMean());
        m.put("std", a.getStd());
        m.put("trend_direction", a.getTrendDirection().wireName());
        m.put("seasonality_detected", a.isSeasonalityDetected());
        m.put("quality_score", a.getQualityScore());
        return m;
    }

    static Map<String, Object> summary(ForecastTable table) {
        Map<String, Object> m = new LinkedHashMap<>();
        List<ForecastPoint> points = table.getPoints();
        if (points.isEmpty()) return m;
        double sum = 0, width = 0;
        for (ForecastPoint p : points) {
            sum += p.getValue();
            width += p.getUpper() - p.getLower();
        }
        double first = points.get(0).getValue();
        double last = points.get(points.size() - 1).getValue();
        String trend = last > first + STABLE_TOLERANCE ? "increasing"
                : last < first - STABLE_TOLERANCE ? "decreasing" : "stable";
        m.put("forecast_start", points.get(0).getDate().toString());
        m.put("forecast_end", points.get(points.size() - 1).getDate().toString());
        m.put("mean_prediction", sum / points.size());
        m.put("trend", trend);
        m.put("mean_interval_width", width / points.size());
        return m;
    }

    static Map<String, Object> evaluations(Map<String, PerformanceMetrics> evaluations) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (Map.Entry<String, PerformanceMetrics> e : evaluations.entrySet()) {
            m.put(e.getKey(), e.getValue().toMap());
        }
        return m;
    }
}
