package forecast.select;

import forecast.data.DataQualityAssessment;
import forecast.eval.ModelComparison;
import forecast.eval.PerformanceMetrics;
import forecast.ml.ForecastTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final output of one selection run. Created fresh per request.
 */
public final class SelectionResult {

    private final String modelUsed;
    private final SelectionState state;
    private final String reason;
    private final DataQualityAssessment assessment;
    private final PerformanceMetrics metrics;
    private final Map<String, PerformanceMetrics> evaluations;
    private final ModelComparison comparison;
    private final ForecastTable forecast;
    private final Confidence confidence;
    private final List<String> recommendations;
    private final Map<String, Object> modelParameters;
    private final String error;

    private SelectionResult(Builder b) {
        this.modelUsed = b.modelUsed;
        this.state = b.state;
        this.reason = b.reason;
        this.assessment = b.assessment;
        this.metrics = b.metrics;
        this.evaluations = Collections.unmodifiableMap(new LinkedHashMap<>(b.evaluations));
        this.comparison = b.comparison;
        this.forecast = b.forecast;
        this.confidence = b.confidence;
        this.recommendations = Collections.unmodifiableList(new ArrayList<>(b.recommendations));
        this.modelParameters = Collections.unmodifiableMap(new LinkedHashMap<>(b.modelParameters));
        this.error = b.error;
    }

    static Builder builder(SelectionState state) {
        return new Builder(state);
    }

    public String getModelUsed() { return modelUsed; }
    public SelectionState getState() { return state; }
    public String getReason() { return reason; }
    public DataQualityAssessment getAssessment() { return assessment; }

    /** Hold-out metrics of the selected model; null unless it was evaluated. */
    public PerformanceMetrics getMetrics() { return metrics; }

    /** Hold-out metrics of every candidate that could be evaluated. */
    public Map<String, PerformanceMetrics> getEvaluations() { return evaluations; }

    /** Null unless candidates were compared. */
    public ModelComparison getComparison() { return comparison; }

    public ForecastTable getForecast() { return forecast; }
    public Confidence getConfidence() { return confidence; }
    public List<String> getRecommendations() { return recommendations; }
    public Map<String, Object> getModelParameters() { return modelParameters; }

    /** Message of the failure that led to fallback; null otherwise. */
    public String getError() { return error; }

    static final class Builder {
        private final SelectionState state;
        private String modelUsed;
        private String reason;
        private DataQualityAssessment assessment;
        private PerformanceMetrics metrics;
        private Map<String, PerformanceMetrics> evaluations = Collections.emptyMap();
        private ModelComparison comparison;
        private ForecastTable forecast;
        private Confidence confidence;
        private List<String> recommendations = Collections.emptyList();
        private Map<String, Object> modelParameters = Collections.emptyMap();
        private String error;

        private Builder(SelectionState state) {
            this.state = state;
        }

        Builder modelUsed(String v) { this.modelUsed = v; return this; }
        Builder reason(String v) { this.reason = v; return this; }
        Builder assessment(DataQualityAssessment v) { this.assessment = v; return this; }
        Builder metrics(PerformanceMetrics v) { this.metrics = v; return this; }
        Builder evaluations(Map<String, PerformanceMetrics> v) { this.evaluations = v; return this; }
        Builder comparison(ModelComparison v) { this.comparison = v; return this; }
        Builder forecast(ForecastTable v) { this.forecast = v; return this; }
        Builder confidence(Confidence v) { this.confidence = v; return this; }
        Builder recommendations(List<String> v) { this.recommendations = v; return this; }
        Builder modelParameters(Map<String, Object> v) { this.modelParameters = v; return this; }
        Builder error(String v) { this.error = v; return this; }

        SelectionResult build() {
            return new SelectionResult(this);
        }
    }
}
