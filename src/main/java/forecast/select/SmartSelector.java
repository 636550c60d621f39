package forecast.select;

import forecast.data.DataQualityAssessment;
import forecast.data.DataQualityAssessor;
import forecast.data.InvalidInputException;
import forecast.data.MetricType;
import forecast.data.SelectionConfig;
import forecast.data.TimeSeries;
import forecast.eval.CrossValidationResult;
import forecast.eval.ModelComparison;
import forecast.eval.PerformanceEvaluator;
import forecast.eval.PerformanceMetrics;
import forecast.eval.TrainTestSplit;
import forecast.ml.FitFailure;
import forecast.ml.FitResult;
import forecast.ml.FittedModel;
import forecast.ml.ForecastModel;
import forecast.ml.ForecastTable;
import forecast.ml.ModelKind;
import forecast.ml.NaiveForecaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Chooses, fits and forecasts with the most trustworthy model for one series.
 * <pre>
 *   n &lt; 10                      → INSUFFICIENT_DATA  naive forecast, confidence low
 *   10 ≤ n &lt; 30, not forced     → QUICK_SELECTION    first candidate that fits, confidence medium
 *   n ≥ 30 or forced            → FULL_EVALUATION    80/20 hold-out, best MAE wins, confidence high
 *   every candidate failed      → FALLBACK           naive forecast, confidence very_low
 * </pre>
 * Every failure inside a run degrades the state instead of propagating; {@link #select} always
 * returns a result for a valid series. Candidates are tried in order: seasonal-trend, then ARIMA.
 */
public class SmartSelector {

    private static final Logger log = LoggerFactory.getLogger(SmartSelector.class);

    public static final int MIN_POINTS = DataQualityAssessor.MIN_VIABLE_POINTS;
    public static final int FULL_EVALUATION_POINTS = 30;

    private final SelectionConfig config;
    private final List<ForecastModel> candidates;
    private final DataQualityAssessor assessor;
    private final PerformanceEvaluator evaluator;

    public SmartSelector(MetricType metricType) {
        this(SelectionConfig.forMetric(metricType));
    }

    public SmartSelector(SelectionConfig config) {
        this(config, defaultCandidates(config), new DataQualityAssessor(), new PerformanceEvaluator());
    }

    public SmartSelector(SelectionConfig config, List<ForecastModel> candidates,
                         DataQualityAssessor assessor, PerformanceEvaluator evaluator) {
        if (candidates.isEmpty()) throw new IllegalArgumentException("at least one candidate model is required");
        this.config = config;
        this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
        this.assessor = assessor;
        this.evaluator = evaluator;
    }

    static List<ForecastModel> defaultCandidates(SelectionConfig config) {
        List<ForecastModel> models = new ArrayList<>();
        for (ModelKind kind : ModelKind.values()) models.add(kind.create(config));
        return models;
    }

    public static SelectionState chooseState(int n, boolean forceFullEvaluation) {
        if (n < MIN_POINTS) return SelectionState.INSUFFICIENT_DATA;
        if (n < FULL_EVALUATION_POINTS && !forceFullEvaluation) return SelectionState.QUICK_SELECTION;
        return SelectionState.FULL_EVALUATION;
    }

    public SelectionResult select(TimeSeries series, int periods, boolean forceFullEvaluation) {
        checkPeriods(periods);
        log.info("Starting model selection for {} metric: {} points, {} periods",
                config.getMetricType().wireName(), series.size(), periods);
        DataQualityAssessment assessment = assessor.assess(series);
        try {
            switch (chooseState(series.size(), forceFullEvaluation)) {
                case INSUFFICIENT_DATA:
                    return insufficientData(series, periods, assessment);
                case QUICK_SELECTION:
                    return quickSelection(series, periods, assessment, candidates, "Quick selection");
                case FULL_EVALUATION:
                default:
                    return fullEvaluation(series, periods, assessment);
            }
        } catch (RuntimeException e) {
            log.error("Error in model selection", e);
            return fallback(series, periods, assessment, describe(e));
        }
    }

    /** Fit one pinned model family on the whole series, without evaluation. */
    public SelectionResult select(TimeSeries series, int periods, ModelKind preferred) {
        checkPeriods(periods);
        DataQualityAssessment assessment = assessor.assess(series);
        if (series.size() < MIN_POINTS) return insufficientData(series, periods, assessment);
        try {
            ForecastModel model = preferred.create(config);
            return quickSelection(series, periods, assessment, Collections.singletonList(model),
                    "Model preference: " + preferred.modelName() + " requested");
        } catch (RuntimeException e) {
            log.error("Error fitting preferred model {}", preferred.modelName(), e);
            return fallback(series, periods, assessment, describe(e));
        }
    }

    /** Hold-out evaluation of every candidate on an 80/20 split. */
    public CandidateEvaluation evaluateCandidates(TimeSeries series) {
        TrainTestSplit split = evaluator.split(series);
        Map<String, PerformanceMetrics> metrics = new LinkedHashMap<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (ForecastModel model : candidates) {
            log.info("Training {} model...", model.getName());
            FitResult fit = fitSafely(model, split.getTrain());
            if (!fit.isSuccess()) {
                String reason = fit.failure().get().getReason();
                log.warn("{} model training failed: {}", model.getName(), reason);
                failures.put(model.getName(), reason);
                continue;
            }
            try {
                metrics.put(model.getName(), evaluator.evaluate(fit.get(), split.getTest()));
            } catch (RuntimeException e) {
                log.warn("{} model evaluation failed: {}", model.getName(), describe(e));
                failures.put(model.getName(), describe(e));
            }
        }
        ModelComparison comparison = metrics.isEmpty() ? null : evaluator.compare(metrics);
        return new CandidateEvaluation(split, metrics, failures, comparison);
    }

    /** Rolling-origin cross-validation of every candidate; candidates that cannot be validated are left out. */
    public Map<String, CrossValidationResult> crossValidateCandidates(TimeSeries series) {
        Map<String, CrossValidationResult> results = new LinkedHashMap<>();
        for (ForecastModel model : candidates) {
            try {
                results.put(model.getName(), evaluator.crossValidate(model, series));
            } catch (RuntimeException e) {
                log.warn("{} cross-validation failed: {}", model.getName(), describe(e));
            }
        }
        return results;
    }

    /**
     * Naive linear-trend forecast for a run in which every candidate failed. Also used by callers
     * that abort a run, e.g. on timeout.
     */
    public SelectionResult fallback(TimeSeries series, int periods, DataQualityAssessment assessment, String error) {
        log.error("Using fallback selection: {}", error);
        DataQualityAssessment a = assessment != null ? assessment : assessor.assess(series);
        return SelectionResult.builder(SelectionState.FALLBACK)
                .modelUsed(NaiveForecaster.NAME)
                .reason("Fallback: " + error)
                .error(error)
                .assessment(a)
                .forecast(bounded(NaiveForecaster.forecast(series, periods)))
                .confidence(Confidence.VERY_LOW)
                .recommendations(Recommendations.from(a, config.getMetricType()))
                .modelParameters(NaiveForecaster.parameters(series))
                .build();
    }

    private SelectionResult insufficientData(TimeSeries series, int periods, DataQualityAssessment assessment) {
        log.warn("Insufficient data ({} points) for model fitting", series.size());
        return SelectionResult.builder(SelectionState.INSUFFICIENT_DATA)
                .modelUsed(NaiveForecaster.NAME)
                .reason("Insufficient data (" + series.size() + " points, need at least " + MIN_POINTS
                        + ") for seasonal-trend/ARIMA models; using " + NaiveForecaster.methodFor(series))
                .assessment(assessment)
                .forecast(bounded(NaiveForecaster.forecast(series, periods)))
                .confidence(Confidence.LOW)
                .recommendations(Recommendations.from(assessment, config.getMetricType()))
                .modelParameters(NaiveForecaster.parameters(series))
                .build();
    }

    private SelectionResult quickSelection(TimeSeries series, int periods, DataQualityAssessment assessment,
                                           List<ForecastModel> models, String context) {
        log.info("Performing quick model selection...");
        List<String> failures = new ArrayList<>();
        for (ForecastModel model : models) {
            FitResult fit = fitSafely(model, series);
            Optional<ForecastTable> forecast = fit.model().flatMap(m -> forecast(m, periods));
            if (forecast.isEmpty()) {
                String reason = fit.failure().map(f -> f.getReason()).orElse("forecast was not finite");
                log.warn("{} failed in quick selection: {}", model.getName(), reason);
                failures.add(model.getName() + ": " + reason);
                continue;
            }
            String why = failures.isEmpty()
                    ? context + ": " + model.getName() + " chosen for " + series.size() + " data points"
                    : context + ": " + model.getName() + " used after " + String.join("; ", failures);
            return SelectionResult.builder(SelectionState.QUICK_SELECTION)
                    .modelUsed(model.getName())
                    .reason(why)
                    .assessment(assessment)
                    .forecast(forecast.get())
                    .confidence(Confidence.MEDIUM)
                    .recommendations(Recommendations.from(assessment, config.getMetricType()))
                    .modelParameters(fit.get().getParameters())
                    .build();
        }
        return fallback(series, periods, assessment, context + " failed: " + String.join("; ", failures));
    }

    private SelectionResult fullEvaluation(TimeSeries series, int periods, DataQualityAssessment assessment) {
        if (!evaluator.canEvaluate(series.size())) {
            log.warn("Evaluation skipped: {} points cannot be split for hold-out testing", series.size());
            return quickSelection(series, periods, assessment, candidates,
                    "Evaluation skipped (" + series.size() + " points too few to split); quick selection");
        }
        log.info("Performing full model evaluation and selection...");
        CandidateEvaluation evaluation = evaluateCandidates(series);
        if (!evaluation.hasWinner()) {
            return fallback(series, periods, assessment,
                    "No models could be successfully trained and evaluated: " + evaluation.getFailures());
        }

        List<String> refitFailures = new ArrayList<>();
        for (PerformanceMetrics ranked : evaluation.getComparison().getRanking()) {
            ForecastModel model = candidate(ranked.getModelName());
            FitResult fit = fitSafely(model, series);
            Optional<ForecastTable> forecast = fit.model().flatMap(m -> forecast(m, periods));
            if (forecast.isEmpty()) {
                String reason = fit.failure().map(f -> f.getReason()).orElse("forecast was not finite");
                log.warn("Refitting {} on the full series failed: {}", model.getName(), reason);
                refitFailures.add(model.getName() + ": " + reason);
                continue;
            }
            String why = String.format("Full evaluation: %s selected based on performance comparison (MAE %.4f, RMSE %.4f)",
                    model.getName(), ranked.getMae(), ranked.getRmse());
            if (!refitFailures.isEmpty()) why += " after " + String.join("; ", refitFailures);
            return SelectionResult.builder(SelectionState.FULL_EVALUATION)
                    .modelUsed(model.getName())
                    .reason(why)
                    .assessment(assessment)
                    .metrics(ranked)
                    .evaluations(evaluation.getMetrics())
                    .comparison(evaluation.getComparison())
                    .forecast(forecast.get())
                    .confidence(Confidence.HIGH)
                    .recommendations(Recommendations.from(assessment, config.getMetricType()))
                    .modelParameters(fit.get().getParameters())
                    .build();
        }
        return fallback(series, periods, assessment,
                "Selected models could not be refitted on the full series: " + String.join("; ", refitFailures));
    }

    private ForecastModel candidate(String name) {
        for (ForecastModel m : candidates) {
            if (m.getName().equals(name)) return m;
        }
        throw new IllegalStateException("Unknown candidate " + name);
    }

    private static FitResult fitSafely(ForecastModel model, TimeSeries series) {
        try {
            return model.fit(series);
        } catch (RuntimeException e) {
            return FitResult.failure(FitFailure.of(model.getName(), e));
        }
    }

    /** Empty when the model cannot produce a finite forecast. */
    private Optional<ForecastTable> forecast(FittedModel model, int periods) {
        try {
            ForecastTable table = model.predict(periods);
            return table.isFinite() ? Optional.of(bounded(table)) : Optional.empty();
        } catch (RuntimeException e) {
            log.warn("{} forecast failed: {}", model.getModelName(), describe(e));
            return Optional.empty();
        }
    }

    private ForecastTable bounded(ForecastTable table) {
        return config.isBounded() ? table.clamp(config.getFloor(), config.getCap()) : table;
    }

    private static void checkPeriods(int periods) {
        if (periods <= 0) throw new InvalidInputException("forecast periods must be positive");
    }

    private static String describe(Throwable e) {
        String msg = e.getMessage();
        return msg != null && !msg.isEmpty() ? msg : e.getClass().getSimpleName();
    }
}
