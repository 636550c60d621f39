package forecast.api;

import forecast.data.InvalidInputException;
import forecast.data.MetricType;
import forecast.data.SelectionConfig;
import forecast.data.TimeSeries;
import forecast.eval.CrossValidationResult;
import forecast.ml.ModelKind;
import forecast.ml.NaiveForecaster;
import forecast.select.CandidateEvaluation;
import forecast.select.SelectionResult;
import forecast.select.SmartSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs selections on a bounded worker pool. A run that exceeds the timeout is cancelled and
 * answered with the fallback forecast. Only {@link InvalidInputException} reaches the caller.
 */
public class ForecastService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ForecastService.class);

    public static final int MIN_COMPARISON_POINTS = 20;

    private final ServerSettings settings;
    private final Function<SelectionConfig, SmartSelector> selectors;
    private final ExecutorService pool;

    public ForecastService(ServerSettings settings) {
        this(settings, SmartSelector::new);
    }

    public ForecastService(ServerSettings settings, Function<SelectionConfig, SmartSelector> selectors) {
        this.settings = settings;
        this.selectors = selectors;
        AtomicInteger counter = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(settings.getWorkers(), r -> {
            Thread t = new Thread(r, "forecast-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public Map<String, Object> forecast(ForecastRequest request) {
        TimeSeries series = request.toSeries();
        MetricType metricType = request.metricType();
        int periods = request.periods(settings.getMaxPeriods());
        boolean force = request.forceFullEvaluation();
        ModelKind preferred = request.preferredModel();
        SmartSelector selector = selectors.apply(SelectionConfig.forMetric(metricType));

        SelectionResult result = run(
                () -> preferred != null
                        ? selector.select(series, periods, preferred)
                        : selector.select(series, periods, force),
                error -> selector.fallback(series, periods, null, error));
        log.info("Forecast completed - model: {}, state: {}, confidence: {}",
                result.getModelUsed(), result.getState().wireName(), result.getConfidence().wireName());
        return ForecastResponse.of(result, metricType.wireName());
    }

    public Map<String, Object> compareModels(ForecastRequest request) {
        TimeSeries series = request.toSeries();
        if (series.size() < MIN_COMPARISON_POINTS) {
            throw new InvalidInputException("At least " + MIN_COMPARISON_POINTS
                    + " data points required for model comparison, got " + series.size());
        }
        MetricType metricType = request.metricType();
        SmartSelector selector = selectors.apply(SelectionConfig.forMetric(metricType));
        CandidateEvaluation evaluation = run(() -> selector.evaluateCandidates(series), error -> {
            throw new IllegalStateException("Model comparison failed: " + error);
        });
        Map<String, CrossValidationResult> crossValidation = run(() -> selector.crossValidateCandidates(series),
                error -> {
                    log.warn("Cross-validation skipped: {}", error);
                    return new LinkedHashMap<>();
                });
        return ComparisonResponse.of(evaluation, crossValidation, metricType.wireName());
    }

    public Map<String, Object> health() {
        Map<String, Object> h = new LinkedHashMap<>();
        h.put("status", "healthy");
        h.put("service", "adaptive-forecast");
        h.put("models_available", modelNames());
        h.put("workers", settings.getWorkers());
        h.put("timeout_ms", settings.getTimeoutMillis());
        h.put("timestamp", Instant.now().toString());
        return h;
    }

    public Map<String, Object> models() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("models", modelNames());
        m.put("model_preferences", preferenceNames());
        List<String> metricTypes = new ArrayList<>();
        for (MetricType t : MetricType.values()) metricTypes.add(t.wireName());
        m.put("metric_types", metricTypes);
        m.put("max_forecast_periods", settings.getMaxPeriods());
        m.put("min_comparison_points", MIN_COMPARISON_POINTS);
        return m;
    }

    private <T> T run(Callable<T> task, Function<String, T> onFailure) {
        Future<T> future = pool.submit(task);
        try {
            return future.get(settings.getTimeoutMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Run exceeded {} ms and was cancelled", settings.getTimeoutMillis());
            return onFailure.apply("Timed out after " + settings.getTimeoutMillis() + " ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return onFailure.apply("Interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InvalidInputException) throw (InvalidInputException) cause;
            log.error("Run failed", cause);
            String msg = cause.getMessage();
            return onFailure.apply(msg != null ? msg : cause.getClass().getSimpleName());
        }
    }

    private static List<String> modelNames() {
        List<String> names = new ArrayList<>();
        for (ModelKind k : ModelKind.values()) names.add(k.modelName());
        names.add(NaiveForecaster.NAME);
        return names;
    }

    private static List<String> preferenceNames() {
        List<String> names = new ArrayList<>();
        names.add(ForecastRequest.AUTO);
        for (ModelKind k : ModelKind.values()) names.add(k.modelName());
        return names;
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }
}
