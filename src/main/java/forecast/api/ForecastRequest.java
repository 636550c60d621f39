package forecast.api;

import com.google.gson.annotations.SerializedName;
import forecast.data.InvalidInputException;
import forecast.data.MetricType;
import forecast.data.Observation;
import forecast.data.TimeSeries;
import forecast.ml.ModelKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of a forecast or comparison request, bound by Gson.
 */
public class ForecastRequest {

    public static final int DEFAULT_PERIODS = 30;
    public static final String AUTO = "auto";

    public static class Point {
        String timestamp;
        String date;
        Double value;

        public Point() { }

        public Point(String timestamp, Double value) {
            this.timestamp = timestamp;
            this.value = value;
        }
    }

    List<Point> series;
    @SerializedName("metric_type")
    String metricType;
    @SerializedName("forecast_periods")
    Integer forecastPeriods;
    @SerializedName("force_full_evaluation")
    Boolean forceFullEvaluation;
    @SerializedName("model_preference")
    String modelPreference;

    public ForecastRequest() { }

    public ForecastRequest(List<Point> series, String metricType, Integer forecastPeriods,
                           Boolean forceFullEvaluation, String modelPreference) {
        this.series = series;
        this.metricType = metricType;
        this.forecastPeriods = forecastPeriods;
        this.forceFullEvaluation = forceFullEvaluation;
        this.modelPreference = modelPreference;
    }

    public static ForecastRequest fromJson(String body) {
        if (body == null || body.isBlank()) throw new InvalidInputException("Missing request body");
        ForecastRequest req;
        try {
            req = Json.GSON.fromJson(body, ForecastRequest.class);
        } catch (RuntimeException e) {
            throw new InvalidInputException("Invalid JSON: " + e.getMessage(), e);
        }
        if (req == null) throw new InvalidInputException("Invalid JSON");
        return req;
    }

    /** Each point is keyed by {@code timestamp}, or {@code date} when that is absent. */
    public TimeSeries toSeries() {
        if (series == null || series.isEmpty()) {
            throw new InvalidInputException("Missing or empty 'series' array");
        }
        List<Observation> obs = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            Point p = series.get(i);
            if (p == null) throw new InvalidInputException("Series entry " + i + " is null");
            String ts = p.timestamp != null ? p.timestamp : p.date;
            obs.add(Observation.parse(ts, p.value));
        }
        return TimeSeries.of(obs);
    }

    public MetricType metricType() {
        return MetricType.fromWireName(metricType);
    }

    public int periods(int max) {
        int n = forecastPeriods != null ? forecastPeriods : DEFAULT_PERIODS;
        if (n < 1 || n > max) {
            throw new InvalidInputException("forecast_periods must be between 1 and " + max + ", got " + n);
        }
        return n;
    }

    public boolean forceFullEvaluation() {
        return forceFullEvaluation != null && forceFullEvaluation;
    }

    /** Null for automatic selection. */
    public ModelKind preferredModel() {
        if (modelPreference == null || modelPreference.isBlank() || AUTO.equalsIgnoreCase(modelPreference.trim())) {
            return null;
        }
        ModelKind kind = ModelKind.fromModelName(modelPreference);
        if (kind == null) {
            throw new InvalidInputException("Unknown model_preference '" + modelPreference
                    + "' (expected auto, arima or seasonal_trend)");
        }
        return kind;
    }
}
