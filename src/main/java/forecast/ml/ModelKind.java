package forecast.ml;

import forecast.data.SelectionConfig;

import java.util.Locale;

/**
 * The closed set of model families the selector chooses between.
 */
public enum ModelKind {
    SEASONAL_TREND("seasonal_trend") {
        @Override
        public ForecastModel create(SelectionConfig config) {
            return new SeasonalTrendModel(config);
        }
    },
    ARIMA("arima") {
        @Override
        public ForecastModel create(SelectionConfig config) {
            return new ArimaModel(config);
        }
    };

    private final String modelName;

    ModelKind(String modelName) {
        this.modelName = modelName;
    }

    public String modelName() {
        return modelName;
    }

    public abstract ForecastModel create(SelectionConfig config);

    /** Null when the name is not a model family. */
    public static ModelKind fromModelName(String name) {
        if (name == null) return null;
        String key = name.trim().toLowerCase(Locale.ROOT);
        for (ModelKind k : values()) {
            if (k.modelName.equals(key)) return k;
        }
        return null;
    }
}
