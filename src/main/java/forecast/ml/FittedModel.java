package forecast.ml;

import java.util.Map;

/**
 * A model fitted to one series. Owned by the run that created it.
 */
public interface FittedModel {

    /** Identifier reported to callers, e.g. {@code arima}. */
    String getModelName();

    /** Forecast {@code periods} steps past the end of the fitted series. */
    ForecastTable predict(int periods);

    /** Akaike information criterion of the in-sample fit. */
    double getInformationCriterion();

    /** Chosen parameters, for reporting. */
    Map<String, Object> getParameters();
}
