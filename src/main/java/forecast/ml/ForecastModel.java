package forecast.ml;

import forecast.data.TimeSeries;

/**
 * A model family that can be fitted to a series. Fitting never throws for bad data; failures come
 * back as {@link FitResult#failure(FitFailure)}.
 */
public interface ForecastModel {

    String getName();

    FitResult fit(TimeSeries series);
}
