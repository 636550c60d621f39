package forecast.ml;

import forecast.data.TimeSeries;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Future rows of a forecast: date, point estimate and interval bounds.
 */
public final class ForecastTable {

    private final List<ForecastPoint> points;

    public ForecastTable(List<ForecastPoint> points) {
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
    }

    /** Rows dated after the end of {@code history}, one step of its cadence apart. */
    public static ForecastTable of(TimeSeries history, double[] values, double[] lower, double[] upper) {
        List<ForecastPoint> rows = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            rows.add(new ForecastPoint(history.dateAfter(i + 1), values[i], lower[i], upper[i]));
        }
        return new ForecastTable(rows);
    }

    public List<ForecastPoint> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public double[] values() {
        double[] out = new double[points.size()];
        for (int i = 0; i < out.length; i++) out[i] = points.get(i).getValue();
        return out;
    }

    public ForecastTable clamp(double min, double max) {
        List<ForecastPoint> rows = new ArrayList<>(points.size());
        for (ForecastPoint p : points) rows.add(p.clamp(min, max));
        return new ForecastTable(rows);
    }

    public boolean isFinite() {
        for (ForecastPoint p : points) {
            if (!Double.isFinite(p.getValue()) || !Double.isFinite(p.getLower()) || !Double.isFinite(p.getUpper())) {
                return false;
            }
        }
        return true;
    }
}
