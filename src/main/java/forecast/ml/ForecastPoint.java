package forecast.ml;

import java.time.LocalDate;

public final class ForecastPoint {

    private final LocalDate date;
    private final double value;
    private final double lower;
    private final double upper;

    public ForecastPoint(LocalDate date, double value, double lower, double upper) {
        this.date = date;
        this.value = value;
        this.lower = lower;
        this.upper = upper;
    }

    public LocalDate getDate() { return date; }
    public double getValue() { return value; }
    public double getLower() { return lower; }
    public double getUpper() { return upper; }

    ForecastPoint clamp(double min, double max) {
        return new ForecastPoint(date, clamp(value, min, max), clamp(lower, min, max), clamp(upper, min, max));
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }
}
