package forecast.data;

import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Cleaned, date-ordered series: sorted, de-duplicated by date (first occurrence wins) and with
 * missing values imputed by the median. Immutable; every accessor returns copies.
 */
public final class TimeSeries {

    private final LocalDate[] dates;
    private final double[] values;
    private final int missingCount;

    private TimeSeries(LocalDate[] dates, double[] values, int missingCount) {
        this.dates = dates;
        this.values = values;
        this.missingCount = missingCount;
    }

    public static TimeSeries of(List<Observation> observations) {
        if (observations == null || observations.isEmpty()) {
            throw new InvalidInputException("Series must contain at least one observation");
        }
        List<Observation> sorted = new ArrayList<>(observations);
        sorted.sort(Comparator.comparing(Observation::getDate)); // stable

        List<Observation> unique = new ArrayList<>(sorted.size());
        LocalDate previous = null;
        for (Observation o : sorted) {
            if (o.getDate().equals(previous)) continue;
            unique.add(o);
            previous = o.getDate();
        }

        int missing = 0;
        List<Double> present = new ArrayList<>(unique.size());
        for (Observation o : unique) {
            if (o.isMissing()) missing++;
            else present.add(o.getValue());
        }
        if (present.isEmpty()) {
            throw new InvalidInputException("Series has no non-missing values");
        }
        double median = new Median().evaluate(present.stream().mapToDouble(Double::doubleValue).toArray());

        LocalDate[] d = new LocalDate[unique.size()];
        double[] v = new double[unique.size()];
        for (int i = 0; i < d.length; i++) {
            Observation o = unique.get(i);
            d[i] = o.getDate();
            v[i] = o.isMissing() ? median : o.getValue();
        }
        return new TimeSeries(d, v, missing);
    }

    /** Daily series starting at {@code start}. */
    public static TimeSeries daily(LocalDate start, double[] values) {
        List<Observation> obs = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            obs.add(new Observation(start.plusDays(i), Double.isNaN(values[i]) ? null : values[i]));
        }
        return of(obs);
    }

    public int size() { return values.length; }

    public double[] values() { return values.clone(); }

    public double value(int i) { return values[i]; }

    public LocalDate date(int i) { return dates[i]; }

    public LocalDate firstDate() { return dates[0]; }

    public LocalDate lastDate() { return dates[dates.length - 1]; }

    /** Number of values that were missing before imputation. */
    public int missingCount() { return missingCount; }

    public long spanDays() {
        return ChronoUnit.DAYS.between(firstDate(), lastDate());
    }

    /** Days since the first observation, per point. */
    public double[] dayOffsets() {
        double[] t = new double[dates.length];
        for (int i = 0; i < t.length; i++) t[i] = ChronoUnit.DAYS.between(dates[0], dates[i]);
        return t;
    }

    /** Median spacing between consecutive observations in days, at least 1. */
    public int stepDays() {
        if (dates.length < 2) return 1;
        double[] gaps = new double[dates.length - 1];
        for (int i = 1; i < dates.length; i++) gaps[i - 1] = ChronoUnit.DAYS.between(dates[i - 1], dates[i]);
        return (int) Math.max(1, Math.round(new Median().evaluate(gaps)));
    }

    /** Date of the {@code steps}-th period after the last observation. */
    public LocalDate dateAfter(int steps) {
        return lastDate().plusDays((long) steps * stepDays());
    }

    /** Sub-series [from, to). The slice carries no missing-value count of its own. */
    public TimeSeries slice(int from, int to) {
        if (from < 0 || to > values.length || from >= to) {
            throw new IllegalArgumentException("Invalid slice [" + from + ", " + to + ") of " + values.length);
        }
        return new TimeSeries(Arrays.copyOfRange(dates, from, to), Arrays.copyOfRange(values, from, to), 0);
    }
}
