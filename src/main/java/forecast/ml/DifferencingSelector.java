package forecast.ml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Differences a series until the {@link StationarityTester} accepts it or the maximum order is used.
 */
public class DifferencingSelector {

    private static final Logger log = LoggerFactory.getLogger(DifferencingSelector.class);

    private final StationarityTester tester;

    public DifferencingSelector(StationarityTester tester) {
        this.tester = tester;
    }

    public Result select(double[] series, int maxOrder) {
        double[] current = series.clone();
        for (int d = 0; d <= maxOrder; d++) {
            if (tester.test(current).isStationary()) {
                log.debug("Series is stationary with d={}", d);
                return new Result(current, d, true);
            }
            if (d == maxOrder || current.length < 2) {
                log.warn("Stationarity not confirmed with d={}", d);
                return new Result(current, d, false);
            }
            current = difference(current);
        }
        return new Result(current, maxOrder, false);
    }

    /** First difference: x[i] - x[i-1], one element shorter. */
    public static double[] difference(double[] x) {
        if (x.length < 2) return new double[0];
        double[] out = new double[x.length - 1];
        for (int i = 1; i < x.length; i++) out[i - 1] = x[i] - x[i - 1];
        return out;
    }

    public static double[] difference(double[] x, int order) {
        double[] z = x;
        for (int i = 0; i < order; i++) z = difference(z);
        return z;
    }

    public static final class Result {
        private final double[] series;
        private final int order;
        private final boolean stationary;

        Result(double[] series, int order, boolean stationary) {
            this.series = series;
            this.order = order;
            this.stationary = stationary;
        }

        public double[] getSeries() { return series.clone(); }
        public int getOrder() { return order; }
        public boolean isStationary() { return stationary; }
    }
}
