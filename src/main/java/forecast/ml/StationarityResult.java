package forecast.ml;

/**
 * Outcome of the ADF and KPSS tests on one series. {@code stationary} is true only when both
 * tests agree; a failed test leaves it false and records the error.
 */
public final class StationarityResult {

    private final TestOutcome adf;
    private final TestOutcome kpss;
    private final boolean stationary;
    private final String error;

    StationarityResult(TestOutcome adf, TestOutcome kpss) {
        this.adf = adf;
        this.kpss = kpss;
        this.stationary = adf.isStationary() && kpss.isStationary();
        this.error = null;
    }

    private StationarityResult(String error) {
        this.adf = null;
        this.kpss = null;
        this.stationary = false;
        this.error = error;
    }

    static StationarityResult failed(String error) {
        return new StationarityResult(error);
    }

    /** Null when the test could not be run. */
    public TestOutcome getAdf() { return adf; }

    /** Null when the test could not be run. */
    public TestOutcome getKpss() { return kpss; }

    public boolean isStationary() { return stationary; }

    /** Null unless a test failed. */
    public String getError() { return error; }

    public static final class TestOutcome {
        private final double statistic;
        private final double pValue;
        private final int lags;
        private final boolean stationary;

        TestOutcome(double statistic, double pValue, int lags, boolean stationary) {
            this.statistic = statistic;
            this.pValue = pValue;
            this.lags = lags;
            this.stationary = stationary;
        }

        public double getStatistic() { return statistic; }
        public double getPValue() { return pValue; }
        public int getLags() { return lags; }
        public boolean isStationary() { return stationary; }
    }
}
