package forecast.data;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class DataQualityAssessorTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    private DataQualityAssessor assessor;

    @BeforeEach
    void setUp() {
        assessor = new DataQualityAssessor();
    }

    @Test
    @DisplayName("Should score a short constant series below 0.7")
    void testConstantSeries() {
        double[] y = new double[15];
        Arrays.fill(y, 4.2);

        DataQualityAssessment a = assessor.assess(TimeSeries.daily(START, y));

        assertEquals(15, a.getDataPoints());
        assertEquals(0.0, a.getVariance(), 0.0);
        assertEquals(0.4, a.getQualityScore(), 1e-12);
        assertFalse(a.isSeasonalityDetected());
        assertEquals(14, a.getDateRangeDays());
    }

    @Test
    @DisplayName("Should report an increasing trend and full score for a clean linear series")
    void testLinearSeries() {
        double[] y = new double[60];
        for (int i = 0; i < y.length; i++) y[i] = 10 + i;

        DataQualityAssessment a = assessor.assess(TimeSeries.daily(START, y));

        assertEquals(TrendDirection.INCREASING, a.getTrendDirection());
        assertEquals(1.0, a.getQualityScore(), 1e-12);
        assertEquals(39.5, a.getMean(), 1e-9);
        assertEquals(0, a.getMissingValues());
    }

    @Test
    @DisplayName("Should penalise more than 10% missing values")
    void testMissingPenalty() {
        double[] y = new double[30];
        for (int i = 0; i < y.length; i++) y[i] = 50 - i;
        y[3] = Double.NaN;
        y[8] = Double.NaN;
        y[13] = Double.NaN;
        y[21] = Double.NaN;

        DataQualityAssessment a = assessor.assess(TimeSeries.daily(START, y));

        assertEquals(4, a.getMissingValues());
        assertEquals(0.8, a.getQualityScore(), 1e-12);
        assertEquals(TrendDirection.DECREASING, a.getTrendDirection());
    }

    @Test
    @DisplayName("Should count zero and negative values")
    void testZeroAndNegativeCounts() {
        DataQualityAssessment a = assessor.assess(TimeSeries.daily(START, new double[]{0, -1, 2, 0, -3}));

        assertEquals(2, a.getZeroValues());
        assertEquals(2, a.getNegativeValues());
    }

    @Test
    @DisplayName("Should detect a weekly cycle")
    void testWeeklySeasonality() {
        int[] week = {0, 5, 9, 7, 3, -8, -12};
        double[] y = new double[42];
        for (int i = 0; i < y.length; i++) y[i] = 100 + week[i % 7];

        assertTrue(DataQualityAssessor.detectSeasonality(y));
        assertEquals(1.0, DataQualityAssessor.autocorrelation(y, 7), 1e-9);
    }

    @Test
    @DisplayName("Should return NaN autocorrelation when fewer than two pairs overlap")
    void testAutocorrelationTooShort() {
        assertTrue(Double.isNaN(DataQualityAssessor.autocorrelation(new double[]{1, 2, 3, 4, 5, 6, 7, 8}, 7)));
    }
}
