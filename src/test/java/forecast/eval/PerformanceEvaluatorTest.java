package forecast.eval;

import forecast.data.MetricType;
import forecast.data.SelectionConfig;
import forecast.data.TimeSeries;
import forecast.ml.ArimaModel;
import forecast.ml.FitResult;
import forecast.ml.FittedModel;
import forecast.ml.ForecastModel;
import forecast.ml.ForecastPoint;
import forecast.ml.ForecastTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class PerformanceEvaluatorTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    @Mock
    private FittedModel model;

    @Mock
    private ForecastModel candidate;

    private PerformanceEvaluator evaluator;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        evaluator = new PerformanceEvaluator();
    }

    private static TimeSeries series(int n) {
        double[] y = new double[n];
        for (int i = 0; i < n; i++) y[i] = i + 1;
        return TimeSeries.daily(START, y);
    }

    private static ForecastTable table(double... values) {
        List<ForecastPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(new ForecastPoint(START.plusDays(i), values[i], values[i] - 1, values[i] + 1));
        }
        return new ForecastTable(points);
    }

    private PerformanceMetrics metrics(String name, double mae, double rmse, double mape) {
        return new PerformanceMetrics(name, 5, mae, rmse * rmse, rmse, mape, 0.5, 1.0, 10.0, 0.0, 100.0);
    }

    @Test
    @DisplayName("Should split temporally at floor(0.8n)")
    void testSplit() {
        TrainTestSplit split = evaluator.split(series(61));

        assertEquals(48, split.getTrain().size());
        assertEquals(13, split.getTest().size());
        assertEquals(START.plusDays(47), split.getTrain().lastDate());
        assertEquals(START.plusDays(48), split.getTest().firstDate());
    }

    @Test
    @DisplayName("Should refuse to split when too little would be left to train on")
    void testCanEvaluate() {
        assertTrue(evaluator.canEvaluate(30));
        assertTrue(evaluator.canEvaluate(11));
        assertFalse(evaluator.canEvaluate(9));
        assertFalse(evaluator.canEvaluate(4));
        assertThrows(IllegalArgumentException.class, () -> evaluator.split(series(6)));
    }

    @Test
    @DisplayName("Should compute error metrics against actual values")
    void testScore() {
        PerformanceMetrics m = evaluator.score("m", new double[]{10, 20, 30, 40}, new double[]{12, 18, 33, 40}, 5.0);

        assertEquals(1.75, m.getMae(), 1e-12);
        assertEquals(4.25, m.getMse(), 1e-12);
        assertEquals(Math.sqrt(4.25), m.getRmse(), 1e-12);
        assertEquals((0.2 + 0.1 + 0.1 + 0.0) / 4 * 100, m.getMape(), 1e-9);
        assertEquals(0.75, m.getMeanError(), 1e-12);
        assertEquals(1.75 / 10.0, m.getMase(), 1e-12);
        assertEquals(1 - 17.0 / 500.0, m.getR2(), 1e-12);
        assertEquals(5.0, m.getInformationCriterion(), 0.0);
        assertEquals(4, m.getTestPeriods());
    }

    @Test
    @DisplayName("Should exclude zero actuals from MAPE and report infinity when all are zero")
    void testMapeWithZeros() {
        PerformanceMetrics some = evaluator.score("m", new double[]{0, 10}, new double[]{1, 11}, 0);
        assertEquals(10.0, some.getMape(), 1e-9);

        PerformanceMetrics none = evaluator.score("m", new double[]{0, 0}, new double[]{1, 1}, 0);
        assertTrue(Double.isInfinite(none.getMape()));
        assertTrue(Double.isInfinite(none.getMase()));
    }

    @Test
    @DisplayName("Should score a fitted model on the test horizon")
    void testEvaluate() {
        when(model.getModelName()).thenReturn("stub");
        when(model.predict(3)).thenReturn(table(9, 10, 11));
        when(model.getInformationCriterion()).thenReturn(12.5);
        TimeSeries test = series(12).slice(9, 12);

        PerformanceMetrics m = evaluator.evaluate(model, test);

        verify(model).predict(3);
        assertEquals("stub", m.getModelName());
        assertEquals(1.0, m.getMae(), 1e-12);
        assertEquals(12.5, m.getInformationCriterion(), 0.0);
    }

    @Test
    @DisplayName("Should rank by MAE and break ties with RMSE")
    void testCompareRanking() {
        Map<String, PerformanceMetrics> results = new LinkedHashMap<>();
        results.put("a", metrics("a", 0.30, 0.50, 5));
        results.put("b", metrics("b", 0.30, 0.40, 9));
        results.put("c", metrics("c", 0.05, 0.90, 1));

        ModelComparison comparison = evaluator.compare(results);

        assertEquals("c", comparison.getBestModelName());
        assertEquals("b", comparison.getRanking().get(1).getModelName());
        assertEquals("a", comparison.getRanking().get(2).getModelName());
        assertEquals("c", comparison.getBestByMetric().get("mae"));
        assertEquals("b", comparison.getBestByMetric().get("rmse"));
        assertEquals("Excellent", comparison.getRatings().get("c"));
        assertEquals("Fair", comparison.getRatings().get("a"));
        assertTrue(comparison.getNotes().get(1).contains("ensemble"));
    }

    @Test
    @DisplayName("Should keep insertion order when every metric ties")
    void testCompareFullTie() {
        Map<String, PerformanceMetrics> results = new LinkedHashMap<>();
        results.put("seasonal_trend", metrics("seasonal_trend", 0.3, 0.4, 2));
        results.put("arima", metrics("arima", 0.3, 0.4, 2));

        assertEquals("seasonal_trend", evaluator.compare(results).getBestModelName());
        assertThrows(IllegalArgumentException.class, () -> evaluator.compare(new LinkedHashMap<>()));
    }

    @Test
    @DisplayName("Should rate accuracy by MAE")
    void testRating() {
        assertEquals("Excellent", PerformanceEvaluator.rating(0.05));
        assertEquals("Good", PerformanceEvaluator.rating(0.15));
        assertEquals("Fair", PerformanceEvaluator.rating(0.3));
        assertEquals("Poor", PerformanceEvaluator.rating(2.0));
    }

    @Test
    @DisplayName("Should refit on a rolling origin and score each fold")
    void testCrossValidate() {
        ArimaModel arima = new ArimaModel(SelectionConfig.forMetric(MetricType.LOAD));

        CrossValidationResult result = evaluator.crossValidate(arima, series(60), 30, 6, 6);

        assertEquals(ArimaModel.NAME, result.getModelName());
        assertEquals(Arrays.asList(30, 36, 42, 48, 54), result.getCutoffs());
        assertEquals(5, result.getFolds().size());
        assertEquals(0, result.getFailedFolds());
        assertTrue(result.getMeanMae() < 1e-6, "mean MAE " + result.getMeanMae());

        CrossValidationResult defaults = evaluator.crossValidate(arima, series(60));
        assertEquals(6, defaults.getHorizon());
        assertEquals(30, (int) defaults.getCutoffs().get(0));
    }

    @Test
    @DisplayName("Should skip folds that fail to fit and fail when none fit")
    void testCrossValidateFailures() {
        when(candidate.getName()).thenReturn("stub");
        when(model.getModelName()).thenReturn("stub");
        when(model.predict(6)).thenReturn(table(1, 2, 3, 4, 5, 6));
        when(candidate.fit(any())).thenReturn(FitResult.failure("stub", "too short"), FitResult.success(model));

        CrossValidationResult result = evaluator.crossValidate(candidate, series(60), 30, 6, 6);

        assertEquals(1, result.getFailedFolds());
        assertEquals(Arrays.asList(36, 42, 48, 54), result.getCutoffs());

        reset(candidate);
        when(candidate.getName()).thenReturn("stub");
        when(candidate.fit(any())).thenReturn(FitResult.failure("stub", "always"));
        assertThrows(IllegalStateException.class, () -> evaluator.crossValidate(candidate, series(60), 30, 6, 6));
    }

    @Test
    @DisplayName("Should reject windows that leave no complete fold")
    void testCrossValidateWindows() {
        assertThrows(IllegalArgumentException.class, () -> evaluator.crossValidate(candidate, series(60), 4, 6, 6));
        assertThrows(IllegalArgumentException.class, () -> evaluator.crossValidate(candidate, series(60), 30, 0, 6));
        assertThrows(IllegalArgumentException.class, () -> evaluator.crossValidate(candidate, series(20), 15, 6, 6));
        verify(candidate, never()).fit(any());
    }
}
