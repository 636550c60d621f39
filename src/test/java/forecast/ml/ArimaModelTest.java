package forecast.ml;

import forecast.data.MetricType;
import forecast.data.SelectionConfig;
import forecast.data.TimeSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ArimaModelTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    private static TimeSeries line(int n) {
        double[] y = new double[n];
        for (int i = 0; i < n; i++) y[i] = 10 + i;
        return TimeSeries.daily(START, y);
    }

    private static TimeSeries ar1(long seed, int n, double phi) {
        Random random = new Random(seed);
        double[] y = new double[n];
        double prev = 0;
        for (int i = 0; i < n; i++) {
            prev = phi * prev + random.nextGaussian();
            y[i] = 50 + prev;
        }
        return TimeSeries.daily(START, y);
    }

    @Test
    @DisplayName("Should continue a noiseless line with ARIMA(0,1,0) plus drift")
    void testLineContinues() {
        ArimaModel model = new ArimaModel(SelectionConfig.forMetric(MetricType.LOAD));

        FitResult result = model.fit(line(60));

        assertTrue(result.isSuccess());
        FittedArima fitted = (FittedArima) result.get();
        assertEquals("(0,1,0)", fitted.getParameters().get("order"));
        ForecastTable forecast = fitted.predict(5);
        assertEquals(5, forecast.size());
        for (int h = 0; h < 5; h++) {
            ForecastPoint p = forecast.getPoints().get(h);
            assertEquals(70 + h, p.getValue(), 1e-6);
            assertEquals(START.plusDays(60 + h), p.getDate());
            assertTrue(p.getLower() <= p.getValue() && p.getValue() <= p.getUpper());
        }
    }

    @Test
    @DisplayName("Should recover the coefficient of an AR(1) process")
    void testAr1Estimate() {
        ArimaModel model = new ArimaModel(SelectionConfig.forMetric(MetricType.GENERAL));

        FitResult result = model.fitOrder(ar1(3, 300, 0.6), 1, 0, 0);

        assertTrue(result.isSuccess());
        FittedArima fitted = (FittedArima) result.get();
        assertEquals(0.6, fitted.getArCoefficients()[0], 0.15);
        assertEquals(1.0, fitted.getSigma2(), 0.3);
        assertEquals(50.0, (Double) fitted.getParameters().get("constant"), 0.5);
    }

    @Test
    @DisplayName("Should widen intervals with the horizon")
    void testIntervalsWiden() {
        ArimaModel model = new ArimaModel(SelectionConfig.forMetric(MetricType.GENERAL));
        FitResult result = model.fit(ar1(5, 120, 0.7));
        assertTrue(result.isSuccess());

        List<ForecastPoint> points = result.get().predict(10).getPoints();

        double first = points.get(0).getUpper() - points.get(0).getLower();
        double last = points.get(9).getUpper() - points.get(9).getLower();
        assertTrue(first > 0);
        assertTrue(last >= first);
    }

    @Test
    @DisplayName("Should report a failure instead of throwing for unusable input")
    void testFailures() {
        ArimaModel model = new ArimaModel(SelectionConfig.forMetric(MetricType.GENERAL));

        FitResult tooShort = model.fit(TimeSeries.daily(START, new double[]{1, 2, 3, 4}));
        assertFalse(tooShort.isSuccess());
        assertTrue(tooShort.failure().get().getReason().contains("insufficient"));
        assertFalse(tooShort.model().isPresent());
        assertThrows(IllegalStateException.class, tooShort::get);

        FitResult overParameterised = model.fitOrder(TimeSeries.daily(START, new double[]{1, 3, 2, 5, 4, 6}), 3, 0, 3);
        assertFalse(overParameterised.isSuccess());
        assertEquals(ArimaModel.NAME, overParameterised.failure().get().getModelName());
    }

    @Test
    @DisplayName("Should stop the grid search when the thread is interrupted")
    void testInterruptedGridSearch() {
        ArimaModel model = new ArimaModel(SelectionConfig.forMetric(MetricType.GENERAL));
        Thread.currentThread().interrupt();
        try {
            FitResult result = model.fit(ar1(9, 80, 0.5));
            assertFalse(result.isSuccess());
            assertTrue(result.failure().get().getReason().contains("interrupted"));
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    @DisplayName("Should check AR stationarity through the characteristic roots")
    void testStationarityCheck() {
        assertTrue(ArimaModel.isStationary(new double[0]));
        assertTrue(ArimaModel.isStationary(new double[]{0.5}));
        assertFalse(ArimaModel.isStationary(new double[]{1.2}));
        assertTrue(ArimaModel.isStationary(new double[]{0.5, 0.3}));
        assertFalse(ArimaModel.isStationary(new double[]{0.5, 0.6}));
    }

    @Test
    @DisplayName("Should fall back to ARIMA(1,1,1) when every grid order fails")
    void testFallbackOrder() {
        ArimaModel model = spy(new ArimaModel(SelectionConfig.forMetric(MetricType.GENERAL)));
        doReturn(FitResult.failure(ArimaModel.NAME, "forced")).when(model).fitOrder(any(), anyInt(), anyInt(), anyInt());
        doCallRealMethod().when(model).fitOrder(any(), eq(1), eq(1), eq(1));

        FitResult result = model.fit(ar1(11, 120, 0.5));

        assertTrue(result.isSuccess());
        assertEquals("(1,1,1)", result.get().getParameters().get("order"));
        verify(model, atLeastOnce()).fitOrder(any(), eq(1), eq(1), eq(1));
    }

    @Test
    @DisplayName("Should report a failure when the fallback order fails too")
    void testFallbackOrderFails() {
        ArimaModel model = spy(new ArimaModel(SelectionConfig.forMetric(MetricType.GENERAL)));
        doReturn(FitResult.failure(ArimaModel.NAME, "forced")).when(model).fitOrder(any(), anyInt(), anyInt(), anyInt());

        FitResult result = model.fit(ar1(11, 120, 0.5));

        assertFalse(result.isSuccess());
        assertTrue(result.failure().get().getReason().contains("no ARIMA order could be fitted"));
    }
}
