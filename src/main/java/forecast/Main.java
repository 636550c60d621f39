package forecast;

import forecast.data.MetricType;
import forecast.data.SeriesCsvReader;
import forecast.data.TimeSeries;
import forecast.ml.ForecastPoint;
import forecast.select.SelectionResult;
import forecast.select.SmartSelector;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.LocalDate;

/**
 * Demo: runs model selection on a sample series, or on a {@code date,value} CSV given as the
 * first argument. An optional second argument names the metric type.
 */
public class Main {

    public static void main(String[] args) {
        MetricType metricType = args.length > 1 ? MetricType.fromWireName(args[1]) : MetricType.LOAD;
        TimeSeries series;
        if (args.length > 0 && args[0] != null && !args[0].trim().isEmpty()) {
            try {
                series = SeriesCsvReader.read(Paths.get(args[0].trim()));
            } catch (IOException | IllegalArgumentException e) {
                String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                System.err.println("CSV error: " + msg);
                System.exit(1);
                return;
            }
        } else {
            series = TimeSeries.daily(LocalDate.of(2024, 1, 1), sampleLoad());
        }

        SmartSelector selector = new SmartSelector(metricType);
        SelectionResult result = selector.select(series, 14, false);

        System.out.println("=== Model selection (" + metricType.wireName() + ", " + series.size() + " points) ===");
        System.out.println("State:      " + result.getState().wireName());
        System.out.println("Model:      " + result.getModelUsed());
        System.out.println("Reason:     " + result.getReason());
        System.out.println("Confidence: " + result.getConfidence().wireName());
        System.out.printf("Quality:    %.2f%n", result.getAssessment().getQualityScore());
        if (result.getMetrics() != null) {
            System.out.printf("MAE = %.4f, RMSE = %.4f%n", result.getMetrics().getMae(), result.getMetrics().getRmse());
        }
        System.out.println();
        System.out.println("=== Forecast ===");
        for (ForecastPoint p : result.getForecast().getPoints()) {
            System.out.printf("%s  %8.2f  [%8.2f, %8.2f]%n", p.getDate(), p.getValue(), p.getLower(), p.getUpper());
        }
        for (String r : result.getRecommendations()) {
            System.out.println("* " + r);
        }
    }

    /** Synthetic daily load: weekly cycle on a slow upward trend. */
    private static double[] sampleLoad() {
        int[] weekly = {0, 4, 6, 5, 3, -6, -12};
        double[] y = new double[56];
        for (int i = 0; i < y.length; i++) {
            y[i] = 40 + 0.3 * i + weekly[i % 7] + ((i * 7919) % 5 - 2) * 0.5;
        }
        return y;
    }
}
