package forecast.select;

import forecast.data.DataQualityAssessment;
import forecast.data.MetricType;

import java.util.ArrayList;
import java.util.List;

/**
 * Advice derived deterministically from a {@link DataQualityAssessment}.
 */
public final class Recommendations {

    static final int TARGET_POINTS = 30;
    static final double TARGET_QUALITY = 0.7;

    public static final String COLLECT_MORE_DATA = "Collect more data points for better model performance";
    public static final String IMPROVE_QUALITY = "Improve data quality by handling missing values and outliers";
    public static final String CHECK_COLLECTION = "Data shows no variation - check data collection process";
    public static final String EXTERNAL_SEASONALITY = "Consider external factors that might introduce seasonality";

    private Recommendations() {
    }

    public static List<String> from(DataQualityAssessment assessment, MetricType metricType) {
        List<String> out = new ArrayList<>();
        if (assessment.getDataPoints() < TARGET_POINTS) out.add(COLLECT_MORE_DATA);
        if (assessment.getQualityScore() < TARGET_QUALITY) out.add(IMPROVE_QUALITY);
        if (assessment.getVariance() == 0.0) out.add(CHECK_COLLECTION);
        if (!assessment.isSeasonalityDetected() && metricType == MetricType.LOAD) out.add(EXTERNAL_SEASONALITY);
        return out;
    }
}
