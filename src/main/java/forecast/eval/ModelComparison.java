package forecast.eval;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Candidates ranked best first, plus per-metric winners, ratings and advisory notes.
 */
public final class ModelComparison {

    private final List<PerformanceMetrics> ranking;
    private final Map<String, String> bestByMetric;
    private final Map<String, String> ratings;
    private final List<String> notes;

    ModelComparison(List<PerformanceMetrics> ranking, Map<String, String> bestByMetric,
                    Map<String, String> ratings, List<String> notes) {
        this.ranking = Collections.unmodifiableList(ranking);
        this.bestByMetric = Collections.unmodifiableMap(bestByMetric);
        this.ratings = Collections.unmodifiableMap(ratings);
        this.notes = Collections.unmodifiableList(notes);
    }

    public List<PerformanceMetrics> getRanking() { return ranking; }

    public PerformanceMetrics getBest() { return ranking.get(0); }

    public String getBestModelName() { return getBest().getModelName(); }

    public Map<String, String> getBestByMetric() { return bestByMetric; }

    public Map<String, String> getRatings() { return ratings; }

    public List<String> getNotes() { return notes; }
}
