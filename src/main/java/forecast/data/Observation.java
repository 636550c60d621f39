package forecast.data;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * One raw (date, value) pair as supplied by a caller. The value may be null or NaN (missing) but
 * never infinite.
 */
public final class Observation {

    private final LocalDate date;
    private final Double value;

    public Observation(LocalDate date, Double value) {
        if (date == null) throw new InvalidInputException("Observation date is required");
        if (value != null && value.isInfinite()) {
            throw new InvalidInputException("Observation value for " + date + " is not finite");
        }
        this.date = date;
        this.value = value;
    }

    /** Parse an ISO date, local date-time or offset date-time; time of day is dropped. */
    public static Observation parse(String timestamp, Double value) {
        return new Observation(parseDate(timestamp), value);
    }

    public static LocalDate parseDate(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            throw new InvalidInputException("Missing timestamp");
        }
        String s = timestamp.trim();
        try {
            if (s.length() <= 10) return LocalDate.parse(s);
            if (s.endsWith("Z") || s.matches(".*[+-]\\d{2}:\\d{2}$")) {
                return OffsetDateTime.parse(s).toLocalDate();
            }
            return LocalDateTime.parse(s).toLocalDate();
        } catch (DateTimeParseException e) {
            throw new InvalidInputException("Malformed timestamp: " + timestamp, e);
        }
    }

    public LocalDate getDate() { return date; }
    public Double getValue() { return value; }

    public boolean isMissing() {
        return value == null || value.isNaN();
    }
}
