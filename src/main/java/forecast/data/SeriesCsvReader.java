package forecast.data;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code date,value} rows (comma, semicolon or tab separated). Blank lines, '#' comments and
 * a header row are skipped; an empty value cell is a missing value.
 */
public final class SeriesCsvReader {

    private SeriesCsvReader() {
    }

    public static TimeSeries read(Path path) throws IOException {
        return parse(Files.readAllLines(path));
    }

    public static TimeSeries parse(List<String> lines) {
        List<Observation> observations = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String[] parts = line.split("[,;\t]", -1);
            if (i == 0 && !Character.isDigit(parts[0].trim().isEmpty() ? 'x' : parts[0].trim().charAt(0))) {
                continue; // header
            }
            if (parts.length < 2) {
                throw new InvalidInputException("Line " + (i + 1) + ": expected 'date,value'");
            }
            String cell = parts[1].trim();
            Double value;
            try {
                value = cell.isEmpty() ? null : Double.valueOf(cell);
            } catch (NumberFormatException e) {
                throw new InvalidInputException("Line " + (i + 1) + ": invalid value '" + cell + "'", e);
            }
            observations.add(Observation.parse(parts[0], value));
        }
        return TimeSeries.of(observations);
    }
}
