package forecast.data;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class SeriesCsvReaderTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should skip the header and comments and treat empty cells as missing")
    void testReadFile() throws IOException {
        Path csv = dir.resolve("series.csv");
        Files.write(csv, Arrays.asList(
                "date,value",
                "# exported nightly",
                "2024-01-01,10",
                "2024-01-02,",
                "",
                "2024-01-03,14"));

        TimeSeries series = SeriesCsvReader.read(csv);

        assertEquals(3, series.size());
        assertEquals(LocalDate.of(2024, 1, 1), series.firstDate());
        assertEquals(1, series.missingCount());
        assertEquals(12.0, series.value(1), 1e-12);
    }

    @Test
    @DisplayName("Should accept semicolon separated rows without a header")
    void testSemicolons() {
        TimeSeries series = SeriesCsvReader.parse(Arrays.asList("2024-02-01;0.5", "2024-02-02;0.75"));

        assertEquals(2, series.size());
        assertEquals(0.75, series.value(1), 1e-12);
    }

    @Test
    @DisplayName("Should reject non-numeric values and bad dates")
    void testRejectsMalformedRows() {
        assertThrows(InvalidInputException.class,
                () -> SeriesCsvReader.parse(Arrays.asList("date,value", "2024-01-01,ten")));
        assertThrows(InvalidInputException.class,
                () -> SeriesCsvReader.parse(Arrays.asList("2024-01-01,1", "2024-13-45,2")));
        assertThrows(InvalidInputException.class,
                () -> SeriesCsvReader.parse(Arrays.asList("2024-01-01,1", "2024-01-02,Infinity")));
    }
}
