package forecast.ml;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class DifferencingSelectorTest {

    private final DifferencingSelector selector = new DifferencingSelector(new StationarityTester());

    @Test
    @DisplayName("Should difference once and repeatedly")
    void testDifference() {
        double[] x = {1, 4, 9, 16, 25};

        assertArrayEquals(new double[]{3, 5, 7, 9}, DifferencingSelector.difference(x), 0.0);
        assertArrayEquals(new double[]{2, 2, 2}, DifferencingSelector.difference(x, 2), 0.0);
        assertArrayEquals(x, DifferencingSelector.difference(x, 0), 0.0);
        assertEquals(0, DifferencingSelector.difference(new double[]{7}).length);
    }

    @Test
    @DisplayName("Should keep d=0 for a stationary series")
    void testStationaryKeepsLevel() {
        int levels = 0;
        for (long seed = 1; seed <= 10; seed++) {
            Random random = new Random(seed);
            double[] y = new double[150];
            for (int i = 0; i < y.length; i++) y[i] = 20 + random.nextGaussian();

            DifferencingSelector.Result r = selector.select(y, 2);

            assertTrue(r.isStationary());
            assertEquals(y.length - r.getOrder(), r.getSeries().length);
            if (r.getOrder() == 0) levels++;
        }
        assertTrue(levels >= 8, "d=0 chosen in " + levels + " of 10 runs");
    }

    @Test
    @DisplayName("Should stop at the maximum order when a trend never tests stationary")
    void testTrendUsesMaxOrder() {
        double[] y = new double[60];
        for (int i = 0; i < y.length; i++) y[i] = 10 + i;

        DifferencingSelector.Result r = selector.select(y, 1);

        assertEquals(1, r.getOrder());
        assertEquals(59, r.getSeries().length);
    }
}
