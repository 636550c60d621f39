package forecast.ml;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class StationarityTesterTest {

    private StationarityTester tester;

    @BeforeEach
    void setUp() {
        tester = new StationarityTester();
    }

    private static double[] noise(long seed, int n) {
        Random random = new Random(seed);
        double[] y = new double[n];
        for (int i = 0; i < n; i++) y[i] = 5 + random.nextGaussian();
        return y;
    }

    private static double[] randomWalk(long seed, int n) {
        Random random = new Random(seed);
        double[] y = new double[n];
        for (int i = 1; i < n; i++) y[i] = y[i - 1] + random.nextGaussian();
        return y;
    }

    @Test
    @DisplayName("Should classify i.i.d. noise as stationary")
    void testNoiseIsStationary() {
        int stationary = 0;
        for (long seed = 1; seed <= 20; seed++) {
            StationarityResult r = tester.test(noise(seed, 200));
            assertNull(r.getError());
            assertTrue(r.getAdf().isStationary(), "ADF should reject a unit root for seed " + seed);
            if (r.isStationary()) stationary++;
        }
        // KPSS falsely rejects about 5% of the time
        assertTrue(stationary >= 16, "stationary in " + stationary + " of 20 runs");
    }

    @Test
    @DisplayName("Should classify a random walk as non-stationary")
    void testRandomWalkIsNotStationary() {
        int nonStationary = 0;
        for (long seed = 1; seed <= 20; seed++) {
            if (!tester.test(randomWalk(seed, 200)).isStationary()) nonStationary++;
        }
        assertTrue(nonStationary >= 16, "non-stationary in " + nonStationary + " of 20 runs");
    }

    @Test
    @DisplayName("Should report failure instead of throwing for short or degenerate input")
    void testDegenerateInput() {
        StationarityResult tooShort = tester.test(new double[]{1, 2, 3});
        assertFalse(tooShort.isStationary());
        assertNotNull(tooShort.getError());
        assertNull(tooShort.getAdf());

        StationarityResult constant = tester.test(new double[]{2, 2, 2, 2, 2, 2, 2, 2, 2, 2, 2, 2});
        assertFalse(constant.isStationary());
        assertNotNull(constant.getError());
    }

    @Test
    @DisplayName("Should drop NaN values before testing")
    void testDropsNaN() {
        double[] y = noise(7, 120);
        double[] withGaps = new double[y.length + 2];
        withGaps[0] = Double.NaN;
        System.arraycopy(y, 0, withGaps, 1, y.length);
        withGaps[withGaps.length - 1] = Double.NaN;

        StationarityResult plain = tester.test(y);
        StationarityResult gapped = tester.test(withGaps);

        assertEquals(plain.isStationary(), gapped.isStationary());
        assertEquals(plain.getAdf().getStatistic(), gapped.getAdf().getStatistic(), 1e-12);
    }

    @Test
    @DisplayName("Should map test statistics to p-values")
    void testPValueTables() {
        assertEquals(1.0, StationarityTester.mackinnonPValue(3.0), 0.0);
        assertEquals(0.0, StationarityTester.mackinnonPValue(-20.0), 0.0);
        // 5% critical value with constant is about -2.86
        assertEquals(0.05, StationarityTester.mackinnonPValue(-2.86), 0.01);
        assertTrue(StationarityTester.mackinnonPValue(-4.0) < StationarityTester.mackinnonPValue(-2.0));

        assertEquals(0.10, StationarityTester.kpssPValue(0.1), 0.0);
        assertEquals(0.05, StationarityTester.kpssPValue(0.463), 1e-12);
        assertEquals(0.01, StationarityTester.kpssPValue(2.0), 0.0);
        double mid = StationarityTester.kpssPValue(0.5);
        assertTrue(mid < 0.05 && mid > 0.025);
    }
}
