package org.lsst.bfkernel.stats;

import java.awt.Rectangle;
import java.util.Arrays;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Test;
import org.lsst.bfkernel.EmptyRegionException;
import org.lsst.bfkernel.FlatImage;

public class ClippedStatisticsTest {

    @Test
    public void testConstant() {
        double[] values = new double[1000];
        Arrays.fill(values, 42.5);
        ClippedStatistics stats = ClippedStatistics.compute(values, 3);
        assertEquals(42.5, stats.getMean(), 0);
        assertEquals(0, stats.getVariance(), 0);
        assertEquals(1000, stats.getCount());
    }

    @Test
    public void testOutlierIsClipped() {
        double[] values = new double[1001];
        for (int i = 0; i < 1000; i++) {
            values[i] = i % 2 == 0 ? 9 : 11;
        }
        values[1000] = 1e6;
        ClippedStatistics stats = ClippedStatistics.compute(values, 3);
        assertEquals(10, stats.getMean(), 1e-12);
        assertEquals(1000.0 / 999.0, stats.getVariance(), 1e-12);
        assertEquals(1000, stats.getCount());
    }

    @Test
    public void testNonFiniteValuesIgnored() {
        double[] values = {1, 2, 3, Double.NaN, Double.POSITIVE_INFINITY};
        assertEquals(2, ClippedStatistics.clippedMean(values, 5), 1e-12);
        assertEquals(1, ClippedStatistics.clippedVariance(values, 5), 1e-12);
    }

    @Test
    public void testSingleValue() {
        ClippedStatistics stats = ClippedStatistics.compute(new double[]{7}, 3);
        assertEquals(7, stats.getMean(), 0);
        assertTrue(Double.isNaN(stats.getVariance()));
    }

    @Test(expected = EmptyRegionException.class)
    public void testEmpty() {
        ClippedStatistics.compute(new double[0], 3);
    }

    @Test
    public void testAllNaN() {
        try {
            ClippedStatistics.clippedMean(new double[]{Double.NaN, Double.NaN}, 3);
            fail("should not reach here");
        } catch (EmptyRegionException x) {
            assertTrue(x.getMessage().contains("No finite values"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidSigma() {
        ClippedStatistics.compute(new double[]{1, 2, 3}, 0);
    }

    @Test
    public void testRegion() {
        FlatImage image = new FlatImage(10, 10);
        image.add(100);
        for (int y = 2; y < 5; y++) {
            for (int x = 2; x < 5; x++) {
                image.set(x, y, x + y);
            }
        }
        // the 3x3 box holds 4..8 with mean 6
        assertEquals(6, ClippedStatistics.clippedMean(image, new Rectangle(2, 2, 3, 3), 5), 1e-12);
        assertEquals(100, ClippedStatistics.clippedMean(image, new Rectangle(5, 5, 5, 5), 5), 0);
    }

    @Test(expected = EmptyRegionException.class)
    public void testEmptyRegion() {
        ClippedStatistics.clippedMean(new FlatImage(10, 10), new Rectangle(3, 3, 0, 4), 3);
    }
}
