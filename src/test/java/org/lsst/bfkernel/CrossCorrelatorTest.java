package org.lsst.bfkernel;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Test;
import org.lsst.bfkernel.simulation.FlatPairSimulator;

public class CrossCorrelatorTest {

    private static final double BIAS_CORR = 0.9241;

    @Test
    public void testIdenticalImages() {
        FlatPairSimulator simulator = FlatPairSimulator.uniform(3, 1, 40, 40, 1.0);
        FlatImage image = simulator.simulate("det", 1, 1000).getImage();
        FlatImage before = image.copy();
        double[][] xcorr = CrossCorrelator.correlate(image, image.copy(), 3, 2, 5, 128, BIAS_CORR);
        assertEquals(4, xcorr.length);
        for (double[] row : xcorr) {
            assertEquals(4, row.length);
            for (double v : row) {
                assertEquals(0, v, 0);
            }
        }
        assertEquals(before, image);
    }

    @Test
    public void testUncorrelatedPoissonNoise() {
        FlatPairSimulator simulator = FlatPairSimulator.uniform(11, 1, 100, 100, 1.0);
        FlatImage image1 = simulator.simulate("det", 1, 100_000).getImage();
        FlatImage image2 = simulator.simulate("det", 2, 100_000).getImage();
        double[][] xcorr = CrossCorrelator.correlate(image1, image2, 5, 3, 5, 128, BIAS_CORR);
        assertEquals(6, xcorr.length);
        // The variance of the difference of two images is twice the flux
        assertEquals(200_000, xcorr[0][0], 0.05 * 200_000);
        // Noise on each lag is about variance/sqrt(npixels), ~2300 here
        for (int dx = 0; dx <= 5; dx++) {
            for (int dy = 0; dy <= 5; dy++) {
                if (dx != 0 || dy != 0) {
                    assertTrue("lag " + dx + "," + dy + " = " + xcorr[dx][dy], Math.abs(xcorr[dx][dy]) < 12_000);
                }
            }
        }
    }

    @Test
    public void testInjectedCorrelation() {
        FlatPairSimulator simulator = FlatPairSimulator.uniform(5, 1, 100, 100, 1.0);
        simulator.setCorrelation(0.3);
        FlatImage image1 = simulator.simulate("det", 1, 100_000).getImage();
        FlatImage image2 = simulator.simulate("det", 2, 100_000).getImage();
        CrossCorrelator correlator = new CrossCorrelator(2, 3, 5, 128, BIAS_CORR);
        double[][] xcorr = correlator.correlate(image1, image2);
        double ratio = xcorr[1][1] / xcorr[0][0];
        // expected a/(1+a^2) = 0.275
        assertTrue("ratio " + ratio, ratio > 0.2 && ratio < 0.35);
        assertTrue(Math.abs(xcorr[1][0] / xcorr[0][0]) < 0.05);
        assertTrue(Math.abs(xcorr[0][1] / xcorr[0][0]) < 0.05);
    }

    @Test
    public void testRegionTooSmall() {
        CrossCorrelator correlator = new CrossCorrelator(5, 3, 5, 128, BIAS_CORR);
        try {
            correlator.correlate(new FlatImage(10, 20), new FlatImage(10, 20));
            fail("should not reach here");
        } catch (InsufficientRegionException x) {
            assertTrue(x.getMessage().contains("lag 5"));
        }
    }

    @Test(expected = ShapeException.class)
    public void testDifferentSizes() {
        new CrossCorrelator(1, 0, 5, 128, BIAS_CORR).correlate(new FlatImage(10, 10), new FlatImage(10, 11));
    }

    @Test
    public void testConfigFactories() {
        BrighterFatterConfig config = new BrighterFatterConfig();
        config.setMaxLag(4);
        config.setNPixBorderXCorr(7);
        config.setNPixBorderGainCalc(12);
        assertEquals(4, CrossCorrelator.forKernel(config).getMaxLag());
        assertEquals(7, CrossCorrelator.forKernel(config).getBorderWidth());
        assertEquals(12, CrossCorrelator.forGain(config).getBorderWidth());
    }
}
