package org.lsst.bfkernel;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Test;
import org.lsst.bfkernel.simulation.FlatPairSimulator;

public class KernelGeneratorTest {

    private static final String DETECTOR = "R22_S11";
    private static final List<VisitPair> PAIRS = Arrays.asList(new VisitPair(1, 2), new VisitPair(3, 4), new VisitPair(5, 6));

    private static Map<Integer, Double> fluxes() {
        Map<Integer, Double> fluxes = new HashMap<>();
        fluxes.put(1, 100_000.0);
        fluxes.put(2, 100_000.0);
        fluxes.put(3, 60_000.0);
        fluxes.put(4, 60_000.0);
        fluxes.put(5, 80_000.0);
        fluxes.put(6, 80_000.0);
        return fluxes;
    }

    private static BrighterFatterConfig config(KernelLevel level) {
        BrighterFatterConfig config = new BrighterFatterConfig();
        config.setDoCalcGains(false);
        config.setLevel(level);
        config.setMaxLag(5);
        config.setNPixBorderXCorr(3);
        config.setELevelSOR(1e-10);
        return config;
    }

    private static void assertSymmetric(double[][] kernel) {
        int n = kernel.length;
        double scale = Math.abs(kernel[n / 2][n / 2]);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                assertEquals(kernel[i][j], kernel[n - 1 - i][j], 1e-9 * scale);
                assertEquals(kernel[i][j], kernel[i][n - 1 - j], 1e-9 * scale);
            }
        }
    }

    @Test
    public void testCcdKernel() throws IOException {
        FlatPairSimulator simulator = FlatPairSimulator.uniform(21, 2, 64, 128, 2.0);
        PipelineContext context = new PipelineContext(config(KernelLevel.CCD));
        KernelGenerator generator = new KernelGenerator(simulator.asSource(fluxes()), context, new GainTable(simulator.getGains()), null);
        BrighterFatterResult result = generator.run(DETECTOR, PAIRS);

        assertTrue(result.getFailures().isEmpty());
        assertEquals(1, result.getKernels().size());
        BrighterFatterKernel kernel = result.getKernel(DETECTOR);
        assertNotNull(kernel);
        assertEquals(11, kernel.getSize());
        assertTrue(kernel.isConverged());
        assertEquals(3, kernel.getSamplesUsed());

        double[][] k = kernel.getKernel();
        assertSymmetric(k);
        double centre = k[5][5];
        assertTrue(centre < 0);
        for (double[] row : k) {
            for (double v : row) {
                assertTrue(v >= centre);
            }
        }
    }

    @Test
    public void testAmpFailureIsIsolated() throws IOException {
        FlatPairSimulator simulator = FlatPairSimulator.uniform(22, 2, 64, 128, 2.0);
        // no gain for C01
        GainTable gains = new GainTable(Collections.singletonMap("C00", 1.0));
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            PipelineContext context = new PipelineContext(config(KernelLevel.AMP));
            BrighterFatterResult result = new KernelGenerator(simulator.asSource(fluxes()), context, gains, executor).run(DETECTOR, PAIRS);
            assertEquals(1, result.getKernels().size());
            BrighterFatterKernel kernel = result.getKernel("C00");
            assertNotNull(kernel);
            assertEquals(11, kernel.getSize());
            assertSymmetric(kernel.getKernel());
            assertNull(result.getKernel("C01"));
            assertTrue(result.getFailures().containsKey("C01"));
            assertTrue(result.getRejections().size() >= 4);
        } finally {
            executor.shutdown();
        }
    }

    @Test
    public void testGainsMeasured() throws IOException {
        FlatPairSimulator simulator = FlatPairSimulator.uniform(23, 2, 200, 200, 2.0);
        Map<Integer, Double> fluxes = new LinkedHashMap<>();
        List<VisitPair> pairs = new java.util.ArrayList<>();
        for (int i = 1; i <= 6; i++) {
            fluxes.put(2 * i, 5000.0 * i);
            fluxes.put(2 * i + 1, 5000.0 * i);
            pairs.add(new VisitPair(2 * i, 2 * i + 1));
        }
        BrighterFatterConfig config = new BrighterFatterConfig();
        config.setMaxLag(1);
        config.setELevelSOR(1e-10);
        BrighterFatterResult result = new KernelGenerator(simulator.asSource(fluxes), new PipelineContext(config)).run(DETECTOR, pairs);

        assertEquals(2.0, result.getGains().getGain("C00"), 0.1);
        assertEquals(2.0, result.getGains().getGain("C01"), 0.1);
        BrighterFatterKernel kernel = result.getKernel(DETECTOR);
        assertNotNull(kernel);
        assertEquals(3, kernel.getSize());
        assertEquals(6, kernel.getSamplesUsed());
    }

    @Test(expected = IllegalStateException.class)
    public void testGainsRequired() throws IOException {
        FlatPairSimulator simulator = FlatPairSimulator.uniform(24, 1, 32, 32, 1.0);
        new KernelGenerator(simulator.asSource(fluxes()), new PipelineContext(config(KernelLevel.CCD))).run(DETECTOR, PAIRS);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNoPairs() throws IOException {
        FlatPairSimulator simulator = FlatPairSimulator.uniform(24, 1, 32, 32, 1.0);
        new KernelGenerator(simulator.asSource(fluxes()), new PipelineContext(config(KernelLevel.CCD))).run(DETECTOR, Collections.<VisitPair>emptyList());
    }

    @Test
    public void testReadErrorPropagates() {
        FlatPairSimulator simulator = FlatPairSimulator.uniform(25, 1, 32, 32, 1.0);
        ExposureSource simulated = simulator.asSource(fluxes());
        ExposureSource failing = (detector, visit) -> {
            if (visit == 4) {
                throw new IOException("Cannot read visit 4");
            }
            return simulated.getExposure(detector, visit);
        };
        GainTable gains = new GainTable(simulator.getGains());
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            for (ExecutorService e : Arrays.asList(null, executor)) {
                try {
                    new KernelGenerator(failing, new PipelineContext(config(KernelLevel.CCD)), gains, e).run(DETECTOR, PAIRS);
                    fail("should not reach here");
                } catch (IOException x) {
                    assertEquals("Cannot read visit 4", x.getMessage());
                }
            }
        } finally {
            executor.shutdown();
        }
    }
}
