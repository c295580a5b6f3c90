package org.lsst.bfkernel.simulation;

import java.awt.Rectangle;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Test;
import org.lsst.bfkernel.Exposure;
import org.lsst.bfkernel.ExposureSource;
import org.lsst.bfkernel.FlatImage;
import org.lsst.bfkernel.Region;

public class FlatPairSimulatorTest {

    @Test
    public void testDeterministic() {
        FlatPairSimulator simulator = FlatPairSimulator.uniform(3, 2, 20, 10, 1.0);
        FlatImage a = simulator.simulateElectrons(5, 1000);
        FlatImage b = FlatPairSimulator.uniform(3, 2, 20, 10, 1.0).simulateElectrons(5, 1000);
        assertEquals(a, b);
        assertNotEquals(a, simulator.simulateElectrons(6, 1000));
    }

    @Test
    public void testGainConversion() {
        FlatPairSimulator simulator = FlatPairSimulator.uniform(4, 2, 10, 10, 2.5);
        FlatImage electrons = simulator.simulateElectrons(1, 500);
        Exposure exposure = simulator.simulate("D", 1, 500);
        assertEquals(20, exposure.getImage().getWidth());
        assertEquals(10, exposure.getImage().getHeight());
        assertEquals(electrons.get(13, 4) / 2.5, exposure.getImage().get(13, 4), 1e-12);
        assertEquals(2, exposure.getAmplifiers().size());
        assertEquals(new Rectangle(10, 0, 10, 10), exposure.getAmplifiers().get(1).getBBox());
        assertEquals(2.5, exposure.getNominalGains().get("C01"), 0);
    }

    @Test
    public void testMeanFlux() {
        FlatImage image = FlatPairSimulator.uniform(5, 1, 100, 100, 1.0).simulateElectrons(1, 400);
        double sum = 0;
        for (int y = 0; y < 100; y++) {
            for (int x = 0; x < 100; x++) {
                sum += image.get(x, y);
            }
        }
        // standard error of the mean is 0.2
        assertEquals(400, sum / 10000, 1.5);
    }

    @Test
    public void testCorrelation() {
        FlatPairSimulator simulator = FlatPairSimulator.uniform(6, 1, 10, 10, 1.0);
        FlatImage plain = simulator.simulateElectrons(1, 100);
        simulator.setCorrelation(0.5);
        FlatImage correlated = simulator.simulateElectrons(1, 100);
        assertEquals(plain.get(0, 0), correlated.get(0, 0), 0);
        assertEquals(plain.get(4, 3) + 0.5 * plain.get(3, 2), correlated.get(4, 3), 1e-12);
    }

    @Test
    public void testMissingGain() {
        try {
            new FlatPairSimulator(1, 10, 10, Arrays.asList(new Region("A", new Rectangle(0, 0, 10, 10))), Collections.<String, Double>emptyMap());
            fail("should not reach here");
        } catch (IllegalArgumentException x) {
            assertTrue(x.getMessage().contains("A"));
        }
    }

    @Test
    public void testSource() throws IOException {
        Map<Integer, Double> fluxes = new HashMap<>();
        fluxes.put(1, 100.0);
        ExposureSource source = FlatPairSimulator.uniform(7, 1, 10, 10, 1.0).asSource(fluxes);
        Exposure exposure = source.getExposure("D", 1);
        assertSame(exposure, source.getExposure("D", 1));
        try {
            source.getExposure("D", 2);
            fail("should not reach here");
        } catch (IOException x) {
            assertTrue(x.getMessage().contains("2"));
        }
    }
}
