package org.lsst.bfkernel;

import java.awt.Rectangle;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import org.junit.Test;

public class ImagePreparerTest {

    private static final Region AMP_A = new Region("A", new Rectangle(0, 0, 10, 10));
    private static final Region AMP_B = new Region("B", new Rectangle(10, 0, 10, 10));

    private static Exposure exposure() {
        FlatImage image = new FlatImage(20, 10);
        for (int y = 0; y < 10; y++) {
            for (int x = 0; x < 20; x++) {
                image.set(x, y, x < 10 ? 5 : 7);
            }
        }
        return new Exposure("R22_S11", 1, image, Arrays.asList(AMP_A, AMP_B));
    }

    @Test
    public void testAmpLevel() {
        Exposure exposure = exposure();
        FlatImage before = exposure.getImage().copy();
        Map<String, Double> gains = new HashMap<>();
        gains.put("A", 2.0);
        gains.put("B", 3.0);
        RegionSet regions = RegionSet.forLevel(KernelLevel.AMP, exposure);
        PreparedImage prepared = new ImagePreparer(new Diagnostics()).prepare(exposure.getImage(), new GainTable(gains), regions, 2, 5);

        assertEquals(10, prepared.getMean(AMP_A), 1e-12);
        assertEquals(21, prepared.getMean(AMP_B), 1e-12);
        FlatImage workingA = prepared.getWorkingImage(AMP_A);
        assertEquals(10, workingA.getWidth());
        assertEquals(0, workingA.get(3, 3), 1e-12);
        assertEquals(0, prepared.getWorkingImage(AMP_B).get(9, 9), 1e-12);
        assertEquals(before, exposure.getImage());
    }

    @Test
    public void testMeanSubtractedFromWholeRegion() {
        FlatImage image = new FlatImage(10, 10);
        for (int y = 0; y < 10; y++) {
            for (int x = 0; x < 10; x++) {
                image.set(x, y, 100 + x * x);
            }
        }
        Exposure exposure = new Exposure("R22_S11", 1, image, Arrays.asList(new Region("A", image.getBounds())));
        RegionSet regions = RegionSet.forLevel(KernelLevel.AMP, exposure);
        Map<String, Double> gains = new HashMap<>();
        gains.put("A", 1.0);
        PreparedImage prepared = new ImagePreparer(new Diagnostics()).prepare(image, new GainTable(gains), regions, 1, 100);
        Region region = regions.getRegions().get(0);
        // mean of x*x over x=1..8 is 25.5, over x=0..9 it is 28.5
        assertEquals(125.5, prepared.getMean(region), 1e-9);
        assertEquals(125 - 128.5, prepared.getWorkingImage(region).get(5, 5), 1e-9);
        assertEquals(100 - 128.5, prepared.getWorkingImage(region).get(0, 3), 1e-9);
    }

    @Test
    public void testCcdLevelUsesUnityGain() {
        Exposure exposure = exposure();
        RegionSet regions = RegionSet.forLevel(KernelLevel.CCD, exposure);
        assertEquals(1, regions.size());
        Region ccd = regions.getRegions().get(0);
        assertEquals("R22_S11", ccd.getName());
        assertEquals(new Rectangle(0, 0, 20, 10), ccd.getBBox());

        PreparedImage prepared = new ImagePreparer(new Diagnostics()).prepare(exposure.getImage(), GainTable.unity(regions), regions, 0, 100);
        assertEquals(6, prepared.getMean(ccd), 1e-12);
        assertEquals(-1, prepared.getWorkingImage(ccd).get(0, 0), 1e-12);
        assertEquals(1, prepared.getWorkingImage(ccd).get(19, 0), 1e-12);
    }

    @Test
    public void testMissingGainRejectsOnlyThatRegion() {
        Exposure exposure = exposure();
        Diagnostics diagnostics = new Diagnostics();
        Map<String, Double> gains = new HashMap<>();
        gains.put("A", 2.0);
        RegionSet regions = RegionSet.forLevel(KernelLevel.AMP, exposure);
        PreparedImage prepared = new ImagePreparer(diagnostics).prepare(exposure.getImage(), new GainTable(gains), regions, 2, 5);
        assertEquals(1, prepared.getWorkingImages().size());
        assertNull(prepared.getWorkingImage(AMP_B));
        List<Diagnostics.Rejection> rejections = diagnostics.getRejections();
        assertEquals(1, rejections.size());
        assertEquals("B", rejections.get(0).getSubject());
    }

    @Test
    public void testBorderTooWideRejectsRegion() {
        Exposure exposure = exposure();
        Diagnostics diagnostics = new Diagnostics();
        RegionSet regions = RegionSet.forLevel(KernelLevel.AMP, exposure);
        Map<String, Double> gains = new HashMap<>();
        gains.put("A", 1.0);
        gains.put("B", 1.0);
        PreparedImage prepared = new ImagePreparer(diagnostics).prepare(exposure.getImage(), new GainTable(gains), regions, 5, 5);
        assertFalse(prepared.getWorkingImages().containsKey(AMP_A));
        assertEquals(2, diagnostics.getRejections().size());
    }
}
