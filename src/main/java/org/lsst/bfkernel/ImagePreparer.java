package org.lsst.bfkernel;

import java.awt.Rectangle;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.bfkernel.stats.ClippedStatistics;

/**
 * Prepares an image for cross-correlation. Each region is copied, rescaled by
 * its gain and has its sigma-clipped mean subtracted. The reported mean of a
 * region is the clipped mean of the rescaled pixels with a border excluded; it
 * is used to normalise the correlations later, not for the subtraction.
 * <p>
 * The caller's image is never modified. A region which cannot be prepared is
 * recorded as a rejection and left out of the result, the other regions are
 * still prepared.
 */
public class ImagePreparer {

    private static final Logger LOG = Logger.getLogger(ImagePreparer.class.getName());

    private final Diagnostics diagnostics;

    public ImagePreparer(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Prepare every region of an image.
     *
     * @param image The calibrated image
     * @param gains The gain of each region
     * @param regions The regions to prepare
     * @param borderWidth The border excluded when computing the reported mean
     * @param clipSigma The clipping threshold
     * @return The working images and means of the regions that could be prepared
     */
    public PreparedImage prepare(FlatImage image, GainTable gains, RegionSet regions, int borderWidth, double clipSigma) {
        Map<Region, FlatImage> workingImages = new LinkedHashMap<>();
        Map<Region, Double> means = new LinkedHashMap<>();
        for (Region region : regions) {
            if (!gains.hasGain(region.getName())) {
                diagnostics.reject(region.getName(), "no gain available");
                continue;
            }
            try {
                FlatImage working = image.subImage(region.getBBox());
                double gain = gains.getGain(region.getName());
                working.scale(gain);
                Rectangle interior = working.interior(borderWidth);
                double interiorMean = ClippedStatistics.clippedMean(working, interior, clipSigma);
                double mean = ClippedStatistics.clippedMean(working, clipSigma);
                working.add(-mean);
                LOG.log(Level.FINE, "Region {0}: gain {1}, subtracted mean {2}, interior mean {3}", new Object[]{region.getName(), gain, mean, interiorMean});
                workingImages.put(region, working);
                means.put(region, interiorMean);
            } catch (KernelGenerationException x) {
                diagnostics.reject(region.getName(), "could not prepare image: " + x.getMessage());
            }
        }
        return new PreparedImage(workingImages, means);
    }

    public PreparedImage prepare(Exposure exposure, GainTable gains, RegionSet regions, BrighterFatterConfig config) {
        return prepare(exposure.getImage(), gains, regions, config.getNPixBorderXCorr(), config.getNSigmaClipXCorr());
    }
}
