package org.lsst.bfkernel;

import java.awt.Rectangle;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.bfkernel.stats.ClippedStatistics;

/**
 * Computes the spatial cross-correlation of the difference of two flat field
 * images, for non-negative lags up to {@code maxLag} in x and y.
 * <p>
 * The difference image is cropped by {@code borderWidth} pixels on every side
 * and a smooth background is removed (slow illumination gradients are not part
 * of the correlation signal). For each lag (dx,dy) the reference patch and the
 * patch shifted by (dx,dy) are each re-centred on their sigma-clipped mean,
 * multiplied pixel by pixel, and the sigma-clipped mean of the product divided
 * by {@code biasCorr} is stored at [dx][dy]. Entry [0][0] approximates the
 * variance of the difference image.
 */
public class CrossCorrelator {

    private static final Logger LOG = Logger.getLogger(CrossCorrelator.class.getName());

    private final int maxLag;
    private final int borderWidth;
    private final double clipSigma;
    private final int backgroundBinSize;
    private final double biasCorr;

    public CrossCorrelator(int maxLag, int borderWidth, double clipSigma, int backgroundBinSize, double biasCorr) {
        if (maxLag < 0) {
            throw new IllegalArgumentException("maxLag must not be negative: " + maxLag);
        }
        this.maxLag = maxLag;
        this.borderWidth = borderWidth;
        this.clipSigma = clipSigma;
        this.backgroundBinSize = backgroundBinSize;
        this.biasCorr = biasCorr;
    }

    /**
     * @param config The run configuration
     * @return A correlator using the border and clipping used for kernel generation
     */
    public static CrossCorrelator forKernel(BrighterFatterConfig config) {
        return new CrossCorrelator(config.getMaxLag(), config.getNPixBorderXCorr(), config.getNSigmaClipXCorr(),
                config.getBackgroundBinSize(), config.getBiasCorr());
    }

    /**
     * @param config The run configuration
     * @return A correlator using the border and clipping used for gain estimation
     */
    public static CrossCorrelator forGain(BrighterFatterConfig config) {
        return new CrossCorrelator(config.getMaxLag(), config.getNPixBorderGainCalc(), config.getNSigmaClipGainCalc(),
                config.getBackgroundBinSize(), config.getBiasCorr());
    }

    public static double[][] correlate(FlatImage imageA, FlatImage imageB, int maxLag, int borderWidth, double clipSigma, int backgroundBinSize, double biasCorr) {
        return new CrossCorrelator(maxLag, borderWidth, clipSigma, backgroundBinSize, biasCorr).correlate(imageA, imageB);
    }

    /**
     * Correlate the difference of two images. Neither input is modified.
     *
     * @param imageA The first image
     * @param imageB The second image, of the same size
     * @return The (maxLag+1)&times;(maxLag+1) quarter correlation, indexed [dx][dy]
     * @throws InsufficientRegionException if the cropped difference is not
     * larger than maxLag in both directions
     */
    public double[][] correlate(FlatImage imageA, FlatImage imageB) {
        if (imageA.getWidth() != imageB.getWidth() || imageA.getHeight() != imageB.getHeight()) {
            throw new ShapeException("Cannot correlate images of different sizes " + imageA + " and " + imageB);
        }
        Rectangle interior = imageA.interior(borderWidth);
        if (interior.width <= maxLag || interior.height <= maxLag) {
            throw new InsufficientRegionException("Region of " + imageA.getWidth() + "x" + imageA.getHeight() + " with border " + borderWidth
                    + " leaves " + interior.width + "x" + interior.height + ", not enough for lag " + maxLag);
        }
        return Timed.execute(() -> correlateInterior(imageA, imageB, interior),
                "Cross-correlation of %dx%d region took %dms", interior.width, interior.height);
    }

    private double[][] correlateInterior(FlatImage imageA, FlatImage imageB, Rectangle interior) {
        FlatImage diff = imageA.subImage(interior);
        diff.subtract(imageB.subImage(interior));
        BackgroundModel.subtract(diff, backgroundBinSize, clipSigma);
        if (LOG.isLoggable(Level.FINE)) {
            ClippedStatistics stats = ClippedStatistics.compute(diff, diff.getBounds(), clipSigma);
            LOG.log(Level.FINE, "Background subtracted difference: clipped mean {0} variance {1}", new Object[]{stats.getMean(), stats.getVariance()});
        }

        int width = diff.getWidth() - maxLag;
        int height = diff.getHeight() - maxLag;
        FlatImage reference = diff.subImage(new Rectangle(0, 0, width, height));
        reference.add(-ClippedStatistics.clippedMean(reference, clipSigma));

        double[][] xcorr = new double[maxLag + 1][maxLag + 1];
        for (int dx = 0; dx <= maxLag; dx++) {
            for (int dy = 0; dy <= maxLag; dy++) {
                FlatImage shifted = diff.subImage(new Rectangle(dx, dy, width, height));
                shifted.add(-ClippedStatistics.clippedMean(shifted, clipSigma));
                shifted.multiply(reference);
                xcorr[dx][dy] = ClippedStatistics.clippedMean(shifted, clipSigma) / biasCorr;
            }
        }
        return xcorr;
    }

    public int getMaxLag() {
        return maxLag;
    }

    public int getBorderWidth() {
        return borderWidth;
    }

    @Override
    public String toString() {
        return "CrossCorrelator{" + "maxLag=" + maxLag + ", borderWidth=" + borderWidth + ", clipSigma=" + clipSigma
                + ", backgroundBinSize=" + backgroundBinSize + ", biasCorr=" + biasCorr + '}';
    }
}
