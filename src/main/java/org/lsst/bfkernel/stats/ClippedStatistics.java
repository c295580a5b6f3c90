package org.lsst.bfkernel.stats;

import java.awt.Rectangle;
import java.util.Arrays;
import org.lsst.bfkernel.EmptyRegionException;
import org.lsst.bfkernel.FlatImage;

/**
 * Iteratively sigma-clipped mean and variance.
 * <p>
 * The clipping is seeded from the median and the inter-quartile range
 * (sigma = 0.741 * IQR), so a few wild values cannot inflate the first
 * threshold. Each subsequent iteration keeps the values within nSigma standard
 * deviations of the current mean and recomputes the mean and variance of the
 * survivors. Iteration stops when an iteration rejects nothing new or after
 * {@link #DEFAULT_ITERATIONS} passes. Non-finite values are ignored.
 * <p>
 * Sums are accumulated relative to the median, which keeps the result exact
 * for constant data and stable for data with a large offset.
 */
public class ClippedStatistics {

    public static final int DEFAULT_ITERATIONS = 3;
    private static final double IQR_TO_SIGMA = 0.741;

    private final double mean;
    private final double variance;
    private final int count;
    private final int iterations;

    private ClippedStatistics(double mean, double variance, int count, int iterations) {
        this.mean = mean;
        this.variance = variance;
        this.count = count;
        this.iterations = iterations;
    }

    public static ClippedStatistics compute(double[] values, double nSigma) {
        return compute(values, nSigma, DEFAULT_ITERATIONS);
    }

    /**
     * Compute clipped statistics of a set of values.
     *
     * @param values The values, which are not modified
     * @param nSigma The clipping threshold in standard deviations
     * @param maxIterations The maximum number of clipping passes
     * @return The clipped statistics
     * @throws EmptyRegionException if there are no finite values, or none
     * survive clipping
     */
    public static ClippedStatistics compute(double[] values, double nSigma, int maxIterations) {
        if (nSigma <= 0) {
            throw new IllegalArgumentException("nSigma must be positive: " + nSigma);
        }
        double[] sorted = finiteSorted(values);
        int n = sorted.length;
        if (n == 0) {
            throw new EmptyRegionException("No finite values to compute statistics from");
        }
        double median = quantile(sorted, 0.5);
        double center = median;
        double sigma = IQR_TO_SIGMA * (quantile(sorted, 0.75) - quantile(sorted, 0.25));
        double mean = median;
        double variance = Double.NaN;
        int lastCount = n;
        int iter = 0;
        while (iter < maxIterations) {
            iter++;
            double threshold = nSigma * sigma;
            int kept = 0;
            double sum = 0;
            for (double v : sorted) {
                if (Math.abs(v - center) <= threshold) {
                    sum += v - median;
                    kept++;
                }
            }
            if (kept == 0) {
                throw new EmptyRegionException("All " + n + " values were clipped (center=" + center + ", sigma=" + sigma + ")");
            }
            mean = median + sum / kept;
            double sumSq = 0;
            for (double v : sorted) {
                if (Math.abs(v - center) <= threshold) {
                    double d = v - mean;
                    sumSq += d * d;
                }
            }
            variance = kept > 1 ? sumSq / (kept - 1) : Double.NaN;
            boolean converged = kept == lastCount;
            lastCount = kept;
            if (converged || !(variance >= 0)) {
                break;
            }
            center = mean;
            sigma = Math.sqrt(variance);
        }
        return new ClippedStatistics(mean, variance, lastCount, iter);
    }

    public static ClippedStatistics compute(FlatImage image, Rectangle box, double nSigma) {
        if (box.isEmpty()) {
            throw new EmptyRegionException("Empty region " + box);
        }
        return compute(image.values(box), nSigma);
    }

    public static double clippedMean(double[] values, double nSigma) {
        return compute(values, nSigma).getMean();
    }

    public static double clippedVariance(double[] values, double nSigma) {
        return compute(values, nSigma).getVariance();
    }

    public static double clippedMean(FlatImage image, Rectangle box, double nSigma) {
        return compute(image, box, nSigma).getMean();
    }

    public static double clippedMean(FlatImage image, double nSigma) {
        return compute(image, image.getBounds(), nSigma).getMean();
    }

    public static double clippedVariance(FlatImage image, Rectangle box, double nSigma) {
        return compute(image, box, nSigma).getVariance();
    }

    private static double[] finiteSorted(double[] values) {
        double[] result = new double[values.length];
        int n = 0;
        for (double v : values) {
            if (Double.isFinite(v)) {
                result[n++] = v;
            }
        }
        if (n != result.length) {
            result = Arrays.copyOf(result, n);
        }
        Arrays.sort(result);
        return result;
    }

    // Linear interpolation between closest ranks
    static double quantile(double[] sorted, double p) {
        double pos = p * (sorted.length - 1);
        int lower = (int) Math.floor(pos);
        int upper = Math.min(lower + 1, sorted.length - 1);
        double frac = pos - lower;
        if (frac == 0) {
            return sorted[lower];
        }
        return sorted[lower] + frac * (sorted[upper] - sorted[lower]);
    }

    public double getMean() {
        return mean;
    }

    /**
     * The sample variance of the values surviving clipping, NaN if only one
     * value survived.
     *
     * @return The variance
     */
    public double getVariance() {
        return variance;
    }

    public double getStdDev() {
        return Math.sqrt(variance);
    }

    public int getCount() {
        return count;
    }

    public int getIterations() {
        return iterations;
    }

    @Override
    public String toString() {
        return "ClippedStatistics{" + "mean=" + mean + ", variance=" + variance + ", count=" + count + ", iterations=" + iterations + '}';
    }
}
