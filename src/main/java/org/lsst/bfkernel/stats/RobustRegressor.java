package org.lsst.bfkernel.stats;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.bfkernel.DegenerateFitException;
import org.lsst.bfkernel.InsufficientDataException;

/**
 * Least squares line fitting with iterative rejection of outliers.
 * <p>
 * Each pass fits a line to the surviving points, computes the sigma-clipped
 * mean and standard deviation of the residuals, and discards every point whose
 * residual lies more than nSigmaClip standard deviations from that mean. The
 * loop ends when a pass rejects nothing or after maxIter passes, so outliers
 * may survive if the iteration limit is reached first.
 */
public class RobustRegressor {

    private static final Logger LOG = Logger.getLogger(RobustRegressor.class.getName());

    private RobustRegressor() {
    }

    /**
     * Fit a line with iterative outlier rejection.
     *
     * @param x The independent variable
     * @param y The dependent variable
     * @param fixThroughOrigin If true fit y = slope * x, otherwise y = slope * x + intercept
     * @param nSigmaClip The rejection threshold in standard deviations of the residuals
     * @param maxIter The maximum number of fit/reject passes
     * @return The fit from the last pass
     * @throws InsufficientDataException if fewer than two points remain at any pass
     * @throws DegenerateFitException if the points do not determine a line
     */
    public static LineFit fit(double[] x, double[] y, boolean fixThroughOrigin, double nSigmaClip, int maxIter) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("x and y differ in length: " + x.length + " vs " + y.length);
        }
        if (maxIter < 1) {
            throw new IllegalArgumentException("maxIter must be at least 1: " + maxIter);
        }
        double[][] points = finitePoints(x, y);
        double[] xs = points[0];
        double[] ys = points[1];
        LineFit fit = null;
        int nIter = 0;
        while (nIter < maxIter) {
            nIter++;
            fit = leastSquares(xs, ys, fixThroughOrigin, nIter);
            LOG.log(Level.FINE, "Iteration {0} (origin fixed={1}) using {2} points", new Object[]{nIter, fixThroughOrigin, xs.length});
            double[] residuals = new double[xs.length];
            for (int i = 0; i < xs.length; i++) {
                residuals[i] = ys[i] - fit.value(xs[i]);
            }
            ClippedStatistics stats = ClippedStatistics.compute(residuals, nSigmaClip);
            double limit = nSigmaClip * stats.getStdDev();
            boolean[] keep = new boolean[xs.length];
            int nKeep = 0;
            for (int i = 0; i < xs.length; i++) {
                // NaN limit (a single surviving residual) rejects nothing
                keep[i] = !(Math.abs(residuals[i] - stats.getMean()) > limit);
                if (keep[i]) {
                    nKeep++;
                }
            }
            LOG.log(Level.FINE, "Residual mean {0} std {1}, rejecting {2}", new Object[]{stats.getMean(), stats.getStdDev(), xs.length - nKeep});
            if (nKeep == xs.length || nIter >= maxIter) {
                break;
            }
            xs = select(xs, keep, nKeep);
            ys = select(ys, keep, nKeep);
        }
        return fit;
    }

    /**
     * Plain least squares fit without any rejection.
     *
     * @param x The independent variable
     * @param y The dependent variable
     * @param fixThroughOrigin If true the intercept is fixed at 0
     * @return The fitted line
     */
    public static LineFit leastSquares(double[] x, double[] y, boolean fixThroughOrigin) {
        double[][] points = finitePoints(x, y);
        return leastSquares(points[0], points[1], fixThroughOrigin, 1);
    }

    private static LineFit leastSquares(double[] x, double[] y, boolean fixThroughOrigin, int iteration) {
        int n = x.length;
        if (n < 2) {
            throw new InsufficientDataException("Need at least 2 points to fit a line, have " + n);
        }
        if (fixThroughOrigin) {
            double sxy = 0;
            double sxx = 0;
            for (int i = 0; i < n; i++) {
                sxy += x[i] * y[i];
                sxx += x[i] * x[i];
            }
            if (sxx == 0) {
                throw new DegenerateFitException("All x values are zero, slope is undefined");
            }
            return new LineFit(sxy / sxx, 0, n, iteration);
        }
        double xMean = 0;
        double yMean = 0;
        for (int i = 0; i < n; i++) {
            xMean += x[i];
            yMean += y[i];
        }
        xMean /= n;
        yMean /= n;
        double sxy = 0;
        double sxx = 0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - xMean;
            sxy += dx * (y[i] - yMean);
            sxx += dx * dx;
        }
        if (sxx == 0) {
            throw new DegenerateFitException("All x values are identical (" + xMean + "), slope is undefined");
        }
        double slope = sxy / sxx;
        return new LineFit(slope, yMean - slope * xMean, n, iteration);
    }

    private static double[][] finitePoints(double[] x, double[] y) {
        double[] xs = new double[x.length];
        double[] ys = new double[y.length];
        int n = 0;
        for (int i = 0; i < x.length; i++) {
            if (Double.isFinite(x[i]) && Double.isFinite(y[i])) {
                xs[n] = x[i];
                ys[n] = y[i];
                n++;
            }
        }
        return new double[][]{Arrays.copyOf(xs, n), Arrays.copyOf(ys, n)};
    }

    private static double[] select(double[] values, boolean[] keep, int nKeep) {
        double[] result = new double[nKeep];
        int j = 0;
        for (int i = 0; i < values.length; i++) {
            if (keep[i]) {
                result[j++] = values[i];
            }
        }
        return result;
    }
}
