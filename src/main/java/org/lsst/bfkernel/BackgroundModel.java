package org.lsst.bfkernel;

import java.awt.Rectangle;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.lsst.bfkernel.stats.ClippedStatistics;

/**
 * Smooth background estimate of an image.
 * <p>
 * The image is divided into a grid of roughly {@code binSize} square cells and
 * the sigma-clipped mean of each cell is taken as the background at the cell
 * centre. The background at each pixel is then interpolated with natural cubic
 * splines, first along x for every row of cells and then along y. With only two
 * cells along an axis the interpolation reduces to linear, with one to a
 * constant. Pixels beyond the outermost cell centres are extrapolated from the
 * end segments of the spline.
 */
class BackgroundModel {

    private static final Logger LOG = Logger.getLogger(BackgroundModel.class.getName());

    private BackgroundModel() {
    }

    static FlatImage estimate(FlatImage image, int binSize, double nSigma) {
        int width = image.getWidth();
        int height = image.getHeight();
        int nx = Math.max(1, width / binSize);
        int ny = Math.max(1, height / binSize);
        if (width < binSize || height < binSize) {
            LOG.log(Level.FINE, "Image {0}x{1} smaller than background bin {2}, using a single bin along the short axis", new Object[]{width, height, binSize});
        }
        int[] xEdges = edges(width, nx);
        int[] yEdges = edges(height, ny);
        double[] xCenters = centers(xEdges);
        double[] yCenters = centers(yEdges);

        double[][] cells = new double[ny][nx];
        for (int j = 0; j < ny; j++) {
            for (int i = 0; i < nx; i++) {
                Rectangle cell = new Rectangle(xEdges[i], yEdges[j], xEdges[i + 1] - xEdges[i], yEdges[j + 1] - yEdges[j]);
                cells[j][i] = ClippedStatistics.clippedMean(image, cell, nSigma);
            }
        }

        double[][] rows = new double[ny][width];
        for (int j = 0; j < ny; j++) {
            UnivariateFunction f = interpolant(xCenters, cells[j]);
            for (int x = 0; x < width; x++) {
                rows[j][x] = f.value(x);
            }
        }
        FlatImage background = new FlatImage(width, height);
        double[] column = new double[ny];
        for (int x = 0; x < width; x++) {
            for (int j = 0; j < ny; j++) {
                column[j] = rows[j][x];
            }
            UnivariateFunction f = interpolant(yCenters, column);
            for (int y = 0; y < height; y++) {
                background.set(x, y, f.value(y));
            }
        }
        return background;
    }

    /**
     * Subtract the estimated background from an image, in place.
     *
     * @param image The image to modify
     * @param binSize The nominal cell size
     * @param nSigma The clipping threshold for the cell means
     */
    static void subtract(FlatImage image, int binSize, double nSigma) {
        image.subtract(estimate(image, binSize, nSigma));
    }

    private static int[] edges(int length, int nBins) {
        int[] edges = new int[nBins + 1];
        for (int i = 0; i <= nBins; i++) {
            edges[i] = (int) ((long) i * length / nBins);
        }
        return edges;
    }

    private static double[] centers(int[] edges) {
        double[] centers = new double[edges.length - 1];
        for (int i = 0; i < centers.length; i++) {
            centers[i] = (edges[i] + edges[i + 1] - 1) / 2.0;
        }
        return centers;
    }

    private static UnivariateFunction interpolant(double[] knots, double[] values) {
        if (knots.length == 1) {
            final double constant = values[0];
            return (x) -> constant;
        }
        // Natural cubic splines need at least 3 knots
        PolynomialSplineFunction spline = knots.length >= 3
                ? new SplineInterpolator().interpolate(knots, values.clone())
                : new LinearInterpolator().interpolate(knots, values.clone());
        return (x) -> evaluate(spline, x);
    }

    private static double evaluate(PolynomialSplineFunction spline, double x) {
        double[] knots = spline.getKnots();
        PolynomialFunction[] polynomials = spline.getPolynomials();
        if (x < knots[0]) {
            return polynomials[0].value(x - knots[0]);
        } else if (x > knots[knots.length - 1]) {
            int last = polynomials.length - 1;
            return polynomials[last].value(x - knots[last]);
        } else {
            return spline.value(x);
        }
    }
}
