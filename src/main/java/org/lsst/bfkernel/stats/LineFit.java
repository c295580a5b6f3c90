package org.lsst.bfkernel.stats;

/**
 * Result of a straight line fit, y = slope * x + intercept.
 */
public class LineFit {

    private final double slope;
    private final double intercept;
    private final int nPoints;
    private final int iterations;

    LineFit(double slope, double intercept, int nPoints, int iterations) {
        this.slope = slope;
        this.intercept = intercept;
        this.nPoints = nPoints;
        this.iterations = iterations;
    }

    public double getSlope() {
        return slope;
    }

    /**
     * @return The intercept, exactly 0 for fits constrained through the origin
     */
    public double getIntercept() {
        return intercept;
    }

    /**
     * @return The number of points used by the final fit
     */
    public int getNPoints() {
        return nPoints;
    }

    public int getIterations() {
        return iterations;
    }

    public double value(double x) {
        return slope * x + intercept;
    }

    @Override
    public String toString() {
        return "LineFit{" + "slope=" + slope + ", intercept=" + intercept + ", nPoints=" + nPoints + ", iterations=" + iterations + '}';
    }
}
