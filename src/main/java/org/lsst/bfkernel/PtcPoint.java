package org.lsst.bfkernel;

/**
 * One point of a photon transfer curve, measured from one visit pair in one
 * region: the sum of the two image means, the zero-lag variance of their
 * difference and the total (tiled and summed) covariance.
 */
public class PtcPoint {

    private final VisitPair visitPair;
    private final double mean;
    private final double variance;
    private final double covariance;

    public PtcPoint(VisitPair visitPair, double mean, double variance, double covariance) {
        this.visitPair = visitPair;
        this.mean = mean;
        this.variance = variance;
        this.covariance = covariance;
    }

    public VisitPair getVisitPair() {
        return visitPair;
    }

    public double getMean() {
        return mean;
    }

    public double getVariance() {
        return variance;
    }

    public double getCovariance() {
        return covariance;
    }

    @Override
    public String toString() {
        return "PtcPoint{" + "visits=" + visitPair + ", mean=" + mean + ", variance=" + variance + ", covariance=" + covariance + '}';
    }
}
