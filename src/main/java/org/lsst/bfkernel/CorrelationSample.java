package org.lsst.bfkernel;

/**
 * One cross-correlation measurement of a region: the means of the two
 * (gain corrected) images and the quarter correlation of their difference,
 * indexed [dx][dy].
 */
public class CorrelationSample {

    private final VisitPair visitPair;
    private final double mean1;
    private final double mean2;
    private final double[][] quarter;

    public CorrelationSample(VisitPair visitPair, double mean1, double mean2, double[][] quarter) {
        this.visitPair = visitPair;
        this.mean1 = mean1;
        this.mean2 = mean2;
        this.quarter = Arrays2D.copy(quarter);
    }

    public VisitPair getVisitPair() {
        return visitPair;
    }

    public double getMean1() {
        return mean1;
    }

    public double getMean2() {
        return mean2;
    }

    public double[][] getQuarter() {
        return Arrays2D.copy(quarter);
    }

    @Override
    public String toString() {
        return "CorrelationSample{" + "visitPair=" + visitPair + ", mean1=" + mean1 + ", mean2=" + mean2 + ", xcorr[0][0]=" + quarter[0][0] + '}';
    }
}
