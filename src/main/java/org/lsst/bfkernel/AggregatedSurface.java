package org.lsst.bfkernel;

/**
 * The per-pixel clipped mean of the normalised correlation surfaces of one
 * region, ready to be handed to the solver.
 */
public class AggregatedSurface {

    private final double[][] surface;
    private final int samplesUsed;
    private final int samplesRejected;

    AggregatedSurface(double[][] surface, int samplesUsed, int samplesRejected) {
        this.surface = surface;
        this.samplesUsed = samplesUsed;
        this.samplesRejected = samplesRejected;
    }

    public double[][] getSurface() {
        return Arrays2D.copy(surface);
    }

    public int getSamplesUsed() {
        return samplesUsed;
    }

    public int getSamplesRejected() {
        return samplesRejected;
    }

    @Override
    public String toString() {
        return "AggregatedSurface{" + "size=" + surface.length + ", samplesUsed=" + samplesUsed + ", samplesRejected=" + samplesRejected + '}';
    }
}
