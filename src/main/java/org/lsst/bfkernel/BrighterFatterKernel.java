package org.lsst.bfkernel;

/**
 * The brighter-fatter kernel of one region, a (2*maxLag+1) square array
 * centred on the zero lag. A kernel whose solver did not converge is still
 * returned but should be treated as unreliable.
 */
public class BrighterFatterKernel {

    private final String region;
    private final double[][] kernel;
    private final boolean converged;
    private final int iterations;
    private final int samplesUsed;

    public BrighterFatterKernel(String region, double[][] kernel, boolean converged, int iterations, int samplesUsed) {
        this.region = region;
        this.kernel = Arrays2D.copy(kernel);
        this.converged = converged;
        this.iterations = iterations;
        this.samplesUsed = samplesUsed;
    }

    public String getRegion() {
        return region;
    }

    public double[][] getKernel() {
        return Arrays2D.copy(kernel);
    }

    public int getSize() {
        return kernel.length;
    }

    public double getValue(int i, int j) {
        return kernel[i][j];
    }

    public boolean isConverged() {
        return converged;
    }

    public int getIterations() {
        return iterations;
    }

    public int getSamplesUsed() {
        return samplesUsed;
    }

    @Override
    public String toString() {
        return "BrighterFatterKernel{" + "region=" + region + ", size=" + kernel.length + ", converged=" + converged
                + ", iterations=" + iterations + ", samplesUsed=" + samplesUsed + '}';
    }
}
