package org.lsst.bfkernel;

/**
 * The output of {@link SorSolver}. A solution which did not converge is still
 * the last iterate, but should be treated as unreliable.
 */
public class SorSolution {

    private final double[][] solution;
    private final boolean converged;
    private final int iterations;
    private final double initialResidual;
    private final double finalResidual;

    SorSolution(double[][] solution, boolean converged, int iterations, double initialResidual, double finalResidual) {
        this.solution = solution;
        this.converged = converged;
        this.iterations = iterations;
        this.initialResidual = initialResidual;
        this.finalResidual = finalResidual;
    }

    public double[][] getSolution() {
        return Arrays2D.copy(solution);
    }

    public boolean isConverged() {
        return converged;
    }

    public int getIterations() {
        return iterations;
    }

    public double getInitialResidual() {
        return initialResidual;
    }

    public double getFinalResidual() {
        return finalResidual;
    }

    @Override
    public String toString() {
        return "SorSolution{" + "size=" + solution.length + ", converged=" + converged + ", iterations=" + iterations
                + ", initialResidual=" + initialResidual + ", finalResidual=" + finalResidual + '}';
    }
}
