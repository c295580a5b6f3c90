package org.lsst.bfkernel;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Successive over-relaxation solver for the discrete Poisson equation
 * {@code laplacian(f) = source}, on a grid one cell larger on each side than
 * the source with f fixed at zero on that outer ring.
 * <p>
 * Points are updated in two half-sweeps (odd-even ordering). The relaxation
 * factor starts at 1 and follows the Chebyshev recurrence, using
 * {@code cos(pi/n)} as the spectral radius of the Jacobi iteration for an
 * n&times;n grid. The solver stops once the summed absolute residual falls to
 * {@code eLevel} times its initial value, or after {@code 2*maxIter}
 * half-sweeps. In the latter case the last iterate is still returned, flagged
 * as not converged.
 */
public class SorSolver {

    private static final Logger LOG = Logger.getLogger(SorSolver.class.getName());

    private final int maxIter;
    private final double eLevel;

    public SorSolver(int maxIter, double eLevel) {
        if (maxIter < 1) {
            throw new IllegalArgumentException("maxIter must be at least 1: " + maxIter);
        }
        this.maxIter = maxIter;
        this.eLevel = eLevel;
    }

    public SorSolver(BrighterFatterConfig config) {
        this(config.getMaxIterSOR(), config.getELevelSOR());
    }

    public SorSolution solve(double[][] source) {
        int n = source.length;
        for (double[] row : source) {
            if (row.length != n) {
                throw new ShapeException("SOR source must be square, found a row of length " + row.length + " in an array of " + n + " rows");
            }
        }
        if (n == 0) {
            throw new ShapeException("SOR source is empty");
        }
        return Timed.execute(() -> relax(source), "SOR on %dx%d grid took %dms", n, n);
    }

    private SorSolution relax(double[][] source) {
        int n = source.length;
        double[][] func = new double[n + 2][n + 2];
        double[][] resid = new double[n + 2][n + 2];
        double rhoSpe = Math.cos(Math.PI / n);

        for (int i = 1; i <= n; i++) {
            for (int j = 1; j <= n; j++) {
                resid[i][j] = func[i][j - 1] + func[i][j + 1] + func[i - 1][j] + func[i + 1][j] - 4 * func[i][j] - source[i - 1][j - 1];
            }
        }
        double inError = sumOfAbs(resid);
        double target = inError * eLevel;

        double omega = 1.0;
        double outError = inError;
        int halfSweeps = 0;
        boolean converged = false;
        while (halfSweeps < maxIter * 2) {
            int parity = halfSweeps % 2;
            for (int i = 1; i <= n; i++) {
                for (int j = 1 + (i + 1 + parity) % 2; j <= n; j += 2) {
                    resid[i][j] = func[i][j - 1] + func[i][j + 1] + func[i - 1][j] + func[i + 1][j] - 4.0 * func[i][j] - source[i - 1][j - 1];
                    func[i][j] += omega * resid[i][j] * 0.25;
                }
            }
            halfSweeps++;
            outError = sumOfAbs(resid);
            if (outError <= target) {
                converged = true;
                break;
            }
            if (halfSweeps == 1) {
                omega = 1.0 / (1 - rhoSpe * rhoSpe / 2.0);
            } else {
                omega = 1.0 / (1 - rhoSpe * rhoSpe * omega / 4.0);
            }
        }
        int iterations = (halfSweeps + 1) / 2;
        if (converged) {
            LOG.log(Level.INFO, "SOR converged in {0} iterations, residual {1} (target {2})", new Object[]{iterations, outError, target});
        } else {
            LOG.log(Level.WARNING, "SOR did not converge in {0} iterations, residual {1} (target {2}), kernel is unreliable", new Object[]{iterations, outError, target});
        }
        double[][] solution = new double[n][n];
        for (int i = 0; i < n; i++) {
            System.arraycopy(func[i + 1], 1, solution[i], 0, n);
        }
        return new SorSolution(solution, converged, iterations, inError, outError);
    }

    private static double sumOfAbs(double[][] array) {
        return SymmetricTiler.sumOfAbs(array);
    }
}
