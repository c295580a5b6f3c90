package org.lsst.bfkernel;

/**
 * Rebuilds a full correlation surface from its non-negative lag quarter, using
 * the point symmetry of the correlation function.
 * <p>
 * For an input of side n the output has side 2n-1 and centre n-1, and input
 * element [i][j] is copied to the four positions [n-1&plusmn;i][n-1&plusmn;j].
 * For example
 * <pre>
 * 1 2 3          9 8 7 8 9
 * 4 5 6    -&gt;    6 5 4 5 6
 * 7 8 9          3 2 1 2 3
 *                6 5 4 5 6
 *                9 8 7 8 9
 * </pre>
 */
public class SymmetricTiler {

    private SymmetricTiler() {
    }

    public static double[][] tile(double[][] quarter) {
        int n = quarter.length;
        if (n == 0) {
            throw new ShapeException("Cannot tile an empty array");
        }
        for (double[] row : quarter) {
            if (row.length != n) {
                throw new ShapeException("Quarter array must be square, found a row of length " + row.length + " in an array of " + n + " rows");
            }
        }
        int center = n - 1;
        double[][] output = new double[2 * n - 1][2 * n - 1];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                double v = quarter[i][j];
                output[center + i][center + j] = v;
                output[center - i][center + j] = v;
                output[center + i][center - j] = v;
                output[center - i][center - j] = v;
            }
        }
        return output;
    }

    public static double sum(double[][] array) {
        double sum = 0;
        for (double[] row : array) {
            for (double v : row) {
                sum += v;
            }
        }
        return sum;
    }

    public static double sumOfAbs(double[][] array) {
        double sum = 0;
        for (double[] row : array) {
            for (double v : row) {
                sum += Math.abs(v);
            }
        }
        return sum;
    }
}
