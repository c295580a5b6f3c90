package org.lsst.bfkernel;

/**
 * Small helpers for square double arrays.
 */
final class Arrays2D {

    private Arrays2D() {
    }

    static double[][] copy(double[][] array) {
        double[][] result = new double[array.length][];
        for (int i = 0; i < array.length; i++) {
            result[i] = array[i].clone();
        }
        return result;
    }

    static void scale(double[][] array, double factor) {
        for (double[] row : array) {
            for (int j = 0; j < row.length; j++) {
                row[j] *= factor;
            }
        }
    }
}
