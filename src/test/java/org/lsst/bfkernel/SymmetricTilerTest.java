package org.lsst.bfkernel;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import org.junit.Test;

public class SymmetricTilerTest {

    @Test
    public void testTile() {
        double[][] quarter = {{1, 2, 3}, {4, 5, 6}, {7, 8, 9}};
        double[][] full = SymmetricTiler.tile(quarter);
        assertEquals(5, full.length);
        assertArrayEquals(new double[]{9, 8, 7, 8, 9}, full[0], 0);
        assertArrayEquals(new double[]{6, 5, 4, 5, 6}, full[1], 0);
        assertArrayEquals(new double[]{3, 2, 1, 2, 3}, full[2], 0);
        assertArrayEquals(new double[]{6, 5, 4, 5, 6}, full[3], 0);
        assertArrayEquals(new double[]{9, 8, 7, 8, 9}, full[4], 0);
    }

    @Test
    public void testSymmetry() {
        int n = 4;
        double[][] quarter = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                quarter[i][j] = Math.sin(i * 7 + j * 3 + 1);
            }
        }
        double[][] full = SymmetricTiler.tile(quarter);
        int size = 2 * n - 1;
        assertEquals(size, full.length);
        assertEquals(quarter[0][0], full[n - 1][n - 1], 0);
        for (int i = 0; i < size; i++) {
            assertEquals(size, full[i].length);
            for (int j = 0; j < size; j++) {
                assertEquals(full[i][j], full[size - 1 - i][j], 0);
                assertEquals(full[i][j], full[i][size - 1 - j], 0);
            }
        }
    }

    @Test
    public void testSingleElement() {
        double[][] full = SymmetricTiler.tile(new double[][]{{2.5}});
        assertEquals(1, full.length);
        assertEquals(2.5, full[0][0], 0);
    }

    @Test
    public void testSums() {
        double[][] full = SymmetricTiler.tile(new double[][]{{4, -1}, {-1, 0.5}});
        // 4 - 4*1 + 4*0.5
        assertEquals(2, SymmetricTiler.sum(full), 1e-15);
        assertEquals(10, SymmetricTiler.sumOfAbs(full), 1e-15);
    }

    @Test(expected = ShapeException.class)
    public void testNotSquare() {
        SymmetricTiler.tile(new double[][]{{1, 2, 3}, {4, 5, 6}});
    }

    @Test(expected = ShapeException.class)
    public void testEmpty() {
        SymmetricTiler.tile(new double[0][0]);
    }
}
