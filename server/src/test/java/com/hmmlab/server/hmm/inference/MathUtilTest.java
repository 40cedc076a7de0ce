package com.hmmlab.server.hmm.inference;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MathUtilTest {

    @Test
    public void testNormalizeInPlace() {
        double[] x = { 1.0, 3.0 };
        double total = MathUtil.normalizeInPlace(x);

        assertEquals(4.0, total, 0.0);
        assertArrayEquals(new double[] { 0.25, 0.75 }, x, 1e-15);
        assertTrue(MathUtil.sumsToOne(x, 1e-12));
    }

    @Test
    public void testArgmaxPrefersLowestIndexOnTie() {
        assertEquals(1, MathUtil.argmax(new double[] { 0.1, 0.7, 0.7 }));
        assertEquals(-1, MathUtil.argmax(new double[0]));
    }

    @Test
    public void testFlooredLog() {
        assertEquals(Math.log(1e-10), MathUtil.flooredLog(0.0, 1e-10), 0.0);
        assertEquals(Math.log(0.5), MathUtil.flooredLog(0.5, 1e-10), 0.0);
    }

    @Test
    public void testCopyIsDeep() {
        double[][] a = { { 1.0, 2.0 }, { 3.0, 4.0 } };
        double[][] b = MathUtil.copy(a);
        b[1][0] = 2.5;

        assertEquals(3.0, a[1][0], 0.0);
        assertArrayEquals(a[0], b[0], 0.0);
    }
}
