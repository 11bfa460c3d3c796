/*
 * Copyright (c) 2025 The edakit Development Team
 */

package io.github.edakit.modules.dataprocessing.eda_decompose.cvxeda;

import org.ejml.data.DMatrixSparseCSC;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class TonicSplineBasisTest {

  @Test
  void testKernelIsSelfConvolvedTriangle() {
    final double[] expected = {1, 4, 10, 16, 19, 16, 10, 4, 1};
    for (int i = 0; i < expected.length; i++) {
      expected[i] /= 19d;
    }
    Assertions.assertArrayEquals(expected, TonicSplineBasis.createKernel(3), 1e-12);
    Assertions.assertArrayEquals(new double[]{1}, TonicSplineBasis.createKernel(1));
  }

  @Test
  void testKernelMatchesDirectConvolution() {
    final int s = 7;
    final double[] ramp = new double[2 * s - 1];
    for (int i = 0; i < ramp.length; i++) {
      ramp[i] = s - Math.abs(i - (s - 1));
    }
    final double[] conv = new double[2 * ramp.length - 1];
    for (int i = 0; i < ramp.length; i++) {
      for (int j = 0; j < ramp.length; j++) {
        conv[i + j] += ramp[i] * ramp[j];
      }
    }
    final double max = conv[2 * s - 2];
    for (int i = 0; i < conv.length; i++) {
      conv[i] /= max;
    }

    final double[] kernel = TonicSplineBasis.createKernel(s);
    Assertions.assertEquals(4 * s - 3, kernel.length);
    Assertions.assertArrayEquals(conv, kernel, 1e-12);
  }

  @Test
  void testBasisColumnsAreCentredOnKnots() {
    final TonicSplineBasis basis = new TonicSplineBasis(3.0, 1);
    final int n = 10;
    final DMatrixSparseCSC b = basis.buildB(n);

    Assertions.assertEquals(3, basis.getKnotSpacing());
    Assertions.assertEquals(4, basis.numKnots(n));
    Assertions.assertEquals(n, b.numRows);
    Assertions.assertEquals(4, b.numCols);
    Assertions.assertEquals(1d, b.get(0, 0), 1e-12);
    Assertions.assertEquals(16d / 19, b.get(1, 0), 1e-12);
    Assertions.assertEquals(1d / 19, b.get(4, 0), 1e-12);
    Assertions.assertEquals(0d, b.get(5, 0));
    Assertions.assertEquals(1d, b.get(6, 2), 1e-12);
    Assertions.assertEquals(1d / 19, b.get(2, 2), 1e-12);
    Assertions.assertEquals(10d / 19, b.get(4, 2), 1e-12);
    // the last knot is cut at the end of the signal
    Assertions.assertEquals(1d, b.get(9, 3), 1e-12);
    Assertions.assertEquals(0d, b.get(4, 3));
    Assertions.assertEquals(1d / 19, b.get(5, 3), 1e-12);
  }

  @Test
  void testKnotSpacingRoundsHalfToEven() {
    Assertions.assertEquals(2, new TonicSplineBasis(2.5, 1).getKnotSpacing());
    Assertions.assertEquals(4, new TonicSplineBasis(3.5, 1).getKnotSpacing());
    Assertions.assertEquals(1000, new TonicSplineBasis(10.0, 100).getKnotSpacing());
    Assertions.assertEquals(1, new TonicSplineBasis(10.0, 100).numKnots(1000));
    Assertions.assertEquals(2, new TonicSplineBasis(10.0, 100).numKnots(1001));
  }

  @Test
  void testTooSmallKnotSpacing() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new TonicSplineBasis(0.4, 1));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new TonicSplineBasis(0.0, 100));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new TonicSplineBasis(10.0, 0));
  }

  @Test
  void testTrend() {
    final DMatrixSparseCSC c = TonicSplineBasis.buildTrend(4);
    for (int i = 0; i < 4; i++) {
      Assertions.assertEquals(1d, c.get(i, 0));
      Assertions.assertEquals((i + 1) / 4d, c.get(i, 1), 1e-15);
    }
  }
}
