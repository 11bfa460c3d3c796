/*
 * Copyright (c) 2025 The edakit Development Team
 *
 * Permission is hereby granted, free of charge, to any person
 * obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without
 * restriction, including without limitation the rights to use,
 * copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY,
 * WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */

package io.github.edakit.modules.dataprocessing.eda_decompose.cvxeda;

import io.github.edakit.util.SparseMatrixUtils;
import java.util.Arrays;
import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;
import org.jetbrains.annotations.NotNull;

/**
 * Regressors of the tonic component: a cubic B-spline like basis B with one column per knot and
 * the trend basis C = [1, t].
 * <p>
 * The knot spacing in samples is {@code s = rint(deltaKnot * samplingRate)}. The kernel is the
 * triangle {@code 1 .. s .. 1} convolved with itself, length {@code 4s - 3}, scaled to a peak of 1
 * and centred on the knots {@code 0, s, 2s, ... < n}. Taps outside the signal are dropped.
 */
public final class TonicSplineBasis {

  private final int knotSpacing;
  private final double[] kernel;

  /**
   * @param deltaKnot    time between knots in s
   * @param samplingRate Hz
   * @throws IllegalArgumentException if the knot spacing rounds to less than one sample
   */
  public TonicSplineBasis(double deltaKnot, double samplingRate) {
    if (!(samplingRate > 0d)) {
      throw new IllegalArgumentException("Sampling rate must be positive, was " + samplingRate);
    }
    final double spacing = Math.rint(deltaKnot / (1d / samplingRate));
    if (!(spacing >= 1d) || spacing > Integer.MAX_VALUE / 4d) {
      throw new IllegalArgumentException(
          "Knot spacing of " + deltaKnot + " s at " + samplingRate + " Hz gives " + spacing
              + " samples, need at least 1");
    }
    knotSpacing = (int) spacing;
    kernel = createKernel(knotSpacing);
  }

  static double[] createKernel(int s) {
    // the ramp 1 .. s .. 1 is a box of width s convolved with itself, so the kernel is four boxes
    double[] kernel = new double[s];
    Arrays.fill(kernel, 1d);
    for (int pass = 0; pass < 3; pass++) {
      kernel = boxSum(kernel, s);
    }
    // symmetric, peak in the middle
    final double max = kernel[2 * s - 2];
    for (int i = 0; i < kernel.length; i++) {
      kernel[i] /= max;
    }
    return kernel;
  }

  /**
   * Full convolution with a box of ones of the given width, as a running sum.
   */
  private static double[] boxSum(double[] values, int width) {
    final double[] out = new double[values.length + width - 1];
    double sum = 0d;
    for (int k = 0; k < out.length; k++) {
      if (k < values.length) {
        sum += values[k];
      }
      if (k - width >= 0) {
        sum -= values[k - width];
      }
      out[k] = sum;
    }
    return out;
  }

  public int getKnotSpacing() {
    return knotSpacing;
  }

  public double[] getKernel() {
    return kernel.clone();
  }

  /**
   * @return number of spline columns nB = ceil(n / s)
   */
  public int numKnots(int n) {
    return (n + knotSpacing - 1) / knotSpacing;
  }

  public @NotNull DMatrixSparseCSC buildB(int n) {
    final DMatrixSparseTriplet triplet = new DMatrixSparseTriplet(n, numKnots(n),
        numKnots(n) * kernel.length);
    appendB(triplet, n, 0, 0);
    return SparseMatrixUtils.toCsc(triplet);
  }

  void appendB(@NotNull DMatrixSparseTriplet target, int n, int rowOffset, int colOffset) {
    final int half = kernel.length / 2;
    final int knots = numKnots(n);
    for (int j = 0; j < knots; j++) {
      final int centre = j * knotSpacing;
      final int from = Math.max(0, centre - half);
      final int to = Math.min(n - 1, centre + half);
      for (int row = from; row <= to; row++) {
        target.addItem(rowOffset + row, colOffset + j, kernel[row - centre + half]);
      }
    }
  }

  /**
   * @return n x 2 trend matrix, a column of ones and the ramp (1..n)/n
   */
  public static @NotNull DMatrixSparseCSC buildTrend(int n) {
    final DMatrixSparseTriplet triplet = new DMatrixSparseTriplet(n, 2, 2 * n);
    appendTrend(triplet, n, 0, 0);
    return SparseMatrixUtils.toCsc(triplet);
  }

  static void appendTrend(@NotNull DMatrixSparseTriplet target, int n, int rowOffset,
      int colOffset) {
    for (int i = 0; i < n; i++) {
      target.addItem(rowOffset + i, colOffset, 1d);
      target.addItem(rowOffset + i, colOffset + 1, (i + 1d) / n);
    }
  }
}
