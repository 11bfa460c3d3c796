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
import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;
import org.jetbrains.annotations.NotNull;

/**
 * Discretized Bateman impulse response of the sweat glands as an order 2 ARMA filter. The
 * continuous model {@code 1 / ((s + a1)(s + a0))} with {@code a1 = 1/min(tau)} and
 * {@code a0 = 1/max(tau)} is mapped with the bilinear transform, which gives the three AR taps and
 * the fixed MA taps {@code [1, 2, 1]}.
 * <p>
 * The operators are n x n, lower banded and causal: row i >= 2 holds the taps at columns
 * i, i-1, i-2, rows 0 and 1 stay empty.
 */
public final class BatemanArmaModel {

  private static final double[] MA = {1d, 2d, 1d};

  private final double tau0;
  private final double tau1;
  private final double samplingPeriod;
  private final double[] ar;

  /**
   * @throws IllegalArgumentException if a time constant is not positive and finite, both are
   *                                  equal, or the sampling rate is not positive
   */
  public BatemanArmaModel(double tau0, double tau1, double samplingRate) {
    if (!(tau0 > 0d) || !(tau1 > 0d) || !Double.isFinite(tau0) || !Double.isFinite(tau1)) {
      throw new IllegalArgumentException(
          "Bateman time constants must be positive, were tau0=" + tau0 + " tau1=" + tau1);
    }
    if (tau0 == tau1) {
      throw new IllegalArgumentException(
          "Bateman time constants must differ, both were " + tau0);
    }
    if (!(samplingRate > 0d)) {
      throw new IllegalArgumentException("Sampling rate must be positive, was " + samplingRate);
    }
    this.tau0 = tau0;
    this.tau1 = tau1;
    this.samplingPeriod = 1d / samplingRate;

    final double dt = samplingPeriod;
    final double a1 = 1d / Math.min(tau0, tau1);
    final double a0 = 1d / Math.max(tau0, tau1);
    final double denominator = (a1 - a0) * dt * dt;
    ar = new double[]{(a1 * dt + 2d) * (a0 * dt + 2d) / denominator,
        (2d * a1 * a0 * dt * dt - 8d) / denominator,
        (a1 * dt - 2d) * (a0 * dt - 2d) / denominator};
  }

  public double getTau0() {
    return tau0;
  }

  public double getTau1() {
    return tau1;
  }

  public double getSamplingPeriod() {
    return samplingPeriod;
  }

  public double[] getAr() {
    return ar.clone();
  }

  public double[] getMa() {
    return MA.clone();
  }

  /**
   * @return the AR operator A mapping the driver q to the SMNA A*q
   */
  public @NotNull DMatrixSparseCSC buildA(int n) {
    final DMatrixSparseTriplet triplet = new DMatrixSparseTriplet(n, n, 3 * n);
    appendBand(triplet, ar, n, 0, 0, 1d);
    return SparseMatrixUtils.toCsc(triplet);
  }

  /**
   * @return the MA operator M mapping the driver q to the phasic response M*q
   */
  public @NotNull DMatrixSparseCSC buildM(int n) {
    final DMatrixSparseTriplet triplet = new DMatrixSparseTriplet(n, n, 3 * n);
    appendBand(triplet, MA, n, 0, 0, 1d);
    return SparseMatrixUtils.toCsc(triplet);
  }

  void appendA(@NotNull DMatrixSparseTriplet target, int n, int rowOffset, int colOffset,
      double scale) {
    appendBand(target, ar, n, rowOffset, colOffset, scale);
  }

  void appendM(@NotNull DMatrixSparseTriplet target, int n, int rowOffset, int colOffset,
      double scale) {
    appendBand(target, MA, n, rowOffset, colOffset, scale);
  }

  private static void appendBand(DMatrixSparseTriplet target, double[] taps, int n,
      int rowOffset, int colOffset, double scale) {
    if (n < 1) {
      throw new IllegalArgumentException("Signal length must be at least 1, was " + n);
    }
    for (int i = 2; i < n; i++) {
      for (int k = 0; k < 3; k++) {
        target.addItem(rowOffset + i, colOffset + i - k, scale * taps[k]);
      }
    }
  }
}
