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
import io.github.edakit.util.optimization.ConeDimensions;
import io.github.edakit.util.optimization.ConeProgram;
import io.github.edakit.util.optimization.QuadraticProgram;
import java.util.Arrays;
import java.util.logging.Logger;
import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;
import org.jetbrains.annotations.NotNull;

/**
 * Builds the cvxEDA problem
 * <pre>
 *   minimize    1/2 ||M q + B l + C d - y||^2 + alpha 1'A q + 1/2 gamma l'l
 *   subject to  A q >= 0
 * </pre>
 * either as a quadratic program over x = [q; d; l] or as a cone program over
 * x = [q; d; t1; t2; l] where both squared norms are bounded by rotated second-order cones, and
 * maps a solver's x back to signals. One instance per signal, all matrices are built in the
 * constructor.
 */
public class CvxEdaFormulator {

  private static final Logger logger = Logger.getLogger(CvxEdaFormulator.class.getName());

  private final double[] y;
  private final int n;
  private final int nB;
  private final double alpha;
  private final double gamma;
  private final BatemanArmaModel model;
  private final TonicSplineBasis basis;
  private final DMatrixSparseCSC a;
  private final DMatrixSparseCSC m;
  private final DMatrixSparseCSC b;
  private final DMatrixSparseCSC c;

  public CvxEdaFormulator(double[] signal, @NotNull BatemanArmaModel model,
      @NotNull TonicSplineBasis basis, double alpha, double gamma) {
    this.y = signal.clone();
    this.n = signal.length;
    this.model = model;
    this.basis = basis;
    this.alpha = alpha;
    this.gamma = gamma;
    a = model.buildA(n);
    m = model.buildM(n);
    b = basis.buildB(n);
    c = TonicSplineBasis.buildTrend(n);
    nB = b.numCols;
    logger.fine(() -> "cvxEDA problem with n=" + n + ", nB=" + nB + ", knot spacing "
        + basis.getKnotSpacing() + " samples");
  }

  public int getSignalLength() {
    return n;
  }

  public int getNumKnots() {
    return nB;
  }

  public @NotNull DMatrixSparseCSC getA() {
    return a;
  }

  public @NotNull DMatrixSparseCSC getM() {
    return m;
  }

  public @NotNull DMatrixSparseCSC getB() {
    return b;
  }

  public @NotNull DMatrixSparseCSC getC() {
    return c;
  }

  /**
   * H = [M C B]'[M C B] + gamma on the spline block, f = alpha A'1 on q minus [M C B]'y, and
   * -A q <= 0.
   */
  public @NotNull QuadraticProgram quadraticProgram() {
    final int size = n + 2 + nB;
    final DMatrixSparseTriplet regressors = new DMatrixSparseTriplet(n, size, 4 * n + b.nz_length);
    model.appendM(regressors, n, 0, 0, 1d);
    TonicSplineBasis.appendTrend(regressors, n, 0, n);
    basis.appendB(regressors, n, 0, n + 2);
    final DMatrixSparseCSC x = SparseMatrixUtils.toCsc(regressors);

    final DMatrixSparseCSC hessian = SparseMatrixUtils.add(SparseMatrixUtils.gram(x),
        SparseMatrixUtils.diagonal(size, n + 2, size, gamma));

    final double[] f = SparseMatrixUtils.multiplyTransposed(x, y);
    final double[] sparsity = driverPenalty();
    for (int i = 0; i < size; i++) {
      f[i] = (i < n ? sparsity[i] : 0d) - f[i];
    }

    final DMatrixSparseTriplet constraints = new DMatrixSparseTriplet(n, size, 3 * n);
    model.appendA(constraints, n, 0, 0, -1d);
    return new QuadraticProgram(hessian, f, SparseMatrixUtils.toCsc(constraints), new double[n]);
  }

  /**
   * Rows of G, top to bottom: -A q (orthant), the residual cone
   * {@code (1/2 + t1, 1/2 - t1, y - Mq - Cd - Bl)} and the ridge cone
   * {@code (1/2 + t2, 1/2 - t2, -l)}.
   */
  public @NotNull ConeProgram coneProgram() {
    final int t1 = n + 2;
    final int t2 = n + 3;
    final int l0 = n + 4;
    final int size = l0 + nB;
    final int rows = 2 * n + nB + 4;

    final DMatrixSparseTriplet g = new DMatrixSparseTriplet(rows, size,
        8 * n + b.nz_length + nB + 4);
    model.appendA(g, n, 0, 0, -1d);
    g.addItem(n, t1, -1d);
    g.addItem(n + 1, t1, 1d);
    model.appendM(g, n, n + 2, 0, 1d);
    TonicSplineBasis.appendTrend(g, n, n + 2, n);
    basis.appendB(g, n, n + 2, l0);
    g.addItem(2 * n + 2, t2, -1d);
    g.addItem(2 * n + 3, t2, 1d);
    for (int j = 0; j < nB; j++) {
      g.addItem(2 * n + 4 + j, l0 + j, 1d);
    }

    final double[] h = new double[rows];
    h[n] = 0.5d;
    h[n + 1] = 0.5d;
    System.arraycopy(y, 0, h, n + 2, n);
    h[2 * n + 2] = 0.5d;
    h[2 * n + 3] = 0.5d;

    final double[] objective = new double[size];
    System.arraycopy(driverPenalty(), 0, objective, 0, n);
    objective[t1] = 1d;
    objective[t2] = gamma;

    return new ConeProgram(objective, SparseMatrixUtils.toCsc(g), h,
        new ConeDimensions(n, new int[]{n + 2, nB + 2}));
  }

  /**
   * alpha * A'1
   */
  private double[] driverPenalty() {
    final double[] ones = new double[n];
    Arrays.fill(ones, alpha);
    return SparseMatrixUtils.multiplyTransposed(a, ones);
  }

  /**
   * Maps a solution x of either encoding back to signals. q is always the first n entries
   * and l always the last nB.
   */
  public @NotNull CvxEdaResult decode(double[] x, double objective, int iterations) {
    final double[] q = Arrays.copyOfRange(x, 0, n);
    final double[] d = Arrays.copyOfRange(x, n, n + 2);
    final double[] l = Arrays.copyOfRange(x, x.length - nB, x.length);

    final double[] spline = SparseMatrixUtils.multiply(b, l);
    final double[] trend = SparseMatrixUtils.multiply(c, d);
    final double[] tonic = new double[n];
    final double[] phasic = SparseMatrixUtils.multiply(m, q);
    final double[] residual = new double[n];
    for (int i = 0; i < n; i++) {
      tonic[i] = spline[i] + trend[i];
      residual[i] = y[i] - phasic[i] - tonic[i];
    }
    final double[] driver = SparseMatrixUtils.multiply(a, q);
    return new CvxEdaResult(tonic, phasic, driver, residual, d, l, objective, iterations);
  }

  /**
   * @return 1/2 y'y, the constant dropped from the quadratic program's objective
   */
  public double signalEnergy() {
    double sum = 0d;
    for (double v : y) {
      sum += v * v;
    }
    return 0.5d * sum;
  }
}
