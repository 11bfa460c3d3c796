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

package io.github.edakit.util.optimization;

import io.github.edakit.util.SparseMatrixUtils;
import java.util.logging.Logger;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.DMatrixSparseCSC;
import org.ejml.interfaces.linsol.LinearSolverSparse;
import org.ejml.sparse.FillReducing;
import org.ejml.sparse.csc.factory.LinearSolverFactory_DSCC;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Factored form of the reduced Newton matrix {@code P + G' W^-2 G}.
 * <p>
 * The sparse part {@code P + (DG)'(DG)} is Cholesky factored with EJML. Second-order cones add
 * two rank-one terms each, which are applied through the Woodbury identity with a small dense
 * capacitance matrix, so a long second-order cone never densifies the sparse factor.
 */
final class ReducedKktSystem {

  private static final Logger logger = Logger.getLogger(ReducedKktSystem.class.getName());

  /**
   * Relative diagonal shift tried once when the plain factorization fails.
   */
  private static final double REGULARIZATION = 1e-12;

  /**
   * Refinement steps against the exact operator after every solve.
   */
  private static final int REFINEMENT_STEPS = 2;

  private final LinearSolverSparse<DMatrixSparseCSC, DMatrixRMaj> cholesky;
  private final DMatrixSparseCSC p;
  private final DMatrixSparseCSC g;
  private final ConeScaling scaling;
  private final int size;
  private final double[][] lowRankColumns;
  private final double[][] correctedColumns;
  private final DecompositionSolver capacitance;

  private ReducedKktSystem(LinearSolverSparse<DMatrixSparseCSC, DMatrixRMaj> cholesky,
      @Nullable DMatrixSparseCSC p, DMatrixSparseCSC g, ConeScaling scaling,
      double[][] lowRankColumns, double[][] correctedColumns,
      @Nullable DecompositionSolver capacitance) {
    this.cholesky = cholesky;
    this.p = p;
    this.g = g;
    this.scaling = scaling;
    this.size = g.numCols;
    this.lowRankColumns = lowRankColumns;
    this.correctedColumns = correctedColumns;
    this.capacitance = capacitance;
  }

  /**
   * @param p quadratic term or null for a linear objective
   * @return the factored system or null if it is numerically singular
   */
  static @Nullable ReducedKktSystem factor(@Nullable DMatrixSparseCSC p,
      @NotNull DMatrixSparseCSC g, @NotNull ConeScaling scaling) {
    final int n = g.numCols;
    DMatrixSparseCSC k = SparseMatrixUtils.gram(
        SparseMatrixUtils.scaleRows(g, scaling.rowScale()));
    if (p != null) {
      k = SparseMatrixUtils.add(k, p);
    }

    LinearSolverSparse<DMatrixSparseCSC, DMatrixRMaj> cholesky = LinearSolverFactory_DSCC.cholesky(
        FillReducing.NONE);
    if (!cholesky.setA(k)) {
      final double shift = REGULARIZATION * Math.max(1d, SparseMatrixUtils.maxAbsDiagonal(k));
      logger.fine(
          () -> "Reduced Newton matrix not positive definite, retrying with shift " + shift);
      cholesky = LinearSolverFactory_DSCC.cholesky(FillReducing.NONE);
      if (!cholesky.setA(SparseMatrixUtils.add(k, SparseMatrixUtils.diagonal(n, 0, n, shift)))) {
        return null;
      }
    }

    if (!scaling.hasLowRankTerms()) {
      return new ReducedKktSystem(cholesky, p, g, scaling, new double[0][], new double[0][],
          null);
    }

    // Y = [G'a_k, G'e_k] per cone, Sigma = diag(w_k, -w_k)
    final ConeDimensions dims = scaling.dims();
    final int cones = dims.numSecondOrderCones();
    final double[][] y = new double[2 * cones][];
    final double[] sigma = new double[2 * cones];
    for (int c = 0; c < cones; c++) {
      final double[] e = new double[dims.size()];
      e[dims.secondOrderOffset(c)] = 1d;
      y[2 * c] = SparseMatrixUtils.multiplyTransposed(g, scaling.lowRankVector(c));
      y[2 * c + 1] = SparseMatrixUtils.multiplyTransposed(g, e);
      sigma[2 * c] = scaling.lowRankWeight(c);
      sigma[2 * c + 1] = -scaling.lowRankWeight(c);
    }

    final DMatrixRMaj rhs = new DMatrixRMaj(n, y.length);
    for (int j = 0; j < y.length; j++) {
      for (int i = 0; i < n; i++) {
        rhs.unsafe_set(i, j, y[j][i]);
      }
    }
    final DMatrixRMaj solved = new DMatrixRMaj(n, y.length);
    cholesky.solve(rhs, solved);
    final double[][] z = new double[y.length][n];
    for (int j = 0; j < y.length; j++) {
      for (int i = 0; i < n; i++) {
        z[j][i] = solved.unsafe_get(i, j);
      }
    }

    // Sigma^-1 + Y' K^-1 Y
    final RealMatrix cap = new Array2DRowRealMatrix(y.length, y.length);
    for (int a = 0; a < y.length; a++) {
      for (int b = 0; b < y.length; b++) {
        cap.setEntry(a, b, ConeAlgebra.dot(y[a], z[b]) + (a == b ? 1d / sigma[a] : 0d));
      }
    }
    final DecompositionSolver capSolver = new LUDecomposition(cap).getSolver();
    if (!capSolver.isNonSingular()) {
      return null;
    }
    return new ReducedKktSystem(cholesky, p, g, scaling, y, z, capSolver);
  }

  /**
   * @return the solution of {@code (P + G'W^-2 G) x = rhs}
   */
  double[] solve(double[] rhs) {
    final double[] x = solveFactored(rhs);
    // near the optimum W^-2 spans many decades and the capacitance solve degenerates
    for (int step = 0; step < REFINEMENT_STEPS; step++) {
      final double[] ax = multiply(x);
      final double[] residual = new double[size];
      for (int i = 0; i < size; i++) {
        residual[i] = rhs[i] - ax[i];
      }
      final double[] correction = solveFactored(residual);
      for (int i = 0; i < size; i++) {
        x[i] += correction[i];
      }
    }
    return x;
  }

  /**
   * @return (P + G'W^-2 G) x applied without the factorization
   */
  private double[] multiply(double[] x) {
    final double[] gx = SparseMatrixUtils.multiply(g, x);
    final double[] result = SparseMatrixUtils.multiplyTransposed(g,
        scaling.applyInverseSquare(gx));
    if (p != null) {
      final double[] px = SparseMatrixUtils.multiply(p, x);
      for (int i = 0; i < size; i++) {
        result[i] += px[i];
      }
    }
    return result;
  }

  private double[] solveFactored(double[] rhs) {
    final DMatrixRMaj b = new DMatrixRMaj(size, 1);
    System.arraycopy(rhs, 0, b.data, 0, size);
    final DMatrixRMaj x = new DMatrixRMaj(size, 1);
    cholesky.solve(b, x);
    final double[] result = x.data.clone();
    if (lowRankColumns.length == 0) {
      return result;
    }
    final double[] t = new double[lowRankColumns.length];
    for (int j = 0; j < t.length; j++) {
      t[j] = ConeAlgebra.dot(lowRankColumns[j], result);
    }
    final double[] coef = capacitance.solve(new ArrayRealVector(t, false)).toArray();
    for (int j = 0; j < coef.length; j++) {
      final double[] col = correctedColumns[j];
      for (int i = 0; i < size; i++) {
        result[i] -= coef[j] * col[i];
      }
    }
    return result;
  }
}
