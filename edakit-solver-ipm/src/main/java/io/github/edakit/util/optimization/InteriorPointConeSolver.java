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
import java.util.logging.Level;
import java.util.logging.Logger;
import org.ejml.data.DMatrixSparseCSC;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Primal-dual interior-point method for
 * <pre>
 *   minimize    1/2 x'Px + c'x
 *   subject to  Gx + s = h,  s in K
 * </pre>
 * where K is a product of a non-negative orthant and second-order cones. Iterates are scaled with
 * Nesterov-Todd scaling and advanced with Mehrotra predictor-corrector steps. Each iteration
 * factors the reduced matrix {@code P + G'W^-2 G} once and reuses it for both steps.
 * <p>
 * Badly scaled problems can stall short of the requested tolerances: the dual residual stops
 * improving while the gap is already small. The solver keeps the iterate closest to optimality
 * and, when it stalls, breaks down or runs out of iterations, returns that iterate as
 * {@link SolverStatus#OPTIMAL_INACCURATE} if it meets the relaxed tolerances below.
 * <p>
 * Stateless: every call allocates its own iterates, so one instance can serve concurrent solves.
 */
public class InteriorPointConeSolver implements ConvexSolverBackend {

  private static final Logger logger = Logger.getLogger(InteriorPointConeSolver.class.getName());

  private static final double STEP_FRACTION = 0.99d;
  private static final double CENTERING_EXPONENT = 3d;

  private static final double INACCURATE_FEASIBILITY_TOLERANCE = 1e-4;
  private static final double INACCURATE_ABSOLUTE_TOLERANCE = 5e-5;
  private static final double INACCURATE_RELATIVE_TOLERANCE = 5e-5;
  /**
   * Iterations without a better iterate, once the gap tolerance is met, before giving up.
   */
  private static final int STALL_ITERATIONS = 5;

  @Override
  public @NotNull String getName() {
    return "Interior point (EJML sparse Cholesky)";
  }

  @Override
  public @NotNull SolverResult solve(@NotNull QuadraticProgram problem,
      @NotNull SolverOptions options) {
    return solve(problem.p(), problem.c(), problem.g(), problem.h(),
        ConeDimensions.orthant(problem.numConstraints()), options);
  }

  @Override
  public @NotNull SolverResult solve(@NotNull ConeProgram problem,
      @NotNull SolverOptions options) {
    return solve(null, problem.c(), problem.g(), problem.h(), problem.dims(), options);
  }

  private @NotNull SolverResult solve(@Nullable DMatrixSparseCSC p, double[] c,
      @NotNull DMatrixSparseCSC g, double[] h, @NotNull ConeDimensions dims,
      @NotNull SolverOptions options) {
    final int m = h.length;
    final double degree = dims.degree();
    final double resx0 = Math.max(1d, ConeAlgebra.norm(c));
    final double resz0 = Math.max(1d, ConeAlgebra.norm(h));

    // initial point from the least-squares problem with identity scaling
    final ReducedKktSystem init = ReducedKktSystem.factor(p, g, ConeScaling.identity(dims));
    if (init == null) {
      logger.fine("Initial reduced Newton matrix is singular");
      return breakdown(new double[c.length], new double[m], new double[m], 0);
    }
    final double[] gth = SparseMatrixUtils.multiplyTransposed(g, h);
    final double[] rhs0 = new double[c.length];
    for (int i = 0; i < rhs0.length; i++) {
      rhs0[i] = gth[i] - c[i];
    }
    double[] x = init.solve(rhs0);
    final double[] gx0 = SparseMatrixUtils.multiply(g, x);
    final double[] r = new double[m];
    for (int i = 0; i < m; i++) {
      r[i] = h[i] - gx0[i];
    }
    double[] s = ConeAlgebra.shiftIntoInterior(dims, r);
    final double[] negR = new double[m];
    for (int i = 0; i < m; i++) {
      negR[i] = -r[i];
    }
    double[] z = ConeAlgebra.shiftIntoInterior(dims, negR);

    SolverResult best = null;
    double bestScore = Double.POSITIVE_INFINITY;
    for (int iteration = 0; ; iteration++) {
      final double[] px = p == null ? new double[x.length] : SparseMatrixUtils.multiply(p, x);
      final double[] gtz = SparseMatrixUtils.multiplyTransposed(g, z);
      final double[] gx = SparseMatrixUtils.multiply(g, x);
      final double[] rx = new double[x.length];
      for (int i = 0; i < rx.length; i++) {
        rx[i] = px[i] + c[i] + gtz[i];
      }
      final double[] rz = new double[m];
      for (int i = 0; i < m; i++) {
        rz[i] = gx[i] + s[i] - h[i];
      }

      final double gap = ConeAlgebra.dot(s, z);
      final double pcost = 0.5d * ConeAlgebra.dot(x, px) + ConeAlgebra.dot(c, x);
      final double dcost = pcost + ConeAlgebra.dot(z, rz) - gap;
      final double relgap;
      if (pcost < 0d) {
        relgap = gap / -pcost;
      } else if (dcost > 0d) {
        relgap = gap / dcost;
      } else {
        relgap = Double.NaN;
      }
      final double pres = ConeAlgebra.norm(rz) / resz0;
      final double dres = ConeAlgebra.norm(rx) / resx0;

      if (options.showProgress() && logger.isLoggable(Level.FINE)) {
        logger.fine(
            String.format("%3d: pcost % .8e dcost % .8e gap %.1e pres %.1e dres %.1e", iteration,
                pcost, dcost, gap, pres, dres));
      }

      final boolean gapReached = gap <= options.absoluteTolerance() || (!Double.isNaN(relgap)
          && relgap <= options.relativeTolerance());
      if (pres <= options.feasibilityTolerance() && dres <= options.feasibilityTolerance()
          && gapReached) {
        logger.fine("Optimal solution found after " + iteration + " iterations");
        return new SolverResult(SolverStatus.OPTIMAL, x, s, z, pcost, dcost, gap, pres, dres,
            iteration);
      }

      final double score = distanceFromOptimum(pres, dres, gap, relgap);
      if (score < bestScore) {
        bestScore = score;
        best = new SolverResult(SolverStatus.OPTIMAL_INACCURATE, x, s, z, pcost, dcost, gap, pres,
            dres, iteration);
      }
      if (gapReached && best != null && iteration - best.iterations() >= STALL_ITERATIONS) {
        logger.fine("No progress since iteration " + best.iterations());
        return closestOrElse(best, bestScore,
            new SolverResult(SolverStatus.NUMERICAL_BREAKDOWN, x, s, z, pcost, dcost, gap, pres,
                dres, iteration));
      }
      if (iteration == options.maxIterations()) {
        logger.fine("Iteration limit " + options.maxIterations() + " reached");
        return closestOrElse(best, bestScore,
            new SolverResult(SolverStatus.ITERATION_LIMIT, x, s, z, pcost, dcost, gap, pres, dres,
                iteration));
      }

      final ConeScaling scaling = ConeScaling.compute(dims, s, z);
      if (scaling == null) {
        logger.fine("Iterate left the cone interior");
        return closestOrElse(best, bestScore, breakdown(x, s, z, iteration));
      }
      final ReducedKktSystem kkt = ReducedKktSystem.factor(p, g, scaling);
      if (kkt == null) {
        logger.fine("Reduced Newton matrix is singular");
        return closestOrElse(best, bestScore, breakdown(x, s, z, iteration));
      }
      final double mu = gap / degree;
      final double[] lambda = scaling.lambda();
      final double[] lambdaSq = ConeAlgebra.product(dims, lambda, lambda);

      // predictor
      final Direction affine = newtonStep(g, kkt, scaling, rx, rz, lambdaSq);
      final double alphaAffine = Math.min(1d,
          Math.min(ConeAlgebra.maxStep(dims, s, affine.ds), ConeAlgebra.maxStep(dims, z,
              affine.dz)));
      double affineGap = 0d;
      for (int i = 0; i < m; i++) {
        affineGap += (s[i] + alphaAffine * affine.ds[i]) * (z[i] + alphaAffine * affine.dz[i]);
      }
      final double sigma = Math.min(1d,
          Math.max(0d, Math.pow(Math.max(affineGap, 0d) / gap, CENTERING_EXPONENT)));

      // corrector with second-order term and centering
      final double[] cross = ConeAlgebra.product(dims, scaling.applyInverse(affine.ds),
          scaling.apply(affine.dz));
      final double[] e = ConeAlgebra.identity(dims);
      final double[] ds = new double[m];
      for (int i = 0; i < m; i++) {
        ds[i] = lambdaSq[i] + cross[i] - sigma * mu * e[i];
      }
      final Direction step = newtonStep(g, kkt, scaling, rx, rz, ds);
      final double alpha = Math.min(1d, STEP_FRACTION * Math.min(
          ConeAlgebra.maxStep(dims, s, step.ds), ConeAlgebra.maxStep(dims, z, step.dz)));

      final double[] nextX = x.clone();
      for (int i = 0; i < nextX.length; i++) {
        nextX[i] += alpha * step.dx[i];
      }
      final double[] nextS = s.clone();
      final double[] nextZ = z.clone();
      for (int i = 0; i < m; i++) {
        nextS[i] += alpha * step.ds[i];
        nextZ[i] += alpha * step.dz[i];
      }
      x = nextX;
      s = nextS;
      z = nextZ;
    }
  }

  /**
   * Solves the linearized KKT conditions
   * <pre>
   *   P dx + G'dz        = -rx
   *   G dx + ds          = -rz
   *   lambda o (W^-1 ds + W dz) = -rs
   * </pre>
   */
  private static Direction newtonStep(@NotNull DMatrixSparseCSC g, @NotNull ReducedKktSystem kkt,
      @NotNull ConeScaling scaling, double[] rx, double[] rz, double[] rs) {
    final ConeDimensions dims = scaling.dims();
    final double[] negRs = new double[rs.length];
    for (int i = 0; i < rs.length; i++) {
      negRs[i] = -rs[i];
    }
    final double[] u = ConeAlgebra.divide(dims, scaling.lambda(), negRs);
    final double[] winvU = scaling.applyInverse(u);
    final double[] w2invRz = scaling.applyInverseSquare(rz);

    final double[] slackTerm = new double[rz.length];
    for (int i = 0; i < slackTerm.length; i++) {
      slackTerm[i] = winvU[i] + w2invRz[i];
    }
    final double[] gt = SparseMatrixUtils.multiplyTransposed(g, slackTerm);
    final double[] rhs = new double[rx.length];
    for (int i = 0; i < rhs.length; i++) {
      rhs[i] = -rx[i] - gt[i];
    }
    final double[] dx = kkt.solve(rhs);

    final double[] gdx = SparseMatrixUtils.multiply(g, dx);
    for (int i = 0; i < gdx.length; i++) {
      gdx[i] += rz[i];
    }
    final double[] dz = scaling.applyInverseSquare(gdx);
    for (int i = 0; i < dz.length; i++) {
      dz[i] += winvU[i];
    }
    // ds = W u - W^2 dz in exact arithmetic, the primal equation keeps rz exact
    final double[] ds = new double[dz.length];
    for (int i = 0; i < ds.length; i++) {
      ds[i] = -gdx[i];
    }
    return new Direction(dx, ds, dz);
  }

  /**
   * @return at most 1 when the iterate meets the near-optimal tolerances
   */
  static double distanceFromOptimum(double pres, double dres, double gap, double relgap) {
    double gapScore = gap / INACCURATE_ABSOLUTE_TOLERANCE;
    if (!Double.isNaN(relgap)) {
      gapScore = Math.min(gapScore, relgap / INACCURATE_RELATIVE_TOLERANCE);
    }
    final double feasibilityScore = Math.max(pres, dres) / INACCURATE_FEASIBILITY_TOLERANCE;
    return Math.max(feasibilityScore, gapScore);
  }

  private static SolverResult closestOrElse(@Nullable SolverResult best, double bestScore,
      @NotNull SolverResult failure) {
    if (best != null && bestScore <= 1d) {
      logger.fine(() -> "Returning near-optimal iterate " + best.iterations() + " instead of "
          + failure.status());
      return best;
    }
    return failure;
  }

  private static SolverResult breakdown(double[] x, double[] s, double[] z, int iteration) {
    return new SolverResult(SolverStatus.NUMERICAL_BREAKDOWN, x, s, z, Double.NaN, Double.NaN,
        Double.NaN, Double.NaN, Double.NaN, iteration);
  }

  private record Direction(double[] dx, double[] ds, double[] dz) {

  }
}
