/*
 * Copyright (c) 2025 The edakit Development Team
 */

package io.github.edakit.util.optimization;

import io.github.edakit.util.SparseMatrixUtils;
import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class InteriorPointConeSolverTest {

  private final InteriorPointConeSolver solver = new InteriorPointConeSolver();

  private static DMatrixSparseCSC matrix(double[][] dense) {
    final DMatrixSparseTriplet triplet = new DMatrixSparseTriplet(dense.length, dense[0].length,
        dense.length);
    for (int i = 0; i < dense.length; i++) {
      for (int j = 0; j < dense[i].length; j++) {
        if (dense[i][j] != 0d) {
          triplet.addItem(i, j, dense[i][j]);
        }
      }
    }
    return SparseMatrixUtils.toCsc(triplet);
  }

  @Test
  void testProjectionOntoOrthant() {
    // minimize 1/2 ||x - a||^2 subject to x >= 0
    final double[] a = {1.5, -2.0, 0.25, -0.1, 3.0};
    final int n = a.length;
    final double[] c = new double[n];
    for (int i = 0; i < n; i++) {
      c[i] = -a[i];
    }
    final QuadraticProgram qp = new QuadraticProgram(SparseMatrixUtils.diagonal(n, 0, n, 1d), c,
        SparseMatrixUtils.diagonal(n, 0, n, -1d), new double[n]);

    final SolverResult result = solver.solve(qp, SolverOptions.DEFAULT);

    Assertions.assertEquals(SolverStatus.OPTIMAL, result.status());
    for (int i = 0; i < n; i++) {
      Assertions.assertEquals(Math.max(a[i], 0d), result.x()[i], 1e-5);
    }
  }

  @Test
  void testEqualityLikeQuadraticProgram() {
    // minimize x1^2 + x2^2 subject to x1 + x2 >= 2, optimum (1, 1)
    final QuadraticProgram qp = new QuadraticProgram(matrix(new double[][]{{2, 0}, {0, 2}}),
        new double[2], matrix(new double[][]{{-1, -1}}), new double[]{-2});

    final SolverResult result = solver.solve(qp, SolverOptions.DEFAULT);

    Assertions.assertTrue(result.isOptimal());
    Assertions.assertEquals(1d, result.x()[0], 1e-5);
    Assertions.assertEquals(1d, result.x()[1], 1e-5);
    Assertions.assertEquals(2d, result.primalObjective(), 1e-5);
  }

  @Test
  void testSecondOrderConeProgram() {
    // minimize x1 + x2 subject to ||(x1, x2)|| <= 1
    final DMatrixSparseCSC g = matrix(new double[][]{{0, 0}, {-1, 0}, {0, -1}});
    final ConeProgram cp = new ConeProgram(new double[]{1, 1}, g, new double[]{1, 0, 0},
        new ConeDimensions(0, new int[]{3}));

    final SolverResult result = solver.solve(cp, SolverOptions.DEFAULT);

    Assertions.assertEquals(SolverStatus.OPTIMAL, result.status());
    final double expected = -1d / Math.sqrt(2d);
    Assertions.assertEquals(expected, result.x()[0], 1e-5);
    Assertions.assertEquals(expected, result.x()[1], 1e-5);
    Assertions.assertEquals(-Math.sqrt(2d), result.primalObjective(), 1e-6);
  }

  @Test
  void testOrthantAndSecondOrderCone() {
    // minimize -x1 - x2 subject to x1 <= 0.5, ||(x1, x2)|| <= 1, optimum (0.5, sqrt(0.75))
    final DMatrixSparseCSC g = matrix(new double[][]{{1, 0}, {0, 0}, {-1, 0}, {0, -1}});
    final ConeProgram cp = new ConeProgram(new double[]{-1, -1}, g, new double[]{0.5, 1, 0, 0},
        new ConeDimensions(1, new int[]{3}));

    final SolverResult result = solver.solve(cp, SolverOptions.DEFAULT);

    Assertions.assertTrue(result.isOptimal());
    Assertions.assertEquals(0.5, result.x()[0], 1e-5);
    Assertions.assertEquals(Math.sqrt(0.75), result.x()[1], 1e-5);
  }

  @Test
  void testRotatedConeBoundsSquaredNorm() {
    // minimize t - 2 x subject to t >= 1/2 x^2, i.e. (1/2 + t, 1/2 - t, x) in Q. Optimum x = 2
    final DMatrixSparseCSC g = matrix(new double[][]{{0, -1}, {0, 1}, {-1, 0}});
    final ConeProgram cp = new ConeProgram(new double[]{-2, 1}, g, new double[]{0.5, 0.5, 0},
        new ConeDimensions(0, new int[]{3}));

    final SolverResult result = solver.solve(cp, SolverOptions.DEFAULT);

    Assertions.assertTrue(result.isOptimal());
    Assertions.assertEquals(2d, result.x()[0], 1e-4);
    Assertions.assertEquals(2d, result.x()[1], 1e-4);
    Assertions.assertEquals(-2d, result.primalObjective(), 1e-6);
  }

  @Test
  void testIterationLimit() {
    final double[] a = {1.5, -2.0, 0.25};
    final QuadraticProgram qp = new QuadraticProgram(SparseMatrixUtils.diagonal(3, 0, 3, 1d),
        new double[]{-a[0], -a[1], -a[2]}, SparseMatrixUtils.diagonal(3, 0, 3, -1d),
        new double[3]);

    final SolverResult result = solver.solve(qp, SolverOptions.DEFAULT.withMaxIterations(1));

    Assertions.assertEquals(SolverStatus.ITERATION_LIMIT, result.status());
    Assertions.assertFalse(result.isOptimal());
  }

  @Test
  void testIterationLimitReturnsNearOptimalIterate() {
    final double[] a = {1.5, -2.0, 0.25};
    final QuadraticProgram qp = new QuadraticProgram(SparseMatrixUtils.diagonal(3, 0, 3, 1d),
        new double[]{-a[0], -a[1], -a[2]}, SparseMatrixUtils.diagonal(3, 0, 3, -1d),
        new double[3]);
    // gap tolerances below anything the iterates reach
    final SolverOptions options = new SolverOptions(1e-300, 1e-300, 1e-7, 8, false);

    final SolverResult result = solver.solve(qp, options);

    Assertions.assertEquals(SolverStatus.OPTIMAL_INACCURATE, result.status());
    Assertions.assertFalse(result.isOptimal());
    Assertions.assertTrue(result.hasSolution());
    Assertions.assertEquals(1.5, result.x()[0], 1e-6);
    Assertions.assertEquals(0d, result.x()[1], 1e-6);
    Assertions.assertEquals(0.25, result.x()[2], 1e-6);
  }

  @Test
  void testDistanceFromOptimum() {
    Assertions.assertEquals(0.2,
        InteriorPointConeSolver.distanceFromOptimum(1e-5, 1e-5, 1e-3, 1e-5), 1e-12);
    Assertions.assertEquals(2d,
        InteriorPointConeSolver.distanceFromOptimum(1e-5, 2e-4, 1e-6, 1e-6), 1e-12);
    // undefined relative gap falls back to the absolute gap
    Assertions.assertEquals(2d,
        InteriorPointConeSolver.distanceFromOptimum(0d, 0d, 1e-4, Double.NaN), 1e-12);
  }

  @Test
  void testProblemIsNotModified() {
    final double[] c = {-1.5, 2.0};
    final double[] h = {0, 0};
    final QuadraticProgram qp = new QuadraticProgram(SparseMatrixUtils.diagonal(2, 0, 2, 1d), c,
        SparseMatrixUtils.diagonal(2, 0, 2, -1d), h);

    solver.solve(qp, SolverOptions.DEFAULT);

    Assertions.assertArrayEquals(new double[]{-1.5, 2.0}, c);
    Assertions.assertArrayEquals(new double[]{0, 0}, h);
  }

  @Test
  void testBackendIsRegistered() {
    final ConvexSolverBackend backend = ConvexSolverBackends.lookup().orElseThrow();
    Assertions.assertInstanceOf(InteriorPointConeSolver.class, backend);
  }

  @Test
  void testInvalidOptions() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new SolverOptions(0d, 1e-6, 1e-7, 100, false));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> SolverOptions.DEFAULT.withMaxIterations(0));
  }
}
