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

/**
 * Tolerances and limits for a single solve. Passed explicitly with every problem, so two solves
 * running side by side never see each other's settings.
 *
 * @param absoluteTolerance absolute duality gap at which a feasible iterate is accepted
 * @param relativeTolerance duality gap relative to the objective at which a feasible iterate is
 *                          accepted
 * @param feasibilityTolerance maximum normalized primal and dual residual
 * @param maxIterations     interior-point iteration cap
 * @param showProgress      log every iteration at FINE
 */
public record SolverOptions(double absoluteTolerance, double relativeTolerance,
                            double feasibilityTolerance, int maxIterations,
                            boolean showProgress) {

  public static final SolverOptions DEFAULT = new SolverOptions(1e-7, 1e-6, 1e-7, 100, false);

  public SolverOptions {
    if (!(absoluteTolerance > 0d) || !(relativeTolerance > 0d) || !(feasibilityTolerance > 0d)) {
      throw new IllegalArgumentException("Solver tolerances must be positive");
    }
    if (maxIterations < 1) {
      throw new IllegalArgumentException("maxIterations must be at least 1, was " + maxIterations);
    }
  }

  public SolverOptions withRelativeTolerance(double relativeTolerance) {
    return new SolverOptions(absoluteTolerance, relativeTolerance, feasibilityTolerance,
        maxIterations, showProgress);
  }

  public SolverOptions withMaxIterations(int maxIterations) {
    return new SolverOptions(absoluteTolerance, relativeTolerance, feasibilityTolerance,
        maxIterations, showProgress);
  }

  public SolverOptions withShowProgress(boolean showProgress) {
    return new SolverOptions(absoluteTolerance, relativeTolerance, feasibilityTolerance,
        maxIterations, showProgress);
  }
}
