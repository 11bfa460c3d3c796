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

import org.jetbrains.annotations.NotNull;

/**
 * Convex optimization capability used by the cvxEDA decomposition. Implementations are discovered
 * with {@link java.util.ServiceLoader}, see {@link ConvexSolverBackends}.
 * <p>
 * Implementations must not keep state between solves and must not modify the problem passed in.
 */
public interface ConvexSolverBackend {

  @NotNull String getName();

  /**
   * Solve a quadratic program with linear inequality constraints.
   */
  @NotNull SolverResult solve(@NotNull QuadraticProgram problem, @NotNull SolverOptions options);

  /**
   * Solve a linear cone program over a product of an orthant and second-order cones.
   */
  @NotNull SolverResult solve(@NotNull ConeProgram problem, @NotNull SolverOptions options);
}
