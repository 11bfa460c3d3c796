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

import java.util.Locale;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Encoding of the cvxEDA problem handed to the solver. Both yield the same optimum.
 */
public enum CvxEdaSolverVariant {
  /**
   * Quadratic objective over [q; d; l] with A q >= 0.
   */
  QUADRATIC_PROGRAM,
  /**
   * Linear objective with both squared norms moved into rotated second-order cones.
   */
  CONE_PROGRAM;

  /**
   * @param name {@code qp}, {@code conelp} or {@code cone}, case-insensitive. Null or blank
   *             selects the quadratic program.
   */
  public static @NotNull CvxEdaSolverVariant fromString(@Nullable String name) {
    if (name == null || name.isBlank()) {
      return QUADRATIC_PROGRAM;
    }
    return switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "qp" -> QUADRATIC_PROGRAM;
      case "conelp", "cone" -> CONE_PROGRAM;
      default -> throw new IllegalArgumentException(
          "Unknown cvxEDA solver variant '" + name + "', use qp or conelp");
    };
  }
}
