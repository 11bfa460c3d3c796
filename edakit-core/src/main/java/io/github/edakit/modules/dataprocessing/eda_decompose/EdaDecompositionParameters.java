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

package io.github.edakit.modules.dataprocessing.eda_decompose;

import io.github.edakit.modules.dataprocessing.eda_decompose.cvxeda.CvxEdaSolverVariant;
import java.util.Properties;
import org.jetbrains.annotations.NotNull;

/**
 * Tuning of all decomposition methods. The cvxEDA fields are ignored by the filter methods and
 * vice versa.
 *
 * @param tau0            slow time constant of the Bateman function in s
 * @param tau1            fast time constant of the Bateman function in s
 * @param deltaKnot       time between knots of the tonic spline in s
 * @param alpha           penalty on the SMNA driver
 * @param gamma           ridge penalty on the spline coefficients
 * @param reltol          relative duality gap the solver has to reach
 * @param solverVariant   encoding handed to the solver
 * @param smoothingFactor median window in seconds
 * @param filterCutoff    tonic/phasic split frequency of the high-pass method in Hz
 */
public record EdaDecompositionParameters(double tau0, double tau1, double deltaKnot, double alpha,
                                         double gamma, double reltol,
                                         @NotNull CvxEdaSolverVariant solverVariant,
                                         int smoothingFactor, double filterCutoff) {

  public static final EdaDecompositionParameters DEFAULT = new EdaDecompositionParameters(2.0,
      0.7, 10.0, 8e-4, 1e-2, 1e-9, CvxEdaSolverVariant.QUADRATIC_PROGRAM, 4, 0.05);

  public EdaDecompositionParameters {
    if (!(reltol > 0d)) {
      throw new IllegalArgumentException("reltol must be positive, was " + reltol);
    }
    if (smoothingFactor < 1) {
      throw new IllegalArgumentException(
          "smoothingFactor must be at least 1 s, was " + smoothingFactor);
    }
    if (!(filterCutoff > 0d)) {
      throw new IllegalArgumentException("filterCutoff must be positive, was " + filterCutoff);
    }
    if (!(alpha >= 0d) || !(gamma >= 0d)) {
      throw new IllegalArgumentException(
          "alpha and gamma must not be negative, were " + alpha + " and " + gamma);
    }
  }

  /**
   * Reads {@code tau0, tau1, deltaKnot, alpha, gamma, reltol, solver, smoothingFactor,
   * filterCutoff}, falling back to {@link #DEFAULT} for missing keys.
   *
   * @throws IllegalArgumentException for values that do not parse
   */
  public static @NotNull EdaDecompositionParameters fromProperties(@NotNull Properties props) {
    final EdaDecompositionParameters d = DEFAULT;
    return new EdaDecompositionParameters( //
        doubleProp(props, "tau0", d.tau0), //
        doubleProp(props, "tau1", d.tau1), //
        doubleProp(props, "deltaKnot", d.deltaKnot), //
        doubleProp(props, "alpha", d.alpha), //
        doubleProp(props, "gamma", d.gamma), //
        doubleProp(props, "reltol", d.reltol), //
        props.containsKey("solver") ? CvxEdaSolverVariant.fromString(props.getProperty("solver"))
            : d.solverVariant, //
        intProp(props, "smoothingFactor", d.smoothingFactor), //
        doubleProp(props, "filterCutoff", d.filterCutoff));
  }

  private static double doubleProp(Properties props, String key, double def) {
    final String value = props.getProperty(key);
    return value == null || value.isBlank() ? def : Double.parseDouble(value.trim());
  }

  private static int intProp(Properties props, String key, int def) {
    final String value = props.getProperty(key);
    return value == null || value.isBlank() ? def : Integer.parseInt(value.trim());
  }

  public EdaDecompositionParameters withTimeConstants(double tau0, double tau1) {
    return new EdaDecompositionParameters(tau0, tau1, deltaKnot, alpha, gamma, reltol,
        solverVariant, smoothingFactor, filterCutoff);
  }

  public EdaDecompositionParameters withDeltaKnot(double deltaKnot) {
    return new EdaDecompositionParameters(tau0, tau1, deltaKnot, alpha, gamma, reltol,
        solverVariant, smoothingFactor, filterCutoff);
  }

  public EdaDecompositionParameters withReltol(double reltol) {
    return new EdaDecompositionParameters(tau0, tau1, deltaKnot, alpha, gamma, reltol,
        solverVariant, smoothingFactor, filterCutoff);
  }

  public EdaDecompositionParameters withSolverVariant(@NotNull CvxEdaSolverVariant variant) {
    return new EdaDecompositionParameters(tau0, tau1, deltaKnot, alpha, gamma, reltol, variant,
        smoothingFactor, filterCutoff);
  }

  public EdaDecompositionParameters withSmoothingFactor(int smoothingFactor) {
    return new EdaDecompositionParameters(tau0, tau1, deltaKnot, alpha, gamma, reltol,
        solverVariant, smoothingFactor, filterCutoff);
  }
}
