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

import io.github.edakit.modules.dataprocessing.eda_decompose.EdaDecompositionResult;
import org.jetbrains.annotations.NotNull;

/**
 * Full cvxEDA solution. Only tonic and phasic are part of the public result, the rest is kept for
 * diagnostics.
 *
 * @param tonic              B*l + C*d
 * @param phasic             M*q
 * @param driver             sparse SMNA driver A*q, non-negative up to solver tolerance
 * @param residual           signal - phasic - tonic
 * @param drift              trend coefficients d (offset, slope)
 * @param splineCoefficients tonic spline coefficients l
 * @param objective          value of the cvxEDA objective at the solution
 * @param iterations         solver iterations
 */
public record CvxEdaResult(double[] tonic, double[] phasic, double[] driver, double[] residual,
                           double[] drift, double[] splineCoefficients, double objective,
                           int iterations) {

  public @NotNull EdaDecompositionResult toDecompositionResult() {
    return new EdaDecompositionResult(tonic, phasic);
  }
}
