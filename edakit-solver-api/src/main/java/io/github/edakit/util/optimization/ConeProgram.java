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

import org.ejml.data.DMatrixSparseCSC;
import org.jetbrains.annotations.NotNull;

/**
 * minimize c'x subject to h - Gx in K, where K is described by {@link ConeDimensions}.
 */
public record ConeProgram(double[] c, @NotNull DMatrixSparseCSC g, double[] h,
                          @NotNull ConeDimensions dims) {

  public ConeProgram {
    if (g.numCols != c.length || g.numRows != h.length) {
      throw new IllegalArgumentException(
          "G must be " + h.length + " x " + c.length + ", was " + g.numRows + " x " + g.numCols);
    }
    if (dims.size() != h.length) {
      throw new IllegalArgumentException(
          "Cone dimensions cover " + dims.size() + " entries but h has " + h.length);
    }
  }

  public int numVariables() {
    return c.length;
  }
}
