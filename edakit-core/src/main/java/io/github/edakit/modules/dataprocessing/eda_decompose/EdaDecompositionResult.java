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

/**
 * Public result of every decomposition method: two columns of the signal's length.
 */
public record EdaDecompositionResult(double[] tonic, double[] phasic) {

  public static final String TONIC = "EDA_Tonic";
  public static final String PHASIC = "EDA_Phasic";

  public EdaDecompositionResult {
    if (tonic.length != phasic.length) {
      throw new IllegalArgumentException(
          "Tonic and phasic differ in length: " + tonic.length + " vs " + phasic.length);
    }
  }

  public int length() {
    return tonic.length;
  }
}
