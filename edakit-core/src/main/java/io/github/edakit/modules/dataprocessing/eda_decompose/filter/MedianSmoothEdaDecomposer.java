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

package io.github.edakit.modules.dataprocessing.eda_decompose.filter;

import io.github.edakit.modules.dataprocessing.eda_decompose.EdaDecomposer;
import io.github.edakit.modules.dataprocessing.eda_decompose.EdaDecompositionResult;
import io.github.edakit.util.signal.SignalSmoothing;
import org.jetbrains.annotations.NotNull;

public class MedianSmoothEdaDecomposer implements EdaDecomposer {

  private final int smoothingFactor;

  public MedianSmoothEdaDecomposer() {
    this(4);
  }

  /**
   * @param smoothingFactor median window length in seconds
   */
  public MedianSmoothEdaDecomposer(int smoothingFactor) {
    if (smoothingFactor < 1) {
      throw new IllegalArgumentException(
          "Smoothing factor must be at least 1 s, was " + smoothingFactor);
    }
    this.smoothingFactor = smoothingFactor;
  }

  @Override
  public @NotNull String getName() {
    return "Median smoothing";
  }

  /**
   * Tonic is the running median over {@code smoothingFactor * samplingRate} samples, phasic is the
   * signal minus the tonic.
   *
   * @throws IllegalArgumentException if the window length overflows an int
   */
  @Override
  public @NotNull EdaDecompositionResult decompose(double[] signal, int samplingRate) {
    final int window;
    try {
      window = Math.multiplyExact(smoothingFactor, samplingRate);
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException(
          "Median window of " + smoothingFactor + " s at " + samplingRate
              + " Hz exceeds the maximum array length", e);
    }
    final double[] tonic = SignalSmoothing.median(signal, window);
    final double[] phasic = new double[signal.length];
    for (int i = 0; i < signal.length; i++) {
      phasic[i] = signal[i] - tonic[i];
    }
    return new EdaDecompositionResult(tonic, phasic);
  }
}
