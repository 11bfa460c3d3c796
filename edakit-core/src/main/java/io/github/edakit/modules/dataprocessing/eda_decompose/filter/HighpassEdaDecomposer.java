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

import com.google.common.collect.Range;
import io.github.edakit.modules.dataprocessing.eda_decompose.EdaDecomposer;
import io.github.edakit.modules.dataprocessing.eda_decompose.EdaDecompositionResult;
import io.github.edakit.util.signal.SignalFilters;
import org.jetbrains.annotations.NotNull;

/**
 * Biopac AcqKnowledge style split: tonic is the low-passed, phasic the high-passed signal. Both
 * are filtered independently from the raw signal, so tonic + phasic only approximates it.
 */
public class HighpassEdaDecomposer implements EdaDecomposer {

  public static final int FILTER_ORDER = 2;

  private final double cutoff;

  public HighpassEdaDecomposer() {
    this(0.05);
  }

  /**
   * @param cutoff split frequency in Hz
   */
  public HighpassEdaDecomposer(double cutoff) {
    if (!(cutoff > 0d)) {
      throw new IllegalArgumentException("Cutoff must be positive, was " + cutoff);
    }
    this.cutoff = cutoff;
  }

  @Override
  public @NotNull String getName() {
    return "High-pass";
  }

  @Override
  public @NotNull EdaDecompositionResult decompose(double[] signal, int samplingRate) {
    final double[] phasic = SignalFilters.butterworth(signal, samplingRate, Range.atLeast(cutoff),
        FILTER_ORDER);
    final double[] tonic = SignalFilters.butterworth(signal, samplingRate, Range.atMost(cutoff),
        FILTER_ORDER);
    return new EdaDecompositionResult(tonic, phasic);
  }
}
