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

import io.github.edakit.modules.dataprocessing.eda_decompose.cvxeda.CvxEdaDecomposer;
import io.github.edakit.modules.dataprocessing.eda_decompose.filter.HighpassEdaDecomposer;
import io.github.edakit.modules.dataprocessing.eda_decompose.filter.MedianSmoothEdaDecomposer;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Entry point of the EDA decomposition: validates the input, resolves the method name and runs
 * the matching {@link EdaDecomposer}.
 * <pre>{@code
 * EdaDecompositionResult result = EdaDecomposition.decompose(eda, 100, "cvxeda");
 * double[] tonic = result.tonic();
 * }</pre>
 */
public final class EdaDecomposition {

  public static final int DEFAULT_SAMPLING_RATE = 1000;
  public static final String DEFAULT_METHOD = "highpass";

  private static final Logger logger = Logger.getLogger(EdaDecomposition.class.getName());

  private EdaDecomposition() {
  }

  public static @NotNull EdaDecompositionResult decompose(double[] signal) {
    return decompose(signal, DEFAULT_SAMPLING_RATE, DEFAULT_METHOD);
  }

  public static @NotNull EdaDecompositionResult decompose(double[] signal, int samplingRate,
      @Nullable String method) {
    return decompose(signal, samplingRate, method, EdaDecompositionParameters.DEFAULT);
  }

  /**
   * @param method case-insensitive method name, see {@link EdaDecompositionMethod}
   * @throws IllegalArgumentException for an unknown method, an empty or non-finite signal, a
   *                                  non-positive sampling rate or invalid method parameters
   */
  public static @NotNull EdaDecompositionResult decompose(double[] signal, int samplingRate,
      @Nullable String method, @NotNull EdaDecompositionParameters params) {
    final EdaDecompositionMethod resolved = EdaDecompositionMethod.fromString(method);
    checkSignal(signal, samplingRate);
    logger.fine(
        () -> "Decomposing " + signal.length + " samples at " + samplingRate + " Hz with method "
            + resolved);
    return createDecomposer(resolved, params).decompose(signal, samplingRate);
  }

  public static @NotNull EdaDecomposer createDecomposer(@NotNull EdaDecompositionMethod method,
      @NotNull EdaDecompositionParameters params) {
    return switch (method) {
      case CVXEDA -> new CvxEdaDecomposer(params);
      case MEDIAN -> new MedianSmoothEdaDecomposer(params.smoothingFactor());
      case HIGHPASS -> new HighpassEdaDecomposer(params.filterCutoff());
    };
  }

  static void checkSignal(double[] signal, int samplingRate) {
    if (signal == null || signal.length == 0) {
      throw new IllegalArgumentException("EDA signal is empty");
    }
    if (samplingRate <= 0) {
      throw new IllegalArgumentException("Sampling rate must be positive, was " + samplingRate);
    }
    for (int i = 0; i < signal.length; i++) {
      if (!Double.isFinite(signal[i])) {
        throw new IllegalArgumentException("EDA signal has a non-finite value at index " + i);
      }
    }
  }
}
