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

package io.github.edakit.util.signal;

import com.github.psambit9791.jdsp.filter.Median;

public final class SignalSmoothing {

  private SignalSmoothing() {
  }

  /**
   * Running median centred on every sample, computed with the JDSP {@link Median} filter. Even
   * sizes are bumped to the next odd size. The signal is padded with zeros, so the first and last
   * size/2 samples are pulled towards 0.
   *
   * @param signal samples, not modified
   * @param size   window length in samples, >= 1
   * @return smoothed copy
   */
  public static double[] median(double[] signal, int size) {
    if (size < 1) {
      throw new IllegalArgumentException("Median window must be >= 1 sample, was " + size);
    }
    final int window = size % 2 == 0 ? size + 1 : size;
    final int n = signal.length;
    if (n == 0 || window == 1) {
      return signal.clone();
    }

    // one extra zero per side keeps the padded signal longer than the window, every output
    // sample below then sees a full window
    final int pad = window / 2 + 1;
    final double[] padded = new double[n + 2 * pad];
    System.arraycopy(signal, 0, padded, pad, n);
    final double[] smoothed = new Median(window).filter(padded);

    final double[] out = new double[n];
    System.arraycopy(smoothed, pad, out, 0, n);
    return out;
  }
}
