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

import com.github.psambit9791.jdsp.filter.Butterworth;
import com.google.common.collect.Range;
import org.jetbrains.annotations.NotNull;

/**
 * Zero-phase Butterworth filtering on top of the JDSP {@link Butterworth} filters.
 * <p>
 * JDSP runs a filter once, forward, from a zero state. Each edge is therefore run forward and
 * backward over an odd extension of the signal. Every pass filters the deviation from its first
 * sample and adds that sample back times the DC gain, which is the response of a filter that
 * starts in the steady state of its first sample. A constant signal passes a low-pass unchanged.
 */
public final class SignalFilters {

  private SignalFilters() {
  }

  /**
   * @param signal       samples, not modified
   * @param samplingRate Hz
   * @param band         pass band in Hz. {@code Range.atLeast(f)} is a high-pass,
   *                     {@code Range.atMost(f)} a low-pass, a closed range a high-pass followed by
   *                     a low-pass.
   * @param order        filter order of every edge, >= 1
   * @return the filtered copy
   */
  public static double[] butterworth(double[] signal, double samplingRate,
      @NotNull Range<Double> band, int order) {
    if (order < 1) {
      throw new IllegalArgumentException("Filter order must be >= 1, was " + order);
    }
    if (!(samplingRate > 0d)) {
      throw new IllegalArgumentException("Sampling rate must be positive, was " + samplingRate);
    }
    if (!band.hasLowerBound() && !band.hasUpperBound()) {
      throw new IllegalArgumentException("Pass band " + band + " has neither a low nor a high cut");
    }
    if (band.hasLowerBound()) {
      checkCutoff(band.lowerEndpoint(), samplingRate);
    }
    if (band.hasUpperBound()) {
      checkCutoff(band.upperEndpoint(), samplingRate);
    }
    if (signal.length == 0) {
      return new double[0];
    }

    double[] filtered = signal.clone();
    if (band.hasLowerBound()) {
      filtered = filtfilt(new Edge(samplingRate, order, band.lowerEndpoint(), false), filtered);
    }
    if (band.hasUpperBound()) {
      filtered = filtfilt(new Edge(samplingRate, order, band.upperEndpoint(), true), filtered);
    }
    return filtered;
  }

  private static void checkCutoff(double cutoff, double samplingRate) {
    if (!(cutoff > 0d) || !(cutoff < samplingRate / 2d)) {
      throw new IllegalArgumentException(
          "Cutoff " + cutoff + " Hz must lie between 0 and the Nyquist frequency " + (samplingRate
              / 2d) + " Hz");
    }
  }

  /**
   * Number of samples added at each end: three times the number of coefficients per pass,
   * limited to n - 1.
   */
  static int padLength(int order, int n) {
    final int sections = (order + 1) / 2;
    return Math.min(3 * (2 * sections + 1 - order % 2), n - 1);
  }

  /**
   * Forward-backward filtering with odd extension at both ends.
   */
  static double[] filtfilt(@NotNull Edge edge, double[] x) {
    final int n = x.length;
    final int pad = padLength(edge.order(), n);

    final double[] ext = new double[n + 2 * pad];
    for (int i = 0; i < pad; i++) {
      ext[i] = 2d * x[0] - x[pad - i];
      ext[n + pad + i] = 2d * x[n - 1] - x[n - 2 - i];
    }
    System.arraycopy(x, 0, ext, pad, n);

    final double[] forward = edge.filter(ext);
    reverse(forward);
    final double[] backward = edge.filter(forward);
    reverse(backward);

    final double[] out = new double[n];
    System.arraycopy(backward, pad, out, 0, n);
    return out;
  }

  private static void reverse(double[] values) {
    for (int i = 0, j = values.length - 1; i < j; i++, j--) {
      final double tmp = values[i];
      values[i] = values[j];
      values[j] = tmp;
    }
  }

  /**
   * One low- or high-pass edge. The DC gain is 1 for a low-pass and 0 for a high-pass.
   */
  record Edge(double samplingRate, int order, double cutoff, boolean lowpass) {

    /**
     * One forward pass that starts settled at the first sample.
     */
    double[] filter(double[] x) {
      final double level = x[0];
      final double[] deviation = new double[x.length];
      for (int i = 0; i < x.length; i++) {
        deviation[i] = x[i] - level;
      }
      final Butterworth butterworth = new Butterworth(samplingRate);
      final double[] y = lowpass ? butterworth.lowPassFilter(deviation, order, cutoff)
          : butterworth.highPassFilter(deviation, order, cutoff);
      if (lowpass) {
        for (int i = 0; i < y.length; i++) {
          y[i] += level;
        }
      }
      return y;
    }
  }
}
