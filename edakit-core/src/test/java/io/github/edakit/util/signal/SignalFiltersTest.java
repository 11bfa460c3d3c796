/*
 * Copyright (c) 2025 The edakit Development Team
 */

package io.github.edakit.util.signal;

import com.google.common.collect.Range;
import java.util.Arrays;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SignalFiltersTest {

  private static double[] sine(int n, double frequency, double samplingRate) {
    final double[] x = new double[n];
    for (int i = 0; i < n; i++) {
      x[i] = Math.sin(2d * Math.PI * frequency * i / samplingRate);
    }
    return x;
  }

  @Test
  void testConstantPassesLowpass() {
    final double[] x = new double[100];
    Arrays.fill(x, 5d);

    final double[] low = SignalFilters.butterworth(x, 1000, Range.atMost(0.05), 2);
    final double[] high = SignalFilters.butterworth(x, 1000, Range.atLeast(0.05), 2);

    for (int i = 0; i < x.length; i++) {
      Assertions.assertEquals(5d, low[i], 1e-8);
      Assertions.assertEquals(0d, high[i], 1e-8);
    }
  }

  @Test
  void testFastSinePassesHighpassAndIsRemovedByLowpass() {
    final double rate = 100;
    final double[] x = sine(6000, 5d, rate);

    final double[] high = SignalFilters.butterworth(x, rate, Range.atLeast(0.5), 2);
    final double[] low = SignalFilters.butterworth(x, rate, Range.atMost(0.5), 2);

    for (int i = 2000; i < 4000; i++) {
      Assertions.assertEquals(x[i], high[i], 1e-3);
      Assertions.assertEquals(0d, low[i], 1e-3);
    }
  }

  @Test
  void testBandpassKeepsCentreFrequency() {
    final double rate = 200;
    final double[] slow = sine(8000, 0.1, rate);
    final double[] mid = sine(8000, 5d, rate);
    final double[] fast = sine(8000, 80d, rate);
    final double[] x = new double[slow.length];
    for (int i = 0; i < x.length; i++) {
      x[i] = slow[i] + mid[i] + fast[i];
    }

    final double[] band = SignalFilters.butterworth(x, rate, Range.closed(1d, 20d), 4);

    for (int i = 3000; i < 5000; i++) {
      Assertions.assertEquals(mid[i], band[i], 2e-2);
    }
  }

  @Test
  void testOddOrder() {
    final double[] x = new double[50];
    Arrays.fill(x, -2d);
    final double[] low = SignalFilters.butterworth(x, 10, Range.atMost(1d), 3);
    for (double v : low) {
      Assertions.assertEquals(-2d, v, 1e-10);
    }
  }

  @Test
  void testPadLength() {
    // one biquad for order 2, a biquad and a first-order section for order 3
    Assertions.assertEquals(9, SignalFilters.padLength(2, 1000));
    Assertions.assertEquals(12, SignalFilters.padLength(3, 1000));
    Assertions.assertEquals(3, SignalFilters.padLength(2, 4));
  }

  @Test
  void testStartsSettledAtFirstSample() {
    // a ramp from 10, a filter starting from rest would rise from 0 instead
    final double[] x = new double[2000];
    for (int i = 0; i < x.length; i++) {
      x[i] = 10d + 0.001 * i;
    }
    final double[] low = SignalFilters.butterworth(x, 100, Range.atMost(1d), 2);
    for (int i = 0; i < x.length; i++) {
      Assertions.assertEquals(x[i], low[i], i >= 500 && i < 1500 ? 1e-3 : 0.1, "index " + i);
    }
  }

  @Test
  void testInputIsNotModified() {
    final double[] x = sine(500, 2d, 100);
    final double[] copy = x.clone();
    SignalFilters.butterworth(x, 100, Range.atLeast(0.5), 2);
    Assertions.assertArrayEquals(copy, x, 0d);
  }

  @Test
  void testShortSignals() {
    Assertions.assertArrayEquals(new double[]{3d},
        SignalFilters.butterworth(new double[]{3d}, 100, Range.atMost(1d), 2), 1e-12);
    Assertions.assertEquals(4,
        SignalFilters.butterworth(new double[]{1, 2, 3, 4}, 100, Range.atLeast(1d), 2).length);
  }

  @Test
  void testInvalidArguments() {
    final double[] x = new double[10];
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> SignalFilters.butterworth(x, 100, Range.atLeast(50d), 2));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> SignalFilters.butterworth(x, 100, Range.atMost(0d), 2));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> SignalFilters.butterworth(x, 100, Range.all(), 2));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> SignalFilters.butterworth(x, 100, Range.atLeast(1d), 0));
  }
}
