/*
 * Copyright (c) 2025 The edakit Development Team
 */

package io.github.edakit.util.signal;

import java.util.Arrays;
import java.util.Random;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SignalSmoothingTest {

  @Test
  void testSmallWindowWithZeroPadding() {
    final double[] x = {1, 5, 2, 8, 3};
    Assertions.assertArrayEquals(new double[]{1, 2, 5, 3, 3}, SignalSmoothing.median(x, 3), 0d);
    // even sizes are bumped to the next odd size
    Assertions.assertArrayEquals(new double[]{1, 2, 5, 3, 3}, SignalSmoothing.median(x, 2), 0d);
    Assertions.assertArrayEquals(x, SignalSmoothing.median(x, 1), 0d);
  }

  @Test
  void testMatchesWindowedMedian() {
    final Random random = new Random(42);
    final double[] x = new double[300];
    for (int i = 0; i < x.length; i++) {
      // repeated values on purpose
      x[i] = Math.round(random.nextGaussian() * 4d) / 2d;
    }
    final int size = 15;
    final double[] smoothed = SignalSmoothing.median(x, size);

    final Median median = new Median();
    for (int i = 0; i < x.length; i++) {
      final double[] window = new double[size];
      for (int j = 0; j < size; j++) {
        final int k = i - size / 2 + j;
        window[j] = k >= 0 && k < x.length ? x[k] : 0d;
      }
      Assertions.assertEquals(median.evaluate(window), smoothed[i], 0d, "index " + i);
    }
  }

  @Test
  void testWindowLongerThanSignal() {
    final double[] x = {4, 4, 4};
    // 5 of the 7 window entries are padding zeros
    Assertions.assertArrayEquals(new double[]{0, 0, 0}, SignalSmoothing.median(x, 7), 0d);
    Assertions.assertEquals(0, SignalSmoothing.median(new double[0], 5).length);
  }

  @Test
  void testInvalidSize() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> SignalSmoothing.median(new double[]{1, 2}, 0));
  }

  @Test
  void testInputIsNotModified() {
    final double[] x = {3, 1, 2, 9, 7};
    final double[] copy = Arrays.copyOf(x, x.length);
    SignalSmoothing.median(x, 3);
    Assertions.assertArrayEquals(copy, x, 0d);
  }
}
