/*
 * Copyright (c) 2025 The edakit Development Team
 */

package io.github.edakit.modules.dataprocessing.eda_decompose.filter;

import io.github.edakit.modules.dataprocessing.eda_decompose.EdaDecompositionResult;
import java.util.Arrays;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class HighpassEdaDecomposerTest {

  /**
   * 60 s at 10 Hz: linear drift plus one Gaussian bump at 30 s.
   */
  private static double[] driftWithBump() {
    final int rate = 10;
    final double[] signal = new double[600];
    for (int i = 0; i < signal.length; i++) {
      final double t = i / (double) rate;
      signal[i] = 2.0 + 0.01 * t + 0.5 * Math.exp(-(t - 30) * (t - 30) / 2);
    }
    return signal;
  }

  @Test
  void testConstantSignal() {
    final double[] signal = new double[100];
    Arrays.fill(signal, 5.0);

    final EdaDecompositionResult result = new HighpassEdaDecomposer().decompose(signal, 1000);

    Assertions.assertArrayEquals(signal, result.tonic(), 1e-8);
    Assertions.assertArrayEquals(new double[100], result.phasic(), 1e-8);
  }

  @Test
  void testComponentsAreFilteredIndependently() {
    final double[] signal = driftWithBump();
    final double[] original = signal.clone();

    final EdaDecompositionResult result = new HighpassEdaDecomposer().decompose(signal, 10);

    Assertions.assertArrayEquals(original, signal);
    double interiorError = 0d;
    double phasicPeak = 0d;
    for (int i = 100; i < 500; i++) {
      interiorError = Math.max(interiorError,
          Math.abs(result.tonic()[i] + result.phasic()[i] - signal[i]));
      phasicPeak = Math.max(phasicPeak, result.phasic()[i]);
    }
    // close to, but not exactly, the signal
    Assertions.assertTrue(interiorError < 0.01, "tonic + phasic off by " + interiorError);
    Assertions.assertTrue(phasicPeak > 0.3, "phasic peak " + phasicPeak);
    Assertions.assertEquals(2.0, result.tonic()[0], 0.05);
  }

  @Test
  void testLowerCutoffMovesMoreIntoPhasic() {
    final double[] signal = driftWithBump();
    final double[] narrow = new HighpassEdaDecomposer(0.05).decompose(signal, 10).phasic();
    final double[] wide = new HighpassEdaDecomposer(0.01).decompose(signal, 10).phasic();
    double narrowEnergy = 0d;
    double wideEnergy = 0d;
    for (int i = 0; i < signal.length; i++) {
      narrowEnergy += narrow[i] * narrow[i];
      wideEnergy += wide[i] * wide[i];
    }
    Assertions.assertTrue(wideEnergy > narrowEnergy);
  }

  @Test
  void testInvalidArguments() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new HighpassEdaDecomposer(0));
    // non-positive sampling rate
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new HighpassEdaDecomposer().decompose(new double[]{1, 2, 3}, 0));
  }
}
