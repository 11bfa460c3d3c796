/*
 * Copyright (c) 2025 The edakit Development Team
 */

package io.github.edakit.modules.dataprocessing.eda_decompose;

import io.github.edakit.modules.dataprocessing.eda_decompose.cvxeda.CvxEdaDecomposer;
import io.github.edakit.modules.dataprocessing.eda_decompose.filter.HighpassEdaDecomposer;
import io.github.edakit.modules.dataprocessing.eda_decompose.filter.MedianSmoothEdaDecomposer;
import io.github.edakit.util.signal.SignalSmoothing;
import java.util.Arrays;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class EdaDecompositionTest {

  private static double[] ramp(int n) {
    final double[] signal = new double[n];
    for (int i = 0; i < n; i++) {
      signal[i] = 1.0 + Math.sin(i / 50d) + 0.001 * i;
    }
    return signal;
  }

  @Test
  void testConstantSignalWithDefaults() {
    final double[] signal = new double[100];
    Arrays.fill(signal, 5.0);

    final EdaDecompositionResult result = EdaDecomposition.decompose(signal);

    Assertions.assertEquals(100, result.length());
    for (int i = 10; i < 90; i++) {
      Assertions.assertEquals(5.0, result.tonic()[i], 1e-6);
      Assertions.assertEquals(0d, result.phasic()[i], 1e-6);
    }
  }

  @Test
  void testUnknownMethod() {
    final IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class,
        () -> EdaDecomposition.decompose(ramp(50), 1000, "unknown_method"));
    Assertions.assertTrue(e.getMessage().contains("unknown_method"));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> EdaDecomposition.decompose(ramp(50), 1000, null));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> EdaDecomposition.decompose(ramp(50), 1000, " "));
  }

  @Test
  void testMethodIsResolvedBeforeSignalChecks() {
    final IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class,
        () -> EdaDecomposition.decompose(new double[0], 1000, "nope"));
    Assertions.assertTrue(e.getMessage().contains("nope"));
  }

  @Test
  void testAliases() {
    Assertions.assertEquals(EdaDecompositionMethod.CVXEDA,
        EdaDecompositionMethod.fromString("cvxEDA"));
    Assertions.assertEquals(EdaDecompositionMethod.MEDIAN,
        EdaDecompositionMethod.fromString("SmoothMedian"));
    Assertions.assertEquals(EdaDecompositionMethod.MEDIAN,
        EdaDecompositionMethod.fromString(" median "));
    Assertions.assertEquals(EdaDecompositionMethod.HIGHPASS,
        EdaDecompositionMethod.fromString("Biopac"));
    Assertions.assertEquals(EdaDecompositionMethod.HIGHPASS,
        EdaDecompositionMethod.fromString("ACQKNOWLEDGE"));
    Assertions.assertEquals("highpass", EdaDecompositionMethod.HIGHPASS.toString());

    final double[] signal = ramp(300);
    Assertions.assertArrayEquals(EdaDecomposition.decompose(signal, 10, "highpass").tonic(),
        EdaDecomposition.decompose(signal, 10, "biopac").tonic());
    Assertions.assertArrayEquals(EdaDecomposition.decompose(signal, 10, "median").phasic(),
        EdaDecomposition.decompose(signal, 10, "smoothmedian").phasic());
  }

  @Test
  void testCreateDecomposer() {
    final EdaDecompositionParameters params = EdaDecompositionParameters.DEFAULT;
    Assertions.assertInstanceOf(CvxEdaDecomposer.class,
        EdaDecomposition.createDecomposer(EdaDecompositionMethod.CVXEDA, params));
    Assertions.assertInstanceOf(MedianSmoothEdaDecomposer.class,
        EdaDecomposition.createDecomposer(EdaDecompositionMethod.MEDIAN, params));
    Assertions.assertInstanceOf(HighpassEdaDecomposer.class,
        EdaDecomposition.createDecomposer(EdaDecompositionMethod.HIGHPASS, params));
  }

  @Test
  void testMedianSplitsExactly() {
    final double[] signal = ramp(400);
    final EdaDecompositionResult result = EdaDecomposition.decompose(signal, 20, "median");

    Assertions.assertArrayEquals(SignalSmoothing.median(signal, 80), result.tonic());
    for (int i = 0; i < signal.length; i++) {
      Assertions.assertEquals(signal[i] - result.tonic()[i], result.phasic()[i], 0d);
    }
  }

  @Test
  void testSmoothingFactorFromParameters() {
    final double[] signal = ramp(400);
    final EdaDecompositionResult result = EdaDecomposition.decompose(signal, 20, "median",
        EdaDecompositionParameters.DEFAULT.withSmoothingFactor(2));
    Assertions.assertArrayEquals(SignalSmoothing.median(signal, 40), result.tonic());
  }

  @Test
  void testInvalidSignals() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> EdaDecomposition.decompose(new double[0], 1000, "highpass"));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> EdaDecomposition.decompose(null, 1000, "median"));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> EdaDecomposition.decompose(new double[]{1, Double.NaN, 2}, 1000, "median"));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> EdaDecomposition.decompose(new double[]{1, 2, 3}, 0, "median"));
  }

  @Test
  void testSignalIsNotModified() {
    final double[] signal = ramp(200);
    final double[] original = signal.clone();
    for (String method : new String[]{"median", "highpass"}) {
      final EdaDecompositionResult result = EdaDecomposition.decompose(signal, 10, method);
      Assertions.assertArrayEquals(original, signal, method);
      Assertions.assertEquals(signal.length, result.tonic().length);
      Assertions.assertEquals(signal.length, result.phasic().length);
    }
  }
}
