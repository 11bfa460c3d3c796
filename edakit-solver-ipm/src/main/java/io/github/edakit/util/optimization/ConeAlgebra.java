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

package io.github.edakit.util.optimization;

import org.jetbrains.annotations.NotNull;

/**
 * Jordan algebra of the product cone: element-wise on the orthant, arrow-matrix arithmetic on
 * each second-order cone.
 */
final class ConeAlgebra {

  private ConeAlgebra() {
  }

  static double[] identity(@NotNull ConeDimensions dims) {
    final double[] e = new double[dims.size()];
    for (int i = 0; i < dims.linear(); i++) {
      e[i] = 1d;
    }
    for (int k = 0; k < dims.numSecondOrderCones(); k++) {
      e[dims.secondOrderOffset(k)] = 1d;
    }
    return e;
  }

  /**
   * @return u o v
   */
  static double[] product(@NotNull ConeDimensions dims, double[] u, double[] v) {
    final double[] w = new double[u.length];
    for (int i = 0; i < dims.linear(); i++) {
      w[i] = u[i] * v[i];
    }
    for (int k = 0; k < dims.numSecondOrderCones(); k++) {
      final int o = dims.secondOrderOffset(k);
      final int q = dims.secondOrderSize(k);
      w[o] = dot(u, v, o, q);
      for (int i = o + 1; i < o + q; i++) {
        w[i] = u[o] * v[i] + v[o] * u[i];
      }
    }
    return w;
  }

  /**
   * Solves lambda o x = v for x.
   */
  static double[] divide(@NotNull ConeDimensions dims, double[] lambda, double[] v) {
    final double[] x = new double[v.length];
    for (int i = 0; i < dims.linear(); i++) {
      x[i] = v[i] / lambda[i];
    }
    for (int k = 0; k < dims.numSecondOrderCones(); k++) {
      final int o = dims.secondOrderOffset(k);
      final int q = dims.secondOrderSize(k);
      final double l0 = lambda[o];
      double tailDot = 0d;
      for (int i = o + 1; i < o + q; i++) {
        tailDot += lambda[i] * v[i];
      }
      final double x0 = (l0 * v[o] - tailDot) / jnorm2(lambda, o, q);
      x[o] = x0;
      for (int i = o + 1; i < o + q; i++) {
        x[i] = (v[i] - x0 * lambda[i]) / l0;
      }
    }
    return x;
  }

  /**
   * @return the largest step t such that u + t * du stays in the cone, or
   * {@link Double#POSITIVE_INFINITY} when du never leaves it. u must be interior.
   */
  static double maxStep(@NotNull ConeDimensions dims, double[] u, double[] du) {
    double step = Double.POSITIVE_INFINITY;
    for (int i = 0; i < dims.linear(); i++) {
      if (du[i] < 0d) {
        step = Math.min(step, -u[i] / du[i]);
      }
    }
    for (int k = 0; k < dims.numSecondOrderCones(); k++) {
      final int o = dims.secondOrderOffset(k);
      final int q = dims.secondOrderSize(k);
      // (u0 + t du0)^2 - ||u1 + t du1||^2 = a t^2 + b t + c
      final double a = jnorm2(du, o, q);
      double b = u[o] * du[o];
      for (int i = o + 1; i < o + q; i++) {
        b -= u[i] * du[i];
      }
      b *= 2d;
      final double c = jnorm2(u, o, q);
      step = Math.min(step, smallestPositiveRoot(a, b, c));
    }
    return step;
  }

  private static double smallestPositiveRoot(double a, double b, double c) {
    if (a == 0d) {
      return b < 0d ? -c / b : Double.POSITIVE_INFINITY;
    }
    final double disc = b * b - 4d * a * c;
    if (disc < 0d) {
      return Double.POSITIVE_INFINITY;
    }
    final double q = -0.5d * (b + Math.copySign(Math.sqrt(disc), b));
    double root = Double.POSITIVE_INFINITY;
    final double r1 = q / a;
    final double r2 = q != 0d ? c / q : Double.POSITIVE_INFINITY;
    if (r1 > 0d) {
      root = r1;
    }
    if (r2 > 0d) {
      root = Math.min(root, r2);
    }
    return root;
  }

  /**
   * Moves r into the cone interior: r itself if already strictly inside, otherwise r shifted by
   * (1 + t) e where t measures the worst violation.
   */
  static double[] shiftIntoInterior(@NotNull ConeDimensions dims, double[] r) {
    double t = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < dims.linear(); i++) {
      t = Math.max(t, -r[i]);
    }
    for (int k = 0; k < dims.numSecondOrderCones(); k++) {
      final int o = dims.secondOrderOffset(k);
      final int q = dims.secondOrderSize(k);
      t = Math.max(t, tailNorm(r, o, q) - r[o]);
    }
    final double[] shifted = r.clone();
    if (t >= -1e-8 * Math.max(norm(r), 1d)) {
      final double[] e = identity(dims);
      for (int i = 0; i < shifted.length; i++) {
        shifted[i] += (1d + t) * e[i];
      }
    }
    return shifted;
  }

  static double dot(double[] u, double[] v) {
    return dot(u, v, 0, u.length);
  }

  static double norm(double[] u) {
    return Math.sqrt(dot(u, u));
  }

  private static double dot(double[] u, double[] v, int offset, int length) {
    double sum = 0d;
    for (int i = offset; i < offset + length; i++) {
      sum += u[i] * v[i];
    }
    return sum;
  }

  /**
   * @return u0^2 - ||u1||^2 of the block at offset, factored to avoid cancellation
   */
  static double jnorm2(double[] u, int offset, int length) {
    final double tail = tailNorm(u, offset, length);
    return (u[offset] - tail) * (u[offset] + tail);
  }

  private static double tailNorm(double[] u, int offset, int length) {
    double tail = 0d;
    for (int i = offset + 1; i < offset + length; i++) {
      tail += u[i] * u[i];
    }
    return Math.sqrt(tail);
  }
}
