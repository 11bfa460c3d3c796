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

import java.util.Arrays;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Nesterov-Todd scaling W of a primal-dual pair (s, z): W z = W^-1 s = lambda.
 * <p>
 * On the orthant W is diagonal with entries sqrt(s/z). On a second-order cone block
 * W = beta (2 v v' - J) with J = diag(1, -1, ..., -1), which gives
 * <pre>
 *   W^-2 = beta^-2 (I - 2 e e' + 2 a a'),  a = J w
 * </pre>
 * where w is the normalized scaling point. The rank-two part of W^-2 is exposed through
 * {@link #lowRankVector(int)} so the reduced Newton system can keep its sparsity.
 */
final class ConeScaling {

  private final ConeDimensions dims;
  private final double[] linearScale;
  private final double[] beta;
  private final double[][] v;
  private final double[][] w;
  private final double[] lambda;
  private final boolean lowRank;

  private ConeScaling(ConeDimensions dims, double[] linearScale, double[] beta, double[][] v,
      double[][] w, double[] lambda, boolean lowRank) {
    this.dims = dims;
    this.linearScale = linearScale;
    this.beta = beta;
    this.v = v;
    this.w = w;
    this.lambda = lambda;
    this.lowRank = lowRank;
  }

  static @NotNull ConeScaling identity(@NotNull ConeDimensions dims) {
    final double[] linear = new double[dims.linear()];
    Arrays.fill(linear, 1d);
    final int cones = dims.numSecondOrderCones();
    final double[] beta = new double[cones];
    final double[][] v = new double[cones][];
    final double[][] w = new double[cones][];
    for (int k = 0; k < cones; k++) {
      beta[k] = 1d;
      v[k] = new double[dims.secondOrderSize(k)];
      v[k][0] = 1d;
      w[k] = v[k];
    }
    return new ConeScaling(dims, linear, beta, v, w, ConeAlgebra.identity(dims), false);
  }

  /**
   * @return the scaling at (s, z), or null if either point is not strictly inside the cone
   */
  static @Nullable ConeScaling compute(@NotNull ConeDimensions dims, double[] s, double[] z) {
    final double[] linear = new double[dims.linear()];
    final double[] lambda = new double[s.length];
    for (int i = 0; i < dims.linear(); i++) {
      if (!(s[i] > 0d) || !(z[i] > 0d)) {
        return null;
      }
      linear[i] = Math.sqrt(s[i] / z[i]);
      lambda[i] = Math.sqrt(s[i] * z[i]);
    }

    final int cones = dims.numSecondOrderCones();
    final double[] beta = new double[cones];
    final double[][] v = new double[cones][];
    final double[][] w = new double[cones][];
    for (int k = 0; k < cones; k++) {
      final int o = dims.secondOrderOffset(k);
      final int q = dims.secondOrderSize(k);
      final double sj = ConeAlgebra.jnorm2(s, o, q);
      final double zj = ConeAlgebra.jnorm2(z, o, q);
      if (!(sj > 0d) || !(zj > 0d) || !(s[o] > 0d) || !(z[o] > 0d)) {
        return null;
      }
      final double sNorm = Math.sqrt(sj);
      final double zNorm = Math.sqrt(zj);
      double sz = 0d;
      for (int i = 0; i < q; i++) {
        sz += s[o + i] * z[o + i];
      }
      final double gamma = Math.sqrt((1d + sz / (sNorm * zNorm)) / 2d);

      final double[] wk = new double[q];
      wk[0] = (s[o] / sNorm + z[o] / zNorm) / (2d * gamma);
      for (int i = 1; i < q; i++) {
        wk[i] = (s[o + i] / sNorm - z[o + i] / zNorm) / (2d * gamma);
      }
      final double[] vk = wk.clone();
      vk[0] += 1d;
      final double vScale = Math.sqrt(2d * (wk[0] + 1d));
      for (int i = 0; i < q; i++) {
        vk[i] /= vScale;
      }
      beta[k] = Math.sqrt(sNorm / zNorm);
      v[k] = vk;
      w[k] = wk;
    }

    final ConeScaling scaling = new ConeScaling(dims, linear, beta, v, w, lambda, cones > 0);
    // lambda = W z on the second-order blocks
    final double[] wz = scaling.apply(z);
    for (int i = dims.linear(); i < lambda.length; i++) {
      lambda[i] = wz[i];
    }
    return scaling;
  }

  double[] lambda() {
    return lambda;
  }

  /**
   * @return W u
   */
  double[] apply(double[] u) {
    final double[] out = new double[u.length];
    for (int i = 0; i < dims.linear(); i++) {
      out[i] = linearScale[i] * u[i];
    }
    for (int k = 0; k < beta.length; k++) {
      final int o = dims.secondOrderOffset(k);
      final double vu = dot(v[k], u, o);
      reflect(u, out, o, v[k], 2d * vu, beta[k]);
    }
    return out;
  }

  /**
   * @return W^-1 u
   */
  double[] applyInverse(double[] u) {
    final double[] out = new double[u.length];
    for (int i = 0; i < dims.linear(); i++) {
      out[i] = u[i] / linearScale[i];
    }
    for (int k = 0; k < beta.length; k++) {
      final int o = dims.secondOrderOffset(k);
      final double[] jv = flip(v[k]);
      final double jvu = dot(jv, u, o);
      reflect(u, out, o, jv, 2d * jvu, 1d / beta[k]);
    }
    return out;
  }

  /**
   * @return W^-2 u
   */
  double[] applyInverseSquare(double[] u) {
    final double[] out = new double[u.length];
    for (int i = 0; i < dims.linear(); i++) {
      out[i] = u[i] / (linearScale[i] * linearScale[i]);
    }
    for (int k = 0; k < beta.length; k++) {
      final int o = dims.secondOrderOffset(k);
      final double[] jw = flip(w[k]);
      final double jwu = dot(jw, u, o);
      reflect(u, out, o, jw, 2d * jwu, 1d / (beta[k] * beta[k]));
    }
    return out;
  }

  /**
   * Row factors D with W^-2 = D^2 + sum_k (2/beta_k^2) (a_k a_k' - e_k e_k'): sqrt(z/s) on the
   * orthant, 1/beta on every second-order row.
   */
  double[] rowScale() {
    final double[] scale = new double[dims.size()];
    for (int i = 0; i < dims.linear(); i++) {
      scale[i] = 1d / linearScale[i];
    }
    for (int k = 0; k < beta.length; k++) {
      final int o = dims.secondOrderOffset(k);
      for (int i = 0; i < dims.secondOrderSize(k); i++) {
        scale[o + i] = 1d / beta[k];
      }
    }
    return scale;
  }

  boolean hasLowRankTerms() {
    return lowRank;
  }

  /**
   * @return a_k = J w_k embedded in a full-length slack vector
   */
  double[] lowRankVector(int k) {
    final double[] a = new double[dims.size()];
    final int o = dims.secondOrderOffset(k);
    final double[] jw = flip(w[k]);
    System.arraycopy(jw, 0, a, o, jw.length);
    return a;
  }

  double lowRankWeight(int k) {
    return 2d / (beta[k] * beta[k]);
  }

  ConeDimensions dims() {
    return dims;
  }

  /**
   * out_block = scale * (coef * p - J u_block)
   */
  private static void reflect(double[] u, double[] out, int o, double[] p, double coef,
      double scale) {
    out[o] = scale * (coef * p[0] - u[o]);
    for (int i = 1; i < p.length; i++) {
      out[o + i] = scale * (coef * p[i] + u[o + i]);
    }
  }

  private static double[] flip(double[] p) {
    final double[] j = new double[p.length];
    j[0] = p[0];
    for (int i = 1; i < p.length; i++) {
      j[i] = -p[i];
    }
    return j;
  }

  private static double dot(double[] p, double[] u, int o) {
    double sum = 0d;
    for (int i = 0; i < p.length; i++) {
      sum += p[i] * u[o + i];
    }
    return sum;
  }
}
