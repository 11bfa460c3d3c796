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

/**
 * Layout of a product cone: the first {@code linear} slack entries form a non-negative orthant,
 * followed by one second-order cone {@code {u : u0 >= ||u1||}} per entry of {@code secondOrder}.
 */
public record ConeDimensions(int linear, int[] secondOrder) {

  public ConeDimensions {
    if (linear < 0) {
      throw new IllegalArgumentException("Negative orthant dimension " + linear);
    }
    secondOrder = secondOrder.clone();
    for (int q : secondOrder) {
      if (q < 1) {
        throw new IllegalArgumentException("Second-order cone dimension must be >= 1, was " + q);
      }
    }
  }

  public static @NotNull ConeDimensions orthant(int linear) {
    return new ConeDimensions(linear, new int[0]);
  }

  /**
   * @return total number of slack entries
   */
  public int size() {
    int size = linear;
    for (int q : secondOrder) {
      size += q;
    }
    return size;
  }

  /**
   * @return barrier degree: one per orthant entry plus one per second-order cone
   */
  public int degree() {
    return linear + secondOrder.length;
  }

  public int numSecondOrderCones() {
    return secondOrder.length;
  }

  /**
   * @return index of the first slack entry of second-order cone k
   */
  public int secondOrderOffset(int k) {
    int offset = linear;
    for (int i = 0; i < k; i++) {
      offset += secondOrder[i];
    }
    return offset;
  }

  @Override
  public int[] secondOrder() {
    return secondOrder.clone();
  }

  public int secondOrderSize(int k) {
    return secondOrder[k];
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ConeDimensions other && linear == other.linear && Arrays.equals(
        secondOrder, other.secondOrder);
  }

  @Override
  public int hashCode() {
    return 31 * linear + Arrays.hashCode(secondOrder);
  }

  @Override
  public String toString() {
    return "ConeDimensions[linear=" + linear + ", secondOrder=" + Arrays.toString(secondOrder)
        + "]";
  }
}
