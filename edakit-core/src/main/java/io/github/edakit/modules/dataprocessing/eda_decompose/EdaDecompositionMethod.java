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

import java.util.List;
import java.util.Locale;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public enum EdaDecompositionMethod {

  /**
   * Convex optimization of a Bateman driver model plus a spline tonic (Greco et al. 2016).
   */
  CVXEDA("cvxeda"),
  /**
   * Tonic is the running median of the signal, phasic the remainder.
   */
  MEDIAN("median", "smoothmedian"),
  /**
   * Low-pass tonic and high-pass phasic at 0.05 Hz, as in Biopac AcqKnowledge.
   */
  HIGHPASS("highpass", "biopac", "acqknowledge");

  private final List<String> names;

  EdaDecompositionMethod(String... names) {
    this.names = List.of(names);
  }

  /**
   * @return accepted lower case names, the first one being canonical
   */
  public @NotNull List<String> getNames() {
    return names;
  }

  @Override
  public String toString() {
    return names.get(0);
  }

  /**
   * Case-insensitive lookup by name or alias.
   *
   * @throws IllegalArgumentException if the name is null, blank or unknown
   */
  public static @NotNull EdaDecompositionMethod fromString(@Nullable String method) {
    if (method == null || method.isBlank()) {
      throw new IllegalArgumentException("No EDA decomposition method given");
    }
    final String normalized = method.trim().toLowerCase(Locale.ROOT);
    for (EdaDecompositionMethod value : values()) {
      if (value.names.contains(normalized)) {
        return value;
      }
    }
    throw new IllegalArgumentException(
        "Unknown EDA decomposition method '" + method + "', use one of cvxeda, median, "
            + "smoothmedian, highpass, biopac or acqknowledge");
  }
}
