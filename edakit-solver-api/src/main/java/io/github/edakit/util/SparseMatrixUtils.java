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

package io.github.edakit.util;

import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;
import org.ejml.ops.DConvertMatrixStruct;
import org.ejml.sparse.csc.CommonOps_DSCC;
import org.jetbrains.annotations.NotNull;

/**
 * Helpers around EJML's compressed sparse column matrices. Problem matrices are accumulated as
 * (row, column, value) triplets and converted once; products with dense vectors work directly on
 * the CSC arrays.
 */
public final class SparseMatrixUtils {

  private SparseMatrixUtils() {
  }

  /**
   * Converts accumulated triplets, sums duplicates and sorts the row indices of every column.
   */
  public static @NotNull DMatrixSparseCSC toCsc(@NotNull DMatrixSparseTriplet triplet) {
    final DMatrixSparseCSC csc = new DMatrixSparseCSC(triplet.numRows, triplet.numCols,
        Math.max(1, triplet.nz_length));
    DConvertMatrixStruct.convert(triplet, csc);
    CommonOps_DSCC.duplicatesAdd(csc, null);
    csc.sortIndices(null);
    return csc;
  }

  /**
   * @return A * x
   */
  public static double[] multiply(@NotNull DMatrixSparseCSC a, double[] x) {
    if (x.length != a.numCols) {
      throw new IllegalArgumentException(
          "Vector length " + x.length + " does not match " + a.numCols + " columns");
    }
    final double[] y = new double[a.numRows];
    for (int col = 0; col < a.numCols; col++) {
      final double xc = x[col];
      if (xc == 0d) {
        continue;
      }
      for (int k = a.col_idx[col]; k < a.col_idx[col + 1]; k++) {
        y[a.nz_rows[k]] += a.nz_values[k] * xc;
      }
    }
    return y;
  }

  /**
   * @return A' * v
   */
  public static double[] multiplyTransposed(@NotNull DMatrixSparseCSC a, double[] v) {
    if (v.length != a.numRows) {
      throw new IllegalArgumentException(
          "Vector length " + v.length + " does not match " + a.numRows + " rows");
    }
    final double[] y = new double[a.numCols];
    for (int col = 0; col < a.numCols; col++) {
      double sum = 0d;
      for (int k = a.col_idx[col]; k < a.col_idx[col + 1]; k++) {
        sum += a.nz_values[k] * v[a.nz_rows[k]];
      }
      y[col] = sum;
    }
    return y;
  }

  /**
   * @return X' * X with sorted row indices
   */
  public static @NotNull DMatrixSparseCSC gram(@NotNull DMatrixSparseCSC x) {
    final DMatrixSparseCSC xt = CommonOps_DSCC.transpose(x, null, null);
    final DMatrixSparseCSC gram = new DMatrixSparseCSC(x.numCols, x.numCols, 0);
    CommonOps_DSCC.mult(xt, x, gram);
    gram.sortIndices(null);
    return gram;
  }

  /**
   * @return A + B with sorted row indices
   */
  public static @NotNull DMatrixSparseCSC add(@NotNull DMatrixSparseCSC a,
      @NotNull DMatrixSparseCSC b) {
    final DMatrixSparseCSC sum = new DMatrixSparseCSC(a.numRows, a.numCols,
        a.nz_length + b.nz_length);
    CommonOps_DSCC.add(1d, a, 1d, b, sum, null, null);
    sum.sortIndices(null);
    return sum;
  }

  /**
   * @return a copy of A with row i multiplied by scale[i]
   */
  public static @NotNull DMatrixSparseCSC scaleRows(@NotNull DMatrixSparseCSC a, double[] scale) {
    final DMatrixSparseCSC scaled = a.copy();
    for (int k = 0; k < scaled.nz_length; k++) {
      scaled.nz_values[k] *= scale[scaled.nz_rows[k]];
    }
    return scaled;
  }

  /**
   * @return size x size matrix with {@code value} on the diagonal entries [from, to)
   */
  public static @NotNull DMatrixSparseCSC diagonal(int size, int from, int to, double value) {
    final DMatrixSparseTriplet triplet = new DMatrixSparseTriplet(size, size,
        Math.max(1, to - from));
    for (int i = from; i < to; i++) {
      triplet.addItem(i, i, value);
    }
    return toCsc(triplet);
  }

  public static double maxAbsDiagonal(@NotNull DMatrixSparseCSC a) {
    double max = 0d;
    for (int col = 0; col < a.numCols; col++) {
      for (int k = a.col_idx[col]; k < a.col_idx[col + 1]; k++) {
        if (a.nz_rows[k] == col) {
          max = Math.max(max, Math.abs(a.nz_values[k]));
        }
      }
    }
    return max;
  }
}
