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

package io.github.edakit.tools.edadecompose;

import com.google.common.primitives.Doubles;
import com.google.common.primitives.Ints;
import io.github.edakit.modules.dataprocessing.eda_decompose.EdaDecomposition;
import io.github.edakit.modules.dataprocessing.eda_decompose.EdaDecompositionParameters;
import io.github.edakit.modules.dataprocessing.eda_decompose.EdaDecompositionResult;
import io.github.edakit.util.DelimitedTextUtils;
import java.awt.BasicStroke;
import java.awt.Color;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import org.jetbrains.annotations.NotNull;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYItemRenderer;
import org.jfree.chart.title.TextTitle;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Standalone runner that decomposes one EDA column of a delimited text file.
 *
 * Usage:
 *   -DinputFile=/path/recording.csv -DoutDir=/path/out -DsamplingRate=100 -Dmethod=cvxeda
 *   [-Dcolumn=EDA] [-Dformat=tsv|png|both] [-Dtau0=2 -Dtau1=0.7 -DdeltaKnot=10 -Dalpha=8e-4
 *   -Dgamma=1e-2 -Dreltol=1e-9 -Dsolver=qp|conelp -DsmoothingFactor=4 -DfilterCutoff=0.05]
 * Or call main with args: inputFile [outDir]
 */
public class EdaDecomposeRunner {

  public static final String RAW = "EDA_Raw";

  public static void main(String[] args) throws Exception {
    final Properties props = new Properties();
    props.putAll(System.getProperties());
    if (args != null && args.length > 0 && args[0] != null && !args[0].isBlank()) {
      props.setProperty("inputFile", args[0]);
    }
    if (args != null && args.length > 1 && args[1] != null && !args[1].isBlank()) {
      props.setProperty("outDir", args[1]);
    }
    if (props.getProperty("inputFile", "").isBlank()) {
      System.err.println("Please provide the input file via -DinputFile or first CLI arg.");
      return;
    }
    run(props);
  }

  /**
   * @return the files written
   */
  public static @NotNull List<Path> run(@NotNull Properties props) throws IOException {
    final Path inputFile = Paths.get(props.getProperty("inputFile", "")).toAbsolutePath()
        .normalize();
    final String stem = inputFile.getFileName().toString().replaceFirst("\\.[^.]*$", "");
    final Path outDir = Paths.get(props.getProperty("outDir",
        inputFile.resolveSibling("eda_decomposed").toString())).toAbsolutePath().normalize();
    final int samplingRate = Integer.parseInt(props.getProperty("samplingRate",
        "" + EdaDecomposition.DEFAULT_SAMPLING_RATE).trim());
    final String method = props.getProperty("method", EdaDecomposition.DEFAULT_METHOD);
    final String column = props.getProperty("column", "").trim();
    final String format = props.getProperty("format", "tsv");
    final boolean outPng = format.equalsIgnoreCase("png") || format.equalsIgnoreCase("both");
    final EdaDecompositionParameters params = EdaDecompositionParameters.fromProperties(props);

    Files.createDirectories(outDir);
    System.out.printf(Locale.US, "Input: %s%nOutput: %s%nmethod=%s, samplingRate=%d, format=%s%n",
        inputFile, outDir, method, samplingRate, format);

    final EdaColumn eda = readColumn(inputFile, column);
    System.out.printf(Locale.US, "Read %d samples from column '%s'%n", eda.values().length,
        eda.name());

    final long start = System.nanoTime();
    final EdaDecompositionResult result = EdaDecomposition.decompose(eda.values(), samplingRate,
        method, params);
    System.out.printf(Locale.US, "Decomposed in %.1f ms%n", (System.nanoTime() - start) / 1e6);

    final List<Path> written = new ArrayList<>();
    final Path tsv = outDir.resolve(stem + "_decomposed.tsv");
    writeTsv(tsv, eda.values(), result);
    written.add(tsv);
    if (outPng) {
      final Path png = outDir.resolve(stem + "_decomposed.png");
      saveChart(png, stem + " (" + method + ")", eda.values(), samplingRate, result);
      written.add(png);
    }
    written.forEach(p -> System.out.println("Wrote " + p));
    return written;
  }

  /**
   * Picks the requested column, a column named like an EDA channel, or the first numeric column.
   * Rows whose cell does not parse as a number are skipped.
   */
  static @NotNull EdaColumn readColumn(@NotNull Path file, @NotNull String column)
      throws IOException {
    final List<String[]> rows = DelimitedTextUtils.readRows(file);
    if (rows.isEmpty()) {
      throw new IOException("No data in " + file);
    }
    final String[] first = rows.get(0);
    final boolean hasHeader = !isNumericRow(first);
    final int startRow = hasHeader ? 1 : 0;

    int idx;
    if (!column.isEmpty()) {
      idx = hasHeader ? guessIndex(first, column) : -1;
      final Integer position = Ints.tryParse(column);
      if (idx < 0 && position != null) {
        idx = position;
      }
      if (idx < 0 || idx >= first.length) {
        throw new IOException("Column '" + column + "' not found in " + file);
      }
    } else {
      idx = hasHeader ? guessIndex(first, "eda", "gsr", "signal", "conductance") : -1;
      if (idx < 0) {
        idx = firstNumericColumn(rows, startRow);
      }
      if (idx < 0) {
        throw new IOException("No numeric column in " + file);
      }
    }

    final List<Double> values = new ArrayList<>(rows.size());
    for (int r = startRow; r < rows.size(); r++) {
      final String[] row = rows.get(r);
      if (row.length <= idx) {
        continue;
      }
      final Double value = Doubles.tryParse(row[idx]);
      if (value != null) {
        values.add(value);
      }
    }
    final String name = hasHeader ? first[idx] : "column " + idx;
    return new EdaColumn(name, Doubles.toArray(values));
  }

  private static boolean isNumericRow(String[] row) {
    for (String cell : row) {
      if (Doubles.tryParse(cell) == null) {
        return false;
      }
    }
    return row.length > 0;
  }

  private static int firstNumericColumn(List<String[]> rows, int startRow) {
    if (rows.size() <= startRow) {
      return -1;
    }
    final String[] row = rows.get(startRow);
    for (int c = 0; c < row.length; c++) {
      if (Doubles.tryParse(row[c]) != null) {
        return c;
      }
    }
    return -1;
  }

  private static int guessIndex(String[] header, String... keys) {
    for (String k : keys) {
      for (int i = 0; i < header.length; i++) {
        if (header[i].equalsIgnoreCase(k)) {
          return i;
        }
      }
    }
    // try contains
    for (String k : keys) {
      for (int i = 0; i < header.length; i++) {
        if (header[i].toLowerCase(Locale.ROOT).contains(k.toLowerCase(Locale.ROOT))) {
          return i;
        }
      }
    }
    return -1;
  }

  static void writeTsv(@NotNull Path out, double[] raw, @NotNull EdaDecompositionResult result)
      throws IOException {
    try (BufferedWriter writer = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
      writer.write(
          RAW + "\t" + EdaDecompositionResult.TONIC + "\t" + EdaDecompositionResult.PHASIC);
      writer.newLine();
      for (int i = 0; i < raw.length; i++) {
        writer.write(raw[i] + "\t" + result.tonic()[i] + "\t" + result.phasic()[i]);
        writer.newLine();
      }
    }
  }

  private static void saveChart(Path out, String title, double[] raw, int samplingRate,
      EdaDecompositionResult result) throws IOException {
    final XYSeriesCollection ds = new XYSeriesCollection();
    ds.addSeries(toSeries(RAW, raw, samplingRate));
    ds.addSeries(toSeries(EdaDecompositionResult.TONIC, result.tonic(), samplingRate));
    ds.addSeries(toSeries(EdaDecompositionResult.PHASIC, result.phasic(), samplingRate));

    final JFreeChart chart = ChartFactory.createXYLineChart(title, "Time (s)", "EDA", ds,
        PlotOrientation.VERTICAL, true, false, false);
    final XYPlot plot = chart.getXYPlot();
    final XYItemRenderer renderer = plot.getRenderer();
    renderer.setSeriesPaint(0, new Color(128, 128, 128));
    renderer.setSeriesPaint(1, new Color(0, 0, 200));
    renderer.setSeriesPaint(2, new Color(200, 0, 0));
    for (int s = 0; s < 3; s++) {
      renderer.setSeriesStroke(s, new BasicStroke(1f));
    }
    chart.addSubtitle(new TextTitle(raw.length + " samples at " + samplingRate + " Hz"));

    ChartUtils.saveChartAsPNG(out.toFile(), chart, 1200, 600);
  }

  private static XYSeries toSeries(String name, double[] values, int samplingRate) {
    final XYSeries series = new XYSeries(name, false, true);
    for (int i = 0; i < values.length; i++) {
      series.add((double) i / samplingRate, values[i], false);
    }
    return series;
  }

  record EdaColumn(String name, double[] values) {

  }
}
