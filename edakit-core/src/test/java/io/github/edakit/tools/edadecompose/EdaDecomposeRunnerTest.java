/*
 * Copyright (c) 2025 The edakit Development Team
 */

package io.github.edakit.tools.edadecompose;

import io.github.edakit.tools.edadecompose.EdaDecomposeRunner.EdaColumn;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EdaDecomposeRunnerTest {

  @TempDir
  Path tempDir;

  private Path writeRecording(String name, String separator, int samples) throws IOException {
    final List<String> lines = new ArrayList<>();
    lines.add(String.join(separator, "Time", "ECG", "EDA"));
    for (int i = 0; i < samples; i++) {
      final double eda = 2.0 + 0.01 * i + (i % 25 == 0 ? 0.5 : 0d);
      lines.add(String.format(Locale.US, "%.1f%s%.3f%s%.4f", i / 10d, separator,
          Math.sin(i / 3d), separator, eda));
    }
    final Path file = tempDir.resolve(name);
    Files.write(file, lines, StandardCharsets.UTF_8);
    return file;
  }

  @Test
  void testWritesDecomposedTable() throws IOException {
    final Path input = writeRecording("session1.csv", ",", 120);
    final Properties props = new Properties();
    props.setProperty("inputFile", input.toString());
    props.setProperty("samplingRate", "10");
    props.setProperty("method", "median");

    final List<Path> written = EdaDecomposeRunner.run(props);

    final Path expected = tempDir.resolve("eda_decomposed").resolve("session1_decomposed.tsv");
    Assertions.assertEquals(List.of(expected), written);
    final List<String> lines = Files.readAllLines(expected, StandardCharsets.UTF_8);
    Assertions.assertEquals(121, lines.size());
    Assertions.assertEquals("EDA_Raw\tEDA_Tonic\tEDA_Phasic", lines.get(0));
    for (String line : lines.subList(1, lines.size())) {
      final String[] cells = line.split("\t");
      Assertions.assertEquals(3, cells.length);
      final double raw = Double.parseDouble(cells[0]);
      final double tonic = Double.parseDouble(cells[1]);
      final double phasic = Double.parseDouble(cells[2]);
      Assertions.assertEquals(raw, tonic + phasic, 1e-9);
    }
    Assertions.assertEquals(2.5, Double.parseDouble(lines.get(1).split("\t")[0]), 1e-12);
  }

  @Test
  void testWritesChart() throws IOException {
    final Path input = writeRecording("session2.tsv", "\t", 300);
    final Properties props = new Properties();
    props.setProperty("inputFile", input.toString());
    props.setProperty("outDir", tempDir.resolve("out").toString());
    props.setProperty("samplingRate", "10");
    props.setProperty("format", "both");

    final List<Path> written = EdaDecomposeRunner.run(props);

    Assertions.assertEquals(2, written.size());
    Assertions.assertTrue(written.get(1).getFileName().toString().endsWith(".png"));
    Assertions.assertTrue(Files.size(written.get(1)) > 0);
  }

  @Test
  void testReadColumnByNameIndexAndGuess() throws IOException {
    final Path input = writeRecording("session3.csv", ";", 5);

    final EdaColumn guessed = EdaDecomposeRunner.readColumn(input, "");
    Assertions.assertEquals("EDA", guessed.name());
    Assertions.assertArrayEquals(new double[]{2.5, 2.01, 2.02, 2.03, 2.04}, guessed.values(),
        1e-12);

    final EdaColumn byName = EdaDecomposeRunner.readColumn(input, "ecg");
    Assertions.assertEquals("ECG", byName.name());
    Assertions.assertEquals(0d, byName.values()[0]);

    final EdaColumn byIndex = EdaDecomposeRunner.readColumn(input, "0");
    Assertions.assertArrayEquals(new double[]{0, 0.1, 0.2, 0.3, 0.4}, byIndex.values(), 1e-12);

    Assertions.assertThrows(IOException.class,
        () -> EdaDecomposeRunner.readColumn(input, "resp"));
  }

  @Test
  void testHeaderlessFileUsesFirstNumericColumn() throws IOException {
    final Path input = tempDir.resolve("plain.txt");
    Files.write(input, List.of("1.5\t7", "1.6\t8", "", "1.7\t9"), StandardCharsets.UTF_8);

    final EdaColumn column = EdaDecomposeRunner.readColumn(input, "");

    Assertions.assertEquals("column 0", column.name());
    Assertions.assertArrayEquals(new double[]{1.5, 1.6, 1.7}, column.values(), 1e-12);
    Assertions.assertArrayEquals(new double[]{7, 8, 9},
        EdaDecomposeRunner.readColumn(input, "1").values(), 1e-12);
  }

  @Test
  void testEmptyFile() throws IOException {
    final Path input = tempDir.resolve("empty.csv");
    Files.write(input, List.of(), StandardCharsets.UTF_8);
    Assertions.assertThrows(IOException.class, () -> EdaDecomposeRunner.readColumn(input, ""));
  }
}
