/*
 * Copyright (c) 2025 The edakit Development Team
 */

package io.github.edakit.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DelimitedTextUtilsTest {

  @Test
  void testDetectSeparator() {
    Assertions.assertEquals(',', DelimitedTextUtils.detectSeparator(List.of("", "time,eda,ecg")));
    Assertions.assertEquals(';', DelimitedTextUtils.detectSeparator(List.of("time;eda")));
    Assertions.assertEquals('\t', DelimitedTextUtils.detectSeparator(List.of("time\teda,x")));
    Assertions.assertEquals('\t', DelimitedTextUtils.detectSeparator(List.of("eda")));
  }

  @Test
  void testReadRows(@TempDir Path dir) throws IOException {
    final Path file = dir.resolve("table.csv");
    Files.writeString(file, "\"time\", \"EDA\"\n0.0, 1.5\n\n0.1,1.6\n");

    final List<String[]> rows = DelimitedTextUtils.readRows(file);

    Assertions.assertEquals(3, rows.size());
    Assertions.assertArrayEquals(new String[]{"time", "EDA"}, rows.get(0));
    Assertions.assertArrayEquals(new String[]{"0.0", "1.5"}, rows.get(1));
    Assertions.assertArrayEquals(new String[]{"0.1", "1.6"}, rows.get(2));
  }
}
