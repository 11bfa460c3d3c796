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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.NotNull;

/**
 * Reading of small tab, comma or semicolon separated tables. Cells are trimmed and stripped of
 * surrounding double quotes; quoted separators are not supported.
 */
public final class DelimitedTextUtils {

  private static final char[] SEPARATORS = {'\t', ',', ';'};

  private DelimitedTextUtils() {
  }

  /**
   * @return the separator occurring most often in the first non-blank line, tab if none occurs
   */
  public static char detectSeparator(@NotNull List<String> lines) {
    final String first = lines.stream().filter(l -> !l.isBlank()).findFirst().orElse("");
    char best = '\t';
    int bestCount = 0;
    for (char sep : SEPARATORS) {
      final int count = CharMatcher.is(sep).countIn(first);
      if (count > bestCount) {
        best = sep;
        bestCount = count;
      }
    }
    return best;
  }

  /**
   * @return all non-blank lines split into cells, using the detected separator
   */
  public static @NotNull List<String[]> readRows(@NotNull Path file) throws IOException {
    final List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    final Splitter splitter = Splitter.on(detectSeparator(lines)).trimResults(
        CharMatcher.whitespace().or(CharMatcher.is('"')));
    final List<String[]> rows = new ArrayList<>(lines.size());
    for (String line : lines) {
      if (line.isBlank()) {
        continue;
      }
      rows.add(splitter.splitToList(line).toArray(String[]::new));
    }
    return rows;
  }
}
