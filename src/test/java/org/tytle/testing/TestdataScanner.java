/*
 * Copyright 2025 The Tytle Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.tytle.testing;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter.TestParameterValuesProvider;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Provides the test programs found in the {@code .tyt} files of a testdata directory.
 *
 * <p>Each program is followed by a block of {@code ;;} comment lines, the first of which starts
 * with a given keyword (e.g. {@code ;; COMPILE}). The rest of that first line is the test's
 * header, and the remaining comment lines (without their {@code ;;}) are its expected output. The
 * next program starts on the line after the comment block.
 */
public class TestdataScanner implements TestParameterValuesProvider {

  /**
   * One test program.
   *
   * @param name the file name and the program's index in the file
   * @param code the program's source
   * @param header the rest of the keyword line, trimmed
   * @param expected the expected output lines, joined with newlines
   */
  public record TestProgram(String name, String code, String header, String expected) {
    @Override
    public String toString() {
      return name;
    }
  }

  private final Path dir;
  private final String keyword;

  protected TestdataScanner(Path dir, String keyword) {
    this.dir = dir;
    this.keyword = ";; " + keyword;
  }

  @Override
  public List<TestProgram> provideValues() {
    try (Stream<Path> files = Files.list(dir)) {
      return files
          .filter(f -> f.toString().endsWith(".tyt"))
          .sorted()
          .flatMap(f -> scan(f).stream())
          .collect(ImmutableList.toImmutableList());
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private ImmutableList<TestProgram> scan(Path file) {
    List<String> lines;
    try {
      lines = Files.readAllLines(file);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    ImmutableList.Builder<TestProgram> result = ImmutableList.builder();
    StringBuilder code = new StringBuilder();
    int count = 0;
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i);
      if (!line.startsWith(keyword)) {
        code.append(line).append('\n');
        continue;
      }
      String header = line.substring(keyword.length()).trim();
      StringBuilder expected = new StringBuilder();
      while (i + 1 < lines.size() && lines.get(i + 1).startsWith(";;")) {
        expected.append(lines.get(++i).substring(2).trim()).append('\n');
      }
      String name = String.format("%s[%s]", file.getFileName(), ++count);
      result.add(new TestProgram(name, code.toString(), header, expected.toString()));
      code.setLength(0);
    }
    return result.build();
  }
}
