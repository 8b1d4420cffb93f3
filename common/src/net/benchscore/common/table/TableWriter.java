/*
 * Copyright Myrrix Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.benchscore.common.table;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.util.List;

import com.google.common.base.CharMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.benchscore.common.io.IOUtils;

/**
 * Writes {@link Table}s as comma-delimited text that {@link TableReader} reads back. A field is quoted
 * only when it contains a comma, a quote or a line break.
 */
public final class TableWriter {

  private static final Logger log = LoggerFactory.getLogger(TableWriter.class);

  private static final CharMatcher NEEDS_QUOTING =
      CharMatcher.anyOf("" + TableReader.DELIMITER + TableReader.QUOTE + "\r\n");

  private TableWriter() {
  }

  /**
   * Writes the table, with a header row, replacing any existing content of the file.
   */
  public static void write(Table table, File file) throws IOException {
    write(table, file, false);
  }

  /**
   * @param table table to write
   * @param file destination
   * @param append if true, rows are appended to the file without a header row; the caller is responsible
   *  for the table's columns matching the file's header
   */
  public static void write(Table table, File file, boolean append) throws IOException {
    log.debug("Writing {} rows to {}", table.getNumRows(), file);
    Writer out = IOUtils.buildWriter(file, append);
    try {
      write(table, out, !append);
    } finally {
      out.close(); // Want to know of close failed -- maybe failed to write
    }
  }

  /**
   * @param table table to write
   * @param out destination; not closed by this method
   * @param header whether to write the header row
   */
  public static void write(Table table, Writer out, boolean header) throws IOException {
    if (header) {
      writeRecord(table.getColumns(), out);
    }
    for (List<String> row : table.getRows()) {
      writeRecord(row, out);
    }
    out.flush();
  }

  private static void writeRecord(List<String> values, Writer out) throws IOException {
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) {
        out.write(TableReader.DELIMITER);
      }
      out.write(quoteIfNeeded(values.get(i)));
    }
    out.write('\n');
  }

  static String quoteIfNeeded(String value) {
    if (NEEDS_QUOTING.matchesNoneOf(value)) {
      return value;
    }
    return TableReader.QUOTE + value.replace("\"", "\"\"") + TableReader.QUOTE;
  }

}
