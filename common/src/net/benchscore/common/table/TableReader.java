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

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.util.List;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.Lists;
import com.google.common.io.Closeables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.benchscore.common.io.IOUtils;

/**
 * Reads comma-delimited files with a header row into {@link Table}s. Fields may be quoted with {@code "},
 * in which case they may contain commas, line breaks and doubled quotes. Files whose names end in a
 * compression suffix are decompressed as they are read.
 *
 * @see TableWriter
 */
public final class TableReader {

  private static final Logger log = LoggerFactory.getLogger(TableReader.class);

  static final char DELIMITER = ',';
  static final char QUOTE = '"';
  private static final Splitter COMMA_SPLIT = Splitter.on(DELIMITER);
  private static final CharMatcher QUOTE_MATCHER = CharMatcher.is(QUOTE);
  private static final char BYTE_ORDER_MARK = '\uFEFF';

  private TableReader() {
  }

  /**
   * @param file delimited file, possibly compressed
   * @return its contents; a file with no content at all yields {@link Table#empty()}
   * @throws IOException if the file can't be read or is malformed
   */
  public static Table read(File file) throws IOException {
    log.debug("Reading {}", file);
    BufferedReader in = IOUtils.openReaderMaybeDecompressing(file);
    try {
      return read(in, Integer.MAX_VALUE);
    } catch (IOException ioe) {
      throw new IOException("Could not read " + file + ": " + ioe.getMessage(), ioe);
    } finally {
      Closeables.close(in, true);
    }
  }

  /**
   * @param file delimited file, possibly compressed
   * @return column names from its header row, or an empty list if the file is empty
   */
  public static List<String> readHeader(File file) throws IOException {
    BufferedReader in = IOUtils.openReaderMaybeDecompressing(file);
    try {
      return read(in, 0).getColumns();
    } finally {
      Closeables.close(in, true);
    }
  }

  /**
   * @param reader source of delimited text; not closed by this method
   * @param maxRows maximum number of data rows to read
   * @return table of the header and up to {@code maxRows} rows
   */
  public static Table read(Reader reader, int maxRows) throws IOException {
    BufferedReader in = IOUtils.buffer(reader);
    List<String> header = readRecord(in);
    if (header == null) {
      return Table.empty();
    }
    if (!header.isEmpty() && !header.get(0).isEmpty() && header.get(0).charAt(0) == BYTE_ORDER_MARK) {
      header.set(0, header.get(0).substring(1));
    }
    Table.Builder builder = Table.builder(header);
    int numColumns = header.size();
    int count = 0;
    List<String> record;
    while (count < maxRows && (record = readRecord(in)) != null) {
      count++;
      if (record.size() > numColumns) {
        throw new IOException("Row " + count + " has " + record.size() + " fields but header has " + numColumns);
      }
      while (record.size() < numColumns) {
        record.add("");
      }
      builder.addRow(record);
    }
    return builder.build();
  }

  /**
   * @return fields of the next non-blank record, or {@code null} at end of input
   */
  private static List<String> readRecord(BufferedReader in) throws IOException {
    String line;
    do {
      line = in.readLine();
      if (line == null) {
        return null;
      }
    } while (line.isEmpty());

    if (QUOTE_MATCHER.matchesNoneOf(line)) {
      return Lists.newArrayList(COMMA_SPLIT.split(line));
    }

    // Quoted fields may span lines; keep reading until quotes balance
    StringBuilder record = new StringBuilder(line);
    while (QUOTE_MATCHER.countIn(record) % 2 != 0) {
      String next = in.readLine();
      if (next == null) {
        throw new IOException("Unterminated quoted field: " + record);
      }
      record.append('\n').append(next);
    }
    return parseQuoted(record);
  }

  private static List<String> parseQuoted(CharSequence record) {
    List<String> fields = Lists.newArrayList();
    StringBuilder field = new StringBuilder();
    boolean inQuotes = false;
    int length = record.length();
    for (int i = 0; i < length; i++) {
      char c = record.charAt(i);
      if (inQuotes) {
        if (c == QUOTE) {
          if (i + 1 < length && record.charAt(i + 1) == QUOTE) {
            field.append(QUOTE);
            i++;
          } else {
            inQuotes = false;
          }
        } else {
          field.append(c);
        }
      } else if (c == QUOTE) {
        inQuotes = true;
      } else if (c == DELIMITER) {
        fields.add(field.toString());
        field.setLength(0);
      } else {
        field.append(c);
      }
    }
    fields.add(field.toString());
    return fields;
  }

}
