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

package net.benchscore.scoring.board;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import net.benchscore.common.LangUtils;
import net.benchscore.common.table.Table;

/**
 * Renders the values of a scoreboard table for humans and for the scoreboard file.
 */
final class ScoreFormatter {

  private static final Set<String> TEXT_COLUMNS = ImmutableSet.of(
      "id", "task", "framework", "constraint", "type", "metric", "mode", "version", "params", "app_version",
      "utc", "info");
  private static final Set<String> INTEGER_COLUMNS = ImmutableSet.of("fold", "models_count", "seed");
  private static final Set<String> DURATION_COLUMNS =
      ImmutableSet.of("duration", "training_duration", "predict_duration");
  private static final MathContext SIX_DIGITS = new MathContext(6, RoundingMode.HALF_EVEN);
  private static final MathContext ONE_DIGIT = new MathContext(1, RoundingMode.HALF_EVEN);

  static final List<String> VERBOSITY_1_COLUMNS =
      ImmutableList.of("task", "fold", "framework", "constraint", "result", "metric", "info");
  static final List<String> VERBOSITY_2_COLUMNS =
      ImmutableList.of("id", "task", "fold", "framework", "constraint", "result", "metric", "duration", "seed", "info");

  private ScoreFormatter() {
  }

  /**
   * @param table scores, in canonical column order
   * @param verbosity 0 for no columns, 1 or 2 for a summary, 3 or more for all columns
   */
  static Table format(Table table, int verbosity) {
    List<String> columns = selectColumns(table.getColumns(), verbosity);
    Table selected = table.reindex(columns);
    int numColumns = columns.size();
    List<List<String>> formattedColumns = Lists.newArrayListWithCapacity(numColumns);
    for (int c = 0; c < numColumns; c++) {
      formattedColumns.add(formatColumn(columns.get(c), selected.getColumn(c)));
    }
    Table.Builder builder = Table.builder(columns);
    for (int row = 0; row < selected.getNumRows(); row++) {
      List<String> formattedRow = Lists.newArrayListWithCapacity(numColumns);
      for (List<String> column : formattedColumns) {
        formattedRow.add(column.get(row));
      }
      builder.addRow(formattedRow);
    }
    return builder.build();
  }

  private static List<String> selectColumns(List<String> columns, int verbosity) {
    if (verbosity <= 0) {
      return ImmutableList.of();
    }
    if (verbosity >= 3) {
      return columns;
    }
    List<String> wanted = verbosity == 1 ? VERBOSITY_1_COLUMNS : VERBOSITY_2_COLUMNS;
    List<String> selected = Lists.newArrayList();
    for (String column : wanted) {
      if (columns.contains(column)) {
        selected.add(column);
      }
    }
    return selected;
  }

  static List<String> formatColumn(String name, List<String> values) {
    List<String> formatted = Lists.newArrayListWithCapacity(values.size());
    if (TEXT_COLUMNS.contains(name)) {
      for (String value : values) {
        formatted.add(LangUtils.isMissing(value) ? "" : value);
      }
    } else if (INTEGER_COLUMNS.contains(name) && allNumeric(values)) {
      for (String value : values) {
        formatted.add(formatInteger(value));
      }
    } else if (DURATION_COLUMNS.contains(name) && allNumeric(values)) {
      for (String value : values) {
        formatted.add(formatDuration(value));
      }
    } else if (isFloatColumn(values)) {
      for (String value : values) {
        formatted.add(formatFloat(value));
      }
    } else {
      formatted.addAll(values);
    }
    return formatted;
  }

  /**
   * @return true if all present values are numeric, and some value is missing or not an integer, as a column
   *  of integers with missing values is stored as floats
   */
  private static boolean isFloatColumn(List<String> values) {
    boolean present = false;
    boolean floating = false;
    for (String value : values) {
      if (LangUtils.isMissing(value)) {
        floating = true;
      } else if (LangUtils.isNumeric(value)) {
        present = true;
        if (!LangUtils.isInteger(value)) {
          floating = true;
        }
      } else {
        return false;
      }
    }
    return present && floating;
  }

  private static boolean allNumeric(List<String> values) {
    for (String value : values) {
      if (!LangUtils.isMissing(value) && !LangUtils.isNumeric(value)) {
        return false;
      }
    }
    return true;
  }

  static String formatInteger(String value) {
    if (LangUtils.isMissing(value)) {
      return "";
    }
    double d = LangUtils.parseNumeric(value);
    if (Double.isNaN(d)) {
      return "";
    }
    if (!Double.isInfinite(d) && d == Math.rint(d)) {
      return Long.toString((long) d);
    }
    return formatFloat(value);
  }

  /**
   * @return one significant digit below 1 second, else one decimal
   */
  static String formatDuration(String value) {
    if (LangUtils.isMissing(value)) {
      return "";
    }
    double d = LangUtils.parseNumeric(value);
    if (Double.isNaN(d)) {
      return "";
    }
    if (Double.isInfinite(d)) {
      return Double.toString(d);
    }
    BigDecimal decimal = new BigDecimal(d);
    if (Math.abs(d) < 1.0) {
      return decimal.round(ONE_DIGIT).stripTrailingZeros().toPlainString();
    }
    return decimal.setScale(1, RoundingMode.HALF_EVEN).toPlainString();
  }

  /**
   * @return value rounded to six significant digits, without exponent or trailing zeros
   */
  static String formatFloat(String value) {
    if (LangUtils.isMissing(value)) {
      return "";
    }
    double d = LangUtils.parseNumeric(value);
    if (Double.isNaN(d)) {
      return "";
    }
    if (Double.isInfinite(d)) {
      return Double.toString(d);
    }
    return new BigDecimal(d).round(SIX_DIGITS).stripTrailingZeros().toPlainString();
  }

}
