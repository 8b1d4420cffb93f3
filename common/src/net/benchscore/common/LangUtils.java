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

package net.benchscore.common;

import java.util.regex.Pattern;

import com.google.common.base.Preconditions;

/**
 * General utility methods related to the language, or primitives, and to parsing the textual values
 * found in delimited files.
 */
public final class LangUtils {

  private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");

  private LangUtils() {
  }

  /**
   * Parses a numeric cell of a delimited file. Besides what {@link Double#parseDouble(String)} accepts,
   * this accepts the spellings of missing and special values that numeric tables commonly contain: an empty cell,
   * {@code nan}, {@code inf}, {@code -inf} and {@code Infinity}, in any case.
   *
   * @param s cell value
   * @return parsed value, {@link Double#NaN} for an empty cell
   * @throws NumberFormatException if the value is not numeric
   */
  public static double parseNumeric(String s) {
    Preconditions.checkNotNull(s);
    String trimmed = s.trim();
    if (trimmed.isEmpty() || "nan".equalsIgnoreCase(trimmed)) {
      return Double.NaN;
    }
    String unsigned = trimmed;
    boolean negative = false;
    if (trimmed.charAt(0) == '-' || trimmed.charAt(0) == '+') {
      negative = trimmed.charAt(0) == '-';
      unsigned = trimmed.substring(1);
    }
    if ("inf".equalsIgnoreCase(unsigned) || "infinity".equalsIgnoreCase(unsigned)) {
      return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    }
    return Double.parseDouble(trimmed);
  }

  /**
   * @return true iff {@link #parseNumeric(String)} would accept the value
   */
  public static boolean isNumeric(String s) {
    if (s == null) {
      return false;
    }
    try {
      parseNumeric(s);
      return true;
    } catch (NumberFormatException ignored) {
      return false;
    }
  }

  /**
   * @return true iff the value is an optionally signed sequence of decimal digits
   */
  public static boolean isInteger(String s) {
    return s != null && INTEGER.matcher(s.trim()).matches();
  }

  /**
   * @return true if argument is not {@link Double#NaN}, {@link Double#POSITIVE_INFINITY} or
   *  {@link Double#NEGATIVE_INFINITY}
   */
  public static boolean isFinite(double d) {
    return !(Double.isNaN(d) || Double.isInfinite(d));
  }

  /**
   * @return true iff every element of the array is finite
   * @see #isFinite(double)
   */
  public static boolean allFinite(double[] values) {
    for (double value : values) {
      if (!isFinite(value)) {
        return false;
      }
    }
    return true;
  }

  /**
   * @return true iff the value is null, empty, the literal {@code None} or {@code NaN}, which all mean
   *  "missing" in a delimited file
   */
  public static boolean isMissing(String s) {
    return s == null || s.isEmpty() || "None".equals(s) || "nan".equalsIgnoreCase(s);
  }

}
