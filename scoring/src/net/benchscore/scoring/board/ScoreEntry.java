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

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import net.benchscore.common.table.Table;

/**
 * One row of a scoreboard: the scores of one framework run on one task fold, keyed by column name. Columns
 * keep the order in which they were first set.
 */
public final class ScoreEntry {

  private final Map<String,Object> values;

  public ScoreEntry() {
    values = Maps.newLinkedHashMap();
  }

  /**
   * Sets a column, replacing any previous value. {@code null} means missing.
   */
  public ScoreEntry put(String column, Object value) {
    Preconditions.checkNotNull(column);
    values.put(column, value);
    return this;
  }

  public Object get(String column) {
    return values.get(column);
  }

  /**
   * @return value as a number, or NaN if it is missing or not a number
   */
  public double getDouble(String column) {
    Object value = values.get(column);
    return value instanceof Number ? ((Number) value).doubleValue() : Double.NaN;
  }

  public boolean hasColumn(String column) {
    return values.containsKey(column);
  }

  public List<String> getColumns() {
    return ImmutableList.copyOf(values.keySet());
  }

  /**
   * @return values rendered as strings; missing and NaN values are empty
   */
  public Map<String,String> asRecord() {
    Map<String,String> record = Maps.newLinkedHashMap();
    for (Map.Entry<String,Object> entry : values.entrySet()) {
      record.put(entry.getKey(), render(entry.getValue()));
    }
    return record;
  }

  private static String render(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      return Double.isNaN(d) ? "" : Double.toString(d);
    }
    return value.toString();
  }

  /**
   * @return table with one row per entry, and the union of the entries' columns in order of first appearance
   */
  public static Table toTable(Collection<ScoreEntry> entries) {
    Set<String> columns = Sets.newLinkedHashSet();
    List<Map<String,String>> records = Lists.newArrayListWithCapacity(entries.size());
    for (ScoreEntry entry : entries) {
      columns.addAll(entry.values.keySet());
      records.add(entry.asRecord());
    }
    return Table.fromRecords(ImmutableList.copyOf(columns), records);
  }

  @Override
  public String toString() {
    return values.toString();
  }

}
