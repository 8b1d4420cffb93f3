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

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

/**
 * <p>An immutable, row-oriented table of textual values with named columns, as read from or written to a
 * delimited file. Values are never null; a missing value is the empty string.</p>
 *
 * <p>Column names are normally unique. A table read from a file may nevertheless contain repeated names,
 * which is a condition some callers want to detect; lookups by name then resolve to the first such column.</p>
 */
public final class Table {

  private static final Table EMPTY = new Table(ImmutableList.<String>of(), ImmutableList.<List<String>>of());

  private final List<String> columns;
  private final List<List<String>> rows;
  private final Map<String,Integer> columnIndex;

  private Table(List<String> columns, List<List<String>> rows) {
    this.columns = columns;
    this.rows = rows;
    columnIndex = Maps.newHashMap();
    for (int i = columns.size() - 1; i >= 0; i--) {
      columnIndex.put(columns.get(i), i);
    }
  }

  /**
   * @return table with no columns and no rows
   */
  public static Table empty() {
    return EMPTY;
  }

  /**
   * @param columns column names, in order
   * @return a {@link Builder} for a table with these columns
   */
  public static Builder builder(List<String> columns) {
    return new Builder(columns);
  }

  /**
   * @see #builder(List)
   */
  public static Builder builder(String... columns) {
    return new Builder(ImmutableList.copyOf(columns));
  }

  /**
   * Builds a table from records keyed by column name; a record lacking a column gets an empty value.
   */
  public static Table fromRecords(List<String> columns, Collection<? extends Map<String,String>> records) {
    Builder builder = builder(columns);
    for (Map<String,String> record : records) {
      List<String> row = Lists.newArrayListWithCapacity(columns.size());
      for (String column : columns) {
        String value = record.get(column);
        row.add(value == null ? "" : value);
      }
      builder.addRow(row);
    }
    return builder.build();
  }

  public List<String> getColumns() {
    return columns;
  }

  public int getNumColumns() {
    return columns.size();
  }

  public int getNumRows() {
    return rows.size();
  }

  /**
   * @return true iff the table has no rows
   */
  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public List<List<String>> getRows() {
    return rows;
  }

  public List<String> getRow(int row) {
    return rows.get(row);
  }

  public String get(int row, int column) {
    return rows.get(row).get(column);
  }

  public String get(int row, String column) {
    return get(row, indexOf(column));
  }

  public boolean hasColumn(String column) {
    return columnIndex.containsKey(column);
  }

  /**
   * @return index of the (first) column with the given name, or -1 if absent
   */
  public int indexOf(String column) {
    Integer index = columnIndex.get(column);
    return index == null ? -1 : index;
  }

  /**
   * @return values of the column at the given index, one per row
   */
  public List<String> getColumn(int column) {
    Preconditions.checkElementIndex(column, columns.size());
    ImmutableList.Builder<String> values = ImmutableList.builder();
    for (List<String> row : rows) {
      values.add(row.get(column));
    }
    return values.build();
  }

  /**
   * @return values of the named column, one per row
   * @throws IllegalArgumentException if there is no such column
   */
  public List<String> getColumn(String column) {
    int index = indexOf(column);
    Preconditions.checkArgument(index >= 0, "No column %s in %s", column, columns);
    return getColumn(index);
  }

  /**
   * @return the value of each row as a map from column name to value, in column order
   */
  public List<Map<String,String>> asRecords() {
    List<Map<String,String>> records = Lists.newArrayListWithCapacity(rows.size());
    for (List<String> row : rows) {
      Map<String,String> record = Maps.newLinkedHashMap();
      for (int i = 0; i < columns.size(); i++) {
        if (!record.containsKey(columns.get(i))) {
          record.put(columns.get(i), row.get(i));
        }
      }
      records.add(record);
    }
    return records;
  }

  /**
   * @param newColumns columns of the result, in order
   * @return table with exactly the given columns; columns this table lacks are filled with empty values
   */
  public Table reindex(List<String> newColumns) {
    if (newColumns.equals(columns)) {
      return this;
    }
    int[] sourceIndices = new int[newColumns.size()];
    for (int i = 0; i < sourceIndices.length; i++) {
      sourceIndices[i] = indexOf(newColumns.get(i));
    }
    Builder builder = builder(newColumns);
    for (List<String> row : rows) {
      List<String> newRow = Lists.newArrayListWithCapacity(sourceIndices.length);
      for (int sourceIndex : sourceIndices) {
        newRow.add(sourceIndex < 0 ? "" : row.get(sourceIndex));
      }
      builder.addRow(newRow);
    }
    return builder.build();
  }

  /**
   * Concatenates the rows of this table and another. The result has this table's columns followed by
   * the other table's columns that this one lacks; rows get empty values for columns they lack.
   */
  public Table concat(Table other) {
    Set<String> union = Sets.newLinkedHashSet(columns);
    union.addAll(other.getColumns());
    List<String> unionColumns = ImmutableList.copyOf(union);
    Table left = reindex(unionColumns);
    Table right = other.reindex(unionColumns);
    Builder builder = builder(unionColumns);
    for (List<String> row : left.getRows()) {
      builder.addRow(row);
    }
    for (List<String> row : right.getRows()) {
      builder.addRow(row);
    }
    return builder.build();
  }

  /**
   * @return table without repeated rows, keeping the first occurrence of each
   */
  public Table distinct() {
    Set<List<String>> seen = Sets.newHashSet();
    Builder builder = builder(columns);
    for (List<String> row : rows) {
      if (seen.add(row)) {
        builder.addRow(row);
      }
    }
    return builder.build();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Table)) {
      return false;
    }
    Table other = (Table) o;
    return columns.equals(other.columns) && rows.equals(other.rows);
  }

  @Override
  public int hashCode() {
    return 31 * columns.hashCode() + rows.hashCode();
  }

  /**
   * @return the header and up to the first 10 rows
   */
  @Override
  public String toString() {
    return preview(10);
  }

  /**
   * @param maxRows number of rows to include
   * @return multi-line rendering of the header and first rows
   */
  public String preview(int maxRows) {
    Joiner joiner = Joiner.on('\t');
    StringBuilder result = new StringBuilder();
    result.append(joiner.join(columns)).append('\n');
    for (List<String> row : rows.subList(0, Math.min(maxRows, rows.size()))) {
      result.append(joiner.join(row)).append('\n');
    }
    if (rows.size() > maxRows) {
      result.append("... (").append(rows.size()).append(" rows)\n");
    }
    return result.toString();
  }

  /**
   * Accumulates rows of a {@link Table}.
   */
  public static final class Builder {

    private final List<String> columns;
    private final ImmutableList.Builder<List<String>> rows;

    private Builder(List<String> columns) {
      Preconditions.checkNotNull(columns);
      this.columns = ImmutableList.copyOf(columns);
      this.rows = ImmutableList.builder();
    }

    /**
     * @param row values, one per column
     * @return this
     * @throws IllegalArgumentException if the row does not have one value per column
     */
    public Builder addRow(List<String> row) {
      Preconditions.checkArgument(row.size() == columns.size(),
                                  "Expected %s values but got %s: %s", columns.size(), row.size(), row);
      rows.add(ImmutableList.copyOf(row));
      return this;
    }

    public Builder addRow(String... row) {
      return addRow(ImmutableList.copyOf(row));
    }

    public Table build() {
      return new Table(columns, rows.build());
    }

  }

}
