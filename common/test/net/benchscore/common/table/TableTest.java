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

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import net.benchscore.common.BenchScoreTest;

public final class TableTest extends BenchScoreTest {

  private static Table sample() {
    return Table.builder("a", "b")
        .addRow("1", "x")
        .addRow("2", "y")
        .build();
  }

  @Test
  public void testAccess() {
    Table table = sample();
    assertEquals(2, table.getNumColumns());
    assertEquals(2, table.getNumRows());
    assertEquals("y", table.get(1, "b"));
    assertEquals(Arrays.asList("1", "2"), table.getColumn("a"));
    assertEquals(-1, table.indexOf("c"));
    assertFalse(table.hasColumn("c"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testWrongRowLength() {
    Table.builder("a", "b").addRow("1");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMissingColumn() {
    sample().getColumn("c");
  }

  @Test
  public void testReindex() {
    Table reindexed = sample().reindex(Arrays.asList("b", "c"));
    assertEquals(Arrays.asList("b", "c"), reindexed.getColumns());
    assertEquals(Arrays.asList("x", ""), reindexed.getRow(0));
  }

  @Test
  public void testConcatUnionsColumns() {
    Table other = Table.builder("b", "c").addRow("z", "3").build();
    Table concatenated = sample().concat(other);
    assertEquals(Arrays.asList("a", "b", "c"), concatenated.getColumns());
    assertEquals(3, concatenated.getNumRows());
    assertEquals(Arrays.asList("1", "x", ""), concatenated.getRow(0));
    assertEquals(Arrays.asList("", "z", "3"), concatenated.getRow(2));
  }

  @Test
  public void testDistinct() {
    Table doubled = sample().concat(sample());
    assertEquals(4, doubled.getNumRows());
    Table distinct = doubled.distinct();
    assertEquals(sample(), distinct);
  }

  @Test
  public void testRecords() {
    List<String> columns = Arrays.asList("a", "b");
    List<Map<String,String>> records = Arrays.<Map<String,String>>asList(
        ImmutableMap.of("a", "1", "b", "x"),
        ImmutableMap.of("a", "2"));
    Table table = Table.fromRecords(columns, records);
    assertEquals("", table.get(1, "b"));
    assertEquals(records.get(0), table.asRecords().get(0));
  }

  @Test
  public void testEmpty() {
    assertTrue(Table.empty().isEmpty());
    assertEquals(0, Table.empty().getNumColumns());
    assertEquals(sample(), Table.empty().concat(sample()));
  }

}
