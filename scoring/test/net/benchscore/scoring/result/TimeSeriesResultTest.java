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

package net.benchscore.scoring.result;

import org.junit.Test;

import net.benchscore.common.BenchScoreTest;
import net.benchscore.common.table.Table;
import net.benchscore.scoring.ProblemType;
import net.benchscore.scoring.validation.InvalidPredictionsException;

public final class TimeSeriesResultTest extends BenchScoreTest {

  private static final String[] COLUMNS =
      { "predictions", "truth", "repeated_item_id", "repeated_abs_seasonal_error", "0.5" };

  /**
   * Two items of two steps each. The median forecast equals the point forecast.
   */
  private static TimeSeriesResult example() throws InvalidPredictionsException {
    Table table = Table.builder(COLUMNS)
        .addRow("12", "10", "A", "2", "12")
        .addRow("18", "20", "A", "2", "18")
        .addRow("5", "5", "B", "1", "5")
        .addRow("10", "5", "B", "1", "10")
        .build();
    return new TimeSeriesResult(table);
  }

  @Test
  public void testPointForecastMetrics() throws Exception {
    TimeSeriesResult result = example();
    assertSame(ProblemType.TIMESERIES, result.getType());
    assertEquals((2.0 / 11.0 + 2.0 / 19.0 + 0.0 + 5.0 / 7.5) / 4.0, result.evaluate("smape").getValue());
    assertEquals(0.325, result.evaluate("mape").getValue());
    assertEquals(9.0 / 40.0, result.evaluate("wape").getValue());
    assertEquals(1.75, result.evaluate("mase").getValue());
  }

  @Test
  public void testRegressionMetrics() throws Exception {
    TimeSeriesResult result = example();
    Evaluation mae = result.evaluate("mae");
    assertEquals(2.25, mae.getValue());
    assertFalse(mae.isHigherBetter());
    assertEquals(Math.sqrt(result.evaluate("mse").getValue()), result.evaluate("rmse").getValue());
    assertTrue(result.getSupportedMetrics().contains("r2"));
    assertTrue(result.getSupportedMetrics().contains("wql"));
  }

  @Test
  public void testQuantileMetrics() throws Exception {
    TimeSeriesResult result = example();
    assertEquals(1, result.getNumQuantileLevels());
    // at level 0.5 the pinball loss is the absolute error
    assertEquals(2.25, result.evaluate("mql").getValue());
    assertEquals(9.0 / 40.0, result.evaluate("wql").getValue());
    assertEquals(1.75, result.evaluate("sql").getValue());
  }

  @Test
  public void testAsymmetricQuantileLoss() throws Exception {
    Table table = Table.builder("predictions", "truth", "repeated_item_id", "repeated_abs_seasonal_error", "0.1", "0.9")
        .addRow("10", "10", "A", "1", "12", "12")
        .build();
    // over-forecast by 2: 2*2*0.9 at level 0.1, 2*2*0.1 at level 0.9
    assertEquals((3.6 + 0.4) / 2.0, new TimeSeriesResult(table).evaluate("mql").getValue());
  }

  @Test
  public void testSafeMeanIgnoresInfinity() throws Exception {
    Table table = Table.builder(COLUMNS)
        .addRow("1", "0", "A", "1", "1")
        .addRow("3", "2", "A", "1", "3")
        .build();
    // the first ratio is infinite
    assertEquals(0.5, new TimeSeriesResult(table).evaluate("mape").getValue());
  }

  @Test
  public void testNoQuantiles() throws Exception {
    Table table = Table.builder("predictions", "truth", "repeated_item_id", "repeated_abs_seasonal_error")
        .addRow("1", "1", "A", "1")
        .build();
    TimeSeriesResult result = new TimeSeriesResult(table);
    Evaluation mql = result.evaluate("mql");
    assertNaN(mql.getValue());
    assertTrue(mql.getMessage().startsWith("Scoring mql: "));
    assertEquals(0.0, result.evaluate("mae").getValue());
  }

  @Test
  public void testUnequalLengths() {
    Table.Builder builder = Table.builder(COLUMNS);
    for (String item : new String[] { "A", "A", "A", "B", "B", "B", "C", "C" }) {
      builder.addRow("1", "1", item, "1", "1");
    }
    try {
      new TimeSeriesResult(builder.build());
      fail();
    } catch (InvalidPredictionsException ipe) {
      assertTrue(ipe.getMessage(), ipe.getMessage().contains("{3, 2}"));
    }
  }

  @Test(expected = InvalidPredictionsException.class)
  public void testInfiniteQuantile() throws Exception {
    Table table = Table.builder(COLUMNS)
        .addRow("1", "1", "A", "1", "1")
        .addRow("1", "1", "A", "1", "inf")
        .build();
    new TimeSeriesResult(table);
  }

  @Test(expected = InvalidPredictionsException.class)
  public void testNaNPrediction() throws Exception {
    Table table = Table.builder(COLUMNS).addRow("nan", "1", "A", "1", "1").build();
    new TimeSeriesResult(table);
  }

  @Test
  public void testMissingColumn() {
    Table table = Table.builder("predictions", "truth", "repeated_item_id").addRow("1", "1", "A").build();
    try {
      new TimeSeriesResult(table);
      fail();
    } catch (InvalidPredictionsException ipe) {
      assertTrue(ipe.getMessage().contains("repeated_abs_seasonal_error"));
    }
  }

  @Test
  public void testUnrecognizedColumn() {
    Table table = Table.builder("predictions", "truth", "repeated_item_id", "repeated_abs_seasonal_error", "foo")
        .addRow("1", "1", "A", "1", "x")
        .build();
    try {
      new TimeSeriesResult(table);
      fail();
    } catch (InvalidPredictionsException ipe) {
      assertTrue(ipe.getMessage().contains("[foo]"));
    }
  }

}
