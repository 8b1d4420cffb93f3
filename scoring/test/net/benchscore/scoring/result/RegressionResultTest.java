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

public final class RegressionResultTest extends BenchScoreTest {

  private static RegressionResult build(String[] predictions, String[] truth) {
    Table.Builder builder = Table.builder("predictions", "truth");
    for (int i = 0; i < predictions.length; i++) {
      builder.addRow(predictions[i], truth[i]);
    }
    return new RegressionResult(builder.build());
  }

  private static RegressionResult example() {
    return build(new String[] { "1", "2", "4" }, new String[] { "1", "2", "3" });
  }

  @Test
  public void testErrors() {
    RegressionResult result = example();
    assertSame(ProblemType.REGRESSION, result.getType());
    assertEquals(1.0 / 3.0, result.evaluate("mae").getValue());
    assertEquals(1.0 / 3.0, result.evaluate("mse").getValue());
    assertEquals(Math.sqrt(1.0 / 3.0), result.evaluate("rmse").getValue());
    double logDiff = Math.log(4.0) - Math.log(5.0);
    assertEquals(logDiff * logDiff / 3.0, result.evaluate("msle").getValue());
  }

  @Test
  public void testRootIdentities() {
    RegressionResult result = build(new String[] { "0.5", "3.25", "10", "7.5" },
                                    new String[] { "1", "2.75", "12", "7" });
    assertEquals(Math.sqrt(result.evaluate("mse").getValue()), result.evaluate("rmse").getValue());
    assertEquals(Math.sqrt(result.evaluate("msle").getValue()), result.evaluate("rmsle").getValue());
  }

  @Test
  public void testR2() {
    // SSres = 1, SStot = 2
    Evaluation r2 = example().evaluate("r2");
    assertEquals(0.5, r2.getValue());
    assertTrue(r2.isHigherBetter());
  }

  @Test
  public void testR2ConstantTruth() {
    assertEquals(1.0, build(new String[] { "2", "2" }, new String[] { "2", "2" }).evaluate("r2").getValue());
    assertEquals(0.0, build(new String[] { "2", "3" }, new String[] { "2", "2" }).evaluate("r2").getValue());
  }

  @Test
  public void testLogErrorBelowMinusOne() {
    RegressionResult result = build(new String[] { "-2", "1" }, new String[] { "1", "1" });
    assertNaN(result.evaluate("msle").getValue());
    assertNaN(result.evaluate("rmsle").getValue());
    assertEquals(1.5, result.evaluate("mae").getValue());
  }

  @Test
  public void testUnsupportedMetric() {
    Evaluation evaluation = example().evaluate("auc");
    assertNaN(evaluation.getValue());
    assertEquals("Unsupported metric `auc` for regression problems", evaluation.getMessage());
  }

  @Test(expected = NumberFormatException.class)
  public void testNonNumeric() {
    build(new String[] { "x" }, new String[] { "1" });
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNoRows() {
    new RegressionResult(Table.builder("predictions", "truth").build());
  }

}
