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

public final class NoResultTest extends BenchScoreTest {

  @Test
  public void testRegisteredMetric() {
    NoResult result = new NoResult("Missing predictions.");
    assertNull(result.getType());
    assertEquals("Missing predictions.", result.getInfo());
    Evaluation evaluation = result.evaluate("acc");
    assertNaN(evaluation.getValue());
    assertSame(MetricDirection.HIGHER_IS_BETTER, evaluation.getDirection());
    assertNull(evaluation.getMessage());
    assertEquals("neg_logloss", result.evaluate("logloss").getNormalizedMetric());
  }

  @Test
  public void testUnknownMetric() {
    Evaluation evaluation = new NoResult(null).evaluate("foo");
    assertNaN(evaluation.getValue());
    assertSame(MetricDirection.UNKNOWN, evaluation.getDirection());
    assertEquals("Unsupported metric `foo`", evaluation.getMessage());
  }

  @Test
  public void testNullMetric() {
    Evaluation evaluation = new NoResult(null).evaluate(null);
    assertNaN(evaluation.getValue());
    assertSame(MetricDirection.UNKNOWN, evaluation.getDirection());
    assertNull(evaluation.getMessage());
  }

  @Test
  public void testErrorMessage() {
    ErrorResult result = new ErrorResult(new IllegalStateException("Bad value"), 200);
    assertEquals("IllegalStateException: Bad value", result.getInfo());
    assertNaN(result.evaluate("rmse").getValue());
    assertTrue(result.getError() instanceof IllegalStateException);
  }

  @Test
  public void testTruncatedErrorMessage() {
    ErrorResult result = new ErrorResult(new IllegalStateException("abcdefghij"), 10);
    assertEquals(10, result.getInfo().length());
    assertEquals("IllegalSt…", result.getInfo());
  }

  @Test
  public void testErrorWithoutMessage() {
    assertEquals("NullPointerException", new ErrorResult(new NullPointerException(), 200).getInfo());
  }

}
