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

package net.benchscore.scoring.stats;

import org.junit.Test;

import net.benchscore.common.BenchScoreTest;

public final class ConfusionMatrixTest extends BenchScoreTest {

  private static ConfusionMatrix buildMatrix() {
    return new ConfusionMatrix(new int[] { 0, 0, 1, 1, 2 }, new int[] { 0, 1, 1, 1, 0 }, 3);
  }

  @Test
  public void testCounts() {
    ConfusionMatrix matrix = buildMatrix();
    assertEquals(3, matrix.getNumClasses());
    assertEquals(5, matrix.getTotal());
    assertEquals(1, matrix.getCount(0, 1));
    assertEquals(1, matrix.getCount(2, 0));
    assertEquals(2, matrix.getSupport(1));
    assertEquals(0, matrix.getCorrect(2));
  }

  @Test
  public void testAccuracy() {
    ConfusionMatrix matrix = buildMatrix();
    assertEquals(0.6, matrix.getAccuracy());
    assertEquals(0.5, matrix.getBalancedAccuracy());
  }

  @Test
  public void testPrecisionRecall() {
    ConfusionMatrix matrix = buildMatrix();
    assertEquals(0.5, matrix.getPrecision(0));
    assertEquals(2.0 / 3.0, matrix.getPrecision(1));
    assertEquals(0.0, matrix.getPrecision(2));
    assertEquals(1.0, matrix.getRecall(1));
    assertEquals(0.5, matrix.getFBeta(0, 1.0));
    assertEquals(0.8, matrix.getFBeta(1, 1.0));
    assertEquals(0.0, matrix.getFBeta(2, 1.0));
    // recall weighs more with beta 2
    assertEquals(5.0 * (2.0 / 3.0) / (4.0 * (2.0 / 3.0) + 1.0), matrix.getFBeta(1, 2.0));
  }

  @Test
  public void testPerClassErrors() {
    assertArrayEquals(new double[] { 0.5, 0.0, 1.0 }, buildMatrix().getPerClassErrors());
    // class 2 never occurs in truth
    ConfusionMatrix matrix = new ConfusionMatrix(new int[] { 0, 1 }, new int[] { 2, 1 }, 3);
    assertArrayEquals(new double[] { 1.0, 0.0 }, matrix.getPerClassErrors());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBadIndex() {
    new ConfusionMatrix(new int[] { 0, 3 }, new int[] { 0, 1 }, 3);
  }

}
