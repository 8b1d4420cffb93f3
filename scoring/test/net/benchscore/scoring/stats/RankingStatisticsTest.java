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

public final class RankingStatisticsTest extends BenchScoreTest {

  private static final boolean[] POSITIVE = { false, false, true, true };
  private static final double[] SCORES = { 0.1, 0.4, 0.35, 0.8 };

  @Test
  public void testAUC() {
    assertEquals(0.75, RankingStatistics.auc(POSITIVE, SCORES));
    assertEquals(1.0, RankingStatistics.auc(POSITIVE, new double[] { 0.1, 0.2, 0.3, 0.4 }));
    assertEquals(0.0, RankingStatistics.auc(POSITIVE, new double[] { 0.4, 0.3, 0.2, 0.1 }));
  }

  @Test
  public void testAUCTies() {
    assertEquals(0.5, RankingStatistics.auc(new boolean[] { true, false }, new double[] { 0.5, 0.5 }));
    assertEquals(0.5, RankingStatistics.auc(POSITIVE, new double[] { 0.3, 0.3, 0.3, 0.3 }));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testAUCOneClass() {
    RankingStatistics.auc(new boolean[] { true, true }, new double[] { 0.1, 0.9 });
  }

  @Test
  public void testAveragePrecision() {
    assertEquals(5.0 / 6.0, RankingStatistics.averagePrecision(POSITIVE, SCORES));
    assertEquals(1.0, RankingStatistics.averagePrecision(POSITIVE, new double[] { 0.1, 0.2, 0.3, 0.4 }));
  }

  @Test
  public void testAveragePrecisionTies() {
    // one threshold: precision 1/2 at recall 1
    assertEquals(0.5, RankingStatistics.averagePrecision(POSITIVE, new double[] { 0.3, 0.3, 0.3, 0.3 }));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testAveragePrecisionNoPositive() {
    RankingStatistics.averagePrecision(new boolean[] { false, false }, new double[] { 0.1, 0.9 });
  }

}
