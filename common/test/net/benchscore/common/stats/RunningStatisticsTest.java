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

package net.benchscore.common.stats;

import org.junit.Test;

import net.benchscore.common.BenchScoreTest;

public final class RunningStatisticsTest extends BenchScoreTest {

  @Test
  public void testInstantiate() {
    RunningStatistics stats = new RunningStatistics();
    assertNaN(stats.getMin());
    assertNaN(stats.getMax());
    assertNaN(stats.getAverage());
    stats.addDatum(Integer.MIN_VALUE);
    assertEquals(Integer.MIN_VALUE, stats.getMin());
    assertEquals(Integer.MIN_VALUE, stats.getMax());
    stats.addDatum(Integer.MAX_VALUE);
    assertEquals(Integer.MIN_VALUE, stats.getMin());
    assertEquals(Integer.MAX_VALUE, stats.getMax());
    assertEquals(2, stats.getCount());
  }

  @Test
  public void testOfFinite() {
    RunningStatistics stats =
        RunningStatistics.ofFinite(new double[] {1.0, Double.NaN, 3.0, Double.POSITIVE_INFINITY});
    assertEquals(2, stats.getCount());
    assertEquals(2.0, stats.getAverage());
    assertEquals(1.0, stats.getMin());
    assertEquals(3.0, stats.getMax());
  }

  @Test
  public void testOfNothingFinite() {
    RunningStatistics stats = RunningStatistics.ofFinite(new double[] {Double.NEGATIVE_INFINITY});
    assertEquals(0, stats.getCount());
    assertNaN(stats.getAverage());
  }

}
