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

import java.util.SortedSet;

import org.junit.Test;

import net.benchscore.common.BenchScoreTest;

public final class MetricRegistryTest extends BenchScoreTest {

  @Test
  public void testDirections() {
    MetricRegistry registry = MetricRegistry.get();
    assertSame(MetricDirection.HIGHER_IS_BETTER, registry.directionOf("auc"));
    assertSame(MetricDirection.HIGHER_IS_BETTER, registry.directionOf("r2"));
    assertSame(MetricDirection.LOWER_IS_BETTER, registry.directionOf("logloss"));
    assertSame(MetricDirection.LOWER_IS_BETTER, registry.directionOf("rmse"));
    assertSame(MetricDirection.LOWER_IS_BETTER, registry.directionOf("wql"));
    assertSame(MetricDirection.UNKNOWN, registry.directionOf("accuracy"));
    assertSame(MetricDirection.UNKNOWN, registry.directionOf(null));
  }

  @Test
  public void testLookup() {
    MetricRegistry registry = MetricRegistry.get();
    MetricDescriptor descriptor = registry.lookup("max_pce");
    assertEquals("max_pce", descriptor.getName());
    assertFalse(descriptor.isHigherBetter());
    assertNull(registry.lookup("foo"));
    assertTrue(registry.isRegistered("sql"));
  }

  @Test
  public void testMetricNames() {
    SortedSet<String> names = MetricRegistry.get().getMetricNames();
    // 12 classification, 6 regression and 7 time series metrics
    assertEquals(25, names.size());
    assertEquals("acc", names.first());
    assertEquals("wql", names.last());
    assertTrue(names.contains("auc_ovo"));
    assertTrue(names.contains("mase"));
  }

  @Test
  public void testReregisterSameDirection() {
    MetricRegistry registry = new MetricRegistry.Builder()
        .register("x", MetricDirection.HIGHER_IS_BETTER)
        .register("x", MetricDirection.HIGHER_IS_BETTER)
        .build();
    assertEquals(1, registry.getMetricNames().size());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testConflictingDirection() {
    new MetricRegistry.Builder()
        .register("x", MetricDirection.HIGHER_IS_BETTER)
        .register("x", MetricDirection.LOWER_IS_BETTER);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownDirection() {
    new MetricRegistry.Builder().register("x", MetricDirection.UNKNOWN);
  }

  @Test
  public void testNormalizedEvaluation() {
    Evaluation lower = new Evaluation("rmse", 2.0, MetricDirection.LOWER_IS_BETTER, null);
    assertEquals("neg_rmse", lower.getNormalizedMetric());
    assertEquals(-2.0, lower.getNormalizedValue());
    Evaluation higher = new Evaluation("auc", 0.7, MetricDirection.HIGHER_IS_BETTER, null);
    assertEquals("auc", higher.getNormalizedMetric());
    assertEquals(0.7, higher.getNormalizedValue());
    Evaluation unknown = new Evaluation("foo", 3.0, MetricDirection.UNKNOWN, "Unsupported metric `foo`");
    assertEquals("foo", unknown.getNormalizedMetric());
    assertEquals(3.0, unknown.getNormalizedValue());
  }

}
