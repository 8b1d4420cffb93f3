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

import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Maps;

/**
 * <p>The set of all known metrics and their directions, across classification, regression and time series
 * results. It is built once, from the metric tables of each kind of result, and never changes afterwards.</p>
 *
 * <p>A metric name means the same thing wherever it is defined: {@code rmse} of a regression result and
 * {@code rmse} of a time series result are registered once, and registering one name with two different
 * directions is an error.</p>
 */
public final class MetricRegistry {

  private static final MetricRegistry INSTANCE = new Builder()
      .registerAll(ClassificationMetric.values())
      .registerAll(RegressionMetric.values())
      .registerAll(TimeSeriesMetric.values())
      .build();

  private final SortedMap<String,MetricDescriptor> descriptors;

  private MetricRegistry(SortedMap<String,MetricDescriptor> descriptors) {
    this.descriptors = ImmutableSortedMap.copyOfSorted(descriptors);
  }

  /**
   * @return the registry of all metrics that results can compute
   */
  public static MetricRegistry get() {
    return INSTANCE;
  }

  /**
   * @param name metric name
   * @return descriptor of the metric, or {@code null} if no metric has that name
   */
  public MetricDescriptor lookup(String name) {
    return name == null ? null : descriptors.get(name);
  }

  /**
   * @param name metric name
   * @return direction of the metric, or {@link MetricDirection#UNKNOWN} if it is not registered
   */
  public MetricDirection directionOf(String name) {
    MetricDescriptor descriptor = lookup(name);
    return descriptor == null ? MetricDirection.UNKNOWN : descriptor.getDirection();
  }

  public boolean isRegistered(String name) {
    return lookup(name) != null;
  }

  /**
   * @return names of all registered metrics, in alphabetical order
   */
  public SortedSet<String> getMetricNames() {
    return ImmutableSortedSet.copyOf(descriptors.keySet());
  }

  static final class Builder {

    private final SortedMap<String,MetricDescriptor> descriptors = Maps.newTreeMap();

    Builder register(String name, MetricDirection direction) {
      MetricDescriptor descriptor = new MetricDescriptor(name, direction);
      MetricDescriptor existing = descriptors.get(name);
      Preconditions.checkArgument(existing == null || existing.equals(descriptor),
                                  "Metric %s is already registered as %s", name, existing);
      descriptors.put(name, descriptor);
      return this;
    }

    Builder registerAll(ScoringFunction<?>... functions) {
      for (ScoringFunction<?> function : functions) {
        register(function.getName(), function.getDirection());
      }
      return this;
    }

    MetricRegistry build() {
      return new MetricRegistry(descriptors);
    }

  }

  static <F extends ScoringFunction<?>> Map<String,F> indexByName(F[] functions) {
    Map<String,F> byName = Maps.newLinkedHashMap();
    for (F function : functions) {
      byName.put(function.getName(), function);
    }
    return byName;
  }

}
