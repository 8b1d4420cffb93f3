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

import com.google.common.base.Preconditions;

/**
 * A registered metric: its name and which direction is better.
 */
public final class MetricDescriptor implements Comparable<MetricDescriptor> {

  private final String name;
  private final MetricDirection direction;

  public MetricDescriptor(String name, MetricDirection direction) {
    Preconditions.checkArgument(name != null && !name.isEmpty(), "Empty metric name");
    Preconditions.checkArgument(direction != null && direction != MetricDirection.UNKNOWN,
                                "Metric %s needs a direction", name);
    this.name = name;
    this.direction = direction;
  }

  public String getName() {
    return name;
  }

  public MetricDirection getDirection() {
    return direction;
  }

  public boolean isHigherBetter() {
    return direction.isHigherBetter();
  }

  @Override
  public int compareTo(MetricDescriptor other) {
    return name.compareTo(other.name);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof MetricDescriptor)) {
      return false;
    }
    MetricDescriptor other = (MetricDescriptor) o;
    return name.equals(other.name) && direction == other.direction;
  }

  @Override
  public int hashCode() {
    return name.hashCode() ^ direction.hashCode();
  }

  @Override
  public String toString() {
    return name + (direction.isHigherBetter() ? "(+)" : "(-)");
  }

}
