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

import java.util.Collections;
import java.util.Set;

import net.benchscore.scoring.ProblemType;

/**
 * A result without predictions, for a run that produced none. Every metric evaluates to NaN; registered
 * metrics still report their direction so that the scoreboard can normalize their names.
 */
public class NoResult extends Result {

  public NoResult(String info) {
    super(info);
  }

  /**
   * @return {@code null}, as there are no predictions
   */
  @Override
  public ProblemType getType() {
    return null;
  }

  @Override
  public Set<String> getSupportedMetrics() {
    return Collections.emptySet();
  }

  @Override
  public Evaluation evaluate(String metric) {
    if (metric == null) {
      return new Evaluation(null, Double.NaN, MetricDirection.UNKNOWN, null);
    }
    MetricDescriptor descriptor = MetricRegistry.get().lookup(metric);
    if (descriptor == null) {
      return new Evaluation(metric, Double.NaN, MetricDirection.UNKNOWN, "Unsupported metric `" + metric + '`');
    }
    return new Evaluation(metric, Double.NaN, descriptor.getDirection(), null);
  }

  @Override
  public String toString() {
    return "NoResult[" + getInfo() + ']';
  }

}
