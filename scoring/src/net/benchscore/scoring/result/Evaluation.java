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

/**
 * The outcome of computing one metric from a {@link Result}. A metric that could not be computed has a NaN
 * value and a message saying why.
 */
public final class Evaluation {

  private static final String LOWER_IS_BETTER_PREFIX = "neg_";

  private final String metric;
  private final double value;
  private final MetricDirection direction;
  private final String message;

  public Evaluation(String metric, double value, MetricDirection direction, String message) {
    this.metric = metric;
    this.value = value;
    this.direction = direction;
    this.message = message;
  }

  public String getMetric() {
    return metric;
  }

  public double getValue() {
    return value;
  }

  public MetricDirection getDirection() {
    return direction;
  }

  public boolean isHigherBetter() {
    return direction.isHigherBetter();
  }

  /**
   * @return why the metric could not be computed, or {@code null} if it was
   */
  public String getMessage() {
    return message;
  }

  /**
   * @return name under which the value is reported so that higher is always better: the metric name, prefixed
   *  with {@code neg_} if lower values of the metric are better
   */
  public String getNormalizedMetric() {
    return direction.isLowerBetter() ? LOWER_IS_BETTER_PREFIX + metric : metric;
  }

  /**
   * @return value negated if lower values of the metric are better, so that higher is always better
   */
  public double getNormalizedValue() {
    return direction.isLowerBetter() ? -value : value;
  }

  @Override
  public String toString() {
    return metric + '=' + value + (message == null ? "" : " (" + message + ')');
  }

}
