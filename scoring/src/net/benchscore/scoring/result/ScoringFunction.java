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
 * A named metric computed from one kind of {@link Result}.
 *
 * @param <R> type of result the metric is computed from
 */
public interface ScoringFunction<R extends Result> {

  /**
   * @return name of the metric, like {@code auc}
   */
  String getName();

  MetricDirection getDirection();

  /**
   * @param result result to score
   * @return value of the metric, possibly NaN
   * @throws ResultException if the metric does not apply to the result
   */
  double score(R result);

}
