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
 * Whether larger or smaller values of a metric are better.
 */
public enum MetricDirection {

  HIGHER_IS_BETTER,
  LOWER_IS_BETTER,
  /** Direction of a metric that is not registered. */
  UNKNOWN;

  public boolean isHigherBetter() {
    return this == HIGHER_IS_BETTER;
  }

  public boolean isLowerBetter() {
    return this == LOWER_IS_BETTER;
  }

}
