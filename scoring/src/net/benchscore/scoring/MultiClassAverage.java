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

package net.benchscore.scoring;

import java.util.Locale;

/**
 * How per-class (or per-pair of classes) scores are combined into one score for multiclass problems.
 */
public enum MultiClassAverage {

  /** Each class's score weighted by its prevalence in the truth. */
  WEIGHTED,
  /** Unweighted mean over classes. */
  MACRO;

  /**
   * @param name case-insensitive name, like {@code weighted}
   * @throws IllegalArgumentException if the name is unknown
   */
  public static MultiClassAverage fromName(String name) {
    return valueOf(name.trim().toUpperCase(Locale.ROOT));
  }

  /**
   * Combines scores according to this strategy.
   *
   * @param scores one score per class or pair
   * @param weights prevalence of each class or pair; ignored for {@link #MACRO}
   * @return average score; 0 if all weights are 0
   */
  public double average(double[] scores, double[] weights) {
    if (this == MACRO) {
      double sum = 0.0;
      for (double score : scores) {
        sum += score;
      }
      return sum / scores.length;
    }
    double weightedSum = 0.0;
    double totalWeight = 0.0;
    for (int i = 0; i < scores.length; i++) {
      if (weights[i] != 0.0) {
        weightedSum += scores[i] * weights[i];
        totalWeight += weights[i];
      }
    }
    return totalWeight == 0.0 ? 0.0 : weightedSum / totalWeight;
  }

}
