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

import java.util.Arrays;
import java.util.Comparator;

import com.google.common.base.Preconditions;

/**
 * Statistics of how well a score ranks positive examples above negative ones.
 */
public final class RankingStatistics {

  private RankingStatistics() {
  }

  /**
   * <p>Area under the ROC curve, which may be understood as the probability that a random positive example
   * is scored higher than a random negative one. Computed exactly from the Mann-Whitney U statistic, with tied
   * scores given their average rank, which counts a tie between a positive and a negative as half.</p>
   *
   * @param positive whether each example is positive
   * @param scores score of each example, higher meaning more likely positive
   * @return AUC in [0,1]
   * @throws IllegalArgumentException if all examples are positive, or all negative
   */
  public static double auc(boolean[] positive, double[] scores) {
    Preconditions.checkArgument(positive.length == scores.length,
                                "Got %s labels but %s scores", positive.length, scores.length);
    long numPositive = 0;
    for (boolean p : positive) {
      if (p) {
        numPositive++;
      }
    }
    long numNegative = positive.length - numPositive;
    Preconditions.checkArgument(numPositive > 0 && numNegative > 0,
                                "Only one class present in truth; AUC is not defined in that case");

    Integer[] order = sortedIndices(scores, false);
    double positiveRankSum = 0.0;
    int i = 0;
    while (i < order.length) {
      int j = i;
      while (j + 1 < order.length && scores[order[j + 1]] == scores[order[i]]) {
        j++;
      }
      // ranks i+1 .. j+1 are tied
      double averageRank = (i + j + 2) / 2.0;
      for (int k = i; k <= j; k++) {
        if (positive[order[k]]) {
          positiveRankSum += averageRank;
        }
      }
      i = j + 1;
    }
    double u = positiveRankSum - numPositive * (numPositive + 1) / 2.0;
    return u / ((double) numPositive * numNegative);
  }

  /**
   * <p>Average precision: the mean of the precision achieved at each threshold, weighted by the increase in
   * recall from the previous threshold. Examples with tied scores share one threshold. It summarizes the
   * precision-recall curve without the optimistic interpolation of a trapezoidal area.</p>
   *
   * @param positive whether each example is positive
   * @param scores score of each example, higher meaning more likely positive
   * @return average precision in [0,1]
   * @throws IllegalArgumentException if there is no positive example
   */
  public static double averagePrecision(boolean[] positive, double[] scores) {
    Preconditions.checkArgument(positive.length == scores.length,
                                "Got %s labels but %s scores", positive.length, scores.length);
    int numPositive = 0;
    for (boolean p : positive) {
      if (p) {
        numPositive++;
      }
    }
    Preconditions.checkArgument(numPositive > 0,
                                "No positive example in truth; average precision is not defined in that case");

    Integer[] order = sortedIndices(scores, true);
    double truePositives = 0.0;
    double falsePositives = 0.0;
    double previousRecall = 0.0;
    double result = 0.0;
    int i = 0;
    while (i < order.length) {
      int j = i;
      while (j + 1 < order.length && scores[order[j + 1]] == scores[order[i]]) {
        j++;
      }
      for (int k = i; k <= j; k++) {
        if (positive[order[k]]) {
          truePositives++;
        } else {
          falsePositives++;
        }
      }
      double precision = truePositives / (truePositives + falsePositives);
      double recall = truePositives / numPositive;
      result += (recall - previousRecall) * precision;
      previousRecall = recall;
      i = j + 1;
    }
    return result;
  }

  private static Integer[] sortedIndices(final double[] scores, final boolean descending) {
    Integer[] order = new Integer[scores.length];
    for (int i = 0; i < order.length; i++) {
      order[i] = i;
    }
    Arrays.sort(order, new Comparator<Integer>() {
      @Override
      public int compare(Integer a, Integer b) {
        int c = Double.compare(scores[a], scores[b]);
        return descending ? -c : c;
      }
    });
    return order;
  }

}
