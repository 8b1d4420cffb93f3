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

import com.google.common.base.Preconditions;
import com.google.common.primitives.Doubles;

import net.benchscore.common.stats.RunningStatistics;

/**
 * Counts of (true class, predicted class) pairs over classes {@code 0 .. numClasses-1}, and the
 * classification statistics that derive from them. Rows are true classes, columns predicted classes.
 */
public final class ConfusionMatrix {

  private final long[][] counts;
  private final long[] support;
  private final long[] predicted;
  private final long total;

  /**
   * @param truth true class index of each example
   * @param predictions predicted class index of each example
   * @param numClasses number of classes
   * @throws IllegalArgumentException if lengths differ or an index is out of range
   */
  public ConfusionMatrix(int[] truth, int[] predictions, int numClasses) {
    Preconditions.checkArgument(truth.length == predictions.length,
                                "Got %s truth values but %s predictions", truth.length, predictions.length);
    Preconditions.checkArgument(numClasses > 0, "No classes");
    counts = new long[numClasses][numClasses];
    support = new long[numClasses];
    predicted = new long[numClasses];
    for (int i = 0; i < truth.length; i++) {
      int t = truth[i];
      int p = predictions[i];
      Preconditions.checkArgument(t >= 0 && t < numClasses, "Bad true class index: %s", t);
      Preconditions.checkArgument(p >= 0 && p < numClasses, "Bad predicted class index: %s", p);
      counts[t][p]++;
      support[t]++;
      predicted[p]++;
    }
    total = truth.length;
  }

  public int getNumClasses() {
    return counts.length;
  }

  public long getCount(int trueClass, int predictedClass) {
    return counts[trueClass][predictedClass];
  }

  /**
   * @return number of examples whose true class is {@code c}
   */
  public long getSupport(int c) {
    return support[c];
  }

  /**
   * @return number of examples of class {@code c} that were predicted correctly
   */
  public long getCorrect(int c) {
    return counts[c][c];
  }

  public long getTotal() {
    return total;
  }

  /**
   * @return fraction of examples predicted correctly
   */
  public double getAccuracy() {
    Preconditions.checkState(total > 0, "No examples");
    long correct = 0;
    for (int c = 0; c < counts.length; c++) {
      correct += counts[c][c];
    }
    return (double) correct / total;
  }

  /**
   * @return mean recall over the classes that occur in the truth
   */
  public double getBalancedAccuracy() {
    RunningStatistics recalls = new RunningStatistics();
    for (int c = 0; c < counts.length; c++) {
      if (support[c] > 0) {
        recalls.addDatum(getRecall(c));
      }
    }
    Preconditions.checkState(recalls.getCount() > 0, "No examples");
    return recalls.getAverage();
  }

  /**
   * @return precision of class {@code c}, or 0 if it was never predicted
   */
  public double getPrecision(int c) {
    return predicted[c] == 0 ? 0.0 : (double) counts[c][c] / predicted[c];
  }

  /**
   * @return recall of class {@code c}, or 0 if it does not occur in the truth
   */
  public double getRecall(int c) {
    return support[c] == 0 ? 0.0 : (double) counts[c][c] / support[c];
  }

  /**
   * @param c class
   * @param beta weight of recall relative to precision
   * @return F-beta score of class {@code c}, or 0 if precision and recall are both 0
   */
  public double getFBeta(int c, double beta) {
    double precision = getPrecision(c);
    double recall = getRecall(c);
    double beta2 = beta * beta;
    double denominator = beta2 * precision + recall;
    return denominator == 0.0 ? 0.0 : (1.0 + beta2) * precision * recall / denominator;
  }

  /**
   * @return for each class occurring in the truth, in class order, the fraction of its examples that were
   *  misclassified: {@code (support - correct) / support}
   */
  public double[] getPerClassErrors() {
    double[] errors = new double[counts.length];
    int n = 0;
    for (int c = 0; c < counts.length; c++) {
      if (support[c] > 0) {
        errors[n++] = (double) (support[c] - counts[c][c]) / support[c];
      }
    }
    return Doubles.toArray(Doubles.asList(errors).subList(0, n));
  }

}
