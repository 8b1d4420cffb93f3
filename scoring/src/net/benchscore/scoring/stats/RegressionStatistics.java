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
import org.apache.commons.math3.util.FastMath;

/**
 * Error statistics of real-valued predictions against true values.
 */
public final class RegressionStatistics {

  private RegressionStatistics() {
  }

  /**
   * @return mean absolute error
   */
  public static double meanAbsoluteError(double[] truth, double[] predictions) {
    check(truth, predictions);
    double sum = 0.0;
    for (int i = 0; i < truth.length; i++) {
      sum += FastMath.abs(truth[i] - predictions[i]);
    }
    return sum / truth.length;
  }

  /**
   * @return mean squared error
   */
  public static double meanSquaredError(double[] truth, double[] predictions) {
    check(truth, predictions);
    double sum = 0.0;
    for (int i = 0; i < truth.length; i++) {
      double diff = truth[i] - predictions[i];
      sum += diff * diff;
    }
    return sum / truth.length;
  }

  /**
   * @return mean squared error between {@code log(1 + truth)} and {@code log(1 + predictions)}; values
   *  below -1 have no logarithm and make the result NaN
   */
  public static double meanSquaredLogError(double[] truth, double[] predictions) {
    check(truth, predictions);
    double sum = 0.0;
    for (int i = 0; i < truth.length; i++) {
      double diff = FastMath.log1p(truth[i]) - FastMath.log1p(predictions[i]);
      sum += diff * diff;
    }
    return sum / truth.length;
  }

  /**
   * @return coefficient of determination, {@code 1 - SSres / SStot}. When the truth is constant, this is 1 for
   *  perfect predictions and 0 otherwise.
   */
  public static double r2(double[] truth, double[] predictions) {
    check(truth, predictions);
    double mean = 0.0;
    for (double t : truth) {
      mean += t;
    }
    mean /= truth.length;
    double residual = 0.0;
    double totalVariation = 0.0;
    for (int i = 0; i < truth.length; i++) {
      double r = truth[i] - predictions[i];
      residual += r * r;
      double d = truth[i] - mean;
      totalVariation += d * d;
    }
    if (totalVariation == 0.0) {
      return residual == 0.0 ? 1.0 : 0.0;
    }
    return 1.0 - residual / totalVariation;
  }

  private static void check(double[] truth, double[] predictions) {
    Preconditions.checkArgument(truth.length == predictions.length,
                                "Got %s truth values but %s predictions", truth.length, predictions.length);
    Preconditions.checkArgument(truth.length > 0, "No examples");
  }

}
