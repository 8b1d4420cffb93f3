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
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import org.apache.commons.math3.util.FastMath;

import net.benchscore.common.LangUtils;
import net.benchscore.common.table.Table;
import net.benchscore.scoring.ProblemType;
import net.benchscore.scoring.stats.RegressionStatistics;

/**
 * Predictions for a regression problem: a {@code predictions} column followed by a {@code truth} column,
 * both numeric.
 */
public final class RegressionResult extends Result {

  private static final Map<String,RegressionMetric> METRICS = MetricRegistry.indexByName(RegressionMetric.values());

  private final double[] predictions;
  private final double[] truth;

  /**
   * @param table predictions in the second-to-last column and truth in the last
   * @throws IllegalArgumentException if there are fewer than two columns or no rows
   * @throws NumberFormatException if a value is not a number
   */
  public RegressionResult(Table table) {
    this(parseColumn(table, table.getNumColumns() - 2), parseColumn(table, table.getNumColumns() - 1));
  }

  RegressionResult(double[] predictions, double[] truth) {
    super(null);
    Preconditions.checkArgument(predictions.length == truth.length,
                                "Got %s predictions but %s truth values", predictions.length, truth.length);
    Preconditions.checkArgument(truth.length > 0, "No predictions");
    this.predictions = predictions;
    this.truth = truth;
  }

  static double[] parseColumn(Table table, int column) {
    Preconditions.checkArgument(table.getNumColumns() >= 2,
                                "Expected predictions and truth columns: %s", table.getColumns());
    List<String> values = table.getColumn(column);
    double[] parsed = new double[values.size()];
    for (int i = 0; i < parsed.length; i++) {
      parsed[i] = LangUtils.parseNumeric(values.get(i));
    }
    return parsed;
  }

  @Override
  public ProblemType getType() {
    return ProblemType.REGRESSION;
  }

  @Override
  public Set<String> getSupportedMetrics() {
    return Collections.unmodifiableSet(METRICS.keySet());
  }

  @Override
  public Evaluation evaluate(String metric) {
    return evaluateWith(metric, METRICS.get(metric), this);
  }

  double[] getPredictions() {
    return predictions;
  }

  double[] getTruth() {
    return truth;
  }

  double meanAbsoluteError() {
    return RegressionStatistics.meanAbsoluteError(truth, predictions);
  }

  double meanSquaredError() {
    return RegressionStatistics.meanSquaredError(truth, predictions);
  }

  double meanSquaredLogError() {
    return RegressionStatistics.meanSquaredLogError(truth, predictions);
  }

  double rootMeanSquaredError() {
    return FastMath.sqrt(meanSquaredError());
  }

  double rootMeanSquaredLogError() {
    return FastMath.sqrt(meanSquaredLogError());
  }

  double r2() {
    return RegressionStatistics.r2(truth, predictions);
  }

  @Override
  public String toString() {
    return "RegressionResult[" + truth.length + " predictions]";
  }

}
