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

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import org.apache.commons.math3.util.FastMath;

import net.benchscore.common.LangUtils;
import net.benchscore.common.stats.RunningStatistics;
import net.benchscore.common.table.Table;
import net.benchscore.scoring.ProblemType;
import net.benchscore.scoring.validation.InvalidPredictionsException;

/**
 * <p>Predictions for a time series forecasting problem. Each row is one forecast step of one item. The table
 * has the columns:</p>
 *
 * <ul>
 *   <li>{@code predictions}: point forecast</li>
 *   <li>{@code truth}: true value</li>
 *   <li>{@code repeated_item_id}: item the step belongs to; all items have the same number of steps</li>
 *   <li>{@code repeated_abs_seasonal_error}: in-sample error of the seasonal naive forecast of the item</li>
 *   <li>optionally, quantile forecast columns named by their level, like {@code 0.1} or {@code 0.9}</li>
 * </ul>
 *
 * <p>Regression metrics of the point forecasts are computed as for a {@link RegressionResult}.</p>
 */
public final class TimeSeriesResult extends Result {

  public static final String PREDICTIONS = "predictions";
  public static final String TRUTH = "truth";
  public static final String ITEM_ID = "repeated_item_id";
  public static final String SEASONAL_ERROR = "repeated_abs_seasonal_error";

  private static final Set<String> REQUIRED_COLUMNS = ImmutableSet.of(TRUTH, PREDICTIONS, ITEM_ID, SEASONAL_ERROR);
  private static final String QUANTILE_PREFIX = "0.";

  private static final Map<String,TimeSeriesMetric> METRICS = MetricRegistry.indexByName(TimeSeriesMetric.values());
  private static final Map<String,RegressionMetric> REGRESSION_METRICS =
      MetricRegistry.indexByName(RegressionMetric.values());

  private final RegressionResult pointForecast;
  private final double[] predictions;
  private final double[] truth;
  private final double[] seasonalErrors;
  private final List<String> itemIDs;
  private final double[] quantileLevels;
  private final double[][] quantilePredictions;

  /**
   * @param table time series predictions
   * @throws InvalidPredictionsException if a column is missing or unrecognized, a forecast is not finite, or
   *  items have different numbers of steps
   * @throws NumberFormatException if a value is not a number
   */
  public TimeSeriesResult(Table table) throws InvalidPredictionsException {
    super(null);
    Set<String> columns = Sets.newLinkedHashSet(table.getColumns());
    Set<String> missing = Sets.difference(REQUIRED_COLUMNS, columns);
    if (!missing.isEmpty()) {
      throw new InvalidPredictionsException("Missing columns for calculating time series metrics: " + missing);
    }
    List<String> quantileColumns = Lists.newArrayList();
    List<String> unrecognized = Lists.newArrayList();
    for (String column : columns) {
      if (REQUIRED_COLUMNS.contains(column)) {
        continue;
      }
      if (column.startsWith(QUANTILE_PREFIX) && isQuantileLevel(column)) {
        quantileColumns.add(column);
      } else {
        unrecognized.add(column);
      }
    }
    if (!unrecognized.isEmpty()) {
      throw new InvalidPredictionsException("Predictions contain unrecognized columns: " + unrecognized);
    }

    predictions = RegressionResult.parseColumn(table, table.indexOf(PREDICTIONS));
    truth = RegressionResult.parseColumn(table, table.indexOf(TRUTH));
    seasonalErrors = RegressionResult.parseColumn(table, table.indexOf(SEASONAL_ERROR));
    itemIDs = table.getColumn(ITEM_ID);

    int numLevels = quantileColumns.size();
    quantileLevels = new double[numLevels];
    quantilePredictions = new double[table.getNumRows()][numLevels];
    for (int q = 0; q < numLevels; q++) {
      String column = quantileColumns.get(q);
      quantileLevels[q] = Double.parseDouble(column);
      double[] values = RegressionResult.parseColumn(table, table.indexOf(column));
      for (int row = 0; row < values.length; row++) {
        quantilePredictions[row][q] = values[row];
      }
    }

    if (!LangUtils.allFinite(predictions)) {
      throw new InvalidPredictionsException("Predictions contain NaN or Inf values");
    }
    for (double[] rowQuantiles : quantilePredictions) {
      if (!LangUtils.allFinite(rowQuantiles)) {
        throw new InvalidPredictionsException("Quantile predictions contain NaN or Inf values");
      }
    }

    Set<Integer> lengths = Sets.newLinkedHashSet();
    for (Collection<Integer> rows : groupByItem().values()) {
      lengths.add(rows.size());
    }
    if (lengths.size() > 1) {
      throw new InvalidPredictionsException(
          "Predicted sequences have different lengths {" + Joiner.on(", ").join(lengths) + '}');
    }

    pointForecast = new RegressionResult(predictions, truth);
  }

  private static boolean isQuantileLevel(String column) {
    double level;
    try {
      level = Double.parseDouble(column);
    } catch (NumberFormatException ignored) {
      return false;
    }
    return level > 0.0 && level < 1.0;
  }

  /**
   * @return row indices of each item, items in order of first appearance
   */
  private Map<String,List<Integer>> groupByItem() {
    Map<String,List<Integer>> groups = Maps.newLinkedHashMap();
    for (int row = 0; row < itemIDs.size(); row++) {
      String itemID = itemIDs.get(row);
      List<Integer> rows = groups.get(itemID);
      if (rows == null) {
        rows = Lists.newArrayList();
        groups.put(itemID, rows);
      }
      rows.add(row);
    }
    return groups;
  }

  @Override
  public ProblemType getType() {
    return ProblemType.TIMESERIES;
  }

  @Override
  public Set<String> getSupportedMetrics() {
    return Collections.unmodifiableSet(Sets.union(REGRESSION_METRICS.keySet(), METRICS.keySet()));
  }

  @Override
  public Evaluation evaluate(String metric) {
    RegressionMetric regressionMetric = REGRESSION_METRICS.get(metric);
    if (regressionMetric != null) {
      return evaluateWith(metric, regressionMetric, pointForecast);
    }
    return evaluateWith(metric, METRICS.get(metric), this);
  }

  public int getNumQuantileLevels() {
    return quantileLevels.length;
  }

  double symmetricMeanAbsolutePercentageError() {
    double[] ratios = new double[truth.length];
    for (int i = 0; i < ratios.length; i++) {
      double denominator = (FastMath.abs(truth[i]) + FastMath.abs(predictions[i])) / 2.0;
      ratios[i] = FastMath.abs(truth[i] - predictions[i]) / denominator;
    }
    return safeMean(ratios);
  }

  double meanAbsolutePercentageError() {
    double[] ratios = new double[truth.length];
    for (int i = 0; i < ratios.length; i++) {
      ratios[i] = FastMath.abs(truth[i] - predictions[i]) / FastMath.abs(truth[i]);
    }
    return safeMean(ratios);
  }

  double weightedAbsolutePercentageError() {
    double errors = 0.0;
    double total = 0.0;
    for (int i = 0; i < truth.length; i++) {
      errors += FastMath.abs(truth[i] - predictions[i]);
      total += FastMath.abs(truth[i]);
    }
    return errors / total;
  }

  double meanAbsoluteScaledError() {
    double[] scaled = new double[truth.length];
    for (int i = 0; i < scaled.length; i++) {
      scaled[i] = FastMath.abs(truth[i] - predictions[i]) / seasonalErrors[i];
    }
    return safeMean(itemwiseMean(scaled));
  }

  double meanQuantileLoss() {
    double[] losses = quantileLossPerStep();
    double sum = 0.0;
    for (double loss : losses) {
      sum += loss;
    }
    return sum / losses.length;
  }

  double weightedQuantileLoss() {
    double[] losses = quantileLossPerStep();
    double sum = 0.0;
    double total = 0.0;
    for (int i = 0; i < losses.length; i++) {
      sum += losses[i];
      total += FastMath.abs(truth[i]);
    }
    return sum / total;
  }

  double scaledQuantileLoss() {
    double[] losses = quantileLossPerStep();
    for (int i = 0; i < losses.length; i++) {
      losses[i] /= seasonalErrors[i];
    }
    return safeMean(itemwiseMean(losses));
  }

  /**
   * @return for each step, the pinball loss {@code 2 |(q' - y)(1[q' >= y] - q)|} of the quantile forecasts
   *  {@code q'} at levels {@code q}, averaged over levels
   */
  private double[] quantileLossPerStep() {
    if (quantileLevels.length == 0) {
      throw new ResultException("No quantile forecasts");
    }
    double[] losses = new double[truth.length];
    for (int i = 0; i < truth.length; i++) {
      double sum = 0.0;
      for (int q = 0; q < quantileLevels.length; q++) {
        double forecast = quantilePredictions[i][q];
        double indicator = forecast >= truth[i] ? 1.0 : 0.0;
        sum += 2.0 * FastMath.abs((forecast - truth[i]) * (indicator - quantileLevels[q]));
      }
      losses[i] = sum / quantileLevels.length;
    }
    return losses;
  }

  private double[] itemwiseMean(double[] values) {
    Collection<List<Integer>> groups = groupByItem().values();
    double[] means = new double[groups.size()];
    int i = 0;
    for (List<Integer> rows : groups) {
      double sum = 0.0;
      for (int row : rows) {
        sum += values[row];
      }
      means[i++] = sum / rows.size();
    }
    return means;
  }

  /**
   * @return mean of the finite values, or NaN if there are none
   */
  private static double safeMean(double[] values) {
    return RunningStatistics.ofFinite(values).getAverage();
  }

  @Override
  public String toString() {
    return "TimeSeriesResult[" + truth.length + " steps, " + quantileLevels.length + " quantile levels]";
  }

}
