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
 * Metrics of {@link TimeSeriesResult}s, in addition to the {@link RegressionMetric}s of their point forecasts.
 */
public enum TimeSeriesMetric implements ScoringFunction<TimeSeriesResult> {

  /** Mean absolute percentage error. */
  MAPE("mape") {
    @Override
    public double score(TimeSeriesResult result) {
      return result.meanAbsolutePercentageError();
    }
  },

  /** Mean absolute error scaled by the seasonal naive forecast error of each item. */
  MASE("mase") {
    @Override
    public double score(TimeSeriesResult result) {
      return result.meanAbsoluteScaledError();
    }
  },

  /** Mean quantile (pinball) loss over steps and quantile levels. */
  MQL("mql") {
    @Override
    public double score(TimeSeriesResult result) {
      return result.meanQuantileLoss();
    }
  },

  /** Symmetric mean absolute percentage error. */
  SMAPE("smape") {
    @Override
    public double score(TimeSeriesResult result) {
      return result.symmetricMeanAbsolutePercentageError();
    }
  },

  /** Quantile loss scaled by the seasonal naive forecast error of each item. */
  SQL("sql") {
    @Override
    public double score(TimeSeriesResult result) {
      return result.scaledQuantileLoss();
    }
  },

  /** Weighted absolute percentage error. */
  WAPE("wape") {
    @Override
    public double score(TimeSeriesResult result) {
      return result.weightedAbsolutePercentageError();
    }
  },

  /** Total quantile loss relative to the total absolute truth. */
  WQL("wql") {
    @Override
    public double score(TimeSeriesResult result) {
      return result.weightedQuantileLoss();
    }
  };

  private final String name;

  TimeSeriesMetric(String name) {
    this.name = name;
  }

  @Override
  public String getName() {
    return name;
  }

  /**
   * @return {@link MetricDirection#LOWER_IS_BETTER}, as all are errors
   */
  @Override
  public MetricDirection getDirection() {
    return MetricDirection.LOWER_IS_BETTER;
  }

}
