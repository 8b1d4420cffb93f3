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
 * Metrics of {@link RegressionResult}s, also computed for time series.
 */
public enum RegressionMetric implements ScoringFunction<RegressionResult> {

  MAE("mae", MetricDirection.LOWER_IS_BETTER) {
    @Override
    public double score(RegressionResult result) {
      return result.meanAbsoluteError();
    }
  },

  MSE("mse", MetricDirection.LOWER_IS_BETTER) {
    @Override
    public double score(RegressionResult result) {
      return result.meanSquaredError();
    }
  },

  MSLE("msle", MetricDirection.LOWER_IS_BETTER) {
    @Override
    public double score(RegressionResult result) {
      return result.meanSquaredLogError();
    }
  },

  R2("r2", MetricDirection.HIGHER_IS_BETTER) {
    @Override
    public double score(RegressionResult result) {
      return result.r2();
    }
  },

  RMSE("rmse", MetricDirection.LOWER_IS_BETTER) {
    @Override
    public double score(RegressionResult result) {
      return result.rootMeanSquaredError();
    }
  },

  RMSLE("rmsle", MetricDirection.LOWER_IS_BETTER) {
    @Override
    public double score(RegressionResult result) {
      return result.rootMeanSquaredLogError();
    }
  };

  private final String name;
  private final MetricDirection direction;

  RegressionMetric(String name, MetricDirection direction) {
    this.name = name;
    this.direction = direction;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public MetricDirection getDirection() {
    return direction;
  }

}
