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

import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.benchscore.scoring.ProblemType;

/**
 * <p>The predictions of one framework run on one task fold, and the metrics that can be computed from them.
 * Subclasses hold a fixed table of metric names to {@link ScoringFunction}s; {@link #evaluate(String)}
 * looks a metric up in it and computes it.</p>
 *
 * <p>Evaluating never throws. A metric that is not in the table, or that fails, yields an
 * {@link Evaluation} with a NaN value and a message.</p>
 */
public abstract class Result {

  private static final Logger log = LoggerFactory.getLogger(Result.class);

  private final String info;

  protected Result(String info) {
    this.info = info;
  }

  /**
   * @return type of problem these predictions are for, or {@code null} if there are no predictions
   */
  public abstract ProblemType getType();

  /**
   * @return additional information about the result, like why there are no predictions, or {@code null}
   */
  public String getInfo() {
    return info;
  }

  /**
   * @return names of the metrics this result can compute
   */
  public abstract Set<String> getSupportedMetrics();

  /**
   * @param metric metric name
   * @return value of the metric, or NaN and a message if it could not be computed
   */
  public abstract Evaluation evaluate(String metric);

  /**
   * Computes {@code metric} with {@code function} applied to {@code target}, turning failures into
   * NaN evaluations.
   */
  protected final <R extends Result> Evaluation evaluateWith(String metric,
                                                             ScoringFunction<R> function,
                                                             R target) {
    if (function == null) {
      return unsupported(metric);
    }
    try {
      return new Evaluation(metric, function.score(target), function.getDirection(), null);
    } catch (RuntimeException re) {
      log.warn("Unable to compute {} for {} result", metric, getType(), re);
      String reason = re.getMessage() == null ? re.getClass().getSimpleName() : re.getMessage();
      return new Evaluation(metric, Double.NaN, function.getDirection(), "Scoring " + metric + ": " + reason);
    }
  }

  private Evaluation unsupported(String metric) {
    ProblemType type = getType();
    log.warn("Metric {} is not supported for {} problems", metric, type);
    return new Evaluation(metric,
                          Double.NaN,
                          MetricDirection.UNKNOWN,
                          "Unsupported metric `" + metric + "` for " + type + " problems");
  }

}
