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

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import org.apache.commons.math3.util.FastMath;

import net.benchscore.common.LangUtils;
import net.benchscore.common.stats.RunningStatistics;
import net.benchscore.common.table.Table;
import net.benchscore.scoring.MultiClassAverage;
import net.benchscore.scoring.ProblemType;
import net.benchscore.scoring.ScoringConfiguration;
import net.benchscore.scoring.stats.ConfusionMatrix;
import net.benchscore.scoring.stats.RankingStatistics;

/**
 * <p>Predictions for a classification problem. The predictions table has one probability column per class,
 * named by the class label, followed by a {@code predictions} column and a {@code truth} column. The problem is
 * binary if there are exactly two classes, and multiclass otherwise.</p>
 *
 * <p>Labels are encoded as the index of their probability column. When predictions and truth are already
 * encoded, as digit strings, they are used as indices directly.</p>
 */
public final class ClassificationResult extends Result {

  private static final Map<String,ClassificationMetric> METRICS =
      MetricRegistry.indexByName(ClassificationMetric.values());

  private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');
  private static final double EPSILON = Math.ulp(1.0);

  private final ProblemType type;
  private final LabelEncoder encoder;
  private final double[][] probabilities;
  private final int[] truth;
  private final int[] predictions;
  private final ConfusionMatrix confusionMatrix;
  private final MultiClassAverage multiClassAverage;

  public ClassificationResult(Table table, ScoringConfiguration config) {
    this(table, config.getMultiClassAverage(), config.isEncodePredictionsAndTruth());
  }

  /**
   * @param table class probability columns, then {@code predictions} and {@code truth}
   * @param multiClassAverage how per-class scores are averaged for multiclass problems
   * @param encoded whether predictions and truth may already be class indices
   * @throws IllegalArgumentException if the table has no rows, no class column, or a label that is not a class
   * @throws NumberFormatException if a probability is not a number
   */
  public ClassificationResult(Table table, MultiClassAverage multiClassAverage, boolean encoded) {
    super(null);
    int numColumns = table.getNumColumns();
    Preconditions.checkArgument(numColumns >= 3,
                                "Expected class probability columns before predictions and truth: %s",
                                table.getColumns());
    Preconditions.checkArgument(table.getNumRows() > 0, "No predictions");
    int numClasses = numColumns - 2;
    this.encoder = new LabelEncoder(table.getColumns().subList(0, numClasses));
    this.type = numClasses == 2 ? ProblemType.BINARY : ProblemType.MULTICLASS;
    this.multiClassAverage = multiClassAverage;

    int numRows = table.getNumRows();
    probabilities = new double[numRows][numClasses];
    for (int row = 0; row < numRows; row++) {
      for (int c = 0; c < numClasses; c++) {
        probabilities[row][c] = LangUtils.parseNumeric(table.get(row, c));
      }
    }
    predictions = encode(table.getColumn(numColumns - 2), encoded);
    truth = encode(table.getColumn(numColumns - 1), encoded);
    confusionMatrix = new ConfusionMatrix(truth, predictions, numClasses);
  }

  private int[] encode(List<String> values, boolean encoded) {
    String first = values.get(0);
    if (encoded && !first.isEmpty() && DIGITS.matchesAllOf(first)) {
      int[] indices = new int[values.size()];
      for (int i = 0; i < indices.length; i++) {
        indices[i] = Integer.parseInt(values.get(i));
      }
      return indices;
    }
    return encoder.encodeAll(values);
  }

  @Override
  public ProblemType getType() {
    return type;
  }

  @Override
  public Set<String> getSupportedMetrics() {
    return Collections.unmodifiableSet(METRICS.keySet());
  }

  @Override
  public Evaluation evaluate(String metric) {
    return evaluateWith(metric, METRICS.get(metric), this);
  }

  public List<String> getClasses() {
    return encoder.getLabels();
  }

  double accuracy() {
    return confusionMatrix.getAccuracy();
  }

  double balancedAccuracy() {
    return confusionMatrix.getBalancedAccuracy();
  }

  double auc() {
    if (type != ProblemType.BINARY) {
      throw new ResultException("For multiclass problems, use `auc_ovr` or `auc_ovo` metrics instead of `auc`");
    }
    return RankingStatistics.auc(isClass(1), column(1));
  }

  /**
   * @return AUC of each class against all others, averaged
   */
  double aucOneVsRest() {
    int numClasses = encoder.size();
    double[] scores = new double[numClasses];
    double[] weights = new double[numClasses];
    for (int c = 0; c < numClasses; c++) {
      scores[c] = RankingStatistics.auc(isClass(c), column(c));
      weights[c] = confusionMatrix.getSupport(c);
    }
    return multiClassAverage.average(scores, weights);
  }

  /**
   * @return AUC of each pair of classes, over the examples of those two classes, averaged. The score of a pair
   *  is the mean of the AUC of each class of the pair against the other.
   */
  double aucOneVsOne() {
    int numClasses = encoder.size();
    int numPairs = numClasses * (numClasses - 1) / 2;
    double[] scores = new double[numPairs];
    double[] weights = new double[numPairs];
    int pair = 0;
    for (int a = 0; a < numClasses; a++) {
      for (int b = a + 1; b < numClasses; b++) {
        int pairCount = 0;
        for (int t : truth) {
          if (t == a || t == b) {
            pairCount++;
          }
        }
        boolean[] isA = new boolean[pairCount];
        boolean[] isB = new boolean[pairCount];
        double[] scoresA = new double[pairCount];
        double[] scoresB = new double[pairCount];
        int i = 0;
        for (int row = 0; row < truth.length; row++) {
          int t = truth[row];
          if (t == a || t == b) {
            isA[i] = t == a;
            isB[i] = t == b;
            scoresA[i] = probabilities[row][a];
            scoresB[i] = probabilities[row][b];
            i++;
          }
        }
        scores[pair] = (RankingStatistics.auc(isA, scoresA) + RankingStatistics.auc(isB, scoresB)) / 2.0;
        weights[pair] = (double) pairCount / truth.length;
        pair++;
      }
    }
    return multiClassAverage.average(scores, weights);
  }

  /**
   * @return F-beta score of the second class for binary problems, or the average over classes otherwise
   */
  double fbeta(double beta) {
    if (type == ProblemType.BINARY) {
      return confusionMatrix.getFBeta(1, beta);
    }
    int numClasses = encoder.size();
    double[] scores = new double[numClasses];
    double[] weights = new double[numClasses];
    for (int c = 0; c < numClasses; c++) {
      scores[c] = confusionMatrix.getFBeta(c, beta);
      weights[c] = confusionMatrix.getSupport(c);
    }
    return multiClassAverage.average(scores, weights);
  }

  /**
   * @return mean negative log of the probability given to the true class, after clipping probabilities away
   *  from 0 and 1 and renormalizing each row
   */
  double logLoss() {
    double sum = 0.0;
    for (int row = 0; row < truth.length; row++) {
      double[] rowProbabilities = probabilities[row];
      double total = 0.0;
      for (double p : rowProbabilities) {
        total += clip(p);
      }
      sum -= FastMath.log(clip(rowProbabilities[truth[row]]) / total);
    }
    return sum / truth.length;
  }

  private static double clip(double p) {
    return FastMath.min(FastMath.max(p, EPSILON), 1.0 - EPSILON);
  }

  double prAuc() {
    if (type != ProblemType.BINARY) {
      throw new ResultException("PR AUC metric is only available for binary problems");
    }
    return RankingStatistics.averagePrecision(isClass(1), column(1));
  }

  double meanPerClassError() {
    return RunningStatistics.ofFinite(confusionMatrix.getPerClassErrors()).getAverage();
  }

  double maxPerClassError() {
    return RunningStatistics.ofFinite(confusionMatrix.getPerClassErrors()).getMax();
  }

  private boolean[] isClass(int c) {
    boolean[] result = new boolean[truth.length];
    for (int i = 0; i < result.length; i++) {
      result[i] = truth[i] == c;
    }
    return result;
  }

  private double[] column(int c) {
    double[] result = new double[probabilities.length];
    for (int i = 0; i < result.length; i++) {
      result[i] = probabilities[i][c];
    }
    return result;
  }

  @Override
  public String toString() {
    return "ClassificationResult[" + type + ", " + encoder.getLabels() + ", " + truth.length + " predictions]";
  }

}
