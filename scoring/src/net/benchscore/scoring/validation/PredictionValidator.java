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

package net.benchscore.scoring.validation;

import java.util.List;
import java.util.Set;

import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;
import com.google.common.collect.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.benchscore.common.LangUtils;
import net.benchscore.common.table.Table;

/**
 * <p>Checks that a predictions table has the structure that frameworks must produce:</p>
 *
 * <ul>
 *   <li>at least two columns, the last two named {@code predictions} and {@code truth}</li>
 *   <li>for regression (exactly two columns), numeric values only</li>
 *   <li>for classification, one numeric probability column per class, named by the class label, with labels
 *    unique and in lexicographic order; predictions among the classes, and each equal to the class with the
 *    highest probability in its row</li>
 * </ul>
 *
 * <p>A truth column whose values differ from the classes is suspicious but allowed; it is logged.</p>
 */
public final class PredictionValidator {

  private static final Logger log = LoggerFactory.getLogger(PredictionValidator.class);

  private final boolean encoded;

  /**
   * @param encoded whether classification predictions and truth are class indices rather than labels
   */
  public PredictionValidator(boolean encoded) {
    this.encoded = encoded;
  }

  /**
   * @throws InvalidPredictionsException at the first violation found
   */
  public void validate(Table predictions) throws InvalidPredictionsException {
    List<String> names = predictions.getColumns();
    int numColumns = names.size();
    check(numColumns >= 2, "Predictions should have 2 columns (regression) or more (classification)");
    check("truth".equals(names.get(numColumns - 1)), "Last column of predictions must be named `truth`");
    check("predictions".equals(names.get(numColumns - 2)),
          "Second to last column of predictions must be named `predictions`");

    if (numColumns == 2) {
      for (int column = 0; column < 2; column++) {
        checkNumeric(predictions, column);
      }
      return;
    }

    List<String> classes = names.subList(0, numColumns - 2);
    check(Ordering.natural().isOrdered(classes), "Class probability columns are not sorted in lexicographic order");
    check(Sets.newHashSet(classes).size() == classes.size(),
          "Predictions contain multiple columns with the same label");
    for (int column = 0; column < classes.size(); column++) {
      checkNumeric(predictions, column);
    }

    List<String> predicted = predictions.getColumn(numColumns - 2);
    List<String> truth = predictions.getColumn(numColumns - 1);
    Set<String> classSet;
    if (encoded) {
      check(allIntegers(truth), "Values in truth column are not encoded");
      check(allIntegers(predicted), "Values in predictions column are not encoded");
      classSet = Sets.newHashSet();
      for (int c = 0; c < classes.size(); c++) {
        classSet.add(Integer.toString(c));
      }
      predicted = canonicalIntegers(predicted);
      truth = canonicalIntegers(truth);
    } else {
      classSet = Sets.newHashSet(classes);
    }

    Set<String> truthSet = Sets.newHashSet(truth);
    if (!classSet.containsAll(truthSet)) {
      log.warn("Truth column contains values unseen during training: no matching probability column");
    }
    if (!truthSet.containsAll(classSet)) {
      log.warn("Truth column doesn't contain all the possible target values: the test dataset may be too small");
    }
    Set<String> unexpected = Sets.difference(Sets.newHashSet(predicted), classSet);
    check(unexpected.isEmpty(), "Predictions column contains unexpected values: " + unexpected);

    for (int row = 0; row < predictions.getNumRows(); row++) {
      int best = argMax(predictions, row, classes.size());
      String expected = encoded ? Integer.toString(best) : classes.get(best);
      check(expected.equals(predicted.get(row)),
            "Predictions don't always match the class with the highest probability");
    }
  }

  private static int argMax(Table predictions, int row, int numClasses) {
    int best = 0;
    double bestProbability = Double.NEGATIVE_INFINITY;
    for (int c = 0; c < numClasses; c++) {
      double probability = LangUtils.parseNumeric(predictions.get(row, c));
      if (probability > bestProbability) {
        best = c;
        bestProbability = probability;
      }
    }
    return best;
  }

  private static void checkNumeric(Table predictions, int column) throws InvalidPredictionsException {
    for (String value : predictions.getColumn(column)) {
      if (!LangUtils.isNumeric(value)) {
        throw new InvalidPredictionsException(
            "Column `" + predictions.getColumns().get(column) + "` contains non-numeric value: " + value);
      }
    }
  }

  private static boolean allIntegers(List<String> values) {
    for (String value : values) {
      if (!LangUtils.isInteger(value)) {
        return false;
      }
    }
    return true;
  }

  private static List<String> canonicalIntegers(List<String> values) {
    List<String> canonical = Lists.newArrayListWithCapacity(values.size());
    for (String value : values) {
      canonical.add(Integer.toString(Integer.parseInt(value.trim())));
    }
    return canonical;
  }

  private static void check(boolean condition, String message) throws InvalidPredictionsException {
    if (!condition) {
      throw new InvalidPredictionsException(message);
    }
  }

}
