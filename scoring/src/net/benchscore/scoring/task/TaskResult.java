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

package net.benchscore.scoring.task;

import java.io.File;
import java.io.IOException;
import java.text.DateFormat;
import java.text.SimpleDateFormat;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Predicate;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import com.google.common.primitives.Doubles;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.benchscore.common.io.IOUtils;
import net.benchscore.common.table.Table;
import net.benchscore.common.table.TableReader;
import net.benchscore.common.table.TableWriter;
import net.benchscore.scoring.ScoringConfiguration;
import net.benchscore.scoring.board.ScoreEntry;
import net.benchscore.scoring.result.ClassificationResult;
import net.benchscore.scoring.result.ErrorResult;
import net.benchscore.scoring.result.Evaluation;
import net.benchscore.scoring.result.NoResult;
import net.benchscore.scoring.result.RegressionResult;
import net.benchscore.scoring.result.Result;
import net.benchscore.scoring.result.TimeSeriesResult;
import net.benchscore.scoring.validation.InvalidPredictionsException;
import net.benchscore.scoring.validation.PredictionValidator;

/**
 * <p>Scores the predictions of one framework run on one fold of a task. The run's predictions and metadata
 * are read from {@code <task>/<fold>/predictions.csv} and {@code <task>/<fold>/metadata.json} under a
 * predictions directory, unless given explicitly.</p>
 *
 * <p>{@link #computeScore(Result, Map)} produces one scoreboard entry, even for a run that produced no
 * predictions or whose predictions could not be read.</p>
 */
public final class TaskResult {

  private static final Logger log = LoggerFactory.getLogger(TaskResult.class);

  public static final String PREDICTIONS_FILE = "predictions.csv";
  public static final String METADATA_FILE = "metadata.json";

  static final String TRAINING_DURATION = "training_duration";
  static final String PREDICT_DURATION = "predict_duration";
  static final String MODELS_COUNT = "models_count";
  static final String INFERENCE_TIMES = "inference_times";
  private static final Set<String> CONSUMED_SIDE_CHANNEL_KEYS =
      ImmutableSet.of(TRAINING_DURATION, PREDICT_DURATION, MODELS_COUNT, INFERENCE_TIMES);

  private static final Joiner INFO_JOINER = Joiner.on("; ");
  private static final Predicate<String> NOT_EMPTY = new Predicate<String>() {
    @Override
    public boolean apply(String s) {
      return !Strings.isNullOrEmpty(s);
    }
  };

  private final TaskDefinition task;
  private final int fold;
  private final String constraint;
  private final File predictionsFile;
  private final File metadataFile;
  private final ScoringConfiguration config;
  private RunMetadata metadata;
  private Result result;

  /**
   * @param task task that was run
   * @param fold fold of the task that was run
   * @param constraint name of the resource constraint of the run, or {@code null}
   * @param predictionsDir directory holding the run's files, or {@code null} for the configured one
   * @param metadata the run's metadata, or {@code null} to read it from the run's metadata file
   * @param config scoring configuration
   */
  public TaskResult(TaskDefinition task,
                    int fold,
                    String constraint,
                    File predictionsDir,
                    RunMetadata metadata,
                    ScoringConfiguration config) {
    this(task, fold, constraint, runFile(task, fold, predictionsDir, config, PREDICTIONS_FILE),
         runFile(task, fold, predictionsDir, config, METADATA_FILE), metadata, config);
  }

  /**
   * @param predictionsFile the run's predictions
   * @param metadataFile the run's metadata, used if {@code metadata} is {@code null}
   */
  public TaskResult(TaskDefinition task,
                    int fold,
                    String constraint,
                    File predictionsFile,
                    File metadataFile,
                    RunMetadata metadata,
                    ScoringConfiguration config) {
    Preconditions.checkNotNull(task);
    Preconditions.checkArgument(fold >= 0, "Bad fold: %s", fold);
    Preconditions.checkNotNull(config);
    this.task = task;
    this.fold = fold;
    this.constraint = constraint;
    this.predictionsFile = predictionsFile;
    this.metadataFile = metadataFile;
    this.metadata = metadata;
    this.config = config;
  }

  private static File runFile(TaskDefinition task,
                              int fold,
                              File predictionsDir,
                              ScoringConfiguration config,
                              String fileName) {
    File dir = predictionsDir == null ? config.getPredictionsDir() : predictionsDir;
    return new File(new File(new File(dir, task.getName()), Integer.toString(fold)), fileName);
  }

  public TaskDefinition getTask() {
    return task;
  }

  public int getFold() {
    return fold;
  }

  public File getPredictionsFile() {
    return predictionsFile;
  }

  public File getMetadataFile() {
    return metadataFile;
  }

  /**
   * @return the run's predictions, loaded on first access
   * @throws InvalidPredictionsException if the predictions violate the structure predictions must have
   */
  public Result getResult() throws InvalidPredictionsException {
    if (result == null) {
      result = loadPredictions(predictionsFile, config);
    }
    return result;
  }

  /**
   * @return the run's metadata, loaded on first access if it was not given
   */
  public RunMetadata getResultMetadata() throws IOException {
    if (metadata == null) {
      metadata = loadMetadata(metadataFile);
    }
    return metadata;
  }

  /**
   * Loads predictions, choosing the kind of result from the columns: time series if there is a
   * {@code repeated_item_id} column, classification if there are more than two columns, and regression
   * otherwise. Classification and regression predictions are validated first in test mode; time series
   * predictions are always checked when loaded.
   *
   * @param file predictions file
   * @return predictions; a {@link NoResult} if the file does not exist, or an {@link ErrorResult} if it can't
   *  be read, or if it violates the structure predictions must have and test mode is off
   * @throws InvalidPredictionsException in test mode, if the predictions violate the structure predictions
   *  must have
   */
  public static Result loadPredictions(File file, ScoringConfiguration config) throws InvalidPredictionsException {
    log.info("Loading predictions from {}", file);
    if (!file.isFile()) {
      log.warn("Predictions file {} is missing: framework either failed or could not produce any prediction",
               file);
      return new NoResult("Missing predictions.");
    }
    try {
      Table predictions = TableReader.read(file);
      if (log.isDebugEnabled()) {
        log.debug("Predictions preview:\n{}", predictions.preview(10));
      }
      if (predictions.hasColumn(TimeSeriesResult.ITEM_ID)) {
        // checked by the constructor itself
        return new TimeSeriesResult(predictions);
      }
      if (config.isTestMode()) {
        new PredictionValidator(config.isEncodePredictionsAndTruth()).validate(predictions);
      }
      if (predictions.getNumColumns() > 2) {
        return new ClassificationResult(predictions, config);
      }
      return new RegressionResult(predictions);
    } catch (InvalidPredictionsException ipe) {
      if (config.isTestMode()) {
        throw ipe;
      }
      log.warn("Invalid predictions in {}: {}", file, ipe.getMessage());
      return new ErrorResult(ipe, config.getErrorMaxLength());
    } catch (IOException ioe) {
      log.warn("Could not load predictions from {}", file, ioe);
      return new ErrorResult(ioe, config.getErrorMaxLength());
    } catch (RuntimeException re) {
      log.warn("Could not load predictions from {}", file, re);
      return new ErrorResult(re, config.getErrorMaxLength());
    }
  }

  /**
   * @param file metadata JSON file
   * @return metadata of the run, or empty metadata if the file does not exist
   * @throws IOException if the file can't be read or parsed
   */
  public static RunMetadata loadMetadata(File file) throws IOException {
    log.info("Loading metadata from {}", file);
    if (!file.isFile()) {
      log.warn("Metadata file {} is missing: framework either couldn't start or doesn't save metadata", file);
      return new RunMetadata();
    }
    return ScoringJson.readMetadata(file);
  }

  public ScoreEntry computeScore() throws InvalidPredictionsException, IOException {
    return computeScore(null, null);
  }

  /**
   * <p>Assembles the scoreboard entry of the run. It has:</p>
   *
   * <ul>
   *   <li>identity of the run: task, fold, constraint, framework and its version and params, problem type, seed,
   *    and the configured mode and application version</li>
   *   <li>{@code training_duration}, {@code predict_duration} and {@code models_count} from the side channel</li>
   *   <li>for each data split and batch size in the side channel's {@code inference_times}, the median time as
   *    {@code infer_batch_size_<split>_<size>}</li>
   *   <li>a column for each metric of the metadata</li>
   *   <li>the primary metric as {@code metric} and its value as {@code result}, negated and named
   *    {@code neg_<metric>} if lower values are better</li>
   *   <li>{@code info}: the result's info and the reasons metrics couldn't be computed</li>
   *   <li>all other side channel values</li>
   * </ul>
   *
   * @param result predictions to score, or {@code null} to load them
   * @param sideChannel additional measurements of the run, or {@code null}
   * @return scoreboard entry of the run
   * @throws InvalidPredictionsException if loaded predictions violate the structure predictions must have
   * @throws IOException if metadata can't be read
   */
  public ScoreEntry computeScore(Result result, Map<String,?> sideChannel)
      throws InvalidPredictionsException, IOException {
    Map<String,?> side = sideChannel == null ? Collections.<String,Object>emptyMap() : sideChannel;
    RunMetadata runMetadata = getResultMetadata();
    Result scored = result == null ? getResult() : result;

    ScoreEntry entry = new ScoreEntry();
    entry.put("id", task.getId());
    entry.put("task", task.getName());
    String type = runMetadata.getType();
    if (type == null && scored.getType() != null) {
      type = scored.getType().getName();
    }
    entry.put("type", type);
    entry.put("constraint", constraint);
    entry.put("framework", runMetadata.getFramework());
    entry.put("version", runMetadata.getFrameworkVersion());
    Map<String,Object> params = runMetadata.getFrameworkParams();
    entry.put("params", params.isEmpty() ? "" : ScoringJson.toJson(params));
    entry.put("fold", fold);
    entry.put("mode", config.getRunMode());
    entry.put("seed", runMetadata.getSeed());
    entry.put("app_version", config.getAppVersion());
    entry.put("utc", utcNow());
    entry.put("metric", runMetadata.getMetric());
    entry.put("duration", Double.NaN);

    entry.put(TRAINING_DURATION, sideChannelValue(side, TRAINING_DURATION));
    entry.put(PREDICT_DURATION, sideChannelValue(side, PREDICT_DURATION));
    entry.put(MODELS_COUNT, sideChannelValue(side, MODELS_COUNT));
    Object inferenceTimes = side.get(INFERENCE_TIMES);
    if (inferenceTimes instanceof Map<?,?>) {
      putInferenceTimes(entry, (Map<?,?>) inferenceTimes);
    }

    String primaryMetric = runMetadata.getMetric();
    List<String> scoringErrors = Lists.newArrayList();
    Evaluation primary = null;
    for (String metric : runMetadata.getMetrics()) {
      Evaluation evaluation = evaluate(scored, metric, scoringErrors);
      entry.put(metric, evaluation.getValue());
      if (metric.equals(primaryMetric)) {
        primary = evaluation;
      }
    }
    if (primary == null && primaryMetric != null) {
      primary = evaluate(scored, primaryMetric, scoringErrors);
    }
    if (primary == null) {
      entry.put("result", Double.NaN);
    } else {
      entry.put("metric", primary.getNormalizedMetric());
      entry.put("result", primary.getNormalizedValue());
    }

    List<String> info = Lists.newArrayList();
    info.add(scored.getInfo());
    info.addAll(scoringErrors);
    entry.put("info", INFO_JOINER.join(Iterables.filter(info, NOT_EMPTY)));

    for (Map.Entry<String,?> sideEntry : side.entrySet()) {
      String key = sideEntry.getKey();
      if (!CONSUMED_SIDE_CHANNEL_KEYS.contains(key)) {
        Object value = sideEntry.getValue();
        entry.put(key, value instanceof Map<?,?> || value instanceof Collection<?> ? ScoringJson.toJson(value) : value);
      }
    }
    log.info("Metric scores: {}", entry);
    return entry;
  }

  private static Evaluation evaluate(Result result, String metric, Collection<String> scoringErrors) {
    Evaluation evaluation = result.evaluate(metric);
    if (evaluation.getMessage() != null) {
      scoringErrors.add(evaluation.getMessage());
    }
    return evaluation;
  }

  private static Object sideChannelValue(Map<String,?> side, String key) {
    Object value = side.get(key);
    return value == null ? Double.NaN : value;
  }

  private static void putInferenceTimes(ScoreEntry entry, Map<?,?> inferenceTimes) {
    for (Map.Entry<?,?> split : inferenceTimes.entrySet()) {
      if (!(split.getValue() instanceof Map<?,?>)) {
        continue;
      }
      for (Map.Entry<?,?> measurements : ((Map<?,?>) split.getValue()).entrySet()) {
        if (!(measurements.getValue() instanceof Collection<?>)) {
          continue;
        }
        List<Double> times = Lists.newArrayList();
        for (Object time : (Collection<?>) measurements.getValue()) {
          if (time instanceof Number) {
            times.add(((Number) time).doubleValue());
          }
        }
        double median = times.isEmpty() ? Double.NaN : new Median().evaluate(Doubles.toArray(times));
        entry.put("infer_batch_size_" + split.getKey() + '_' + measurements.getKey(), median);
      }
    }
  }

  private static String utcNow() {
    DateFormat format = new SimpleDateFormat("yyyy-MM-dd'T'HH:mm:ss", Locale.ENGLISH);
    format.setTimeZone(TimeZone.getTimeZone("UTC"));
    return format.format(new Date());
  }

  /**
   * Writes predictions in the layout that {@link #loadPredictions(File, ScoringConfiguration)} reads: class
   * probability columns ordered by label, then {@code predictions} and {@code truth}, then any other columns.
   * An existing file is backed up first.
   *
   * @param outputFile file to write
   * @param predictions predicted label or value of each row
   * @param truth true label or value of each row
   * @param probabilities class probabilities of each row, or {@code null} for regression
   * @param probabilityLabels class label of each column of {@code probabilities}
   * @param optionalColumns additional columns, like time series item ids, or {@code null}
   */
  public static void savePredictions(File outputFile,
                                     List<String> predictions,
                                     List<String> truth,
                                     double[][] probabilities,
                                     List<String> probabilityLabels,
                                     Table optionalColumns) throws IOException {
    int numRows = predictions.size();
    Preconditions.checkArgument(truth.size() == numRows,
                                "Got %s predictions but %s truth values", numRows, truth.size());
    Preconditions.checkArgument(optionalColumns == null || optionalColumns.getNumRows() == numRows,
                                "Optional columns don't have %s rows", numRows);
    log.debug("Saving predictions to {}", outputFile);

    List<String> sortedLabels = Collections.emptyList();
    int[] sourceColumns = new int[0];
    if (probabilities != null) {
      Preconditions.checkArgument(probabilities.length == numRows,
                                  "Got %s predictions but %s probability rows", numRows, probabilities.length);
      Preconditions.checkNotNull(probabilityLabels, "No labels for probabilities");
      sortedLabels = Lists.newArrayList(probabilityLabels);
      Collections.sort(sortedLabels);
      sourceColumns = new int[sortedLabels.size()];
      for (int i = 0; i < sourceColumns.length; i++) {
        sourceColumns[i] = probabilityLabels.indexOf(sortedLabels.get(i));
      }
    }

    List<String> columns = Lists.newArrayList(sortedLabels);
    columns.add("predictions");
    columns.add("truth");
    if (optionalColumns != null) {
      columns.addAll(optionalColumns.getColumns());
    }
    Table.Builder builder = Table.builder(columns);
    for (int row = 0; row < numRows; row++) {
      List<String> values = Lists.newArrayListWithCapacity(columns.size());
      for (int sourceColumn : sourceColumns) {
        values.add(Double.toString(probabilities[row][sourceColumn]));
      }
      values.add(predictions.get(row));
      values.add(truth.get(row));
      if (optionalColumns != null) {
        values.addAll(optionalColumns.getRow(row));
      }
      builder.addRow(values);
    }
    Table table = builder.build();
    if (log.isDebugEnabled()) {
      log.debug("Predictions preview:\n{}", table.preview(20));
    }

    IOUtils.backupFile(outputFile);
    TableWriter.write(table, outputFile);
    log.info("Predictions saved to {}", outputFile);
  }

  /**
   * Scores a predictions file named {@code <framework>_[task_]<task>_<fold>.csv}, with tokens separated by
   * the configured separator. If a parent directory is named
   * {@code <framework>_<benchmark>_<constraint>_<mode>_<yyyyMMddTHHmmss>}, the constraint is taken from it. The
   * run's metadata is read from {@code metadata.json} next to the file if there is one.
   *
   * @param file predictions file
   * @return scoreboard entry of the run, or {@code null} if the file name doesn't have the expected format
   */
  public static ScoreEntry scoreFromPredictionsFile(File file, ScoringConfiguration config)
      throws InvalidPredictionsException, IOException {
    String sep = Pattern.quote(config.getTokenSeparator());
    Pattern filePattern = Pattern.compile(
        "(?<framework>[\\w\\-]+?)" + sep + "(?:task" + sep + ")?(?<task>[\\w\\-]+)" + sep + "(?<fold>\\d+)\\.csv");
    Matcher fileMatcher = filePattern.matcher(file.getName());
    if (!fileMatcher.matches()) {
      log.error("Predictions file {} has wrong naming format", file);
      return null;
    }
    String framework = fileMatcher.group("framework");
    String taskName = fileMatcher.group("task");
    int fold = Integer.parseInt(fileMatcher.group("fold"));

    Pattern folderPattern = Pattern.compile(
        "(?<framework>[\\w\\-]+?)" + sep + "(?<benchmark>[\\w\\-]+)" + sep + "(?<constraint>[\\w\\-]+)" + sep +
        "(?<mode>[\\w\\-]+)" + sep + "(?<datetime>\\d{8}T\\d{6})");
    String constraint = null;
    for (File dir = file.getAbsoluteFile().getParentFile(); dir != null; dir = dir.getParentFile()) {
      Matcher folderMatcher = folderPattern.matcher(dir.getName());
      if (folderMatcher.matches()) {
        constraint = folderMatcher.group("constraint");
        log.debug("Run of benchmark {} under constraint {}", folderMatcher.group("benchmark"), constraint);
        break;
      }
    }

    File metadataFile = new File(file.getAbsoluteFile().getParentFile(), METADATA_FILE);
    RunMetadata metadata = loadMetadata(metadataFile);
    if (metadata.getFramework() == null) {
      metadata.setFramework(framework);
    }
    TaskResult taskResult =
        new TaskResult(TaskDefinition.named(taskName), fold, constraint, file, metadataFile, metadata, config);
    return taskResult.computeScore();
  }

}
