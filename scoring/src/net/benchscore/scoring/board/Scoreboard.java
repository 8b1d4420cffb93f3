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

package net.benchscore.scoring.board;

import java.io.File;
import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.benchscore.common.io.IOUtils;
import net.benchscore.common.table.Table;
import net.benchscore.common.table.TableReader;
import net.benchscore.common.table.TableWriter;
import net.benchscore.scoring.ScoringConfiguration;
import net.benchscore.scoring.result.MetricRegistry;

/**
 * <p>A ledger of scores, persisted as a CSV file in a scores directory. A scoreboard may hold the scores of
 * all runs, or be scoped to a framework, a benchmark, a task, or a framework together with a benchmark or
 * task. The scope determines the file name, with tokens joined by the configured separator:</p>
 *
 * <ul>
 *   <li>{@code results.csv}: all scores</li>
 *   <li>{@code {framework}.csv}</li>
 *   <li>{@code benchmark_{benchmark}.csv} and {@code {framework}_benchmark_{benchmark}.csv}</li>
 *   <li>{@code task_{task}.csv} and {@code {framework}_task_{task}.csv}</li>
 * </ul>
 *
 * <p>Instances are immutable: {@link #append(Table, boolean)} returns a new scoreboard, and
 * {@link #save(boolean)} writes this one's scores to its file.</p>
 */
public final class Scoreboard {

  private static final Logger log = LoggerFactory.getLogger(Scoreboard.class);

  public static final String RESULTS_FILE = "results.csv";

  /**
   * Columns every scoreboard has, in order. Metric columns follow, then any other columns.
   */
  public static final List<String> FIXED_COLUMNS = ImmutableList.of(
      "id", "task", "framework", "constraint", "fold", "type", "result", "metric", "mode", "version",
      "params", "app_version", "utc", "duration", "training_duration", "predict_duration", "models_count",
      "seed", "info");

  private static final String NAME_TOKEN = "[\\w\\-]+";

  private final Table scores;
  private final String frameworkName;
  private final String benchmarkName;
  private final String taskName;
  private final File scoresDir;
  private final String separator;

  /**
   * @param scores scores held by this scoreboard
   * @param frameworkName framework the scoreboard is scoped to, or {@code null}
   * @param benchmarkName benchmark the scoreboard is scoped to, or {@code null}
   * @param taskName task the scoreboard is scoped to, or {@code null}
   * @param scoresDir directory of the scoreboard file
   * @param config supplies the file name separator
   */
  public Scoreboard(Table scores,
                    String frameworkName,
                    String benchmarkName,
                    String taskName,
                    File scoresDir,
                    ScoringConfiguration config) {
    this(scores, frameworkName, benchmarkName, taskName, scoresDir, config.getTokenSeparator());
  }

  private Scoreboard(Table scores,
                     String frameworkName,
                     String benchmarkName,
                     String taskName,
                     File scoresDir,
                     String separator) {
    Preconditions.checkNotNull(scores);
    Preconditions.checkNotNull(scoresDir);
    this.scores = scores;
    this.frameworkName = frameworkName;
    this.benchmarkName = benchmarkName;
    this.taskName = taskName;
    this.scoresDir = scoresDir;
    this.separator = separator;
  }

  /**
   * @return scoreboard of the given scope, with the scores already saved in its file, if any
   */
  public static Scoreboard load(String frameworkName,
                                String benchmarkName,
                                String taskName,
                                File scoresDir,
                                ScoringConfiguration config) throws IOException {
    Scoreboard empty = new Scoreboard(Table.empty(), frameworkName, benchmarkName, taskName, scoresDir, config);
    return empty.withScores(empty.load());
  }

  /**
   * @return scoreboard of all scores, {@code results.csv} in the scores directory
   */
  public static Scoreboard all(File scoresDir, ScoringConfiguration config) throws IOException {
    return load(null, null, null, scoresDir, config);
  }

  /**
   * @return scoreboard of the given entries, scoped to all scores in the scores directory
   */
  public static Scoreboard of(Collection<ScoreEntry> entries, File scoresDir, ScoringConfiguration config) {
    return new Scoreboard(ScoreEntry.toTable(entries), null, null, null, scoresDir, config);
  }

  /**
   * Loads the scoreboard saved in a file, deducing its scope from the file name.
   *
   * @param file scoreboard file
   * @return scoreboard, or {@code null} if the file name is not one of a scoreboard
   */
  public static Scoreboard fromFile(File file, ScoringConfiguration config) throws IOException {
    String sep = Pattern.quote(config.getTokenSeparator());
    Pattern[] patterns = {
        Pattern.compile(Pattern.quote(RESULTS_FILE)),
        Pattern.compile("(?<framework>" + NAME_TOKEN + ')' + sep + "benchmark" + sep +
                        "(?<benchmark>" + NAME_TOKEN + ")\\.csv"),
        Pattern.compile("benchmark" + sep + "(?<benchmark>" + NAME_TOKEN + ")\\.csv"),
        Pattern.compile("(?<framework>" + NAME_TOKEN + ')' + sep + "task" + sep +
                        "(?<task>" + NAME_TOKEN + ")\\.csv"),
        Pattern.compile("task" + sep + "(?<task>" + NAME_TOKEN + ")\\.csv"),
        Pattern.compile("(?<framework>" + NAME_TOKEN + ")\\.csv"),
    };
    String fileName = file.getName();
    for (Pattern pattern : patterns) {
      Matcher matcher = pattern.matcher(fileName);
      if (matcher.matches()) {
        String framework = group(matcher, pattern, "framework");
        String benchmark = group(matcher, pattern, "benchmark");
        String task = group(matcher, pattern, "task");
        File dir = file.getAbsoluteFile().getParentFile();
        return load(framework, benchmark, task, dir, config);
      }
    }
    log.warn("{} is not a scoreboard file name", file);
    return null;
  }

  private static String group(Matcher matcher, Pattern pattern, String name) {
    return pattern.pattern().contains("(?<" + name + '>') ? matcher.group(name) : null;
  }

  public String getFrameworkName() {
    return frameworkName;
  }

  public String getBenchmarkName() {
    return benchmarkName;
  }

  public String getTaskName() {
    return taskName;
  }

  /**
   * @return scores as they were loaded or appended, in no particular column order
   */
  public Table getScores() {
    return scores;
  }

  /**
   * @return file this scoreboard is saved to
   */
  public File getPath() {
    return new File(scoresDir, fileName());
  }

  private String fileName() {
    if (frameworkName != null) {
      if (taskName != null) {
        return frameworkName + separator + "task" + separator + taskName + ".csv";
      }
      if (benchmarkName != null) {
        return frameworkName + separator + "benchmark" + separator + benchmarkName + ".csv";
      }
      return frameworkName + ".csv";
    }
    if (taskName != null) {
      return "task" + separator + taskName + ".csv";
    }
    if (benchmarkName != null) {
      return "benchmark" + separator + benchmarkName + ".csv";
    }
    return RESULTS_FILE;
  }

  /**
   * @return scores saved in this scoreboard's file, or an empty table if there is no file
   */
  public Table load() throws IOException {
    File path = getPath();
    if (!path.isFile()) {
      log.debug("No scores at {}", path);
      return Table.empty();
    }
    log.debug("Loading scores from {}", path);
    return TableReader.read(path);
  }

  /**
   * @return scores with the fixed columns first, then metric columns and then other columns, each in
   *  alphabetical order; an empty table is returned unchanged
   */
  public Table asTable() {
    if (scores.isEmpty()) {
      return scores;
    }
    return scores.reindex(canonicalColumns(scores.getColumns()));
  }

  static List<String> canonicalColumns(Collection<String> columns) {
    SortedSet<String> metricColumns = Sets.newTreeSet();
    SortedSet<String> dynamicColumns = Sets.newTreeSet();
    for (String column : columns) {
      if (FIXED_COLUMNS.contains(column)) {
        continue;
      }
      if (MetricRegistry.get().isRegistered(column)) {
        metricColumns.add(column);
      } else {
        dynamicColumns.add(column);
      }
    }
    List<String> ordered = Lists.newArrayList(FIXED_COLUMNS);
    ordered.addAll(metricColumns);
    ordered.addAll(dynamicColumns);
    return ordered;
  }

  /**
   * @param verbosity 0 for no columns; 1 for {@code task, fold, framework, constraint, result, metric, info};
   *  2 for {@code id, task, fold, framework, constraint, result, metric, duration, seed, info}; 3 or more for
   *  all columns
   * @return scores in canonical column order, with values rounded and missing values blank
   */
  public Table asPrintableTable(int verbosity) {
    return ScoreFormatter.format(asTable(), verbosity);
  }

  /**
   * Writes all columns of the printable scores to this scoreboard's file. If the file already exists with a
   * different set of columns, or is to be overwritten, it is first backed up. When appending to a file with
   * different columns, the file is rewritten with its rows and the new rows under the union of both columns.
   *
   * @param append whether to add the scores to those already in the file
   */
  public void save(boolean append) throws IOException {
    Table printable = asPrintableTable(Integer.MAX_VALUE);
    File path = getPath();
    if (printable.getNumColumns() == 0) {
      log.info("No scores to save to {}", path);
      return;
    }
    boolean exists = path.isFile();
    boolean drift = false;
    List<String> existingColumns = null;
    if (exists) {
      existingColumns = TableReader.readHeader(path);
      Set<String> existing = Sets.newHashSet(existingColumns);
      drift = !existing.equals(Sets.newHashSet(printable.getColumns()));
    }
    if (exists && (drift || !append)) {
      IOUtils.backupFile(path);
    }
    log.debug("Saving scores to {}", path);
    if (!exists || !append) {
      TableWriter.write(printable, path);
    } else if (drift) {
      Table merged = TableReader.read(path).concat(printable);
      TableWriter.write(withScores(merged).asPrintableTable(Integer.MAX_VALUE), path);
    } else {
      TableWriter.write(printable.reindex(existingColumns), path, true);
    }
    log.info("Scores saved to {}", path);
  }

  /**
   * @return new scoreboard, of the same scope, holding this scoreboard's scores and then the other's
   */
  public Scoreboard append(Scoreboard other, boolean noDuplicates) {
    return append(other.scores, noDuplicates);
  }

  /**
   * @param other scores to add
   * @param noDuplicates if true, rows that are identical to an earlier row are dropped
   * @return new scoreboard, of the same scope, holding this scoreboard's scores and then {@code other}
   */
  public Scoreboard append(Table other, boolean noDuplicates) {
    Table merged;
    if (scores.getNumColumns() == 0) {
      merged = other;
    } else if (other.getNumColumns() == 0) {
      merged = scores;
    } else {
      merged = scores.concat(other);
    }
    return withScores(noDuplicates ? merged.distinct() : merged);
  }

  public Scoreboard append(Table other) {
    return append(other, true);
  }

  private Scoreboard withScores(Table newScores) {
    return new Scoreboard(newScores, frameworkName, benchmarkName, taskName, scoresDir, separator);
  }

  @Override
  public String toString() {
    return "Scoreboard[" + getPath() + ", " + scores.getNumRows() + " rows]";
  }

}
