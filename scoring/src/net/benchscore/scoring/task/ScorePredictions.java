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
import java.util.List;

import com.google.common.collect.Lists;
import com.lexicalscope.jewel.cli.ArgumentValidationException;
import com.lexicalscope.jewel.cli.CliFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.benchscore.common.log.MemoryHandler;
import net.benchscore.scoring.ScoringConfiguration;
import net.benchscore.scoring.board.ScoreEntry;
import net.benchscore.scoring.board.Scoreboard;
import net.benchscore.scoring.validation.InvalidPredictionsException;

/**
 * <p>Scores predictions files from the command line, and optionally adds the scores to the scoreboard of all
 * results. Each file must be named {@code <framework>_[task_]<task>_<fold>.csv}. For example:</p>
 *
 * <p>{@code java -cp ... net.benchscore.scoring.task.ScorePredictions --save --verbosity 2
 *  results/autosklearn_task_adult_0.csv}</p>
 *
 * <p>Other settings are read from system properties; see {@link ScoringConfiguration}.</p>
 */
public final class ScorePredictions {

  private static final Logger log = LoggerFactory.getLogger(ScorePredictions.class);

  private ScorePredictions() {
  }

  public static void main(String[] args) throws Exception {
    ScorePredictionsArgs cliArgs;
    try {
      cliArgs = CliFactory.parseArguments(ScorePredictionsArgs.class, args);
    } catch (ArgumentValidationException ave) {
      printHelp(ave.getMessage());
      return;
    }

    List<String> fileNames = cliArgs.getFiles();
    if (fileNames == null || fileNames.isEmpty()) {
      printHelp("No predictions file specified");
      return;
    }
    List<File> files = Lists.newArrayListWithCapacity(fileNames.size());
    for (String fileName : fileNames) {
      files.add(new File(fileName));
    }

    MemoryHandler.setSensibleLogFormat();
    ScoringConfiguration config = new ScoringConfiguration();
    if (cliArgs.isTestMode()) {
      config.setTestMode(true);
    }
    File scoresDir = cliArgs.getScoresDir() == null ? config.getScoresDir() : cliArgs.getScoresDir();

    Scoreboard scoreboard = score(files, scoresDir, config);
    System.out.println(scoreboard.asPrintableTable(cliArgs.getVerbosity()).preview(Integer.MAX_VALUE));
    if (cliArgs.isSave()) {
      scoreboard.save(true);
    }
  }

  /**
   * @return scoreboard of all results in {@code scoresDir}, holding the scores of the files that could be scored
   */
  static Scoreboard score(List<File> files, File scoresDir, ScoringConfiguration config) {
    List<ScoreEntry> entries = Lists.newArrayList();
    for (File file : files) {
      try {
        ScoreEntry entry = TaskResult.scoreFromPredictionsFile(file, config);
        if (entry != null) {
          entries.add(entry);
        }
      } catch (InvalidPredictionsException ipe) {
        log.error("Invalid predictions in {}: {}", file, ipe.getMessage());
      } catch (IOException ioe) {
        log.error("Could not score {}", file, ioe);
      }
    }
    log.info("Scored {} of {} files", entries.size(), files.size());
    return Scoreboard.of(entries, scoresDir, config);
  }

  private static void printHelp(String message) {
    System.out.println();
    System.out.println("Scores predictions files of benchmark runs.");
    System.out.println();
    if (message != null) {
      System.out.println(message);
      System.out.println();
    }
  }

}
