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
import java.util.List;

import com.lexicalscope.jewel.cli.Option;
import com.lexicalscope.jewel.cli.Unparsed;

/**
 * Command line argument object for {@link ScorePredictions}.
 */
public interface ScorePredictionsArgs {

  @Option(defaultToNull = true, description = "Directory of the scoreboard to add scores to; " +
                                              "defaults to the scores directory under scoring.outputDir")
  File getScoresDir();

  @Option(description = "Save the scores to the scoreboard, appending to scores already there")
  boolean isSave();

  @Option(defaultValue = "1", description = "How many columns to print: 0 (none) to 3 (all)")
  int getVerbosity();

  @Option(description = "Validate predictions strictly before scoring them")
  boolean isTestMode();

  @Option(helpRequest = true)
  boolean getHelp();

  @Unparsed
  List<String> getFiles();

}
