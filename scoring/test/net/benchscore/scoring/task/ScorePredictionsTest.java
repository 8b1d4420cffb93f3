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
import java.util.Arrays;

import org.junit.Test;

import net.benchscore.common.BenchScoreTest;
import net.benchscore.common.table.Table;
import net.benchscore.scoring.ScoringConfiguration;
import net.benchscore.scoring.board.Scoreboard;

public final class ScorePredictionsTest extends BenchScoreTest {

  @Test
  public void testScoreFiles() throws Exception {
    File regression = writeTestFile("runs/ridge_housing_1.csv", "predictions,truth", "1,1", "2,2", "4,3");
    File badName = writeTestFile("runs/housing.csv", "predictions,truth", "1,1");
    File scoresDir = new File(getTestTempDir(), "scores");
    ScoringConfiguration config = new ScoringConfiguration();

    Scoreboard scoreboard = ScorePredictions.score(Arrays.asList(regression, badName), scoresDir, config);
    assertEquals(new File(scoresDir, Scoreboard.RESULTS_FILE), scoreboard.getPath());
    Table scores = scoreboard.asTable();
    assertEquals(1, scores.getNumRows());
    assertEquals("ridge", scores.get(0, "framework"));
    assertEquals("housing", scores.get(0, "task"));
    assertEquals("1", scores.get(0, "fold"));
    assertEquals("regression", scores.get(0, "type"));

    scoreboard.save(true);
    assertEquals(1, Scoreboard.all(scoresDir, config).getScores().getNumRows());
  }

  @Test
  public void testUnreadableMetadataSkipsFile() throws Exception {
    File regression = writeTestFile("runs/ridge_housing_1.csv", "predictions,truth", "1,1", "2,2", "4,3");
    File unreadable = writeTestFile("broken/lasso_housing_1.csv", "predictions,truth", "1,1", "2,2");
    writeTestFile("broken/metadata.json", "{\"framework\": ");
    File scoresDir = new File(getTestTempDir(), "scores");

    Scoreboard scoreboard =
        ScorePredictions.score(Arrays.asList(unreadable, regression), scoresDir, new ScoringConfiguration());
    Table scores = scoreboard.asTable();
    assertEquals(1, scores.getNumRows());
    assertEquals("ridge", scores.get(0, "framework"));
  }

}
