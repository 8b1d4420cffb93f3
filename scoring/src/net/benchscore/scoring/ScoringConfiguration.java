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

package net.benchscore.scoring;

import java.io.File;

import com.google.common.base.Preconditions;

/**
 * <p>Configuration of scoring and of the scoreboard. Defaults are read from system properties when an
 * instance is constructed, and may be changed afterwards with the setters. The properties, set with
 * {@code -Dproperty=value}, are:</p>
 *
 * <ul>
 *   <li>{@code scoring.tokenSeparator}: separator between the tokens of scoreboard and predictions file
 *    names, like the {@code _} in {@code autosklearn_task_adult.csv}. Defaults to {@code _}.</li>
 *   <li>{@code scoring.errorMaxLength}: maximum length of the message recorded for a run whose predictions
 *    could not be loaded. Defaults to 200.</li>
 *   <li>{@code scoring.testMode}: if true, predictions are validated strictly when loaded, and a violation
 *    of their structure fails the scoring. Defaults to false.</li>
 *   <li>{@code scoring.runMode}: recorded in the {@code mode} column of each scoreboard entry. Defaults to
 *    {@code local}.</li>
 *   <li>{@code scoring.appVersion}: recorded in the {@code app_version} column. Defaults to {@code dev}.</li>
 *   <li>{@code scoring.outputDir}: root of the {@code scores} and {@code predictions} directories.
 *    Defaults to {@code results}.</li>
 *   <li>{@code scoring.encodePredictionsAndTruth}: if true, classification predictions and truth are
 *    integer indices into the sorted class labels rather than the labels themselves. Defaults to false.</li>
 *   <li>{@code scoring.multiClassAverage}: {@code weighted} or {@code macro}; how per-class scores of
 *    multiclass AUC and F-beta are averaged. Defaults to {@code weighted}.</li>
 * </ul>
 */
public final class ScoringConfiguration {

  public static final String DEFAULT_TOKEN_SEPARATOR = "_";
  public static final int DEFAULT_ERROR_MAX_LENGTH = 200;
  public static final String DEFAULT_RUN_MODE = "local";
  public static final String DEFAULT_APP_VERSION = "dev";
  public static final String DEFAULT_OUTPUT_DIR = "results";

  private String tokenSeparator;
  private int errorMaxLength;
  private boolean testMode;
  private String runMode;
  private String appVersion;
  private File outputDir;
  private boolean encodePredictionsAndTruth;
  private MultiClassAverage multiClassAverage;

  public ScoringConfiguration() {
    tokenSeparator = System.getProperty("scoring.tokenSeparator", DEFAULT_TOKEN_SEPARATOR);
    errorMaxLength = Integer.parseInt(
        System.getProperty("scoring.errorMaxLength", Integer.toString(DEFAULT_ERROR_MAX_LENGTH)));
    testMode = Boolean.parseBoolean(System.getProperty("scoring.testMode", "false"));
    runMode = System.getProperty("scoring.runMode", DEFAULT_RUN_MODE);
    appVersion = System.getProperty("scoring.appVersion", DEFAULT_APP_VERSION);
    outputDir = new File(System.getProperty("scoring.outputDir", DEFAULT_OUTPUT_DIR));
    encodePredictionsAndTruth = Boolean.parseBoolean(System.getProperty("scoring.encodePredictionsAndTruth", "false"));
    multiClassAverage = MultiClassAverage.fromName(System.getProperty("scoring.multiClassAverage", "weighted"));
    Preconditions.checkArgument(errorMaxLength > 1, "errorMaxLength must be at least 2: %s", errorMaxLength);
  }

  /**
   * @return separator between tokens of scoreboard and predictions file names
   */
  public String getTokenSeparator() {
    return tokenSeparator;
  }

  public void setTokenSeparator(String tokenSeparator) {
    Preconditions.checkArgument(tokenSeparator != null && !tokenSeparator.isEmpty(), "Empty separator");
    this.tokenSeparator = tokenSeparator;
  }

  /**
   * @return maximum length of an error message recorded in a scoreboard entry, including the ellipsis
   */
  public int getErrorMaxLength() {
    return errorMaxLength;
  }

  public void setErrorMaxLength(int errorMaxLength) {
    Preconditions.checkArgument(errorMaxLength > 1, "errorMaxLength must be at least 2: %s", errorMaxLength);
    this.errorMaxLength = errorMaxLength;
  }

  /**
   * @return true if predictions are validated strictly when loaded
   */
  public boolean isTestMode() {
    return testMode;
  }

  public void setTestMode(boolean testMode) {
    this.testMode = testMode;
  }

  public String getRunMode() {
    return runMode;
  }

  public void setRunMode(String runMode) {
    this.runMode = runMode;
  }

  public String getAppVersion() {
    return appVersion;
  }

  public void setAppVersion(String appVersion) {
    this.appVersion = appVersion;
  }

  public File getOutputDir() {
    return outputDir;
  }

  public void setOutputDir(File outputDir) {
    Preconditions.checkNotNull(outputDir);
    this.outputDir = outputDir;
  }

  /**
   * @return default directory holding scoreboards, {@code scores} under {@link #getOutputDir()}
   */
  public File getScoresDir() {
    return new File(outputDir, "scores");
  }

  /**
   * @return default directory holding predictions, {@code predictions} under {@link #getOutputDir()}
   */
  public File getPredictionsDir() {
    return new File(outputDir, "predictions");
  }

  /**
   * @return true if classification predictions and truth are integer indices into the sorted class labels
   */
  public boolean isEncodePredictionsAndTruth() {
    return encodePredictionsAndTruth;
  }

  public void setEncodePredictionsAndTruth(boolean encodePredictionsAndTruth) {
    this.encodePredictionsAndTruth = encodePredictionsAndTruth;
  }

  public MultiClassAverage getMultiClassAverage() {
    return multiClassAverage;
  }

  public void setMultiClassAverage(MultiClassAverage multiClassAverage) {
    Preconditions.checkNotNull(multiClassAverage);
    this.multiClassAverage = multiClassAverage;
  }

}
