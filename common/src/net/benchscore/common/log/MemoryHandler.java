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

package net.benchscore.common.log;

import java.util.List;
import java.util.Queue;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.SimpleFormatter;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Simple {@link Handler} that records recent log lines in memory, for example to report what went wrong
 * while scoring a batch of prediction files, or to check in a test that a warning was issued.
 */
public final class MemoryHandler extends Handler {

  private static final int DEFAULT_NUM_LINES = 1000;
  private static final String LOG_FORMAT_PROP = "java.util.logging.SimpleFormatter.format";

  private final int maxLines;
  private final Queue<String> logLines;

  public MemoryHandler() {
    this(DEFAULT_NUM_LINES);
  }

  /**
   * @param maxLines number of most recent lines to keep
   */
  public MemoryHandler(int maxLines) {
    this.maxLines = maxLines;
    logLines = Lists.newLinkedList();
    setFormatter(new SimpleFormatter());
    setLevel(Level.FINE);
  }

  /**
   * @return copy of recent log lines, oldest first
   */
  public List<String> getLogLines() {
    synchronized (logLines) {
      return ImmutableList.copyOf(logLines);
    }
  }

  /**
   * @return true iff some recorded line contains the given text
   */
  public boolean contains(String text) {
    for (String line : getLogLines()) {
      if (line.contains(text)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public void publish(LogRecord logRecord) {
    if (!isLoggable(logRecord)) {
      return;
    }
    String line = getFormatter().format(logRecord);
    synchronized (logLines) {
      logLines.add(line);
      while (logLines.size() > maxLines) {
        logLines.remove();
      }
    }
  }

  @Override
  public void flush() {
  }

  @Override
  public void close() {
    synchronized (logLines) {
      logLines.clear();
    }
  }

  /**
   * <p>Sets the {@code java.util.logging} default output format to something more sensible than the 2-line default.
   * This can be overridden further on the command line. The format is like:</p>
   *
   * <p><pre>
   * Mon Nov 26 23:16:09 GMT 2012 INFO Scores saved to results/scores/results.csv
   * </pre></p>
   */
  public static void setSensibleLogFormat() {
    if (System.getProperty(LOG_FORMAT_PROP) == null) {
      System.setProperty(LOG_FORMAT_PROP, "%1$tc %4$s %5$s%6$s%n");
    }
  }

}
