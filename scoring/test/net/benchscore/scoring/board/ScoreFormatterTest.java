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

import java.util.Arrays;

import org.junit.Test;

import net.benchscore.common.BenchScoreTest;

public final class ScoreFormatterTest extends BenchScoreTest {

  @Test
  public void testIntegers() {
    assertEquals("3", ScoreFormatter.formatInteger("3.0"));
    assertEquals("42", ScoreFormatter.formatInteger("42"));
    assertEquals("", ScoreFormatter.formatInteger(""));
    assertEquals("", ScoreFormatter.formatInteger("NaN"));
    assertEquals("2.5", ScoreFormatter.formatInteger("2.5"));
  }

  @Test
  public void testDurations() {
    assertEquals("0.05", ScoreFormatter.formatDuration("0.0456"));
    assertEquals("0.3", ScoreFormatter.formatDuration("0.3"));
    assertEquals("12.3", ScoreFormatter.formatDuration("12.345"));
    assertEquals("5.0", ScoreFormatter.formatDuration("5"));
    assertEquals("", ScoreFormatter.formatDuration("nan"));
  }

  @Test
  public void testFloats() {
    assertEquals("0.123457", ScoreFormatter.formatFloat("0.12345678"));
    assertEquals("-0.308093", ScoreFormatter.formatFloat("-0.30809306"));
    assertEquals("1234570", ScoreFormatter.formatFloat("1234567.8"));
    assertEquals("1", ScoreFormatter.formatFloat("1"));
    assertEquals("0.0001", ScoreFormatter.formatFloat("1.0E-4"));
    assertEquals("12345700000", ScoreFormatter.formatFloat("1.23456789e10"));
    assertEquals("", ScoreFormatter.formatFloat("NaN"));
    assertEquals("Infinity", ScoreFormatter.formatFloat("inf"));
  }

  @Test
  public void testColumns() {
    assertEquals(Arrays.asList("0.5", "", "1"),
                 ScoreFormatter.formatColumn("result", Arrays.asList("0.5", "nan", "1")));
    // whole numbers without missing values are left alone
    assertEquals(Arrays.asList("1", "2"), ScoreFormatter.formatColumn("custom", Arrays.asList("1", "2")));
    assertEquals(Arrays.asList("a", "0.5"), ScoreFormatter.formatColumn("custom", Arrays.asList("a", "0.5")));
    assertEquals(Arrays.asList("3913", ""), ScoreFormatter.formatColumn("id", Arrays.asList("3913", "None")));
    assertEquals(Arrays.asList("1.10", ""), ScoreFormatter.formatColumn("version", Arrays.asList("1.10", "")));
    assertEquals(Arrays.asList("0.20"), ScoreFormatter.formatColumn("constraint", Arrays.asList("0.20")));
    assertEquals(Arrays.asList("0", ""), ScoreFormatter.formatColumn("fold", Arrays.asList("0.0", "")));
  }

}
