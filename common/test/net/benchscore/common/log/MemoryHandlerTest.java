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

import java.util.logging.Level;
import java.util.logging.Logger;

import org.junit.Test;
import org.slf4j.LoggerFactory;

import net.benchscore.common.BenchScoreTest;

public final class MemoryHandlerTest extends BenchScoreTest {

  @Test
  public void testKeepsRecentLines() {
    Logger julLogger = Logger.getLogger(MemoryHandlerTest.class.getName());
    MemoryHandler handler = new MemoryHandler(2);
    julLogger.addHandler(handler);
    try {
      julLogger.log(Level.WARNING, "first");
      julLogger.log(Level.WARNING, "second");
      julLogger.log(Level.WARNING, "third");
      assertEquals(2, handler.getLogLines().size());
      assertFalse(handler.contains("first"));
      assertTrue(handler.contains("third"));
    } finally {
      julLogger.removeHandler(handler);
    }
    handler.close();
    assertTrue(handler.getLogLines().isEmpty());
  }

  @Test
  public void testCapturesSlf4j() {
    Logger julLogger = Logger.getLogger(MemoryHandlerTest.class.getName());
    MemoryHandler handler = new MemoryHandler();
    julLogger.addHandler(handler);
    try {
      LoggerFactory.getLogger(MemoryHandlerTest.class).warn("Truth column contains {} values", "unseen");
      assertTrue(handler.contains("Truth column contains unseen values"));
    } finally {
      julLogger.removeHandler(handler);
    }
  }

}
