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

package net.benchscore.common;

import java.io.File;
import java.io.IOException;
import java.io.Writer;

import com.google.common.io.Files;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.BeforeClass;

import net.benchscore.common.io.IOUtils;
import net.benchscore.common.log.MemoryHandler;

public abstract class BenchScoreTest extends Assert {

  private static final double DOUBLE_EPSILON = 1.0e-12;

  private File testTempDir;

  @SuppressWarnings("deprecation")
  public static void assertEquals(double expected, double actual) {
    Assert.assertEquals(expected, actual, DOUBLE_EPSILON);
  }

  @SuppressWarnings("deprecation")
  public static void assertEquals(String message, double expected, double actual) {
    Assert.assertEquals(message, expected, actual, DOUBLE_EPSILON);
  }

  public static void assertArrayEquals(double[] expecteds, double[] actuals) {
    Assert.assertArrayEquals(expecteds, actuals, DOUBLE_EPSILON);
  }

  @BeforeClass
  public static void setUpClass() {
    MemoryHandler.setSensibleLogFormat();
  }

  @Before
  public void setUp() throws Exception {
    testTempDir = null;
  }

  @After
  public void tearDown() throws Exception {
    IOUtils.deleteRecursively(testTempDir);
  }

  protected static void assertNaN(double d) {
    assertTrue("Expected NaN but got " + d, Double.isNaN(d));
  }

  protected final synchronized File getTestTempDir() {
    if (testTempDir == null) {
      testTempDir = Files.createTempDir();
      testTempDir.deleteOnExit();
    }
    return testTempDir;
  }

  /**
   * Writes lines of text to a file under {@link #getTestTempDir()}, creating directories as needed.
   *
   * @param relativePath path of the file relative to the temp dir
   * @param lines content, one line each
   * @return the file written
   */
  protected final File writeTestFile(String relativePath, String... lines) throws IOException {
    File file = new File(getTestTempDir(), relativePath);
    Writer out = IOUtils.buildWriter(file, false);
    try {
      for (String line : lines) {
        out.write(line);
        out.write('\n');
      }
    } finally {
      out.close();
    }
    return file;
  }

}
