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

package net.benchscore.common.io;

import java.io.File;

import com.google.common.base.Charsets;
import com.google.common.io.Files;
import org.junit.Test;

import net.benchscore.common.BenchScoreTest;

public final class IOUtilsTest extends BenchScoreTest {

  @Test
  public void testBackupMissingFile() throws Exception {
    assertNull(IOUtils.backupFile(new File(getTestTempDir(), "absent.csv")));
  }

  @Test
  public void testBackup() throws Exception {
    File file = writeTestFile("scores/results.csv", "a,b", "1,2");
    File backup = IOUtils.backupFile(file);
    assertNotNull(backup);
    assertEquals(new File(file.getParentFile(), IOUtils.BACKUP_DIR), backup.getParentFile());
    assertTrue(backup.getName().matches("results\\.\\d{8}T\\d{6}\\.csv"));
    assertEquals(Files.asCharSource(file, Charsets.UTF_8).read(),
                 Files.asCharSource(backup, Charsets.UTF_8).read());

    File second = IOUtils.backupFile(file);
    assertFalse(second.equals(backup));
    assertTrue(second.getName().matches("results\\.\\d{8}T\\d{6}_1\\.csv"));
  }

  @Test
  public void testDeleteRecursively() throws Exception {
    writeTestFile("a/b/c.txt", "x");
    File dir = new File(getTestTempDir(), "a");
    assertTrue(IOUtils.deleteRecursively(dir));
    assertFalse(dir.exists());
    assertFalse(IOUtils.deleteRecursively(null));
  }

}
