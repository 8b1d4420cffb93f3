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

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.text.SimpleDateFormat;
import java.util.ArrayDeque;
import java.util.Date;
import java.util.Deque;
import java.util.Locale;
import java.util.TimeZone;
import java.util.zip.GZIPInputStream;
import java.util.zip.InflaterInputStream;
import java.util.zip.ZipInputStream;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.io.Files;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simple utility methods related to I/O.
 */
public final class IOUtils {

  private static final Logger log = LoggerFactory.getLogger(IOUtils.class);

  /** Name of the directory, next to a backed-up file, that holds its backups. */
  public static final String BACKUP_DIR = "backup";

  private IOUtils() {
  }

  /**
   * Attempts to recursively delete a directory. This may not work across symlinks.
   *
   * @param dir directory to delete along with contents
   * @return {@code true} if all files and dirs were deleted successfully
   */
  public static boolean deleteRecursively(File dir) {
    if (dir == null) {
      return false;
    }
    Deque<File> stack = new ArrayDeque<File>();
    stack.push(dir);
    boolean result = true;
    while (!stack.isEmpty()) {
      File topElement = stack.peek();
      if (topElement.isDirectory()) {
        File[] directoryContents = topElement.listFiles();
        if (directoryContents != null && directoryContents.length > 0) {
          for (File fileOrSubDirectory : directoryContents) {
            stack.push(fileOrSubDirectory);
          }
        } else {
          result = result && stack.pop().delete();
        }
      } else {
        result = result && stack.pop().delete();
      }
    }
    return result;
  }

  /**
   * Opens an {@link InputStream} to the file. If it appears to be compressed, because its file name ends in
   * ".gz", ".zip", ".deflate" or ".bz2", then it will be decompressed accordingly
   *
   * @param file file, possibly compressed, to open
   * @return {@link InputStream} on uncompressed contents
   * @throws IOException if the stream can't be opened or is invalid or can't be read
   */
  public static InputStream openMaybeDecompressing(File file) throws IOException {
    String name = file.getName();
    InputStream in = new FileInputStream(file);
    if (name.endsWith(".gz")) {
      return new GZIPInputStream(in);
    }
    if (name.endsWith(".zip")) {
      ZipInputStream zipIn = new ZipInputStream(in);
      if (zipIn.getNextEntry() == null) {
        zipIn.close();
        throw new IOException("No entry in " + file);
      }
      return zipIn;
    }
    if (name.endsWith(".deflate")) {
      return new InflaterInputStream(in);
    }
    if (name.endsWith(".bz2") || name.endsWith(".bzip2")) {
      return new BZip2CompressorInputStream(in);
    }
    return in;
  }

  /**
   * @param file file, possibly compressed, to open
   * @return {@link BufferedReader} on uncompressed contents, decoded as UTF-8
   * @throws IOException if the stream can't be opened or is invalid or can't be read
   * @see #openMaybeDecompressing(File)
   */
  public static BufferedReader openReaderMaybeDecompressing(File file) throws IOException {
    return new BufferedReader(new InputStreamReader(openMaybeDecompressing(file), Charsets.UTF_8));
  }

  /**
   * @param file file to write, creating parent directories if needed
   * @param append if true, append to the file instead of truncating it
   * @return {@link Writer} on the file, encoding as UTF-8
   */
  public static Writer buildWriter(File file, boolean append) throws IOException {
    File parent = file.getAbsoluteFile().getParentFile();
    if (parent != null && !parent.isDirectory() && !parent.mkdirs()) {
      throw new IOException("Could not create " + parent);
    }
    return new OutputStreamWriter(new FileOutputStream(file, append), Charsets.UTF_8);
  }

  /**
   * Wraps its argument in {@link BufferedReader} if not already one.
   */
  public static BufferedReader buffer(Reader maybeBuffered) {
    return maybeBuffered instanceof BufferedReader
        ? (BufferedReader) maybeBuffered
        : new BufferedReader(maybeBuffered);
  }

  /**
   * Copies a file into the {@link #BACKUP_DIR} directory next to it, before it is overwritten. The copy is
   * named after the file's last modification time, in UTC, like {@code results.20240131T235959.csv}. If such
   * a copy already exists, a counter is added to the name.
   *
   * @param file file to back up
   * @return the backup copy, or {@code null} if the file does not exist
   * @throws IOException if the copy can't be made
   */
  public static File backupFile(File file) throws IOException {
    Preconditions.checkNotNull(file);
    if (!file.isFile()) {
      return null;
    }
    File dir = new File(file.getAbsoluteFile().getParentFile(), BACKUP_DIR);
    if (!dir.isDirectory() && !dir.mkdirs()) {
      throw new IOException("Could not create " + dir);
    }
    String name = file.getName();
    int dot = name.lastIndexOf('.');
    String baseName = dot > 0 ? name.substring(0, dot) : name;
    String extension = dot > 0 ? name.substring(dot) : "";

    SimpleDateFormat format = new SimpleDateFormat("yyyyMMdd'T'HHmmss", Locale.ROOT);
    format.setTimeZone(TimeZone.getTimeZone("UTC"));
    String stamp = format.format(new Date(file.lastModified()));

    File backup = new File(dir, baseName + '.' + stamp + extension);
    for (int i = 1; backup.exists(); i++) {
      backup = new File(dir, baseName + '.' + stamp + '_' + i + extension);
    }
    Files.copy(file, backup);
    log.info("Backed up {} to {}", file, backup);
    return backup;
  }

}
