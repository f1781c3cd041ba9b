/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.tandem.examples.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.IOUtils;
import org.apache.tandem.io.TextPair;
import org.apache.tandem.stash.StashWriter;

import com.google.common.base.Charsets;

/**
 * Tab separated interaction files, one <code>user&lt;TAB&gt;item</code> pair
 * per line.
 */
public final class InteractionFormat {

  private static final Log LOG = LogFactory.getLog(InteractionFormat.class);

  private static final char SEPARATOR = '\t';

  private long lines;
  private long malformed;

  /**
   * @return the interaction of the line, or null if it does not hold exactly
   *         two non-empty fields.
   */
  public static TextPair parse(String line) {
    int tab = line.indexOf(SEPARATOR);
    if (tab < 0 || line.indexOf(SEPARATOR, tab + 1) >= 0) {
      return null;
    }
    String user = line.substring(0, tab).trim();
    String item = line.substring(tab + 1).trim();
    if (user.isEmpty() || item.isEmpty()) {
      return null;
    }
    return new TextPair(user, item);
  }

  public static String format(String user, String item) {
    return user + SEPARATOR + item;
  }

  /**
   * Lists the files to read: a directory stands for its visible files. Each
   * path is resolved against its own file system.
   */
  public static List<Path> listInputs(Configuration conf, Path[] paths)
      throws IOException {
    List<Path> files = new ArrayList<Path>();
    for (Path path : paths) {
      FileSystem fs = path.getFileSystem(conf);
      FileStatus status = fs.getFileStatus(fs.makeQualified(path));
      if (!status.isDirectory()) {
        files.add(status.getPath());
        continue;
      }
      for (FileStatus child : fs.listStatus(path)) {
        String name = child.getPath().getName();
        if (child.isFile() && !name.startsWith("_") && !name.startsWith(".")) {
          files.add(child.getPath());
        }
      }
    }
    return files;
  }

  /**
   * Appends the interactions of a file to the writer, skipping malformed
   * lines.
   *
   * @return the number of interactions appended
   */
  public long read(FileSystem fs, Path file, StashWriter<TextPair> out)
      throws IOException {
    long appended = 0;
    BufferedReader reader = new BufferedReader(new InputStreamReader(
        fs.open(file), Charsets.UTF_8));
    try {
      String line;
      while ((line = reader.readLine()) != null) {
        lines++;
        TextPair edge = parse(line);
        if (edge == null) {
          malformed++;
          if (LOG.isDebugEnabled()) {
            LOG.debug("Skipping malformed line " + lines + ": " + line);
          }
          continue;
        }
        out.append(edge);
        appended++;
      }
    } finally {
      IOUtils.closeStream(reader);
    }
    LOG.info("Read " + appended + " interactions from " + file);
    return appended;
  }

  public long getLines() {
    return lines;
  }

  public long getMalformed() {
    return malformed;
  }
}
