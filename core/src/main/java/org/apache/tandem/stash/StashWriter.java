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
package org.apache.tandem.stash;

import java.io.IOException;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.io.NullWritable;
import org.apache.hadoop.io.SequenceFile;
import org.apache.hadoop.io.WritableComparable;

/**
 * Appends rows to a new stash. The stash becomes readable once the writer is
 * closed.
 */
public final class StashWriter<T extends WritableComparable<? super T>> {

  private static final Log LOG = LogFactory.getLog(StashWriter.class);

  private final StashContext context;
  private final Stash<T> stash;
  private final long progressInterval;
  private SequenceFile.Writer writer;
  private long count;

  StashWriter(StashContext context, Stash<T> stash, SequenceFile.Writer writer,
      long progressInterval) {
    this.context = context;
    this.stash = stash;
    this.writer = writer;
    this.progressInterval = progressInterval;
  }

  public void append(T row) throws IOException {
    if (writer == null) {
      throw new IllegalStateException("Writer of " + stash + " is closed.");
    }
    writer.append(row, NullWritable.get());
    count++;
    if (progressInterval > 0 && count % progressInterval == 0) {
      LOG.info(stash + ": " + count + " rows written");
    }
  }

  public long getCount() {
    return count;
  }

  /**
   * Flushes and closes the backing file.
   *
   * @return the written stash
   */
  public Stash<T> close() throws IOException {
    if (writer != null) {
      SequenceFile.Writer w = writer;
      writer = null;
      context.unregister(w);
      w.close();
    }
    return stash;
  }
}
