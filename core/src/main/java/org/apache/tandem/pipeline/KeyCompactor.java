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
package org.apache.tandem.pipeline;

import java.io.Closeable;
import java.io.IOException;
import java.util.Iterator;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.io.IOUtils;
import org.apache.hadoop.io.Text;
import org.apache.tandem.stash.Stash;
import org.apache.tandem.stash.StashContext;

/**
 * Replaces string keys by dense integer ids and back. The id of a key is its
 * position in the sorted, de-duplicated list of all keys of its universe (the
 * labels), so ids of n distinct keys are exactly [0, n). <br/>
 * Both directions walk the rows and the labels in lock-step, which requires
 * the rows to be sorted like the labels. With {@value #CHECKED_KEY} enabled a
 * violation fails with an {@link IllegalStateException}; without it, unsorted
 * rows get wrong ids.
 */
public final class KeyCompactor {

  public static final String CHECKED_KEY = "tandem.compaction.checked";

  private static final Log LOG = LogFactory.getLog(KeyCompactor.class);

  /**
   * Receives each row of a compaction walk with the id of its key.
   */
  public static abstract class Relabeling<R> {

    /**
     * @return the key of the row, the rows must arrive in ascending key order.
     */
    public abstract Text key(R row);

    public abstract void relabel(R row, int id) throws IOException;
  }

  /**
   * Receives each row of a restoration walk with the key of its id.
   */
  public static abstract class Restoring<R> {

    /**
     * @return the id of the row, the rows must arrive in ascending id order.
     */
    public abstract int id(R row);

    public abstract void restore(R row, Text label) throws IOException;
  }

  private final StashContext context;
  private final boolean checked;

  public KeyCompactor(StashContext context, Configuration conf) {
    this(context, conf.getBoolean(CHECKED_KEY, true));
  }

  public KeyCompactor(StashContext context, boolean checked) {
    this.context = context;
    this.checked = checked;
    if (!checked) {
      LOG.warn("Key compaction runs unchecked, unsorted rows will get wrong ids");
    }
  }

  public boolean isChecked() {
    return checked;
  }

  /**
   * Builds the ordered reference list of a key universe.
   *
   * @param keys all keys of the universe, in any order and with duplicates.
   */
  public Stash<Text> labels(Stash<Text> keys) throws IOException {
    return context.sortDedup(keys);
  }

  /**
   * Walks the key-sorted rows and the labels in lock-step and hands each row
   * to the relabeling together with the ordinal of its key.
   *
   * @return the number of rows walked
   */
  public <R> long compact(Iterable<R> rows, Stash<Text> labels,
      Relabeling<R> relabeling) throws IOException {
    Iterator<Text> it = labels.iterator();
    Text label = null;
    int index = -1;
    Text previous = null;
    long count = 0;
    try {
      for (R row : rows) {
        Text key = relabeling.key(row);
        if (checked && previous != null && previous.compareTo(key) > 0) {
          throw new IllegalStateException("Rows are not sorted by key: " + key
              + " after " + previous);
        }
        while (label == null || !label.equals(key)) {
          if (!it.hasNext()) {
            throw new IllegalStateException("Key " + key
                + " is not in the labels or the rows are not sorted");
          }
          label = it.next();
          index++;
          if (checked && label.compareTo(key) > 0) {
            throw new IllegalStateException("Key " + key
                + " is not in the labels");
          }
        }
        relabeling.relabel(row, index);
        previous = key;
        count++;
      }
    } finally {
      closeQuietly(it);
    }
    return count;
  }

  /**
   * Walks the id-sorted rows and the labels in lock-step and hands each row to
   * the restoring together with the key of its id.
   *
   * @return the number of rows walked
   */
  public <R> long restore(Iterable<R> rows, Stash<Text> labels,
      Restoring<R> restoring) throws IOException {
    Iterator<Text> it = labels.iterator();
    Text label = null;
    int index = -1;
    long count = 0;
    try {
      for (R row : rows) {
        int id = restoring.id(row);
        if (checked && id < index) {
          throw new IllegalStateException("Rows are not sorted by id: " + id
              + " after " + index);
        }
        if (checked && id < 0) {
          throw new IllegalStateException("Negative id " + id);
        }
        while (index != id) {
          if (!it.hasNext()) {
            throw new IllegalStateException("Id " + id
                + " is out of the labels or the rows are not sorted");
          }
          label = it.next();
          index++;
        }
        restoring.restore(row, label);
        count++;
      }
    } finally {
      closeQuietly(it);
    }
    return count;
  }

  private static void closeQuietly(Iterator<Text> it) {
    if (it instanceof Closeable) {
      IOUtils.closeStream((Closeable) it);
    }
  }
}
