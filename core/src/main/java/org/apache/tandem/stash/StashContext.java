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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.FileUtil;
import org.apache.hadoop.fs.LocalFileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.DataOutputBuffer;
import org.apache.hadoop.io.IOUtils;
import org.apache.hadoop.io.NullWritable;
import org.apache.hadoop.io.RawComparator;
import org.apache.hadoop.io.SequenceFile;
import org.apache.hadoop.io.SequenceFile.CompressionType;
import org.apache.hadoop.io.WritableComparable;
import org.apache.hadoop.io.WritableComparator;

/**
 * Owns the stashes of one run. Stashes live in a private temporary directory
 * below the configured work directory, which is deleted when the context is
 * closed, whether the run succeeded or not. Only {@link #persist(Stash, String)}
 * moves data out of it. <br/>
 * Structure is as follows: <br/>
 * ${tandem.work.dir}/_tmp_&lt;uuid&gt;/stash_&lt;n&gt;.seq <br/>
 * A context is not thread safe.
 */
public final class StashContext implements Closeable {

  public static final String WORK_DIR_KEY = "tandem.work.dir";
  public static final String SORT_MB_KEY = "tandem.stash.sort.mb";
  public static final String SORT_FACTOR_KEY = "tandem.stash.sort.factor";
  public static final String PROGRESS_INTERVAL_KEY = "tandem.progress.interval";

  public static final int DEFAULT_SORT_MB = 100;
  public static final int DEFAULT_SORT_FACTOR = 100;
  public static final long DEFAULT_PROGRESS_INTERVAL = 100000L;

  private static final Log LOG = LogFactory.getLog(StashContext.class);

  private final Configuration conf;
  private final LocalFileSystem fs;
  private final Path workDir;
  private final Path tmpDir;
  private final int sortMemory;
  private final int sortFactor;
  private final long progressInterval;

  private final List<Stash<?>> stashes = new ArrayList<Stash<?>>();
  // readers and writers that haven't been closed by their owners yet
  private final Set<Closeable> openStreams = new LinkedHashSet<Closeable>();
  private int sequence = 0;
  private boolean closed = false;

  public StashContext(Configuration conf) throws IOException {
    this.conf = conf;
    int sortMb = conf.getInt(SORT_MB_KEY, DEFAULT_SORT_MB);
    checkArgument(sortMb > 0 && sortMb < 2048, SORT_MB_KEY
        + " must be between 1 and 2047, but was " + sortMb);
    this.sortMemory = sortMb * 1024 * 1024;
    this.sortFactor = conf.getInt(SORT_FACTOR_KEY, DEFAULT_SORT_FACTOR);
    checkArgument(sortFactor > 1, SORT_FACTOR_KEY
        + " must be at least 2, but was " + sortFactor);
    this.progressInterval = conf.getLong(PROGRESS_INTERVAL_KEY,
        DEFAULT_PROGRESS_INTERVAL);

    this.fs = FileSystem.getLocal(conf);
    String configuredWorkDir = conf.get(WORK_DIR_KEY);
    if (configuredWorkDir == null) {
      configuredWorkDir = System.getProperty("java.io.tmpdir") + "/tandem";
    }
    this.workDir = fs.makeQualified(new Path(configuredWorkDir));
    this.tmpDir = new Path(workDir, "_tmp_" + UUID.randomUUID());
    if (!fs.mkdirs(tmpDir)) {
      throw new IOException("Can't create stash directory " + tmpDir);
    }
    LOG.debug("Stashing into " + tmpDir);
  }

  public Configuration getConf() {
    return conf;
  }

  public Path getWorkDir() {
    return workDir;
  }

  public Path getTmpDir() {
    return tmpDir;
  }

  /**
   * @return the number of stashes created by this context so far
   */
  public int getStashCount() {
    return stashes.size();
  }

  /**
   * Opens a writer on a fresh, empty stash.
   */
  public <T extends WritableComparable<? super T>> StashWriter<T> newWriter(
      Class<T> rowClass) throws IOException {
    Stash<T> stash = newStash(rowClass);
    SequenceFile.Writer writer = createWriter(stash.getPath(), rowClass);
    register(writer);
    return new StashWriter<T>(this, stash, writer, progressInterval);
  }

  /**
   * Creates an empty stash.
   */
  public <T extends WritableComparable<? super T>> Stash<T> create(
      Class<T> rowClass) throws IOException {
    return newWriter(rowClass).close();
  }

  /**
   * Writes the given rows into a new stash.
   */
  public <T extends WritableComparable<? super T>> Stash<T> create(
      Class<T> rowClass, Iterable<? extends T> rows) throws IOException {
    StashWriter<T> writer = newWriter(rowClass);
    for (T row : rows) {
      writer.append(row);
    }
    return writer.close();
  }

  /**
   * Sorts the given stash ascending and removes duplicated rows.
   */
  public <T extends WritableComparable<? super T>> Stash<T> sortDedup(
      Stash<T> in) throws IOException {
    return sortDedup(in, false);
  }

  /**
   * Stashes the rows, then sorts them ascending and removes duplicates.
   */
  public <T extends WritableComparable<? super T>> Stash<T> sortDedup(
      Class<T> rowClass, Iterable<? extends T> rows) throws IOException {
    return sortDedup(create(rowClass, rows), false);
  }

  /**
   * Sorts the given stash with an external merge sort and removes rows whose
   * serialized form equals the one of their predecessor. The order is the one
   * of the row class' registered raw comparator, which must agree with its
   * {@link Comparable} order.
   *
   * @param in the stash to sort, left untouched.
   * @param reverse true to sort descending.
   * @return a new sorted stash without duplicates.
   */
  @SuppressWarnings({ "unchecked", "rawtypes" })
  public <T extends WritableComparable<? super T>> Stash<T> sortDedup(
      Stash<T> in, boolean reverse) throws IOException {
    checkOpen();
    Class<T> rowClass = in.getRowClass();
    RawComparator comparator = WritableComparator.get(rowClass, conf);
    if (reverse) {
      comparator = new ReverseComparator(comparator);
    }
    SequenceFile.Sorter sorter = new SequenceFile.Sorter(fs, comparator,
        rowClass, NullWritable.class, conf);
    sorter.setMemory(sortMemory);
    sorter.setFactor(sortFactor);

    Path sorted = new Path(tmpDir, "sort_" + (sequence++) + ".seq");
    long start = System.currentTimeMillis();
    sorter.sort(new Path[] { in.getPath() }, sorted, false);

    Stash<T> out = newStash(rowClass);
    SequenceFile.Writer writer = createWriter(out.getPath(), rowClass);
    register(writer);
    long rows = 0;
    long duplicates = 0;
    try {
      // the sorter doesn't write anything for empty input
      if (fs.exists(sorted)) {
        SequenceFile.Reader reader = openReader(sorted);
        try {
          DataOutputBuffer previous = new DataOutputBuffer();
          DataOutputBuffer current = new DataOutputBuffer();
          SequenceFile.ValueBytes value = reader.createValueBytes();
          boolean first = true;
          while (reader.nextRaw(current, value) != -1) {
            if (first || !sameBytes(previous, current)) {
              writer.appendRaw(current.getData(), 0, current.getLength(), value);
              DataOutputBuffer tmp = previous;
              previous = current;
              current = tmp;
              first = false;
              rows++;
            } else {
              duplicates++;
            }
            current.reset();
          }
        } finally {
          IOUtils.closeStream(reader);
        }
        fs.delete(sorted, false);
      }
    } finally {
      unregister(writer);
      writer.close();
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Sorted " + in + " into " + out + ": " + rows + " rows, "
          + duplicates + " duplicates removed in "
          + (System.currentTimeMillis() - start) + "ms");
    }
    return out;
  }

  /**
   * Copies the stash out of the temporary area, to ${tandem.work.dir}/name.
   * The copy survives {@link #close()}.
   *
   * @return the path of the copy
   */
  public Path persist(Stash<?> stash, String name) throws IOException {
    checkOpen();
    checkArgument(name != null && !name.isEmpty() && !name.equals(".")
        && !name.equals("..") && name.indexOf(Path.SEPARATOR_CHAR) < 0
        && name.indexOf('\\') < 0 && name.indexOf(':') < 0,
        "Persisted stash name must be a plain file name, but was " + name);
    Path target = new Path(workDir, name);
    if (!FileUtil.copy(fs, stash.getPath(), fs, target, false, true, conf)) {
      throw new IOException("Can't persist " + stash + " to " + target);
    }
    LOG.info("Persisted " + stash + " to " + target);
    return target;
  }

  /**
   * Closes pending readers and writers and deletes every stash of this
   * context. Calling it more than once has no effect.
   */
  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    for (Closeable stream : new ArrayList<Closeable>(openStreams)) {
      IOUtils.closeStream(stream);
    }
    openStreams.clear();
    if (!fs.delete(tmpDir, true) && fs.exists(tmpDir)) {
      throw new IOException("Can't delete stash directory " + tmpDir);
    }
    LOG.debug("Deleted " + stashes.size() + " stashes in " + tmpDir);
  }

  public boolean isClosed() {
    return closed;
  }

  void checkOpen() {
    checkState(!closed, "Stash context " + tmpDir + " is closed.");
  }

  SequenceFile.Reader openReader(Path path) throws IOException {
    return new SequenceFile.Reader(conf, SequenceFile.Reader.file(path));
  }

  void register(Closeable stream) {
    openStreams.add(stream);
  }

  void unregister(Closeable stream) {
    openStreams.remove(stream);
  }

  private <T extends WritableComparable<? super T>> Stash<T> newStash(
      Class<T> rowClass) {
    checkOpen();
    Path path = new Path(tmpDir, "stash_" + (sequence++) + ".seq");
    Stash<T> stash = new Stash<T>(this, rowClass, path);
    stashes.add(stash);
    return stash;
  }

  private SequenceFile.Writer createWriter(Path path, Class<?> rowClass)
      throws IOException {
    return SequenceFile.createWriter(conf, SequenceFile.Writer.file(path),
        SequenceFile.Writer.keyClass(rowClass),
        SequenceFile.Writer.valueClass(NullWritable.class),
        SequenceFile.Writer.compression(CompressionType.NONE));
  }

  private static boolean sameBytes(DataOutputBuffer a, DataOutputBuffer b) {
    return a.getLength() == b.getLength()
        && WritableComparator.compareBytes(a.getData(), 0, a.getLength(),
            b.getData(), 0, b.getLength()) == 0;
  }

  /**
   * Inverts the order of a raw comparator.
   */
  private static final class ReverseComparator<T> implements RawComparator<T> {

    private final RawComparator<T> comparator;

    ReverseComparator(RawComparator<T> comparator) {
      this.comparator = comparator;
    }

    @Override
    public int compare(T o1, T o2) {
      return comparator.compare(o2, o1);
    }

    @Override
    public int compare(byte[] b1, int s1, int l1, byte[] b2, int s2, int l2) {
      return comparator.compare(b2, s2, l2, b1, s1, l1);
    }
  }
}
