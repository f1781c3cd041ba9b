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

import java.io.Closeable;
import java.io.IOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.IOUtils;
import org.apache.hadoop.io.SequenceFile;
import org.apache.hadoop.io.WritableComparable;
import org.apache.hadoop.util.ReflectionUtils;

/**
 * On-disk list of rows, backed by a sequence file with {@code NullWritable}
 * values. Every call to {@link #iterator()} re-reads the file from the start,
 * so a stash can be replayed as often as needed without holding its rows in
 * memory. Each row returned is a fresh instance. <br/>
 * Stashes are created by a {@link StashContext}, which also deletes them.
 */
public final class Stash<T extends WritableComparable<? super T>> implements
    Iterable<T> {

  private final StashContext context;
  private final Class<T> rowClass;
  private final Path path;

  Stash(StashContext context, Class<T> rowClass, Path path) {
    this.context = context;
    this.rowClass = rowClass;
    this.path = path;
  }

  public Class<T> getRowClass() {
    return rowClass;
  }

  public Path getPath() {
    return path;
  }

  /**
   * Counts the rows by scanning the backing file.
   */
  public long length() throws IOException {
    context.checkOpen();
    SequenceFile.Reader reader = context.openReader(path);
    try {
      T row = ReflectionUtils.newInstance(rowClass, context.getConf());
      long count = 0;
      while (reader.next(row)) {
        count++;
      }
      return count;
    } finally {
      IOUtils.closeStream(reader);
    }
  }

  /**
   * @throws RuntimeException wrapping the {@link IOException} if the backing
   *           file can't be read.
   */
  @Override
  public Iterator<T> iterator() {
    context.checkOpen();
    try {
      return new StashIterator();
    } catch (IOException e) {
      throw new RuntimeException("Can't open stash " + path, e);
    }
  }

  @Override
  public String toString() {
    return "Stash[" + rowClass.getSimpleName() + ", " + path.getName() + "]";
  }

  private final class StashIterator implements Iterator<T>, Closeable {

    private SequenceFile.Reader reader;
    private T next;
    private boolean fetched;

    StashIterator() throws IOException {
      reader = context.openReader(path);
      context.register(this);
    }

    @Override
    public boolean hasNext() {
      if (!fetched) {
        fetch();
      }
      return next != null;
    }

    @Override
    public T next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      fetched = false;
      T row = next;
      next = null;
      return row;
    }

    @Override
    public void remove() {
      throw new UnsupportedOperationException("Stashes are read only.");
    }

    private void fetch() {
      fetched = true;
      if (reader == null) {
        return;
      }
      T row = ReflectionUtils.newInstance(rowClass, context.getConf());
      try {
        if (reader.next(row)) {
          next = row;
        } else {
          close();
        }
      } catch (IOException e) {
        close();
        throw new RuntimeException("Can't read from stash " + path, e);
      }
    }

    @Override
    public void close() {
      if (reader != null) {
        IOUtils.closeStream(reader);
        reader = null;
        context.unregister(this);
      }
    }
  }
}
