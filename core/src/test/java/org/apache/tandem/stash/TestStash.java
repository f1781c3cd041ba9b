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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Random;
import java.util.Set;

import junit.framework.TestCase;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.Text;
import org.apache.tandem.TandemConfiguration;
import org.apache.tandem.io.IdPair;
import org.apache.tandem.io.TextPair;
import org.junit.Test;

public class TestStash extends TestCase {

  public static final String TMP_OUTPUT_PATH = System.getProperty(
      "test.build.data", "/tmp") + "/tandem-stash";

  private Configuration conf;
  private StashContext context;

  @Override
  protected void setUp() throws Exception {
    conf = new TandemConfiguration();
    conf.set(StashContext.WORK_DIR_KEY, TMP_OUTPUT_PATH);
    context = new StashContext(conf);
  }

  @Override
  protected void tearDown() throws Exception {
    context.close();
  }

  private static List<Text> texts(String... values) {
    List<Text> list = new ArrayList<Text>();
    for (String value : values) {
      list.add(new Text(value));
    }
    return list;
  }

  private static <T> List<T> toList(Iterable<T> rows) {
    List<T> list = new ArrayList<T>();
    for (T row : rows) {
      list.add(row);
    }
    return list;
  }

  @Test
  public void testIterationReplaysAllRows() throws Exception {
    Stash<Text> stash = context.create(Text.class, texts("b", "a", "c", "a"));
    assertEquals(texts("b", "a", "c", "a"), toList(stash));
    assertEquals(texts("b", "a", "c", "a"), toList(stash));
    assertEquals(4, stash.length());
    assertEquals(4, stash.length());
  }

  @Test
  public void testPartialIterationDoesNotAffectNextOne() throws Exception {
    Stash<Text> stash = context.create(Text.class, texts("x", "y", "z"));
    Iterator<Text> it = stash.iterator();
    assertEquals(new Text("x"), it.next());
    assertEquals(texts("x", "y", "z"), toList(stash));
    assertEquals(new Text("y"), it.next());
  }

  @Test
  public void testRowsAreFreshInstances() throws Exception {
    Stash<Text> stash = context.create(Text.class, texts("x", "y"));
    List<Text> rows = toList(stash);
    assertNotSame(rows.get(0), rows.get(1));
    assertEquals("x", rows.get(0).toString());
  }

  @Test
  public void testEmptyStash() throws Exception {
    Stash<Text> stash = context.create(Text.class);
    assertEquals(0, stash.length());
    assertFalse(stash.iterator().hasNext());
    Stash<Text> sorted = context.sortDedup(stash);
    assertEquals(0, sorted.length());
  }

  @Test
  public void testSortDedup() throws Exception {
    Stash<Text> stash = context.create(Text.class,
        texts("pear", "apple", "fig", "apple", "pear", "banana"));
    Stash<Text> sorted = context.sortDedup(stash);
    assertEquals(texts("apple", "banana", "fig", "pear"), toList(sorted));
    // the input is left untouched
    assertEquals(6, stash.length());
  }

  @Test
  public void testSortDedupReverse() throws Exception {
    Stash<Text> sorted = context.sortDedup(
        context.create(Text.class, texts("b", "c", "a", "c")), true);
    assertEquals(texts("c", "b", "a"), toList(sorted));
  }

  @Test
  public void testSortDedupIsIdempotent() throws Exception {
    Random r = new Random(42L);
    List<TextPair> rows = new ArrayList<TextPair>();
    for (int i = 0; i < 500; i++) {
      rows.add(new TextPair("u" + r.nextInt(20), "i" + r.nextInt(20)));
    }
    Stash<TextPair> once = context.sortDedup(TextPair.class, rows);
    Stash<TextPair> twice = context.sortDedup(once);
    List<TextPair> onceRows = toList(once);
    assertEquals(onceRows, toList(twice));

    Set<TextPair> distinct = new HashSet<TextPair>(rows);
    assertEquals(distinct.size(), onceRows.size());
    assertEquals(distinct, new HashSet<TextPair>(onceRows));
    for (int i = 1; i < onceRows.size(); i++) {
      assertTrue(onceRows.get(i - 1).compareTo(onceRows.get(i)) < 0);
    }
  }

  @Test
  public void testSortDedupSpillsToSeveralSegments() throws Exception {
    context.close();
    conf.setInt(StashContext.SORT_MB_KEY, 1);
    conf.setInt(StashContext.SORT_FACTOR_KEY, 2);
    context = new StashContext(conf);

    int n = 60000;
    List<IdPair> rows = new ArrayList<IdPair>();
    Random r = new Random(7L);
    for (int i = 0; i < n; i++) {
      int item = r.nextInt(n);
      rows.add(new IdPair(item, 1));
      rows.add(new IdPair(item, 0));
    }
    Stash<IdPair> sorted = context.sortDedup(IdPair.class, rows);
    IdPair previous = null;
    long count = 0;
    for (IdPair row : sorted) {
      if (previous != null) {
        assertTrue(previous + " !< " + row, previous.compareTo(row) < 0);
      }
      previous = row;
      count++;
    }
    assertEquals(new HashSet<IdPair>(rows).size(), count);
  }

  @Test
  public void testPersistSurvivesClose() throws Exception {
    Stash<Text> stash = context.create(Text.class, texts("a", "b"));
    Path persisted = context.persist(stash, "persisted_" + System.nanoTime()
        + ".seq");
    Path tmpDir = context.getTmpDir();
    FileSystem fs = FileSystem.getLocal(conf);
    assertTrue(fs.exists(tmpDir));
    context.close();

    assertFalse(fs.exists(tmpDir));
    assertTrue(fs.exists(persisted));
    assertTrue(fs.getFileStatus(persisted).getLen() > 0);
    fs.delete(persisted, false);
  }

  @Test
  public void testPersistRejectsNamesOutsideTheWorkDir() throws Exception {
    Stash<Text> stash = context.create(Text.class, texts("a"));
    String[] names = { "../escaped.seq", "/tmp/absolute.seq", "sub/dir.seq",
        "", "..", "file:other.seq" };
    for (String name : names) {
      try {
        context.persist(stash, name);
        fail("Name \"" + name + "\" should be rejected");
      } catch (IllegalArgumentException e) {
        // expected
      }
    }
    FileSystem fs = FileSystem.getLocal(conf);
    assertFalse(fs.exists(new Path(context.getWorkDir().getParent(),
        "escaped.seq")));
  }

  @Test
  public void testClosedContextRejectsAccess() throws Exception {
    Stash<Text> stash = context.create(Text.class, texts("a"));
    context.close();
    context.close();
    assertTrue(context.isClosed());
    try {
      stash.iterator();
      fail("Iterating a stash of a closed context should fail");
    } catch (IllegalStateException e) {
      // expected
    }
    try {
      context.create(Text.class, texts("b"));
      fail("Creating a stash in a closed context should fail");
    } catch (IllegalStateException e) {
      // expected
    }
  }

  @Test
  public void testContextTracksStashes() throws Exception {
    assertEquals(0, context.getStashCount());
    Stash<Text> stash = context.create(Text.class, texts("a", "b"));
    context.sortDedup(stash);
    assertEquals(2, context.getStashCount());
  }

  @Test
  public void testWriterAppendAfterClose() throws IOException {
    StashWriter<Text> writer = context.newWriter(Text.class);
    writer.append(new Text("a"));
    Stash<Text> stash = writer.close();
    assertEquals(1, writer.getCount());
    assertEquals(Arrays.asList(new Text("a")), toList(stash));
    try {
      writer.append(new Text("b"));
      fail("Appending to a closed writer should fail");
    } catch (IllegalStateException e) {
      // expected
    }
  }
}
