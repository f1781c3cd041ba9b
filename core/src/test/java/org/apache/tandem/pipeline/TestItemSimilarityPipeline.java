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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import junit.framework.TestCase;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.commons.math3.util.Pair;
import org.apache.hadoop.conf.Configuration;
import org.apache.tandem.TandemConfiguration;
import org.apache.tandem.io.RecommendationRecord;
import org.apache.tandem.io.TextPair;
import org.apache.tandem.similarity.JaccardSimilarity;
import org.apache.tandem.similarity.ScoringStrategy;
import org.apache.tandem.stash.Stash;
import org.apache.tandem.stash.StashContext;
import org.junit.Test;

public class TestItemSimilarityPipeline extends TestCase {

  private static final Log LOG = LogFactory
      .getLog(TestItemSimilarityPipeline.class);

  public static final String TMP_OUTPUT_PATH = System.getProperty(
      "test.build.data", "/tmp") + "/tandem-pipeline";

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

  private static List<TextPair> edges(String... userItems) {
    List<TextPair> rows = new ArrayList<TextPair>();
    for (int i = 0; i < userItems.length; i += 2) {
      rows.add(new TextPair(userItems[i], userItems[i + 1]));
    }
    return rows;
  }

  private static List<RecommendationRecord> toList(
      Stash<RecommendationRecord> stash) {
    List<RecommendationRecord> list = new ArrayList<RecommendationRecord>();
    for (RecommendationRecord record : stash) {
      list.add(record);
    }
    return list;
  }

  @Test
  public void testTwoItemsRecommendEachOther() throws Exception {
    conf.setInt(ItemSimilarityPipeline.TOP_K_KEY, 2);
    ItemSimilarityPipeline pipeline = new ItemSimilarityPipeline(conf,
        context, new Random(1L));
    List<RecommendationRecord> records = toList(pipeline.run(edges("u1", "a",
        "u1", "b", "u2", "a", "u2", "b", "u3", "a")));

    assertEquals(2, records.size());
    RecommendationRecord a = records.get(0);
    assertEquals("a", a.getItem());
    assertEquals(1, a.size());
    assertEquals("b", a.getCandidates().get(0).getFirst());
    assertEquals(0.667f, a.getCandidates().get(0).getSecond(), 1e-3f);

    RecommendationRecord b = records.get(1);
    assertEquals("b", b.getItem());
    assertEquals(1, b.size());
    assertEquals("a", b.getCandidates().get(0).getFirst());
    assertEquals(0.667f, b.getCandidates().get(0).getSecond(), 1e-3f);
  }

  @Test
  public void testBotsAreFilteredBeforeScoring() throws Exception {
    conf.setInt(BotFilter.MAX_INTERACTIONS_KEY, 1);
    ItemSimilarityPipeline pipeline = new ItemSimilarityPipeline(conf,
        context, new Random(1L));
    List<RecommendationRecord> records = toList(pipeline.run(edges("u1", "a",
        "u1", "b", "u2", "a")));
    assertTrue(records.isEmpty());
    assertEquals(1, pipeline.getBotFilter().getUsersFiltered());
    assertEquals(1, pipeline.getBotFilter().getUsersKept());
  }

  @Test
  public void testEveryUserIsABot() throws Exception {
    conf.setInt(BotFilter.MAX_INTERACTIONS_KEY, 1);
    for (ScoringStrategy strategy : ScoringStrategy.values()) {
      conf.set(ItemSimilarityPipeline.STRATEGY_KEY, strategy.name());
      ItemSimilarityPipeline pipeline = new ItemSimilarityPipeline(conf,
          context, new Random(1L));
      Stash<RecommendationRecord> records = pipeline.run(edges("u1", "a",
          "u1", "b", "u2", "b", "u2", "c"));
      assertEquals(0, records.length());
      assertEquals(2, pipeline.getBotFilter().getUsersFiltered());
      assertEquals(0, pipeline.getBotFilter().getUsersKept());
      assertEquals(4, pipeline.getBotFilter().getEdgesDropped());
    }
  }

  @Test
  public void testEmptyInput() throws Exception {
    ItemSimilarityPipeline pipeline = new ItemSimilarityPipeline(conf,
        context, new Random(1L));
    assertEquals(0, pipeline.run(edges()).length());
  }

  @Test
  public void testItemsWithoutOverlapGetNoRecord() throws Exception {
    ItemSimilarityPipeline pipeline = new ItemSimilarityPipeline(conf,
        context, new Random(3L));
    List<RecommendationRecord> records = toList(pipeline.run(edges("u1", "a",
        "u2", "b", "u3", "c", "u3", "d")));
    assertEquals(2, records.size());
    assertEquals("c", records.get(0).getItem());
    assertEquals("d", records.get(1).getItem());
  }

  private List<TextPair> randomEdges(Random r, int users, int items,
      int perUser) {
    List<TextPair> rows = new ArrayList<TextPair>();
    for (int u = 0; u < users; u++) {
      // a few popular items and a long tail
      for (int i = 0; i < perUser; i++) {
        int item = r.nextBoolean() ? r.nextInt(items / 10) : r.nextInt(items);
        rows.add(new TextPair("user" + u, "item" + item));
      }
    }
    return rows;
  }

  private static String render(List<RecommendationRecord> records) {
    StringBuilder sb = new StringBuilder();
    for (RecommendationRecord record : records) {
      sb.append(record).append('\n');
    }
    return sb.toString();
  }

  @Test
  public void testRunsAreReproducibleWithTheSameSeed() throws Exception {
    List<TextPair> rows = randomEdges(new Random(11L), 300, 200, 6);
    String first = render(toList(new ItemSimilarityPipeline(conf, context,
        new Random(99L)).run(rows)));
    String second = render(toList(new ItemSimilarityPipeline(conf, context,
        new Random(99L)).run(rows)));
    assertEquals(first, second);
  }

  @Test
  public void testRecordsAreConsistent() throws Exception {
    conf.setInt(ItemSimilarityPipeline.TOP_K_KEY, 3);
    conf.set(ItemSimilarityPipeline.STRATEGY_KEY, "bucket");
    conf.setInt(ItemSimilarityPipeline.THREADS_KEY, 3);
    List<TextPair> rows = randomEdges(new Random(5L), 200, 100, 5);
    List<RecommendationRecord> records = toList(new ItemSimilarityPipeline(
        conf, context, new Random(5L)).run(rows));
    assertFalse(records.isEmpty());
    LOG.info(records.size() + " records, first " + records.get(0));

    String previous = null;
    for (RecommendationRecord record : records) {
      String item = record.getItem();
      if (previous != null) {
        assertTrue(previous.compareTo(item) < 0);
      }
      previous = item;
      assertTrue(record.size() >= 1 && record.size() <= 3);

      Set<String> seen = new HashSet<String>();
      float lastScore = Float.MAX_VALUE;
      for (Pair<String, Float> candidate : record.getCandidates()) {
        assertFalse(item.equals(candidate.getFirst()));
        assertTrue(seen.add(candidate.getFirst()));
        float score = candidate.getSecond();
        assertTrue(score > 0f && score <= 1f);
        assertTrue(score <= lastScore);
        lastScore = score;
        assertEquals(jaccard(rows, item, candidate.getFirst()), score, 1e-6f);
      }
    }
  }

  private static float jaccard(List<TextPair> rows, String a, String b) {
    Set<String> ua = new HashSet<String>();
    Set<String> ub = new HashSet<String>();
    for (TextPair row : rows) {
      if (row.getSecond().toString().equals(a)) {
        ua.add(row.getFirst().toString());
      } else if (row.getSecond().toString().equals(b)) {
        ub.add(row.getFirst().toString());
      }
    }
    return JaccardSimilarity.similarity(userIds(ua), userIds(ub));
  }

  private static int[] userIds(Set<String> users) {
    int[] ids = new int[users.size()];
    int i = 0;
    for (String user : users) {
      ids[i++] = Integer.parseInt(user.substring("user".length()));
    }
    Arrays.sort(ids);
    return ids;
  }

  @Test
  public void testInvalidOptionsAreRejected() throws Exception {
    String[][] invalid = { { ItemSimilarityPipeline.TOP_K_KEY, "0" },
        { ItemSimilarityPipeline.ROUNDS_KEY, "0" },
        { ItemSimilarityPipeline.THREADS_KEY, "0" },
        { BotFilter.MAX_INTERACTIONS_KEY, "-1" },
        { ItemSimilarityPipeline.STRATEGY_KEY, "exhaustive" } };
    for (String[] option : invalid) {
      Configuration c = new Configuration(conf);
      c.set(option[0], option[1]);
      try {
        ItemSimilarityPipeline.validate(c);
        fail(option[0] + "=" + option[1] + " should be rejected");
      } catch (IllegalArgumentException e) {
        // expected
      }
    }
    ItemSimilarityPipeline.validate(conf);
  }
}
