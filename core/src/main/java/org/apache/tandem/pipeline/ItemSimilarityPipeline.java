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

import static com.google.common.base.Preconditions.checkArgument;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Random;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.io.Text;
import org.apache.tandem.io.IdPair;
import org.apache.tandem.io.RecommendationRecord;
import org.apache.tandem.io.ScoredIdPair;
import org.apache.tandem.io.ScoredLabel;
import org.apache.tandem.io.TextIdPair;
import org.apache.tandem.io.TextPair;
import org.apache.tandem.similarity.ItemUserSets;
import org.apache.tandem.similarity.ScoringStrategy;
import org.apache.tandem.similarity.SimilarityEngine;
import org.apache.tandem.similarity.TopKAccumulator;
import org.apache.tandem.stash.Stash;
import org.apache.tandem.stash.StashContext;
import org.apache.tandem.stash.StashWriter;

/**
 * Computes item-to-item recommendations from (user, item) interactions in one
 * batch:
 * <ol>
 * <li>bot filtering of users with too many interactions</li>
 * <li>compaction of user and item keys to dense ids</li>
 * <li>grouping of the users of every item</li>
 * <li>MinHash rounds feeding one top-k table</li>
 * <li>restoration of the item keys of the table</li>
 * </ol>
 * Every intermediate result is a stash of the given context, the caller closes
 * the context once it is done with the returned records.
 */
public final class ItemSimilarityPipeline {

  public static final String ROUNDS_KEY = "tandem.minhash.rounds";
  public static final String TOP_K_KEY = "tandem.recommendations.per.item";
  public static final String STRATEGY_KEY = "tandem.similarity.strategy";
  public static final String THREADS_KEY = "tandem.similarity.threads";

  public static final int DEFAULT_ROUNDS = 10;
  public static final int DEFAULT_TOP_K = 5;

  private static final Log LOG = LogFactory.getLog(ItemSimilarityPipeline.class);

  private final StashContext context;
  private final Random random;
  private final int rounds;
  private final int topK;
  private final int threads;
  private final ScoringStrategy strategy;
  private final BotFilter botFilter;
  private final KeyCompactor compactor;

  /**
   * @param conf the run's configuration, validated before anything is stashed.
   * @param context owner of all stashes of the run.
   * @param random entropy source of the MinHash seeds and tiebreaks.
   * @throws IllegalArgumentException if the configuration is invalid.
   */
  public ItemSimilarityPipeline(Configuration conf, StashContext context,
      Random random) {
    validate(conf);
    this.context = context;
    this.random = random;
    this.rounds = conf.getInt(ROUNDS_KEY, DEFAULT_ROUNDS);
    this.topK = conf.getInt(TOP_K_KEY, DEFAULT_TOP_K);
    this.threads = conf.getInt(THREADS_KEY, 1);
    this.strategy = ScoringStrategy.fromName(conf.get(STRATEGY_KEY,
        ScoringStrategy.ADJACENT.name()));
    this.botFilter = new BotFilter(context, conf);
    this.compactor = new KeyCompactor(context, conf);
  }

  /**
   * Checks the options of a run.
   *
   * @throws IllegalArgumentException naming the first invalid option.
   */
  public static void validate(Configuration conf) {
    int rounds = conf.getInt(ROUNDS_KEY, DEFAULT_ROUNDS);
    checkArgument(rounds > 0, ROUNDS_KEY + " must be positive, but was "
        + rounds);
    int topK = conf.getInt(TOP_K_KEY, DEFAULT_TOP_K);
    checkArgument(topK > 0, TOP_K_KEY + " must be positive, but was " + topK);
    int maxInteractions = conf.getInt(BotFilter.MAX_INTERACTIONS_KEY,
        BotFilter.DEFAULT_MAX_INTERACTIONS);
    checkArgument(maxInteractions > 0, BotFilter.MAX_INTERACTIONS_KEY
        + " must be positive, but was " + maxInteractions);
    int threads = conf.getInt(THREADS_KEY, 1);
    checkArgument(threads > 0, THREADS_KEY + " must be positive, but was "
        + threads);
    ScoringStrategy.fromName(conf.get(STRATEGY_KEY,
        ScoringStrategy.ADJACENT.name()));
  }

  public BotFilter getBotFilter() {
    return botFilter;
  }

  /**
   * Stashes the raw interactions and runs the pipeline on them.
   */
  public Stash<RecommendationRecord> run(Iterable<TextPair> rawEdges)
      throws IOException {
    long start = System.currentTimeMillis();
    Stash<TextPair> raw = context.create(TextPair.class, rawEdges);
    logStage("ingest", start);
    return run(raw);
  }

  /**
   * @param rawEdges (user, item) interactions, in any order and possibly
   *          repeated.
   * @return one record per item with at least one candidate, ordered by item
   *         key.
   */
  public Stash<RecommendationRecord> run(Stash<TextPair> rawEdges)
      throws IOException {
    long runStart = System.currentTimeMillis();

    long start = System.currentTimeMillis();
    Stash<TextPair> edges = botFilter.filter(rawEdges);
    logStage("bot filter", start);

    start = System.currentTimeMillis();
    StashWriter<Text> userKeys = context.newWriter(Text.class);
    StashWriter<Text> itemKeys = context.newWriter(Text.class);
    for (TextPair edge : edges) {
      itemKeys.append(edge.getFirst());
      userKeys.append(edge.getSecond());
    }
    Stash<Text> users = compactor.labels(userKeys.close());
    Stash<Text> items = compactor.labels(itemKeys.close());
    Stash<IdPair> compacted = compact(edges, users, items);
    int numItems = (int) items.length();
    LOG.info(users.length() + " users, " + numItems + " items, "
        + compacted.length() + " unique edges");
    logStage("compaction", start);

    start = System.currentTimeMillis();
    ItemUserSets sets = ItemUserSets.group(compacted, numItems);
    TopKAccumulator accumulator = new TopKAccumulator(numItems, topK);
    SimilarityEngine engine = new SimilarityEngine(sets, strategy);
    try {
      long collected = engine.run(rounds, threads, random, accumulator);
      LOG.info(collected + " pairs with a positive score");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw (IOException) new InterruptedIOException(
          "Interrupted while running MinHash rounds").initCause(e);
    }
    logStage("similarity", start);

    start = System.currentTimeMillis();
    Stash<RecommendationRecord> records = restore(accumulator, items);
    logStage("restoration", start);

    LOG.info("Computed recommendations in "
        + (System.currentTimeMillis() - runStart) + "ms");
    return records;
  }

  /**
   * Replaces user keys and then item keys by their ids.
   *
   * @param edges (item, user) edges grouped by user in ascending order.
   * @return (item id, user id) edges sorted by item and user.
   */
  private Stash<IdPair> compact(Stash<TextPair> edges, Stash<Text> users,
      Stash<Text> items) throws IOException {
    final StashWriter<TextIdPair> userCompacted = context
        .newWriter(TextIdPair.class);
    compactor.compact(edges, users, new KeyCompactor.Relabeling<TextPair>() {
      @Override
      public Text key(TextPair edge) {
        return edge.getSecond();
      }

      @Override
      public void relabel(TextPair edge, int user) throws IOException {
        userCompacted.append(new TextIdPair(edge.getFirst(), user));
      }
    });
    Stash<TextIdPair> byItem = context.sortDedup(userCompacted.close());

    // items are walked in key order, so the ids come out sorted
    final StashWriter<IdPair> compacted = context.newWriter(IdPair.class);
    compactor.compact(byItem, items, new KeyCompactor.Relabeling<TextIdPair>() {
      @Override
      public Text key(TextIdPair edge) {
        return edge.getKey();
      }

      @Override
      public void relabel(TextIdPair edge, int item) throws IOException {
        compacted.append(new IdPair(item, edge.getId()));
      }
    });
    return compacted.close();
  }

  /**
   * Turns the top-k table back into item keys, first the candidates and then
   * the items, and groups the candidates of each item into a record.
   */
  private Stash<RecommendationRecord> restore(TopKAccumulator accumulator,
      Stash<Text> items) throws IOException {
    final StashWriter<ScoredIdPair> drained = context
        .newWriter(ScoredIdPair.class);
    accumulator.drain(new TopKAccumulator.Visitor() {
      @Override
      public void visit(int item, int candidate, float score)
          throws IOException {
        drained.append(new ScoredIdPair(candidate, item, score));
      }
    });
    Stash<ScoredIdPair> byCandidate = context.sortDedup(drained.close());

    final StashWriter<ScoredLabel> labelled = context
        .newWriter(ScoredLabel.class);
    compactor.restore(byCandidate, items,
        new KeyCompactor.Restoring<ScoredIdPair>() {
          @Override
          public int id(ScoredIdPair row) {
            return row.getId();
          }

          @Override
          public void restore(ScoredIdPair row, Text candidate)
              throws IOException {
            labelled.append(new ScoredLabel(row.getOther(), row.getScore(),
                candidate));
          }
        });
    Stash<ScoredLabel> byItem = context.sortDedup(labelled.close());

    StashWriter<RecommendationRecord> records = context
        .newWriter(RecommendationRecord.class);
    RecordGrouping grouping = new RecordGrouping(records);
    compactor.restore(byItem, items, grouping);
    grouping.finish();
    return records.close();
  }

  /**
   * Collects the restored, item-sorted candidates into one record per item.
   */
  private static final class RecordGrouping extends
      KeyCompactor.Restoring<ScoredLabel> {

    private final StashWriter<RecommendationRecord> records;
    private RecommendationRecord current;

    RecordGrouping(StashWriter<RecommendationRecord> records) {
      this.records = records;
    }

    @Override
    public int id(ScoredLabel row) {
      return row.getId();
    }

    @Override
    public void restore(ScoredLabel row, Text item) throws IOException {
      if (current == null || !current.getItem().equals(item.toString())) {
        finish();
        current = new RecommendationRecord(item.toString());
      }
      current.addCandidate(row.getLabel().toString(), row.getScore());
    }

    void finish() throws IOException {
      if (current != null) {
        records.append(current);
        current = null;
      }
    }
  }

  private static void logStage(String stage, long start) {
    LOG.info("Finished " + stage + " in "
        + (System.currentTimeMillis() - start) + "ms");
  }
}
