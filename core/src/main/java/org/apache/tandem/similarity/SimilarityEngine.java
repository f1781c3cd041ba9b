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
package org.apache.tandem.similarity;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.util.IndexedSortable;
import org.apache.hadoop.util.QuickSort;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Finds pairs of items with high Jaccard similarity by repeated MinHash
 * rounds. A round hashes every item to the MinHash digest of its users under a
 * fresh seed, sorts all items by digest (random tiebreak), and scores the items
 * that end up close to each other with their exact Jaccard similarity. Every
 * scored pair is offered in both directions. <br/>
 * Similar items collide more often, so over several rounds true neighbours get
 * repeated independent chances to be scored. Based on Das, Abhinandan S., et
 * al. "Google news personalization: scalable online collaborative filtering."
 * WWW 2007.
 */
public final class SimilarityEngine {

  private static final Log LOG = LogFactory.getLog(SimilarityEngine.class);

  private final ItemUserSets sets;
  private final ScoringStrategy strategy;

  public SimilarityEngine(ItemUserSets sets, ScoringStrategy strategy) {
    this.sets = sets;
    this.strategy = strategy;
  }

  public ScoringStrategy getStrategy() {
    return strategy;
  }

  /**
   * Statistics of one round.
   */
  public static final class RoundStats {
    private final int buckets;
    private final int largestBucket;
    private final long pairsScored;
    private final long pairsCollected;

    RoundStats(int buckets, int largestBucket, long pairsScored,
        long pairsCollected) {
      this.buckets = buckets;
      this.largestBucket = largestBucket;
      this.pairsScored = pairsScored;
      this.pairsCollected = pairsCollected;
    }

    /** @return the number of distinct digests */
    public int getBuckets() {
      return buckets;
    }

    public int getLargestBucket() {
      return largestBucket;
    }

    public long getPairsScored() {
      return pairsScored;
    }

    /** @return the number of scored pairs with a positive score */
    public long getPairsCollected() {
      return pairsCollected;
    }

    @Override
    public String toString() {
      return buckets + " buckets (largest " + largestBucket + "), "
          + pairsScored + " pairs scored, " + pairsCollected + " collected";
    }
  }

  /**
   * Runs a single round. The seed and the tiebreaks are drawn from the given
   * random.
   */
  public RoundStats round(Random random, ScoreCollector collector) {
    final int n = sets.size();
    if (n == 0) {
      // Hadoop's QuickSort rejects empty ranges
      return new RoundStats(0, 0, 0, 0);
    }
    final long seed = random.nextLong();
    final long[] digests = new long[n];
    final float[] tiebreaks = new float[n];
    final int[] items = new int[n];
    for (int i = 0; i < n; i++) {
      items[i] = i;
      digests[i] = MinHash.digest(seed, sets.users(i));
      // otherwise items with equal digests would stay in id order and always
      // meet the same neighbours
      tiebreaks[i] = random.nextFloat();
    }

    sortByDigest(digests, tiebreaks, items);

    int buckets = 0;
    int largestBucket = 0;
    long scored = 0;
    long collected = 0;
    int start = 0;
    while (start < n) {
      int end = start + 1;
      while (end < n && digests[end] == digests[start]) {
        end++;
      }
      buckets++;
      largestBucket = Math.max(largestBucket, end - start);
      if (strategy == ScoringStrategy.BUCKET) {
        for (int i = start; i < end; i++) {
          for (int j = i + 1; j < end; j++) {
            scored++;
            if (score(items[i], items[j], collector)) {
              collected++;
            }
          }
        }
      }
      start = end;
    }
    if (strategy == ScoringStrategy.ADJACENT) {
      for (int i = 0; i + 1 < n; i++) {
        scored++;
        if (score(items[i], items[i + 1], collector)) {
          collected++;
        }
      }
    }
    return new RoundStats(buckets, largestBucket, scored, collected);
  }

  private static void sortByDigest(final long[] digests,
      final float[] tiebreaks, final int[] items) {
    new QuickSort().sort(new IndexedSortable() {
      @Override
      public int compare(int i, int j) {
        int cmp = Long.compareUnsigned(digests[i], digests[j]);
        if (cmp != 0) {
          return cmp;
        }
        return Float.compare(tiebreaks[i], tiebreaks[j]);
      }

      @Override
      public void swap(int i, int j) {
        long digest = digests[i];
        digests[i] = digests[j];
        digests[j] = digest;
        float tiebreak = tiebreaks[i];
        tiebreaks[i] = tiebreaks[j];
        tiebreaks[j] = tiebreak;
        int item = items[i];
        items[i] = items[j];
        items[j] = item;
      }
    }, 0, items.length);
  }

  private boolean score(int a, int b, ScoreCollector collector) {
    float score = JaccardSimilarity.similarity(sets.users(a), sets.users(b));
    if (score <= 0f) {
      return false;
    }
    collector.collect(a, b, score);
    collector.collect(b, a, score);
    return true;
  }

  /**
   * Runs the given number of rounds into one accumulator. Each round draws
   * from its own random, seeded from the given one, so the scored pairs of a
   * run only depend on that random, whatever the number of threads.
   *
   * @param threads rounds computed concurrently; with more than one thread
   *          the inserts into the accumulator are serialized.
   * @return the total number of pairs with a positive score
   */
  public long run(int rounds, int threads, Random random,
      final TopKAccumulator accumulator) throws InterruptedException {
    checkArgument(rounds > 0, "rounds must be positive, but was " + rounds);
    checkArgument(threads > 0, "threads must be positive, but was " + threads);
    LOG.info("Running " + rounds + " MinHash rounds over " + sets.size()
        + " items with " + sets.edges() + " edges, strategy " + strategy
        + (strategy == ScoringStrategy.ADJACENT ? " (linear, lower recall)"
            : " (all pairs per bucket, higher recall)") + ", " + threads
        + " thread(s)");
    long[] seeds = new long[rounds];
    for (int i = 0; i < rounds; i++) {
      seeds[i] = random.nextLong();
    }

    long collected = 0;
    if (threads == 1) {
      for (int i = 0; i < rounds; i++) {
        collected += logRound(i, round(new Random(seeds[i]), accumulator));
      }
      return collected;
    }

    final ScoreCollector synchronizedCollector = new ScoreCollector() {
      @Override
      public void collect(int item, int candidate, float score) {
        synchronized (accumulator) {
          accumulator.insert(item, candidate, score);
        }
      }
    };
    ExecutorService pool = Executors.newFixedThreadPool(threads,
        new ThreadFactoryBuilder().setNameFormat("minhash-round-%d")
            .setDaemon(true).build());
    try {
      List<Future<RoundStats>> futures = new ArrayList<Future<RoundStats>>();
      for (int i = 0; i < rounds; i++) {
        final long seed = seeds[i];
        futures.add(pool.submit(new Callable<RoundStats>() {
          @Override
          public RoundStats call() throws Exception {
            return round(new Random(seed), synchronizedCollector);
          }
        }));
      }
      for (int i = 0; i < rounds; i++) {
        try {
          collected += logRound(i, futures.get(i).get());
        } catch (ExecutionException e) {
          throw new RuntimeException("MinHash round " + i + " failed",
              e.getCause());
        }
      }
    } finally {
      pool.shutdownNow();
    }
    return collected;
  }

  private static long logRound(int round, RoundStats stats) {
    if (LOG.isDebugEnabled()) {
      LOG.debug("Round " + round + ": " + stats);
    }
    return stats.getPairsCollected();
  }
}
