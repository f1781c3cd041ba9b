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

import java.io.IOException;
import java.util.Arrays;

/**
 * Keeps the k best scored candidates of every item. The table is stored in two
 * flat arrays of numItems * k slots instead of an object per pair, a slot is
 * empty while it holds score 0 and candidate -1. <br/>
 * The slots of an item are always sorted by descending score and hold each
 * candidate at most once. A candidate is recorded with the first score it was
 * inserted with. <br/>
 * Not thread safe, concurrent rounds have to serialize their inserts.
 */
public final class TopKAccumulator implements ScoreCollector {

  public static final int NO_CANDIDATE = -1;

  /**
   * Receives the non empty slots of the table.
   */
  public interface Visitor {
    void visit(int item, int candidate, float score) throws IOException;
  }

  private final int numItems;
  private final int k;
  private final float[] scores;
  private final int[] candidates;

  public TopKAccumulator(int numItems, int k) {
    checkArgument(numItems >= 0, "Negative number of items: " + numItems);
    checkArgument(k > 0, "k must be positive, but was " + k);
    long slots = (long) numItems * k;
    checkArgument(slots <= Integer.MAX_VALUE - 8, numItems + " items with "
        + k + " candidates each don't fit into one table");
    this.numItems = numItems;
    this.k = k;
    this.scores = new float[(int) slots];
    this.candidates = new int[(int) slots];
    Arrays.fill(candidates, NO_CANDIDATE);
  }

  public int getNumItems() {
    return numItems;
  }

  public int getK() {
    return k;
  }

  /**
   * Offers a candidate to an item in O(k): the incoming pair is swapped into
   * the first slot with a lower score and the displaced pair continues down the
   * slots, the last one falls off.
   */
  public void insert(int item, int candidate, float score) {
    if (item == candidate || score <= 0f) {
      return;
    }
    int start = item * k;
    int end = start + k;
    for (int i = start; i < end; i++) {
      if (candidates[i] == candidate) {
        return;
      }
      if (candidates[i] == NO_CANDIDATE) {
        break;
      }
    }
    for (int i = start; i < end; i++) {
      if (score > scores[i]) {
        float displacedScore = scores[i];
        int displaced = candidates[i];
        scores[i] = score;
        candidates[i] = candidate;
        score = displacedScore;
        candidate = displaced;
        if (candidate == NO_CANDIDATE) {
          break;
        }
      }
    }
  }

  @Override
  public void collect(int item, int candidate, float score) {
    insert(item, candidate, score);
  }

  /**
   * @return the number of filled slots of the item
   */
  public int size(int item) {
    int start = item * k;
    int n = 0;
    while (n < k && candidates[start + n] != NO_CANDIDATE) {
      n++;
    }
    return n;
  }

  /**
   * @return the candidates of the item, best first
   */
  public int[] candidates(int item) {
    return Arrays.copyOfRange(candidates, item * k, item * k + size(item));
  }

  /**
   * @return the scores of the item's candidates, best first
   */
  public float[] scores(int item) {
    return Arrays.copyOfRange(scores, item * k, item * k + size(item));
  }

  /**
   * Visits every filled slot, by ascending item and descending score.
   */
  public void drain(Visitor visitor) throws IOException {
    for (int item = 0; item < numItems; item++) {
      int start = item * k;
      for (int i = start; i < start + k; i++) {
        if (candidates[i] == NO_CANDIDATE || scores[i] <= 0f) {
          break;
        }
        visitor.visit(item, candidates[i], scores[i]);
      }
    }
  }
}
