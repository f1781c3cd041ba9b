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

import java.util.Arrays;

import org.apache.tandem.io.IdPair;

/**
 * The users of every item as sorted arrays of unique user ids, indexed by item
 * id. Built once and shared read-only by all MinHash rounds.
 */
public final class ItemUserSets {

  private static final int[] EMPTY = new int[0];

  private final int[][] users;
  private final long edges;

  ItemUserSets(int[][] users) {
    this.users = users;
    long count = 0;
    for (int[] set : users) {
      count += set.length;
    }
    this.edges = count;
  }

  /**
   * Groups compacted edges by item.
   *
   * @param edges (item id, user id) edges sorted by item and user, without
   *          duplicates.
   * @param numItems the number of distinct items, all item ids must be below.
   */
  public static ItemUserSets group(Iterable<IdPair> edges, int numItems) {
    int[][] users = new int[numItems][];
    int item = -1;
    int[] buffer = new int[16];
    int size = 0;
    for (IdPair edge : edges) {
      int next = edge.getFirst();
      checkArgument(next >= item && next < numItems, "Edge " + edge
          + " is out of order or out of range");
      if (next != item) {
        if (item >= 0) {
          users[item] = Arrays.copyOf(buffer, size);
        }
        item = next;
        size = 0;
      } else {
        checkArgument(edge.getSecond() > buffer[size - 1], "Edge " + edge
            + " is out of order or duplicated");
      }
      if (size == buffer.length) {
        buffer = Arrays.copyOf(buffer, size * 2);
      }
      buffer[size++] = edge.getSecond();
    }
    if (item >= 0) {
      users[item] = Arrays.copyOf(buffer, size);
    }
    for (int i = 0; i < numItems; i++) {
      if (users[i] == null) {
        users[i] = EMPTY;
      }
    }
    return new ItemUserSets(users);
  }

  /**
   * Wraps already grouped user sets, each must be sorted and unique.
   */
  public static ItemUserSets of(int[]... users) {
    return new ItemUserSets(users);
  }

  public int size() {
    return users.length;
  }

  public long edges() {
    return edges;
  }

  /**
   * @return the sorted user ids of the item, not to be modified.
   */
  public int[] users(int item) {
    return users[item];
  }
}
