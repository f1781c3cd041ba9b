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

/**
 * One-permutation MinHash over user ids. For a fixed seed the digests of two
 * user sets are equal with a probability of their Jaccard similarity. See
 * http://en.wikipedia.org/wiki/MinHash
 */
public final class MinHash {

  private static final long GOLDEN_GAMMA = 0x9e3779b97f4a7c15L;

  private MinHash() {
  }

  /**
   * Hashes a user id under a seed, each seed acts as an independent random
   * permutation of the id space.
   */
  public static long hash(long seed, int user) {
    long h = seed + (user & 0xffffffffL) * GOLDEN_GAMMA;
    return fmix64(h ^ Long.rotateLeft(seed, 31));
  }

  /**
   * @return the minimum hash of the users, compared unsigned. The maximum
   *         unsigned value for an empty set.
   */
  public static long digest(long seed, int[] users) {
    long min = -1L;
    for (int user : users) {
      long h = hash(seed, user);
      if (Long.compareUnsigned(h, min) < 0) {
        min = h;
      }
    }
    return min;
  }

  // finalizer of MurmurHash3, avalanches all bits
  static long fmix64(long h) {
    h ^= (h >>> 33);
    h *= 0xff51afd7ed558ccdL;
    h ^= (h >>> 33);
    h *= 0xc4ceb9fe1a85ec53L;
    h ^= (h >>> 33);
    return h;
  }
}
