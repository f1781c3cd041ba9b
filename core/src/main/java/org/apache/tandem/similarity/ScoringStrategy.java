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
 * How the pairs of a MinHash round are chosen once the items are sorted by
 * digest.
 */
public enum ScoringStrategy {

  /**
   * Score every item with its successor in the sorted order. Linear in the
   * number of items, but of a large bucket only neighbours are compared, which
   * costs recall.
   */
  ADJACENT,

  /**
   * Score every pair of items sharing a digest. Finds every colliding pair, but
   * is quadratic in the size of the largest bucket, which popular items can
   * make very large.
   */
  BUCKET;

  public static ScoringStrategy fromName(String name) {
    for (ScoringStrategy strategy : values()) {
      if (strategy.name().equalsIgnoreCase(name.trim())) {
        return strategy;
      }
    }
    throw new IllegalArgumentException("Unknown scoring strategy \"" + name
        + "\", use \"adjacent\" or \"bucket\"");
  }
}
