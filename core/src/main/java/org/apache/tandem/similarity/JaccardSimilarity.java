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
 * Jaccard similarity of sets given as sorted arrays of unique ints, computed by
 * a single merge of both arrays. See http://en.wikipedia.org/wiki/Jaccard_index
 */
public final class JaccardSimilarity {

  private JaccardSimilarity() {
  }

  /**
   * @return |a & b| / |a | b|, or 0 if both sets are empty
   */
  public static float similarity(int[] a, int[] b) {
    int intersection = 0;
    int difference = 0;
    int i = 0;
    int j = 0;
    while (i < a.length && j < b.length) {
      if (a[i] < b[j]) {
        difference++;
        i++;
      } else if (a[i] > b[j]) {
        difference++;
        j++;
      } else {
        intersection++;
        i++;
        j++;
      }
    }
    difference += (a.length - i) + (b.length - j);
    if (intersection == 0) {
      return 0f;
    }
    return (float) intersection / (float) (intersection + difference);
  }
}
