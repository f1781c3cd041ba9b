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
package org.apache.tandem;

import junit.framework.TestCase;

import org.apache.hadoop.conf.Configuration;
import org.apache.tandem.pipeline.ItemSimilarityPipeline;
import org.junit.Test;

public class TestTandemConfiguration extends TestCase {

  @Test
  public void testDefaultsAreLoaded() {
    Configuration conf = new TandemConfiguration();
    assertEquals(10, conf.getInt(ItemSimilarityPipeline.ROUNDS_KEY, -1));
    assertEquals(5, conf.getInt(ItemSimilarityPipeline.TOP_K_KEY, -1));
    assertEquals("adjacent", conf.get(ItemSimilarityPipeline.STRATEGY_KEY));
  }

  @Test
  public void testCopyKeepsOverrides() {
    Configuration base = new Configuration(false);
    base.setInt(ItemSimilarityPipeline.TOP_K_KEY, 7);
    Configuration conf = new TandemConfiguration(base);
    assertEquals(7, conf.getInt(ItemSimilarityPipeline.TOP_K_KEY, -1));
    assertEquals(10, conf.getInt(ItemSimilarityPipeline.ROUNDS_KEY, -1));
  }

  @Test
  public void testSeededRandomIsReproducible() {
    Configuration conf = new TandemConfiguration();
    conf.setLong(TandemConfiguration.RANDOM_SEED_KEY, 42L);
    assertEquals(TandemConfiguration.newRandom(conf).nextLong(),
        TandemConfiguration.newRandom(conf).nextLong());
  }

  @Test
  public void testInvalidSeedIsRejected() {
    Configuration conf = new TandemConfiguration();
    assertNotNull(TandemConfiguration.newRandom(conf));
    conf.set(TandemConfiguration.RANDOM_SEED_KEY, "forty-two");
    try {
      TandemConfiguration.newRandom(conf);
      fail("A non numeric seed should be rejected");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }
}
