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

import java.util.Map.Entry;
import java.util.Random;

import org.apache.hadoop.conf.Configuration;

/**
 * Adds Tandem configuration files to a Configuration. Resources are loaded in
 * order, so a key set in tandem-site.xml overrides the one of
 * tandem-default.xml.
 */
public class TandemConfiguration extends Configuration {

  public static final String DEFAULT_RESOURCE = "tandem-default.xml";
  public static final String SITE_RESOURCE = "tandem-site.xml";

  /** Seed of the run's entropy source; unset means nondeterministic. */
  public static final String RANDOM_SEED_KEY = "tandem.random.seed";

  public TandemConfiguration() {
    super();
    addResource(DEFAULT_RESOURCE);
    addResource(SITE_RESOURCE);
  }

  /**
   * Creates a configuration with the Tandem resources, overridden by every
   * key of the given one.
   * 
   * @param c Configuration to clone.
   */
  public TandemConfiguration(final Configuration c) {
    this();
    for (Entry<String, String> e : c) {
      set(e.getKey(), e.getValue());
    }
  }

  /**
   * Creates the entropy source for per-round seeds and tiebreaks. A configured
   * {@link #RANDOM_SEED_KEY} makes runs reproducible.
   *
   * @throws IllegalArgumentException if the seed is not a number.
   */
  public static Random newRandom(Configuration conf) {
    String seed = conf.getTrimmed(RANDOM_SEED_KEY);
    if (seed == null || seed.isEmpty()) {
      return new Random();
    }
    try {
      return new Random(Long.parseLong(seed));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(RANDOM_SEED_KEY
          + " must be a number, but was " + seed, e);
    }
  }
}
