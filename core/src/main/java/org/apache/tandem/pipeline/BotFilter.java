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
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.io.Text;
import org.apache.tandem.io.TextPair;
import org.apache.tandem.stash.Stash;
import org.apache.tandem.stash.StashContext;
import org.apache.tandem.stash.StashWriter;

/**
 * Drops the interactions of users who touched more distinct items than
 * {@value #MAX_INTERACTIONS_KEY} allows, such users are most likely crawlers.
 * At most that many items are buffered per user.
 */
public final class BotFilter {

  public static final String MAX_INTERACTIONS_KEY = "tandem.max.interactions.per.user";
  public static final int DEFAULT_MAX_INTERACTIONS = 1000;

  private static final Log LOG = LogFactory.getLog(BotFilter.class);

  private final StashContext context;
  private final int maxInteractions;

  private long usersKept;
  private long usersFiltered;
  private long edgesDropped;

  public BotFilter(StashContext context, Configuration conf) {
    this(context, conf.getInt(MAX_INTERACTIONS_KEY, DEFAULT_MAX_INTERACTIONS));
  }

  public BotFilter(StashContext context, int maxInteractions) {
    checkArgument(maxInteractions > 0, MAX_INTERACTIONS_KEY
        + " must be positive, but was " + maxInteractions);
    this.context = context;
    this.maxInteractions = maxInteractions;
  }

  /**
   * @param rawEdges (user, item) interactions, in any order and possibly
   *          repeated.
   * @return the distinct (item, user) edges of the retained users, grouped by
   *         user in ascending user order.
   */
  public Stash<TextPair> filter(Stash<TextPair> rawEdges) throws IOException {
    Stash<TextPair> sorted = context.sortDedup(rawEdges);
    StashWriter<TextPair> out = context.newWriter(TextPair.class);

    Text user = null;
    List<Text> items = new ArrayList<Text>();
    int count = 0;
    for (TextPair edge : sorted) {
      if (user != null && !user.equals(edge.getFirst())) {
        flush(user, items, count, out);
        items.clear();
        count = 0;
      }
      user = edge.getFirst();
      count++;
      // no need to remember the items of a user that is already over the cap
      if (count <= maxInteractions) {
        items.add(edge.getSecond());
      }
    }
    if (user != null) {
      flush(user, items, count, out);
    }

    LOG.info("Kept " + usersKept + " users, filtered " + usersFiltered
        + " users with " + edgesDropped + " edges above " + maxInteractions
        + " interactions");
    return out.close();
  }

  private void flush(Text user, List<Text> items, int count,
      StashWriter<TextPair> out) throws IOException {
    if (count > maxInteractions) {
      usersFiltered++;
      edgesDropped += count;
      if (LOG.isDebugEnabled()) {
        LOG.debug("Filtered user " + user + " with " + count + " items");
      }
      return;
    }
    usersKept++;
    for (Text item : items) {
      out.append(new TextPair(item, user));
    }
  }

  public int getMaxInteractions() {
    return maxInteractions;
  }

  public long getUsersKept() {
    return usersKept;
  }

  public long getUsersFiltered() {
    return usersFiltered;
  }

  public long getEdgesDropped() {
    return edgesDropped;
  }
}
