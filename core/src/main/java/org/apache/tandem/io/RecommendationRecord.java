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
package org.apache.tandem.io;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.util.Pair;
import org.apache.hadoop.io.Text;
import org.apache.hadoop.io.WritableComparable;
import org.apache.hadoop.io.WritableComparator;
import org.apache.hadoop.io.WritableUtils;

/**
 * The recommendations of one item: candidate item keys with their Jaccard
 * scores, highest score first. Records are ordered by item key.
 */
public final class RecommendationRecord implements
    WritableComparable<RecommendationRecord> {

  static {
    WritableComparator.define(RecommendationRecord.class, new Comparator());
  }

  private final Text item;
  private final List<Pair<String, Float>> candidates;

  public RecommendationRecord() {
    this.item = new Text();
    this.candidates = new ArrayList<Pair<String, Float>>();
  }

  public RecommendationRecord(String item) {
    this.item = new Text(item);
    this.candidates = new ArrayList<Pair<String, Float>>();
  }

  public String getItem() {
    return item.toString();
  }

  /**
   * @return the candidates as (candidate item key, score), highest score first
   */
  public List<Pair<String, Float>> getCandidates() {
    return Collections.unmodifiableList(candidates);
  }

  public void addCandidate(String candidate, float score) {
    candidates.add(new Pair<String, Float>(candidate, score));
  }

  public int size() {
    return candidates.size();
  }

  @Override
  public void write(DataOutput out) throws IOException {
    item.write(out);
    WritableUtils.writeVInt(out, candidates.size());
    for (Pair<String, Float> candidate : candidates) {
      Text.writeString(out, candidate.getFirst());
      out.writeFloat(candidate.getSecond());
    }
  }

  @Override
  public void readFields(DataInput in) throws IOException {
    item.readFields(in);
    candidates.clear();
    int size = WritableUtils.readVInt(in);
    for (int i = 0; i < size; i++) {
      String candidate = Text.readString(in);
      candidates.add(new Pair<String, Float>(candidate, in.readFloat()));
    }
  }

  @Override
  public int compareTo(RecommendationRecord o) {
    return item.compareTo(o.item);
  }

  @Override
  public int hashCode() {
    return item.hashCode() * 31 + candidates.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof RecommendationRecord))
      return false;
    RecommendationRecord other = (RecommendationRecord) obj;
    return item.equals(other.item) && candidates.equals(other.candidates);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(item.toString());
    sb.append(" ->");
    for (Pair<String, Float> candidate : candidates) {
      sb.append(' ').append(candidate.getFirst()).append(':')
          .append(candidate.getSecond());
    }
    return sb.toString();
  }

  /**
   * Orders serialized records by their item key only.
   */
  public static final class Comparator extends WritableComparator {

    private static final Text.Comparator TEXT_COMPARATOR = new Text.Comparator();

    public Comparator() {
      super(RecommendationRecord.class);
    }

    @Override
    public int compare(byte[] b1, int s1, int l1, byte[] b2, int s2, int l2) {
      return TEXT_COMPARATOR.compare(b1, s1, TextPair.textLength(b1, s1), b2,
          s2, TextPair.textLength(b2, s2));
    }
  }
}
