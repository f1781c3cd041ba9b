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

import org.apache.hadoop.io.WritableComparable;
import org.apache.hadoop.io.WritableComparator;

/**
 * A scored pair of compacted item ids, ordered by id, then other id, then
 * score. The drained top-k table is written as (candidate, item, score) rows so
 * that candidates can be restored first.
 */
public final class ScoredIdPair implements WritableComparable<ScoredIdPair> {

  static {
    WritableComparator.define(ScoredIdPair.class, new Comparator());
  }

  private int id;
  private int other;
  private float score;

  public ScoredIdPair() {
  }

  public ScoredIdPair(int id, int other, float score) {
    this.id = id;
    this.other = other;
    this.score = score;
  }

  public int getId() {
    return id;
  }

  public int getOther() {
    return other;
  }

  public float getScore() {
    return score;
  }

  @Override
  public void write(DataOutput out) throws IOException {
    out.writeInt(id);
    out.writeInt(other);
    out.writeFloat(score);
  }

  @Override
  public void readFields(DataInput in) throws IOException {
    id = in.readInt();
    other = in.readInt();
    score = in.readFloat();
  }

  @Override
  public int compareTo(ScoredIdPair o) {
    int cmp = Integer.compare(id, o.id);
    if (cmp != 0) {
      return cmp;
    }
    cmp = Integer.compare(other, o.other);
    if (cmp != 0) {
      return cmp;
    }
    return Float.compare(score, o.score);
  }

  @Override
  public int hashCode() {
    return (id * 31 + other) * 31 + Float.floatToIntBits(score);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof ScoredIdPair))
      return false;
    ScoredIdPair o = (ScoredIdPair) obj;
    return id == o.id && other == o.other
        && Float.floatToIntBits(score) == Float.floatToIntBits(o.score);
  }

  @Override
  public String toString() {
    return id + "\t" + other + "\t" + score;
  }

  public static final class Comparator extends WritableComparator {

    public Comparator() {
      super(ScoredIdPair.class);
    }

    @Override
    public int compare(byte[] b1, int s1, int l1, byte[] b2, int s2, int l2) {
      int cmp = compareBytes(b1, s1, 8, b2, s2, 8);
      if (cmp != 0) {
        return cmp;
      }
      return Float.compare(readFloat(b1, s1 + 8), readFloat(b2, s2 + 8));
    }
  }
}
