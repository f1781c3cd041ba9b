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

import org.apache.hadoop.io.Text;
import org.apache.hadoop.io.WritableComparable;
import org.apache.hadoop.io.WritableComparator;

/**
 * An item id with a scored candidate whose key is already restored. Ordered by
 * id ascending, score descending and label ascending, which is the order the
 * candidates of one item are emitted in.
 */
public final class ScoredLabel implements WritableComparable<ScoredLabel> {

  static {
    WritableComparator.define(ScoredLabel.class, new Comparator());
  }

  private int id;
  private float score;
  private final Text label;

  public ScoredLabel() {
    this.label = new Text();
  }

  public ScoredLabel(int id, float score, Text label) {
    this.id = id;
    this.score = score;
    this.label = new Text(label);
  }

  public ScoredLabel(int id, float score, String label) {
    this.id = id;
    this.score = score;
    this.label = new Text(label);
  }

  public int getId() {
    return id;
  }

  public float getScore() {
    return score;
  }

  public Text getLabel() {
    return label;
  }

  @Override
  public void write(DataOutput out) throws IOException {
    out.writeInt(id);
    out.writeFloat(score);
    label.write(out);
  }

  @Override
  public void readFields(DataInput in) throws IOException {
    id = in.readInt();
    score = in.readFloat();
    label.readFields(in);
  }

  @Override
  public int compareTo(ScoredLabel o) {
    int cmp = Integer.compare(id, o.id);
    if (cmp != 0) {
      return cmp;
    }
    // higher scores first
    cmp = Float.compare(o.score, score);
    if (cmp != 0) {
      return cmp;
    }
    return label.compareTo(o.label);
  }

  @Override
  public int hashCode() {
    return (id * 31 + Float.floatToIntBits(score)) * 31 + label.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof ScoredLabel))
      return false;
    return compareTo((ScoredLabel) obj) == 0;
  }

  @Override
  public String toString() {
    return id + "\t" + score + "\t" + label;
  }

  public static final class Comparator extends WritableComparator {

    private static final Text.Comparator TEXT_COMPARATOR = new Text.Comparator();

    public Comparator() {
      super(ScoredLabel.class);
    }

    @Override
    public int compare(byte[] b1, int s1, int l1, byte[] b2, int s2, int l2) {
      int cmp = compareBytes(b1, s1, 4, b2, s2, 4);
      if (cmp != 0) {
        return cmp;
      }
      cmp = Float.compare(readFloat(b2, s2 + 4), readFloat(b1, s1 + 4));
      if (cmp != 0) {
        return cmp;
      }
      return TEXT_COMPARATOR.compare(b1, s1 + 8, l1 - 8, b2, s2 + 8, l2 - 8);
    }
  }
}
