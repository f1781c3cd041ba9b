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
import org.apache.hadoop.io.WritableUtils;

/**
 * A pair of strings, ordered by the first and then by the second element. Used
 * for raw interactions (user, item) and for filtered edges (item, user).
 */
public final class TextPair implements WritableComparable<TextPair> {

  static {
    WritableComparator.define(TextPair.class, new Comparator());
  }

  private final Text first;
  private final Text second;

  public TextPair() {
    this.first = new Text();
    this.second = new Text();
  }

  public TextPair(String first, String second) {
    this.first = new Text(first);
    this.second = new Text(second);
  }

  public TextPair(Text first, Text second) {
    this.first = new Text(first);
    this.second = new Text(second);
  }

  public Text getFirst() {
    return first;
  }

  public Text getSecond() {
    return second;
  }

  @Override
  public void write(DataOutput out) throws IOException {
    first.write(out);
    second.write(out);
  }

  @Override
  public void readFields(DataInput in) throws IOException {
    first.readFields(in);
    second.readFields(in);
  }

  @Override
  public int compareTo(TextPair o) {
    int cmp = first.compareTo(o.first);
    if (cmp != 0) {
      return cmp;
    }
    return second.compareTo(o.second);
  }

  @Override
  public int hashCode() {
    return first.hashCode() * 163 + second.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof TextPair))
      return false;
    TextPair other = (TextPair) obj;
    return first.equals(other.first) && second.equals(other.second);
  }

  @Override
  public String toString() {
    return first + "\t" + second;
  }

  /**
   * Byte level comparator; orders serialized pairs like
   * {@link TextPair#compareTo(TextPair)}.
   */
  public static final class Comparator extends WritableComparator {

    private static final Text.Comparator TEXT_COMPARATOR = new Text.Comparator();

    public Comparator() {
      super(TextPair.class);
    }

    @Override
    public int compare(byte[] b1, int s1, int l1, byte[] b2, int s2, int l2) {
      int firstL1 = textLength(b1, s1);
      int firstL2 = textLength(b2, s2);
      int cmp = TEXT_COMPARATOR.compare(b1, s1, firstL1, b2, s2, firstL2);
      if (cmp != 0) {
        return cmp;
      }
      return TEXT_COMPARATOR.compare(b1, s1 + firstL1, l1 - firstL1, b2, s2
          + firstL2, l2 - firstL2);
    }
  }

  /**
   * @return the number of bytes of a serialized {@link Text} starting at
   *         offset s, including its length prefix.
   */
  static int textLength(byte[] b, int s) {
    try {
      return WritableUtils.decodeVIntSize(b[s]) + WritableComparator.readVInt(b, s);
    } catch (IOException e) {
      throw new IllegalArgumentException(e);
    }
  }
}
