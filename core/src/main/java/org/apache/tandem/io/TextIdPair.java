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
 * A string key and a dense id, ordered by key and then by id. The id is
 * written as a fixed width big endian int, so ids (which are never negative)
 * compare on their bytes like numbers.
 */
public final class TextIdPair implements WritableComparable<TextIdPair> {

  static {
    WritableComparator.define(TextIdPair.class, new Comparator());
  }

  private final Text key;
  private int id;

  public TextIdPair() {
    this.key = new Text();
  }

  public TextIdPair(Text key, int id) {
    this.key = new Text(key);
    this.id = id;
  }

  public TextIdPair(String key, int id) {
    this.key = new Text(key);
    this.id = id;
  }

  public Text getKey() {
    return key;
  }

  public int getId() {
    return id;
  }

  @Override
  public void write(DataOutput out) throws IOException {
    key.write(out);
    out.writeInt(id);
  }

  @Override
  public void readFields(DataInput in) throws IOException {
    key.readFields(in);
    id = in.readInt();
  }

  @Override
  public int compareTo(TextIdPair o) {
    int cmp = key.compareTo(o.key);
    if (cmp != 0) {
      return cmp;
    }
    return Integer.compare(id, o.id);
  }

  @Override
  public int hashCode() {
    return key.hashCode() * 31 + id;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof TextIdPair))
      return false;
    TextIdPair other = (TextIdPair) obj;
    return id == other.id && key.equals(other.key);
  }

  @Override
  public String toString() {
    return key + "\t" + id;
  }

  public static final class Comparator extends WritableComparator {

    private static final Text.Comparator TEXT_COMPARATOR = new Text.Comparator();

    public Comparator() {
      super(TextIdPair.class);
    }

    @Override
    public int compare(byte[] b1, int s1, int l1, byte[] b2, int s2, int l2) {
      int keyL1 = TextPair.textLength(b1, s1);
      int keyL2 = TextPair.textLength(b2, s2);
      int cmp = TEXT_COMPARATOR.compare(b1, s1, keyL1, b2, s2, keyL2);
      if (cmp != 0) {
        return cmp;
      }
      return compareBytes(b1, s1 + keyL1, l1 - keyL1, b2, s2 + keyL2, l2
          - keyL2);
    }
  }
}
