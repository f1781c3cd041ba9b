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
 * A compacted edge (item id, user id). Both ids are non negative fixed width
 * ints, so the serialized form sorts byte by byte.
 */
public final class IdPair implements WritableComparable<IdPair> {

  static {
    WritableComparator.define(IdPair.class, new Comparator());
  }

  private int first;
  private int second;

  public IdPair() {
  }

  public IdPair(int first, int second) {
    this.first = first;
    this.second = second;
  }

  public int getFirst() {
    return first;
  }

  public int getSecond() {
    return second;
  }

  @Override
  public void write(DataOutput out) throws IOException {
    out.writeInt(first);
    out.writeInt(second);
  }

  @Override
  public void readFields(DataInput in) throws IOException {
    first = in.readInt();
    second = in.readInt();
  }

  @Override
  public int compareTo(IdPair o) {
    int cmp = Integer.compare(first, o.first);
    if (cmp != 0) {
      return cmp;
    }
    return Integer.compare(second, o.second);
  }

  @Override
  public int hashCode() {
    return first * 31 + second;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof IdPair))
      return false;
    IdPair other = (IdPair) obj;
    return first == other.first && second == other.second;
  }

  @Override
  public String toString() {
    return first + "\t" + second;
  }

  public static final class Comparator extends WritableComparator {

    public Comparator() {
      super(IdPair.class);
    }

    @Override
    public int compare(byte[] b1, int s1, int l1, byte[] b2, int s2, int l2) {
      return compareBytes(b1, s1, l1, b2, s2, l2);
    }
  }
}
