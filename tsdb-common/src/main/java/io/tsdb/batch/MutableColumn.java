/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.tsdb.batch;

import io.tsdb.exception.TsdbException;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * An append-only, in-memory column of a {@link MutableBatch}.
 *
 * <p>Tag values are dictionary encoded per column, the dictionary id (boxed once per distinct
 * value) serving as the tag identity key.
 */
public final class MutableColumn implements PartitioningColumn<Integer> {

  private static final int INITIAL_CAPACITY = 16;

  private final String name;
  private final ColumnType type;
  private final BitSet valid = new BitSet();
  private int length;

  // TIME and I64
  private long[] longs;
  // F64
  private double[] doubles;
  // BOOL
  private BitSet bools;
  // STRING
  private String[] strings;
  // TAG
  private int[] tagKeys;
  private TagDictionary dictionary;

  MutableColumn(String name, ColumnType type) {
    this.name = name;
    this.type = type;
    switch (type) {
      case TIME:
      case I64:
        longs = new long[INITIAL_CAPACITY];
        break;
      case F64:
        doubles = new double[INITIAL_CAPACITY];
        break;
      case BOOL:
        bools = new BitSet();
        break;
      case STRING:
        strings = new String[INITIAL_CAPACITY];
        break;
      case TAG:
        tagKeys = new int[INITIAL_CAPACITY];
        dictionary = new TagDictionary();
        break;
      default:
        throw new TsdbException("Unsupported column type " + type);
    }
  }

  public String getName() {
    return name;
  }

  public ColumnType getType() {
    return type;
  }

  public int length() {
    return length;
  }

  @Override
  public boolean isValid(int idx) {
    return valid.get(idx);
  }

  @Nullable
  @Override
  public Integer getTagIdentityKey(int idx) {
    if (type != ColumnType.TAG || !valid.get(idx)) {
      return null;
    }
    return dictionary.boxedKey(tagKeys[idx]);
  }

  @Nullable
  @Override
  public String getTagValue(Integer key) {
    if (type != ColumnType.TAG) {
      return null;
    }
    return dictionary.lookup(key);
  }

  @Override
  public String typeDescription() {
    return type.description();
  }

  public long getLong(int idx) {
    checkType(ColumnType.TIME, ColumnType.I64);
    return longs[idx];
  }

  public double getDouble(int idx) {
    checkType(ColumnType.F64);
    return doubles[idx];
  }

  public boolean getBoolean(int idx) {
    checkType(ColumnType.BOOL);
    return bools.get(idx);
  }

  /**
   * Returns the string or tag value at {@code idx}, null if the row holds no value.
   */
  @Nullable
  public String getString(int idx) {
    checkType(ColumnType.STRING, ColumnType.TAG);
    if (!valid.get(idx)) {
      return null;
    }
    return type == ColumnType.TAG ? dictionary.lookup(tagKeys[idx]) : strings[idx];
  }

  /**
   * Returns a copy of the first {@link #length()} values of a TIME or I64 column.
   */
  long[] longValues() {
    checkType(ColumnType.TIME, ColumnType.I64);
    return Arrays.copyOf(longs, length);
  }

  void appendNulls(int count) {
    ensureCapacity(length + count);
    length += count;
  }

  void appendLong(long value) {
    ensureCapacity(length + 1);
    longs[length] = value;
    valid.set(length);
    length++;
  }

  void appendDouble(double value) {
    ensureCapacity(length + 1);
    doubles[length] = value;
    valid.set(length);
    length++;
  }

  void appendBoolean(boolean value) {
    bools.set(length, value);
    valid.set(length);
    length++;
  }

  void appendString(String value) {
    ensureCapacity(length + 1);
    if (type == ColumnType.TAG) {
      tagKeys[length] = dictionary.lookupOrInsert(value);
    } else {
      strings[length] = value;
    }
    valid.set(length);
    length++;
  }

  /**
   * Appends rows {@code [start, end)} of {@code other}, which must be of the same type.
   */
  void appendFrom(MutableColumn other, int start, int end) {
    if (other.type != type) {
      throw new TsdbException("Cannot append column \"" + name + "\" of type " + other.type.description()
          + " to a column of type " + type.description());
    }
    ensureCapacity(length + (end - start));
    for (int i = start; i < end; i++) {
      if (!other.valid.get(i)) {
        length++;
        continue;
      }
      switch (type) {
        case TIME:
        case I64:
          appendLong(other.longs[i]);
          break;
        case F64:
          appendDouble(other.doubles[i]);
          break;
        case BOOL:
          appendBoolean(other.bools.get(i));
          break;
        case STRING:
          appendString(other.strings[i]);
          break;
        case TAG:
          appendString(other.dictionary.lookup(other.tagKeys[i]));
          break;
        default:
          throw new TsdbException("Unsupported column type " + type);
      }
    }
  }

  private void ensureCapacity(int capacity) {
    if (longs != null && longs.length < capacity) {
      longs = Arrays.copyOf(longs, grow(longs.length, capacity));
    }
    if (doubles != null && doubles.length < capacity) {
      doubles = Arrays.copyOf(doubles, grow(doubles.length, capacity));
    }
    if (strings != null && strings.length < capacity) {
      strings = Arrays.copyOf(strings, grow(strings.length, capacity));
    }
    if (tagKeys != null && tagKeys.length < capacity) {
      tagKeys = Arrays.copyOf(tagKeys, grow(tagKeys.length, capacity));
    }
  }

  private static int grow(int current, int required) {
    return Math.max(current * 2, required);
  }

  private void checkType(ColumnType... expected) {
    for (ColumnType t : expected) {
      if (t == type) {
        return;
      }
    }
    throw new TsdbException("Column \"" + name + "\" is of type " + type.description());
  }

  @Override
  public String toString() {
    return "MutableColumn{name=" + name + ", type=" + type.description() + ", length=" + length + '}';
  }

  /**
   * Per-column tag dictionary.
   */
  private static final class TagDictionary {
    private final List<String> values = new ArrayList<>();
    private final List<Integer> keys = new ArrayList<>();
    private final Map<String, Integer> index = new HashMap<>();

    int lookupOrInsert(String value) {
      Integer key = index.get(value);
      if (key == null) {
        key = values.size();
        values.add(value);
        keys.add(key);
        index.put(value, key);
      }
      return key;
    }

    Integer boxedKey(int key) {
      return keys.get(key);
    }

    @Nullable
    String lookup(int key) {
      return key >= 0 && key < values.size() ? values.get(key) : null;
    }
  }
}
