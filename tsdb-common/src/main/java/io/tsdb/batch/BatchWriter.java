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

import java.util.LinkedHashMap;
import java.util.Map;

import static io.tsdb.common.util.ValidationUtils.checkArgument;
import static io.tsdb.common.util.ValidationUtils.checkState;

/**
 * Writes a fixed number of rows into a {@link MutableBatch}.
 *
 * <p>Columns are staged and only become visible in the batch on {@link #commit()}; a writer that is
 * dropped without committing leaves the batch untouched.
 *
 * <p>Validity masks are LSB first: bit {@code i % 8} of byte {@code i / 8} marks row {@code i} as
 * holding a value. Values are supplied for the valid rows only, in row order. A null mask marks
 * every row valid.
 */
public class BatchWriter {

  private final MutableBatch batch;
  private final int numRows;
  private final Map<String, MutableColumn> staged = new LinkedHashMap<>();
  private boolean committed;

  BatchWriter(MutableBatch batch, int numRows) {
    checkArgument(numRows >= 0, "Row count must not be negative");
    this.batch = batch;
    this.numRows = numRows;
  }

  public BatchWriter writeTime(String name, long... values) {
    checkArgument(values.length == numRows,
        "Expected " + numRows + " timestamps for column \"" + name + "\", got " + values.length);
    MutableColumn column = stage(name, ColumnType.TIME);
    for (long value : values) {
      column.appendLong(value);
    }
    return this;
  }

  public BatchWriter writeTag(String name, @Nullable byte[] validMask, String... values) {
    return writeStrings(name, ColumnType.TAG, validMask, values);
  }

  public BatchWriter writeString(String name, @Nullable byte[] validMask, String... values) {
    return writeStrings(name, ColumnType.STRING, validMask, values);
  }

  public BatchWriter writeI64(String name, @Nullable byte[] validMask, long... values) {
    MutableColumn column = stage(name, ColumnType.I64);
    int next = 0;
    for (int row = 0; row < numRows; row++) {
      if (isSet(validMask, row)) {
        checkValueCount(name, values.length, next);
        column.appendLong(values[next++]);
      } else {
        column.appendNulls(1);
      }
    }
    checkAllConsumed(name, values.length, next);
    return this;
  }

  public BatchWriter writeF64(String name, @Nullable byte[] validMask, double... values) {
    MutableColumn column = stage(name, ColumnType.F64);
    int next = 0;
    for (int row = 0; row < numRows; row++) {
      if (isSet(validMask, row)) {
        checkValueCount(name, values.length, next);
        column.appendDouble(values[next++]);
      } else {
        column.appendNulls(1);
      }
    }
    checkAllConsumed(name, values.length, next);
    return this;
  }

  public BatchWriter writeBool(String name, @Nullable byte[] validMask, boolean... values) {
    MutableColumn column = stage(name, ColumnType.BOOL);
    int next = 0;
    for (int row = 0; row < numRows; row++) {
      if (isSet(validMask, row)) {
        checkValueCount(name, values.length, next);
        column.appendBoolean(values[next++]);
      } else {
        column.appendNulls(1);
      }
    }
    checkAllConsumed(name, values.length, next);
    return this;
  }

  /**
   * Publishes the staged columns to the batch.
   */
  public void commit() {
    checkState(!committed, "Writer has already been committed");
    batch.commit(staged, numRows);
    committed = true;
  }

  private BatchWriter writeStrings(String name, ColumnType type, @Nullable byte[] validMask, String[] values) {
    MutableColumn column = stage(name, type);
    int next = 0;
    for (int row = 0; row < numRows; row++) {
      if (isSet(validMask, row)) {
        checkValueCount(name, values.length, next);
        column.appendString(values[next++]);
      } else {
        column.appendNulls(1);
      }
    }
    checkAllConsumed(name, values.length, next);
    return this;
  }

  private MutableColumn stage(String name, ColumnType type) {
    checkState(!committed, "Writer has already been committed");
    if (staged.containsKey(name)) {
      throw new TsdbException("Column \"" + name + "\" written twice");
    }
    batch.checkCompatible(name, type);
    MutableColumn column = new MutableColumn(name, type);
    staged.put(name, column);
    return column;
  }

  private static boolean isSet(@Nullable byte[] mask, int row) {
    if (mask == null) {
      return true;
    }
    int idx = row >> 3;
    return idx < mask.length && (mask[idx] & (1 << (row & 7))) != 0;
  }

  private static void checkValueCount(String name, int supplied, int next) {
    if (next >= supplied) {
      throw new TsdbException("Too few values supplied for column \"" + name + "\": " + supplied);
    }
  }

  private static void checkAllConsumed(String name, int supplied, int consumed) {
    if (supplied != consumed) {
      throw new TsdbException("Expected " + consumed + " values for column \"" + name + "\", got " + supplied);
    }
  }
}
