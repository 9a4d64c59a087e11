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

import io.tsdb.common.util.Option;
import io.tsdb.exception.TimeColumnNotFoundException;
import io.tsdb.exception.TsdbException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.tsdb.common.util.ValidationUtils.checkArgument;

/**
 * An in-memory, column oriented batch of rows.
 *
 * <p>Rows are added through a {@link BatchWriter}, or copied from another batch with
 * {@link #extendFromRanges(Batch, List)}. Every column always holds exactly {@link #numRows()} rows,
 * rows without a value being marked invalid.
 */
public class MutableBatch implements WritableBatch {

  private static final Logger LOG = LoggerFactory.getLogger(MutableBatch.class);

  private final Map<String, MutableColumn> columns = new LinkedHashMap<>();
  private int rowCount;

  /**
   * Returns a copy of the timestamps; writing to it does not change the batch.
   */
  @Override
  public long[] timeColumn() {
    MutableColumn time = columns.get(TIME_COLUMN_NAME);
    if (time == null || time.getType() != ColumnType.TIME) {
      throw new TimeColumnNotFoundException();
    }
    return time.longValues();
  }

  @Override
  public int numRows() {
    return rowCount;
  }

  @Override
  public Option<PartitioningColumn<?>> column(String name) {
    return Option.ofNullable(columns.get(name));
  }

  public Option<MutableColumn> getColumn(String name) {
    return Option.ofNullable(columns.get(name));
  }

  /**
   * Returns a writer appending {@code numRows} rows to this batch once committed.
   */
  public BatchWriter writer(int numRows) {
    return new BatchWriter(this, numRows);
  }

  @Override
  public void extendFromRanges(Batch source, List<RowRange> ranges) {
    checkArgument(source instanceof MutableBatch,
        "Cannot extend a MutableBatch from " + source.getClass().getName());
    MutableBatch other = (MutableBatch) source;
    int appended = 0;
    for (RowRange range : ranges) {
      checkArgument(range.end() <= other.rowCount,
          "Row range " + range + " exceeds the " + other.rowCount + " rows of the source batch");
      appended += range.length();
    }
    for (MutableColumn src : other.columns.values()) {
      checkCompatible(src.getName(), src.getType());
    }

    for (MutableColumn src : other.columns.values()) {
      MutableColumn dst = getOrCreate(src.getName(), src.getType());
      for (RowRange range : ranges) {
        dst.appendFrom(src, range.start(), range.end());
      }
    }
    padMissing(other.columns.keySet(), appended);
    rowCount += appended;
    LOG.debug("Appended {} rows from {} ranges, batch now holds {} rows", appended, ranges.size(), rowCount);
  }

  /**
   * Appends the columns staged by {@code writer}. Called by {@link BatchWriter#commit()}.
   */
  void commit(Map<String, MutableColumn> staged, int numRows) {
    for (MutableColumn src : staged.values()) {
      checkCompatible(src.getName(), src.getType());
    }
    for (MutableColumn src : staged.values()) {
      getOrCreate(src.getName(), src.getType()).appendFrom(src, 0, numRows);
    }
    padMissing(staged.keySet(), numRows);
    rowCount += numRows;
  }

  /**
   * Fails if this batch holds a column named {@code name} of another type. Checked for every column
   * before any is appended to, so that a rejected append leaves the batch untouched.
   */
  void checkCompatible(String name, ColumnType type) {
    MutableColumn column = columns.get(name);
    if (column != null && column.getType() != type) {
      throw new TsdbException("Column \"" + name + "\" is of type " + column.getType().description()
          + ", cannot write values of type " + type.description());
    }
  }

  private MutableColumn getOrCreate(String name, ColumnType type) {
    MutableColumn column = columns.get(name);
    if (column == null) {
      column = new MutableColumn(name, type);
      column.appendNulls(rowCount);
      columns.put(name, column);
    }
    return column;
  }

  private void padMissing(Iterable<String> written, int numRows) {
    for (MutableColumn column : columns.values()) {
      boolean present = false;
      for (String name : written) {
        if (name.equals(column.getName())) {
          present = true;
          break;
        }
      }
      if (!present) {
        column.appendNulls(numRows);
      }
    }
  }

  @Override
  public String toString() {
    return "MutableBatch{rows=" + rowCount + ", columns=" + columns.keySet() + '}';
  }
}
