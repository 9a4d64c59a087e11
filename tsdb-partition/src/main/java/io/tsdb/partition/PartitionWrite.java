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

package io.tsdb.partition;

import io.tsdb.batch.Batch;
import io.tsdb.batch.RowRange;
import io.tsdb.batch.WritableBatch;
import io.tsdb.common.util.Option;
import io.tsdb.exception.PartitionKeyException;
import io.tsdb.exception.PartitionWriteException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongPredicate;

import static io.tsdb.common.util.ValidationUtils.checkArgument;

/**
 * The rows of a batch bound for one partition.
 *
 * <p>A write refers to its source batch through a list of non-empty row ranges, and tracks the
 * number of rows and the inclusive range of their timestamps.
 */
public class PartitionWrite {

  private static final Logger LOG = LoggerFactory.getLogger(PartitionWrite.class);

  private final Batch batch;
  private final List<RowRange> ranges;
  private long minTimestamp;
  private long maxTimestamp;
  private int rowCount;

  private PartitionWrite(Batch batch, List<RowRange> ranges, long minTimestamp, long maxTimestamp, int rowCount) {
    this.batch = batch;
    this.ranges = ranges;
    this.minTimestamp = minTimestamp;
    this.maxTimestamp = maxTimestamp;
    this.rowCount = rowCount;
  }

  /**
   * Returns a write covering every row of {@code batch}.
   *
   * @throws IllegalArgumentException if the batch has no rows
   * @throws io.tsdb.exception.TimeColumnNotFoundException if the batch has no time column
   */
  public static PartitionWrite of(Batch batch) {
    int numRows = batch.numRows();
    checkArgument(numRows > 0, "Cannot create a partition write from an empty batch");
    long[] time = batch.timeColumn();
    PartitionWrite write = new PartitionWrite(batch, new ArrayList<>(), Long.MAX_VALUE, Long.MIN_VALUE, 0);
    write.addRange(RowRange.of(0, numRows), time);
    return write;
  }

  /**
   * Splits {@code batch} into one write per partition key, in order of first appearance.
   *
   * @throws PartitionWriteException if the key of any row cannot be generated
   * @throws io.tsdb.exception.TimeColumnNotFoundException if the batch has no time column
   */
  public static Map<String, PartitionWrite> partition(Batch batch, PartitionTemplate template) {
    Iterator<ValueRange<PartitionKeyResult>> keyRanges = PartitionBatcher.partitionBatch(batch, template);
    long[] time = batch.timeColumn();

    Map<String, PartitionWrite> partitions = new LinkedHashMap<>();
    int numRanges = 0;
    while (keyRanges.hasNext()) {
      ValueRange<PartitionKeyResult> keyRange = keyRanges.next();
      RowRange range = keyRange.getRange();
      Option<PartitionKeyException> error = keyRange.getValue().getError();
      if (error.isPresent()) {
        throw new PartitionWriteException("Failed to generate the partition key of rows " + range, error.get());
      }
      String key = keyRange.getValue().getKeyOrThrow();
      partitions.computeIfAbsent(key,
          k -> new PartitionWrite(batch, new ArrayList<>(), Long.MAX_VALUE, Long.MIN_VALUE, 0))
          .addRange(range, time);
      numRanges++;
    }
    LOG.debug("Partitioned {} rows into {} ranges across {} partitions", batch.numRows(), numRanges,
        partitions.size());
    return partitions;
  }

  private void addRange(RowRange range, long[] time) {
    for (int i = range.start(); i < range.end(); i++) {
      minTimestamp = Math.min(minTimestamp, time[i]);
      maxTimestamp = Math.max(maxTimestamp, time[i]);
    }
    ranges.add(range);
    rowCount += range.length();
  }

  /**
   * Returns the rows of this write whose timestamp satisfies {@code predicate}, or empty if none does.
   * Ranges are split around the rows filtered out.
   */
  public Option<PartitionWrite> filter(LongPredicate predicate) {
    long[] time = batch.timeColumn();
    PartitionWrite filtered = new PartitionWrite(batch, new ArrayList<>(), Long.MAX_VALUE, Long.MIN_VALUE, 0);
    for (RowRange range : ranges) {
      int runStart = -1;
      for (int i = range.start(); i < range.end(); i++) {
        if (predicate.test(time[i])) {
          if (runStart < 0) {
            runStart = i;
          }
        } else if (runStart >= 0) {
          filtered.addRange(RowRange.of(runStart, i), time);
          runStart = -1;
        }
      }
      if (runStart >= 0) {
        filtered.addRange(RowRange.of(runStart, range.end()), time);
      }
    }
    return filtered.rowCount == 0 ? Option.empty() : Option.of(filtered);
  }

  /**
   * Appends the rows of this write to {@code dest}.
   */
  public void writeToBatch(WritableBatch dest) {
    dest.extendFromRanges(batch, Collections.unmodifiableList(ranges));
  }

  public Batch getBatch() {
    return batch;
  }

  public List<RowRange> getRanges() {
    return Collections.unmodifiableList(ranges);
  }

  public long getMinTimestamp() {
    return minTimestamp;
  }

  public long getMaxTimestamp() {
    return maxTimestamp;
  }

  public int getRowCount() {
    return rowCount;
  }

  @Override
  public String toString() {
    return "PartitionWrite{rows=" + rowCount + ", ranges=" + ranges
        + ", minTimestamp=" + minTimestamp + ", maxTimestamp=" + maxTimestamp + '}';
  }
}
