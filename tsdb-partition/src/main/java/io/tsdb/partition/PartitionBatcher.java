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
import io.tsdb.partition.template.PartitionKeyGenerator;

import java.util.Iterator;

/**
 * Groups the rows of a batch into ranges of rows sharing a partition key.
 */
public final class PartitionBatcher {

  private PartitionBatcher() {
  }

  /**
   * Returns the partition key ranges of {@code batch}, in row order.
   *
   * <p>Consecutive rows with the same key share a range, and so do consecutive rows failing with
   * the same error. The same key may head several non-adjacent ranges.
   *
   * @throws IllegalArgumentException if the template has too many parts
   * @throws io.tsdb.exception.TimeColumnNotFoundException if the batch has no time column
   */
  public static Iterator<ValueRange<PartitionKeyResult>> partitionBatch(Batch batch, PartitionTemplate template) {
    return new RangeEncodingIterator<>(new PartitionKeyGenerator(batch, template).keys());
  }
}
