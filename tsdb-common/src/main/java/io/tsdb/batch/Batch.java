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

/**
 * A read-only view over a set of rows, exposing the capabilities partition key generation relies on.
 */
public interface Batch {

  String TIME_COLUMN_NAME = "time";

  /**
   * Returns the timestamp (nanoseconds since the epoch) of every row in this batch.
   * Callers may modify the returned array without affecting the batch.
   *
   * @throws TimeColumnNotFoundException if the batch has no time column
   */
  long[] timeColumn();

  /**
   * Returns the number of rows in this batch.
   */
  int numRows();

  /**
   * Looks up the column named {@code name}.
   */
  Option<PartitioningColumn<?>> column(String name);
}
