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

import io.tsdb.common.util.Option;
import io.tsdb.exception.PartitionKeyException;

import java.util.Objects;

/**
 * The outcome of generating the partition key of a row: the key, or the error that prevented it.
 *
 * <p>Two failures are equal when they carry the same kind of error with the same message, so that
 * consecutive rows failing for the same reason collapse into one range.
 */
public final class PartitionKeyResult {

  private final String key;
  private final PartitionKeyException error;

  private PartitionKeyResult(String key, PartitionKeyException error) {
    this.key = key;
    this.error = error;
  }

  public static PartitionKeyResult of(String key) {
    return new PartitionKeyResult(Objects.requireNonNull(key), null);
  }

  public static PartitionKeyResult error(PartitionKeyException error) {
    return new PartitionKeyResult(null, Objects.requireNonNull(error));
  }

  public boolean isSuccess() {
    return key != null;
  }

  public Option<String> getKey() {
    return Option.ofNullable(key);
  }

  public Option<PartitionKeyException> getError() {
    return Option.ofNullable(error);
  }

  /**
   * Returns the key, rethrowing the error of a failed row.
   */
  public String getKeyOrThrow() {
    if (error != null) {
      throw error;
    }
    return key;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    PartitionKeyResult that = (PartitionKeyResult) o;
    if (key != null) {
      return key.equals(that.key);
    }
    return that.error != null
        && error.getClass() == that.error.getClass()
        && Objects.equals(error.getMessage(), that.error.getMessage());
  }

  @Override
  public int hashCode() {
    return key != null ? key.hashCode() : Objects.hash(error.getClass(), error.getMessage());
  }

  @Override
  public String toString() {
    return key != null ? "Ok(" + key + ")" : "Err(" + error.getMessage() + ")";
  }
}
