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

import io.tsdb.batch.RowRange;

import java.util.Objects;

/**
 * A value shared by a contiguous range of rows.
 */
public final class ValueRange<T> {

  private final T value;
  private final RowRange range;

  public ValueRange(T value, RowRange range) {
    this.value = Objects.requireNonNull(value);
    this.range = Objects.requireNonNull(range);
  }

  public static <T> ValueRange<T> of(T value, int start, int end) {
    return new ValueRange<>(value, RowRange.of(start, end));
  }

  public T getValue() {
    return value;
  }

  public RowRange getRange() {
    return range;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ValueRange<?> that = (ValueRange<?>) o;
    return value.equals(that.value) && range.equals(that.range);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, range);
  }

  @Override
  public String toString() {
    return "(" + value + ", " + range + ")";
  }
}
