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

import java.util.Iterator;
import java.util.NoSuchElementException;

import static io.tsdb.common.util.ValidationUtils.checkState;

/**
 * Run-length encodes a sequence of values into {@link ValueRange}s of row indexes.
 *
 * <p>An empty element means "same as the previous element" and extends the open range, as does a
 * value equal to the open one. The first element must carry a value. Ranges are never empty and
 * cover the input without gaps.
 *
 * <p>e.g. {@code [5, 5, 5, 7, 2, 2, 3]} encodes to {@code [(5, 0..3), (7, 3..4), (2, 4..6), (3, 6..7)]}.
 */
public class RangeEncodingIterator<T> implements Iterator<ValueRange<T>> {

  private final Iterator<Option<T>> source;

  private T openValue;
  private int openStart;
  private int position;
  private ValueRange<T> nextRange;

  public RangeEncodingIterator(Iterator<Option<T>> source) {
    this.source = source;
  }

  @Override
  public boolean hasNext() {
    if (nextRange == null) {
      nextRange = computeNext();
    }
    return nextRange != null;
  }

  @Override
  public ValueRange<T> next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    ValueRange<T> result = nextRange;
    nextRange = null;
    return result;
  }

  private ValueRange<T> computeNext() {
    while (source.hasNext()) {
      Option<T> item = source.next();
      int idx = position++;
      if (item.isEmpty()) {
        checkState(openValue != null, "The first element of a range encoded sequence must carry a value");
        continue;
      }
      T value = item.get();
      if (openValue == null) {
        openValue = value;
        openStart = idx;
      } else if (!openValue.equals(value)) {
        ValueRange<T> flushed = ValueRange.of(openValue, openStart, idx);
        openValue = value;
        openStart = idx;
        return flushed;
      }
    }
    if (openValue != null) {
      ValueRange<T> flushed = ValueRange.of(openValue, openStart, position);
      openValue = null;
      return flushed;
    }
    return null;
  }
}
