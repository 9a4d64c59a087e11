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

import java.io.Serializable;
import java.util.Objects;

import static io.tsdb.common.util.ValidationUtils.checkArgument;

/**
 * A half-open interval {@code [start, end)} of row indexes within a batch.
 */
public final class RowRange implements Serializable {

  private static final long serialVersionUID = 1L;

  private final int start;
  private final int end;

  public RowRange(int start, int end) {
    checkArgument(start >= 0 && start <= end, "Invalid row range [" + start + ", " + end + ")");
    this.start = start;
    this.end = end;
  }

  public static RowRange of(int start, int end) {
    return new RowRange(start, end);
  }

  public int start() {
    return start;
  }

  public int end() {
    return end;
  }

  public int length() {
    return end - start;
  }

  public boolean isEmpty() {
    return start == end;
  }

  public boolean contains(int idx) {
    return idx >= start && idx < end;
  }

  /**
   * Returns this range shifted by {@code offset} rows.
   */
  public RowRange offset(int offset) {
    return new RowRange(start + offset, end + offset);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    RowRange that = (RowRange) o;
    return start == that.start && end == that.end;
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end);
  }

  @Override
  public String toString() {
    return start + ".." + end;
  }
}
