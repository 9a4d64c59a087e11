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

import java.io.Serializable;
import java.util.Objects;

import static io.tsdb.common.util.ValidationUtils.checkArgument;

/**
 * One component of a partition template.
 *
 * <ul>
 *   <li>{@link Type#TAG_VALUE}: the value of a tag column.</li>
 *   <li>{@link Type#TIME_FORMAT}: the row timestamp rendered with a strftime format.</li>
 *   <li>{@link Type#BUCKET}: the hash bucket of a tag column value.</li>
 * </ul>
 */
public final class TemplatePart implements Serializable {

  private static final long serialVersionUID = 1L;

  public enum Type {
    TAG_VALUE, TIME_FORMAT, BUCKET
  }

  private final Type type;
  private final String value;
  private final int numBuckets;

  private TemplatePart(Type type, String value, int numBuckets) {
    this.type = type;
    this.value = Objects.requireNonNull(value);
    this.numBuckets = numBuckets;
  }

  public static TemplatePart tagValue(String column) {
    return new TemplatePart(Type.TAG_VALUE, column, 0);
  }

  public static TemplatePart timeFormat(String format) {
    return new TemplatePart(Type.TIME_FORMAT, format, 0);
  }

  public static TemplatePart bucket(String column, int numBuckets) {
    checkArgument(numBuckets > 0, "Number of buckets must be positive, got " + numBuckets);
    return new TemplatePart(Type.BUCKET, column, numBuckets);
  }

  public Type getType() {
    return type;
  }

  /**
   * The column name of a tag value or bucket part.
   */
  public String getColumn() {
    checkArgument(type != Type.TIME_FORMAT, "Time format parts do not refer to a column");
    return value;
  }

  public String getFormat() {
    checkArgument(type == Type.TIME_FORMAT, "Only time format parts carry a format");
    return value;
  }

  public int getNumBuckets() {
    checkArgument(type == Type.BUCKET, "Only bucket parts carry a number of buckets");
    return numBuckets;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    TemplatePart that = (TemplatePart) o;
    return numBuckets == that.numBuckets && type == that.type && value.equals(that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, value, numBuckets);
  }

  @Override
  public String toString() {
    switch (type) {
      case TAG_VALUE:
        return "TagValue(" + value + ")";
      case TIME_FORMAT:
        return "TimeFormat(" + value + ")";
      default:
        return "Bucket(" + value + ", " + numBuckets + ")";
    }
  }
}
