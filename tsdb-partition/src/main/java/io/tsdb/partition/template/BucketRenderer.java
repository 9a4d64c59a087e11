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

package io.tsdb.partition.template;

import io.tsdb.batch.PartitioningColumn;
import io.tsdb.common.util.Option;
import io.tsdb.exception.TagValueNotTagException;
import io.tsdb.partition.keygen.BucketHasher;

import javax.annotation.Nullable;

import static io.tsdb.partition.keygen.PartitionKeyConstants.NULL_PARTITION_KEY_PLACEHOLDER;

/**
 * Renders the bucket id of a tag column value.
 *
 * <p>Rows with a different tag value may still fall into the same bucket; {@link #isIdentical}
 * hashes the new value to find out when the identity key changes.
 *
 * @param <K> identity key type of the column's tag values
 */
public class BucketRenderer<K> implements TemplatePartRenderer {

  private final PartitioningColumn<K> column;
  private final BucketHasher hasher;

  @Nullable
  private K lastKey;

  BucketRenderer(PartitioningColumn<K> column, BucketHasher hasher) {
    this.column = column;
    this.hasher = hasher;
  }

  static <K> BucketRenderer<K> forColumn(PartitioningColumn<K> column, int numBuckets) {
    return new BucketRenderer<>(column, new BucketHasher(numBuckets));
  }

  @Override
  public void render(int idx, StringBuilder out) {
    if (!column.isValid(idx)) {
      lastKey = null;
      out.append(NULL_PARTITION_KEY_PLACEHOLDER);
      return;
    }
    K key = column.getTagIdentityKey(idx);
    String value = key == null ? null : column.getTagValue(key);
    if (value == null) {
      throw new TagValueNotTagException(column.typeDescription());
    }
    lastKey = key;
    out.append(hasher.assignBucket(value));
  }

  @Override
  public boolean isIdentical(int idx) {
    if (!column.isValid(idx)) {
      return lastKey == null;
    }
    K key = column.getTagIdentityKey(idx);
    if (key == null) {
      return false;
    }
    if (key.equals(lastKey)) {
      return true;
    }
    if (lastKey == null) {
      return false;
    }
    String value = column.getTagValue(key);
    if (value == null) {
      return false;
    }
    Option<Integer> lastBucket = hasher.lastAssignedBucket();
    return lastBucket.isPresent() && lastBucket.get() == hasher.assignBucket(value);
  }
}
