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

import javax.annotation.Nullable;

/**
 * The column capabilities required to derive partition keys from tag values.
 *
 * <p>Tag columns are expected to be dictionary encoded: rows carrying the same tag value return
 * the same identity key, which allows consecutive rows to be compared without comparing strings.
 *
 * @param <K> the opaque identity key type of this column's tag dictionary
 */
public interface PartitioningColumn<K> {

  /**
   * Returns true if row {@code idx} holds a value.
   */
  boolean isValid(int idx);

  /**
   * Returns the identity key of the tag value at {@code idx}, or null if this column is not a tag column.
   */
  @Nullable
  K getTagIdentityKey(int idx);

  /**
   * Resolves a key returned by {@link #getTagIdentityKey(int)} to its tag value.
   */
  @Nullable
  String getTagValue(K key);

  /**
   * Describes the column type, used in error messages.
   */
  String typeDescription();
}
