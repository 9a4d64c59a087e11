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

package io.tsdb.partition.keygen;

/**
 * Constants of the partition key format.
 */
public final class PartitionKeyConstants {

  /**
   * Separates the rendered parts of a partition key.
   */
  public static final char PARTITION_KEY_DELIMITER = '|';

  /**
   * Rendered for a part whose value is absent (null tag, missing column).
   */
  public static final String NULL_PARTITION_KEY_PLACEHOLDER = "!";

  /**
   * Rendered for a part whose value is the empty string.
   */
  public static final String EMPTY_PARTITION_KEY_PLACEHOLDER = "^";

  /**
   * Appended to a part that was cut short to fit {@link #PARTITION_KEY_PART_MAX_LENGTH}.
   */
  public static final char PARTITION_KEY_PART_TRUNCATED = '#';

  /**
   * Maximum length of a single encoded key part, in bytes.
   */
  public static final int PARTITION_KEY_PART_MAX_LENGTH = 200;

  private PartitionKeyConstants() {
  }
}
