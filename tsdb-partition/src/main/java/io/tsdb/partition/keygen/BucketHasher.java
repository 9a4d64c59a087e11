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

import io.tsdb.common.util.Option;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

import static io.tsdb.common.util.ValidationUtils.checkArgument;

/**
 * Assigns tag values to a fixed number of hash buckets.
 *
 * <p>The bucket of a value is the 32-bit murmur3 hash (x86 variant, seed 0) of its UTF-8 bytes,
 * masked to a non-negative int, modulo the number of buckets. This matches the bucket transform of
 * Apache Iceberg, so ids are stable across releases and engines.
 */
public class BucketHasher {

  private static final HashFunction MURMUR3 = Hashing.murmur3_32_fixed();

  private final int numBuckets;
  private int lastAssignedBucket = -1;

  public BucketHasher(int numBuckets) {
    checkArgument(numBuckets > 0, "Number of buckets must be positive, got " + numBuckets);
    this.numBuckets = numBuckets;
  }

  public int getNumBuckets() {
    return numBuckets;
  }

  /**
   * Returns the bucket of {@code value}, remembering it as the last assigned bucket.
   */
  public int assignBucket(String value) {
    int hash = MURMUR3.hashString(value, StandardCharsets.UTF_8).asInt();
    lastAssignedBucket = (hash & Integer.MAX_VALUE) % numBuckets;
    return lastAssignedBucket;
  }

  /**
   * The bucket returned by the previous {@link #assignBucket} call, if any.
   */
  public Option<Integer> lastAssignedBucket() {
    return lastAssignedBucket < 0 ? Option.empty() : Option.of(lastAssignedBucket);
  }
}
