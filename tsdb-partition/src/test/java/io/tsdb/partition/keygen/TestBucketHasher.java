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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TestBucketHasher {

  @ParameterizedTest
  @CsvSource({
      "foo, 10, 6",
      "bat, 10, 5",
      "qux, 10, 5",
      "for_test_strings, 5, 1",
      "97c953a1-70e6-4569-80e4-59d1f49ec3fa, 10, 6",
      "f1aac284-b8a1-4938-acf3-52a3d516ca14, 10, 4",
      "420bb984-4d1e-48ec-bbfc-10825fbf3221, 10, 5"
  })
  public void testAssignBucket(String value, int numBuckets, int expected) {
    assertEquals(expected, new BucketHasher(numBuckets).assignBucket(value));
  }

  @Test
  public void testEmptyValue() {
    assertEquals(0, new BucketHasher(10).assignBucket(""));
  }

  @Test
  public void testLastAssignedBucket() {
    BucketHasher hasher = new BucketHasher(10);
    assertTrue(hasher.lastAssignedBucket().isEmpty());
    hasher.assignBucket("foo");
    assertEquals(Option.of(6), hasher.lastAssignedBucket());
    hasher.assignBucket("bat");
    assertEquals(Option.of(5), hasher.lastAssignedBucket());
  }

  @Test
  public void testBucketsAlwaysInRange() {
    for (int numBuckets = 1; numBuckets <= 64; numBuckets++) {
      BucketHasher hasher = new BucketHasher(numBuckets);
      for (int i = 0; i < 200; i++) {
        int bucket = hasher.assignBucket("host-" + i);
        assertTrue(bucket >= 0 && bucket < numBuckets);
      }
    }
  }

  @Test
  public void testRejectsZeroBuckets() {
    assertThrows(IllegalArgumentException.class, () -> new BucketHasher(0));
  }
}
