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

package io.tsdb.partition.strftime;

/**
 * Granularity at which a formatted timestamp may change.
 */
enum Precision {
  DAY(86_400L * TimeFields.NANOS_PER_SECOND),
  HOUR(3_600L * TimeFields.NANOS_PER_SECOND),
  MINUTE(60L * TimeFields.NANOS_PER_SECOND),
  SECOND(TimeFields.NANOS_PER_SECOND),
  MILLI(TimeFields.NANOS_PER_MILLI),
  MICRO(1_000L),
  NANO(1L);

  private final long nanos;

  Precision(long nanos) {
    this.nanos = nanos;
  }

  long nanos() {
    return nanos;
  }

  static Precision finest(Precision a, Precision b) {
    if (a == null) {
      return b;
    }
    if (b == null) {
      return a;
    }
    return a.nanos <= b.nanos ? a : b;
  }
}
