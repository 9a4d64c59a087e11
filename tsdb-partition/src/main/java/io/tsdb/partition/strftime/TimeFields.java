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

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;

/**
 * The calendar fields of a nanosecond timestamp, in UTC.
 */
final class TimeFields {

  static final long NANOS_PER_MILLI = 1_000_000L;
  static final long NANOS_PER_SECOND = 1_000_000_000L;

  final DateTime dateTime;
  final long epochSecond;
  final int nanoOfSecond;

  TimeFields(long epochNanos) {
    this.dateTime = new DateTime(Math.floorDiv(epochNanos, NANOS_PER_MILLI), DateTimeZone.UTC);
    this.epochSecond = Math.floorDiv(epochNanos, NANOS_PER_SECOND);
    this.nanoOfSecond = (int) Math.floorMod(epochNanos, NANOS_PER_SECOND);
  }

  int hour12() {
    int hour = dateTime.getHourOfDay() % 12;
    return hour == 0 ? 12 : hour;
  }

  /**
   * Day of week numbered from Sunday = 0.
   */
  int daysFromSunday() {
    return dateTime.getDayOfWeek() % 7;
  }
}
