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

import java.util.function.ToLongFunction;

/**
 * Numeric strftime fields with their natural width.
 */
enum Numeric {
  YEAR(4, Precision.DAY, t -> t.dateTime.getYear()),
  YEAR_DIV_100(2, Precision.DAY, t -> Math.floorDiv(t.dateTime.getYear(), 100)),
  YEAR_MOD_100(2, Precision.DAY, t -> Math.floorMod(t.dateTime.getYear(), 100)),
  ISO_YEAR(4, Precision.DAY, t -> t.dateTime.getWeekyear()),
  ISO_YEAR_MOD_100(2, Precision.DAY, t -> Math.floorMod(t.dateTime.getWeekyear(), 100)),
  MONTH(2, Precision.DAY, t -> t.dateTime.getMonthOfYear()),
  DAY(2, Precision.DAY, t -> t.dateTime.getDayOfMonth()),
  WEEK_FROM_SUN(2, Precision.DAY, t -> (t.dateTime.getDayOfYear() - t.daysFromSunday() + 6) / 7),
  WEEK_FROM_MON(2, Precision.DAY, t -> (t.dateTime.getDayOfYear() - (t.dateTime.getDayOfWeek() - 1) + 6) / 7),
  ISO_WEEK(2, Precision.DAY, t -> t.dateTime.getWeekOfWeekyear()),
  DAYS_FROM_SUN(1, Precision.DAY, TimeFields::daysFromSunday),
  WEEKDAY_FROM_MON(1, Precision.DAY, t -> t.dateTime.getDayOfWeek()),
  ORDINAL(3, Precision.DAY, t -> t.dateTime.getDayOfYear()),
  HOUR(2, Precision.HOUR, t -> t.dateTime.getHourOfDay()),
  HOUR12(2, Precision.HOUR, TimeFields::hour12),
  MINUTE(2, Precision.MINUTE, t -> t.dateTime.getMinuteOfHour()),
  SECOND(2, Precision.SECOND, t -> t.dateTime.getSecondOfMinute()),
  NANOSECOND(9, Precision.NANO, t -> t.nanoOfSecond),
  TIMESTAMP(1, Precision.SECOND, t -> t.epochSecond);

  private final int width;
  private final Precision precision;
  private final ToLongFunction<TimeFields> extractor;

  Numeric(int width, Precision precision, ToLongFunction<TimeFields> extractor) {
    this.width = width;
    this.precision = precision;
    this.extractor = extractor;
  }

  int width() {
    return width;
  }

  Precision precision() {
    return precision;
  }

  long value(TimeFields time) {
    return extractor.applyAsLong(time);
  }
}
