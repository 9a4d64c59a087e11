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

import java.util.Locale;

/**
 * Fixed-form strftime items: names, zone offsets, fractions and RFC 3339.
 *
 * <p>Timestamps are always rendered in UTC, so zone items render constant text.
 */
enum Fixed implements StrftimeItem {

  SHORT_MONTH_NAME(Precision.DAY) {
    @Override
    public void format(TimeFields time, StringBuilder out) {
      out.append(time.dateTime.monthOfYear().getAsShortText(Locale.ENGLISH));
    }
  },
  LONG_MONTH_NAME(Precision.DAY) {
    @Override
    public void format(TimeFields time, StringBuilder out) {
      out.append(time.dateTime.monthOfYear().getAsText(Locale.ENGLISH));
    }
  },
  SHORT_WEEKDAY_NAME(Precision.DAY) {
    @Override
    public void format(TimeFields time, StringBuilder out) {
      out.append(time.dateTime.dayOfWeek().getAsShortText(Locale.ENGLISH));
    }
  },
  LONG_WEEKDAY_NAME(Precision.DAY) {
    @Override
    public void format(TimeFields time, StringBuilder out) {
      out.append(time.dateTime.dayOfWeek().getAsText(Locale.ENGLISH));
    }
  },
  LOWER_AMPM(Precision.HOUR) {
    @Override
    public void format(TimeFields time, StringBuilder out) {
      out.append(time.dateTime.getHourOfDay() < 12 ? "am" : "pm");
    }
  },
  UPPER_AMPM(Precision.HOUR) {
    @Override
    public void format(TimeFields time, StringBuilder out) {
      out.append(time.dateTime.getHourOfDay() < 12 ? "AM" : "PM");
    }
  },
  TIMEZONE_NAME(null) {
    @Override
    public void format(TimeFields time, StringBuilder out) {
      out.append("UTC");
    }
  },
  TIMEZONE_OFFSET(null) {
    @Override
    public void format(TimeFields time, StringBuilder out) {
      out.append("+0000");
    }
  },
  TIMEZONE_OFFSET_COLON(null) {
    @Override
    public void format(TimeFields time, StringBuilder out) {
      out.append("+00:00");
    }
  },
  TIMEZONE_OFFSET_DOUBLE_COLON(null) {
    @Override
    public void format(TimeFields time, StringBuilder out) {
      out.append("+00:00:00");
    }
  },
  TIMEZONE_OFFSET_TRIPLE_COLON(null) {
    @Override
    public void format(TimeFields time, StringBuilder out) {
      out.append("+00");
    }
  },
  /**
   * {@code %.f}: a dot and as many digits (3, 6 or 9) as the fraction needs, nothing for whole seconds.
   */
  NANOSECOND(Precision.NANO) {
    @Override
    public void format(TimeFields time, StringBuilder out) {
      appendAutoFraction(time.nanoOfSecond, out);
    }
  },
  NANOSECOND_3(Precision.MILLI) {
    @Override
    public void format(TimeFields time, StringBuilder out) {
      out.append('.');
      NumericItem.appendPadded(out, time.nanoOfSecond / 1_000_000, 3, Pad.ZERO);
    }
  },
  NANOSECOND_6(Precision.MICRO) {
    @Override
    public void format(TimeFields time, StringBuilder out) {
      out.append('.');
      NumericItem.appendPadded(out, time.nanoOfSecond / 1_000, 6, Pad.ZERO);
    }
  },
  NANOSECOND_9(Precision.NANO) {
    @Override
    public void format(TimeFields time, StringBuilder out) {
      out.append('.');
      NumericItem.appendPadded(out, time.nanoOfSecond, 9, Pad.ZERO);
    }
  },
  NANOSECOND_3_NO_DOT(Precision.MILLI) {
    @Override
    public void format(TimeFields time, StringBuilder out) {
      NumericItem.appendPadded(out, time.nanoOfSecond / 1_000_000, 3, Pad.ZERO);
    }
  },
  NANOSECOND_6_NO_DOT(Precision.MICRO) {
    @Override
    public void format(TimeFields time, StringBuilder out) {
      NumericItem.appendPadded(out, time.nanoOfSecond / 1_000, 6, Pad.ZERO);
    }
  },
  NANOSECOND_9_NO_DOT(Precision.NANO) {
    @Override
    public void format(TimeFields time, StringBuilder out) {
      NumericItem.appendPadded(out, time.nanoOfSecond, 9, Pad.ZERO);
    }
  },
  /**
   * {@code %+}: {@code 2001-07-08T00:34:60.026490+00:00}.
   */
  RFC3339(Precision.NANO) {
    @Override
    public void format(TimeFields time, StringBuilder out) {
      new NumericItem(Numeric.YEAR, Pad.ZERO).format(time, out);
      out.append('-');
      NumericItem.appendPadded(out, time.dateTime.getMonthOfYear(), 2, Pad.ZERO);
      out.append('-');
      NumericItem.appendPadded(out, time.dateTime.getDayOfMonth(), 2, Pad.ZERO);
      out.append('T');
      NumericItem.appendPadded(out, time.dateTime.getHourOfDay(), 2, Pad.ZERO);
      out.append(':');
      NumericItem.appendPadded(out, time.dateTime.getMinuteOfHour(), 2, Pad.ZERO);
      out.append(':');
      NumericItem.appendPadded(out, time.dateTime.getSecondOfMinute(), 2, Pad.ZERO);
      appendAutoFraction(time.nanoOfSecond, out);
      out.append("+00:00");
    }
  };

  private final Precision precision;

  Fixed(Precision precision) {
    this.precision = precision;
  }

  @Override
  public Precision precision() {
    return precision;
  }

  private static void appendAutoFraction(int nanos, StringBuilder out) {
    if (nanos == 0) {
      return;
    }
    out.append('.');
    if (nanos % 1_000_000 == 0) {
      NumericItem.appendPadded(out, nanos / 1_000_000, 3, Pad.ZERO);
    } else if (nanos % 1_000 == 0) {
      NumericItem.appendPadded(out, nanos / 1_000, 6, Pad.ZERO);
    } else {
      NumericItem.appendPadded(out, nanos, 9, Pad.ZERO);
    }
  }
}
