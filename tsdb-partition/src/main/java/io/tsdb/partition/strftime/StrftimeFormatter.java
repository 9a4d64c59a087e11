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

import io.tsdb.exception.InvalidStrftimeException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

/**
 * Renders nanosecond timestamps with a strftime format, in UTC.
 *
 * <p>The format is parsed once. A malformed format does not fail construction: every call to
 * {@link #render} raises {@link InvalidStrftimeException} instead, so that the error is reported
 * against each row it affects.
 *
 * <p>The formatter remembers the last timestamp it rendered. {@link #equalsLast} tells whether
 * another timestamp would render to the same text, by comparing both at the finest time unit the
 * format observes.
 *
 * <p>Not thread-safe.
 */
public class StrftimeFormatter {

  private static final Logger LOG = LoggerFactory.getLogger(StrftimeFormatter.class);

  private final String format;
  private final List<StrftimeItem> items;
  private final boolean valid;
  /**
   * Nanos per observed time unit, 0 if the rendered text does not depend on the time.
   */
  private final long precisionNanos;

  private boolean rendered;
  private long lastTimestamp;

  public StrftimeFormatter(String format) {
    this.format = format;
    List<StrftimeItem> parsed;
    boolean ok;
    try {
      parsed = StrftimeParser.parse(format);
      ok = true;
    } catch (IllegalArgumentException e) {
      LOG.warn("Invalid strftime format in partition template: " + e.getMessage());
      parsed = Collections.emptyList();
      ok = false;
    }
    this.items = parsed;
    this.valid = ok;

    Precision precision = null;
    for (StrftimeItem item : items) {
      precision = Precision.finest(precision, item.precision());
    }
    this.precisionNanos = precision == null ? 0 : precision.nanos();
  }

  public String getFormat() {
    return format;
  }

  public boolean isValid() {
    return valid;
  }

  /**
   * Appends {@code timestamp}, in nanoseconds since the epoch, formatted to {@code out}.
   *
   * @throws InvalidStrftimeException if the format could not be parsed
   */
  public void render(long timestamp, StringBuilder out) {
    if (!valid) {
      throw new InvalidStrftimeException();
    }
    TimeFields time = new TimeFields(timestamp);
    for (StrftimeItem item : items) {
      item.format(time, out);
    }
    rendered = true;
    lastTimestamp = timestamp;
  }

  public String render(long timestamp) {
    StringBuilder sb = new StringBuilder();
    render(timestamp, sb);
    return sb.toString();
  }

  /**
   * Returns true if {@code timestamp} renders to the same text as the last rendered timestamp.
   * Always false before the first successful render.
   */
  public boolean equalsLast(long timestamp) {
    if (!rendered) {
      return false;
    }
    if (precisionNanos == 0) {
      return true;
    }
    return Math.floorDiv(timestamp, precisionNanos) == Math.floorDiv(lastTimestamp, precisionNanos);
  }

  @Override
  public String toString() {
    return "StrftimeFormatter{" + format + '}';
  }
}
