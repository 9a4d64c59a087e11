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
 * A numeric field rendered with the given padding.
 */
final class NumericItem implements StrftimeItem {

  private final Numeric field;
  private final Pad pad;

  NumericItem(Numeric field, Pad pad) {
    this.field = field;
    this.pad = pad;
  }

  @Override
  public void format(TimeFields time, StringBuilder out) {
    long value = field.value(time);
    if ((field == Numeric.YEAR || field == Numeric.ISO_YEAR) && (value < 0 || value > 9999)) {
      // Years outside of four digits always carry their sign.
      out.append(value < 0 ? '-' : '+');
      appendPadded(out, Math.abs(value), field.width(), Pad.ZERO);
    } else {
      appendPadded(out, value, field.width(), pad);
    }
  }

  @Override
  public Precision precision() {
    return field.precision();
  }

  static void appendPadded(StringBuilder out, long value, int width, Pad pad) {
    String digits = Long.toString(Math.abs(value));
    int fill = width - digits.length() - (value < 0 ? 1 : 0);
    if (pad == Pad.SPACE) {
      for (int i = 0; i < fill; i++) {
        out.append(' ');
      }
    }
    if (value < 0) {
      out.append('-');
    }
    if (pad == Pad.ZERO) {
      for (int i = 0; i < fill; i++) {
        out.append('0');
      }
    }
    out.append(digits);
  }

  @Override
  public String toString() {
    return "Numeric(" + field + ", " + pad + ")";
  }
}
