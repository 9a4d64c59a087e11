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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Parses strftime formats into {@link StrftimeItem}s.
 *
 * <p>Numeric directives accept the padding modifiers {@code %-x} (no padding), {@code %_x} (spaces)
 * and {@code %0x} (zeros); any other directive preceded by a modifier is rejected.
 */
final class StrftimeParser {

  private StrftimeParser() {
  }

  /**
   * Parses {@code format}.
   *
   * @throws IllegalArgumentException describing the first malformed directive
   */
  static List<StrftimeItem> parse(String format) {
    List<StrftimeItem> items = new ArrayList<>();
    StringBuilder literal = new StringBuilder();
    int i = 0;
    while (i < format.length()) {
      char c = format.charAt(i++);
      if (c != '%') {
        literal.append(c);
        continue;
      }
      if (i >= format.length()) {
        throw new IllegalArgumentException("Trailing '%' in \"" + format + "\"");
      }

      Pad pad = null;
      char spec = format.charAt(i++);
      if (spec == '-' || spec == '_' || spec == '0') {
        pad = spec == '-' ? Pad.NONE : spec == '_' ? Pad.SPACE : Pad.ZERO;
        if (i >= format.length()) {
          throw new IllegalArgumentException("Trailing padding modifier in \"" + format + "\"");
        }
        spec = format.charAt(i++);
      }

      NumericItem numeric = numeric(spec, pad);
      if (numeric != null) {
        flush(literal, items);
        items.add(numeric);
        continue;
      }
      if (pad != null) {
        throw new IllegalArgumentException("Padding modifier on non-numeric directive %" + spec
            + " in \"" + format + "\"");
      }

      List<StrftimeItem> expanded;
      switch (spec) {
        case '%':
          literal.append('%');
          continue;
        case 't':
          literal.append('\t');
          continue;
        case 'n':
          literal.append('\n');
          continue;
        case ':': {
          int colons = 1;
          while (i < format.length() && format.charAt(i) == ':' && colons < 3) {
            colons++;
            i++;
          }
          if (i >= format.length() || format.charAt(i) != 'z') {
            throw new IllegalArgumentException("Invalid timezone directive in \"" + format + "\"");
          }
          i++;
          expanded = Collections.singletonList(colons == 1 ? Fixed.TIMEZONE_OFFSET_COLON
              : colons == 2 ? Fixed.TIMEZONE_OFFSET_DOUBLE_COLON : Fixed.TIMEZONE_OFFSET_TRIPLE_COLON);
          break;
        }
        case '.': {
          Fixed fraction = null;
          if (i < format.length() && format.charAt(i) == 'f') {
            fraction = Fixed.NANOSECOND;
            i += 1;
          } else if (i + 1 < format.length() && format.charAt(i + 1) == 'f') {
            fraction = fraction(format.charAt(i), Fixed.NANOSECOND_3, Fixed.NANOSECOND_6, Fixed.NANOSECOND_9);
            i += 2;
          }
          if (fraction == null) {
            throw new IllegalArgumentException("Invalid fraction directive in \"" + format + "\"");
          }
          expanded = Collections.singletonList(fraction);
          break;
        }
        case '3':
        case '6':
        case '9': {
          if (i >= format.length() || format.charAt(i) != 'f') {
            throw new IllegalArgumentException("Invalid fraction directive in \"" + format + "\"");
          }
          i++;
          expanded = Collections.singletonList(
              fraction(spec, Fixed.NANOSECOND_3_NO_DOT, Fixed.NANOSECOND_6_NO_DOT, Fixed.NANOSECOND_9_NO_DOT));
          break;
        }
        default:
          expanded = fixedOrComposite(spec);
          if (expanded == null) {
            throw new IllegalArgumentException("Unsupported directive %" + spec + " in \"" + format + "\"");
          }
      }
      flush(literal, items);
      items.addAll(expanded);
    }
    flush(literal, items);
    return items;
  }

  private static NumericItem numeric(char spec, Pad pad) {
    switch (spec) {
      case 'Y':
        return item(Numeric.YEAR, pad, Pad.ZERO);
      case 'C':
        return item(Numeric.YEAR_DIV_100, pad, Pad.ZERO);
      case 'y':
        return item(Numeric.YEAR_MOD_100, pad, Pad.ZERO);
      case 'G':
        return item(Numeric.ISO_YEAR, pad, Pad.ZERO);
      case 'g':
        return item(Numeric.ISO_YEAR_MOD_100, pad, Pad.ZERO);
      case 'm':
        return item(Numeric.MONTH, pad, Pad.ZERO);
      case 'd':
        return item(Numeric.DAY, pad, Pad.ZERO);
      case 'e':
        return item(Numeric.DAY, pad, Pad.SPACE);
      case 'U':
        return item(Numeric.WEEK_FROM_SUN, pad, Pad.ZERO);
      case 'W':
        return item(Numeric.WEEK_FROM_MON, pad, Pad.ZERO);
      case 'V':
        return item(Numeric.ISO_WEEK, pad, Pad.ZERO);
      case 'w':
        return item(Numeric.DAYS_FROM_SUN, pad, Pad.NONE);
      case 'u':
        return item(Numeric.WEEKDAY_FROM_MON, pad, Pad.NONE);
      case 'j':
        return item(Numeric.ORDINAL, pad, Pad.ZERO);
      case 'H':
        return item(Numeric.HOUR, pad, Pad.ZERO);
      case 'k':
        return item(Numeric.HOUR, pad, Pad.SPACE);
      case 'I':
        return item(Numeric.HOUR12, pad, Pad.ZERO);
      case 'l':
        return item(Numeric.HOUR12, pad, Pad.SPACE);
      case 'M':
        return item(Numeric.MINUTE, pad, Pad.ZERO);
      case 'S':
        return item(Numeric.SECOND, pad, Pad.ZERO);
      case 'f':
        return item(Numeric.NANOSECOND, pad, Pad.ZERO);
      case 's':
        return item(Numeric.TIMESTAMP, pad, Pad.NONE);
      default:
        return null;
    }
  }

  private static NumericItem item(Numeric field, Pad pad, Pad defaultPad) {
    return new NumericItem(field, pad == null ? defaultPad : pad);
  }

  private static List<StrftimeItem> fixedOrComposite(char spec) {
    switch (spec) {
      case 'b':
      case 'h':
        return Collections.singletonList(Fixed.SHORT_MONTH_NAME);
      case 'B':
        return Collections.singletonList(Fixed.LONG_MONTH_NAME);
      case 'a':
        return Collections.singletonList(Fixed.SHORT_WEEKDAY_NAME);
      case 'A':
        return Collections.singletonList(Fixed.LONG_WEEKDAY_NAME);
      case 'p':
        return Collections.singletonList(Fixed.UPPER_AMPM);
      case 'P':
        return Collections.singletonList(Fixed.LOWER_AMPM);
      case 'Z':
        return Collections.singletonList(Fixed.TIMEZONE_NAME);
      case 'z':
        return Collections.singletonList(Fixed.TIMEZONE_OFFSET);
      case '+':
        return Collections.singletonList(Fixed.RFC3339);
      case 'D':
      case 'x':
        return Arrays.asList(item(Numeric.MONTH, null, Pad.ZERO), new Literal("/"),
            item(Numeric.DAY, null, Pad.ZERO), new Literal("/"), item(Numeric.YEAR_MOD_100, null, Pad.ZERO));
      case 'F':
        return Arrays.asList(item(Numeric.YEAR, null, Pad.ZERO), new Literal("-"),
            item(Numeric.MONTH, null, Pad.ZERO), new Literal("-"), item(Numeric.DAY, null, Pad.ZERO));
      case 'v':
        return Arrays.asList(item(Numeric.DAY, null, Pad.SPACE), new Literal("-"),
            Fixed.SHORT_MONTH_NAME, new Literal("-"), item(Numeric.YEAR, null, Pad.ZERO));
      case 'R':
        return Arrays.asList(item(Numeric.HOUR, null, Pad.ZERO), new Literal(":"),
            item(Numeric.MINUTE, null, Pad.ZERO));
      case 'T':
      case 'X':
        return Arrays.asList(item(Numeric.HOUR, null, Pad.ZERO), new Literal(":"),
            item(Numeric.MINUTE, null, Pad.ZERO), new Literal(":"), item(Numeric.SECOND, null, Pad.ZERO));
      case 'r':
        return Arrays.asList(item(Numeric.HOUR12, null, Pad.ZERO), new Literal(":"),
            item(Numeric.MINUTE, null, Pad.ZERO), new Literal(":"), item(Numeric.SECOND, null, Pad.ZERO),
            new Literal(" "), Fixed.UPPER_AMPM);
      case 'c':
        return Arrays.asList(Fixed.SHORT_WEEKDAY_NAME, new Literal(" "), Fixed.SHORT_MONTH_NAME,
            new Literal(" "), item(Numeric.DAY, null, Pad.SPACE), new Literal(" "),
            item(Numeric.HOUR, null, Pad.ZERO), new Literal(":"), item(Numeric.MINUTE, null, Pad.ZERO),
            new Literal(":"), item(Numeric.SECOND, null, Pad.ZERO), new Literal(" "),
            item(Numeric.YEAR, null, Pad.ZERO));
      default:
        // %#z and friends only make sense when parsing timestamps.
        return null;
    }
  }

  private static Fixed fraction(char digits, Fixed three, Fixed six, Fixed nine) {
    switch (digits) {
      case '3':
        return three;
      case '6':
        return six;
      case '9':
        return nine;
      default:
        return null;
    }
  }

  private static void flush(StringBuilder literal, List<StrftimeItem> items) {
    if (literal.length() > 0) {
      items.add(new Literal(literal.toString()));
      literal.setLength(0);
    }
  }
}
