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

import java.nio.charset.StandardCharsets;
import java.util.BitSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.tsdb.partition.keygen.PartitionKeyConstants.EMPTY_PARTITION_KEY_PLACEHOLDER;
import static io.tsdb.partition.keygen.PartitionKeyConstants.PARTITION_KEY_PART_MAX_LENGTH;
import static io.tsdb.partition.keygen.PartitionKeyConstants.PARTITION_KEY_PART_TRUNCATED;

/**
 * Escapes the values written into partition keys.
 *
 * <p>The UTF-8 bytes of a value are percent-encoded (uppercase hex) when they are control bytes,
 * non-ASCII bytes, or one of the reserved characters {@code | ! ^ # %}. The encoded form therefore
 * never contains a delimiter or a sentinel, and distinct values never encode to the same part.
 *
 * <p>Encoded parts longer than {@link PartitionKeyConstants#PARTITION_KEY_PART_MAX_LENGTH} bytes
 * are cut on a grapheme cluster boundary of the original value and marked with a trailing
 * {@code #}.
 */
public final class PartitionKeyEncoder {

  private static final BitSet CHARS_TO_ESCAPE = new BitSet(128);

  private static final Pattern GRAPHEME_CLUSTER = Pattern.compile("\\X");

  private static final char[] HEX_DIGITS = "0123456789ABCDEF".toCharArray();

  static {
    for (char c = 0; c < ' '; c++) {
      CHARS_TO_ESCAPE.set(c);
    }
    char[] reserved = new char[] {
        PartitionKeyConstants.PARTITION_KEY_DELIMITER,
        '!', '^', PARTITION_KEY_PART_TRUNCATED, '%', '\u007F'};
    for (char c : reserved) {
      CHARS_TO_ESCAPE.set(c);
    }
  }

  private PartitionKeyEncoder() {
  }

  /**
   * Encodes {@code value} as a single partition key part.
   */
  public static String encodeKeyPart(String value) {
    String encoded = encode(value);
    if (encoded.isEmpty()) {
      return EMPTY_PARTITION_KEY_PLACEHOLDER;
    }
    if (encoded.length() <= PARTITION_KEY_PART_MAX_LENGTH) {
      return encoded;
    }
    return truncate(value);
  }

  static boolean needsEscaping(int b) {
    return b < 0 || b >= 0x80 || CHARS_TO_ESCAPE.get(b);
  }

  private static String encode(String value) {
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    StringBuilder sb = null;
    for (int i = 0; i < bytes.length; i++) {
      int b = bytes[i];
      if (needsEscaping(b)) {
        if (sb == null) {
          sb = new StringBuilder(bytes.length * 3);
          for (int j = 0; j < i; j++) {
            sb.append((char) bytes[j]);
          }
        }
        sb.append('%').append(HEX_DIGITS[(b >> 4) & 0xF]).append(HEX_DIGITS[b & 0xF]);
      } else if (sb != null) {
        sb.append((char) b);
      }
    }
    // Nothing escaped means the value is plain ASCII already.
    return sb == null ? value : sb.toString();
  }

  private static String truncate(String value) {
    StringBuilder sb = new StringBuilder(PARTITION_KEY_PART_MAX_LENGTH);
    Matcher clusters = GRAPHEME_CLUSTER.matcher(value);
    while (clusters.find()) {
      String cluster = encode(clusters.group());
      if (sb.length() + cluster.length() >= PARTITION_KEY_PART_MAX_LENGTH) {
        break;
      }
      sb.append(cluster);
    }
    return sb.append(PARTITION_KEY_PART_TRUNCATED).toString();
  }
}
