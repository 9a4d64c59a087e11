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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.Random;
import java.util.stream.Stream;

import static io.tsdb.partition.keygen.PartitionKeyConstants.PARTITION_KEY_PART_MAX_LENGTH;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TestPartitionKeyEncoder {

  private static String repeat(char c, int n) {
    StringBuilder sb = new StringBuilder(n);
    for (int i = 0; i < n; i++) {
      sb.append(c);
    }
    return sb.toString();
  }

  private static String as(int n) {
    return repeat('A', n);
  }

  private static Stream<Arguments> encodingCases() {
    return Stream.of(
        Arguments.of("bananas", "bananas"),
        Arguments.of("plátanos", "pl%C3%A1tanos"),
        Arguments.of("", "^"),
        Arguments.of("|", "%7C"),
        Arguments.of("!", "%21"),
        Arguments.of("^", "%5E"),
        Arguments.of("#", "%23"),
        Arguments.of("%7C%21%257C", "%257C%2521%25257C"),
        Arguments.of("tab\there", "tab%09here"),
        Arguments.of("del\u007F", "del%7F"),
        Arguments.of("a/b c=d", "a/b c=d"),
        Arguments.of("🍌", "%F0%9F%8D%8C"));
  }

  @ParameterizedTest
  @MethodSource("encodingCases")
  public void testEncodeKeyPart(String value, String expected) {
    assertEquals(expected, PartitionKeyEncoder.encodeKeyPart(value));
  }

  private static Stream<Arguments> truncationCases() {
    String tamil = "நி";
    String tamilEncoded = "%E0%AE%A8%E0%AE%BF";
    String banana = "🍌";
    return Stream.of(
        Arguments.of(as(199), as(199)),
        Arguments.of(as(200), as(200)),
        Arguments.of(as(201), as(199) + "#"),
        Arguments.of(as(197) + "%", as(197) + "%25"),
        Arguments.of(as(198) + "%", as(198) + "#"),
        Arguments.of(as(199) + "%", as(199) + "#"),
        Arguments.of(as(194) + banana, as(194) + "#"),
        Arguments.of(as(195) + banana, as(195) + "#"),
        Arguments.of(as(196) + banana, as(196) + "#"),
        Arguments.of(as(181) + tamil + "bananas", as(181) + tamilEncoded + "#"),
        Arguments.of(as(182) + tamil, as(182) + tamilEncoded),
        Arguments.of(as(182) + tamil + "bananas", as(182) + "#"),
        Arguments.of(as(190) + tamil + "bananas", as(190) + "#"));
  }

  @ParameterizedTest
  @MethodSource("truncationCases")
  public void testTruncation(String value, String expected) {
    assertEquals(expected, PartitionKeyEncoder.encodeKeyPart(value));
  }

  @ParameterizedTest
  @ValueSource(ints = {183, 184, 185, 186, 187, 188, 189})
  public void testTruncationNeverSplitsGraphemeCluster(int prefix) {
    assertEquals(as(prefix) + "#", PartitionKeyEncoder.encodeKeyPart(as(prefix) + "நிbananas"));
  }

  @Test
  public void testEncodedPartsNeverContainReservedCharacters() {
    Random random = new Random(0x5EED);
    for (int i = 0; i < 500; i++) {
      StringBuilder sb = new StringBuilder();
      int len = random.nextInt(300);
      for (int j = 0; j < len; j++) {
        switch (random.nextInt(4)) {
          case 0:
            sb.append("|!^#%".charAt(random.nextInt(5)));
            break;
          case 1:
            sb.append((char) random.nextInt(0x20));
            break;
          case 2:
            sb.append((char) (0x00C0 + random.nextInt(0x100)));
            break;
          default:
            sb.append((char) ('a' + random.nextInt(26)));
        }
      }
      String encoded = PartitionKeyEncoder.encodeKeyPart(sb.toString());
      assertFalse(encoded.isEmpty());
      assertTrue(encoded.getBytes(StandardCharsets.UTF_8).length <= PARTITION_KEY_PART_MAX_LENGTH,
          () -> "encoded part too long: " + encoded);
      String body = encoded.endsWith("#") ? encoded.substring(0, encoded.length() - 1) : encoded;
      for (char c : body.toCharArray()) {
        assertTrue(c >= 0x20 && c < 0x7F, () -> "unexpected character in " + encoded);
        assertTrue("|!^#".indexOf(c) < 0 || body.equals("^"), () -> "reserved character in " + encoded);
      }
    }
  }
}
