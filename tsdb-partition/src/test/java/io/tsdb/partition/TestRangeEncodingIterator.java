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

package io.tsdb.partition;

import io.tsdb.common.util.Option;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class TestRangeEncodingIterator {

  private static <T> List<ValueRange<T>> encode(List<Option<T>> values) {
    List<ValueRange<T>> result = new ArrayList<>();
    new RangeEncodingIterator<>(values.iterator()).forEachRemaining(result::add);
    return result;
  }

  private static List<Option<Integer>> present(Integer... values) {
    return Arrays.stream(values).map(Option::of).collect(Collectors.toList());
  }

  @Test
  public void testEncode() {
    assertEquals(
        Arrays.asList(ValueRange.of(5, 0, 3), ValueRange.of(7, 3, 4), ValueRange.of(2, 4, 6), ValueRange.of(3, 6, 7)),
        encode(present(5, 5, 5, 7, 2, 2, 3)));
  }

  @Test
  public void testEncodeSparse() {
    List<Option<Integer>> sparse = Arrays.asList(
        Option.of(5), Option.empty(), Option.empty(), Option.of(7), Option.of(2), Option.empty(), Option.of(3));
    assertEquals(
        Arrays.asList(ValueRange.of(5, 0, 3), ValueRange.of(7, 3, 4), ValueRange.of(2, 4, 6), ValueRange.of(3, 6, 7)),
        encode(sparse));
  }

  @Test
  public void testEncodeEmptyAndSingle() {
    assertEquals(Collections.emptyList(), encode(Collections.<Option<Integer>>emptyList()));
    assertEquals(Collections.singletonList(ValueRange.of(1, 0, 1)), encode(present(1)));
  }

  @Test
  public void testRepeatedValueAfterOthersStartsNewRange() {
    assertEquals(
        Arrays.asList(ValueRange.of("a", 0, 1), ValueRange.of("b", 1, 2), ValueRange.of("a", 2, 4)),
        encode(Arrays.asList(Option.of("a"), Option.of("b"), Option.of("a"), Option.<String>empty())));
  }

  @Test
  public void testLeadingEmptyElementRejected() {
    List<Option<Integer>> values = Arrays.asList(Option.empty(), Option.of(1));
    assertThrows(IllegalStateException.class, () -> encode(values));
  }

  @Test
  public void testExhaustion() {
    Iterator<ValueRange<Integer>> it = new RangeEncodingIterator<>(present(1, 1).iterator());
    assertEquals(ValueRange.of(1, 0, 2), it.next());
    assertFalse(it.hasNext());
    assertFalse(it.hasNext());
    assertThrows(NoSuchElementException.class, it::next);
  }

  @Test
  public void testEncodeRandomized() {
    Random random = new Random(42);
    List<Integer> original = new ArrayList<>();
    for (int i = 0; i < 1000; i++) {
      original.add(random.nextInt(20));
    }

    List<ValueRange<Integer>> ranges = encode(original.stream().map(Option::of).collect(Collectors.toList()));

    assertEquals(0, ranges.get(0).getRange().start());
    for (int i = 1; i < ranges.size(); i++) {
      assertEquals(ranges.get(i - 1).getRange().end(), ranges.get(i).getRange().start());
      assertNotEquals(ranges.get(i - 1).getValue(), ranges.get(i).getValue());
      assertFalse(ranges.get(i).getRange().isEmpty());
    }

    List<Integer> hydrated = new ArrayList<>();
    for (ValueRange<Integer> range : ranges) {
      for (int i = 0; i < range.getRange().length(); i++) {
        hydrated.add(range.getValue());
      }
    }
    assertEquals(original, hydrated);
  }
}
