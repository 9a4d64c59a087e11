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

package io.tsdb.common.util;

import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TestOption {

  @Test
  public void testEmptyAndPresent() {
    Option<String> empty = Option.empty();
    assertTrue(empty.isEmpty());
    assertFalse(empty.isPresent());
    assertThrows(NoSuchElementException.class, empty::get);
    assertSame(empty, Option.ofNullable(null));

    Option<String> value = Option.of("west");
    assertTrue(value.isPresent());
    assertEquals("west", value.get());
    assertThrows(NullPointerException.class, () -> Option.of(null));
  }

  @Test
  public void testTransformations() {
    Option<String> value = Option.of("west");
    assertEquals(Option.of(4), value.map(String::length));
    assertEquals(Option.empty(), value.map(v -> null));
    assertEquals(Option.empty(), value.filter(v -> v.startsWith("e")));
    assertEquals(Option.of("WEST"), value.flatMap(v -> Option.of(v.toUpperCase())));
    assertEquals("east", Option.<String>empty().orElse("east"));
    assertEquals("east", Option.<String>empty().orElseGet(() -> "east"));
    assertThrows(IllegalStateException.class, () -> Option.empty().orElseThrow(IllegalStateException::new));

    AtomicInteger calls = new AtomicInteger();
    value.ifPresent(v -> calls.incrementAndGet());
    Option.empty().ifPresent(v -> calls.incrementAndGet());
    assertEquals(1, calls.get());
  }

  @Test
  public void testJavaOptionalConversion() {
    assertEquals(Optional.of(1), Option.of(1).toJavaOptional());
    assertEquals(Option.empty(), Option.fromJavaOptional(Optional.empty()));
    assertEquals(Option.of(1), Option.fromJavaOptional(Optional.of(1)));
  }

  @Test
  public void testValidationUtils() {
    ValidationUtils.checkArgument(true, "unused");
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> ValidationUtils.checkArgument(false, "bad argument"));
    assertEquals("bad argument", e.getMessage());
    assertThrows(IllegalStateException.class, () -> ValidationUtils.checkState(false, "bad state"));
  }
}
