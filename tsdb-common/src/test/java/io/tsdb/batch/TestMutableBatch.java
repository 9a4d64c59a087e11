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

package io.tsdb.batch;

import io.tsdb.exception.TimeColumnNotFoundException;
import io.tsdb.exception.TsdbException;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TestMutableBatch {

  private static MutableBatch sampleBatch() {
    MutableBatch batch = new MutableBatch();
    batch.writer(5)
        .writeTime("time", 1, 2, 3, 4, 5)
        .writeTag("region", new byte[] {0b00001010}, "west", "east")
        .writeI64("count", new byte[] {0b00010001}, 10, 50)
        .writeF64("load", null, 0.1, 0.2, 0.3, 0.4, 0.5)
        .writeBool("up", new byte[] {0b00000100}, true)
        .writeString("note", new byte[] {0b00000001}, "first")
        .commit();
    return batch;
  }

  @Test
  public void testWriteAndRead() {
    MutableBatch batch = sampleBatch();
    assertEquals(5, batch.numRows());
    assertArrayEquals(new long[] {1, 2, 3, 4, 5}, batch.timeColumn());

    MutableColumn region = batch.getColumn("region").get();
    assertFalse(region.isValid(0));
    assertEquals("west", region.getString(1));
    assertNull(region.getString(2));
    assertEquals("east", region.getString(3));
    assertEquals("tag", region.typeDescription());

    MutableColumn count = batch.getColumn("count").get();
    assertTrue(count.isValid(0));
    assertEquals(10, count.getLong(0));
    assertEquals(50, count.getLong(4));
    assertFalse(count.isValid(2));

    assertEquals(0.3, batch.getColumn("load").get().getDouble(2));
    assertTrue(batch.getColumn("up").get().getBoolean(2));
    assertFalse(batch.getColumn("up").get().isValid(1));
    assertEquals("first", batch.getColumn("note").get().getString(0));
    assertTrue(batch.column("missing").isEmpty());
  }

  @Test
  public void testTagIdentityKeys() {
    MutableBatch batch = new MutableBatch();
    batch.writer(4)
        .writeTime("time", 1, 2, 3, 4)
        .writeTag("host", new byte[] {0b00001011}, "a", "b", "a")
        .writeString("label", null, "a", "b", "c", "d")
        .commit();

    MutableColumn host = batch.getColumn("host").get();
    Integer first = host.getTagIdentityKey(0);
    assertNotNull(first);
    assertEquals(first, host.getTagIdentityKey(3));
    assertFalse(first.equals(host.getTagIdentityKey(1)));
    assertNull(host.getTagIdentityKey(2));
    assertEquals("a", host.getTagValue(first));

    // Non-tag columns expose no identity key.
    MutableColumn label = batch.getColumn("label").get();
    assertNull(label.getTagIdentityKey(0));
    assertNull(label.getTagValue(0));
    assertEquals("string", label.typeDescription());
  }

  @Test
  public void testMissingTimeColumn() {
    MutableBatch batch = new MutableBatch();
    batch.writer(1).writeTag("region", null, "west").commit();
    assertThrows(TimeColumnNotFoundException.class, batch::timeColumn);

    // A column named time that is not a timestamp column is not the time column.
    MutableBatch wrongType = new MutableBatch();
    wrongType.writer(1).writeI64("time", null, 1).commit();
    assertThrows(TimeColumnNotFoundException.class, wrongType::timeColumn);
  }

  @Test
  public void testUncommittedWriterLeavesBatchUntouched() {
    MutableBatch batch = sampleBatch();
    batch.writer(2).writeTime("time", 6, 7).writeTag("region", null, "north", "south");
    assertEquals(5, batch.numRows());
    assertArrayEquals(new long[] {1, 2, 3, 4, 5}, batch.timeColumn());
  }

  @Test
  public void testCommitPadsAbsentColumns() {
    MutableBatch batch = sampleBatch();
    batch.writer(2).writeTime("time", 6, 7).writeTag("host", null, "h1", "h2").commit();

    assertEquals(7, batch.numRows());
    assertArrayEquals(new long[] {1, 2, 3, 4, 5, 6, 7}, batch.timeColumn());
    MutableColumn host = batch.getColumn("host").get();
    assertEquals(7, host.length());
    for (int i = 0; i < 5; i++) {
      assertFalse(host.isValid(i));
    }
    assertEquals("h2", host.getString(6));
    MutableColumn region = batch.getColumn("region").get();
    assertEquals(7, region.length());
    assertFalse(region.isValid(5));
    assertFalse(region.isValid(6));
  }

  @Test
  public void testWriterValidation() {
    MutableBatch batch = new MutableBatch();
    assertThrows(IllegalArgumentException.class, () -> batch.writer(3).writeTime("time", 1, 2));
    assertThrows(TsdbException.class, () -> batch.writer(3).writeTag("region", new byte[] {0b00000111}, "a", "b"));
    assertThrows(TsdbException.class, () -> batch.writer(3).writeTag("region", new byte[] {0b00000001}, "a", "b"));
    assertThrows(TsdbException.class, () -> batch.writer(1).writeTag("region", null, "a").writeTag("region", null, "b"));

    BatchWriter writer = batch.writer(1).writeTime("time", 1);
    writer.commit();
    assertThrows(IllegalStateException.class, writer::commit);

    // The type of an existing column is fixed.
    assertThrows(TsdbException.class, () -> batch.writer(1).writeString("time", null, "x"));
  }

  @Test
  public void testExtendFromRanges() {
    MutableBatch source = sampleBatch();
    MutableBatch dest = new MutableBatch();
    dest.writer(1).writeTime("time", 100).writeTag("other", null, "x").commit();

    dest.extendFromRanges(source, Arrays.asList(RowRange.of(0, 2), RowRange.of(3, 5)));

    assertEquals(5, dest.numRows());
    assertArrayEquals(new long[] {100, 1, 2, 4, 5}, dest.timeColumn());
    MutableColumn region = dest.getColumn("region").get();
    assertFalse(region.isValid(0));
    assertFalse(region.isValid(1));
    assertEquals("west", region.getString(2));
    assertEquals("east", region.getString(3));
    assertFalse(region.isValid(4));
    MutableColumn other = dest.getColumn("other").get();
    assertEquals("x", other.getString(0));
    assertFalse(other.isValid(1));
    assertEquals(5, other.length());
    assertEquals(50, dest.getColumn("count").get().getLong(4));
  }

  @Test
  public void testExtendFromEmptyRanges() {
    MutableBatch source = sampleBatch();
    MutableBatch dest = new MutableBatch();
    dest.extendFromRanges(source, Collections.emptyList());
    assertEquals(0, dest.numRows());
    assertEquals(0, dest.timeColumn().length);
  }

  @Test
  public void testExtendRejectsTypeConflictWithoutPartialWrite() {
    MutableBatch dest = new MutableBatch();
    dest.writer(1).writeTime("time", 100).writeString("region", null, "west").commit();
    MutableBatch source = new MutableBatch();
    source.writer(2).writeTime("time", 1, 2).writeTag("region", null, "east", "north").commit();

    assertThrows(TsdbException.class,
        () -> dest.extendFromRanges(source, Collections.singletonList(RowRange.of(0, 2))));

    // The time column precedes the conflicting column but must not have been extended.
    assertEquals(1, dest.numRows());
    assertArrayEquals(new long[] {100}, dest.timeColumn());
    assertEquals(1, dest.getColumn("region").get().length());
    assertEquals("west", dest.getColumn("region").get().getString(0));

    // The batch stays usable after the rejected extend.
    dest.writer(1).writeTime("time", 101).writeString("region", null, "south").commit();
    assertEquals(2, dest.numRows());
    assertArrayEquals(new long[] {100, 101}, dest.timeColumn());
  }

  @Test
  public void testExtendRejectsOutOfBoundsRange() {
    MutableBatch source = sampleBatch();
    assertThrows(IllegalArgumentException.class,
        () -> new MutableBatch().extendFromRanges(source, Collections.singletonList(RowRange.of(3, 6))));
  }

  @Test
  public void testTimeColumnIsDetachedFromBatch() {
    MutableBatch batch = new MutableBatch();
    batch.writer(2).writeTime("time", 1, 2).commit();
    long[] first = batch.timeColumn();
    first[0] = 99;
    assertArrayEquals(new long[] {1, 2}, batch.timeColumn());

    batch.writer(1).writeTime("time", 3).commit();
    assertArrayEquals(new long[] {1, 2, 3}, batch.timeColumn());
    assertArrayEquals(new long[] {99, 2}, first);
  }

  @Test
  public void testRowRange() {
    RowRange range = RowRange.of(2, 5);
    assertEquals(3, range.length());
    assertTrue(range.contains(2));
    assertFalse(range.contains(5));
    assertEquals(RowRange.of(4, 7), range.offset(2));
    assertTrue(RowRange.of(3, 3).isEmpty());
    assertEquals("2..5", range.toString());
    assertThrows(IllegalArgumentException.class, () -> RowRange.of(5, 2));
    assertThrows(IllegalArgumentException.class, () -> RowRange.of(-1, 2));
  }
}
