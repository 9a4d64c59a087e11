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
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import static io.tsdb.partition.TemplatePart.bucket;
import static io.tsdb.partition.TemplatePart.tagValue;
import static io.tsdb.partition.TemplatePart.timeFormat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TestPartitionKeyConfig {

  @TempDir
  File tempDir;

  @Test
  public void testDefaults() {
    PartitionKeyConfig config = PartitionKeyConfig.newBuilder().build();
    assertEquals("%Y-%m-%d", config.getDefaultTimeFormat());
    assertEquals("%Y-%m-%d", config.getProps().getProperty(PartitionKeyConfig.DEFAULT_TIME_FORMAT.key()));
    assertEquals(PartitionTemplate.of(timeFormat("%Y-%m-%d")), PartitionTemplate.defaultTemplate(config));
    assertTrue(PartitionKeyConfig.DEFAULT_TIME_FORMAT.toString()
        .startsWith("Key: 'tsdb.partition.default.time.format' , default: %Y-%m-%d (strftime format"));
  }

  @Test
  public void testOverrides() throws IOException {
    assertEquals("%Y", PartitionKeyConfig.newBuilder().defaultTimeFormat("%Y").build().getDefaultTimeFormat());

    Properties props = new Properties();
    props.setProperty("tsdb.partition.default.time.format", "%Y-%m");
    assertEquals("%Y-%m", PartitionKeyConfig.newBuilder().fromProperties(props).build().getDefaultTimeFormat());

    File file = new File(tempDir, "partition.properties");
    try (Writer writer = new FileWriter(file)) {
      writer.write("tsdb.partition.default.time.format=%G-W%V\n");
    }
    assertEquals("%G-W%V", PartitionKeyConfig.newBuilder().fromFile(file).build().getDefaultTimeFormat());
  }

  @Test
  public void testResolveTemplate() {
    PartitionKeyConfig config = PartitionKeyConfig.newBuilder().build();
    List<TemplatePart> parts = Arrays.asList(tagValue("region"), bucket("host", 4));
    assertEquals(new PartitionTemplate(parts), PartitionTemplate.resolve(Option.of(parts), config));
    assertEquals(PartitionTemplate.defaultTemplate(config), PartitionTemplate.resolve(Option.empty(), config));
    assertEquals(Collections.singletonList(timeFormat("%Y-%m-%d")),
        PartitionTemplate.resolve(Option.empty(), config).getParts());
  }

  @Test
  public void testTemplateParts() {
    TemplatePart part = bucket("host", 4);
    assertEquals(TemplatePart.Type.BUCKET, part.getType());
    assertEquals("host", part.getColumn());
    assertEquals(4, part.getNumBuckets());
    assertEquals("Bucket(host, 4)", part.toString());
    assertNotEquals(bucket("host", 5), part);
    assertThrows(IllegalArgumentException.class, () -> bucket("host", 0));
    assertThrows(IllegalArgumentException.class, () -> timeFormat("%Y").getColumn());
    assertThrows(IllegalArgumentException.class, () -> tagValue("region").getFormat());
  }
}
