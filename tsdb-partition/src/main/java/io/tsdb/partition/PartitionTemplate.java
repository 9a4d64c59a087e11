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

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The ordered parts a table's partition keys are built from.
 *
 * <p>Construction does not bound the number of parts; templates are validated where they are
 * declared, and the key generator refuses templates over {@link #MAXIMUM_NUMBER_OF_TEMPLATE_PARTS}.
 */
public final class PartitionTemplate implements Serializable {

  private static final long serialVersionUID = 1L;

  public static final int MAXIMUM_NUMBER_OF_TEMPLATE_PARTS = 8;

  private final List<TemplatePart> parts;

  public PartitionTemplate(List<TemplatePart> parts) {
    this.parts = Collections.unmodifiableList(new ArrayList<>(parts));
  }

  public static PartitionTemplate of(TemplatePart... parts) {
    return new PartitionTemplate(Arrays.asList(parts));
  }

  /**
   * The template of tables without an override: the row date.
   */
  public static PartitionTemplate defaultTemplate(PartitionKeyConfig config) {
    return of(TemplatePart.timeFormat(config.getDefaultTimeFormat()));
  }

  /**
   * Returns the table's own template when it has one, the default template otherwise.
   */
  public static PartitionTemplate resolve(Option<List<TemplatePart>> tableParts, PartitionKeyConfig config) {
    return tableParts.map(PartitionTemplate::new).orElseGet(() -> defaultTemplate(config));
  }

  public List<TemplatePart> getParts() {
    return parts;
  }

  public int size() {
    return parts.size();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return parts.equals(((PartitionTemplate) o).parts);
  }

  @Override
  public int hashCode() {
    return parts.hashCode();
  }

  @Override
  public String toString() {
    return "PartitionTemplate" + parts;
  }
}
