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

package io.tsdb.partition.template;

import io.tsdb.batch.Batch;
import io.tsdb.batch.PartitioningColumn;
import io.tsdb.common.util.Option;
import io.tsdb.exception.PartitionKeyException;
import io.tsdb.partition.PartitionKeyResult;
import io.tsdb.partition.PartitionTemplate;
import io.tsdb.partition.TemplatePart;
import io.tsdb.partition.strftime.StrftimeFormatter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static io.tsdb.common.util.ValidationUtils.checkArgument;
import static io.tsdb.partition.PartitionTemplate.MAXIMUM_NUMBER_OF_TEMPLATE_PARTS;
import static io.tsdb.partition.keygen.PartitionKeyConstants.PARTITION_KEY_DELIMITER;

/**
 * Generates the partition keys of the rows of one batch.
 *
 * <p>The template parts are resolved against the batch once, at construction. {@link #keys()} then
 * yields one element per row: the key of the first row, and for every following row either its key
 * or {@link Option#empty()} when every part renders the same as for the previous row. A row whose
 * key cannot be generated yields a failed {@link PartitionKeyResult} and does not stop the pass.
 *
 * <p>An instance is bound to a single batch and is not thread-safe.
 */
public class PartitionKeyGenerator {

  private final List<TemplatePartRenderer> renderers;
  private final int numRows;
  private int lastKeyLength;

  /**
   * @throws IllegalArgumentException if the template has more than
   *     {@link PartitionTemplate#MAXIMUM_NUMBER_OF_TEMPLATE_PARTS} parts
   * @throws io.tsdb.exception.TimeColumnNotFoundException if the batch has no time column
   */
  public PartitionKeyGenerator(Batch batch, PartitionTemplate template) {
    checkArgument(template.size() <= MAXIMUM_NUMBER_OF_TEMPLATE_PARTS,
        String.format("partition template contains %d parts, which exceeds the maximum of %d parts",
            template.size(), MAXIMUM_NUMBER_OF_TEMPLATE_PARTS));
    long[] time = batch.timeColumn();
    this.numRows = batch.numRows();
    List<TemplatePartRenderer> resolved = new ArrayList<>(template.size());
    for (TemplatePart part : template.getParts()) {
      resolved.add(resolve(batch, part, time));
    }
    this.renderers = Collections.unmodifiableList(resolved);
  }

  private static TemplatePartRenderer resolve(Batch batch, TemplatePart part, long[] time) {
    switch (part.getType()) {
      case TAG_VALUE:
        return batch.column(part.getColumn())
            .<TemplatePartRenderer>map(column -> tagValueRenderer(column))
            .orElse(MissingTagRenderer.INSTANCE);
      case BUCKET:
        return batch.column(part.getColumn())
            .<TemplatePartRenderer>map(column -> bucketRenderer(column, part.getNumBuckets()))
            .orElse(MissingTagRenderer.INSTANCE);
      case TIME_FORMAT:
        return new TimeFormatRenderer(new StrftimeFormatter(part.getFormat()), time);
      default:
        throw new IllegalArgumentException("Unsupported template part " + part);
    }
  }

  private static <K> TemplatePartRenderer tagValueRenderer(PartitioningColumn<K> column) {
    return TagValueRenderer.forColumn(column);
  }

  private static <K> TemplatePartRenderer bucketRenderer(PartitioningColumn<K> column, int numBuckets) {
    return BucketRenderer.forColumn(column, numBuckets);
  }

  /**
   * Returns the deduplicated key sequence of the batch, one element per row.
   */
  public Iterator<Option<PartitionKeyResult>> keys() {
    return new Iterator<Option<PartitionKeyResult>>() {
      private int idx = 0;

      @Override
      public boolean hasNext() {
        return idx < numRows;
      }

      @Override
      public Option<PartitionKeyResult> next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        int row = idx++;
        if (row > 0 && isIdentical(row)) {
          return Option.empty();
        }
        return Option.of(evaluate(row));
      }
    };
  }

  /**
   * Renders the full key of row {@code idx}.
   */
  public PartitionKeyResult evaluate(int idx) {
    StringBuilder sb = new StringBuilder(lastKeyLength);
    try {
      for (int i = 0; i < renderers.size(); i++) {
        if (i > 0) {
          sb.append(PARTITION_KEY_DELIMITER);
        }
        renderers.get(i).render(idx, sb);
      }
    } catch (PartitionKeyException e) {
      return PartitionKeyResult.error(e);
    }
    lastKeyLength = sb.length();
    return PartitionKeyResult.of(sb.toString());
  }

  private boolean isIdentical(int idx) {
    for (TemplatePartRenderer renderer : renderers) {
      if (!renderer.isIdentical(idx)) {
        return false;
      }
    }
    return true;
  }
}
