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

/**
 * Renders one part of a partition template for the rows of a single batch.
 *
 * <p>Renderers are stateful: they remember what they rendered last, which lets
 * {@link #isIdentical(int)} tell cheaply whether a row would render the same part again.
 */
public interface TemplatePartRenderer {

  /**
   * Appends the encoded part for row {@code idx} to {@code out}.
   *
   * @throws io.tsdb.exception.PartitionKeyException if the row cannot be rendered
   */
  void render(int idx, StringBuilder out);

  /**
   * Returns true if row {@code idx} renders to the same part as the last rendered row. Never throws
   * for column type mismatches; those surface from {@link #render}.
   */
  boolean isIdentical(int idx);
}
