/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.fathom.search;


import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Ordered list of {@link SortField}s that top hits are ranked by. Each
 * field only breaks the ties left by the ones before it, and ascending
 * doc id breaks whatever ties remain. Fields other than the score and the
 * doc id must be indexed as columns.
 */
public class Sort {

  /** By descending score, the order of an unsorted search. */
  public static final Sort RELEVANCE = new Sort();

  /** By doc id. */
  public static final Sort INDEXORDER = new Sort(SortField.FIELD_DOC);

  private final SortField[] fields;

  /** Same as {@link #RELEVANCE}. */
  public Sort() {
    this(SortField.FIELD_SCORE);
  }

  public Sort(SortField... fields) {
    if (fields.length == 0) {
      throw new IllegalArgumentException("a sort needs at least one field");
    }
    this.fields = fields.clone();
  }

  public SortField[] getSort() {
    return fields.clone();
  }

  /** True if any field ranks by score. */
  public boolean needsScores() {
    return Arrays.stream(fields).anyMatch(SortField::needsScores);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Sort && Arrays.equals(fields, ((Sort) obj).fields);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(fields);
  }

  @Override
  public String toString() {
    return Arrays.stream(fields).map(SortField::toString).collect(Collectors.joining(","));
  }
}
