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
package org.fathom.search.grouping;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

import org.fathom.index.LeafReaderContext;
import org.fathom.index.NumericColumn;
import org.fathom.search.Scorable;

/**
 * Groups by the bucket a numeric column value falls into. Buckets start at
 * {@code start} and follow each other with the given gaps; once the gaps
 * run out the last one repeats. Values below {@code start}, at or past
 * {@code end}, or missing fall into the {@code null} group. Unless
 * {@code hardEnd} is set the last bucket keeps its full width past
 * {@code end}, otherwise it is cut at {@code end}.
 */
public class NumericRangeGroupSelector extends GroupSelector<LongRange> {

  private final String field;
  private final long start;
  private final long end;
  private final long[] gaps;
  private final boolean hardEnd;

  private NumericColumn column;
  private LongRange current;
  private Set<LongRange> groups;

  /** Buckets of equal width {@code gap}. */
  public NumericRangeGroupSelector(String field, long start, long end, long gap) {
    this(field, start, end, new long[] {gap}, false);
  }

  public NumericRangeGroupSelector(String field, long start, long end, long[] gaps, boolean hardEnd) {
    this.field = Objects.requireNonNull(field);
    if (start >= end) {
      throw new IllegalArgumentException("start must be less than end: start=" + start + " end=" + end);
    }
    if (gaps.length == 0) {
      throw new IllegalArgumentException("at least one gap is required");
    }
    for (long gap : gaps) {
      if (gap <= 0) {
        throw new IllegalArgumentException("gaps must be positive: " + Arrays.toString(gaps));
      }
    }
    this.start = start;
    this.end = end;
    this.gaps = gaps.clone();
    this.hardEnd = hardEnd;
  }

  public String getField() {
    return field;
  }

  /** Bucket holding {@code value}, or null if it is outside {@code [start, end)}. */
  public LongRange bucket(long value) {
    if (value < start || value >= end) {
      return null;
    }
    long lo = start;
    for (int i = 0; i < gaps.length - 1; i++) {
      long hi = lo + gaps[i];
      if (value < hi) {
        return range(lo, hi);
      }
      lo = hi;
    }
    final long gap = gaps[gaps.length - 1];
    lo += (value - lo) / gap * gap;
    return range(lo, lo + gap);
  }

  private LongRange range(long lo, long hi) {
    return new LongRange(lo, hardEnd ? Math.min(hi, end) : hi);
  }

  @Override
  public void setNextReader(LeafReaderContext readerContext) throws IOException {
    column = readerContext.reader().getNumericColumn(field);
  }

  @Override
  public void setScorer(Scorable scorer) throws IOException { }

  @Override
  public State advanceTo(int doc) throws IOException {
    current = column != null && column.exists(doc) ? bucket(column.get(doc)) : null;
    if (groups != null && groups.contains(current) == false) {
      return State.SKIP;
    }
    return State.ACCEPT;
  }

  @Override
  public LongRange currentValue() {
    return current;
  }

  @Override
  public LongRange copyValue() {
    return current;
  }

  @Override
  public void setGroups(Collection<LongRange> groups) {
    this.groups = groups == null ? null : new HashSet<>(groups);
  }
}
