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


import java.io.IOException;
import java.util.Objects;

import org.fathom.index.Terms;
import org.fathom.index.TermsEnum;
import org.fathom.util.BytesRef;
import org.fathom.util.NumericUtils;

/**
 * A {@link Query} that matches numeric values within a specified range.
 * <p>
 * The field must be indexed as a numeric field: its terms are the values
 * encoded with {@link NumericUtils#longToSortableBytes(long)}, whose byte
 * order is the numeric order. The query then behaves like a
 * {@link TermRangeQuery} over the encoded bounds.
 * <p>
 * A null bound leaves that end of the range open.
 */
public final class NumericRangeQuery extends MultiTermQuery {
  private final Long min;
  private final Long max;
  private final boolean minInclusive;
  private final boolean maxInclusive;

  private NumericRangeQuery(String field, Long min, Long max, boolean minInclusive, boolean maxInclusive) {
    super(field);
    this.min = min;
    this.max = max;
    this.minInclusive = minInclusive;
    this.maxInclusive = maxInclusive;
  }

  /**
   * Factory that creates a <code>NumericRangeQuery</code>, that queries a <code>long</code>
   * range. You can have half-open ranges (which are in fact &lt;/&le; or &gt;/&ge; queries)
   * by setting the min or max value to <code>null</code>.
   */
  public static NumericRangeQuery newLongRange(final String field, Long min, Long max,
                                               final boolean minInclusive, final boolean maxInclusive) {
    return new NumericRangeQuery(field, min, max, minInclusive, maxInclusive);
  }

  @Override
  protected TermsEnum getTermsEnum(Terms terms) throws IOException {
    if (min != null && max != null && min > max) {
      return TermsEnum.EMPTY;
    }
    final BytesRef lower = min == null ? null : NumericUtils.longToSortableBytes(min);
    final BytesRef upper = max == null ? null : NumericUtils.longToSortableBytes(max);
    return terms.range(lower, upper, minInclusive, maxInclusive);
  }

  /** Returns the lower value of this range query */
  public Long getMin() { return min; }

  /** Returns the upper value of this range query */
  public Long getMax() { return max; }

  /** Returns <code>true</code> if the lower endpoint is inclusive */
  public boolean includesMin() { return minInclusive; }

  /** Returns <code>true</code> if the upper endpoint is inclusive */
  public boolean includesMax() { return maxInclusive; }

  @Override
  public String toString(final String field) {
    final StringBuilder sb = new StringBuilder();
    if (!getField().equals(field)) sb.append(getField()).append(':');
    return sb.append(minInclusive ? '[' : '{')
      .append((min == null) ? "*" : min.toString())
      .append(" TO ")
      .append((max == null) ? "*" : max.toString())
      .append(maxInclusive ? ']' : '}')
      .toString();
  }

  @Override
  public boolean equals(final Object o) {
    if (o == this) return true;
    if (!super.equals(o))
      return false;
    final NumericRangeQuery q = (NumericRangeQuery) o;
    return Objects.equals(q.min, min) &&
           Objects.equals(q.max, max) &&
           minInclusive == q.minInclusive &&
           maxInclusive == q.maxInclusive;
  }

  @Override
  public int hashCode() {
    int hash = super.hashCode();
    hash += Objects.hashCode(min) ^ 0x14fa55fb;
    hash += Objects.hashCode(max) ^ 0x733fa5fe;
    return hash + (Boolean.valueOf(minInclusive).hashCode() ^ 0x14fa55fb) +
           (Boolean.valueOf(maxInclusive).hashCode() ^ 0x733fa5fe);
  }
}
