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

import java.util.Locale;

/** A half-open range of longs, {@code [min, max)}, naming one bucket of a {@link NumericRangeGroupSelector}. */
public final class LongRange {

  public final long min;
  public final long max;

  public LongRange(long min, long max) {
    if (min >= max) {
      throw new IllegalArgumentException("empty range: [" + min + ", " + max + ")");
    }
    this.min = min;
    this.max = max;
  }

  public boolean contains(long value) {
    return value >= min && value < max;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof LongRange == false) {
      return false;
    }
    LongRange other = (LongRange) obj;
    return min == other.min && max == other.max;
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(min) + Long.hashCode(max);
  }

  @Override
  public String toString() {
    return String.format(Locale.ROOT, "[%d TO %d)", min, max);
  }
}
