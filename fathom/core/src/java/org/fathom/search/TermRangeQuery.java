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

/**
 * Matches documents holding a term of {@code field} that sorts, by
 * {@link BytesRef#compareTo(BytesRef)}, between two bounds. Each bound is
 * inclusive or exclusive; a null bound leaves that end of the range open.
 */
public class TermRangeQuery extends MultiTermQuery {

  private final BytesRef lowerTerm;
  private final BytesRef upperTerm;
  private final boolean includeLower;
  private final boolean includeUpper;

  /** The bounds are copied. */
  public TermRangeQuery(String field, BytesRef lowerTerm, BytesRef upperTerm, boolean includeLower, boolean includeUpper) {
    super(field);
    this.lowerTerm = lowerTerm == null ? null : BytesRef.deepCopyOf(lowerTerm);
    this.upperTerm = upperTerm == null ? null : BytesRef.deepCopyOf(upperTerm);
    this.includeLower = includeLower;
    this.includeUpper = includeUpper;
  }

  /** A range over the UTF-8 encodings of two strings, either of which may be null. */
  public static TermRangeQuery newStringRange(String field, String lowerTerm, String upperTerm,
                                              boolean includeLower, boolean includeUpper) {
    return new TermRangeQuery(field, toBytes(lowerTerm), toBytes(upperTerm), includeLower, includeUpper);
  }

  private static BytesRef toBytes(String term) {
    return term == null ? null : new BytesRef(term);
  }

  public BytesRef getLowerTerm() {
    return lowerTerm;
  }

  public BytesRef getUpperTerm() {
    return upperTerm;
  }

  public boolean includesLower() {
    return includeLower;
  }

  public boolean includesUpper() {
    return includeUpper;
  }

  @Override
  protected TermsEnum getTermsEnum(Terms terms) throws IOException {
    boolean inverted = lowerTerm != null && upperTerm != null && lowerTerm.compareTo(upperTerm) > 0;
    return inverted ? TermsEnum.EMPTY : terms.range(lowerTerm, upperTerm, includeLower, includeUpper);
  }

  @Override
  public String toString(String field) {
    StringBuilder sb = new StringBuilder();
    if (getField().equals(field) == false) {
      sb.append(getField()).append(':');
    }
    return sb.append(includeLower ? '[' : '{')
        .append(bound(lowerTerm))
        .append(" TO ")
        .append(bound(upperTerm))
        .append(includeUpper ? ']' : '}')
        .toString();
  }

  // "*" stands for an open bound, so a literal star is escaped
  private static String bound(BytesRef term) {
    if (term == null) {
      return "*";
    }
    String text = term.utf8ToString();
    return text.equals("*") ? "\\*" : text;
  }

  @Override
  public boolean equals(Object other) {
    if (super.equals(other) == false) {
      return false;
    }
    TermRangeQuery that = (TermRangeQuery) other;
    return includeLower == that.includeLower
        && includeUpper == that.includeUpper
        && Objects.equals(lowerTerm, that.lowerTerm)
        && Objects.equals(upperTerm, that.upperTerm);
  }

  @Override
  public int hashCode() {
    return Objects.hash(super.hashCode(), includeLower, includeUpper, lowerTerm, upperTerm);
  }
}
