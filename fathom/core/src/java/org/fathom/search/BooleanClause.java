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


import java.util.Objects;

/** One sub-query of a {@link BooleanQuery} and how it takes part. */
public final class BooleanClause {

  /** How a clause takes part in matching and scoring. */
  public enum Occur {
    /** Must match; adds to the score. */
    MUST("+"),
    /** Must match; does not add to the score. */
    FILTER("#"),
    /** Optional; adds to the score when it matches. Without required
     *  clauses at least one optional clause must match. */
    SHOULD(""),
    /** Must not match; never scores. */
    MUST_NOT("-");

    private final String symbol;

    Occur(String symbol) {
      this.symbol = symbol;
    }

    @Override
    public String toString() {
      return symbol;
    }
  }

  private final Query query;
  private final Occur occur;

  public BooleanClause(Query query, Occur occur) {
    this.query = Objects.requireNonNull(query, "query");
    this.occur = Objects.requireNonNull(occur, "occur");
  }

  public Query getQuery() {
    return query;
  }

  public Occur getOccur() {
    return occur;
  }

  /** True for {@link Occur#MUST} and {@link Occur#FILTER}. */
  public boolean isRequired() {
    return occur == Occur.MUST || occur == Occur.FILTER;
  }

  /** True for {@link Occur#MUST_NOT}. */
  public boolean isProhibited() {
    return occur == Occur.MUST_NOT;
  }

  /** True when the clause contributes to the score. */
  public boolean isScoring() {
    return occur == Occur.MUST || occur == Occur.SHOULD;
  }

  @Override
  public boolean equals(Object o) {
    if (o instanceof BooleanClause == false) {
      return false;
    }
    final BooleanClause other = (BooleanClause) o;
    return occur == other.occur && query.equals(other.query);
  }

  @Override
  public int hashCode() {
    return Objects.hash(query, occur);
  }

  @Override
  public String toString() {
    return occur + query.toString();
  }
}
