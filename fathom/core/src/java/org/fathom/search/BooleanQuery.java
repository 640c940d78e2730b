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
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

import org.fathom.index.IndexReader;
import org.fathom.search.BooleanClause.Occur;

/**
 * Combines sub-queries with {@link Occur} semantics: required, optional,
 * filtering and excluded clauses. A query made only of
 * {@link Occur#MUST_NOT} clauses matches every document the clauses miss.
 */
public class BooleanQuery extends Query implements Iterable<BooleanClause> {

  /** Collects clauses; the order of clauses does not change the matches. */
  public static class Builder {
    private final List<BooleanClause> clauses = new ArrayList<>();
    private int minimumNumberShouldMatch;

    /** Requires at least {@code min} optional clauses to match. */
    public Builder setMinimumNumberShouldMatch(int min) {
      if (min < 0) {
        throw new IllegalArgumentException("minimumNumberShouldMatch must be >= 0, got " + min);
      }
      minimumNumberShouldMatch = min;
      return this;
    }

    public Builder add(BooleanClause clause) {
      clauses.add(clause);
      return this;
    }

    public Builder add(Query query, Occur occur) {
      return add(new BooleanClause(query, occur));
    }

    public BooleanQuery build() {
      return new BooleanQuery(minimumNumberShouldMatch, new ArrayList<>(clauses));
    }
  }

  private final int minimumNumberShouldMatch;
  private final List<BooleanClause> clauses;

  private BooleanQuery(int minimumNumberShouldMatch, List<BooleanClause> clauses) {
    this.minimumNumberShouldMatch = minimumNumberShouldMatch;
    this.clauses = Collections.unmodifiableList(clauses);
  }

  /** Optional clauses that must match, 0 when only required clauses decide. */
  public int getMinimumNumberShouldMatch() {
    return minimumNumberShouldMatch;
  }

  public List<BooleanClause> clauses() {
    return clauses;
  }

  @Override
  public final Iterator<BooleanClause> iterator() {
    return clauses.iterator();
  }

  @Override
  public Weight createWeight(IndexSearcher searcher, boolean needsScores, float boost) throws IOException {
    return new BooleanWeight(this, searcher, needsScores, boost);
  }

  @Override
  public Query rewrite(IndexReader reader) throws IOException {
    if (clauses.isEmpty()) {
      return new MatchNoDocsQuery("empty BooleanQuery");
    }
    if (clauses.size() == 1) {
      final BooleanClause only = clauses.get(0);
      final boolean plainShould = only.getOccur() == Occur.SHOULD && minimumNumberShouldMatch <= 1;
      final boolean plainMust = only.getOccur() == Occur.MUST && minimumNumberShouldMatch == 0;
      if (plainShould || plainMust) {
        return only.getQuery();
      }
    }

    final Builder builder = new Builder().setMinimumNumberShouldMatch(minimumNumberShouldMatch);
    boolean changed = false;
    for (BooleanClause clause : clauses) {
      final Query rewritten = clause.getQuery().rewrite(reader);
      changed |= rewritten != clause.getQuery();
      builder.add(rewritten, clause.getOccur());
    }
    return changed ? builder.build() : this;
  }

  @Override
  public String toString(String field) {
    final StringBuilder sb = new StringBuilder();
    if (minimumNumberShouldMatch > 0) {
      sb.append('(');
    }
    for (int i = 0; i < clauses.size(); i++) {
      if (i > 0) {
        sb.append(' ');
      }
      final BooleanClause clause = clauses.get(i);
      sb.append(clause.getOccur());
      final Query sub = clause.getQuery();
      if (sub instanceof BooleanQuery) {
        sb.append('(').append(sub.toString(field)).append(')');
      } else {
        sb.append(sub.toString(field));
      }
    }
    if (minimumNumberShouldMatch > 0) {
      sb.append(")~").append(minimumNumberShouldMatch);
    }
    return sb.toString();
  }

  /** Equal when the clauses, in order, and the minimum match count agree. */
  @Override
  public boolean equals(Object o) {
    if (sameClassAs(o) == false) {
      return false;
    }
    final BooleanQuery other = (BooleanQuery) o;
    return minimumNumberShouldMatch == other.minimumNumberShouldMatch && clauses.equals(other.clauses);
  }

  @Override
  public int hashCode() {
    return Objects.hash(classHash(), minimumNumberShouldMatch, clauses);
  }
}
