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
import java.util.Arrays;
import java.util.List;

import org.fathom.index.LeafReaderContext;

/**
 * Expert: the Weight for BooleanQuery, used to
 * combine the matchers of the clauses.
 * <ul>
 * <li>required clauses only: {@link ConjunctionMatcher}</li>
 * <li>optional clauses only: {@link DisjunctionMatcher}, scores summed</li>
 * <li>required and optional clauses: {@link ReqOptMatcher}, or a conjunction
 *     of both sides when a minimum number of optional clauses must match</li>
 * <li>prohibited clauses: {@link ReqExclMatcher} over the positive side,
 *     or over an {@link EveryMatcher} when there is none</li>
 * </ul>
 */
final class BooleanWeight extends Weight {
  private final BooleanQuery query;
  private final List<Weight> weights;
  private final boolean hasPositiveClauses;
  private final float boost;

  BooleanWeight(BooleanQuery query, IndexSearcher searcher, boolean needsScores, float boost) throws IOException {
    super(query);
    this.query = query;
    this.boost = boost;
    weights = new ArrayList<>();
    boolean positive = false;
    for (BooleanClause c : query) {
      Weight w = searcher.createWeight(c.getQuery(), needsScores && c.isScoring(), c.isScoring() ? boost : 1f);
      weights.add(w);
      positive |= c.isProhibited() == false;
    }
    this.hasPositiveClauses = positive;
  }

  @Override
  public Matcher matcher(LeafReaderContext context) throws IOException {
    List<Matcher> required = new ArrayList<>();
    List<Matcher> optional = new ArrayList<>();
    List<Matcher> prohibited = new ArrayList<>();
    for (int i = 0; i < weights.size(); i++) {
      final BooleanClause c = query.clauses().get(i);
      final Matcher subMatcher = weights.get(i).matcher(context);
      if (subMatcher == null) {
        if (c.isRequired()) {
          return null;
        }
        continue;
      }
      switch (c.getOccur()) {
        case MUST:
          required.add(subMatcher);
          break;
        case FILTER:
          required.add(new ConstantScoreMatcher(this, 0f, subMatcher));
          break;
        case SHOULD:
          optional.add(subMatcher);
          break;
        case MUST_NOT:
          prohibited.add(subMatcher);
          break;
        default:
          throw new AssertionError();
      }
    }

    final int minShouldMatch = query.getMinimumNumberShouldMatch();
    if (optional.size() < minShouldMatch) {
      return null;
    }

    Matcher positive;
    if (hasPositiveClauses == false) {
      positive = new EveryMatcher(this, boost, context.reader().maxDoc(), null);
    } else if (required.isEmpty() && optional.isEmpty()) {
      return null;
    } else {
      final Matcher req = required.isEmpty() ? null : conjunction(required);
      final Matcher opt = optional.isEmpty() ? null : disjunction(optional, Math.max(1, minShouldMatch));
      if (req == null) {
        positive = opt;
      } else if (opt == null) {
        positive = req;
      } else if (minShouldMatch > 0) {
        positive = new ConjunctionMatcher(this, Arrays.asList(req, opt));
      } else {
        positive = new ReqOptMatcher(this, req, opt);
      }
    }

    if (prohibited.isEmpty()) {
      return positive;
    }
    return new ReqExclMatcher(this, positive, disjunction(prohibited, 1));
  }

  private Matcher conjunction(List<Matcher> matchers) {
    return matchers.size() == 1 ? matchers.get(0) : new ConjunctionMatcher(this, matchers);
  }

  private Matcher disjunction(List<Matcher> matchers, int minShouldMatch) {
    return matchers.size() == 1 ? matchers.get(0) : new DisjunctionMatcher(this, matchers, minShouldMatch);
  }

  @Override
  public String toString() {
    return "weight(" + query + ")";
  }
}
