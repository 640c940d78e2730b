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

import org.fathom.index.IndexReader;

/**
 * Multiplies the scores of a wrapped query by a constant factor. Matching
 * is unchanged.
 */
public final class BoostQuery extends Query {

  private final Query query;
  private final float boost;

  /** @param boost a finite factor, zero or greater */
  public BoostQuery(Query query, float boost) {
    this.query = Objects.requireNonNull(query);
    if (Float.isFinite(boost) == false || boost < 0f) {
      throw new IllegalArgumentException("boost must be a finite value >= 0, got " + boost);
    }
    this.boost = boost;
  }

  public Query getQuery() {
    return query;
  }

  public float getBoost() {
    return boost;
  }

  @Override
  public Query rewrite(IndexReader reader) throws IOException {
    final Query inner = query.rewrite(reader);
    if (boost == 1f) {
      return inner;
    }
    if (inner instanceof BoostQuery) {
      // fold nested boosts into one
      final BoostQuery nested = (BoostQuery) inner;
      return new BoostQuery(nested.query, boost * nested.boost);
    }
    return inner == query ? this : new BoostQuery(inner, boost);
  }

  @Override
  public Weight createWeight(IndexSearcher searcher, boolean needsScores, float boost) throws IOException {
    return query.createWeight(searcher, needsScores, this.boost * boost);
  }

  @Override
  public String toString(String field) {
    return "(" + query.toString(field) + ")^" + boost;
  }

  @Override
  public boolean equals(Object other) {
    if (sameClassAs(other) == false) {
      return false;
    }
    final BoostQuery that = (BoostQuery) other;
    return Float.compare(boost, that.boost) == 0 && query.equals(that.query);
  }

  @Override
  public int hashCode() {
    return Objects.hash(classHash(), query, boost);
  }
}
