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
import java.util.List;

import org.fathom.util.PriorityQueue;

/** A Matcher for OR like queries, counterpart of <code>ConjunctionMatcher</code>.
 * This Matcher implements {@link Matcher#advance(int)} and uses advance() on the given Matchers.
 * The score of a document is the sum of the scores of the sub-matchers on it.
 */
final class DisjunctionMatcher extends Matcher {
  /** The minimum number of matchers that should match. */
  private final int minimumNrMatchers;

  /** The matchers, ordered by their current document. */
  private final PriorityQueue<Matcher> queue;

  private final long cost;
  private int doc = -1;

  /** Construct a <code>DisjunctionMatcher</code>.
   * @param weight The weight to be used.
   * @param subMatchers A collection of at least two sub-matchers.
   * @param minimumNrMatchers The positive minimum number of sub-matchers that should
   * match to match this query.
   * <br>When <code>minimumNrMatchers</code> is bigger than
   * the number of <code>subMatchers</code>,
   * no matches will be produced.
   * <br>When minimumNrMatchers equals the number of subMatchers,
   * it more efficient to use <code>ConjunctionMatcher</code>.
   */
  DisjunctionMatcher(Weight weight, List<Matcher> subMatchers, int minimumNrMatchers) {
    super(weight);
    if (minimumNrMatchers <= 0) {
      throw new IllegalArgumentException("Minimum nr of matchers should be positive");
    }
    if (subMatchers.size() <= 1) {
      throw new IllegalArgumentException("There must be at least 2 subMatchers");
    }
    this.minimumNrMatchers = minimumNrMatchers;
    this.queue = new PriorityQueue<Matcher>(subMatchers.size()) {
      @Override
      protected boolean lessThan(Matcher a, Matcher b) {
        return a.docID() < b.docID();
      }
    };
    long cost = 0;
    for (Matcher matcher : subMatchers) {
      queue.add(matcher);
      cost += matcher.cost();
    }
    this.cost = cost;
  }

  @Override
  public int nextDoc() throws IOException {
    if (doc == NO_MORE_DOCS) {
      return doc;
    }
    return doAdvance(doc + 1);
  }

  @Override
  public int advance(int target) throws IOException {
    if (doc == NO_MORE_DOCS || (doc != -1 && doc >= target)) {
      return doc;
    }
    return doAdvance(target);
  }

  private int doAdvance(int target) throws IOException {
    for (;;) {
      Matcher top = queue.top();
      while (top.docID() < target) {
        top.advance(target);
        top = queue.updateTop();
      }
      final int candidate = top.docID();
      if (candidate == NO_MORE_DOCS) {
        return doc = NO_MORE_DOCS;
      }
      if (minimumNrMatchers == 1 || countMatchers(candidate) >= minimumNrMatchers) {
        return doc = candidate;
      }
      target = candidate + 1;
    }
  }

  private int countMatchers(int target) {
    int count = 0;
    for (Matcher matcher : queue) {
      if (matcher.docID() == target) {
        count++;
      }
    }
    return count;
  }

  @Override
  public int docID() {
    return doc;
  }

  @Override
  public long cost() {
    return cost;
  }

  /** Returns the score of the current document matching the query. */
  @Override
  public float score() throws IOException {
    ensureActive();
    double sum = 0.0d;
    for (Matcher matcher : queue) {
      if (matcher.docID() == doc) {
        sum += matcher.score();
      }
    }
    return (float) sum;
  }
}
