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
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/** Matcher for conjunctions, sets of queries, all of which are required.
 *  The sub-matchers leapfrog each other, led by the least costly one; the
 *  score is the sum of the sub-matchers' scores. */
final class ConjunctionMatcher extends Matcher {

  private final Matcher lead;
  private final Matcher[] others;
  private final Matcher[] matchers;
  private int doc = -1;

  ConjunctionMatcher(Weight weight, List<Matcher> required) {
    super(weight);
    if (required.size() < 2) {
      throw new IllegalArgumentException("Cannot make a ConjunctionMatcher of less than 2 matchers");
    }
    matchers = required.toArray(new Matcher[0]);
    final Matcher[] sorted = matchers.clone();
    // Sort the array the first time to allow the least frequent DocsEnum to
    // lead the matching.
    Arrays.sort(sorted, Comparator.comparingLong(Matcher::cost));
    lead = sorted[0];
    others = Arrays.copyOfRange(sorted, 1, sorted.length);
  }

  private int doNext(int target) throws IOException {
    advanceHead:
    for (;;) {
      if (target == NO_MORE_DOCS) {
        return doc = NO_MORE_DOCS;
      }
      for (Matcher other : others) {
        int next = other.docID();
        if (next < target) {
          next = other.advance(target);
        }
        if (next > target) {
          // iterator beyond the current doc - advance lead and continue to the new highest doc.
          target = lead.advance(next);
          continue advanceHead;
        }
      }
      // success - all iterators are on the same doc
      return doc = target;
    }
  }

  @Override
  public int advance(int target) throws IOException {
    if (doc == NO_MORE_DOCS || (doc != -1 && doc >= target)) {
      return doc;
    }
    return doNext(lead.advance(target));
  }

  @Override
  public int docID() {
    return doc;
  }

  @Override
  public int nextDoc() throws IOException {
    if (doc == NO_MORE_DOCS) {
      return doc;
    }
    return doNext(lead.nextDoc());
  }

  @Override
  public long cost() {
    return lead.cost();
  }

  @Override
  public float score() throws IOException {
    ensureActive();
    double sum = 0.0d;
    for (Matcher matcher : matchers) {
      sum += matcher.score();
    }
    return (float) sum;
  }
}
