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


import org.fathom.util.Bits;

/**
 * Matches every document of a leaf, or the documents set in a bit set, with
 * a constant score.
 */
final class EveryMatcher extends Matcher {
  private final float score;
  private final int maxDoc;
  private final Bits docs;
  private int doc = -1;

  /** @param docs the documents to match, or null to match all of them */
  EveryMatcher(Weight weight, float score, int maxDoc, Bits docs) {
    super(weight);
    this.score = score;
    this.maxDoc = maxDoc;
    this.docs = docs;
  }

  @Override
  public int docID() {
    return doc;
  }

  @Override
  public int nextDoc() {
    if (doc == NO_MORE_DOCS) {
      return doc;
    }
    return advance(doc + 1);
  }

  @Override
  public int advance(int target) {
    if (doc == NO_MORE_DOCS || (doc != -1 && doc >= target)) {
      return doc;
    }
    for (int d = Math.max(0, target); d < maxDoc; d++) {
      if (docs == null || docs.get(d)) {
        return doc = d;
      }
    }
    return doc = NO_MORE_DOCS;
  }

  @Override
  public long cost() {
    return maxDoc;
  }

  @Override
  public float score() {
    ensureActive();
    return score;
  }
}
