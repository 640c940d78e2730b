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

/** A Matcher for queries with a required subquery
 * and excluding (prohibited) sub query.
 * <br>
 * This <code>Matcher</code> implements {@link Matcher#advance(int)},
 * and it uses the advance() on the given matchers.
 */
final class ReqExclMatcher extends Matcher {
  private final Matcher reqMatcher;
  private final Matcher exclMatcher;

  /** Construct a <code>ReqExclMatcher</code>.
   * @param reqMatcher The matcher that must match, except where
   * @param exclMatcher indicates exclusion.
   */
  ReqExclMatcher(Weight weight, Matcher reqMatcher, Matcher exclMatcher) {
    super(weight);
    this.reqMatcher = reqMatcher;
    this.exclMatcher = exclMatcher;
  }

  @Override
  public int nextDoc() throws IOException {
    if (reqMatcher.docID() == NO_MORE_DOCS) {
      return NO_MORE_DOCS;
    }
    return toNonExcluded(reqMatcher.nextDoc());
  }

  /** Advance to non excluded doc.
   * <br>On entry:
   * <ul>
   * <li>reqMatcher is on the candidate doc,
   * <li>exclMatcher is before or on the candidate doc or beyond it.
   * </ul>
   * Advances reqMatcher a non excluded required doc, if any.
   * @return the first non excluded doc at or after the candidate, or NO_MORE_DOCS.
   */
  private int toNonExcluded(int doc) throws IOException {
    for (; doc != NO_MORE_DOCS; doc = reqMatcher.nextDoc()) {
      int exclDoc = exclMatcher.docID();
      if (exclDoc < doc) {
        exclDoc = exclMatcher.advance(doc);
      }
      if (exclDoc != doc) {
        return doc; // not excluded
      }
    }
    return NO_MORE_DOCS;
  }

  @Override
  public int docID() {
    return reqMatcher.docID();
  }

  /** Returns the score of the current document matching the query.
   * Initially invalid, until {@link #nextDoc()} is called the first time.
   * @return The score of the required matcher.
   */
  @Override
  public float score() throws IOException {
    ensureActive();
    return reqMatcher.score();
  }

  @Override
  public int advance(int target) throws IOException {
    if (reqMatcher.isActive() && reqMatcher.docID() >= target) {
      return reqMatcher.docID();
    }
    if (reqMatcher.docID() == NO_MORE_DOCS) {
      return NO_MORE_DOCS;
    }
    return toNonExcluded(reqMatcher.advance(target));
  }

  @Override
  public long cost() {
    return reqMatcher.cost();
  }
}
