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

/** A Matcher for queries with a required part and an optional part.
 * Delays advance() on the optional part until a score() is needed.
 * <br>
 * This <code>Matcher</code> implements {@link Matcher#advance(int)}.
 */
final class ReqOptMatcher extends Matcher {
  private final Matcher reqMatcher;
  private final Matcher optMatcher;

  /** Construct a <code>ReqOptMatcher</code>.
   * @param reqMatcher The required matcher. This must match.
   * @param optMatcher The optional matcher. This is used for scoring only.
   */
  ReqOptMatcher(Weight weight, Matcher reqMatcher, Matcher optMatcher) {
    super(weight);
    this.reqMatcher = reqMatcher;
    this.optMatcher = optMatcher;
  }

  @Override
  public int nextDoc() throws IOException {
    return reqMatcher.nextDoc();
  }

  @Override
  public int advance(int target) throws IOException {
    return reqMatcher.advance(target);
  }

  @Override
  public int docID() {
    return reqMatcher.docID();
  }

  /** Returns the score of the current document matching the query.
   * Initially invalid, until {@link #nextDoc()} is called the first time.
   * @return The score of the required matcher, eventually increased by the score
   * of the optional matcher when it also matches the current document.
   */
  @Override
  public float score() throws IOException {
    ensureActive();
    final int curDoc = reqMatcher.docID();
    final float reqScore = reqMatcher.score();
    int optDoc = optMatcher.docID();
    if (optDoc < curDoc) {
      optDoc = optMatcher.advance(curDoc);
    }
    return optDoc == curDoc ? reqScore + optMatcher.score() : reqScore;
  }

  @Override
  public long cost() {
    return reqMatcher.cost();
  }
}
