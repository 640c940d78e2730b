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

import org.fathom.index.LeafReader;
import org.fathom.index.PostingsEnum;
import org.fathom.search.similarities.Similarity;

/** Expert: A <code>Matcher</code> for documents matching a <code>Term</code>.
 */
final class TermMatcher extends Matcher {
  private final PostingsEnum postingsEnum;
  private final Similarity.SimScorer docScorer;
  private final LeafReader reader;
  private final String field;

  TermMatcher(Weight weight, PostingsEnum postingsEnum, Similarity.SimScorer docScorer, LeafReader reader, String field) {
    super(weight);
    this.postingsEnum = postingsEnum;
    this.docScorer = docScorer;
    this.reader = reader;
    this.field = field;
  }

  @Override
  public int docID() {
    return postingsEnum.docID();
  }

  @Override
  public int nextDoc() throws IOException {
    return postingsEnum.nextDoc();
  }

  @Override
  public int advance(int target) throws IOException {
    return postingsEnum.advance(target);
  }

  @Override
  public long cost() {
    return postingsEnum.cost();
  }

  @Override
  public float score() throws IOException {
    ensureActive();
    final int doc = postingsEnum.docID();
    return docScorer.score(postingsEnum.weight(), reader.documentFieldLength(doc, field));
  }

  /** Returns a string representation of this <code>TermMatcher</code>. */
  @Override
  public String toString() { return "matcher(" + weight + ")[" + postingsEnum.docID() + "]"; }
}
