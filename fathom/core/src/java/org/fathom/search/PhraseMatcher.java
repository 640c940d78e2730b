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

/**
 * Matches the documents holding all terms of a phrase, in order, at their
 * relative positions. With a slop, each term may sit up to {@code slop}
 * positions after the place it would take in the exact phrase.
 * <p>
 * The phrase frequency, the number of positions of the first term that
 * start a match, is the weight given to the similarity.
 */
final class PhraseMatcher extends Matcher {
  private final PostingsEnum[] postings;
  private final PostingsEnum lead;
  private final int[] offsets;
  private final int slop;
  private final Similarity.SimScorer docScorer;
  private final LeafReader reader;
  private final String field;

  private final int[][] docPositions;
  private int doc = -1;
  private int freq;

  PhraseMatcher(Weight weight, PostingsEnum[] postings, int[] offsets, int slop,
                Similarity.SimScorer docScorer, LeafReader reader, String field) {
    super(weight);
    this.postings = postings;
    this.offsets = offsets;
    this.slop = slop;
    this.docScorer = docScorer;
    this.reader = reader;
    this.field = field;
    this.docPositions = new int[postings.length][];
    PostingsEnum cheapest = postings[0];
    for (PostingsEnum pe : postings) {
      if (pe.cost() < cheapest.cost()) {
        cheapest = pe;
      }
    }
    this.lead = cheapest;
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
  public int advance(int target) throws IOException {
    if (doc == NO_MORE_DOCS || (doc != -1 && doc >= target)) {
      return doc;
    }
    return doNext(lead.advance(target));
  }

  private int doNext(int target) throws IOException {
    advanceHead:
    for (;;) {
      if (target == NO_MORE_DOCS) {
        return doc = NO_MORE_DOCS;
      }
      for (PostingsEnum other : postings) {
        if (other == lead) {
          continue;
        }
        int next = other.docID();
        if (next < target) {
          next = other.advance(target);
        }
        if (next > target) {
          target = lead.advance(next);
          continue advanceHead;
        }
      }
      freq = phraseFreq();
      if (freq > 0) {
        return doc = target;
      }
      target = lead.nextDoc();
    }
  }

  /** Counts the start positions of the first term from which the whole phrase matches. */
  private int phraseFreq() {
    for (int i = 0; i < postings.length; i++) {
      docPositions[i] = postings[i].positions();
    }
    int count = 0;
    for (int start : docPositions[0]) {
      if (matchesFrom(1, start)) {
        count++;
      }
    }
    return count;
  }

  private boolean matchesFrom(int termIndex, int previous) {
    if (termIndex == postings.length) {
      return true;
    }
    final int expected = previous + offsets[termIndex] - offsets[termIndex - 1];
    for (int position : docPositions[termIndex]) {
      if (position > expected + slop) {
        break;
      }
      if (position >= expected && matchesFrom(termIndex + 1, position)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public long cost() {
    return lead.cost();
  }

  @Override
  public float score() throws IOException {
    ensureActive();
    return docScorer.score(freq, reader.documentFieldLength(doc, field));
  }

  @Override
  public String toString() {
    return "PhraseMatcher(" + weight + ")";
  }
}
