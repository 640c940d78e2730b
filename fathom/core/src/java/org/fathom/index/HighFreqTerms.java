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
package org.fathom.index;


import java.io.IOException;

import org.fathom.util.BytesRef;
import org.fathom.util.PriorityQueue;

/**
 * <code>HighFreqTerms</code> extracts the top terms of a field out of an
 * existing index, ranked either by total weight or by a tf-idf score.
 */
public final class HighFreqTerms {

  private HighFreqTerms() {}

  /**
   * Returns the {@code numTerms} terms of {@code field} with the largest total
   * weight, optionally restricted to terms starting with {@code prefix}.
   * Results are sorted by descending weight, ties by term.
   */
  public static TermStats[] mostFrequentTerms(IndexReader reader, String field, int numTerms, BytesRef prefix) throws IOException {
    return topTerms(reader, field, numTerms, prefix, false);
  }

  /**
   * Returns the {@code numTerms} terms of {@code field} with the largest
   * {@code totalWeight * idf}, where {@code idf = log(numDocs / (docFreq + 1)) + 1}.
   * These are the terms that are frequent where they occur but occur in few
   * documents.
   */
  public static TermStats[] mostDistinctiveTerms(IndexReader reader, String field, int numTerms, BytesRef prefix) throws IOException {
    return topTerms(reader, field, numTerms, prefix, true);
  }

  private static TermStats[] topTerms(IndexReader reader, String field, int numTerms, BytesRef prefix, boolean distinctive) throws IOException {
    if (numTerms < 1) {
      throw new IllegalArgumentException("numTerms must be >= 1, got " + numTerms);
    }
    final Terms terms = reader.terms(field);
    if (terms == null) {
      return new TermStats[0];
    }
    final TermStatsQueue tiq = new TermStatsQueue(numTerms);
    final TermsEnum termsEnum = prefix == null ? terms.iterator() : terms.prefix(prefix);
    final int numDocs = reader.numDocs();
    BytesRef term;
    while ((term = termsEnum.next()) != null) {
      final int docFreq = termsEnum.docFreq();
      final float totalWeight = termsEnum.totalWeight();
      double score = totalWeight;
      if (distinctive) {
        score *= Math.log((double) numDocs / (docFreq + 1)) + 1.0;
      }
      tiq.insertWithOverflow(new TermStats(field, term, docFreq, totalWeight, score));
    }
    final TermStats[] result = new TermStats[tiq.size()];
    // we want highest first so we read it off the queue in reverse
    int count = tiq.size() - 1;
    while (tiq.size() != 0) {
      result[count] = tiq.pop();
      count--;
    }
    return result;
  }

  /**
   * Priority queue for TermStats objects: the least term is the one with the
   * lowest score, then the largest term text.
   **/
  static final class TermStatsQueue extends PriorityQueue<TermStats> {
    TermStatsQueue(int size) {
      super(size);
    }

    @Override
    protected boolean lessThan(TermStats termInfoA, TermStats termInfoB) {
      if (termInfoA.score != termInfoB.score) {
        return termInfoA.score < termInfoB.score;
      }
      return termInfoA.termtext.compareTo(termInfoB.termtext) > 0;
    }
  }
}
