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
package org.fathom.search.similarities;


import org.fathom.search.CollectionStatistics;
import org.fathom.search.TermStatistics;
import org.fathom.util.BytesRef;
import org.fathom.util.FathomTestCase;

public class TestSimilarities extends FathomTestCase {

  // 10 docs, 40 tokens in the field: average length 4
  private static final CollectionStatistics STATS = new CollectionStatistics("body", 10, 10, 40, 30, 40);

  private static TermStatistics term(long docFreq) {
    return new TermStatistics(new BytesRef("term"), docFreq, docFreq);
  }

  public void testBM25() {
    Similarity.SimScorer scorer = new BM25Similarity().scorer(1f, STATS, term(4));
    final double idf = Math.log(10 / 5.0) + 1;
    // a document of average length: norm = k1
    assertEquals(idf * 2 * 2.2 / (2 + 1.2), scorer.score(2f, 4), 1e-5);
    // longer documents score lower
    assertTrue(scorer.score(2f, 8) < scorer.score(2f, 4));
    // higher frequencies saturate below idf * (k1 + 1)
    assertTrue(scorer.score(1000f, 4) < idf * 2.2);
    assertTrue(scorer.score(3f, 4) > scorer.score(2f, 4));
  }

  public void testBM25Parameters() {
    BM25Similarity noLengths = new BM25Similarity(1.2f, 0f);
    Similarity.SimScorer scorer = noLengths.scorer(1f, STATS, term(4));
    assertEquals(scorer.score(2f, 1), scorer.score(2f, 100), 0f);
    assertEquals(1.2f, noLengths.getK1(), 0f);
    assertEquals(0f, noLengths.getB(), 0f);
    assertThrows(IllegalArgumentException.class, () -> new BM25Similarity(-1f, 0.5f));
    assertThrows(IllegalArgumentException.class, () -> new BM25Similarity(Float.POSITIVE_INFINITY, 0.5f));
    assertThrows(IllegalArgumentException.class, () -> new BM25Similarity(1.2f, 1.5f));
    assertThrows(IllegalArgumentException.class, () -> new BM25Similarity(1.2f, Float.NaN));
  }

  public void testBoostScales() {
    Similarity sim = new BM25Similarity();
    assertEquals(3 * sim.scorer(1f, STATS, term(2)).score(1f, 4), sim.scorer(3f, STATS, term(2)).score(1f, 4), 1e-5);
  }

  public void testTFIDF() {
    Similarity.SimScorer scorer = new TFIDFSimilarity().scorer(2f, STATS, term(1));
    final double idf = Math.log(10 / 2.0) + 1;
    assertEquals(2 * idf * 3, scorer.score(3f, 4), 1e-5);
    // lengths do not matter
    assertEquals(scorer.score(3f, 1), scorer.score(3f, 50), 0f);
    // rare terms weigh more
    assertTrue(scorer.score(1f, 1) > new TFIDFSimilarity().scorer(2f, STATS, term(9)).score(1f, 1));
  }

  public void testFrequency() {
    Similarity.SimScorer scorer = new FrequencySimilarity().scorer(1.5f, STATS, term(5));
    assertEquals(3f, scorer.score(2f, 7), 0f);
    assertEquals(0f, scorer.score(0f, 7), 0f);
  }
}
