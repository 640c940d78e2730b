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

/**
 * BM25 Similarity. Introduced in Stephen E. Robertson, Steve Walker,
 * Susan Jones, Micheline Hancock-Beaulieu, and Mike Gatford. Okapi at TREC-3.
 * In Proceedings of the Third <b>T</b>ext <b>RE</b>trieval <b>C</b>onference (TREC 1994).
 * Gaithersburg, USA, November 1994.
 */
public class BM25Similarity extends Similarity {
  private final float k1;
  private final float b;

  /**
   * BM25 with the supplied parameter values.
   * @param k1 Controls non-linear term frequency normalization (saturation).
   * @param b Controls to what degree document length normalizes tf values.
   * @throws IllegalArgumentException if {@code k1} is infinite or negative, or if {@code b} is
   *         not within the range {@code [0..1]}
   */
  public BM25Similarity(float k1, float b) {
    if (Float.isFinite(k1) == false || k1 < 0) {
      throw new IllegalArgumentException("illegal k1 value: " + k1 + ", must be a non-negative finite value");
    }
    if (Float.isNaN(b) || b < 0 || b > 1) {
      throw new IllegalArgumentException("illegal b value: " + b + ", must be between 0 and 1");
    }
    this.k1 = k1;
    this.b  = b;
  }

  /** BM25 with these default values:
   * <ul>
   *   <li>{@code k1 = 1.2}</li>
   *   <li>{@code b = 0.75}</li>
   * </ul>
   */
  public BM25Similarity() {
    this(1.2f, 0.75f);
  }

  /** Implemented as <code>log(maxDoc/(docFreq+1)) + 1</code>. */
  protected float idf(long docFreq, long maxDoc) {
    return (float) (Math.log(maxDoc / (double) (docFreq + 1)) + 1.0);
  }

  /** The default implementation computes the average as <code>sumFieldLength / maxDoc</code>,
   * or returns <code>1</code> if the field has no length. */
  protected float avgFieldLength(CollectionStatistics collectionStats) {
    if (collectionStats.maxDoc() == 0 || collectionStats.sumFieldLength() == 0) {
      return 1f;
    }
    return (float) (collectionStats.sumFieldLength() / (double) collectionStats.maxDoc());
  }

  @Override
  public final SimScorer scorer(float boost, CollectionStatistics collectionStats, TermStatistics... termStats) {
    float idf = 0;
    for (TermStatistics stat : termStats) {
      idf += idf(stat.docFreq(), collectionStats.maxDoc());
    }
    return new BM25Scorer(boost, k1, b, idf, avgFieldLength(collectionStats));
  }

  private static class BM25Scorer extends SimScorer {
    private final float boost;
    private final float k1;
    private final float b;
    private final float idf;
    private final float avgFieldLength;

    BM25Scorer(float boost, float k1, float b, float idf, float avgFieldLength) {
      this.boost = boost;
      this.k1 = k1;
      this.b = b;
      this.idf = idf;
      this.avgFieldLength = avgFieldLength;
    }

    @Override
    public float score(float weight, long fieldLength) {
      final float norm = k1 * ((1 - b) + b * fieldLength / avgFieldLength);
      return boost * idf * (weight * (k1 + 1)) / (weight + norm);
    }
  }

  /**
   * Returns the <code>k1</code> parameter
   * @see #BM25Similarity(float, float)
   */
  public final float getK1() {
    return k1;
  }

  /**
   * Returns the <code>b</code> parameter
   * @see #BM25Similarity(float, float)
   */
  public final float getB() {
    return b;
  }

  @Override
  public String toString() {
    return "BM25(k1=" + k1 + ",b=" + b + ")";
  }
}
