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
import org.fathom.search.IndexSearcher;
import org.fathom.search.TermStatistics;

/**
 * Similarity defines the components of Fathom scoring.
 * <p>
 * At search time, a query asks the similarity for a {@link SimScorer}
 * built from the statistics of the collection and of its terms. The
 * matchers then call {@link SimScorer#score(float, long)} for each
 * matching document with the weight of the term in the document and the
 * length of the field in the document.
 * <p>
 * The similarity is set on the {@link IndexSearcher}; the default is
 * {@link BM25Similarity}.
 *
 * @see IndexSearcher#setSimilarity(Similarity)
 * @fathom.experimental
 */
public abstract class Similarity {

  /**
   * Sole constructor. (For invocation by subclass
   * constructors, typically implicit.)
   */
  protected Similarity() {}

  /**
   * Compute any collection-level weight (e.g. IDF, average document length, etc) needed for scoring a query.
   *
   * @param boost a multiplicative factor to apply to the produced scores
   * @param collectionStats collection-level statistics, such as the number of tokens in the collection.
   * @param termStats term-level statistics, such as the document frequency of a term across the collection.
   * @return SimScorer object with the information this Similarity needs to score a query.
   */
  public abstract SimScorer scorer(float boost, CollectionStatistics collectionStats, TermStatistics... termStats);

  /** Stores the weight for a query across the indexed collection. */
  public static abstract class SimScorer {

    /**
     * Sole constructor. (For invocation by subclass
     * constructors.)
     */
    protected SimScorer() {}

    /**
     * Score a single document.
     * @param weight the weight of the term (or phrase) in the document
     * @param fieldLength the length of the field in the document, 0 if unknown
     * @return document's score
     */
    public abstract float score(float weight, long fieldLength);
  }
}
